package ch.uzh.ifi.grading.model.constants;

public enum Comparison {
    EXACT, TOLERANCE
}
