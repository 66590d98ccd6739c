package ch.uzh.ifi.grading.model.dao;

import lombok.Value;

@Value
public class TestOutcome {
    String test;
    boolean passed;
    Double points;
    Double maxPoints;
}
