package ch.uzh.ifi.grading.model.dao;

import lombok.Value;

@Value
public class ScanFinding {
    String location;
    String rule;
    String message;

    @Override
    public String toString() {
        return "%s: %s".formatted(location, message);
    }
}
