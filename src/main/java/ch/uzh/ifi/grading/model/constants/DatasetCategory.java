package ch.uzh.ifi.grading.model.constants;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DatasetCategory {
    CORRECTNESS, ROBUSTNESS, FIXED_TEST_TABLE;

    @JsonValue
    public String getName() {
        return name().toLowerCase();
    }
}
