package ch.uzh.ifi.grading.model.dao;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

@Value
public class FieldOutcome {
    String field;
    JsonNode expected;
    JsonNode actual;
    boolean correct;
    Double points;
}
