package ch.uzh.ifi.grading.model.dao;

import ch.uzh.ifi.grading.model.constants.FailureKind;
import lombok.Value;

@Value
public class GradingFailure {
    FailureKind kind;
    String message;
}
