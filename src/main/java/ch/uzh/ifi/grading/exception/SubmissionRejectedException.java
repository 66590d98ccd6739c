package ch.uzh.ifi.grading.exception;

import ch.uzh.ifi.grading.model.constants.FailureKind;
import lombok.Getter;

@Getter
public class SubmissionRejectedException extends RuntimeException {

    private final FailureKind kind;

    public SubmissionRejectedException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SubmissionRejectedException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
