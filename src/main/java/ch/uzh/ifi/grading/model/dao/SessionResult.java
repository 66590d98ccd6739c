package ch.uzh.ifi.grading.model.dao;

import ch.uzh.ifi.grading.model.constants.FailureKind;
import lombok.Value;

import java.util.Map;
import java.util.Objects;

@Value
public class SessionResult {
    FailureKind failure;
    String diagnostic;
    Map<String, Boolean> testOutcomes;

    public static SessionResult completed(Map<String, Boolean> testOutcomes) {
        return new SessionResult(null, null, Map.copyOf(testOutcomes));
    }

    public static SessionResult failed(FailureKind failure, String diagnostic) {
        return new SessionResult(failure, diagnostic, Map.of());
    }

    public boolean isCompleted() {
        return Objects.isNull(failure);
    }
}
