package ch.uzh.ifi.grading.model.constants;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum ExecutionOutcome {
    SUCCESS(null),
    NONZERO_EXIT(FailureKind.NONZERO_EXIT),
    RESOURCE_LIMIT_KILLED(FailureKind.RESOURCE_LIMIT),
    TIMEOUT(FailureKind.TIMEOUT),
    SPAWN_ERROR(FailureKind.SPAWN_ERROR);

    private final FailureKind failureKind;

    public boolean isSuccess() {
        return this.equals(SUCCESS);
    }
}
