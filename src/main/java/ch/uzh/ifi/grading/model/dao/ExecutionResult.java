package ch.uzh.ifi.grading.model.dao;

import ch.uzh.ifi.grading.model.constants.ExecutionOutcome;
import lombok.Builder;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

import java.time.Duration;

@Value
@Builder
public class ExecutionResult {
    ExecutionOutcome outcome;
    Integer exitCode;
    @Builder.Default
    String stdout = "";
    @Builder.Default
    String stderr = "";
    Duration duration;

    public static ExecutionResult spawnError(String message, Duration duration) {
        return ExecutionResult.builder().outcome(ExecutionOutcome.SPAWN_ERROR).stderr(message).duration(duration).build();
    }

    public boolean isSuccess() {
        return outcome.isSuccess();
    }

    public String describe(int limit) {
        String detail = switch (outcome) {
            case SUCCESS -> "Exited normally";
            case NONZERO_EXIT -> "Exited with status " + exitCode;
            case RESOURCE_LIMIT_KILLED -> "Killed after exceeding a resource limit (status %d)".formatted(exitCode);
            case TIMEOUT -> "Timed out after %ds".formatted(duration.toSeconds());
            case SPAWN_ERROR -> "Could not start program";
        };
        return StringUtils.isBlank(stderr) ? detail : detail + ": " + StringUtils.left(stderr.strip(), limit);
    }
}
