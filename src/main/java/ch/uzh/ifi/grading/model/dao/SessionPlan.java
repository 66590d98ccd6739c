package ch.uzh.ifi.grading.model.dao;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Fully resolved commands of one grading session: ports are already allocated and substituted.
 */
@Value
@Builder
public class SessionPlan {
    Path submissionDir;
    Path harnessDir;
    @Builder.Default
    List<List<String>> harnessInstallCommands = List.of();
    int harnessInstallTimeout;
    @Builder.Default
    List<String> installCommand = List.of();
    int installTimeout;
    List<String> auxCommand;
    List<String> appCommand;
    List<String> testCommand;
    @Builder.Default
    int testTimeout = 180;
    String readinessUrl;
    @Builder.Default
    int readinessTimeout = 60;
    @Builder.Default
    Duration pollInterval = Duration.ofSeconds(1);
    @Builder.Default
    int diagnosticLimit = 500;
    @Builder.Default
    Map<String, String> environment = Map.of();
    Long processLimit;
}
