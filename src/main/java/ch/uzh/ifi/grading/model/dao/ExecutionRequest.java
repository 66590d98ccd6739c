package ch.uzh.ifi.grading.model.dao;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class ExecutionRequest {
    List<String> command;
    Path workingDir;
    @Builder.Default
    int timeoutSeconds = 30;
    boolean allowNetwork;
    @Builder.Default
    Map<String, String> environment = Map.of();
    /**
     * Overrides the configured process-count ceiling, for tools such as package managers that fork heavily.
     */
    Long processLimit;
    String label;
}
