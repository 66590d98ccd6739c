package ch.uzh.ifi.grading.config;

import ch.uzh.ifi.grading.exception.ConfigurationException;
import ch.uzh.ifi.grading.model.SandboxCapabilities;
import ch.uzh.ifi.grading.model.constants.IsolationTool;
import ch.uzh.ifi.grading.model.constants.ResourceLimit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
public class SandboxConfigurer {

    private static final long PROBE_TIMEOUT_SECONDS = 5;

    @Bean
    public SandboxCapabilities sandboxCapabilities(GraderProperties properties) {
        GraderProperties.Sandbox sandbox = properties.getSandbox();
        boolean processGroups = probe(List.of("setsid", "--version"));
        if (!sandbox.isEnabled()) {
            log.warn("Sandbox is disabled, submissions run without resource limits or isolation");
            return new SandboxCapabilities(false, IsolationTool.NONE, Set.of(), processGroups);
        }
        IsolationTool tool = selectIsolationTool(sandbox.getIsolation());
        Set<ResourceLimit> limits = EnumSet.noneOf(ResourceLimit.class);
        if (tool.equals(IsolationTool.FIREJAIL))
            limits.addAll(EnumSet.complementOf(EnumSet.of(ResourceLimit.CORE)));
        else if (probe(List.of("prlimit", "--version")))
            limits.addAll(EnumSet.allOf(ResourceLimit.class));
        SandboxCapabilities capabilities = new SandboxCapabilities(true, tool, Collections.unmodifiableSet(limits), processGroups);
        if (capabilities.isStronglyIsolated())
            log.info("Sandbox isolation: {}", capabilities.describe());
        else
            log.warn("No isolation tool found, sandbox degrades to {}", capabilities.describe());
        if (!processGroups)
            log.warn("setsid is not available, only direct descendants of a submission can be terminated");
        return capabilities;
    }

    private IsolationTool selectIsolationTool(String isolation) {
        return switch (isolation.toLowerCase()) {
            case "auto" -> probeIsolationTool(IsolationTool.FIREJAIL) ? IsolationTool.FIREJAIL
                    : probeIsolationTool(IsolationTool.BUBBLEWRAP) ? IsolationTool.BUBBLEWRAP : IsolationTool.NONE;
            case "firejail" -> requireIsolationTool(IsolationTool.FIREJAIL);
            case "bubblewrap", "bwrap" -> requireIsolationTool(IsolationTool.BUBBLEWRAP);
            case "none" -> IsolationTool.NONE;
            default -> throw new ConfigurationException("Unknown sandbox isolation " + isolation);
        };
    }

    private IsolationTool requireIsolationTool(IsolationTool tool) {
        if (!probeIsolationTool(tool))
            throw new ConfigurationException("Sandbox isolation %s was requested but is not usable".formatted(tool.getName()));
        return tool;
    }

    /**
     * Bubblewrap is installed on many hosts that forbid unprivileged user namespaces, so it has to prove that it can
     * actually start a process.
     */
    private boolean probeIsolationTool(IsolationTool tool) {
        return switch (tool) {
            case FIREJAIL -> probe(List.of(tool.getExecutable(), "--version"));
            case BUBBLEWRAP -> probe(List.of(tool.getExecutable(), "--ro-bind", "/", "/", "--dev", "/dev", "true"));
            case NONE -> false;
        };
    }

    private boolean probe(List<String> command) {
        try {
            Process process = new ProcessBuilder(command).redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD).start();
            if (!process.waitFor(PROBE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return false;
            }
            return process.exitValue() == 0;
        } catch (IOException e) {
            log.debug("{} is not available: {}", command.get(0), e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
