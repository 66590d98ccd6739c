package ch.uzh.ifi.grading.service;

import ch.uzh.ifi.grading.config.GraderProperties;
import ch.uzh.ifi.grading.model.SandboxCapabilities;
import ch.uzh.ifi.grading.model.constants.ExecutionOutcome;
import ch.uzh.ifi.grading.model.constants.IsolationTool;
import ch.uzh.ifi.grading.model.constants.ResourceLimit;
import ch.uzh.ifi.grading.model.dao.ExecutionRequest;
import ch.uzh.ifi.grading.model.dao.ExecutionResult;
import com.google.common.base.Joiner;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Runs untrusted commands. Ceilings are set by a wrapper that execs the command, so they are in force before its
 * first instruction, and every child leads its own process group so that it can be torn down as a whole.
 */
@Slf4j
@Service
@AllArgsConstructor
public class SandboxExecutor {

    /**
     * Signals the kernel uses to enforce CPU and file-size ceilings, plus SIGKILL for the hard limits.
     */
    private static final Set<Integer> LIMIT_SIGNALS = Set.of(9, 24, 25);

    private GraderProperties properties;

    private SandboxCapabilities capabilities;

    public SandboxCapabilities getCapabilities() {
        return capabilities;
    }

    public ExecutionResult run(List<String> command, Path workingDir, int timeoutSeconds, boolean allowNetwork) {
        return run(ExecutionRequest.builder().command(command).workingDir(workingDir)
                .timeoutSeconds(timeoutSeconds).allowNetwork(allowNetwork).build());
    }

    public ExecutionResult run(ExecutionRequest request) {
        Instant start = Instant.now();
        SandboxedProcess process;
        try {
            process = start(request);
        } catch (IOException e) {
            log.error("Failed to start {}: {}", describe(request), e.getMessage());
            return ExecutionResult.spawnError(e.getMessage(), Duration.between(start, Instant.now()));
        }
        try (process) {
            boolean exited = process.waitFor(Duration.ofSeconds(request.getTimeoutSeconds()));
            process.terminate();
            ExecutionResult result = ExecutionResult.builder()
                    .outcome(exited ? classify(process.exitValue()) : ExecutionOutcome.TIMEOUT)
                    .exitCode(exited ? process.exitValue() : null)
                    .stdout(process.readStdout(properties.getSandbox().getStdoutLimit()))
                    .stderr(process.readStderr(properties.getSandbox().getStderrLimit()))
                    .duration(Duration.between(start, Instant.now())).build();
            log.info("{} finished with {} after {} ms", describe(request), result.getOutcome(), result.getDuration().toMillis());
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionResult.builder().outcome(ExecutionOutcome.TIMEOUT).stderr("Interrupted while waiting")
                    .duration(Duration.between(start, Instant.now())).build();
        }
    }

    ExecutionOutcome classify(int exitCode) {
        if (exitCode == 0)
            return ExecutionOutcome.SUCCESS;
        if (exitCode > 128 && LIMIT_SIGNALS.contains(exitCode - 128))
            return ExecutionOutcome.RESOURCE_LIMIT_KILLED;
        return ExecutionOutcome.NONZERO_EXIT;
    }

    /**
     * Starts a command in the background, for long-running services. The caller owns the returned handle and must
     * close it.
     */
    public SandboxedProcess start(ExecutionRequest request) throws IOException {
        Path captureDir = createCaptureDir();
        try {
            ProcessBuilder builder = new ProcessBuilder(formCommand(request))
                    .directory(request.getWorkingDir().toFile())
                    .redirectOutput(captureDir.resolve("stdout").toFile())
                    .redirectError(captureDir.resolve("stderr").toFile());
            builder.environment().clear();
            builder.environment().putAll(formEnvironment(captureDir));
            builder.environment().putAll(request.getEnvironment());
            Process process = builder.start();
            process.getOutputStream().close();
            log.debug("Started {} as pid {}", describe(request), process.pid());
            return new SandboxedProcess(process, capabilities.isProcessGroups(),
                    properties.getSandbox().getKillGracePeriod(), captureDir, describe(request));
        } catch (IOException | RuntimeException e) {
            FileUtils.deleteQuietly(captureDir.toFile());
            throw e;
        }
    }

    private Path createCaptureDir() throws IOException {
        Path sandboxDir = Paths.get(properties.getWorkingDir(), "sandbox").toAbsolutePath();
        Files.createDirectories(sandboxDir);
        return Files.createTempDirectory(sandboxDir, "run-");
    }

    List<String> formCommand(ExecutionRequest request) {
        List<String> command = new ArrayList<>();
        if (capabilities.isProcessGroups())
            command.add("setsid");
        if (capabilities.isEnabled()) {
            Map<ResourceLimit, Long> ceilings = formCeilings(request);
            IsolationTool tool = capabilities.getIsolationTool();
            if (tool.equals(IsolationTool.FIREJAIL)) {
                command.addAll(tool.formWrapper(request.getWorkingDir(), request.isAllowNetwork()));
                ceilings.forEach((limit, value) -> formFirejailLimit(limit, value).ifPresent(command::add));
            } else {
                if (capabilities.hasLimits()) {
                    command.add("prlimit");
                    ceilings.forEach((limit, value) -> command.add(limit.formOption(value)));
                    command.add("--");
                }
                command.addAll(tool.formWrapper(request.getWorkingDir(), request.isAllowNetwork()));
            }
        }
        command.addAll(request.getCommand());
        return command;
    }

    private Map<ResourceLimit, Long> formCeilings(ExecutionRequest request) {
        GraderProperties.Sandbox sandbox = properties.getSandbox();
        Map<ResourceLimit, Long> ceilings = new EnumMap<>(ResourceLimit.class);
        ceilings.put(ResourceLimit.CPU, sandbox.getCpuSeconds());
        ceilings.put(ResourceLimit.ADDRESS_SPACE, sandbox.getMemoryBytes());
        ceilings.put(ResourceLimit.FILE_SIZE, sandbox.getFileSizeBytes());
        ceilings.put(ResourceLimit.PROCESSES, Objects.requireNonNullElse(request.getProcessLimit(), sandbox.getProcesses()));
        ceilings.put(ResourceLimit.OPEN_FILES, sandbox.getOpenFiles());
        ceilings.put(ResourceLimit.CORE, 0L);
        ceilings.keySet().retainAll(capabilities.getLimits());
        return ceilings;
    }

    private Optional<String> formFirejailLimit(ResourceLimit limit, long value) {
        return switch (limit) {
            case CPU -> Optional.of("--rlimit-cpu=" + value);
            case ADDRESS_SPACE -> Optional.of("--rlimit-as=" + value);
            case FILE_SIZE -> Optional.of("--rlimit-fsize=" + value);
            case PROCESSES -> Optional.of("--rlimit-nproc=" + value);
            case OPEN_FILES -> Optional.of("--rlimit-nofile=" + value);
            case CORE -> Optional.empty();
        };
    }

    /**
     * The child never inherits the server's environment: only allow-listed variables, a throwaway home and
     * the per-call extras are passed on.
     */
    private Map<String, String> formEnvironment(Path captureDir) throws IOException {
        GraderProperties.Sandbox sandbox = properties.getSandbox();
        Map<String, String> environment = new LinkedHashMap<>(sandbox.getEnvironment());
        sandbox.getInheritedVariables().forEach(name ->
                Optional.ofNullable(System.getenv(name)).ifPresent(value -> environment.put(name, value)));
        if (capabilities.isStronglyIsolated())
            environment.put("HOME", "/tmp");
        else
            environment.put("HOME", Files.createDirectory(captureDir.resolve("home")).toString());
        return environment;
    }

    private String describe(ExecutionRequest request) {
        return Optional.ofNullable(request.getLabel()).orElseGet(() -> Joiner.on(' ').join(request.getCommand()));
    }
}
