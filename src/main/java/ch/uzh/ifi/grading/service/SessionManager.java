package ch.uzh.ifi.grading.service;

import ch.uzh.ifi.grading.config.GraderProperties;
import ch.uzh.ifi.grading.exception.ConfigurationException;
import ch.uzh.ifi.grading.model.Submission;
import ch.uzh.ifi.grading.model.constants.ExecutionOutcome;
import ch.uzh.ifi.grading.model.constants.FailureKind;
import ch.uzh.ifi.grading.model.dao.ExecutionRequest;
import ch.uzh.ifi.grading.model.dao.ExecutionResult;
import ch.uzh.ifi.grading.model.dao.SessionPlan;
import ch.uzh.ifi.grading.model.dao.SessionResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Grades projects that have to be served: installs dependencies, starts the auxiliary API and the candidate's
 * application, waits until the application answers and then runs the browser test suite against it.
 */
@Slf4j
@Service
public class SessionManager {

    private static final int PROBE_TIMEOUT_MILLIS = 2000;

    private static final Pattern AUX_PORT = Pattern.compile("^--port=(\\d+)$");

    private final SandboxExecutor sandboxExecutor;

    private final JsonMapper jsonMapper;

    private final RestTemplate readinessClient;

    public SessionManager(SandboxExecutor sandboxExecutor, JsonMapper jsonMapper) {
        this.sandboxExecutor = sandboxExecutor;
        this.jsonMapper = jsonMapper;
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(PROBE_TIMEOUT_MILLIS);
        requestFactory.setReadTimeout(PROBE_TIMEOUT_MILLIS);
        this.readinessClient = new RestTemplate(requestFactory);
    }

    /**
     * Copies the grading harness into the submission's scratch space, allocates free ports and substitutes them
     * into every configured command.
     */
    public SessionPlan plan(Submission submission, GraderProperties.Session config, Path challengeFixtures) throws IOException {
        Path harnessSource = challengeFixtures.resolve(config.getHarnessDir());
        if (!Files.isDirectory(harnessSource))
            throw new ConfigurationException("Grading harness %s not found".formatted(harnessSource));
        Path harnessDir = Files.createDirectories(submission.resolveScratch("harness"));
        if (config.getHarnessFiles().isEmpty())
            FileUtils.copyDirectory(harnessSource.toFile(), harnessDir.toFile());
        for (String name : config.getHarnessFiles()) {
            Path file = harnessSource.resolve(name);
            if (!Files.isRegularFile(file))
                throw new ConfigurationException("Grading harness file %s not found".formatted(file));
            FileUtils.copyFileToDirectory(file.toFile(), harnessDir.toFile());
        }
        List<Integer> ports = allocatePorts(2);
        Map<String, String> placeholders = new LinkedHashMap<>();
        placeholders.put("{app_port}", ports.get(0).toString());
        placeholders.put("{api_port}", ports.get(1).toString());
        placeholders.put("{harness}", harnessDir.toString());
        placeholders.put("{submission}", submission.getEntryPoint().getRoot().toString());
        Map<String, String> environment = new LinkedHashMap<>();
        config.getEnvironment().forEach((name, value) -> environment.put(name, substitute(value, placeholders)));
        environment.put("PORT", ports.get(0).toString());
        environment.put("APP_URL", "http://localhost:" + ports.get(0));
        environment.put("API_URL", "http://localhost:" + ports.get(1));
        return SessionPlan.builder()
                .submissionDir(submission.getEntryPoint().getRoot())
                .harnessDir(harnessDir)
                .harnessInstallCommands(config.getHarnessInstallCommands().stream()
                        .map(command -> substitute(command, placeholders)).toList())
                .harnessInstallTimeout(config.getHarnessInstallTimeout())
                .installCommand(substitute(config.getInstallCommand(), placeholders))
                .installTimeout(config.getInstallTimeout())
                .auxCommand(substitute(config.getAuxCommand(), placeholders))
                .appCommand(substitute(config.getAppCommand(), placeholders))
                .testCommand(substitute(config.getTestCommand(), placeholders))
                .testTimeout(config.getTestTimeout())
                .readinessUrl("http://localhost:%d%s".formatted(ports.get(0), config.getReadinessPath()))
                .readinessTimeout(config.getReadinessTimeout())
                .pollInterval(config.getPollInterval())
                .diagnosticLimit(config.getDiagnosticLimit())
                .environment(environment)
                .processLimit(config.getProcessLimit())
                .build();
    }

    private List<String> substitute(List<String> command, Map<String, String> placeholders) {
        return command.stream().map(argument -> substitute(argument, placeholders)).toList();
    }

    private String substitute(String value, Map<String, String> placeholders) {
        String result = value;
        for (Map.Entry<String, String> placeholder : placeholders.entrySet())
            result = result.replace(placeholder.getKey(), placeholder.getValue());
        return result;
    }

    List<Integer> allocatePorts(int count) throws IOException {
        List<ServerSocket> sockets = new ArrayList<>();
        try {
            for (int i = 0; i < count; i++)
                sockets.add(new ServerSocket(0));
            return sockets.stream().map(ServerSocket::getLocalPort).toList();
        } finally {
            for (ServerSocket socket : sockets)
                socket.close();
        }
    }

    /**
     * Runs a session without a configured plan. {@code APP_URL} and {@code PORT} are taken from the readiness URL
     * and {@code API_URL} from a {@code --port=N} argument of the auxiliary command, on the same host.
     */
    public SessionResult runSession(Path root, List<String> auxCommand, List<String> appCommand, List<String> testCommand,
                                    String readinessUrl, int readinessTimeout) {
        return runSession(SessionPlan.builder().submissionDir(root).harnessDir(root)
                .auxCommand(auxCommand).appCommand(appCommand).testCommand(testCommand)
                .readinessUrl(readinessUrl).readinessTimeout(readinessTimeout)
                .environment(deriveEnvironment(auxCommand, readinessUrl)).build());
    }

    Map<String, String> deriveEnvironment(List<String> auxCommand, String readinessUrl) {
        Map<String, String> environment = new LinkedHashMap<>();
        UriComponents readiness;
        try {
            readiness = UriComponentsBuilder.fromHttpUrl(readinessUrl).build();
        } catch (IllegalArgumentException e) {
            log.warn("Cannot derive session addresses from {}: {}", readinessUrl, e.getMessage());
            return environment;
        }
        if (readiness.getPort() != -1)
            environment.put("PORT", String.valueOf(readiness.getPort()));
        environment.put("APP_URL", origin(readiness.getScheme(), readiness.getHost(), readiness.getPort()));
        auxCommand.stream().map(AUX_PORT::matcher).filter(Matcher::matches).reduce((first, last) -> last)
                .ifPresent(port -> environment.put("API_URL",
                        origin(readiness.getScheme(), readiness.getHost(), Integer.parseInt(port.group(1)))));
        return environment;
    }

    private String origin(String scheme, String host, int port) {
        return UriComponentsBuilder.newInstance().scheme(scheme).host(host).port(port).toUriString();
    }

    public SessionResult runSession(SessionPlan plan) {
        int diagnosticLimit = plan.getDiagnosticLimit();
        for (List<String> command : plan.getHarnessInstallCommands()) {
            ExecutionResult install = execute(command, plan.getHarnessDir(), plan.getHarnessInstallTimeout(), plan, "harness install");
            if (!install.isSuccess())
                return SessionResult.failed(FailureKind.DEPENDENCY_INSTALL_FAILED,
                        "Failed to install grading dependencies: " + install.describe(diagnosticLimit));
        }
        if (!plan.getInstallCommand().isEmpty()) {
            ExecutionResult install = execute(plan.getInstallCommand(), plan.getSubmissionDir(), plan.getInstallTimeout(), plan, "install");
            if (!install.isSuccess())
                return SessionResult.failed(FailureKind.DEPENDENCY_INSTALL_FAILED,
                        "Failed to install submission dependencies: " + install.describe(diagnosticLimit));
        }
        List<SandboxedProcess> services = new ArrayList<>();
        try {
            if (!plan.getAuxCommand().isEmpty())
                services.add(sandboxExecutor.start(formRequest(plan.getAuxCommand(), plan.getHarnessDir(), 0, plan, "auxiliary service")));
            SandboxedProcess app = sandboxExecutor.start(formRequest(plan.getAppCommand(), plan.getSubmissionDir(), 0, plan, "application"));
            services.add(app);
            if (!awaitReady(plan.getReadinessUrl(), Duration.ofSeconds(plan.getReadinessTimeout()), plan.getPollInterval(), app))
                return SessionResult.failed(FailureKind.SERVICE_NOT_READY,
                        "Application failed to start: " + StringUtils.left(app.readStderr(diagnosticLimit).strip(), diagnosticLimit));
            ExecutionResult tests = execute(plan.getTestCommand(), plan.getHarnessDir(), plan.getTestTimeout(), plan, "test run");
            return evaluateTestRun(tests, diagnosticLimit);
        } catch (IOException e) {
            log.error("Failed to start session service: {}", e.getMessage());
            return SessionResult.failed(FailureKind.SPAWN_ERROR, "Could not start service: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SessionResult.failed(FailureKind.TIMEOUT, "Interrupted while waiting for the application");
        } finally {
            Collections.reverse(services);
            services.forEach(SandboxedProcess::close);
        }
    }

    private ExecutionResult execute(List<String> command, Path workingDir, int timeoutSeconds, SessionPlan plan, String label) {
        return sandboxExecutor.run(formRequest(command, workingDir, timeoutSeconds, plan, label));
    }

    private ExecutionRequest formRequest(List<String> command, Path workingDir, int timeoutSeconds, SessionPlan plan, String label) {
        return ExecutionRequest.builder().command(command).workingDir(workingDir).timeoutSeconds(timeoutSeconds)
                .allowNetwork(true).environment(plan.getEnvironment()).processLimit(plan.getProcessLimit())
                .label(label).build();
    }

    /**
     * Polls until the URL answers with a successful status. Gives up early when the application exits.
     */
    boolean awaitReady(String url, Duration timeout, Duration pollInterval, SandboxedProcess app) throws InterruptedException {
        Instant deadline = Instant.now().plus(timeout);
        while (Instant.now().isBefore(deadline)) {
            try {
                readinessClient.getForEntity(url, String.class);
                log.info("Application answered on {} after {} ms", url, app.elapsed().toMillis());
                return true;
            } catch (RestClientException e) {
                log.debug("Application not ready on {}: {}", url, e.getMessage());
            }
            if (!app.isAlive()) {
                log.warn("Application exited before answering on {}", url);
                return false;
            }
            Thread.sleep(pollInterval.toMillis());
        }
        return false;
    }

    private SessionResult evaluateTestRun(ExecutionResult tests, int diagnosticLimit) {
        if (tests.getOutcome().equals(ExecutionOutcome.TIMEOUT) || tests.getOutcome().equals(ExecutionOutcome.SPAWN_ERROR)
                || tests.getOutcome().equals(ExecutionOutcome.RESOURCE_LIMIT_KILLED))
            return SessionResult.failed(tests.getOutcome().getFailureKind(), tests.describe(diagnosticLimit));
        try {
            return SessionResult.completed(parseTestReport(tests.getStdout()));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Unreadable test report: {}", e.getMessage());
            return SessionResult.failed(FailureKind.INVALID_OUTPUT,
                    "Tests completed but the report could not be parsed: " + tests.describe(diagnosticLimit));
        }
    }

    /**
     * Reads a JSON test report of nested suites, each holding specs with a title and an ok flag.
     */
    public Map<String, Boolean> parseTestReport(String report) throws JsonProcessingException {
        JsonNode root = jsonMapper.readTree(report);
        if (root == null || !root.isObject() || !root.has("suites"))
            throw new IllegalArgumentException("Report has no suites");
        Map<String, Boolean> outcomes = new LinkedHashMap<>();
        collectSpecs(root.get("suites"), outcomes);
        return outcomes;
    }

    private void collectSpecs(JsonNode suites, Map<String, Boolean> outcomes) {
        for (JsonNode suite : suites) {
            for (JsonNode spec : suite.path("specs"))
                outcomes.merge(spec.path("title").asText(), spec.path("ok").asBoolean(false), Boolean::logicalAnd);
            collectSpecs(suite.path("suites"), outcomes);
        }
    }
}
