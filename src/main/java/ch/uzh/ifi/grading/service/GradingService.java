package ch.uzh.ifi.grading.service;

import ch.uzh.ifi.grading.config.GraderProperties;
import ch.uzh.ifi.grading.exception.ConfigurationException;
import ch.uzh.ifi.grading.exception.SubmissionRejectedException;
import ch.uzh.ifi.grading.model.EntryPoint;
import ch.uzh.ifi.grading.model.Submission;
import ch.uzh.ifi.grading.model.constants.ChallengeType;
import ch.uzh.ifi.grading.model.constants.FailureKind;
import ch.uzh.ifi.grading.model.dao.DatasetResult;
import ch.uzh.ifi.grading.model.dao.ExecutionRequest;
import ch.uzh.ifi.grading.model.dao.ExecutionResult;
import ch.uzh.ifi.grading.model.dao.GradeReport;
import ch.uzh.ifi.grading.model.dao.ScanResult;
import ch.uzh.ifi.grading.model.dao.SessionResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.ListUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.util.StopWatch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs one attempt through the whole pipeline: intake, screening, execution, scoring and persistence. Whatever
 * happens, the caller receives a complete report and the attempt's temporary directory is gone afterwards.
 */
@Slf4j
@Service
@AllArgsConstructor
public class GradingService {

    private static final int DIAGNOSTIC_LIMIT = 500;

    private GraderProperties properties;

    private IntakeService intakeService;

    private SecurityScanner securityScanner;

    private SandboxExecutor sandboxExecutor;

    private SessionManager sessionManager;

    private ScoringEngine scoringEngine;

    private ResultStore resultStore;

    private JsonMapper jsonMapper;

    public GradeReport gradeAndRecord(byte[] archive, String studentId, ChallengeType challenge, String ipAddress) {
        GradeReport report = grade(archive, studentId, challenge);
        resultStore.record(report, ipAddress);
        return report;
    }

    public GradeReport grade(byte[] archive, String studentId, ChallengeType challenge) {
        StopWatch stopWatch = new StopWatch(studentId);
        stopWatch.start(challenge.getSlug());
        GraderProperties.Challenge config = properties.getChallenge(challenge).orElseGet(GraderProperties.Challenge::new);
        GradeReport report;
        try {
            report = gradeChallenge(archive, studentId, challenge, config);
        } catch (SubmissionRejectedException e) {
            log.warn("Rejected submission of {}: {}", studentId, e.getMessage());
            report = scoringEngine.buildFailureReport(studentId, challenge, config, e.getKind(), e.getMessage(),
                    List.of(), LocalDateTime.now());
        } catch (ConfigurationException e) {
            log.error("Cannot grade {}: {}", challenge.getSlug(), e.getMessage());
            report = scoringEngine.buildFailureReport(studentId, challenge, config, FailureKind.CONFIGURATION_ERROR,
                    "Server config error: " + e.getMessage(), List.of(), LocalDateTime.now());
        } catch (IOException | RuntimeException e) {
            log.error("Failed to grade submission of {}", studentId, e);
            report = scoringEngine.buildFailureReport(studentId, challenge, config, FailureKind.INTERNAL_ERROR,
                    "Internal error while grading", List.of(), LocalDateTime.now());
        }
        stopWatch.stop();
        log.info("Graded {} submission of {} in {} ms: {}", challenge.getSlug(), studentId,
                stopWatch.getTotalTimeMillis(), report.getSummary());
        return report;
    }

    private GradeReport gradeChallenge(byte[] archive, String studentId, ChallengeType challenge,
                                       GraderProperties.Challenge config) throws IOException {
        if (properties.getChallenge(challenge).isEmpty())
            throw new ConfigurationException("Challenge %s is not configured".formatted(challenge.getSlug()));
        Path fixtures = Paths.get(properties.getFixturesDir(), challenge.getSlug());
        JsonNode expectedResults = challenge.isSession() ? null : loadExpectedResults(fixtures, config);
        try (Submission submission = intakeService.accept(archive, studentId, challenge)) {
            ScanResult scan = securityScanner.scan(submission.getExtractedRoot());
            if (!scan.isSafe())
                return scoringEngine.buildFailureReport(studentId, challenge, config, FailureKind.SECURITY_VIOLATION,
                        "SECURITY: Dangerous code detected - submission rejected",
                        scan.getWarnings(securityScanner.getMaxWarnings()), LocalDateTime.now());
            List<DatasetResult> datasets = challenge.isSession()
                    ? gradeSession(submission, config, fixtures)
                    : gradeDatasets(submission, config, fixtures.resolve(config.getHiddenData()), expectedResults);
            return scoringEngine.buildReport(studentId, challenge, config, datasets, LocalDateTime.now());
        }
    }

    private JsonNode loadExpectedResults(Path fixtures, GraderProperties.Challenge config) {
        Path expectedFile = fixtures.resolve(config.getExpectedResults());
        if (!Files.isDirectory(fixtures.resolve(config.getHiddenData())))
            throw new ConfigurationException("Hidden data not found");
        if (!Files.isRegularFile(expectedFile))
            throw new ConfigurationException("Expected results not found");
        try {
            JsonNode expected = jsonMapper.readTree(expectedFile.toFile());
            if (!expected.isObject())
                throw new ConfigurationException("Expected results must be a JSON object");
            return expected;
        } catch (IOException e) {
            throw new ConfigurationException("Expected results are not valid JSON: " + e.getMessage());
        }
    }

    private List<DatasetResult> gradeDatasets(Submission submission, GraderProperties.Challenge config,
                                              Path hiddenData, JsonNode expectedResults) {
        List<DatasetResult> results = new ArrayList<>();
        for (GraderProperties.Dataset dataset : config.getDatasets()) {
            try {
                results.add(gradeDataset(submission, config, dataset, hiddenData, expectedResults));
            } catch (IOException e) {
                log.error("Failed to prepare dataset {} for {}", dataset.getName(), submission.getStudentId(), e);
                results.add(DatasetResult.failed(dataset.getName(), dataset.getCategory(), dataset.getPoints(),
                        FailureKind.INTERNAL_ERROR, "Could not prepare dataset"));
            } catch (RuntimeException e) {
                log.error("Failed to grade dataset {} for {}", dataset.getName(), submission.getStudentId(), e);
                results.add(DatasetResult.failed(dataset.getName(), dataset.getCategory(), dataset.getPoints(),
                        FailureKind.INTERNAL_ERROR, "Internal error while grading dataset"));
            }
        }
        return results;
    }

    private DatasetResult gradeDataset(Submission submission, GraderProperties.Challenge config,
                                       GraderProperties.Dataset dataset, Path hiddenData, JsonNode expectedResults)
            throws IOException {
        Path inputFile = hiddenData.resolve(dataset.getName());
        JsonNode expected = expectedResults.get(dataset.getName());
        if (!Files.isRegularFile(inputFile))
            return DatasetResult.failed(dataset.getName(), dataset.getCategory(), dataset.getPoints(),
                    FailureKind.FIXTURE_MISSING, "Test file not found: " + dataset.getName());
        if (Objects.isNull(expected) || !expected.isObject())
            return DatasetResult.failed(dataset.getName(), dataset.getCategory(), dataset.getPoints(),
                    FailureKind.FIXTURE_MISSING, "Expected results not found: " + dataset.getName());
        EntryPoint entryPoint = submission.getEntryPoint();
        Path stagedInput = stageInput(entryPoint.getWorkingDir(), inputFile);
        List<String> command = ListUtils.union(entryPoint.formRunCommand(config.getInterpreter()),
                List.of(stagedInput.toString()));
        ExecutionResult execution = sandboxExecutor.run(ExecutionRequest.builder().command(command)
                .workingDir(entryPoint.getWorkingDir()).timeoutSeconds(config.getTimeLimit()).allowNetwork(false)
                .label("%s on %s".formatted(submission.getStudentId(), dataset.getName())).build());
        if (!execution.isSuccess())
            return DatasetResult.failed(dataset.getName(), dataset.getCategory(), dataset.getPoints(),
                    execution.getOutcome().getFailureKind(), execution.describe(DIAGNOSTIC_LIMIT));
        JsonNode actual;
        try {
            actual = parseOutput(execution.getStdout());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return DatasetResult.failed(dataset.getName(), dataset.getCategory(), dataset.getPoints(),
                    FailureKind.INVALID_OUTPUT, "Invalid JSON output: " + StringUtils.left(e.getMessage(), DIAGNOSTIC_LIMIT));
        }
        return scoringEngine.scoreDataset(dataset, actual, expected);
    }

    /**
     * The input is copied next to the program, the only location an isolated child is guaranteed to see.
     */
    private Path stageInput(Path workingDir, Path inputFile) throws IOException {
        Path stagingDir = Files.createDirectories(workingDir.resolve(".datasets"));
        return Files.copy(inputFile, stagingDir.resolve(inputFile.getFileName()), StandardCopyOption.REPLACE_EXISTING);
    }

    /**
     * Standard output has to hold exactly one JSON object and nothing else.
     */
    JsonNode parseOutput(String stdout) throws JsonProcessingException {
        if (StringUtils.isBlank(stdout))
            throw new IllegalArgumentException("Program produced no output");
        JsonNode output = jsonMapper.readerFor(JsonNode.class)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS).readValue(stdout.strip());
        if (!output.isObject())
            throw new IllegalArgumentException("Output is not a JSON object");
        return output;
    }

    private List<DatasetResult> gradeSession(Submission submission, GraderProperties.Challenge config, Path fixtures)
            throws IOException {
        if (Objects.isNull(config.getSession()))
            throw new ConfigurationException("Challenge %s has no session configuration".formatted(submission.getChallenge().getSlug()));
        SessionResult session = sessionManager.runSession(sessionManager.plan(submission, config.getSession(), fixtures));
        if (!session.isCompleted())
            log.warn("Session of {} failed with {}: {}", submission.getStudentId(), session.getFailure(), session.getDiagnostic());
        JsonNode outcomes = jsonMapper.valueToTree(session.getTestOutcomes());
        return config.getDatasets().stream().map(dataset -> session.isCompleted()
                ? scoringEngine.scoreDataset(dataset, outcomes, null)
                : DatasetResult.failed(dataset.getName(), dataset.getCategory(), dataset.getPoints(),
                session.getFailure(), session.getDiagnostic())).toList();
    }
}
