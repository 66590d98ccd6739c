package ch.uzh.ifi.grading.service;

import ch.uzh.ifi.grading.TestingUtils;
import ch.uzh.ifi.grading.config.GraderProperties;
import ch.uzh.ifi.grading.model.constants.ChallengeType;
import ch.uzh.ifi.grading.model.constants.DatasetCategory;
import ch.uzh.ifi.grading.model.constants.FailureKind;
import ch.uzh.ifi.grading.model.dao.DatasetResult;
import ch.uzh.ifi.grading.model.dao.GradeReport;
import ch.uzh.ifi.grading.service.scoring.FieldToleranceStrategy;
import ch.uzh.ifi.grading.service.scoring.RejectionRateStrategy;
import ch.uzh.ifi.grading.service.scoring.TestTableStrategy;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScoringEngineTests {

    private final ScoringEngine scoringEngine = new ScoringEngine(
            List.of(new FieldToleranceStrategy(), new RejectionRateStrategy(), new TestTableStrategy()));

    private final LocalDateTime timestamp = LocalDateTime.of(2024, 5, 1, 12, 0);

    private GraderProperties.Challenge createChallenge() {
        GraderProperties.Challenge challenge = new GraderProperties.Challenge();
        challenge.setDatasets(List.of(TestingUtils.createCorrectnessDataset("edge_proto_v1_A.log", 50.0),
                TestingUtils.createRobustnessDataset("edge_proto_v1_1_D.log", 50.0)));
        return challenge;
    }

    private DatasetResult scored(String name, double earned, double possible) {
        return DatasetResult.builder().name(name).category(DatasetCategory.CORRECTNESS)
                .pointsEarned(earned).pointsPossible(possible).percentage(earned / possible * 100).build();
    }

    @ParameterizedTest
    @CsvSource({"100, A", "90, A", "89.99, B", "80, B", "79.5, C", "70, C", "60, D", "59.99, F", "0, F"})
    void gradeLadderTest(double percentage, String grade) {
        assertEquals(grade, ScoringEngine.calculateGrade(percentage));
    }

    @Test
    void scoreDatasetDispatchesByCategoryTest() throws Exception {
        JsonMapper jsonMapper = new JsonMapper();
        DatasetResult result = scoringEngine.scoreDataset(
                TestingUtils.createRobustnessDataset("edge_proto_v1_1_D.log", 14.0),
                jsonMapper.readTree("{\"total_requests\": 5}"), jsonMapper.readTree("{}"));
        assertEquals(DatasetCategory.ROBUSTNESS, result.getCategory());
        assertEquals(9.0, result.getPointsEarned());
    }

    @Test
    void buildReportTest() {
        GradeReport report = scoringEngine.buildReport("student_1", ChallengeType.EDGE_PROTO, createChallenge(),
                List.of(scored("edge_proto_v1_A.log", 37.5, 50.0), scored("edge_proto_v1_1_D.log", 45.0, 50.0)),
                timestamp);
        assertEquals(82.5, report.getTotalScore());
        assertEquals(100.0, report.getMaxScore());
        assertEquals(82.5, report.getPercentage());
        assertEquals("B", report.getGrade());
        assertTrue(report.isPassed());
        assertTrue(report.isSuccess());
        assertEquals("Score: 82.5/100, Grade: B", report.getSummary());
        assertEquals(timestamp, report.getTimestamp());
    }

    @Test
    void totalClampedToMaxScoreTest() {
        GradeReport report = scoringEngine.buildReport("student_1", ChallengeType.EDGE_PROTO, createChallenge(),
                List.of(scored("edge_proto_v1_A.log", 80.0, 80.0), scored("edge_proto_v1_1_D.log", 50.0, 50.0)),
                timestamp);
        assertEquals(100.0, report.getTotalScore());
        assertEquals("Score: 100/100, Grade: A", report.getSummary());
    }

    @Test
    void passThresholdInclusiveTest() {
        GraderProperties.Challenge challenge = createChallenge();
        GradeReport atThreshold = scoringEngine.buildReport("student_1", ChallengeType.EDGE_PROTO, challenge,
                List.of(scored("edge_proto_v1_A.log", 60.0, 100.0)), timestamp);
        GradeReport belowThreshold = scoringEngine.buildReport("student_1", ChallengeType.EDGE_PROTO, challenge,
                List.of(scored("edge_proto_v1_A.log", 59.99, 100.0)), timestamp);
        assertTrue(atThreshold.isPassed());
        assertFalse(belowThreshold.isPassed());
        assertEquals("F", belowThreshold.getGrade());
    }

    @Test
    void buildFailureReportTest() {
        GradeReport report = scoringEngine.buildFailureReport("student_1", ChallengeType.EDGE_PROTO, createChallenge(),
                FailureKind.SECURITY_VIOLATION, "SECURITY: Dangerous code detected - submission rejected",
                List.of("main.py: sudo command detected"), timestamp);
        assertEquals(0.0, report.getTotalScore());
        assertEquals(100.0, report.getMaxScore());
        assertEquals("F", report.getGrade());
        assertFalse(report.isPassed());
        assertFalse(report.isSuccess());
        assertEquals(FailureKind.SECURITY_VIOLATION, report.getError().getKind());
        assertEquals("ERROR: SECURITY: Dangerous code detected - submission rejected", report.getSummary());
        assertEquals(List.of("main.py: sudo command detected"), report.getSecurityWarnings());
        assertEquals(2, report.getDatasets().size());
        assertTrue(report.getDatasets().stream().allMatch(dataset -> dataset.getPointsEarned() == 0.0
                && dataset.getFailure().getKind() == FailureKind.SECURITY_VIOLATION));
    }
}
