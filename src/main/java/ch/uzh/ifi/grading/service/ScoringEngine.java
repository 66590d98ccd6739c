package ch.uzh.ifi.grading.service;

import ch.uzh.ifi.grading.config.GraderProperties;
import ch.uzh.ifi.grading.model.constants.ChallengeType;
import ch.uzh.ifi.grading.model.constants.DatasetCategory;
import ch.uzh.ifi.grading.model.constants.FailureKind;
import ch.uzh.ifi.grading.model.dao.DatasetResult;
import ch.uzh.ifi.grading.model.dao.GradeReport;
import ch.uzh.ifi.grading.model.dao.GradingFailure;
import ch.uzh.ifi.grading.service.scoring.ScoringStrategy;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.util.Precision;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class ScoringEngine {

    private final Map<DatasetCategory, ScoringStrategy> strategies = new EnumMap<>(DatasetCategory.class);

    public ScoringEngine(List<ScoringStrategy> strategies) {
        strategies.forEach(strategy -> this.strategies.put(strategy.getCategory(), strategy));
    }

    public DatasetResult scoreDataset(GraderProperties.Dataset dataset, JsonNode actual, JsonNode expected) {
        ScoringStrategy strategy = strategies.get(dataset.getCategory());
        if (strategy == null)
            throw new IllegalStateException("No scoring strategy for " + dataset.getCategory());
        return strategy.score(dataset, actual, expected);
    }

    public static String calculateGrade(double percentage) {
        if (percentage >= 90) return "A";
        if (percentage >= 80) return "B";
        if (percentage >= 70) return "C";
        if (percentage >= 60) return "D";
        return "F";
    }

    /**
     * Sums the dataset scores into a report. The total is clamped to the challenge's maximum, so misconfigured
     * dataset weights can never produce a score above it.
     */
    public GradeReport buildReport(String studentId, ChallengeType challenge, GraderProperties.Challenge config,
                                   List<DatasetResult> datasets, LocalDateTime timestamp) {
        double maxScore = config.getMaxScore();
        double earned = datasets.stream().mapToDouble(DatasetResult::getPointsEarned).sum();
        double totalScore = Precision.round(Math.min(maxScore, Math.max(0.0, earned)), 2);
        double percentage = maxScore > 0 ? Precision.round(totalScore / maxScore * 100, 2) : 0.0;
        String grade = calculateGrade(percentage);
        return GradeReport.builder().studentId(studentId).challenge(challenge).timestamp(timestamp)
                .datasets(datasets).totalScore(totalScore).maxScore(maxScore).percentage(percentage).grade(grade)
                .passed(totalScore >= config.getPassThreshold())
                .summary("Score: %s/%s, Grade: %s".formatted(format(totalScore), format(maxScore), grade))
                .build();
    }

    /**
     * Report for an attempt that could not be graded at all. Every configured dataset is listed with zero points.
     */
    public GradeReport buildFailureReport(String studentId, ChallengeType challenge, GraderProperties.Challenge config,
                                          FailureKind kind, String message, List<String> securityWarnings,
                                          LocalDateTime timestamp) {
        List<DatasetResult> datasets = config.getDatasets().stream().map(dataset -> DatasetResult.failed(
                dataset.getName(), dataset.getCategory(), dataset.getPoints(), kind, "Not graded")).toList();
        return GradeReport.builder().studentId(studentId).challenge(challenge).timestamp(timestamp)
                .datasets(datasets).totalScore(0.0).maxScore(config.getMaxScore()).percentage(0.0)
                .grade(calculateGrade(0.0)).passed(false).summary("ERROR: " + message)
                .error(new GradingFailure(kind, message)).securityWarnings(securityWarnings).build();
    }

    private String format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
