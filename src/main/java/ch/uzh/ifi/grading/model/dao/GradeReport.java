package ch.uzh.ifi.grading.model.dao;

import ch.uzh.ifi.grading.model.constants.ChallengeType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one graded attempt. Every response of the submit endpoint carries this shape, including
 * attempts rejected before execution, in which case {@link #error} holds the reason and every dataset scores zero.
 */
@Value
@Builder
@Jacksonized
public class GradeReport {
    String studentId;
    ChallengeType challenge;
    LocalDateTime timestamp;
    @Builder.Default
    List<DatasetResult> datasets = List.of();
    Double totalScore;
    Double maxScore;
    Double percentage;
    String grade;
    boolean passed;
    String summary;
    GradingFailure error;
    @Builder.Default
    List<String> securityWarnings = List.of();

    public boolean isSuccess() {
        return Objects.isNull(error);
    }
}
