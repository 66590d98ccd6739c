package ch.uzh.ifi.grading.projections;

import ch.uzh.ifi.grading.model.constants.ChallengeType;

import java.time.LocalDateTime;

public interface AttemptSummary {
    Long getId();

    String getStudentId();

    ChallengeType getChallenge();

    LocalDateTime getCreatedAt();

    String getIpAddress();

    Double getTotalScore();

    Double getMaxScore();

    String getGrade();

    boolean isPassed();

    String getErrorMessage();
}
