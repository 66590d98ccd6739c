package ch.uzh.ifi.grading.service;

import ch.uzh.ifi.grading.model.Attempt;
import ch.uzh.ifi.grading.model.constants.ChallengeType;
import ch.uzh.ifi.grading.model.dao.GradeReport;
import ch.uzh.ifi.grading.model.dao.GradingFailure;
import ch.uzh.ifi.grading.projections.AttemptSummary;
import ch.uzh.ifi.grading.repository.AttemptRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.util.Precision;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Append-only history of graded attempts.
 */
@Slf4j
@Service
@AllArgsConstructor
public class ResultStore {

    private AttemptRepository attemptRepository;

    private JsonMapper jsonMapper;

    @Transactional
    public Attempt record(GradeReport report, String ipAddress) {
        Attempt attempt = new Attempt();
        attempt.setStudentId(report.getStudentId());
        attempt.setChallenge(report.getChallenge());
        attempt.setCreatedAt(report.getTimestamp());
        attempt.setIpAddress(ipAddress);
        attempt.setTotalScore(report.getTotalScore());
        attempt.setMaxScore(report.getMaxScore());
        attempt.setGrade(report.getGrade());
        attempt.setPassed(report.isPassed());
        attempt.setErrorMessage(Optional.ofNullable(report.getError()).map(GradingFailure::getMessage).orElse(null));
        try {
            attempt.setReport(jsonMapper.writeValueAsString(report));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize grade report of " + report.getStudentId(), e);
        }
        Attempt saved = attemptRepository.save(attempt);
        log.info("Recorded attempt {} of {} for {}: {}/{}", saved.getId(), report.getStudentId(),
                report.getChallenge().getSlug(), report.getTotalScore(), report.getMaxScore());
        return saved;
    }

    public List<AttemptSummary> findAll(Optional<ChallengeType> challenge) {
        return challenge.map(attemptRepository::findByChallengeOrderByCreatedAtDescIdDesc)
                .orElseGet(attemptRepository::findAllByOrderByCreatedAtDescIdDesc);
    }

    public List<Attempt> findByStudent(String studentId) {
        return attemptRepository.findByStudentIdOrderByCreatedAtDescIdDesc(studentId);
    }

    public Map<String, Object> getStats() {
        Map<String, Object> byChallenge = new LinkedHashMap<>();
        for (ChallengeType challenge : ChallengeType.values()) {
            long total = attemptRepository.countByChallenge(challenge);
            long passed = attemptRepository.countByChallengeAndPassedTrue(challenge);
            Double average = attemptRepository.averageScoreByChallenge(challenge);
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("total_submissions", total);
            stats.put("passed", passed);
            stats.put("failed", total - passed);
            stats.put("unique_students", attemptRepository.countStudentsByChallenge(challenge));
            stats.put("average_score", Objects.isNull(average) ? 0.0 : Precision.round(average, 2));
            byChallenge.put(challenge.getSlug(), stats);
        }
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total_submissions", attemptRepository.count());
        stats.put("unique_students", attemptRepository.countStudents());
        stats.put("by_challenge", byChallenge);
        return stats;
    }
}
