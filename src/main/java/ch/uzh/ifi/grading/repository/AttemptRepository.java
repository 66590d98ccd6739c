package ch.uzh.ifi.grading.repository;

import ch.uzh.ifi.grading.model.Attempt;
import ch.uzh.ifi.grading.model.constants.ChallengeType;
import ch.uzh.ifi.grading.projections.AttemptSummary;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;

import java.util.List;

/**
 * Append-only access to graded attempts: rows can be inserted and read, never changed or removed.
 */
public interface AttemptRepository extends Repository<Attempt, Long> {

    Attempt save(Attempt attempt);

    List<AttemptSummary> findAllByOrderByCreatedAtDescIdDesc();

    List<AttemptSummary> findByChallengeOrderByCreatedAtDescIdDesc(ChallengeType challenge);

    List<Attempt> findByStudentIdOrderByCreatedAtDescIdDesc(String studentId);

    long count();

    long countByChallenge(ChallengeType challenge);

    long countByChallengeAndPassedTrue(ChallengeType challenge);

    @Query("SELECT COUNT(DISTINCT a.studentId) FROM Attempt a")
    long countStudents();

    @Query("SELECT COUNT(DISTINCT a.studentId) FROM Attempt a WHERE a.challenge = :challenge")
    long countStudentsByChallenge(ChallengeType challenge);

    @Query("SELECT AVG(a.totalScore) FROM Attempt a WHERE a.challenge = :challenge AND a.totalScore > 0")
    Double averageScoreByChallenge(ChallengeType challenge);
}
