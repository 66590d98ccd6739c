package ch.uzh.ifi.grading.model;

import ch.uzh.ifi.grading.model.constants.ChallengeType;
import com.fasterxml.jackson.annotation.JsonRawValue;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

@Getter
@Setter
@Entity
@Immutable
@Table(name = "attempts", indexes = {
        @Index(name = "idx_student_id", columnList = "student_id"),
        @Index(name = "idx_challenge", columnList = "challenge"),
        @Index(name = "idx_created_at", columnList = "created_at")})
public class Attempt {
    @Id
    @GeneratedValue
    public Long id;

    @Column(name = "student_id", nullable = false)
    public String studentId;

    @Column(name = "challenge", nullable = false)
    @Enumerated(EnumType.STRING)
    public ChallengeType challenge;

    @Column(name = "created_at", nullable = false)
    public LocalDateTime createdAt;

    public String ipAddress;

    public Double totalScore;

    public Double maxScore;

    public String grade;

    public boolean passed;

    @JsonRawValue
    @Column(columnDefinition = "text")
    public String report;

    @Column(columnDefinition = "text")
    public String errorMessage;
}
