package ch.uzh.ifi.grading.model.dao;

import ch.uzh.ifi.grading.model.constants.DatasetCategory;
import ch.uzh.ifi.grading.model.constants.FailureKind;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Objects;

@Value
@Builder
@Jacksonized
public class DatasetResult {
    String name;
    DatasetCategory category;
    Double pointsEarned;
    Double pointsPossible;
    Double percentage;
    @Builder.Default
    List<FieldOutcome> fields = List.of();
    @Builder.Default
    List<TestOutcome> tests = List.of();
    GradingFailure failure;

    public static DatasetResult failed(String name, DatasetCategory category, Double pointsPossible,
                                       FailureKind kind, String message) {
        return DatasetResult.builder().name(name).category(category).pointsEarned(0.0)
                .pointsPossible(pointsPossible).percentage(0.0).failure(new GradingFailure(kind, message)).build();
    }

    public boolean isSuccess() {
        return Objects.isNull(failure);
    }
}
