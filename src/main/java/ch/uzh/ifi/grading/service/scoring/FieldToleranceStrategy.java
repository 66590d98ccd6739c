package ch.uzh.ifi.grading.service.scoring;

import ch.uzh.ifi.grading.config.GraderProperties;
import ch.uzh.ifi.grading.model.constants.Comparison;
import ch.uzh.ifi.grading.model.constants.DatasetCategory;
import ch.uzh.ifi.grading.model.dao.DatasetResult;
import ch.uzh.ifi.grading.model.dao.FieldOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.math.NumberUtils;
import org.apache.commons.math3.util.Precision;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Every configured field is worth an equal share of the dataset. Numeric fields with a tolerance are compared in
 * decimal arithmetic, so a difference that equals the tolerance still counts as correct.
 */
@Component
public class FieldToleranceStrategy implements ScoringStrategy {

    @Override
    public DatasetCategory getCategory() {
        return DatasetCategory.CORRECTNESS;
    }

    @Override
    public DatasetResult score(GraderProperties.Dataset dataset, JsonNode actual, JsonNode expected) {
        List<GraderProperties.Field> fields = dataset.getFields();
        double pointsPerField = fields.isEmpty() ? 0.0 : dataset.getPoints() / fields.size();
        List<FieldOutcome> outcomes = new ArrayList<>();
        for (GraderProperties.Field field : fields) {
            JsonNode expectedValue = expected.get(field.getName());
            JsonNode actualValue = actual.get(field.getName());
            boolean correct = isCorrect(field, expectedValue, actualValue);
            outcomes.add(new FieldOutcome(field.getName(), expectedValue, actualValue, correct, correct ? pointsPerField : 0.0));
        }
        long correct = outcomes.stream().filter(FieldOutcome::isCorrect).count();
        double earned = fields.isEmpty() ? 0.0 : (double) correct / fields.size() * dataset.getPoints();
        return DatasetResult.builder().name(dataset.getName()).category(getCategory())
                .pointsEarned(Precision.round(earned, 2)).pointsPossible(dataset.getPoints())
                .percentage(percentage(earned, dataset.getPoints())).fields(outcomes).build();
    }

    boolean isCorrect(GraderProperties.Field field, JsonNode expected, JsonNode actual) {
        if (isAbsent(expected) || isAbsent(actual))
            return false;
        Optional<BigDecimal> expectedNumber = toDecimal(expected);
        Optional<BigDecimal> actualNumber = toDecimal(actual);
        if (expected.isNumber() && actual.isNumber() && expectedNumber.get().compareTo(actualNumber.get()) == 0)
            return true;
        if (expected.equals(actual))
            return true;
        if (!field.getComparison().equals(Comparison.TOLERANCE) || Objects.isNull(field.getTolerance()))
            return false;
        if (expectedNumber.isEmpty() || actualNumber.isEmpty())
            return false;
        BigDecimal difference = actualNumber.get().subtract(expectedNumber.get()).abs();
        return difference.compareTo(BigDecimal.valueOf(field.getTolerance())) <= 0;
    }

    private boolean isAbsent(JsonNode value) {
        return Objects.isNull(value) || value.isNull() || value.isMissingNode();
    }

    private Optional<BigDecimal> toDecimal(JsonNode value) {
        if (value.isNumber())
            return Optional.of(value.decimalValue());
        if (!value.isTextual() || !NumberUtils.isCreatable(value.asText().strip()))
            return Optional.empty();
        try {
            return Optional.of(new BigDecimal(value.asText().strip()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    static double percentage(double earned, double possible) {
        return possible > 0 ? Precision.round(earned / possible * 100, 2) : 0.0;
    }
}
