package ch.uzh.ifi.grading.service.scoring;

import ch.uzh.ifi.grading.config.GraderProperties;
import ch.uzh.ifi.grading.model.constants.DatasetCategory;
import ch.uzh.ifi.grading.model.dao.DatasetResult;
import ch.uzh.ifi.grading.model.dao.FieldOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import org.apache.commons.math3.util.Precision;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Scores input made entirely of malformed records. Reporting the sentinel earns full points, every unit of
 * deviation costs one point and a deviation of at least the saturation earns nothing. A missing or non-numeric
 * value earns nothing.
 */
@Component
public class RejectionRateStrategy implements ScoringStrategy {

    @Override
    public DatasetCategory getCategory() {
        return DatasetCategory.ROBUSTNESS;
    }

    @Override
    public DatasetResult score(GraderProperties.Dataset dataset, JsonNode actual, JsonNode expected) {
        JsonNode actualValue = actual.get(dataset.getSentinelField());
        double saturation = Objects.requireNonNullElse(dataset.getSaturation(), dataset.getPoints());
        double earned = 0.0;
        boolean correct = false;
        if (Objects.nonNull(actualValue) && actualValue.isNumber()) {
            double deviation = Math.abs(actualValue.asDouble() - dataset.getSentinel());
            earned = deviation >= saturation ? 0.0 : Math.max(0.0, dataset.getPoints() - deviation);
            correct = deviation == 0.0;
        }
        FieldOutcome outcome = new FieldOutcome(dataset.getSentinelField(), DoubleNode.valueOf(dataset.getSentinel()),
                actualValue, correct, Precision.round(earned, 2));
        return DatasetResult.builder().name(dataset.getName()).category(getCategory())
                .pointsEarned(Precision.round(earned, 2)).pointsPossible(dataset.getPoints())
                .percentage(FieldToleranceStrategy.percentage(earned, dataset.getPoints())).fields(List.of(outcome)).build();
    }
}
