package ch.uzh.ifi.grading.service.scoring;

import ch.uzh.ifi.grading.config.GraderProperties;
import ch.uzh.ifi.grading.model.constants.DatasetCategory;
import ch.uzh.ifi.grading.model.dao.DatasetResult;
import ch.uzh.ifi.grading.model.dao.TestOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.math3.util.Precision;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Awards the points of every passed test listed in the dataset's table. Tests missing from the run count as failed,
 * tests missing from the table are ignored.
 */
@Component
public class TestTableStrategy implements ScoringStrategy {

    @Override
    public DatasetCategory getCategory() {
        return DatasetCategory.FIXED_TEST_TABLE;
    }

    @Override
    public DatasetResult score(GraderProperties.Dataset dataset, JsonNode actual, JsonNode expected) {
        List<TestOutcome> outcomes = dataset.getTests().stream().map(entry -> {
            boolean passed = actual.path(entry.getTest()).asBoolean(false);
            return new TestOutcome(entry.getTest(), passed, passed ? entry.getPoints() : 0.0, entry.getPoints());
        }).toList();
        double earned = outcomes.stream().mapToDouble(TestOutcome::getPoints).sum();
        double possible = Objects.requireNonNullElseGet(dataset.getPoints(),
                () -> dataset.getTests().stream().mapToDouble(GraderProperties.TestPoints::getPoints).sum());
        return DatasetResult.builder().name(dataset.getName()).category(getCategory())
                .pointsEarned(Precision.round(earned, 2)).pointsPossible(possible)
                .percentage(FieldToleranceStrategy.percentage(earned, possible)).tests(outcomes).build();
    }
}
