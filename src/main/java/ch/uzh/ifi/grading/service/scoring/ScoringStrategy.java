package ch.uzh.ifi.grading.service.scoring;

import ch.uzh.ifi.grading.config.GraderProperties;
import ch.uzh.ifi.grading.model.constants.DatasetCategory;
import ch.uzh.ifi.grading.model.dao.DatasetResult;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Turns the observed output of one dataset into points. Implementations are pure: the same inputs always
 * produce the same result.
 */
public interface ScoringStrategy {

    DatasetCategory getCategory();

    /**
     * @param actual   the program's output object, or the test outcomes keyed by test id
     * @param expected the expected object for the dataset, unused by strategies that score against a fixed table
     */
    DatasetResult score(GraderProperties.Dataset dataset, JsonNode actual, JsonNode expected);
}
