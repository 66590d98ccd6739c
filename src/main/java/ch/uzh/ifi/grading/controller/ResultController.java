package ch.uzh.ifi.grading.controller;

import ch.uzh.ifi.grading.model.Attempt;
import ch.uzh.ifi.grading.model.constants.ChallengeType;
import ch.uzh.ifi.grading.projections.AttemptSummary;
import ch.uzh.ifi.grading.service.ResultStore;
import lombok.AllArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@AllArgsConstructor
@RequestMapping("/results")
public class ResultController {

    private ResultStore resultStore;

    @GetMapping
    public Map<String, List<AttemptSummary>> getResults(@RequestParam(required = false) String challenge) {
        Optional<ChallengeType> challengeType = Optional.ofNullable(challenge).map(slug -> ChallengeType.fromSlug(slug)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown challenge " + slug)));
        return Map.of("results", resultStore.findAll(challengeType));
    }

    @GetMapping("/{studentId}")
    public Map<String, Object> getStudentResults(@PathVariable String studentId) {
        List<Attempt> attempts = resultStore.findByStudent(studentId);
        return Map.of("student_id", studentId, "results", attempts);
    }
}
