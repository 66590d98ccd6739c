package ch.uzh.ifi.grading.controller;

import ch.uzh.ifi.grading.model.Attempt;
import ch.uzh.ifi.grading.model.constants.ChallengeType;
import ch.uzh.ifi.grading.service.ResultStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ResultControllerTests {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ResultStore resultStore;

    private Attempt createAttempt(String studentId, double score) {
        Attempt attempt = new Attempt();
        attempt.setId(1L);
        attempt.setStudentId(studentId);
        attempt.setChallenge(ChallengeType.EDGE_PROTO);
        attempt.setCreatedAt(LocalDateTime.of(2024, 5, 1, 12, 0));
        attempt.setTotalScore(score);
        attempt.setMaxScore(100.0);
        attempt.setGrade("A");
        attempt.setPassed(true);
        attempt.setReport("{\"total_score\": %s}".formatted(score));
        return attempt;
    }

    @Test
    void healthIsPublicTest() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.challenges[0]").value("edge-proto"))
                .andExpect(jsonPath("$.security.code_scanning").value(true))
                .andExpect(jsonPath("$.security.sandbox_enabled").value(true));
    }

    @Test
    void statusIsPublicTest() throws Exception {
        given(resultStore.getStats()).willReturn(Map.of("total_submissions", 3));
        mockMvc.perform(get("/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stats.total_submissions").value(3))
                .andExpect(jsonPath("$.config.max_upload_size_mb").value(50));
    }

    @Test
    void resultsRequireApiKeyTest() throws Exception {
        mockMvc.perform(get("/results")).andExpect(status().isUnauthorized());
        mockMvc.perform(get("/results/alice")).andExpect(status().isUnauthorized());
    }

    @Test
    void studentResultsTest() throws Exception {
        given(resultStore.findByStudent("alice")).willReturn(List.of(createAttempt("alice", 95.0)));
        mockMvc.perform(get("/results/alice").header("X-API-Key", "test-api-key"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.student_id").value("alice"))
                .andExpect(jsonPath("$.results[0].total_score").value(95.0))
                .andExpect(jsonPath("$.results[0].report.total_score").value(95.0));
    }

    @Test
    void filteredResultsTest() throws Exception {
        given(resultStore.findAll(Optional.of(ChallengeType.FRONTEND))).willReturn(List.of());
        mockMvc.perform(get("/results").param("challenge", "frontend").header("X-API-Key", "test-api-key"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results").isEmpty());
        mockMvc.perform(get("/results").param("challenge", "backend").header("X-API-Key", "test-api-key"))
                .andExpect(status().isBadRequest());
    }
}
