package ch.uzh.ifi.grading.controller;

import ch.uzh.ifi.grading.model.constants.ChallengeType;
import ch.uzh.ifi.grading.model.constants.FailureKind;
import ch.uzh.ifi.grading.model.dao.GradeReport;
import ch.uzh.ifi.grading.model.dao.GradingFailure;
import ch.uzh.ifi.grading.service.GradingService;
import ch.uzh.ifi.grading.service.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "grader.max-upload-size=1024")
@AutoConfigureMockMvc
@ActiveProfiles("test")
class SubmissionControllerTests {

    private static final byte[] ARCHIVE = "PK\u0003\u0004 pretend this is a zip".getBytes();

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private SubmissionController submissionController;

    @MockBean
    private GradingService gradingService;

    @MockBean
    private RateLimiter rateLimiter;

    private GradeReport createReport(String studentId, GradingFailure error) {
        return GradeReport.builder().studentId(studentId).challenge(ChallengeType.EDGE_PROTO)
                .timestamp(LocalDateTime.of(2024, 5, 1, 12, 0)).totalScore(error == null ? 82.5 : 0.0)
                .maxScore(100.0).percentage(error == null ? 82.5 : 0.0).grade(error == null ? "B" : "F")
                .passed(error == null).summary(error == null ? "Score: 82.5/100, Grade: B" : "ERROR: " + error.getMessage())
                .error(error).build();
    }

    @BeforeEach
    void setUp() {
        given(rateLimiter.isAllowed(anyString())).willReturn(true);
        given(gradingService.gradeAndRecord(any(), anyString(), any(), anyString()))
                .willAnswer(invocation -> createReport(invocation.getArgument(1), null));
    }

    @Test
    void missingApiKeyTest() throws Exception {
        mockMvc.perform(post("/submit").header("X-Student-ID", "alice").content(ARCHIVE))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Unauthorized. Provide X-API-Key header."));
        then(gradingService).should(never()).gradeAndRecord(any(), anyString(), any(), anyString());
    }

    @Test
    void wrongApiKeyTest() throws Exception {
        mockMvc.perform(post("/submit").header("X-API-Key", "guessed-key").header("X-Student-ID", "alice").content(ARCHIVE))
                .andExpect(status().isUnauthorized());
        then(rateLimiter).should(never()).isAllowed(anyString());
    }

    @Test
    void rawBodySubmissionTest() throws Exception {
        mockMvc.perform(post("/submit").header("X-API-Key", "test-api-key").header("X-Student-ID", "alice")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM).content(ARCHIVE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.student_id").value("alice"))
                .andExpect(jsonPath("$.total_score").value(82.5))
                .andExpect(jsonPath("$.grade").value("B"))
                .andExpect(jsonPath("$.challenge").value("edge-proto"));
        then(gradingService).should().gradeAndRecord(eq(ARCHIVE), eq("alice"), eq(ChallengeType.EDGE_PROTO), eq("127.0.0.1"));
    }

    @Test
    void multipartSubmissionTest() throws Exception {
        mockMvc.perform(multipart("/submit").file(new MockMultipartFile("file", "solution.zip", "application/zip", ARCHIVE))
                        .header("X-API-Key", "test-api-key").header("X-Student-ID", "bob").header("X-Challenge", "frontend"))
                .andExpect(status().isOk());
        then(gradingService).should().gradeAndRecord(eq(ARCHIVE), eq("bob"), eq(ChallengeType.FRONTEND), anyString());
    }

    @Test
    void rateLimitedTest() throws Exception {
        given(rateLimiter.isAllowed(anyString())).willReturn(false);
        mockMvc.perform(post("/submit").header("X-API-Key", "test-api-key").header("X-Student-ID", "alice").content(ARCHIVE))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error").value("Rate limit exceeded. Try again later."));
    }

    @Test
    void missingStudentIdTest() throws Exception {
        mockMvc.perform(post("/submit").header("X-API-Key", "test-api-key").content(ARCHIVE))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/submit").header("X-API-Key", "test-api-key").header("X-Student-ID", "../..").content(ARCHIVE))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unknownChallengeTest() throws Exception {
        mockMvc.perform(post("/submit").header("X-API-Key", "test-api-key").header("X-Student-ID", "alice")
                        .header("X-Challenge", "backend").content(ARCHIVE))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid challenge. Use one of edge-proto, frontend"));
    }

    @Test
    void oversizedUploadTest() throws Exception {
        mockMvc.perform(post("/submit").header("X-API-Key", "test-api-key").header("X-Student-ID", "alice")
                        .content(new byte[2048]))
                .andExpect(status().isPayloadTooLarge());
        then(gradingService).should(never()).gradeAndRecord(any(), anyString(), any(), anyString());
    }

    @Test
    void emptyUploadTest() throws Exception {
        mockMvc.perform(post("/submit").header("X-API-Key", "test-api-key").header("X-Student-ID", "alice"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("No ZIP file found"));
    }

    @Test
    void rejectedSubmissionStatusTest() throws Exception {
        given(gradingService.gradeAndRecord(any(), anyString(), any(), anyString())).willReturn(createReport("alice",
                new GradingFailure(FailureKind.PATH_TRAVERSAL, "Invalid ZIP: path traversal detected")));
        mockMvc.perform(post("/submit").header("X-API-Key", "test-api-key").header("X-Student-ID", "alice").content(ARCHIVE))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.summary").value("ERROR: Invalid ZIP: path traversal detected"))
                .andExpect(jsonPath("$.error.kind").value("path_traversal"));
    }

    @Test
    void sanitizeIdentityTest() {
        assertEquals("alicebob", submissionController.sanitizeIdentity("al!ice/../bob"));
        assertEquals("student_1-a", submissionController.sanitizeIdentity(" student_1-a "));
        assertEquals("", submissionController.sanitizeIdentity(null));
        assertEquals(50, submissionController.sanitizeIdentity("x".repeat(80)).length());
    }
}
