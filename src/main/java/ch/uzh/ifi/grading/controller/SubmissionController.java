package ch.uzh.ifi.grading.controller;

import ch.uzh.ifi.grading.config.GraderProperties;
import ch.uzh.ifi.grading.model.constants.ChallengeType;
import ch.uzh.ifi.grading.model.dao.GradeReport;
import ch.uzh.ifi.grading.service.GradingService;
import ch.uzh.ifi.grading.service.RateLimiter;
import jakarta.servlet.http.HttpServletRequest;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.BoundedInputStream;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.multipart.MultipartHttpServletRequest;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.util.WebUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.regex.Pattern;

@Slf4j
@RestController
@AllArgsConstructor
public class SubmissionController {

    private static final Pattern IDENTITY_FILTER = Pattern.compile("[^A-Za-z0-9_-]");

    private GraderProperties properties;

    private RateLimiter rateLimiter;

    private GradingService gradingService;

    /**
     * Accepts an archive either as the raw request body or as a file part of a multipart form. The request is
     * admitted, its headers validated and its declared size checked before the body is read.
     */
    @PostMapping("/submit")
    public ResponseEntity<GradeReport> submit(HttpServletRequest request,
                                              @RequestHeader(value = "X-Student-ID", required = false) String studentId,
                                              @RequestHeader(value = "X-Challenge", required = false) String challenge) {
        String ipAddress = request.getRemoteAddr();
        if (!rateLimiter.isAllowed(ipAddress))
            throw new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS, "Rate limit exceeded. Try again later.");
        String sanitizedId = sanitizeIdentity(studentId);
        if (sanitizedId.isEmpty())
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Missing or invalid X-Student-ID header");
        ChallengeType challengeType = ChallengeType.fromSlug(StringUtils.defaultIfBlank(challenge, ChallengeType.EDGE_PROTO.getSlug()).strip())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST,
                        "Invalid challenge. Use one of " + String.join(", ", ChallengeType.listSupported())));
        if (request.getContentLengthLong() > properties.getMaxUploadSize())
            throw tooLarge();
        byte[] archive = readArchive(request);
        log.info("Grading {}: {} ({} bytes)", challengeType.getSlug(), sanitizedId, archive.length);
        GradeReport report = gradingService.gradeAndRecord(archive, sanitizedId, challengeType, ipAddress);
        HttpStatus status = report.isSuccess() ? HttpStatus.OK : report.getError().getKind().getStatus();
        return ResponseEntity.status(status).body(report);
    }

    String sanitizeIdentity(String studentId) {
        return StringUtils.left(IDENTITY_FILTER.matcher(StringUtils.defaultString(studentId)).replaceAll(""),
                properties.getMaxIdentityLength());
    }

    private byte[] readArchive(HttpServletRequest request) {
        try {
            byte[] archive;
            MultipartHttpServletRequest multipartRequest = WebUtils.getNativeRequest(request, MultipartHttpServletRequest.class);
            if (multipartRequest != null) {
                MultipartFile file = multipartRequest.getFileMap().values().stream().findFirst()
                        .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "No ZIP file found"));
                archive = file.getBytes();
            } else {
                try (InputStream body = new BoundedInputStream(request.getInputStream(), properties.getMaxUploadSize() + 1)) {
                    archive = IOUtils.toByteArray(body);
                }
            }
            if (archive.length > properties.getMaxUploadSize())
                throw tooLarge();
            if (archive.length == 0)
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "No ZIP file found");
            return archive;
        } catch (IOException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Failed to read upload", e);
        }
    }

    private ResponseStatusException tooLarge() {
        return new ResponseStatusException(HttpStatus.PAYLOAD_TOO_LARGE,
                "File too large. Max %d MB".formatted(properties.getMaxUploadSize() / 1024 / 1024));
    }
}
