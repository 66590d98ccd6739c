package ch.uzh.ifi.grading;

import ch.uzh.ifi.grading.config.GraderProperties;
import ch.uzh.ifi.grading.model.SandboxCapabilities;
import ch.uzh.ifi.grading.model.constants.ChallengeType;
import ch.uzh.ifi.grading.service.RateLimiter;
import ch.uzh.ifi.grading.service.ResultStore;
import lombok.AllArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@AllArgsConstructor
public class ServerInfoController {

    private GraderProperties properties;

    private SandboxCapabilities sandboxCapabilities;

    private RateLimiter rateLimiter;

    private ResultStore resultStore;

    @GetMapping("/health")
    public Map<String, Object> getHealth() {
        Map<String, Object> security = new LinkedHashMap<>();
        security.put("sandbox_enabled", sandboxCapabilities.isEnabled());
        security.put("sandbox_tool", sandboxCapabilities.describe());
        security.put("strongly_isolated", sandboxCapabilities.isStronglyIsolated());
        security.put("resource_limits", sandboxCapabilities.getLimits());
        security.put("process_groups", sandboxCapabilities.isProcessGroups());
        security.put("code_scanning", true);
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "ok");
        health.put("timestamp", LocalDateTime.now().toString());
        health.put("challenges", List.of(ChallengeType.listSupported()));
        health.put("security", security);
        return health;
    }

    @GetMapping("/status")
    public Map<String, Object> getStatus() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("max_upload_size_mb", properties.getMaxUploadSize() / 1024 / 1024);
        config.put("rate_limit_per_minute", rateLimiter.getMaxRequests());
        config.put("rate_limit_window_seconds", properties.getRateLimit().getWindow().toSeconds());
        config.put("challenges", List.of(ChallengeType.listSupported()));
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "ok");
        status.put("stats", resultStore.getStats());
        status.put("config", config);
        return status;
    }
}
