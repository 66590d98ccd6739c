package ch.uzh.ifi.grading.config;

import ch.uzh.ifi.grading.model.constants.ChallengeType;
import ch.uzh.ifi.grading.model.constants.Comparison;
import ch.uzh.ifi.grading.model.constants.DatasetCategory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Data
@Configuration
@ConfigurationProperties(prefix = "grader")
public class GraderProperties {
    private String apiKey;
    private String apiKeyFile = ".api_key";
    private String workingDir = "/tmp/grader";
    private String fixturesDir = "fixtures";
    private Long maxUploadSize = 50L * 1024 * 1024;
    private Long maxExtractedSize = 200L * 1024 * 1024;
    private Integer maxIdentityLength = 50;
    private RateLimit rateLimit = new RateLimit();
    private Sandbox sandbox = new Sandbox();
    private Scanner scanner = new Scanner();
    private Map<ChallengeType, Challenge> challenges = new LinkedHashMap<>();

    public Optional<Challenge> getChallenge(ChallengeType type) {
        return Optional.ofNullable(challenges.get(type));
    }

    @Data
    public static class RateLimit {
        private Duration window = Duration.ofSeconds(60);
        private Integer maxRequests = 10;
    }

    @Data
    public static class Sandbox {
        private boolean enabled = true;
        /**
         * One of auto, firejail, bubblewrap or none. Auto picks the strongest tool found on the host.
         */
        private String isolation = "auto";
        private Long cpuSeconds = 60L;
        private Long memoryBytes = 512L * 1024 * 1024;
        private Long fileSizeBytes = 50L * 1024 * 1024;
        private Long processes = 50L;
        private Long openFiles = 256L;
        private Integer stdoutLimit = 1024 * 1024;
        private Integer stderrLimit = 4096;
        private Duration killGracePeriod = Duration.ofSeconds(2);
        private Map<String, String> environment = new LinkedHashMap<>();
        private List<String> inheritedVariables = new ArrayList<>(List.of("TERM", "TZ"));
    }

    @Data
    public static class Scanner {
        private List<String> extensions = new ArrayList<>();
        private List<String> skippedDirectories = new ArrayList<>(List.of("node_modules"));
        private Integer maxWarnings = 10;
        private List<Rule> rules = new ArrayList<>();
    }

    @Data
    public static class Rule {
        private String pattern;
        private String reason;
    }

    @Data
    public static class Challenge {
        private Double maxScore = 100.0;
        private Double passThreshold = 60.0;
        private Integer timeLimit = 30;
        private String interpreter = "python3";
        private EntryPoints entryPoints = new EntryPoints();
        private String expectedResults = "expected_results.json";
        private String hiddenData = "hidden_data";
        private List<Dataset> datasets = new ArrayList<>();
        private Session session;
    }

    /**
     * Marker paths relative to a candidate directory, tried in the order scripts, binaries, manifests.
     */
    @Data
    public static class EntryPoints {
        private List<String> scripts = new ArrayList<>();
        private List<String> binaries = new ArrayList<>();
        private List<String> manifests = new ArrayList<>();
    }

    @Data
    public static class Dataset {
        private String name;
        private DatasetCategory category = DatasetCategory.CORRECTNESS;
        private Double points;
        private List<Field> fields = new ArrayList<>();
        private String sentinelField;
        private Double sentinel = 0.0;
        private Double saturation;
        private List<TestPoints> tests = new ArrayList<>();
    }

    @Data
    public static class Field {
        private String name;
        private Comparison comparison = Comparison.EXACT;
        private Double tolerance;
    }

    @Data
    public static class TestPoints {
        private String test;
        private Double points;
    }

    @Data
    public static class Session {
        private String harnessDir = "harness";
        private List<String> harnessFiles = new ArrayList<>();
        private List<List<String>> harnessInstallCommands = new ArrayList<>();
        private Integer harnessInstallTimeout = 120;
        private List<String> installCommand = new ArrayList<>();
        private Integer installTimeout = 180;
        private List<String> auxCommand = new ArrayList<>();
        private List<String> appCommand = new ArrayList<>();
        private List<String> testCommand = new ArrayList<>();
        private Integer testTimeout = 180;
        private String readinessPath = "/";
        private Integer readinessTimeout = 60;
        private Duration pollInterval = Duration.ofSeconds(1);
        private Integer diagnosticLimit = 500;
        private Long processLimit = 1024L;
        private Map<String, String> environment = new LinkedHashMap<>();
    }
}
