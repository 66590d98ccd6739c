package ch.uzh.ifi.grading.service;

import ch.uzh.ifi.grading.config.GraderProperties;
import ch.uzh.ifi.grading.model.dao.ScanFinding;
import ch.uzh.ifi.grading.model.dao.ScanResult;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Textual screening of extracted sources. A single match anywhere rejects the whole submission.
 */
@Slf4j
@Service
public class SecurityScanner {

    @Value
    static class CompiledRule {
        Pattern pattern;
        String reason;
    }

    private final List<CompiledRule> rules;

    private final Set<String> extensions;

    private final Set<String> skippedDirectories;

    private final int maxWarnings;

    public SecurityScanner(GraderProperties properties) {
        GraderProperties.Scanner scanner = properties.getScanner();
        this.rules = scanner.getRules().stream().map(rule -> new CompiledRule(
                Pattern.compile(rule.getPattern(), Pattern.CASE_INSENSITIVE | Pattern.MULTILINE), rule.getReason())).toList();
        this.extensions = scanner.getExtensions().stream().map(extension -> extension.replaceFirst("^\\.", "").toLowerCase())
                .collect(Collectors.toUnmodifiableSet());
        this.skippedDirectories = Set.copyOf(scanner.getSkippedDirectories());
        this.maxWarnings = scanner.getMaxWarnings();
        log.info("Loaded {} security rules for {} file types", rules.size(), extensions.size());
    }

    public int getMaxWarnings() {
        return maxWarnings;
    }

    public ScanResult scan(Path root) throws IOException {
        List<ScanFinding> findings = new ArrayList<>();
        try (Stream<Path> files = Files.walk(root)) {
            for (Path file : files.filter(Files::isRegularFile).filter(file -> isScannable(root.relativize(file))).sorted().toList())
                findings.addAll(scanFile(root, file));
        }
        if (!findings.isEmpty())
            log.warn("Security scan of {} produced {} findings", root, findings.size());
        return ScanResult.of(findings);
    }

    private boolean isScannable(Path relativePath) {
        boolean skipped = StreamSupport.stream(relativePath.spliterator(), false).map(Path::toString)
                .anyMatch(part -> part.startsWith(".") || skippedDirectories.contains(part));
        return !skipped && extensions.contains(FilenameUtils.getExtension(relativePath.toString()).toLowerCase());
    }

    private List<ScanFinding> scanFile(Path root, Path file) {
        String location = FilenameUtils.separatorsToUnix(root.relativize(file).toString());
        String content;
        try {
            content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Skipping unreadable file {}: {}", location, e.getMessage());
            return List.of();
        }
        return rules.stream().filter(rule -> rule.getPattern().matcher(content).find())
                .map(rule -> new ScanFinding(location, rule.getPattern().pattern(), rule.getReason())).toList();
    }
}
