package ch.uzh.ifi.grading.model.dao;

import lombok.Value;

import java.util.List;

@Value
public class ScanResult {
    boolean safe;
    List<ScanFinding> findings;

    public static ScanResult of(List<ScanFinding> findings) {
        return new ScanResult(findings.isEmpty(), List.copyOf(findings));
    }

    public List<String> getWarnings(int limit) {
        return findings.stream().limit(limit).map(ScanFinding::toString).toList();
    }
}
