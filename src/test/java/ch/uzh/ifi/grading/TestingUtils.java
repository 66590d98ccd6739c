package ch.uzh.ifi.grading;

import ch.uzh.ifi.grading.config.GraderProperties;
import ch.uzh.ifi.grading.model.constants.ChallengeType;
import ch.uzh.ifi.grading.model.constants.Comparison;
import ch.uzh.ifi.grading.model.constants.DatasetCategory;
import lombok.Value;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class TestingUtils {

    public static final String MODULE_SOLUTION = """
            import json
            import sys

            def main():
                print(json.dumps({"total_requests": 0}))

            if __name__ == "__main__":
                main()
            """;

    public static final String DANGEROUS_SOLUTION = """
            import os

            def cleanup():
                os.system("sudo reboot")
            """;

    /**
     * Answers every hidden dataset with its expected result, using shell builtins only.
     */
    public static final String PERFECT_TOOL = """
            #!/bin/sh
            case "$1" in
              *_A.log) echo '{"total_requests": 10, "error_rate": 0.1, "avg_rtt_ms": 12.5, "top_congestion": "cubic"}' ;;
              *_B.log) echo '{"total_requests": 20, "error_rate": 0.25, "avg_rtt_ms": 30.0, "top_congestion": "bbr"}' ;;
              *_C.log) echo '{"total_requests": 15, "error_rate": 0.0, "avg_rtt_ms": 8.75, "top_congestion": "reno"}' ;;
              *_D.log) echo '{"total_requests": 0, "error_rate": 0.0, "avg_rtt_ms": 0.0, "top_congestion": null}' ;;
              *) echo "unknown input" >&2; exit 2 ;;
            esac
            """;

    /**
     * Gets dataset A right, misses one tolerance on B, prints garbage for C and accepts five bad lines of D.
     */
    public static final String PARTIAL_TOOL = """
            #!/bin/sh
            case "$1" in
              *_A.log) echo '{"total_requests": 10, "error_rate": 0.1, "avg_rtt_ms": 12.5, "top_congestion": "cubic"}' ;;
              *_B.log) echo '{"total_requests": 20, "error_rate": 0.261, "avg_rtt_ms": 30.0, "top_congestion": "bbr"}' ;;
              *_C.log) echo 'parsing...'; echo '{"total_requests": 15}' ;;
              *_D.log) echo '{"total_requests": 5}' ;;
            esac
            """;

    public static final String LITERAL_SUFFIX_TOOL = """
            #!/bin/sh
            echo '{"total_requests": "10L", "error_rate": "0x10", "avg_rtt_ms": "2f", "top_congestion": "cubic"}'
            """;

    public static final String CRASHING_TOOL = """
            #!/bin/sh
            echo "Traceback: something broke" >&2
            exit 3
            """;

    @Value
    public static class ZipContent {
        String name;
        String content;
        int unixMode;

        public static ZipContent file(String name, String content) {
            return new ZipContent(name, content, 0644);
        }

        public static ZipContent executable(String name, String content) {
            return new ZipContent(name, content, 0755);
        }

        public static ZipContent directory(String name) {
            return new ZipContent(name.endsWith("/") ? name : name + "/", null, 0755);
        }
    }

    public static byte[] createZip(ZipContent... entries) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipArchiveOutputStream zip = new ZipArchiveOutputStream(bytes)) {
            for (ZipContent entry : entries) {
                ZipArchiveEntry zipEntry = new ZipArchiveEntry(entry.getName());
                zipEntry.setUnixMode(entry.getUnixMode());
                zip.putArchiveEntry(zipEntry);
                if (entry.getContent() != null)
                    zip.write(entry.getContent().getBytes(StandardCharsets.UTF_8));
                zip.closeArchiveEntry();
            }
            zip.finish();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    public static GraderProperties createProperties(String workingDir) {
        GraderProperties properties = new GraderProperties();
        properties.setWorkingDir(workingDir);
        properties.getSandbox().getEnvironment().put("PATH", "/usr/local/bin:/usr/bin:/bin");
        GraderProperties.Challenge edgeProto = new GraderProperties.Challenge();
        edgeProto.getEntryPoints().setScripts(List.of("edge_proto_tool/main.py", "src/edge_proto_tool/main.py", "main.py"));
        edgeProto.getEntryPoints().setBinaries(List.of("edge_proto_tool", "main"));
        properties.getChallenges().put(ChallengeType.EDGE_PROTO, edgeProto);
        GraderProperties.Challenge frontend = new GraderProperties.Challenge();
        frontend.getEntryPoints().setManifests(List.of("package.json"));
        properties.getChallenges().put(ChallengeType.FRONTEND, frontend);
        return properties;
    }

    public static GraderProperties.Field createField(String name, Double tolerance) {
        GraderProperties.Field field = new GraderProperties.Field();
        field.setName(name);
        if (tolerance != null) {
            field.setComparison(Comparison.TOLERANCE);
            field.setTolerance(tolerance);
        }
        return field;
    }

    public static GraderProperties.Dataset createCorrectnessDataset(String name, double points) {
        GraderProperties.Dataset dataset = new GraderProperties.Dataset();
        dataset.setName(name);
        dataset.setCategory(DatasetCategory.CORRECTNESS);
        dataset.setPoints(points);
        dataset.setFields(List.of(createField("total_requests", null), createField("error_rate", 0.01),
                createField("avg_rtt_ms", 0.5), createField("top_congestion", null)));
        return dataset;
    }

    public static GraderProperties.Dataset createRobustnessDataset(String name, double points) {
        GraderProperties.Dataset dataset = new GraderProperties.Dataset();
        dataset.setName(name);
        dataset.setCategory(DatasetCategory.ROBUSTNESS);
        dataset.setPoints(points);
        dataset.setSentinelField("total_requests");
        dataset.setSentinel(0.0);
        dataset.setSaturation(points);
        return dataset;
    }
}
