package ch.uzh.ifi.grading.service;

import ch.uzh.ifi.grading.config.GraderProperties;
import ch.uzh.ifi.grading.exception.ConfigurationException;
import ch.uzh.ifi.grading.exception.SubmissionRejectedException;
import ch.uzh.ifi.grading.model.EntryPoint;
import ch.uzh.ifi.grading.model.Submission;
import ch.uzh.ifi.grading.model.constants.ChallengeType;
import ch.uzh.ifi.grading.model.constants.EntryPointType;
import ch.uzh.ifi.grading.model.constants.FailureKind;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.input.BoundedInputStream;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Stream;

@Slf4j
@Service
@AllArgsConstructor
public class IntakeService {

    private static final Pattern SEGMENT_SEPARATOR = Pattern.compile("[/\\\\]");

    private static final Pattern DRIVE_LETTER = Pattern.compile("^[A-Za-z]:.*");

    private static final int EXECUTE_BITS = 0111;

    private GraderProperties properties;

    /**
     * Extracts an uploaded archive into a fresh directory and discovers how to run it. Nothing is written unless
     * every entry of the archive is safe to extract, and the directory is removed again if anything fails.
     */
    public Submission accept(byte[] archive, String studentId, ChallengeType challenge) {
        if (archive.length > properties.getMaxUploadSize())
            throw new SubmissionRejectedException(FailureKind.PAYLOAD_TOO_LARGE,
                    "File too large. Max %d MB".formatted(properties.getMaxUploadSize() / 1024 / 1024));
        GraderProperties.Challenge config = properties.getChallenge(challenge).orElseThrow(() ->
                new ConfigurationException("Challenge %s is not configured".formatted(challenge.getSlug())));
        Path tempRoot = createTempRoot();
        try {
            Path extractedRoot = Files.createDirectory(tempRoot.resolve("submission"));
            extract(archive, extractedRoot);
            EntryPoint entryPoint = locateEntryPoint(extractedRoot, config.getEntryPoints()).orElseThrow(() ->
                    new SubmissionRejectedException(FailureKind.NO_ENTRY_POINT,
                            "Could not find %s in submission".formatted(describeMarkers(config.getEntryPoints()))));
            log.info("Accepted {} submission of {} with {} entry point {}", challenge.getSlug(), studentId,
                    entryPoint.getType().getName(), extractedRoot.relativize(entryPoint.getTarget()));
            return new Submission(studentId, challenge, tempRoot, extractedRoot, entryPoint);
        } catch (IOException e) {
            FileUtils.deleteQuietly(tempRoot.toFile());
            throw new UncheckedIOException("Failed to prepare submission directory", e);
        } catch (RuntimeException e) {
            FileUtils.deleteQuietly(tempRoot.toFile());
            throw e;
        }
    }

    private Path createTempRoot() {
        Path workingDir = Paths.get(properties.getWorkingDir(), "submissions").toAbsolutePath();
        try {
            Files.createDirectories(workingDir);
            return Files.createTempDirectory(workingDir, "attempt-");
        } catch (IOException e) {
            throw new ConfigurationException("Working directory %s is not writable: %s".formatted(workingDir, e.getMessage()));
        }
    }

    private void verifyEntry(ZipArchiveEntry entry) {
        String name = entry.getName();
        if (name.startsWith("/") || name.startsWith("\\") || DRIVE_LETTER.matcher(name).matches()
                || Stream.of(SEGMENT_SEPARATOR.split(name)).anyMatch(".."::equals))
            throw new SubmissionRejectedException(FailureKind.PATH_TRAVERSAL, "Invalid ZIP: path traversal detected");
        if (entry.isUnixSymlink())
            throw new SubmissionRejectedException(FailureKind.INVALID_ARCHIVE, "Invalid ZIP: symbolic links are not allowed");
    }

    void extract(byte[] archive, Path target) {
        try (ZipFile zipFile = new ZipFile(new SeekableInMemoryByteChannel(archive))) {
            List<ZipArchiveEntry> entries = Collections.list(zipFile.getEntries());
            entries.forEach(this::verifyEntry);
            long remaining = properties.getMaxExtractedSize();
            for (ZipArchiveEntry entry : entries) {
                Path destination = target.resolve(entry.getName()).normalize();
                if (!destination.startsWith(target))
                    throw new SubmissionRejectedException(FailureKind.PATH_TRAVERSAL, "Invalid ZIP: path traversal detected");
                if (entry.isDirectory()) {
                    Files.createDirectories(destination);
                    continue;
                }
                Files.createDirectories(destination.getParent());
                try (InputStream content = new BoundedInputStream(zipFile.getInputStream(entry), remaining + 1)) {
                    remaining -= Files.copy(content, destination);
                }
                if (remaining < 0)
                    throw new SubmissionRejectedException(FailureKind.PAYLOAD_TOO_LARGE,
                            "Extracted content exceeds %d MB".formatted(properties.getMaxExtractedSize() / 1024 / 1024));
                if (entry.getPlatform() == ZipArchiveEntry.PLATFORM_UNIX && (entry.getUnixMode() & EXECUTE_BITS) != 0
                        && !destination.toFile().setExecutable(true, true))
                    log.warn("Failed to restore execute permission of {}", destination);
            }
        } catch (IOException e) {
            throw new SubmissionRejectedException(FailureKind.INVALID_ARCHIVE, "Invalid ZIP file", e);
        }
    }

    /**
     * Searches the root, its subdirectories and their children, in that order, for the first directory that holds
     * one of the challenge's markers. Within a directory scripts win over binaries, binaries over manifests.
     */
    public Optional<EntryPoint> locateEntryPoint(Path base, GraderProperties.EntryPoints markers) throws IOException {
        for (Path candidate : listCandidates(base)) {
            Optional<EntryPoint> entryPoint = matchMarker(candidate, markers.getScripts(), EntryPointType.INTERPRETED, Files::isRegularFile)
                    .or(() -> matchMarker(candidate, markers.getBinaries(), EntryPointType.COMPILED_BINARY,
                            path -> Files.isRegularFile(path) && Files.isExecutable(path)))
                    .or(() -> matchMarker(candidate, markers.getManifests(), EntryPointType.WEB_PROJECT, Files::isRegularFile));
            if (entryPoint.isPresent())
                return entryPoint;
        }
        return Optional.empty();
    }

    private List<Path> listCandidates(Path base) throws IOException {
        List<Path> candidates = new ArrayList<>(List.of(base));
        for (Path subdir : listDirectories(base)) {
            candidates.add(subdir);
            candidates.addAll(listDirectories(subdir));
        }
        return candidates;
    }

    private List<Path> listDirectories(Path parent) throws IOException {
        try (Stream<Path> children = Files.list(parent)) {
            return children.filter(Files::isDirectory).sorted().toList();
        }
    }

    private Optional<EntryPoint> matchMarker(Path dir, List<String> markers, EntryPointType type, Predicate<Path> accepts) {
        return markers.stream().map(dir::resolve).filter(accepts).findFirst()
                .map(target -> new EntryPoint(type, dir, target));
    }

    private String describeMarkers(GraderProperties.EntryPoints markers) {
        List<String> all = new ArrayList<>(markers.getScripts());
        all.addAll(markers.getBinaries());
        all.addAll(markers.getManifests());
        return String.join(", ", all);
    }
}
