package ch.uzh.ifi.grading.model;

import ch.uzh.ifi.grading.model.constants.ChallengeType;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

import java.io.Closeable;
import java.nio.file.Path;

/**
 * An extracted upload that is being graded. Owns an exclusive temporary directory which is removed on close.
 */
@Slf4j
@Getter
@AllArgsConstructor
public class Submission implements Closeable {

    private final String studentId;

    private final ChallengeType challenge;

    private final Path tempRoot;

    private final Path extractedRoot;

    private final EntryPoint entryPoint;

    public Path resolveScratch(String name) {
        return tempRoot.resolve(name);
    }

    @Override
    public void close() {
        if (!FileUtils.deleteQuietly(tempRoot.toFile()) && tempRoot.toFile().exists())
            log.error("Failed to remove submission directory {}", tempRoot);
    }
}
