package ch.uzh.ifi.grading.model.constants;

import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.NotImplementedException;

import java.nio.file.Path;
import java.util.List;

/**
 * The runnable form a submission was recognised as. Discovered once during intake and carried through grading.
 */
public enum EntryPointType {
    INTERPRETED, COMPILED_BINARY, WEB_PROJECT;

    @JsonValue
    public String getName() {
        return name().toLowerCase();
    }

    /**
     * Directory the program has to be started from. A script nested in a package is run as a module from the
     * package's parent, so that absolute imports inside the package resolve.
     */
    public Path formWorkingDir(Path root, Path target) {
        if (this.equals(INTERPRETED) && !target.getParent().equals(root))
            return target.getParent().getParent();
        return root;
    }

    public List<String> formRunCommand(String interpreter, Path root, Path target) {
        return switch (this) {
            case INTERPRETED -> target.getParent().equals(root)
                    ? List.of(interpreter, target.getFileName().toString())
                    : List.of(interpreter, "-m", "%s.%s".formatted(target.getParent().getFileName(),
                    FilenameUtils.getBaseName(target.getFileName().toString())));
            case COMPILED_BINARY -> List.of(target.toString());
            case WEB_PROJECT -> throw new NotImplementedException("Web projects are graded in a session");
        };
    }
}
