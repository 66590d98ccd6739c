package ch.uzh.ifi.grading.model;

import ch.uzh.ifi.grading.model.constants.EntryPointType;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

@Value
public class EntryPoint {
    EntryPointType type;
    /**
     * Directory in which the marker was found, treated as the root of the candidate's project.
     */
    Path root;
    Path target;

    public Path getWorkingDir() {
        return type.formWorkingDir(root, target);
    }

    public List<String> formRunCommand(String interpreter) {
        return type.formRunCommand(interpreter, root, target);
    }
}
