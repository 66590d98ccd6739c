package ch.uzh.ifi.grading.model.constants;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * External tools able to restrict a child's namespaces. Ordered by preference, strongest first.
 */
@Getter
@AllArgsConstructor
public enum IsolationTool {
    FIREJAIL("firejail"),
    BUBBLEWRAP("bwrap"),
    NONE(null);

    private final String executable;

    @JsonValue
    public String getName() {
        return name().toLowerCase();
    }

    public boolean isAvailable() {
        return executable != null;
    }

    public List<String> formWrapper(Path workingDir, boolean allowNetwork) {
        List<String> wrapper = new ArrayList<>();
        switch (this) {
            case FIREJAIL -> {
                wrapper.addAll(List.of(executable, "--quiet", "--private-tmp", "--private-dev", "--noroot",
                        "--whitelist=" + workingDir, "--read-only=/usr", "--read-only=/lib", "--read-only=/lib64"));
                if (!allowNetwork)
                    wrapper.add("--net=none");
            }
            case BUBBLEWRAP -> {
                wrapper.addAll(List.of(executable,
                        "--ro-bind", "/usr", "/usr", "--ro-bind-try", "/lib", "/lib", "--ro-bind-try", "/lib64", "/lib64",
                        "--ro-bind-try", "/bin", "/bin", "--ro-bind-try", "/sbin", "/sbin", "--ro-bind-try", "/etc", "/etc",
                        "--bind", workingDir.toString(), workingDir.toString(), "--tmpfs", "/tmp",
                        "--proc", "/proc", "--dev", "/dev", "--unshare-pid", "--unshare-ipc", "--die-with-parent",
                        "--chdir", workingDir.toString()));
                if (!allowNetwork)
                    wrapper.add("--unshare-net");
            }
            case NONE -> {
            }
        }
        return wrapper;
    }
}
