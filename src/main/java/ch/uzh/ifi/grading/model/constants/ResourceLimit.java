package ch.uzh.ifi.grading.model.constants;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Per-process ceilings, named after the {@code prlimit} options that set them.
 */
@Getter
@AllArgsConstructor
public enum ResourceLimit {
    CPU("--cpu"),
    ADDRESS_SPACE("--as"),
    FILE_SIZE("--fsize"),
    PROCESSES("--nproc"),
    OPEN_FILES("--nofile"),
    CORE("--core");

    private final String option;

    @JsonValue
    public String getName() {
        return name().toLowerCase();
    }

    public String formOption(long value) {
        return "%s=%d".formatted(option, value);
    }
}
