package ch.uzh.ifi.grading.model.constants;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum FailureKind {
    CONFIGURATION_ERROR(Scope.RUN, HttpStatus.INTERNAL_SERVER_ERROR),
    INTERNAL_ERROR(Scope.RUN, HttpStatus.INTERNAL_SERVER_ERROR),

    PAYLOAD_TOO_LARGE(Scope.RUN, HttpStatus.PAYLOAD_TOO_LARGE),
    INVALID_ARCHIVE(Scope.RUN, HttpStatus.BAD_REQUEST),
    PATH_TRAVERSAL(Scope.RUN, HttpStatus.BAD_REQUEST),
    NO_ENTRY_POINT(Scope.RUN, HttpStatus.BAD_REQUEST),
    SECURITY_VIOLATION(Scope.RUN, HttpStatus.BAD_REQUEST),

    FIXTURE_MISSING(Scope.DATASET, HttpStatus.OK),
    NONZERO_EXIT(Scope.DATASET, HttpStatus.OK),
    INVALID_OUTPUT(Scope.DATASET, HttpStatus.OK),
    RESOURCE_LIMIT(Scope.DATASET, HttpStatus.OK),
    TIMEOUT(Scope.DATASET, HttpStatus.OK),
    SPAWN_ERROR(Scope.DATASET, HttpStatus.OK),
    DEPENDENCY_INSTALL_FAILED(Scope.DATASET, HttpStatus.OK),
    SERVICE_NOT_READY(Scope.DATASET, HttpStatus.OK);

    public enum Scope {RUN, DATASET}

    private final Scope scope;

    private final HttpStatus status;

    @JsonValue
    public String getName() {
        return name().toLowerCase();
    }

    public boolean isTerminal() {
        return scope.equals(Scope.RUN);
    }
}
