package ch.uzh.ifi.grading.model.constants;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

@Getter
@AllArgsConstructor
public enum ChallengeType {
    EDGE_PROTO("edge-proto"),
    FRONTEND("frontend");

    private final String slug;

    public static Optional<ChallengeType> fromSlug(String slug) {
        return Arrays.stream(values()).filter(type -> type.getSlug().equalsIgnoreCase(slug)).findFirst();
    }

    public static String[] listSupported() {
        return Arrays.stream(values()).map(ChallengeType::getSlug).toList().toArray(new String[]{});
    }

    @JsonValue
    public String getName() {
        return slug;
    }

    public boolean isSession() {
        return this.equals(FRONTEND);
    }
}
