package quest.gekko.smm.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/** Outcome recorded with a follower snapshot. */
public enum SnapshotStatus {
    SUCCESS("success"),
    PARTIAL_SUCCESS("partial_success"),
    FAILED("failed");

    private final String code;

    SnapshotStatus(String code) { this.code = code; }

    @JsonValue
    public String code() { return code; }

    @JsonCreator
    public static SnapshotStatus fromCode(String code) {
        return Arrays.stream(values())
                .filter(s -> s.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown snapshot status: " + code));
    }
}
