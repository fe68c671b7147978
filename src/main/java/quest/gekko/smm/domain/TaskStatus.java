package quest.gekko.smm.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Lifecycle of a crawl task. Run logs use the terminal subset
 * (running, success, partial_success, failed).
 */
public enum TaskStatus {
    IDLE("idle"),
    RUNNING("running"),
    SUCCESS("success"),
    PARTIAL_SUCCESS("partial_success"),
    FAILED("failed"),
    RETRYING("retrying");

    private final String code;

    TaskStatus(String code) { this.code = code; }

    @JsonValue
    public String code() { return code; }

    @JsonCreator
    public static TaskStatus fromCode(String code) {
        return Arrays.stream(values())
                .filter(s -> s.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown task status: " + code));
    }

    /** Derives a batch status from per-target outcomes; an empty batch counts as failed. */
    public static TaskStatus ofBatch(int succeeded, int failed) {
        if (succeeded > 0 && failed == 0) return SUCCESS;
        if (succeeded > 0) return PARTIAL_SUCCESS;
        return FAILED;
    }
}
