package quest.gekko.smm.service.crawler;

import lombok.Getter;

/** A failed account fetch, with the terminal cause. */
@Getter
public class FetchException extends Exception {

    public enum Reason {
        TIMEOUT,
        CONNECTION,
        HTTP_STATUS,
        /** Malformed payload or missing fields. Never retried. */
        PARSE,
        /** The platform answered but reported an error code of its own. */
        UPSTREAM_ERROR
    }

    private final Reason reason;
    private final Integer httpStatus;

    public FetchException(Reason reason, String message) {
        this(reason, null, message, null);
    }

    public FetchException(Reason reason, String message, Throwable cause) {
        this(reason, null, message, cause);
    }

    public FetchException(Reason reason, Integer httpStatus, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.httpStatus = httpStatus;
    }

    public static FetchException parse(String message) {
        return new FetchException(Reason.PARSE, message);
    }
}
