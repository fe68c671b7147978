package quest.gekko.smm.service.crawler;

/** One failed request attempt, carried through the retry template. */
class UpstreamFailure extends RuntimeException {

    private final FetchException.Reason reason;
    private final Integer httpStatus;

    UpstreamFailure(FetchException.Reason reason, Integer httpStatus, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.httpStatus = httpStatus;
    }

    Integer httpStatus() {
        return httpStatus;
    }

    FetchException toFetchException() {
        return new FetchException(reason, httpStatus, getMessage(), getCause());
    }
}
