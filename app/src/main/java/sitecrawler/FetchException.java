package sitecrawler;

// A fetch that gave up, either after exhausting retries or on a terminal answer.
public class FetchException extends Exception {

    private final FetchErrorKind kind;
    private final Integer statusCode;
    private final int attempts;

    public FetchException(FetchErrorKind kind, String detail, Integer statusCode, int attempts) {
        super(detail);
        this.kind = kind;
        this.statusCode = statusCode;
        this.attempts = attempts;
    }

    public FetchException(FetchErrorKind kind, String detail, int attempts, Throwable cause) {
        super(detail, cause);
        this.kind = kind;
        this.statusCode = null;
        this.attempts = attempts;
    }

    public FetchErrorKind kind() {
        return kind;
    }

    // HTTP status of the last response, null when none was received.
    public Integer statusCode() {
        return statusCode;
    }

    public int attempts() {
        return attempts;
    }

    public String detail() {
        return getMessage();
    }
}
