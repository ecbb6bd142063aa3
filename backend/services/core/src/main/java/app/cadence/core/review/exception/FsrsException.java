package app.cadence.core.review.exception;

public class FsrsException extends RuntimeException {

    private final String code;

    public FsrsException(String message, String code) {
        super(message);
        this.code = code;
    }

    public FsrsException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
