package app.cadence.core.review.exception;

public class InvalidCardException extends FsrsException {

    public InvalidCardException(String message) {
        super(message, "INVALID_CARD");
    }
}
