package app.cadence.core.review.exception;

public class VersionMismatchException extends FsrsException {

    private final String expectedVersion;
    private final String actualVersion;

    public VersionMismatchException(String expectedVersion, String actualVersion) {
        super("Card version mismatch: expected " + expectedVersion + ", got " + actualVersion, "VERSION_MISMATCH");
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getExpectedVersion() {
        return expectedVersion;
    }

    public String getActualVersion() {
        return actualVersion;
    }
}
