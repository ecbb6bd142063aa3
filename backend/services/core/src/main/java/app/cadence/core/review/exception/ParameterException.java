package app.cadence.core.review.exception;

/**
 * Input that cannot be repaired safely, such as an unknown rating. Retrying with the same input fails again.
 */
public class ParameterException extends FsrsException {

    private final String parameterName;
    private final transient Object value;

    public ParameterException(String message, String parameterName, Object value) {
        super(message, "PARAMETER_ERROR");
        this.parameterName = parameterName;
        this.value = value;
    }

    public String getParameterName() {
        return parameterName;
    }

    public Object getValue() {
        return value;
    }
}
