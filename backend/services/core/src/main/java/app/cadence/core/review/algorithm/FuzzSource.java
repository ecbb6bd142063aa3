package app.cadence.core.review.algorithm;

@FunctionalInterface
public interface FuzzSource {

    /**
     * Uniform sample in {@code [-1, 1)}.
     */
    double nextSigned();
}
