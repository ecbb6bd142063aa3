package app.cadence.core.review.algorithm;

import java.util.List;

public final class Fsrs6Defaults {

    public static final String VERSION = "6.1.1";
    public static final String ALGORITHM_NAME = "FSRS6";
    public static final int PARAMETER_COUNT = 21;

    public static final List<Double> WEIGHTS = List.of(
            0.212, 1.2931, 2.3065, 8.2956, 6.4133, 0.8334, 3.0194, 0.001, 1.8722, 0.1666,
            0.796, 1.4835, 0.0614, 0.2629, 1.6483, 0.6014, 1.8729, 0.5425, 0.0912, 0.0658, 0.1542
    );

    public static final double REQUEST_RETENTION = 0.9;
    public static final double MIN_REQUEST_RETENTION = 0.5;
    public static final double MAX_REQUEST_RETENTION = 0.99;

    // one year by default, five years at most
    public static final double MAXIMUM_INTERVAL = 365;
    public static final double MAX_MAXIMUM_INTERVAL = 1825;

    public static final boolean ENABLE_FUZZ = true;
    public static final boolean SHORT_TERM_MEMORY_ENABLED = true;
    public static final boolean LONG_TERM_STABILITY_ENABLED = true;

    private Fsrs6Defaults() {
    }
}
