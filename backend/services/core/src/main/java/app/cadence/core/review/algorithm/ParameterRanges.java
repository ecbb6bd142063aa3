package app.cadence.core.review.algorithm;

/**
 * Accepted interval for each of the 21 weights. Values outside are replaced by the default weight.
 */
public final class ParameterRanges {

    private static final double[][] RANGES = {
            {0.1, 2.0},   // w0  initial stability, again
            {0.5, 3.0},   // w1  initial stability, hard
            {1.0, 5.0},   // w2  initial stability, good
            {3.0, 15.0},  // w3  initial stability, easy
            {3.0, 10.0},  // w4  initial difficulty
            {0.5, 2.0},   // w5  difficulty weight
            {0.5, 5.0},   // w6  difficulty change rate
            {0.0, 0.5},   // w7  difficulty decay
            {0.5, 3.0},   // w8  stability growth
            {0.0, 1.0},   // w9  stability decay
            {0.5, 2.0},   // w10 forget stability
            {0.5, 3.0},   // w11 forget difficulty exponent
            {0.0, 2.0},   // w12 forget stability exponent
            {0.0, 1.0},   // w13 forget elapsed exponent
            {0.0, 2.0},   // w14 recall stability growth
            {0.5, 1.5},   // w15 hard penalty
            {1.0, 3.0},   // w16 easy bonus
            {0.0, 1.0},   // w17 short-term memory factor
            {0.0, 0.5},   // w18 short-term memory decay
            {0.0, 0.5},   // w19 long-term stability factor
            {0.0, 0.5}    // w20 long-term stability growth
    };

    private ParameterRanges() {
    }

    public static double min(int index) {
        return RANGES[index][0];
    }

    public static double max(int index) {
        return RANGES[index][1];
    }

    public static boolean contains(int index, double value) {
        return !Double.isNaN(value) && value >= min(index) && value <= max(index);
    }

    public static double clamp(int index, double value) {
        return Math.max(min(index), Math.min(max(index), value));
    }
}
