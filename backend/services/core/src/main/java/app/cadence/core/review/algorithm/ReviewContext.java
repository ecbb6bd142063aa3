package app.cadence.core.review.algorithm;

public record ReviewContext(
        Integer responseMs
) {
    public static final ReviewContext EMPTY = new ReviewContext(null);
}
