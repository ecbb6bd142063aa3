package app.cadence.core.review.domain;

import app.cadence.core.review.exception.ParameterException;

public enum Rating {
    AGAIN(1), HARD(2), GOOD(3), EASY(4);

    private final int code;
    Rating(int code) { this.code = code; }
    public int code() { return code; }

    public boolean isRecalled() {
        return code >= GOOD.code;
    }

    public static Rating fromCode(int code) {
        for (Rating r : values()) {
            if (r.code == code) return r;
        }
        throw new ParameterException("Rating must be 1, 2, 3, or 4", "rating", code);
    }
}
