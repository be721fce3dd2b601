package com.example.cruscotto.domain.model;

/**
 * Outcome of the plausibility checks run on one extraction attempt.
 */
public record ValidationVerdict(boolean accepted, String reason) {

    private static final ValidationVerdict ACCEPTED = new ValidationVerdict(true, "ok");

    public static ValidationVerdict accept() {
        return ACCEPTED;
    }

    public static ValidationVerdict reject(String reason) {
        return new ValidationVerdict(false, reason);
    }
}
