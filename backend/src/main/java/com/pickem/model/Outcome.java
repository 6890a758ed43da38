package com.pickem.model;

/**
 * Three-way result of a game, plus a sentinel for games without a final result.
 * Declaration order of HOME, AWAY, TIE is the order poll options are rendered in.
 */
public enum Outcome {
    HOME,
    AWAY,
    TIE,
    NOT_FINISHED;

    /**
     * Derives the outcome from a home-minus-away result.
     *
     * @param result home score minus away score, or null when the game has not finished
     * @return the outcome for that result
     */
    public static Outcome fromResult(Integer result) {
        if (result == null) {
            return NOT_FINISHED;
        }
        if (result == 0) {
            return TIE;
        }
        return result < 0 ? AWAY : HOME;
    }

    public boolean isFinal() {
        return this != NOT_FINISHED;
    }
}
