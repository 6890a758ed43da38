package com.pickem.service;

import com.pickem.model.GameTypeCatalog;
import com.pickem.model.Outcome;

import java.util.List;
import java.util.Optional;

/**
 * Order of answer options on a published poll. Voter option indexes are
 * resolved back to outcomes through the same list.
 */
public final class PollOptions {

    private static final List<Outcome> WITH_TIE = List.of(Outcome.HOME, Outcome.AWAY, Outcome.TIE);
    private static final List<Outcome> WITHOUT_TIE = List.of(Outcome.HOME, Outcome.AWAY);

    private PollOptions() {
    }

    public static List<Outcome> forGameType(String gameTypeId) {
        return GameTypeCatalog.allowsTie(gameTypeId) ? WITH_TIE : WITHOUT_TIE;
    }

    public static Optional<Outcome> outcomeAt(String gameTypeId, int optionIndex) {
        List<Outcome> options = forGameType(gameTypeId);
        if (optionIndex < 0 || optionIndex >= options.size()) {
            return Optional.empty();
        }
        return Optional.of(options.get(optionIndex));
    }
}
