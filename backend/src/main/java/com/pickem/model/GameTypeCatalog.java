package com.pickem.model;

/**
 * Fixed catalogue of game types seeded into the {@code gametype} table.
 */
public enum GameTypeCatalog {
    REG("Regular Season"),
    WC("Wild Card Round"),
    DIV("Divisional Round"),
    CON("Conference Championship"),
    SB("Super Bowl");

    private final String displayName;

    GameTypeCatalog(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getId() {
        return name();
    }

    /**
     * Only regular season games can end in a tie.
     */
    public static boolean allowsTie(String gameTypeId) {
        return REG.name().equals(gameTypeId);
    }
}
