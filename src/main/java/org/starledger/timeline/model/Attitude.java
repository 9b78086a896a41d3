package org.starledger.timeline.model;

import java.util.Locale;

/**
 * Attitude of a country towards the observer, ordered by how much it reveals.
 * <p>
 * Disclosure is monotonic: an attitude that reveals military information also reveals technology,
 * economy and demographics.
 */
public enum Attitude {
    IS_PLAYER(4),
    FRIENDLY(4),
    LOYAL(4),
    DISLOYAL(4),
    OVERLORD(4),
    PROTECTIVE(3),
    CORDIAL(2),
    RECEPTIVE(2),
    NEUTRAL(1),
    WARY(1),
    UNKNOWN(0),
    HOSTILE(0),
    SUSPICIOUS(0),
    DOMINEERING(0),
    THREATENED(0),
    ALARMED(0),
    BELLIGERENT(0),
    IMPERIOUS(0);

    private final int rank;

    Attitude(int rank) {
        this.rank = rank;
    }

    public boolean revealsMilitary() {
        return rank >= 4;
    }

    public boolean revealsTechnology() {
        return rank >= 3;
    }

    public boolean revealsEconomy() {
        return rank >= 2;
    }

    public boolean revealsDemographics() {
        return rank >= 1;
    }

    /**
     * @return The attitude as written in snapshots, e.g. {@code friendly}.
     */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param disclosure The requested level.
     * @return Whether this attitude grants it. {@link Disclosure#CONTACT} is never granted by attitude alone.
     */
    public boolean reveals(Disclosure disclosure) {
        return switch (disclosure) {
            case CONTACT -> false;
            case DEMOGRAPHY -> revealsDemographics();
            case ECONOMY -> revealsEconomy();
            case TECHNOLOGY -> revealsTechnology();
            case MILITARY -> revealsMilitary();
        };
    }

    /**
     * Parses an attitude as written in snapshots, e.g. {@code friendly}.
     *
     * @param text The attitude text, possibly {@code null}.
     * @return The attitude, {@link #UNKNOWN} for unrecognized values.
     */
    public static Attitude parse(String text) {
        if (text == null) {
            return UNKNOWN;
        }
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
