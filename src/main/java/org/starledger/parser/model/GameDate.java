package org.starledger.parser.model;

import java.util.OptionalInt;

/**
 * Conversion between the in-game calendar ({@code Y.M.D}) and a day index.
 * <p>
 * The calendar has 12 months of 30 days and no leap days. Day 0 is {@code 2200.01.01}.
 */
public final class GameDate {

    public static final int EPOCH_YEAR = 2200;
    public static final int DAYS_PER_YEAR = 360;
    public static final int DAYS_PER_MONTH = 30;

    private GameDate() {
    }

    /**
     * Converts a date string to its day index.
     *
     * @param date A date in {@code Y.M.D} form, e.g. {@code 2231.04.17}.
     * @return The day index, which is negative for dates before the epoch.
     * @throws IllegalArgumentException if the date is not in {@code Y.M.D} form.
     */
    public static int toDays(String date) {
        if (date == null) {
            throw new IllegalArgumentException("Date is null");
        }
        String[] parts = date.trim().split("\\.");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Expected date in Y.M.D form, found '" + date + "'");
        }
        try {
            int year = Integer.parseInt(parts[0]);
            int month = Integer.parseInt(parts[1]);
            int day = Integer.parseInt(parts[2]);
            return (year - EPOCH_YEAR) * DAYS_PER_YEAR + (month - 1) * DAYS_PER_MONTH + (day - 1);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected date in Y.M.D form, found '" + date + "'", e);
        }
    }

    /**
     * Lenient variant of {@link #toDays(String)} for optional date fields.
     *
     * @param date A date string, possibly {@code null} or {@code none}.
     * @return The day index, or empty if the value is not a valid date.
     */
    public static OptionalInt tryToDays(String date) {
        if (date == null || date.isBlank() || "none".equals(date)) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(toDays(date));
        } catch (IllegalArgumentException e) {
            return OptionalInt.empty();
        }
    }

    /**
     * Converts a day index back to a date string.
     *
     * @param days The day index.
     * @return The date in {@code YYYY.MM.DD} form.
     */
    public static String fromDays(int days) {
        int yearOffset = Math.floorDiv(days, DAYS_PER_YEAR);
        int dayOfYear = Math.floorMod(days, DAYS_PER_YEAR);
        int month = dayOfYear / DAYS_PER_MONTH + 1;
        int day = dayOfYear % DAYS_PER_MONTH + 1;
        return String.format("%04d.%02d.%02d", EPOCH_YEAR + yearOffset, month, day);
    }
}
