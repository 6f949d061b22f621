package org.dxworks.surveyreports.report;

/**
 * Letters appendices A, B, ..., Z, AA, AB, ... (bijective base-26, no zero digit).
 */
public final class AppendixLabeler {

    public static final int ALPHABET_SIZE = 26;

    private AppendixLabeler() {}

    public static String label(int number) {
        return label(number, ALPHABET_SIZE);
    }

    public static String label(int number, int base) {
        if (number < 1) {
            throw new IllegalArgumentException("Appendix number must be positive: " + number);
        }
        if (base < 2 || base > ALPHABET_SIZE) {
            throw new IllegalArgumentException("Base must be between 2 and " + ALPHABET_SIZE + ": " + base);
        }
        StringBuilder letters = new StringBuilder();
        int remaining = number;
        while (remaining > 0) {
            int digit = (remaining - 1) % base;
            letters.append((char) ('A' + digit));
            remaining = (remaining - 1) / base;
        }
        return letters.reverse().toString();
    }
}
