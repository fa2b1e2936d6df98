package com.dcruver.litsync.extract;

/**
 * Heuristics that reject garbage text from broken or scanned PDFs.
 * <p>
 * Text passes when it is longer than 100 characters, its first 100 words average 2 to 30
 * characters, at least half of its first 1000 characters are ASCII, and its first 500
 * characters contain a space plus either a period or the text has over 100 words.
 */
public final class TextQualityCheck {

    private TextQualityCheck() {
    }

    /**
     * @return null if the text is usable, otherwise why it was rejected
     */
    public static String rejectionReason(String text) {
        if (text == null || text.strip().length() <= 100) {
            return "too short (" + (text == null ? 0 : text.strip().length()) + " chars)";
        }

        String[] words = text.strip().split("\\s+");
        int sample = Math.min(words.length, 100);
        long letters = 0;
        for (int i = 0; i < sample; i++) {
            letters += words[i].length();
        }
        double avgWordLength = (double) letters / sample;

        String head = text.substring(0, Math.min(text.length(), 1000));
        long ascii = head.chars().filter(c -> c < 128).count();
        double asciiRatio = (double) ascii / head.length();

        if (avgWordLength < 2 || avgWordLength > 30 || asciiRatio < 0.5) {
            return String.format("failed validation (avg word len %.1f, ASCII ratio %.2f)", avgWordLength, asciiRatio);
        }

        String opening = text.substring(0, Math.min(text.length(), 500));
        boolean hasSpaces = opening.indexOf(' ') >= 0;
        boolean hasPeriods = opening.indexOf('.') >= 0;
        if (!hasSpaces || !(hasPeriods || words.length > 100)) {
            return "no sentence structure";
        }
        return null;
    }

    /**
     * Rough confidence in [0, 1] for text that passed, growing with length.
     */
    public static double confidence(String text) {
        int words = text.strip().split("\\s+").length;
        return Math.min(1.0, 0.5 + words / 4000.0);
    }
}
