package com.spreadsheet.calc.engine.reference;

import com.spreadsheet.calc.exceptions.InvalidReferenceException;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellRange;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between (row, col) addresses and A1 text.
 * Columns use bijective base 26 (A..Z, AA..ZZ, AAA...), rows are 1-based in text.
 */
public final class ReferenceResolver {

    // "$AB$12" -> groups: "$", "AB", "$", "12"
    private static final Pattern A1_PATTERN = Pattern.compile("^(\\$?)([A-Z]+)(\\$?)([0-9]+)$");

    // Keeps column and row indices inside int range
    private static final int MAX_COLUMN_LETTERS = 6;
    private static final int MAX_ROW_DIGITS = 9;

    private ReferenceResolver() {
    }

    /**
     * 0 -> "A", 25 -> "Z", 26 -> "AA", 701 -> "ZZ", 702 -> "AAA".
     */
    public static String columnToLetters(int col) {
        if (col < 0) {
            throw new IllegalArgumentException("Negative column index: " + col);
        }
        StringBuilder letters = new StringBuilder();
        int remaining = col;
        while (remaining >= 0) {
            letters.append((char) ('A' + remaining % 26));
            remaining = remaining / 26 - 1;
        }
        return letters.reverse().toString();
    }

    /**
     * "A" -> 0, "Z" -> 25, "AA" -> 26. Letters must be upper case.
     */
    public static int lettersToColumn(String letters) {
        if (letters == null || letters.isEmpty() || letters.length() > MAX_COLUMN_LETTERS) {
            throw new InvalidReferenceException("Invalid column letters: " + letters);
        }
        int index = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = letters.charAt(i);
            if (c < 'A' || c > 'Z') {
                throw new InvalidReferenceException("Invalid column letters: " + letters);
            }
            index = index * 26 + (c - 'A' + 1);
        }
        return index - 1;
    }

    public static String addressToText(CellAddress address) {
        StringBuilder text = new StringBuilder();
        if (address.isAbsoluteCol()) {
            text.append('$');
        }
        text.append(columnToLetters(address.getCol()));
        if (address.isAbsoluteRow()) {
            text.append('$');
        }
        text.append(address.getRow() + 1);
        return text.toString();
    }

    /**
     * Parses "[$]COL[$]ROW", e.g. "B5", "$B$5", "AA10".
     *
     * @throws InvalidReferenceException if the text is not a well-formed reference
     */
    public static CellAddress textToAddress(String text) {
        if (text == null) {
            throw new InvalidReferenceException("Missing reference");
        }
        Matcher matcher = A1_PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new InvalidReferenceException("Invalid A1 reference: " + text);
        }
        String digits = matcher.group(4);
        if (digits.length() > MAX_ROW_DIGITS) {
            throw new InvalidReferenceException("Row number too large: " + text);
        }
        int row = Integer.parseInt(digits) - 1;
        if (row < 0) {
            throw new InvalidReferenceException("Row numbers start at 1: " + text);
        }
        int col = lettersToColumn(matcher.group(2));
        return new CellAddress(row, col, "$".equals(matcher.group(3)), "$".equals(matcher.group(1)));
    }

    /**
     * Parses "A1:B10" (corners in any order) or a single reference, which yields a 1x1 range.
     */
    public static CellRange textToRange(String text) {
        if (text == null) {
            throw new InvalidReferenceException("Missing range");
        }
        int colon = text.indexOf(':');
        if (colon < 0) {
            CellAddress single = textToAddress(text.trim());
            return new CellRange(single, single);
        }
        return new CellRange(
                textToAddress(text.substring(0, colon).trim()),
                textToAddress(text.substring(colon + 1).trim()));
    }

    /**
     * Every address covered by the range, row-major, corners normalized.
     * The returned sequence is lazy and can be walked any number of times.
     */
    public static Iterable<CellAddress> expandRange(CellRange range) {
        return range;
    }
}
