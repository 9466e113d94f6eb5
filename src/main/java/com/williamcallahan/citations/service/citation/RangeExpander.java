package com.williamcallahan.citations.service.citation;

import java.util.List;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands numeric citation text such as {@code [3-5]} or {@code [1, 2, 8]} into the sorted,
 * distinct reference numbers it denotes.
 */
public class RangeExpander {

    private static final Pattern RANGE_PATTERN = Pattern.compile("(\\d+)\\s*[-–—]\\s*(\\d+)");
    private static final Pattern NUMBER_PATTERN = Pattern.compile("\\d+");
    private static final int MAX_DIGITS = 9;

    private final int rangeSpanLimit;
    private final int maxCitationNumber;

    public RangeExpander() {
        this(50, 1000);
    }

    /**
     * @param rangeSpanLimit ranges with {@code end - start} at or above this are not expanded
     * @param maxCitationNumber exclusive upper bound for accepted numbers
     */
    public RangeExpander(int rangeSpanLimit, int maxCitationNumber) {
        this.rangeSpanLimit = rangeSpanLimit;
        this.maxCitationNumber = maxCitationNumber;
    }

    /**
     * Expands citation text to reference numbers.
     *
     * @param text citation text, e.g. {@code [3-5,8]}
     * @return ascending distinct numbers, empty when the text is not numeric
     */
    public List<Integer> expand(String text) {
        if (text == null || text.isEmpty() || !isNumberLike(text)) {
            return List.of();
        }

        TreeSet<Integer> numbers = new TreeSet<>();
        Matcher rangeMatcher = RANGE_PATTERN.matcher(text);
        while (rangeMatcher.find()) {
            int start = parseBounded(rangeMatcher.group(1));
            int end = parseBounded(rangeMatcher.group(2));
            if (start >= 0 && end > start && end - start < rangeSpanLimit) {
                for (int number = start; number <= end; number++) {
                    if (isCitationNumber(number)) {
                        numbers.add(number);
                    }
                }
            }
        }

        String withoutRanges = RANGE_PATTERN.matcher(text).replaceAll(" ");
        Matcher numberMatcher = NUMBER_PATTERN.matcher(withoutRanges);
        while (numberMatcher.find()) {
            int number = parseBounded(numberMatcher.group());
            if (isCitationNumber(number)) {
                numbers.add(number);
            }
        }

        return List.copyOf(numbers);
    }

    /**
     * Author-year citations carry letters; years and page numbers in them are not references.
     */
    static boolean isNumberLike(String text) {
        for (int index = 0; index < text.length(); index++) {
            if (Character.isLetter(text.charAt(index))) {
                return false;
            }
        }
        return true;
    }

    private boolean isCitationNumber(int number) {
        return number > 0 && number < maxCitationNumber;
    }

    // Overlong digit runs are noise; -1 keeps them out of every range and bound check.
    private static int parseBounded(String digits) {
        if (digits.length() > MAX_DIGITS) {
            return -1;
        }
        return Integer.parseInt(digits);
    }
}
