package org.panes.util;

import java.text.Collator;
import java.util.Comparator;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locale- and number-aware ordering: {@code page2} sorts before {@code page10}, case is ignored.
 * Strings that differ only in case or leading zeros compare equal, so a stable sort keeps their enumeration order.
 */
public class NaturalOrderComparator implements Comparator<String> {

    public static final NaturalOrderComparator INSTANCE = new NaturalOrderComparator(Locale.getDefault());

    private static final Pattern NUMERIC_PATTERN = Pattern.compile("(\\d+)|(\\D+)");

    private final Collator collator;

    public NaturalOrderComparator(Locale locale) {
        this.collator = Collator.getInstance(locale);
        this.collator.setStrength(Collator.SECONDARY);
    }

    @Override
    public int compare(String s1, String s2) {
        Matcher m1 = NUMERIC_PATTERN.matcher(s1);
        Matcher m2 = NUMERIC_PATTERN.matcher(s2);
        while (true) {
            boolean has1 = m1.find();
            boolean has2 = m2.find();
            if (!has1 || !has2) {
                return Boolean.compare(has1, has2);
            }
            String part1 = m1.group();
            String part2 = m2.group();
            int cmp;
            if (m1.group(1) != null && m2.group(1) != null) {
                cmp = compareNumeric(part1, part2);
            } else {
                cmp = collator.compare(part1, part2);
            }
            if (cmp != 0) {
                return cmp;
            }
        }
    }

    // Digit runs of any length, without overflow
    private static int compareNumeric(String digits1, String digits2) {
        String a = stripLeadingZeros(digits1);
        String b = stripLeadingZeros(digits2);
        if (a.length() != b.length()) {
            return Integer.compare(a.length(), b.length());
        }
        return a.compareTo(b);
    }

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }
}
