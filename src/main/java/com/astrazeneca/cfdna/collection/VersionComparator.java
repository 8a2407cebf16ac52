package com.astrazeneca.cfdna.collection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Compares strings the way version numbers are compared: runs of digits are compared numerically and runs
 * of letters lexically, separators are skipped. So "chr2:100" sorts before "chr10:50" and "7.10" after "7.9".
 * Strings with equal runs are ordered by their plain string value to stay consistent with equals.
 */
public final class VersionComparator implements Comparator<String> {
    public static final VersionComparator INSTANCE = new VersionComparator();

    private VersionComparator() {
    }

    @Override
    public int compare(String first, String second) {
        List<String> left = tokenize(first);
        List<String> right = tokenize(second);

        for (int i = 0; i < left.size() && i < right.size(); i++) {
            String l = left.get(i);
            String r = right.get(i);
            boolean leftNumeric = Character.isDigit(l.charAt(0));
            boolean rightNumeric = Character.isDigit(r.charAt(0));

            int cmp;
            if (leftNumeric && rightNumeric) {
                cmp = compareNumeric(l, r);
            } else if (leftNumeric != rightNumeric) {
                // letters go before digits
                cmp = leftNumeric ? 1 : -1;
            } else {
                cmp = l.compareTo(r);
            }
            if (cmp != 0) {
                return cmp;
            }
        }
        if (left.size() != right.size()) {
            return Integer.compare(left.size(), right.size());
        }
        return first.compareTo(second);
    }

    /**
     * Splits string to the runs of digits and runs of letters, everything else is treated as a separator.
     * @param value string to split
     * @return list of runs in order of appearance
     */
    static List<String> tokenize(String value) {
        List<String> tokens = new ArrayList<>();
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (Character.isDigit(c)) {
                int start = i;
                while (i < value.length() && Character.isDigit(value.charAt(i))) {
                    i++;
                }
                tokens.add(value.substring(start, i));
            } else if (Character.isLetter(c)) {
                int start = i;
                while (i < value.length() && Character.isLetter(value.charAt(i))) {
                    i++;
                }
                tokens.add(value.substring(start, i));
            } else {
                i++;
            }
        }
        return tokens;
    }

    private static int compareNumeric(String l, String r) {
        String left = stripLeadingZeros(l);
        String right = stripLeadingZeros(r);
        if (left.length() != right.length()) {
            return Integer.compare(left.length(), right.length());
        }
        return left.compareTo(right);
    }

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }
}
