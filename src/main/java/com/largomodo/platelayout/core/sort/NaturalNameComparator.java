package com.largomodo.platelayout.core.sort;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders names the way people count: "item2" before "item10".
 * <p>
 * Names are split into alternating runs of digits and non-digits and compared run by run.
 * Digit runs compare by numeric value (of any length, leading zeros ignored), other runs
 * case-insensitively. A digit run sorts before a text run at the same position. When all runs
 * match, the name with fewer runs comes first, then fewer leading zeros, and finally the raw
 * strings are compared so the order stays total.
 * <p>
 * Stateless, safe for concurrent use.
 */
public class NaturalNameComparator implements Comparator<String> {

    public static final NaturalNameComparator INSTANCE = new NaturalNameComparator();

    @Override
    public int compare(String s1, String s2) {
        List<String> runs1 = split(s1);
        List<String> runs2 = split(s2);

        int shared = Math.min(runs1.size(), runs2.size());
        int zeroTieBreak = 0;
        for (int i = 0; i < shared; i++) {
            String r1 = runs1.get(i);
            String r2 = runs2.get(i);
            boolean digits1 = isDigitRun(r1);
            boolean digits2 = isDigitRun(r2);

            if (digits1 && digits2) {
                int cmp = compareNumeric(r1, r2);
                if (cmp != 0) {
                    return cmp;
                }
                if (zeroTieBreak == 0) {
                    // "01" vs "1": remember, only used if nothing else differs
                    zeroTieBreak = Integer.compare(r1.length(), r2.length());
                }
            } else if (digits1 != digits2) {
                return digits1 ? -1 : 1;
            } else {
                int cmp = r1.compareToIgnoreCase(r2);
                if (cmp != 0) {
                    return cmp;
                }
            }
        }

        if (runs1.size() != runs2.size()) {
            return Integer.compare(runs1.size(), runs2.size());
        }
        if (zeroTieBreak != 0) {
            return zeroTieBreak;
        }
        return s1.compareTo(s2);
    }

    private static List<String> split(String name) {
        List<String> runs = new ArrayList<>();
        int start = 0;
        for (int i = 1; i <= name.length(); i++) {
            if (i == name.length() || Character.isDigit(name.charAt(i)) != Character.isDigit(name.charAt(i - 1))) {
                runs.add(name.substring(start, i));
                start = i;
            }
        }
        return runs;
    }

    private static boolean isDigitRun(String run) {
        return !run.isEmpty() && Character.isDigit(run.charAt(0));
    }

    // Compares digit strings without parsing, so arbitrarily long runs cannot overflow
    private static int compareNumeric(String r1, String r2) {
        String n1 = stripLeadingZeros(r1);
        String n2 = stripLeadingZeros(r2);
        if (n1.length() != n2.length()) {
            return Integer.compare(n1.length(), n2.length());
        }
        for (int i = 0; i < n1.length(); i++) {
            int d = Character.digit(n1.charAt(i), 10) - Character.digit(n2.charAt(i), 10);
            if (d != 0) {
                return d;
            }
        }
        return 0;
    }

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }
}
