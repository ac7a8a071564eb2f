package db.flatfile.exec;

import java.util.Comparator;

/**
 * Natural ("human") ordering of text: "img2" &lt; "img10".
 *
 * Each string is split into alternating runs of ASCII digits and non-digits.
 * Runs are compared pairwise left to right: two digit runs by numeric value
 * (arbitrary length, leading zeros ignored), anything else by UTF-16 code
 * unit; a digit run against a text run is decided by their first chars.
 * Case sensitive. A string that is a prefix of the other sorts first.
 */
public final class NaturalOrderComparator implements Comparator<String> {
    public static final NaturalOrderComparator INSTANCE = new NaturalOrderComparator();

    @Override
    public int compare(String a, String b) {
        int i = 0, j = 0;
        int lenA = a.length(), lenB = b.length();
        while (i < lenA && j < lenB) {
            char ca = a.charAt(i);
            char cb = b.charAt(j);
            if (isDigit(ca) && isDigit(cb)) {
                int endA = digitRunEnd(a, i);
                int endB = digitRunEnd(b, j);
                int cmp = compareDigitRuns(a, i, endA, b, j, endB);
                if (cmp != 0) return cmp;
                i = endA;
                j = endB;
            } else if (isDigit(ca) || isDigit(cb)) {
                return Character.compare(ca, cb);
            } else {
                int endA = textRunEnd(a, i);
                int endB = textRunEnd(b, j);
                int cmp = compareTextRuns(a, i, endA, b, j, endB);
                if (cmp != 0) return cmp;
                i = endA;
                j = endB;
            }
        }
        return Integer.compare(lenA - i, lenB - j);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static int digitRunEnd(String s, int from) {
        int k = from;
        while (k < s.length() && isDigit(s.charAt(k))) k++;
        return k;
    }

    private static int textRunEnd(String s, int from) {
        int k = from;
        while (k < s.length() && !isDigit(s.charAt(k))) k++;
        return k;
    }

    private static int compareDigitRuns(String a, int startA, int endA, String b, int startB, int endB) {
        while (startA < endA - 1 && a.charAt(startA) == '0') startA++;
        while (startB < endB - 1 && b.charAt(startB) == '0') startB++;
        int lenCmp = Integer.compare(endA - startA, endB - startB);
        if (lenCmp != 0) return lenCmp;
        for (int k = 0; k < endA - startA; k++) {
            int cmp = Character.compare(a.charAt(startA + k), b.charAt(startB + k));
            if (cmp != 0) return cmp;
        }
        return 0;
    }

    private static int compareTextRuns(String a, int startA, int endA, String b, int startB, int endB) {
        int lenA = endA - startA, lenB = endB - startB;
        int n = Math.min(lenA, lenB);
        for (int k = 0; k < n; k++) {
            int cmp = Character.compare(a.charAt(startA + k), b.charAt(startB + k));
            if (cmp != 0) return cmp;
        }
        if (lenA == lenB) return 0;
        // Shorter run is followed by a digit or by the end of its string
        int nextA = startA + n, nextB = startB + n;
        if (lenA < lenB) {
            return nextA < a.length() ? Character.compare(a.charAt(nextA), b.charAt(nextB)) : -1;
        }
        return nextB < b.length() ? Character.compare(a.charAt(nextA), b.charAt(nextB)) : 1;
    }
}
