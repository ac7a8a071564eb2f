package db.flatfile.query;

import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Key values are plain text; these helpers derive the numeric views used for
 * automatic keys and duplicate detection.
 */
final class Keys {
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    private Keys() {}

    /**
     * Integer value of the leading "[+-]digits" prefix after trimming, 0 when
     * there is none ("12abc" is 12, "abc" is 0). Saturates at the long bounds.
     */
    static long numericValue(String key) {
        if (key == null) return 0;
        String s = key.trim();
        int i = 0;
        boolean negative = false;
        if (i < s.length() && (s.charAt(i) == '+' || s.charAt(i) == '-')) {
            negative = s.charAt(i) == '-';
            i++;
        }
        int digitsStart = i;
        while (i < s.length() && Character.isDigit(s.charAt(i)) && s.charAt(i) < 128) i++;
        if (i == digitsStart) return 0;
        BigInteger value = new BigInteger(s.substring(digitsStart, i));
        if (negative) value = value.negate();
        if (value.compareTo(BigInteger.valueOf(Long.MAX_VALUE)) > 0) return Long.MAX_VALUE;
        if (value.compareTo(BigInteger.valueOf(Long.MIN_VALUE)) < 0) return Long.MIN_VALUE;
        return value.longValue();
    }

    /** Integer literals in plain decimal form ("012" -> "12"); other text unchanged. */
    static String canonical(String key) {
        if (key == null) return "";
        String s = key.trim();
        if (INTEGER.matcher(s).matches()) return new BigInteger(s).toString();
        return key;
    }
}
