package nl.bytesoflife.deltatokn.connectivity;

import java.util.Comparator;

/**
 * Orders strings with embedded numbers by numeric value, so {@code R2} sorts before {@code R10}.
 * Strings that compare equal that way fall back to plain string order, which keeps the ordering
 * total ({@code R01} and {@code R1} are not equal).
 */
public final class NaturalOrder implements Comparator<String> {

    public static final NaturalOrder INSTANCE = new NaturalOrder();

    private NaturalOrder() {
    }

    @Override
    public int compare(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            char ca = a.charAt(i);
            char cb = b.charAt(j);
            if (isDigit(ca) && isDigit(cb)) {
                int endA = digitsEnd(a, i);
                int endB = digitsEnd(b, j);
                int cmp = compareDigits(a.substring(i, endA), b.substring(j, endB));
                if (cmp != 0) return cmp;
                i = endA;
                j = endB;
            } else {
                if (ca != cb) return Character.compare(ca, cb);
                i++;
                j++;
            }
        }
        int remaining = Integer.compare(a.length() - i, b.length() - j);
        if (remaining != 0) return remaining;
        return a.compareTo(b);
    }

    private static int compareDigits(String a, String b) {
        String ta = stripLeadingZeros(a);
        String tb = stripLeadingZeros(b);
        if (ta.length() != tb.length()) {
            return Integer.compare(ta.length(), tb.length());
        }
        return ta.compareTo(tb);
    }

    private static String stripLeadingZeros(String digits) {
        int k = 0;
        while (k < digits.length() - 1 && digits.charAt(k) == '0') k++;
        return digits.substring(k);
    }

    private static int digitsEnd(String s, int start) {
        int end = start;
        while (end < s.length() && isDigit(s.charAt(end))) end++;
        return end;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
