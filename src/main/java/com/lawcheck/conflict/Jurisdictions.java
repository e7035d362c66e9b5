package com.lawcheck.conflict;

import java.util.Locale;

/**
 * Jurisdiction codes form a hierarchy by prefix: {@code US} is above
 * {@code US-CA}, which is above {@code US-CA/SF}. Separators are
 * {@code - / . :}; comparison ignores case.
 */
public final class Jurisdictions {

    private static final String SEPARATORS = "-/.:";

    private Jurisdictions() {
    }

    public static boolean isAncestor(String higher, String lower) {
        if (higher == null || lower == null) {
            return false;
        }
        String h = normalize(higher);
        String l = normalize(lower);
        return l.length() > h.length()
            && l.startsWith(h)
            && SEPARATORS.indexOf(l.charAt(h.length())) >= 0;
    }

    /** Same jurisdiction, or one contains the other. */
    public static boolean overlap(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return normalize(a).equals(normalize(b)) || isAncestor(a, b) || isAncestor(b, a);
    }

    /** Whether the two jurisdictions sit at different levels of one hierarchy. */
    public static boolean ranked(String a, String b) {
        return isAncestor(a, b) || isAncestor(b, a);
    }

    /** The same jurisdiction, or at least one side does not name one. */
    public static boolean sameOrUnspecified(String a, String b) {
        return a == null || b == null || normalize(a).equals(normalize(b));
    }

    private static String normalize(String jurisdiction) {
        return jurisdiction.trim().toUpperCase(Locale.ROOT);
    }
}
