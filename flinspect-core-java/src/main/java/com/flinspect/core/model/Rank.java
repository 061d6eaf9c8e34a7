package com.flinspect.core.model;

/** Rank helpers. Ranks are non-negative; {@link #UNKNOWN} marks a rank that cannot be recovered. */
public final class Rank {

    public static final int UNKNOWN = -1;

    private Rank() {}

    public static boolean isKnown(int rank) {
        return rank >= 0;
    }

    /** Unknown on either side matches. */
    public static boolean matches(int a, int b) {
        return !isKnown(a) || !isKnown(b) || a == b;
    }

    public static String format(int rank) {
        return isKnown(rank) ? Integer.toString(rank) : "?";
    }
}
