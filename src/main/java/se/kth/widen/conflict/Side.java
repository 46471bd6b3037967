package se.kth.widen.conflict;

/** The two competing sides of a conflict region, in source order. */
public enum Side {
    OURS,
    THEIRS;
}
