package io.satnet.bundle;

public enum BundleOrder {
    /**
     * No ordering guarantee.
     */
    NONE,
    /**
     * Highest priority first, older copies first within a priority.
     */
    PRIORITY,
    /**
     * Oldest stored copy first.
     */
    AGE,
    /**
     * Smallest bundle first.
     */
    SIZE
}
