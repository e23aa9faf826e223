package io.satnet.bundle;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * Custody status of one stored copy of a bundle. Node-local bookkeeping, never part of
 * the bundle itself.
 * <p>
 * {@code PENDING -> IN_TRANSIT -> {DELIVERED | EXPIRED | FAILED}}; a pending copy may also
 * reach any terminal status directly. Terminal statuses are final.
 */
@Getter
@RequiredArgsConstructor
public enum BundleStatus {

    PENDING("pending"),
    IN_TRANSIT("in_transit"),
    DELIVERED("delivered"),
    EXPIRED("expired"),
    FAILED("failed"),
    ;

    private final String value;

    public boolean isTerminal() {
        return this == DELIVERED || this == EXPIRED || this == FAILED;
    }

    /**
     * Same status counts as allowed, so repeating an update is observationally a no-op.
     */
    public boolean canTransitionTo(final BundleStatus next) {
        if (next == this) {
            return true;
        }
        if (isTerminal()) {
            return false;
        }

        return this == PENDING || next != PENDING;
    }

    public static BundleStatus fromValue(final String value) {
        return Arrays.stream(values())
                .filter(status -> status.getValue().equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown bundle status: " + value));
    }
}
