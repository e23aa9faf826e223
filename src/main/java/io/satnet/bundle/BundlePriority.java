package io.satnet.bundle;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

@Getter
@RequiredArgsConstructor
public enum BundlePriority {

    BULK(0),
    NORMAL(1),
    EXPEDITED(2),
    ;

    private final int value;

    public static boolean isValid(final int value) {
        return value >= BULK.value && value <= EXPEDITED.value;
    }

    public static BundlePriority fromValue(final int value) {
        return Arrays.stream(values())
                .filter(priority -> priority.getValue() == value)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("invalid priority: " + value + " (must be 0-2)"));
    }
}
