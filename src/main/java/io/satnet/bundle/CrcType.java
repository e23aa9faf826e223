package io.satnet.bundle;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * Integrity-check type tag carried by a bundle. The tag is transported as is; computing
 * the check belongs to the wire layer.
 */
@Getter
@RequiredArgsConstructor
public enum CrcType {

    NONE(0),
    CRC16(1),
    CRC32(2),
    ;

    private final int value;

    public static CrcType fromValue(final int value) {
        return Arrays.stream(values())
                .filter(type -> type.getValue() == value)
                .findFirst()
                .orElseThrow();
    }
}
