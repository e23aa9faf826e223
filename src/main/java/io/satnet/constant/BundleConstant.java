package io.satnet.constant;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.time.Duration;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class BundleConstant {

    /**
     * Bundle protocol version stamped on every bundle. A bundle carrying any other
     * version fails validation.
     */
    public static final int VERSION = 7;

    /**
     * Maximum amount of hops a bundle may be relayed. Incrementing past this value is a
     * validation error and the bundle is dropped instead of forwarded.
     */
    public static final int MAX_HOP_COUNT = 255;

    public static final Duration DEFAULT_LIFETIME = Duration.ofHours(24);

    /**
     * Fixed overhead used by the approximate size calculation, on top of the endpoint
     * strings and the payload.
     */
    public static final int HEADER_BASE_SIZE = 64;

    public static final int SHORT_ID_LENGTH = 8;
}
