package io.satnet.bundle;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Query criteria for listing stored bundles. Every field is optional and all present
 * fields must match.
 */
@Value
@Builder(toBuilder = true)
public class BundleFilter {

    public static final BundleFilter ALL = BundleFilter.builder().build();

    String destinationEid;
    String sourceEid;
    BundleStatus status;
    BundlePriority minPriority;
    /**
     * Only bundles stored no longer than this ago.
     */
    Duration maxAge;
    Integer limit;
    @Builder.Default
    BundleOrder order = BundleOrder.NONE;

    public static BundleFilter byStatus(BundleStatus status) {
        return BundleFilter.builder().status(status).build();
    }
}
