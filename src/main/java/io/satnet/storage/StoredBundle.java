package io.satnet.storage;

import io.satnet.bundle.Bundle;
import io.satnet.bundle.BundleStatus;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * A stored copy together with its custody bookkeeping.
 */
@Value
public class StoredBundle {
    Bundle bundle;
    @With
    BundleStatus status;
    Instant storedAt;
}
