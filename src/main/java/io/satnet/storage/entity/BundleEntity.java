package io.satnet.storage.entity;

import lombok.Builder;
import lombok.Data;
import org.dizitart.no2.repository.annotations.Entity;
import org.dizitart.no2.repository.annotations.Id;

import java.time.Instant;

import static io.satnet.storage.NitriteBundleStore.BUNDLES;

@Entity(value = BUNDLES)
@Data
@Builder
public class BundleEntity {

    @Id
    private String bundleId;

    private int version;
    private long bundleFlags;
    private String destinationEid;
    private String sourceEid;
    private String reportTo;
    private Instant creationTimestamp;
    /**
     * ISO-8601 duration
     */
    private String lifetime;
    private byte[] payload;
    private int crcType;
    private String previousNode;
    private int hopCount;
    private int priority;

    private String status;
    private Instant storedAt;
}
