package io.satnet.bundle;

import io.satnet.exception.ValidationException;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.ArrayUtils;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static io.satnet.constant.BundleConstant.DEFAULT_LIFETIME;
import static io.satnet.constant.BundleConstant.HEADER_BASE_SIZE;
import static io.satnet.constant.BundleConstant.MAX_HOP_COUNT;
import static io.satnet.constant.BundleConstant.SHORT_ID_LENGTH;
import static io.satnet.constant.BundleConstant.VERSION;
import static java.util.Objects.requireNonNullElse;
import static java.util.Objects.requireNonNullElseGet;
import static org.apache.commons.lang3.StringUtils.isBlank;
import static org.apache.commons.lang3.StringUtils.length;

/**
 * The store-and-forward message unit.
 * <p>
 * Addressing, lifetime and payload are fixed at construction. The only state that changes
 * while a bundle travels is its transit annotation (hop count and previous hop, see
 * {@link #incrementHop(String)}) and its priority. Custody status is not part of the bundle,
 * it is tracked per stored copy by the {@link io.satnet.storage.BundleStore}.
 * <p>
 * Two bundles are equal when their ids are equal: they are copies of one logical message.
 * Hand copies across every store or node boundary with {@link #copy()}.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class Bundle {

    @EqualsAndHashCode.Include
    private final UUID id;
    private final int version;
    private final long bundleFlags;
    private final String destinationEid;
    private final String sourceEid;
    private final String reportTo;
    private final Instant creationTimestamp;
    private final Duration lifetime;
    @Getter(AccessLevel.NONE)
    private final byte[] payload;
    private final CrcType crcType;

    private String previousNode;
    private int hopCount;
    private BundlePriority priority;

    @Builder
    private Bundle(
            UUID id,
            Integer version,
            long bundleFlags,
            String destinationEid,
            String sourceEid,
            String reportTo,
            Instant creationTimestamp,
            Duration lifetime,
            byte[] payload,
            CrcType crcType,
            String previousNode,
            int hopCount,
            BundlePriority priority
    ) {
        this.id = requireNonNullElseGet(id, UUID::randomUUID);
        this.version = requireNonNullElse(version, VERSION);
        this.bundleFlags = bundleFlags;
        this.destinationEid = destinationEid;
        this.sourceEid = sourceEid;
        this.reportTo = isBlank(reportTo) ? sourceEid : reportTo;
        this.creationTimestamp = requireNonNullElseGet(creationTimestamp, Instant::now);
        this.lifetime = requireNonNullElse(lifetime, DEFAULT_LIFETIME);
        this.payload = payload == null ? ArrayUtils.EMPTY_BYTE_ARRAY : payload.clone();
        this.crcType = requireNonNullElse(crcType, CrcType.CRC16);
        this.previousNode = previousNode;
        this.hopCount = hopCount;
        this.priority = requireNonNullElse(priority, BundlePriority.NORMAL);
    }

    /**
     * Creates a bundle with the default lifetime, normal priority and no hops taken.
     */
    public static Bundle create(String source, String destination, byte[] payload) {
        return Bundle.builder()
                .sourceEid(source)
                .destinationEid(destination)
                .payload(payload)
                .build();
    }

    public static Bundle create(String source, String destination, byte[] payload, @NonNull BundlePriority priority) {
        var bundle = create(source, destination, payload);
        bundle.setPriority(priority);

        return bundle;
    }

    public byte[] getPayload() {
        return payload.clone();
    }

    public int getPayloadLength() {
        return payload.length;
    }

    public Instant expiresAt() {
        return creationTimestamp.plus(lifetime);
    }

    public boolean isExpired() {
        return isExpired(Clock.systemUTC());
    }

    /**
     * Recomputed on every call, never cached.
     */
    public boolean isExpired(@NonNull Clock clock) {
        return clock.instant().isAfter(expiresAt());
    }

    public Duration remainingLifetime() {
        return remainingLifetime(Clock.systemUTC());
    }

    public Duration remainingLifetime(@NonNull Clock clock) {
        var remaining = Duration.between(clock.instant(), expiresAt());

        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public void validate() throws ValidationException {
        validate(Clock.systemUTC());
    }

    public void validate(@NonNull Clock clock) throws ValidationException {
        if (version != VERSION) {
            throw new ValidationException(String.format("invalid bundle version: %d (expected %d)", version, VERSION));
        }
        if (isBlank(destinationEid)) {
            throw new ValidationException("destination EID cannot be empty");
        }
        if (isBlank(sourceEid)) {
            throw new ValidationException("source EID cannot be empty");
        }
        if (hopCount < 0 || hopCount > MAX_HOP_COUNT) {
            throw new ValidationException(String.format("hop count %d outside of [0, %d]", hopCount, MAX_HOP_COUNT));
        }
        if (!clock.instant().isBefore(expiresAt())) {
            throw new ValidationException("bundle has expired at " + expiresAt());
        }
    }

    public void setPriority(final int priority) throws ValidationException {
        if (!BundlePriority.isValid(priority)) {
            throw new ValidationException("invalid priority: " + priority + " (must be 0-2)");
        }
        this.priority = BundlePriority.fromValue(priority);
    }

    public void setPriority(@NonNull final BundlePriority priority) {
        this.priority = priority;
    }

    /**
     * Records one more relay through {@code nodeId}. The ceiling is never exceeded: an
     * attempt to go past it fails and leaves the bundle untouched, which tells the caller
     * to drop it instead of forwarding.
     */
    public void incrementHop(@NonNull final String nodeId) throws ValidationException {
        if (hopCount >= MAX_HOP_COUNT) {
            throw new ValidationException(String.format("max hop count exceeded (%d)", MAX_HOP_COUNT));
        }
        hopCount++;
        previousNode = nodeId;
    }

    /**
     * Deep copy, payload included.
     */
    public Bundle copy() {
        return toBuilder().build();
    }

    /**
     * A copy of the same logical bundle stamped with a new source endpoint. The report-to
     * endpoint follows the source unless it was set to somewhere else.
     */
    public Bundle withSourceEid(final String source) {
        var reportTarget = reportTo == null || reportTo.equals(sourceEid) ? source : reportTo;

        return toBuilder()
                .sourceEid(source)
                .reportTo(reportTarget)
                .build();
    }

    /**
     * SHA-256 over identity, addressing and payload, hex encoded.
     */
    public String hash() {
        var data = new ByteArrayOutputStream();
        data.writeBytes(id.toString().getBytes(StandardCharsets.UTF_8));
        data.writeBytes(String.valueOf(sourceEid).getBytes(StandardCharsets.UTF_8));
        data.writeBytes(String.valueOf(destinationEid).getBytes(StandardCharsets.UTF_8));
        data.writeBytes(payload);

        return DigestUtils.sha256Hex(data.toByteArray());
    }

    /**
     * Approximate size in bytes.
     */
    public int size() {
        return HEADER_BASE_SIZE
                + length(sourceEid)
                + length(destinationEid)
                + length(reportTo)
                + length(previousNode)
                + payload.length;
    }

    public String shortId() {
        return id.toString().substring(0, SHORT_ID_LENGTH);
    }

    @Override
    public String toString() {
        return String.format(
                "Bundle[id=%s, src=%s, dst=%s, priority=%s, hops=%d, size=%d]",
                shortId(), sourceEid, destinationEid, priority, hopCount, size()
        );
    }

    private BundleBuilder toBuilder() {
        return Bundle.builder()
                .id(id)
                .version(version)
                .bundleFlags(bundleFlags)
                .destinationEid(destinationEid)
                .sourceEid(sourceEid)
                .reportTo(reportTo)
                .creationTimestamp(creationTimestamp)
                .lifetime(lifetime)
                .payload(payload)
                .crcType(crcType)
                .previousNode(previousNode)
                .hopCount(hopCount)
                .priority(priority);
    }
}
