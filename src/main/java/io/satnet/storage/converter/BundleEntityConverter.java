package io.satnet.storage.converter;

import io.satnet.storage.entity.BundleEntity;
import org.dizitart.no2.collection.Document;
import org.dizitart.no2.common.mapper.EntityConverter;
import org.dizitart.no2.common.mapper.NitriteMapper;

import java.time.Instant;

public class BundleEntityConverter implements EntityConverter<BundleEntity> {

    @Override
    public Class<BundleEntity> getEntityType() {
        return BundleEntity.class;
    }

    @Override
    public Document toDocument(BundleEntity entity, NitriteMapper nitriteMapper) {
        return Document.createDocument()
                .put("bundleId", entity.getBundleId())
                .put("version", entity.getVersion())
                .put("bundleFlags", entity.getBundleFlags())
                .put("destinationEid", entity.getDestinationEid())
                .put("sourceEid", entity.getSourceEid())
                .put("reportTo", entity.getReportTo())
                .put("creationTimestamp", entity.getCreationTimestamp())
                .put("lifetime", entity.getLifetime())
                .put("payload", entity.getPayload())
                .put("crcType", entity.getCrcType())
                .put("previousNode", entity.getPreviousNode())
                .put("hopCount", entity.getHopCount())
                .put("priority", entity.getPriority())
                .put("status", entity.getStatus())
                .put("storedAt", entity.getStoredAt());
    }

    @Override
    public BundleEntity fromDocument(Document document, NitriteMapper nitriteMapper) {
        return BundleEntity.builder()
                .bundleId(document.get("bundleId", String.class))
                .version(document.get("version", Integer.class))
                .bundleFlags(document.get("bundleFlags", Long.class))
                .destinationEid(document.get("destinationEid", String.class))
                .sourceEid(document.get("sourceEid", String.class))
                .reportTo(document.get("reportTo", String.class))
                .creationTimestamp(document.get("creationTimestamp", Instant.class))
                .lifetime(document.get("lifetime", String.class))
                .payload(document.get("payload", byte[].class))
                .crcType(document.get("crcType", Integer.class))
                .previousNode(document.get("previousNode", String.class))
                .hopCount(document.get("hopCount", Integer.class))
                .priority(document.get("priority", Integer.class))
                .status(document.get("status", String.class))
                .storedAt(document.get("storedAt", Instant.class))
                .build();
    }
}
