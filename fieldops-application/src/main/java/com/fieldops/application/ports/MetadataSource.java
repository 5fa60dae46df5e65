package com.fieldops.application.ports;

import com.fieldops.domain.metadata.EntityMetadata;

import java.util.List;

/**
 * Supplies entity definitions at startup (JSON documents, code).
 */
public interface MetadataSource {
    List<EntityMetadata> loadAll();
}
