package com.ascend.modsync.sync.http;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Upstream source of mod metadata. Implementations block for the duration of the call
 * and signal failures with {@link UpstreamException} subtypes.
 */
public interface ModMetadataClient {
    JsonNode fetchOne(String key);
}
