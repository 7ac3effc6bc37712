package com.govledger.audit;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ManifestEntry(
        @JsonProperty("path") String path,
        @JsonProperty("sha256") String sha256,
        @JsonProperty("size") long size,
        @JsonProperty("export_metadata") boolean exportMetadata) {
}
