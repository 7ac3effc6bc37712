package com.govledger.audit;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.govledger.event.Hashing;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BundleManifest(
        @JsonProperty("schema_version") String schemaVersion,
        @JsonProperty("bundle_id") String bundleId,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("created_by") String createdBy,
        @JsonProperty("export_parameters") ExportParameters exportParameters,
        @JsonProperty("governance_fingerprint_hash") String governanceFingerprintHash,
        @JsonProperty("trace_chain_anchor") String traceChainAnchor,
        @JsonProperty("trace_chain_head") String traceChainHead,
        @JsonProperty("retention_policy_version") String retentionPolicyVersion,
        @JsonProperty("bundle_hash") String bundleHash,
        @JsonProperty("entries") List<ManifestEntry> entries) {

    public static final String SCHEMA_VERSION = "1.0.0";
    public static final String CREATED_BY = "gov-ledger";

    public BundleManifest {
        entries = entries == null ? null : List.copyOf(entries);
    }

    public static String bundleHash(List<ManifestEntry> entries) {
        StringBuilder joined = new StringBuilder(entries.size() * 64);
        entries.stream().map(ManifestEntry::sha256).sorted().forEach(joined::append);
        return Hashing.sha256Hex(joined.toString());
    }
}
