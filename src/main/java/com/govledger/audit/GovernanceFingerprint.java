package com.govledger.audit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.govledger.event.CanonicalJson;
import com.govledger.event.Hashing;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GovernanceFingerprint(
        @JsonProperty("schema_version") String schemaVersion,
        @JsonProperty("files") List<FileFingerprint> files,
        @JsonProperty("composite_hash") String compositeHash) {

    public static final String SCHEMA_VERSION = "1.0.0";
    public static final String MISSING = "MISSING";

    public GovernanceFingerprint {
        files = files == null ? List.of() : List.copyOf(files);
    }

    static GovernanceFingerprint of(List<FileFingerprint> files) {
        return new GovernanceFingerprint(SCHEMA_VERSION, files, compositeHash(files));
    }

    public static String compositeHash(List<FileFingerprint> files) {
        List<Object> rows = new ArrayList<>();
        for (FileFingerprint file : files) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("path", file.path());
            row.put("sha256", file.sha256());
            row.put("size", file.size());
            rows.add(row);
        }
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("files", rows);
        return Hashing.sha256Hex(CanonicalJson.canonicalize(record));
    }

    public record FileFingerprint(
            @JsonProperty("path") String path,
            @JsonProperty("sha256") String sha256,
            @JsonProperty("size") long size) {

        public boolean missing() {
            return MISSING.equals(sha256);
        }
    }
}
