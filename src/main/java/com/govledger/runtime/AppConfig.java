package com.govledger.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.govledger.ledger.RotatingLedgerSink;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private LedgerConfig ledger = new LedgerConfig();
    private TraceConfig trace = new TraceConfig();
    private AuditConfig audit = new AuditConfig();

    public static AppConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(path.toFile(), AppConfig.class);
    }

    public LedgerConfig getLedger() {
        return ledger;
    }

    public void setLedger(LedgerConfig ledger) {
        this.ledger = ledger == null ? new LedgerConfig() : ledger;
    }

    public TraceConfig getTrace() {
        return trace;
    }

    public void setTrace(TraceConfig trace) {
        this.trace = trace == null ? new TraceConfig() : trace;
    }

    public AuditConfig getAudit() {
        return audit;
    }

    public void setAudit(AuditConfig audit) {
        this.audit = audit == null ? new AuditConfig() : audit;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LedgerConfig {
        private String path = ".govledger/ledger/governance_events.jsonl";
        private long maxSizeBytes = RotatingLedgerSink.DEFAULT_MAX_SIZE_BYTES;
        private int maxFileCount = RotatingLedgerSink.DEFAULT_MAX_FILE_COUNT;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public long getMaxSizeBytes() {
            return maxSizeBytes;
        }

        public void setMaxSizeBytes(long maxSizeBytes) {
            this.maxSizeBytes = maxSizeBytes;
        }

        public int getMaxFileCount() {
            return maxFileCount;
        }

        public void setMaxFileCount(int maxFileCount) {
            this.maxFileCount = maxFileCount;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TraceConfig {
        private String storePath = ".govledger/trace/trace_links.jsonl";

        public String getStorePath() {
            return storePath;
        }

        public void setStorePath(String storePath) {
            this.storePath = storePath;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AuditConfig {
        private long maxStalenessSeconds = 86_400;
        private String governanceRoot = ".";
        private List<String> governancePaths = new ArrayList<>();
        private String outputDir = ".govledger/audit";
        private String artifactManifestPath = "build/artifacts.json";

        public long getMaxStalenessSeconds() {
            return maxStalenessSeconds;
        }

        public void setMaxStalenessSeconds(long maxStalenessSeconds) {
            this.maxStalenessSeconds = maxStalenessSeconds;
        }

        public String getGovernanceRoot() {
            return governanceRoot;
        }

        public void setGovernanceRoot(String governanceRoot) {
            this.governanceRoot = governanceRoot;
        }

        public List<String> getGovernancePaths() {
            return governancePaths;
        }

        public void setGovernancePaths(List<String> governancePaths) {
            this.governancePaths = governancePaths == null ? new ArrayList<>() : governancePaths;
        }

        public String getOutputDir() {
            return outputDir;
        }

        public void setOutputDir(String outputDir) {
            this.outputDir = outputDir;
        }

        public String getArtifactManifestPath() {
            return artifactManifestPath;
        }

        public void setArtifactManifestPath(String artifactManifestPath) {
            this.artifactManifestPath = artifactManifestPath;
        }
    }
}
