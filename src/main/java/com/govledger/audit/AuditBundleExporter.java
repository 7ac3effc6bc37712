package com.govledger.audit;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.govledger.event.CanonicalJson;
import com.govledger.event.Hashing;
import com.govledger.freshness.FreshnessManifest;
import com.govledger.freshness.SourceTimestamp;
import com.govledger.ledger.LedgerReader;
import com.govledger.ledger.LedgerSnapshot;
import com.govledger.ledger.LedgerSource;
import com.govledger.ledger.RotatingLedgerSink;
import com.govledger.trace.TraceLink;
import com.govledger.trace.TraceRegistry;

public class AuditBundleExporter {
    public static final String MANIFEST_FILE = "AUDIT_MANIFEST.json";
    public static final String FRESHNESS_FILE = "FRESHNESS_MANIFEST.json";
    public static final String VERIFY_FILE = "VERIFY.md";
    public static final String EVENTS_FILE = "governance_events/events.jsonl";
    public static final String TRACE_FILE = "trace/trace_links.jsonl";
    public static final String FINGERPRINT_FILE = "fingerprint/governance_fingerprint.json";
    public static final String SCOPE_FILE = "scope/scope_declaration.json";
    public static final String ARTIFACTS_FILE = "artifacts/artifacts.json";

    public static final String SOURCE_EVENTS = "governance_events";
    public static final String SOURCE_TRACE = "trace_links";
    public static final String SOURCE_FINGERPRINT = "governance_fingerprint";
    public static final String SOURCE_BUNDLE = "audit_bundle";

    private static final Logger log = LoggerFactory.getLogger(AuditBundleExporter.class);

    private final LedgerSource ledger;
    private final TraceRegistry registry;
    private final GovernanceFingerprintEngine fingerprintEngine;
    private final Path artifactManifest;
    private final Clock clock;

    public AuditBundleExporter(LedgerSource ledger, TraceRegistry registry, GovernanceFingerprintEngine fingerprintEngine) {
        this(ledger, registry, fingerprintEngine, Clock.systemUTC());
    }

    public AuditBundleExporter(LedgerSource ledger, TraceRegistry registry, GovernanceFingerprintEngine fingerprintEngine,
            Clock clock) {
        this(ledger, registry, fingerprintEngine, null, clock);
    }

    public AuditBundleExporter(LedgerSource ledger, TraceRegistry registry, GovernanceFingerprintEngine fingerprintEngine,
            Path artifactManifest, Clock clock) {
        this.ledger = ledger;
        this.registry = registry;
        this.fingerprintEngine = fingerprintEngine;
        this.artifactManifest = artifactManifest;
        this.clock = clock;
    }

    public ExportResult export(ExportRequest request) throws IOException {
        Path destination = request.destination().toAbsolutePath().normalize();
        if (Files.exists(destination)) {
            throw new FileAlreadyExistsException(destination.toString(), null, "bundle destination already exists");
        }
        Path parent = destination.getParent();
        Files.createDirectories(parent);
        Path staging = Files.createTempDirectory(parent, "." + destination.getFileName() + ".staging-");
        try {
            ExportResult staged = assemble(staging, request);
            Files.move(staging, destination, StandardCopyOption.ATOMIC_MOVE);
            log.info("Exported audit bundle {} to {} events={} links={} bundleHash={}", staged.bundleId(), destination,
                    staged.eventCount(), staged.linkCount(), staged.bundleHash());
            return new ExportResult(destination, staged.manifest(), staged.eventCount(), staged.linkCount());
        } catch (IOException | RuntimeException e) {
            deleteStaging(staging, e);
            throw e;
        }
    }

    private ExportResult assemble(Path bundle, ExportRequest request) throws IOException {
        Instant exportedAt = clock.instant();
        List<ManifestEntry> entries = new ArrayList<>();

        EventSlice events = writeEvents(bundle.resolve(EVENTS_FILE), request.start(), request.end());
        entries.add(entry(bundle, EVENTS_FILE, false));

        List<TraceLink> links = traceSlice(request.start(), request.end());
        writeLinks(bundle.resolve(TRACE_FILE), links);
        entries.add(entry(bundle, TRACE_FILE, false));

        GovernanceFingerprint fingerprint = fingerprintEngine.compute();
        BundleJson.write(bundle.resolve(FINGERPRINT_FILE), fingerprint);
        entries.add(entry(bundle, FINGERPRINT_FILE, false));

        boolean artifactsPresent = copyArtifactManifest(bundle.resolve(ARTIFACTS_FILE));
        if (artifactsPresent) {
            entries.add(entry(bundle, ARTIFACTS_FILE, false));
        }

        BundleJson.write(bundle.resolve(SCOPE_FILE), scopeDeclaration(request, artifactsPresent));
        entries.add(entry(bundle, SCOPE_FILE, false));

        writeResource(bundle.resolve(VERIFY_FILE), VERIFY_FILE);
        entries.add(entry(bundle, VERIFY_FILE, false));

        Map<String, SourceTimestamp> sources = new TreeMap<>();
        if (events.newest() != null) {
            sources.put(SOURCE_EVENTS, new SourceTimestamp(events.newest(), "Newest governance event in the export window"));
        }
        if (!links.isEmpty()) {
            Instant newestLink = links.stream().map(TraceLink::registeredAt).max(Comparator.naturalOrder()).orElseThrow();
            sources.put(SOURCE_TRACE, new SourceTimestamp(newestLink, "Newest trace link in the exported slice"));
        }
        sources.put(SOURCE_FINGERPRINT, new SourceTimestamp(exportedAt, "Governance fingerprint computation time"));
        sources.put(SOURCE_BUNDLE, new SourceTimestamp(exportedAt, "Bundle export time"));
        BundleJson.write(bundle.resolve(FRESHNESS_FILE),
                FreshnessManifest.of(exportedAt, request.maxStalenessSeconds(), sources));
        entries.add(entry(bundle, FRESHNESS_FILE, true));

        entries.sort(Comparator.comparing(ManifestEntry::path));
        BundleManifest manifest = new BundleManifest(
                BundleManifest.SCHEMA_VERSION,
                newBundleId(),
                exportedAt,
                BundleManifest.CREATED_BY,
                new ExportParameters(request.start(), request.end(), request.maxStalenessSeconds()),
                fingerprint.compositeHash(),
                links.isEmpty() ? null : links.get(0).prevHash(),
                links.isEmpty() ? null : links.get(links.size() - 1).linkHash(),
                RotatingLedgerSink.RETENTION_POLICY_VERSION,
                BundleManifest.bundleHash(entries),
                entries);
        BundleJson.write(bundle.resolve(MANIFEST_FILE), manifest);
        return new ExportResult(bundle, manifest, events.count(), links.size());
    }

    private EventSlice writeEvents(Path target, Instant start, Instant end) throws IOException {
        Files.createDirectories(target.getParent());
        int[] count = new int[1];
        Instant[] newest = new Instant[1];
        try (LedgerSnapshot snapshot = ledger.openSnapshot();
                OutputStream out = Files.newOutputStream(target)) {
            snapshot.forEachLine((segment, lineNumber, line) -> {
                Instant timestamp = LedgerReader.timestampOf(segment, lineNumber, line);
                if (!LedgerReader.inWindow(timestamp, start, end)) {
                    return;
                }
                out.write(line);
                out.write('\n');
                count[0]++;
                if (newest[0] == null || timestamp.isAfter(newest[0])) {
                    newest[0] = timestamp;
                }
            });
        }
        return new EventSlice(count[0], newest[0]);
    }

    private List<TraceLink> traceSlice(Instant start, Instant end) {
        if (registry == null) {
            return List.of();
        }
        List<TraceLink> all = registry.links();
        int first = -1;
        int last = -1;
        for (int i = 0; i < all.size(); i++) {
            Instant registeredAt = all.get(i).registeredAt();
            if (first < 0 && (start == null || !registeredAt.isBefore(start))) {
                first = i;
            }
            if (end == null || registeredAt.isBefore(end)) {
                last = i;
            }
        }
        if (first < 0 || last < first) {
            return List.of();
        }
        return all.subList(first, last + 1);
    }

    private static void writeLinks(Path target, List<TraceLink> links) throws IOException {
        Files.createDirectories(target.getParent());
        StringBuilder content = new StringBuilder();
        for (TraceLink link : links) {
            content.append(CanonicalJson.canonicalString(link.toRecord())).append('\n');
        }
        Files.writeString(target, content.toString(), StandardCharsets.UTF_8);
    }

    private boolean copyArtifactManifest(Path target) throws IOException {
        if (artifactManifest == null || !Files.isRegularFile(artifactManifest)) {
            log.debug("No artifact manifest at {}; bundle will declare it absent", artifactManifest);
            return false;
        }
        Files.createDirectories(target.getParent());
        Files.copy(artifactManifest, target);
        return true;
    }

    private Map<String, Object> scopeDeclaration(ExportRequest request, boolean artifactsPresent) throws IOException {
        Map<String, Object> scope;
        try (InputStream in = resource("scope_declaration.json")) {
            scope = BundleJson.MAPPER.readValue(in, new TypeReference<LinkedHashMap<String, Object>>() {
            });
        }
        Map<String, Object> window = new LinkedHashMap<>();
        window.put("start_time", request.start() == null ? null : request.start().toString());
        window.put("end_time", request.end() == null ? null : request.end().toString());
        window.put("time_bounded", request.start() != null || request.end() != null);

        Map<String, Object> included = new LinkedHashMap<>();
        included.put(SOURCE_EVENTS, Map.of(
                "description", "Governance events whose timestamp falls in [start_time, end_time)",
                "path", EVENTS_FILE));
        included.put(SOURCE_TRACE, Map.of(
                "description", "Contiguous hash-chained trace links registered in the window",
                "path", TRACE_FILE));
        included.put(SOURCE_FINGERPRINT, Map.of(
                "description", "SHA-256 fingerprint of the governance configuration files",
                "path", FINGERPRINT_FILE));
        Map<String, Object> artifacts = new LinkedHashMap<>();
        artifacts.put("description", "Build artifact manifest, copied unchanged");
        artifacts.put("path", ARTIFACTS_FILE);
        artifacts.put("source", artifactManifest == null ? null : artifactManifest.getFileName().toString());
        artifacts.put("present", artifactsPresent);
        included.put("artifact_manifest", artifacts);

        scope.put("schema_version", BundleManifest.SCHEMA_VERSION);
        scope.put("export_window", window);
        scope.put("included", included);
        return scope;
    }

    private static void writeResource(Path target, String name) throws IOException {
        try (InputStream in = resource(name)) {
            Files.copy(in, target);
        }
    }

    private static InputStream resource(String name) throws IOException {
        InputStream in = AuditBundleExporter.class.getResourceAsStream(name);
        if (in == null) {
            throw new IOException("Missing bundled resource " + name);
        }
        return in;
    }

    private static ManifestEntry entry(Path bundle, String relative, boolean exportMetadata) throws IOException {
        Path file = bundle.resolve(relative);
        return new ManifestEntry(relative, Hashing.sha256Hex(file), Files.size(file), exportMetadata);
    }

    private static String newBundleId() {
        return "audit-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    private static void deleteStaging(Path directory, Exception cause) {
        try (Stream<Path> walk = Files.walk(directory)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            cause.addSuppressed(e);
            log.warn("Could not remove staging directory {}", directory, e);
        }
    }

    private record EventSlice(int count, Instant newest) {
    }
}
