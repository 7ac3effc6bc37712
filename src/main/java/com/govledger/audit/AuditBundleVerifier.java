package com.govledger.audit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.govledger.event.CanonicalJson;
import com.govledger.event.Hashing;
import com.govledger.event.InvalidRecordException;
import com.govledger.freshness.FreshnessEvaluator;
import com.govledger.freshness.FreshnessFailure;
import com.govledger.freshness.FreshnessManifest;
import com.govledger.freshness.FreshnessResult;
import com.govledger.trace.ChainVerification;
import com.govledger.trace.TraceChainVerifier;
import com.govledger.trace.TraceLink;
import com.govledger.trace.TraceRegistry;

/**
 * Checks an exported bundle using nothing but its own files. Every check is always reported;
 * a check that cannot be completed fails.
 */
public class AuditBundleVerifier {
    private static final Logger log = LoggerFactory.getLogger(AuditBundleVerifier.class);

    private final Clock clock;

    public AuditBundleVerifier() {
        this(Clock.systemUTC());
    }

    public AuditBundleVerifier(Clock clock) {
        this.clock = clock;
    }

    public VerificationReport verify(Path bundle) {
        return verify(bundle, Options.ALL);
    }

    public VerificationReport verify(Path bundle, Options options) {
        Path root = bundle.toAbsolutePath().normalize();
        List<CheckResult> checks = new ArrayList<>();
        BundleManifest manifest = readManifest(root, checks);
        if (manifest != null) {
            Set<String> listed = new HashSet<>();
            for (ManifestEntry entry : manifest.entries()) {
                listed.add(entry.path());
                checks.add(checkArtifact(root, entry));
            }
            checks.add(checkUnlisted(root, listed));
            checks.add(checkBundleHash(manifest));
            checks.add(checkFingerprint(root, manifest, listed));
            if (options.skipFreshness()) {
                checks.add(CheckResult.skipped("FRESHNESS", "freshness check skipped on request"));
            } else {
                checks.addAll(checkFreshness(root, listed));
            }
            if (options.skipTraceChain()) {
                checks.add(CheckResult.skipped("TRACE_CHAIN", "trace chain check skipped on request"));
            } else {
                checks.add(checkTraceChain(root, manifest, listed));
            }
        }
        VerificationReport report = new VerificationReport(root, clock.instant(), checks);
        if (report.passed()) {
            log.info("Bundle {} verified: PASS ({} checks)", root, checks.size());
        } else {
            log.warn("Bundle {} verified: FAIL {}", root, report.failures());
        }
        return report;
    }

    public VerificationReport requireTrusted(Path bundle) throws ArtifactIntegrityException {
        VerificationReport report = verify(bundle);
        if (!report.passed()) {
            throw new ArtifactIntegrityException(report);
        }
        return report;
    }

    private static BundleManifest readManifest(Path root, List<CheckResult> checks) {
        Path path = root.resolve(AuditBundleExporter.MANIFEST_FILE);
        if (!Files.isRegularFile(path)) {
            checks.add(CheckResult.fail("MANIFEST", "MANIFEST_MISSING", AuditBundleExporter.MANIFEST_FILE + " not found"));
            return null;
        }
        BundleManifest manifest;
        try {
            manifest = BundleJson.read(path, BundleManifest.class);
        } catch (IOException e) {
            checks.add(CheckResult.fail("MANIFEST", "MANIFEST_MALFORMED", e.getMessage()));
            return null;
        }
        if (manifest.entries() == null || manifest.bundleHash() == null || manifest.entries().stream()
                .anyMatch(entry -> entry == null || entry.path() == null || entry.sha256() == null)) {
            checks.add(CheckResult.fail("MANIFEST", "MANIFEST_MALFORMED", "manifest lacks entries or bundle_hash"));
            return null;
        }
        checks.add(CheckResult.pass("MANIFEST", manifest.entries().size() + " entries, bundle " + manifest.bundleId()));
        return manifest;
    }

    private static CheckResult checkArtifact(Path root, ManifestEntry entry) {
        String name = "ARTIFACT:" + entry.path();
        Path file = resolveInside(root, entry.path());
        if (file == null) {
            return CheckResult.fail(name, "ARTIFACT_PATH_INVALID", "path escapes the bundle directory");
        }
        if (!Files.isRegularFile(file)) {
            return CheckResult.fail(name, "ARTIFACT_MISSING", entry.path() + " not found");
        }
        try {
            long size = Files.size(file);
            String sha256 = Hashing.sha256Hex(file);
            if (size != entry.size() || !sha256.equals(entry.sha256())) {
                return CheckResult.fail(name, "ARTIFACT_TAMPERED",
                        "expected sha256=" + entry.sha256() + " size=" + entry.size()
                                + ", found sha256=" + sha256 + " size=" + size);
            }
            return CheckResult.pass(name, "sha256=" + sha256);
        } catch (IOException e) {
            return CheckResult.fail(name, "ARTIFACT_MISSING", "unreadable: " + e.getMessage());
        }
    }

    private static CheckResult checkUnlisted(Path root, Set<String> listed) {
        Set<String> unexpected = new TreeSet<>();
        try (Stream<Path> walk = Files.walk(root)) {
            walk.filter(Files::isRegularFile)
                    .map(path -> root.relativize(path).toString().replace('\\', '/'))
                    .filter(relative -> !relative.equals(AuditBundleExporter.MANIFEST_FILE))
                    .filter(relative -> !listed.contains(relative))
                    .forEach(unexpected::add);
        } catch (IOException e) {
            return CheckResult.fail("UNLISTED_ARTIFACTS", "UNEXPECTED_ARTIFACT", "bundle directory unreadable: " + e.getMessage());
        }
        if (!unexpected.isEmpty()) {
            return CheckResult.fail("UNLISTED_ARTIFACTS", "UNEXPECTED_ARTIFACT", "not in manifest: " + unexpected);
        }
        return CheckResult.pass("UNLISTED_ARTIFACTS", "no unlisted files");
    }

    private static CheckResult checkBundleHash(BundleManifest manifest) {
        String computed = BundleManifest.bundleHash(manifest.entries());
        if (!computed.equals(manifest.bundleHash())) {
            return CheckResult.fail("BUNDLE_HASH", "BUNDLE_HASH_MISMATCH",
                    "manifest says " + manifest.bundleHash() + ", entries hash to " + computed);
        }
        return CheckResult.pass("BUNDLE_HASH", computed);
    }

    private static CheckResult checkFingerprint(Path root, BundleManifest manifest, Set<String> listed) {
        if (!listed.contains(AuditBundleExporter.FINGERPRINT_FILE)) {
            return CheckResult.fail("FINGERPRINT", "FINGERPRINT_MISSING", AuditBundleExporter.FINGERPRINT_FILE + " not in manifest");
        }
        GovernanceFingerprint fingerprint;
        try {
            fingerprint = BundleJson.read(root.resolve(AuditBundleExporter.FINGERPRINT_FILE), GovernanceFingerprint.class);
        } catch (IOException e) {
            return CheckResult.fail("FINGERPRINT", "FINGERPRINT_MISSING", "unreadable: " + e.getMessage());
        }
        String recomputed = GovernanceFingerprint.compositeHash(fingerprint.files());
        if (!recomputed.equals(fingerprint.compositeHash()) || !recomputed.equals(manifest.governanceFingerprintHash())) {
            return CheckResult.fail("FINGERPRINT", "FINGERPRINT_MISMATCH",
                    "recomputed " + recomputed + ", file says " + fingerprint.compositeHash()
                            + ", manifest says " + manifest.governanceFingerprintHash());
        }
        long missing = fingerprint.files().stream().filter(GovernanceFingerprint.FileFingerprint::missing).count();
        return CheckResult.pass("FINGERPRINT", recomputed + (missing > 0 ? " (" + missing + " paths recorded MISSING)" : ""));
    }

    private List<CheckResult> checkFreshness(Path root, Set<String> listed) {
        Path path = root.resolve(AuditBundleExporter.FRESHNESS_FILE);
        if (!listed.contains(AuditBundleExporter.FRESHNESS_FILE) || !Files.isRegularFile(path)) {
            return List.of(CheckResult.fail("FRESHNESS", "FRESHNESS_MANIFEST_MISSING",
                    AuditBundleExporter.FRESHNESS_FILE + " not found"));
        }
        FreshnessManifest manifest;
        try {
            manifest = BundleJson.read(path, FreshnessManifest.class);
        } catch (IOException e) {
            return List.of(CheckResult.fail("FRESHNESS", "FRESHNESS_MANIFEST_MALFORMED", e.getMessage()));
        }
        FreshnessResult result = FreshnessEvaluator.evaluate(manifest, clock);
        if (!result.errors().isEmpty()) {
            return List.of(CheckResult.fail("FRESHNESS", "FRESHNESS_MANIFEST_MALFORMED", String.join("; ", result.errors())));
        }
        List<CheckResult> checks = new ArrayList<>();
        for (Map.Entry<String, Long> age : result.ageSeconds().entrySet()) {
            String name = "FRESHNESS:" + age.getKey();
            FreshnessFailure failure = result.failures().stream()
                    .filter(candidate -> candidate.source().equals(age.getKey()))
                    .findFirst()
                    .orElse(null);
            if (failure == null) {
                checks.add(CheckResult.pass(name, "age=" + age.getValue() + "s max=" + result.maxStalenessSeconds() + "s"));
            } else {
                checks.add(CheckResult.fail(name, "STALE_SOURCE", "age=" + failure.ageSeconds() + "s max="
                        + failure.maxStalenessSeconds() + "s exceeded_by=" + failure.exceededBySeconds() + "s"));
            }
        }
        checks.sort(Comparator.comparing(CheckResult::name));
        return checks;
    }

    private static CheckResult checkTraceChain(Path root, BundleManifest manifest, Set<String> listed) {
        if (!listed.contains(AuditBundleExporter.TRACE_FILE)) {
            return CheckResult.fail("TRACE_CHAIN", "TRACE_CHAIN_BROKEN", AuditBundleExporter.TRACE_FILE + " not in manifest");
        }
        List<TraceLink> links = new ArrayList<>();
        try {
            String content = Files.readString(root.resolve(AuditBundleExporter.TRACE_FILE), StandardCharsets.UTF_8);
            for (String line : content.split("\n")) {
                if (!line.isEmpty()) {
                    links.add(TraceLink.fromRecord(CanonicalJson.parse(line)));
                }
            }
        } catch (NoSuchFileException e) {
            return CheckResult.fail("TRACE_CHAIN", "TRACE_CHAIN_BROKEN", "trace slice not found");
        } catch (IOException | InvalidRecordException e) {
            return CheckResult.fail("TRACE_CHAIN", "TRACE_CHAIN_BROKEN", "index " + links.size() + ": unreadable link: " + e.getMessage());
        }
        if (links.isEmpty()) {
            return CheckResult.pass("TRACE_CHAIN", "no links in slice");
        }
        String anchor = manifest.traceChainAnchor() == null ? TraceRegistry.GENESIS_HASH : manifest.traceChainAnchor();
        ChainVerification verification = TraceChainVerifier.verify(links, anchor);
        if (!verification.valid()) {
            return CheckResult.fail("TRACE_CHAIN", "TRACE_CHAIN_BROKEN",
                    "index " + verification.firstInvalidIndex() + ": " + verification.reason());
        }
        String head = links.get(links.size() - 1).linkHash();
        if (manifest.traceChainHead() != null && !manifest.traceChainHead().equals(head)) {
            return CheckResult.fail("TRACE_CHAIN", "TRACE_CHAIN_BROKEN",
                    "slice ends at " + head + " but manifest records head " + manifest.traceChainHead());
        }
        return CheckResult.pass("TRACE_CHAIN", links.size() + " links verified, head " + head);
    }

    private static Path resolveInside(Path root, String relative) {
        if (relative.isEmpty() || relative.startsWith("/") || relative.contains("\\")) {
            return null;
        }
        Path resolved = root.resolve(relative).normalize();
        return resolved.startsWith(root) && !resolved.equals(root) ? resolved : null;
    }

    public record Options(boolean skipFreshness, boolean skipTraceChain) {
        public static final Options ALL = new Options(false, false);
    }
}
