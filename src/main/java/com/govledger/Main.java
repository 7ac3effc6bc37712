package com.govledger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.govledger.audit.AuditBundleExporter;
import com.govledger.audit.AuditBundleVerifier;
import com.govledger.audit.CheckResult;
import com.govledger.audit.ExportRequest;
import com.govledger.audit.ExportResult;
import com.govledger.audit.GovernanceFingerprintEngine;
import com.govledger.audit.VerificationReport;
import com.govledger.event.CanonicalJson;
import com.govledger.event.ContextSchema;
import com.govledger.event.EventContext;
import com.govledger.event.GovernanceEvent;
import com.govledger.ledger.LedgerDirectory;
import com.govledger.ledger.LedgerFormatException;
import com.govledger.ledger.RetentionInfo;
import com.govledger.ledger.RotatingLedgerSink;
import com.govledger.runtime.AppConfig;
import com.govledger.trace.Gap;
import com.govledger.trace.TraceChain;
import com.govledger.trace.TraceDomain;
import com.govledger.trace.TraceInvariantViolationException;
import com.govledger.trace.TraceLink;
import com.govledger.trace.TraceLinkType;
import com.govledger.trace.TraceNode;
import com.govledger.trace.TraceRegistry;
import com.govledger.trace.TraceStoreCorruptedException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "gov-ledger",
        mixinStandardHelpOptions = true,
        version = "gov-ledger 0.1.0",
        description = "Governance event ledger, trace registry and audit bundle tooling.")
public class Main implements Callable<Integer> {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_STORAGE = 3;

    private static final Logger log = LoggerFactory.getLogger(Main.class);
    private static final DateTimeFormatter BUNDLE_NAME_FORMATTER = DateTimeFormatter.ofPattern("yyyyMMddHHmmss", Locale.ROOT)
            .withZone(ZoneOffset.UTC);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", required = true)
    Mode mode;

    @Option(names = "--event-id", description = "Event id for record mode")
    String eventId;

    @Option(names = "--event-type", description = "Event type for record mode")
    String eventType;

    @Option(names = "--timestamp", description = "Event timestamp (ISO-8601 UTC); defaults to now")
    Instant timestamp;

    @Option(names = "--agent-id", description = "Acting agent")
    String agentId;

    @Option(names = "--verb", description = "Action attempted")
    String verb;

    @Option(names = "--target", description = "Target of the action")
    String target;

    @Option(names = "--decision", description = "Decision recorded, e.g. ALLOW or DENY")
    String decision;

    @Option(names = "--reason-code", description = "Reason code for the decision")
    String reasonCode;

    @Option(names = "--context", description = "Event context as a JSON object")
    String contextJson;

    @Option(names = "--from", description = "Link source as DOMAIN:ref")
    String from;

    @Option(names = "--to", description = "Link target as DOMAIN:ref")
    String to;

    @Option(names = "--link-type", description = "Link type: ${COMPLETION-CANDIDATES}")
    TraceLinkType linkType;

    @Option(names = "--decision-ref", description = "Originating decision, when it cannot be inherited")
    String decisionRef;

    @Option(names = "--entity", description = "Entity for chain mode as DOMAIN:ref")
    String entity;

    @Option(names = "--start", description = "Inclusive export window start (ISO-8601 UTC)")
    Instant start;

    @Option(names = "--end", description = "Exclusive export window end (ISO-8601 UTC)")
    Instant end;

    @Option(names = "--max-staleness-seconds", description = "Overrides audit.maxStalenessSeconds")
    Long maxStalenessSeconds;

    @Option(names = "--output", description = "Bundle directory to create in export mode")
    Path output;

    @Option(names = "--bundle", description = "Bundle directory for verify mode")
    Path bundle;

    @Option(names = "--skip-freshness", description = "Report the freshness check as skipped", defaultValue = "false")
    boolean skipFreshness;

    @Option(names = "--skip-trace-chain", description = "Report the trace chain check as skipped", defaultValue = "false")
    boolean skipTraceChain;

    private final Clock clock;
    private final PrintStream out;

    public Main() {
        this(Clock.systemUTC(), System.out);
    }

    Main(Clock clock, PrintStream out) {
        this.clock = clock;
        this.out = out;
    }

    enum Mode {
        record,
        rotate,
        status,
        link,
        chain,
        export,
        verify
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        try {
            AppConfig config = AppConfig.load(Path.of(configPath));
            log.debug("Running {} mode with config {}", mode, configPath);
            return switch (mode) {
                case record -> record(config);
                case rotate -> rotate(config);
                case status -> status(config);
                case link -> link(config);
                case chain -> chain(config);
                case export -> export(config);
                case verify -> verify();
            };
        } catch (IllegalArgumentException e) {
            log.error("Invalid input: {}", e.getMessage());
            return EXIT_USAGE;
        } catch (TraceInvariantViolationException e) {
            log.error("Trace link rejected: {} context={}", e.getMessage(), e.context());
            return EXIT_FAILED;
        } catch (LedgerFormatException | TraceStoreCorruptedException e) {
            log.error("Stored data is corrupt: {}", e.getMessage());
            return EXIT_FAILED;
        } catch (IOException e) {
            log.error("Storage fault: {}", e.getMessage(), e);
            return EXIT_STORAGE;
        }
    }

    private int record(AppConfig config) throws IOException {
        if (isBlank(eventId) || isBlank(eventType)) {
            log.error("--event-id and --event-type are required in record mode");
            return EXIT_USAGE;
        }
        EventContext context = EventContext.EMPTY;
        if (contextJson != null) {
            Map<String, Object> raw;
            try {
                raw = CanonicalJson.parse(contextJson);
            } catch (IOException e) {
                log.error("--context is not a JSON object: {}", e.getMessage());
                return EXIT_USAGE;
            }
            context = EventContext.of(raw, ContextSchema.DEFAULT);
        }
        GovernanceEvent event = new GovernanceEvent(eventId, eventType, timestamp == null ? clock.instant() : timestamp,
                agentId, verb, target, decision, reasonCode, context);
        try (RotatingLedgerSink sink = openSink(config)) {
            sink.write(event);
            out.println("recorded " + event.eventId() + " -> " + sink.activePath());
        }
        return EXIT_OK;
    }

    private int rotate(AppConfig config) throws IOException {
        try (RotatingLedgerSink sink = openSink(config)) {
            sink.rotate();
            out.println("rotated " + sink.activePath());
        }
        return EXIT_OK;
    }

    private int status(AppConfig config) throws IOException {
        AppConfig.LedgerConfig ledger = config.getLedger();
        RetentionInfo info = new LedgerDirectory(Path.of(ledger.getPath()))
                .retentionInfo(ledger.getMaxSizeBytes(), ledger.getMaxFileCount());
        out.println("ledger " + info.activePath() + " policy=" + info.policyVersion()
                + " sealed=" + info.sealedFiles().size() + "/" + info.maxFileCount()
                + " activeBytes=" + info.activeSizeBytes() + " totalBytes=" + info.totalSizeBytes());
        for (RetentionInfo.SealedFile sealed : info.sealedFiles()) {
            out.println("  sealed #" + sealed.index() + " " + sealed.path().getFileName() + " " + sealed.sizeBytes() + " bytes");
        }
        TraceRegistry registry = TraceRegistry.load(Path.of(config.getTrace().getStorePath()), clock);
        out.println("trace links=" + registry.size() + " head=" + registry.headHash());
        return EXIT_OK;
    }

    private int link(AppConfig config) throws IOException {
        if (from == null || to == null || linkType == null) {
            log.error("--from, --to and --link-type are required in link mode");
            return EXIT_USAGE;
        }
        TraceNode source = parseNode("--from", from);
        TraceNode destination = parseNode("--to", to);
        TraceRegistry registry = TraceRegistry.open(Path.of(config.getTrace().getStorePath()), clock);
        TraceLink link = registry.registerLink(source.domain(), source.ref(), destination.domain(), destination.ref(),
                linkType, decisionRef);
        out.println(link.linkId() + " " + link.from() + " -> " + link.to() + " decision=" + link.decisionRef()
                + " hash=" + link.linkHash());
        return EXIT_OK;
    }

    private int chain(AppConfig config) throws IOException {
        if (entity == null) {
            log.error("--entity is required in chain mode");
            return EXIT_USAGE;
        }
        TraceNode node = parseNode("--entity", entity);
        TraceRegistry registry = TraceRegistry.load(Path.of(config.getTrace().getStorePath()), clock);
        TraceChain chain = registry.getChain(node.domain(), node.ref());
        for (TraceLink link : chain.links()) {
            out.println(link.linkId() + " " + link.from() + " -> " + link.to() + " [" + link.linkType() + "]");
        }
        for (Gap gap : chain.gaps()) {
            out.println("GAP " + gap.domain() + ":" + gap.expectedRef() + " " + gap.detail());
        }
        return chain.complete() ? EXIT_OK : EXIT_FAILED;
    }

    private int export(AppConfig config) throws IOException {
        AppConfig.AuditConfig audit = config.getAudit();
        Path destination = output != null
                ? output
                : Path.of(audit.getOutputDir()).resolve("bundle-" + BUNDLE_NAME_FORMATTER.format(clock.instant()));
        long staleness = maxStalenessSeconds != null ? maxStalenessSeconds : audit.getMaxStalenessSeconds();
        TraceRegistry registry = TraceRegistry.load(Path.of(config.getTrace().getStorePath()), clock);
        AuditBundleExporter exporter = new AuditBundleExporter(
                new LedgerDirectory(Path.of(config.getLedger().getPath())),
                registry,
                new GovernanceFingerprintEngine(Path.of(audit.getGovernanceRoot()), audit.getGovernancePaths()),
                artifactManifest(audit),
                clock);
        ExportResult result = exporter.export(new ExportRequest(start, end, staleness, destination));
        out.println("exported " + result.bundleId() + " to " + result.bundlePath() + " events=" + result.eventCount()
                + " links=" + result.linkCount() + " bundle_hash=" + result.bundleHash());
        return EXIT_OK;
    }

    private int verify() {
        if (bundle == null) {
            log.error("--bundle is required in verify mode");
            return EXIT_USAGE;
        }
        VerificationReport report = new AuditBundleVerifier(clock)
                .verify(bundle, new AuditBundleVerifier.Options(skipFreshness, skipTraceChain));
        for (CheckResult check : report.checks()) {
            out.println(check.status() + " " + check.name()
                    + (check.code() == null ? "" : " " + check.code())
                    + (check.detail() == null ? "" : " - " + check.detail()));
        }
        out.println(report.verdict());
        return report.passed() ? EXIT_OK : EXIT_FAILED;
    }

    private static Path artifactManifest(AppConfig.AuditConfig audit) {
        String configured = audit.getArtifactManifestPath();
        return isBlank(configured) ? null : Path.of(audit.getGovernanceRoot()).resolve(configured);
    }

    private RotatingLedgerSink openSink(AppConfig config) throws IOException {
        AppConfig.LedgerConfig ledger = config.getLedger();
        return new RotatingLedgerSink(Path.of(ledger.getPath()), ledger.getMaxSizeBytes(), ledger.getMaxFileCount());
    }

    static TraceNode parseNode(String option, String value) {
        int separator = value.indexOf(':');
        if (separator <= 0 || separator == value.length() - 1) {
            throw new IllegalArgumentException(option + " must look like DOMAIN:ref, got " + value);
        }
        TraceDomain domain;
        try {
            domain = TraceDomain.valueOf(value.substring(0, separator).toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(option + " has unknown domain " + value.substring(0, separator));
        }
        return new TraceNode(domain, value.substring(separator + 1));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
