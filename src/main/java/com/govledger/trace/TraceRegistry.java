package com.govledger.trace;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.govledger.event.InvalidRecordException;

/**
 * Append-only, hash-chained registry of links between decisions, executions, settlements and
 * ledger entries.
 *
 * <p>Registration is serialized by a write lock; each link's {@code prevHash} is the head hash
 * at the moment it is appended. When backed by a {@link TraceLinkStore} the link is forced to
 * disk before the head advances, so a failed append leaves the registry unchanged.
 */
public class TraceRegistry {
    public static final String GENESIS_HASH = "0".repeat(64);
    public static final String MISSING_REF = "MISSING";

    private static final Logger log = LoggerFactory.getLogger(TraceRegistry.class);

    private final TraceLinkStore store;
    private final Clock clock;
    private final boolean readOnly;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final List<TraceLink> links = new ArrayList<>();
    private final Map<TraceNode, List<TraceLink>> bySource = new HashMap<>();
    private final Map<TraceNode, List<TraceLink>> byTarget = new HashMap<>();
    private final Map<String, String> settlementDecisions = new HashMap<>();
    private String headHash = GENESIS_HASH;

    public TraceRegistry() {
        this(null, Clock.systemUTC());
    }

    public TraceRegistry(Clock clock) {
        this(null, clock);
    }

    TraceRegistry(TraceLinkStore store, Clock clock) {
        this(store, clock, false);
    }

    private TraceRegistry(TraceLinkStore store, Clock clock, boolean readOnly) {
        this.store = store;
        this.clock = clock;
        this.readOnly = readOnly;
    }

    public static TraceRegistry open(Path storePath) throws IOException {
        return open(storePath, Clock.systemUTC());
    }

    public static TraceRegistry open(Path storePath, Clock clock) throws IOException {
        TraceLinkStore store = new TraceLinkStore(storePath);
        return restore(store, store.readAll(), clock, false);
    }

    public static TraceRegistry load(Path storePath) throws IOException {
        return load(storePath, Clock.systemUTC());
    }

    public static TraceRegistry load(Path storePath, Clock clock) throws IOException {
        TraceLinkStore store = new TraceLinkStore(storePath);
        return restore(store, store.readCommitted(), clock, true);
    }

    private static TraceRegistry restore(TraceLinkStore store, List<TraceLink> stored, Clock clock, boolean readOnly)
            throws TraceStoreCorruptedException {
        Path storePath = store.path();
        ChainVerification verification = TraceChainVerifier.verify(stored, GENESIS_HASH);
        if (!verification.valid()) {
            throw new TraceStoreCorruptedException("Trace store " + storePath + " failed verification at index "
                    + verification.firstInvalidIndex() + ": " + verification.reason(), verification.firstInvalidIndex());
        }
        TraceRegistry registry = new TraceRegistry(store, clock, readOnly);
        for (int i = 0; i < stored.size(); i++) {
            TraceLink link = stored.get(i);
            if (link.sequence() != i) {
                throw new TraceStoreCorruptedException("Trace store " + storePath + " has sequence "
                        + link.sequence() + " at index " + i, i);
            }
            registry.index(link);
        }
        log.info("Loaded {} trace links from {} head={}{}", stored.size(), storePath, registry.headHash,
                readOnly ? " (read-only)" : "");
        return registry;
    }

    public TraceLink registerLink(TraceDomain fromDomain, String fromRef, TraceDomain toDomain, String toRef,
            TraceLinkType linkType) throws IOException {
        return registerLink(fromDomain, fromRef, toDomain, toRef, linkType, null);
    }

    public TraceLink registerLink(TraceDomain fromDomain, String fromRef, TraceDomain toDomain, String toRef,
            TraceLinkType linkType, String decisionRef) throws IOException {
        if (readOnly) {
            throw new IllegalStateException("Trace registry loaded read-only from " + store.path());
        }
        requireDomain("from_domain", fromDomain);
        requireDomain("to_domain", toDomain);
        requireRef("from_ref", fromRef);
        requireRef("to_ref", toRef);
        if (linkType == null) {
            throw new InvalidRecordException("link_type", "required field is missing");
        }
        if (decisionRef != null) {
            requireRef("decision_ref", decisionRef);
        }

        lock.writeLock().lock();
        try {
            String resolved = resolveDecision(fromDomain, fromRef, toDomain, toRef, decisionRef);
            enforceInvariants(fromDomain, fromRef, toDomain, toRef, resolved);

            long sequence = links.size();
            TraceLink link = new TraceLink(linkId(sequence), sequence, fromDomain, fromRef, toDomain, toRef,
                    linkType, resolved, clock.instant(), headHash, null).sealed();
            if (store != null) {
                store.append(link);
            }
            index(link);
            log.debug("Registered {} {} -> {} decision={} hash={}", link.linkId(), link.from(), link.to(),
                    resolved, link.linkHash());
            return link;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public TraceChain getChain(TraceDomain domain, String ref) {
        TraceNode start = new TraceNode(domain, ref);
        lock.readLock().lock();
        try {
            if (!bySource.containsKey(start) && !byTarget.containsKey(start)) {
                return new TraceChain(domain, ref, List.of(), List.of(),
                        List.of(new Gap(domain, ref, "no trace link registered for " + start)));
            }
            Set<TraceLink> collected = new TreeSet<>(Comparator.comparingLong(TraceLink::sequence));
            walk(start, byTarget, TraceLink::from, collected);
            walk(start, bySource, TraceLink::to, collected);

            List<TraceLink> ordered = new ArrayList<>(collected);
            Set<TraceNode> nodes = new LinkedHashSet<>();
            Set<TraceNode> targets = new HashSet<>();
            for (TraceLink link : ordered) {
                nodes.add(link.from());
                nodes.add(link.to());
                targets.add(link.to());
            }
            return new TraceChain(domain, ref, ordered, new ArrayList<>(nodes), findGaps(ordered, nodes, targets));
        } finally {
            lock.readLock().unlock();
        }
    }

    public ChainVerification verifyChain() {
        return TraceChainVerifier.verify(links(), GENESIS_HASH);
    }

    public List<TraceLink> links() {
        lock.readLock().lock();
        try {
            return List.copyOf(links);
        } finally {
            lock.readLock().unlock();
        }
    }

    public String headHash() {
        lock.readLock().lock();
        try {
            return headHash;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return links.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<TraceLink> linksFrom(TraceDomain domain, String ref) {
        lock.readLock().lock();
        try {
            return List.copyOf(bySource.getOrDefault(new TraceNode(domain, ref), List.of()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<TraceLink> linksTo(TraceDomain domain, String ref) {
        lock.readLock().lock();
        try {
            return List.copyOf(byTarget.getOrDefault(new TraceNode(domain, ref), List.of()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<String> decisionOf(String settlementRef) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(settlementDecisions.get(settlementRef));
        } finally {
            lock.readLock().unlock();
        }
    }

    private void index(TraceLink link) {
        links.add(link);
        bySource.computeIfAbsent(link.from(), k -> new ArrayList<>()).add(link);
        byTarget.computeIfAbsent(link.to(), k -> new ArrayList<>()).add(link);
        if (link.toDomain() == TraceDomain.SETTLEMENT && link.decisionRef() != null) {
            settlementDecisions.putIfAbsent(link.toRef(), link.decisionRef());
        }
        headHash = link.linkHash();
    }

    private String resolveDecision(TraceDomain fromDomain, String fromRef, TraceDomain toDomain, String toRef,
            String explicit) {
        String inherited;
        if (toDomain == TraceDomain.DECISION) {
            inherited = toRef;
        } else if (fromDomain == TraceDomain.DECISION) {
            inherited = fromRef;
        } else {
            Set<String> upstream = new TreeSet<>();
            for (TraceLink link : byTarget.getOrDefault(new TraceNode(fromDomain, fromRef), List.of())) {
                if (link.decisionRef() != null) {
                    upstream.add(link.decisionRef());
                }
            }
            if (upstream.size() > 1) {
                throw violation(TraceInvariantViolationException.Rule.AMBIGUOUS_DECISION_ORIGIN,
                        fromDomain + ":" + fromRef + " traces to more than one decision " + upstream,
                        fromDomain, fromRef, toDomain, toRef, String.join(",", upstream));
            }
            inherited = upstream.isEmpty() ? null : upstream.iterator().next();
        }
        if (explicit == null) {
            return inherited;
        }
        if (inherited != null && !inherited.equals(explicit)) {
            throw violation(TraceInvariantViolationException.Rule.DECISION_REF_CONFLICT,
                    "supplied decision " + explicit + " but " + fromDomain + ":" + fromRef + " traces to " + inherited,
                    fromDomain, fromRef, toDomain, toRef, explicit);
        }
        return explicit;
    }

    private void enforceInvariants(TraceDomain fromDomain, String fromRef, TraceDomain toDomain, String toRef,
            String decisionRef) {
        if (decisionRef == null && (touches(TraceDomain.EXECUTION, fromDomain, toDomain)
                || touches(TraceDomain.SETTLEMENT, fromDomain, toDomain))) {
            throw violation(TraceInvariantViolationException.Rule.ORPHAN_LINK,
                    "link " + fromDomain + ":" + fromRef + " -> " + toDomain + ":" + toRef
                            + " has no originating decision reference",
                    fromDomain, fromRef, toDomain, toRef, null);
        }
        if (toDomain == TraceDomain.SETTLEMENT) {
            String existing = settlementDecisions.get(toRef);
            if (existing != null && !existing.equals(decisionRef)) {
                throw violation(TraceInvariantViolationException.Rule.SETTLEMENT_FAN_IN,
                        "settlement " + toRef + " already traces to decision " + existing + ", not " + decisionRef,
                        fromDomain, fromRef, toDomain, toRef, decisionRef);
            }
        }
    }

    private static boolean touches(TraceDomain domain, TraceDomain fromDomain, TraceDomain toDomain) {
        return fromDomain == domain || toDomain == domain;
    }

    private static void walk(TraceNode start, Map<TraceNode, List<TraceLink>> edges,
            Function<TraceLink, TraceNode> next, Set<TraceLink> collected) {
        Deque<TraceNode> queue = new ArrayDeque<>();
        Set<TraceNode> visited = new HashSet<>();
        queue.add(start);
        visited.add(start);
        while (!queue.isEmpty()) {
            TraceNode node = queue.poll();
            for (TraceLink link : edges.getOrDefault(node, List.of())) {
                collected.add(link);
                TraceNode neighbour = next.apply(link);
                if (visited.add(neighbour)) {
                    queue.add(neighbour);
                }
            }
        }
    }

    private static List<Gap> findGaps(List<TraceLink> ordered, Set<TraceNode> nodes, Set<TraceNode> targets) {
        List<Gap> gaps = new ArrayList<>();
        for (TraceNode node : nodes) {
            if (!targets.contains(node) && node.domain() != TraceDomain.DECISION) {
                gaps.add(new Gap(TraceDomain.DECISION, MISSING_REF,
                        "chain rooted at " + node + " does not start in the DECISION domain"));
            }
        }
        for (TraceLink link : ordered) {
            int from = link.fromDomain().ordinal();
            int to = link.toDomain().ordinal();
            for (int skipped = from + 1; skipped < to; skipped++) {
                TraceDomain domain = TraceDomain.values()[skipped];
                gaps.add(new Gap(domain, MISSING_REF,
                        "no " + domain + " hop between " + link.from() + " and " + link.to()));
            }
        }
        return gaps;
    }

    private static TraceInvariantViolationException violation(TraceInvariantViolationException.Rule rule,
            String message, TraceDomain fromDomain, String fromRef, TraceDomain toDomain, String toRef,
            String decisionRef) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put("from", fromDomain + ":" + fromRef);
        context.put("to", toDomain + ":" + toRef);
        if (decisionRef != null) {
            context.put("decision_ref", decisionRef);
        }
        return new TraceInvariantViolationException(rule, message, context);
    }

    private static void requireDomain(String field, TraceDomain domain) {
        if (domain == null) {
            throw new InvalidRecordException(field, "required field is missing");
        }
    }

    private static void requireRef(String field, String ref) {
        if (ref == null || ref.isBlank()) {
            throw new InvalidRecordException(field, "must be a non-blank reference");
        }
    }

    private static String linkId(long sequence) {
        return String.format("link-%08d", sequence);
    }
}
