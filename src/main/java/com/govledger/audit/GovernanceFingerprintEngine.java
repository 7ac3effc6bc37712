package com.govledger.audit;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.govledger.event.Hashing;

public class GovernanceFingerprintEngine {
    private static final Logger log = LoggerFactory.getLogger(GovernanceFingerprintEngine.class);

    private final Path root;
    private final List<String> paths;

    public GovernanceFingerprintEngine(Path root, List<String> paths) {
        this.root = root.toAbsolutePath().normalize();
        this.paths = List.copyOf(paths);
    }

    public GovernanceFingerprint compute() throws IOException {
        TreeMap<String, GovernanceFingerprint.FileFingerprint> files = new TreeMap<>();
        for (String configured : paths) {
            Path resolved = root.resolve(configured).normalize();
            if (!resolved.startsWith(root)) {
                throw new IllegalArgumentException("Governance path escapes root " + root + ": " + configured);
            }
            if (Files.isDirectory(resolved)) {
                List<Path> children;
                try (Stream<Path> walk = Files.walk(resolved)) {
                    children = walk.filter(Files::isRegularFile).toList();
                }
                for (Path child : children) {
                    addFile(files, child);
                }
            } else if (Files.isRegularFile(resolved)) {
                addFile(files, resolved);
            } else {
                String relative = relative(resolved);
                log.warn("Governance path {} is missing; recorded as {}", relative, GovernanceFingerprint.MISSING);
                files.put(relative, new GovernanceFingerprint.FileFingerprint(relative, GovernanceFingerprint.MISSING, -1));
            }
        }
        GovernanceFingerprint fingerprint = GovernanceFingerprint.of(new ArrayList<>(files.values()));
        log.debug("Computed governance fingerprint over {} files: {}", files.size(), fingerprint.compositeHash());
        return fingerprint;
    }

    private void addFile(TreeMap<String, GovernanceFingerprint.FileFingerprint> files, Path file) throws IOException {
        String relative = relative(file);
        files.put(relative, new GovernanceFingerprint.FileFingerprint(relative, Hashing.sha256Hex(file), Files.size(file)));
    }

    private String relative(Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }
}
