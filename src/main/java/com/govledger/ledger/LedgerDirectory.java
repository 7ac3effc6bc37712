package com.govledger.ledger;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only access to a rotation set on disk without owning its writer, e.g. for an offline
 * export. The active file is bounded at its last newline so a record still being appended is
 * never included. A writer in another process may rotate meanwhile, so every opened file is
 * checked against a fresh listing and the snapshot is retried if a slot moved.
 */
public class LedgerDirectory implements LedgerSource {
    private static final Logger log = LoggerFactory.getLogger(LedgerDirectory.class);
    private static final int MAX_ATTEMPTS = 3;

    private final LedgerFiles files;
    private final OpenListener openListener;

    public LedgerDirectory(Path activePath) {
        this(activePath, path -> {
        });
    }

    LedgerDirectory(Path activePath, OpenListener openListener) {
        this.files = new LedgerFiles(activePath);
        this.openListener = openListener;
    }

    public Path activePath() {
        return files.active();
    }

    public List<Path> filesOldestFirst() throws IOException {
        return files.oldestFirst();
    }

    public RetentionInfo retentionInfo(long maxSizeBytes, int maxFileCount) throws IOException {
        long activeSize = Files.exists(files.active()) ? LedgerFiles.committedLength(files.active()) : 0L;
        return files.retentionInfo(RotatingLedgerSink.RETENTION_POLICY_VERSION, maxSizeBytes, maxFileCount, activeSize, null);
    }

    @Override
    public LedgerSnapshot openSnapshot() throws IOException {
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                LedgerSnapshot snapshot = tryOpen();
                if (snapshot != null) {
                    return snapshot;
                }
                log.debug("Ledger {} rotated while opening snapshot (attempt {})", files.active(), attempt);
            } catch (NoSuchFileException e) {
                log.debug("Ledger file vanished while opening snapshot (attempt {}): {}", attempt, e.getFile());
            }
        }
        throw new IOException("Ledger " + files.active() + " kept rotating while a snapshot was opened ("
                + MAX_ATTEMPTS + " attempts)");
    }

    // null when the set changed while it was being opened
    private LedgerSnapshot tryOpen() throws IOException {
        List<Path> listed = files.oldestFirst();
        List<FileIdentity> identities = new ArrayList<>();
        List<LedgerSnapshot.Segment> segments = new ArrayList<>();
        try {
            for (Path path : listed) {
                FileIdentity before = FileIdentity.of(path);
                FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
                boolean active = path.equals(files.active());
                long size = channel.size();
                long length = active ? LedgerFiles.committedLength(channel, size) : size;
                segments.add(new LedgerSnapshot.Segment(path.getFileName().toString(), path, channel, length));
                openListener.opened(path);
                if (!before.sameFile(FileIdentity.of(path))) {
                    LedgerSnapshot.closeQuietly(segments);
                    return null;
                }
                identities.add(active ? before.withoutSize() : before.withSize(size));
            }
            if (!listed.equals(files.oldestFirst())) {
                LedgerSnapshot.closeQuietly(segments);
                return null;
            }
            for (int i = 0; i < listed.size(); i++) {
                FileIdentity now = FileIdentity.of(listed.get(i));
                if (!identities.get(i).matches(now)) {
                    LedgerSnapshot.closeQuietly(segments);
                    return null;
                }
            }
        } catch (IOException e) {
            LedgerSnapshot.closeAll(segments, e);
            throw e;
        }
        return new LedgerSnapshot(segments);
    }

    // fileKey is the inode where the platform has one. Size is compared for sealed files only.
    private record FileIdentity(Object key, FileTime created, long size) {
        private static final long ANY_SIZE = -1;

        static FileIdentity of(Path path) throws IOException {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            return new FileIdentity(attributes.fileKey(), attributes.creationTime(), attributes.size());
        }

        boolean sameFile(FileIdentity other) {
            if (key != null || other.key != null) {
                return Objects.equals(key, other.key);
            }
            return Objects.equals(created, other.created);
        }

        boolean matches(FileIdentity other) {
            return sameFile(other) && (size == ANY_SIZE || size == other.size);
        }

        FileIdentity withSize(long observed) {
            return new FileIdentity(key, created, observed);
        }

        FileIdentity withoutSize() {
            return new FileIdentity(key, created, ANY_SIZE);
        }
    }

    interface OpenListener {
        void opened(Path path) throws IOException;
    }
}
