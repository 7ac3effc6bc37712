package com.govledger.ledger;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.govledger.event.GovernanceEvent;

/**
 * Size- and count-bounded append-only writer for governance events.
 *
 * <p>Every {@link #write} and {@link #rotate} runs under one writer lock. A record is appended
 * and forced to disk before {@code write} returns, so readers of the active file only ever see
 * whole lines. When the next record would push the active file past {@code maxSizeBytes} the
 * active file is sealed first: sealed suffixes shift up one slot (highest first), the active
 * file becomes slot 1 and any slot beyond {@code maxFileCount} is deleted, oldest first.
 *
 * <p>A rotation that fails half-way leaves the sink {@link SinkState#FAILED}; writes are then
 * refused with {@link StorageFaultException} until {@link #clearFailure()} succeeds.
 */
public class RotatingLedgerSink implements LedgerSource, Closeable {
    public static final long DEFAULT_MAX_SIZE_BYTES = 50L * 1024 * 1024;
    public static final int DEFAULT_MAX_FILE_COUNT = 20;
    public static final String RETENTION_POLICY_VERSION = "1.0.0";

    private static final Logger log = LoggerFactory.getLogger(RotatingLedgerSink.class);

    private final LedgerFiles files;
    private final long maxSizeBytes;
    private final int maxFileCount;
    private final FileMover fileMover;
    private final ReentrantLock writeLock = new ReentrantLock();

    private FileChannel channel;
    private long activeSize;
    private SinkState state = SinkState.ACTIVE;
    private IOException failureCause;

    public RotatingLedgerSink(Path activePath) throws IOException {
        this(activePath, DEFAULT_MAX_SIZE_BYTES, DEFAULT_MAX_FILE_COUNT);
    }

    public RotatingLedgerSink(Path activePath, long maxSizeBytes, int maxFileCount) throws IOException {
        this(activePath, maxSizeBytes, maxFileCount, RotatingLedgerSink::atomicMove);
    }

    RotatingLedgerSink(Path activePath, long maxSizeBytes, int maxFileCount, FileMover fileMover) throws IOException {
        if (maxSizeBytes <= 0) {
            throw new IllegalArgumentException("maxSizeBytes must be positive");
        }
        if (maxFileCount < 1) {
            throw new IllegalArgumentException("maxFileCount must be at least 1");
        }
        this.files = new LedgerFiles(activePath);
        this.maxSizeBytes = maxSizeBytes;
        this.maxFileCount = maxFileCount;
        this.fileMover = fileMover;
        Files.createDirectories(files.directory());
        recoverTornTail();
        this.channel = openActive();
        this.activeSize = channel.size();
        log.debug("Opened ledger {} activeSize={} maxSizeBytes={} maxFileCount={}",
                files.active(), activeSize, maxSizeBytes, maxFileCount);
    }

    public void write(GovernanceEvent event) throws StorageFaultException {
        byte[] canonical = event.canonicalBytes();
        byte[] line = new byte[canonical.length + 1];
        System.arraycopy(canonical, 0, line, 0, canonical.length);
        line[canonical.length] = '\n';

        writeLock.lock();
        try {
            ensureWritable();
            if (activeSize > 0 && activeSize + line.length > maxSizeBytes) {
                rotateLocked();
            }
            long before = activeSize;
            try {
                ByteBuffer buffer = ByteBuffer.wrap(line);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(false);
            } catch (IOException e) {
                rollBackPartialWrite(before, e);
                throw new StorageFaultException("Failed to append event " + event.eventId() + " to " + files.active(), e);
            }
            activeSize = before + line.length;
        } finally {
            writeLock.unlock();
        }
    }

    public void rotate() throws StorageFaultException {
        writeLock.lock();
        try {
            ensureWritable();
            if (activeSize == 0) {
                log.debug("Skipping rotation of empty ledger {}", files.active());
                return;
            }
            rotateLocked();
        } finally {
            writeLock.unlock();
        }
    }

    public void clearFailure() throws StorageFaultException {
        writeLock.lock();
        try {
            if (state != SinkState.FAILED) {
                return;
            }
            try {
                if (channel != null && channel.isOpen()) {
                    channel.close();
                }
                channel = null;
                recoverTornTail();
                channel = openActive();
                activeSize = channel.size();
                pruneBeyondLimit();
            } catch (IOException e) {
                failureCause = e;
                throw new StorageFaultException("Could not recover ledger " + files.active(), e);
            }
            log.info("Ledger {} recovered from FAILED state (cause was: {})", files.active(),
                    failureCause == null ? "unknown" : failureCause.getMessage());
            state = SinkState.ACTIVE;
            failureCause = null;
        } finally {
            writeLock.unlock();
        }
    }

    public SinkState state() {
        writeLock.lock();
        try {
            return state;
        } finally {
            writeLock.unlock();
        }
    }

    public Path activePath() {
        return files.active();
    }

    public RetentionInfo retentionInfo() throws IOException {
        writeLock.lock();
        try {
            return files.retentionInfo(RETENTION_POLICY_VERSION, maxSizeBytes, maxFileCount, activeSize, state);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public LedgerSnapshot openSnapshot() throws IOException {
        writeLock.lock();
        try {
            if (state != SinkState.ACTIVE) {
                return new LedgerDirectory(files.active()).openSnapshot();
            }
            List<LedgerSnapshot.Segment> segments = new ArrayList<>();
            try {
                for (Map.Entry<Integer, Path> entry : files.sealedFiles().descendingMap().entrySet()) {
                    FileChannel sealed = FileChannel.open(entry.getValue(), StandardOpenOption.READ);
                    segments.add(new LedgerSnapshot.Segment(entry.getValue().getFileName().toString(),
                            entry.getValue(), sealed, sealed.size()));
                }
                FileChannel current = FileChannel.open(files.active(), StandardOpenOption.READ);
                segments.add(new LedgerSnapshot.Segment(files.active().getFileName().toString(),
                        files.active(), current, activeSize));
            } catch (IOException e) {
                LedgerSnapshot.closeAll(segments, e);
                throw e;
            }
            return new LedgerSnapshot(segments);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void close() throws IOException {
        writeLock.lock();
        try {
            if (state == SinkState.CLOSED) {
                return;
            }
            state = SinkState.CLOSED;
            if (channel != null && channel.isOpen()) {
                channel.force(true);
                channel.close();
            }
        } finally {
            writeLock.unlock();
        }
    }

    private void rotateLocked() throws StorageFaultException {
        try {
            channel.force(true);
            channel.close();
            channel = null;

            NavigableMap<Integer, Path> sealed = files.sealedFiles();
            for (Map.Entry<Integer, Path> entry : sealed.descendingMap().entrySet()) {
                fileMover.move(entry.getValue(), files.sealed(entry.getKey() + 1));
            }
            fileMover.move(files.active(), files.sealed(1));

            channel = openActive();
            activeSize = 0;
            pruneBeyondLimit();
            log.info("Rotated ledger {} -> {}", files.active(), files.sealed(1).getFileName());
        } catch (IOException e) {
            state = SinkState.FAILED;
            failureCause = e;
            log.error("Rotation of ledger {} failed; sink is FAILED until cleared", files.active(), e);
            throw new StorageFaultException("Rotation of " + files.active() + " failed", e);
        }
    }

    private void pruneBeyondLimit() throws IOException {
        for (Map.Entry<Integer, Path> entry : files.sealedFiles().descendingMap().entrySet()) {
            if (entry.getKey() <= maxFileCount) {
                break;
            }
            Files.delete(entry.getValue());
            log.info("Deleted sealed ledger file {} (exceeds maxFileCount={})", entry.getValue().getFileName(), maxFileCount);
        }
    }

    private void ensureWritable() throws StorageFaultException {
        if (state == SinkState.CLOSED) {
            throw new IllegalStateException("Ledger sink is closed: " + files.active());
        }
        if (state == SinkState.FAILED) {
            throw new StorageFaultException("Ledger sink is FAILED; call clearFailure() first: " + files.active(), failureCause);
        }
    }

    private void rollBackPartialWrite(long committedSize, IOException cause) {
        try {
            channel.truncate(committedSize);
            channel.force(false);
        } catch (IOException truncateFailure) {
            cause.addSuppressed(truncateFailure);
            state = SinkState.FAILED;
            failureCause = cause;
            log.error("Could not roll back partial write on {}; sink is FAILED", files.active(), truncateFailure);
        }
    }

    private void recoverTornTail() throws IOException {
        Path active = files.active();
        if (!Files.exists(active)) {
            return;
        }
        try (FileChannel rw = FileChannel.open(active, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            long size = rw.size();
            long committed = LedgerFiles.committedLength(rw, size);
            if (committed < size) {
                log.warn("Truncating torn record tail of {} bytes from {}", size - committed, active);
                rw.truncate(committed);
                rw.force(true);
            }
        }
    }

    private FileChannel openActive() throws IOException {
        return FileChannel.open(files.active(), StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    private static void atomicMove(Path source, Path target) throws IOException {
        Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
    }

    @FunctionalInterface
    interface FileMover {
        void move(Path source, Path target) throws IOException;
    }
}
