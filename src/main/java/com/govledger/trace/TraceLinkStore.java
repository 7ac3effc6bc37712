package com.govledger.trace;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.govledger.event.CanonicalJson;
import com.govledger.event.InvalidRecordException;

public class TraceLinkStore {
    private static final Logger log = LoggerFactory.getLogger(TraceLinkStore.class);

    private final Path path;

    public TraceLinkStore(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

    public void append(TraceLink link) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        byte[] line = (CanonicalJson.canonicalString(link.toRecord()) + "\n").getBytes(StandardCharsets.UTF_8);
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE)) {
            long before = channel.size();
            try {
                ByteBuffer buffer = ByteBuffer.wrap(line);
                long position = before;
                while (buffer.hasRemaining()) {
                    position += channel.write(buffer, position);
                }
                channel.force(false);
            } catch (IOException e) {
                try {
                    channel.truncate(before);
                } catch (IOException truncateFailure) {
                    e.addSuppressed(truncateFailure);
                }
                throw e;
            }
        }
    }

    public List<TraceLink> readAll() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        byte[] bytes = Files.readAllBytes(path);
        int committed = committedLength(bytes);
        if (committed < bytes.length) {
            log.warn("Truncating torn trace record tail of {} bytes from {}", bytes.length - committed, path);
            try (FileChannel channel = FileChannel.open(path, StandardOpenOption.WRITE)) {
                channel.truncate(committed);
                channel.force(true);
            }
        }
        return parse(bytes, committed);
    }

    public List<TraceLink> readCommitted() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        byte[] bytes = Files.readAllBytes(path);
        int committed = committedLength(bytes);
        if (committed < bytes.length) {
            log.debug("Ignoring {} uncommitted bytes at the end of {}", bytes.length - committed, path);
        }
        return parse(bytes, committed);
    }

    private static int committedLength(byte[] bytes) {
        int committed = bytes.length;
        while (committed > 0 && bytes[committed - 1] != '\n') {
            committed--;
        }
        return committed;
    }

    private List<TraceLink> parse(byte[] bytes, int committed) throws TraceStoreCorruptedException {
        String content = new String(bytes, 0, committed, StandardCharsets.UTF_8);
        List<TraceLink> links = new ArrayList<>();
        int lineNumber = 0;
        for (String line : content.split("\n")) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                links.add(TraceLink.fromRecord(CanonicalJson.parse(line)));
            } catch (IOException | InvalidRecordException e) {
                throw new TraceStoreCorruptedException(
                        "Unreadable trace record at " + path + ":" + lineNumber, links.size(), e);
            }
        }
        return links;
    }
}
