package com.govledger.ledger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

final class LedgerFiles {
    private static final int SCAN_CHUNK = 8192;

    private final Path active;
    private final Path directory;
    private final String sealedPrefix;

    LedgerFiles(Path active) {
        Path absolute = active.toAbsolutePath().normalize();
        this.active = absolute;
        this.directory = absolute.getParent();
        this.sealedPrefix = absolute.getFileName().toString() + ".";
    }

    Path active() {
        return active;
    }

    Path directory() {
        return directory;
    }

    Path sealed(int index) {
        return directory.resolve(sealedPrefix + index);
    }

    NavigableMap<Integer, Path> sealedFiles() throws IOException {
        NavigableMap<Integer, Path> sealed = new TreeMap<>();
        if (!Files.isDirectory(directory)) {
            return sealed;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, sealedPrefix + "*")) {
            for (Path candidate : stream) {
                Integer index = suffixIndex(candidate.getFileName().toString());
                if (index != null && Files.isRegularFile(candidate)) {
                    sealed.put(index, candidate);
                }
            }
        }
        return sealed;
    }

    List<Path> oldestFirst() throws IOException {
        List<Path> ordered = new ArrayList<>(sealedFiles().descendingMap().values());
        if (Files.exists(active)) {
            ordered.add(active);
        }
        return ordered;
    }

    RetentionInfo retentionInfo(String policyVersion, long maxSizeBytes, int maxFileCount, long activeSize, SinkState state)
            throws IOException {
        List<RetentionInfo.SealedFile> sealedFiles = new ArrayList<>();
        long total = activeSize;
        for (var entry : sealedFiles().entrySet()) {
            long size = Files.size(entry.getValue());
            sealedFiles.add(new RetentionInfo.SealedFile(entry.getKey(), entry.getValue(), size));
            total += size;
        }
        int fileCount = sealedFiles.size() + (Files.exists(active) ? 1 : 0);
        return new RetentionInfo(policyVersion, maxSizeBytes, maxFileCount, active, activeSize, fileCount, total,
                List.copyOf(sealedFiles), state);
    }

    private Integer suffixIndex(String fileName) {
        String suffix = fileName.substring(sealedPrefix.length());
        if (suffix.isEmpty() || suffix.length() > 9) {
            return null;
        }
        for (int i = 0; i < suffix.length(); i++) {
            if (!Character.isDigit(suffix.charAt(i))) {
                return null;
            }
        }
        int index = Integer.parseInt(suffix);
        return index > 0 ? index : null;
    }

    static long committedLength(Path file) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            return committedLength(channel, channel.size());
        }
    }

    static long committedLength(FileChannel channel, long size) throws IOException {
        long end = size;
        ByteBuffer buffer = ByteBuffer.allocate(SCAN_CHUNK);
        while (end > 0) {
            long start = Math.max(0, end - SCAN_CHUNK);
            buffer.clear();
            buffer.limit((int) (end - start));
            int total = 0;
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, start + total);
                if (read < 0) {
                    break;
                }
                total += read;
            }
            for (int i = total - 1; i >= 0; i--) {
                if (buffer.get(i) == '\n') {
                    return start + i + 1;
                }
            }
            end = start;
        }
        return 0;
    }
}
