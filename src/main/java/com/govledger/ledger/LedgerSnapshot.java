package com.govledger.ledger;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LedgerSnapshot implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(LedgerSnapshot.class);

    private final List<Segment> segments;

    LedgerSnapshot(List<Segment> segments) {
        this.segments = List.copyOf(segments);
    }

    public List<Segment> segments() {
        return segments;
    }

    public long totalBytes() {
        return segments.stream().mapToLong(Segment::length).sum();
    }

    public void forEachLine(LineVisitor visitor) throws IOException {
        for (Segment segment : segments) {
            long lineNumber = 0;
            try (InputStream in = new BufferedInputStream(new BoundedChannelInputStream(segment.channel(), segment.length()))) {
                ByteArrayOutputStream line = new ByteArrayOutputStream(512);
                int b;
                while ((b = in.read()) != -1) {
                    if (b == '\n') {
                        lineNumber++;
                        visitor.visit(segment.name(), lineNumber, line.toByteArray());
                        line.reset();
                    } else {
                        line.write(b);
                    }
                }
            }
        }
    }

    @Override
    public void close() throws IOException {
        IOException first = null;
        for (Segment segment : segments) {
            try {
                segment.channel().close();
            } catch (IOException e) {
                if (first == null) {
                    first = e;
                } else {
                    first.addSuppressed(e);
                }
            }
        }
        if (first != null) {
            throw first;
        }
    }

    static void closeAll(List<Segment> segments, IOException cause) {
        for (Segment segment : segments) {
            try {
                segment.channel().close();
            } catch (IOException e) {
                cause.addSuppressed(e);
            }
        }
    }

    static void closeQuietly(List<Segment> segments) {
        for (Segment segment : segments) {
            try {
                segment.channel().close();
            } catch (IOException e) {
                log.debug("Could not close discarded snapshot segment {}", segment.path(), e);
            }
        }
    }

    public record Segment(String name, Path path, FileChannel channel, long length) {
    }

    @FunctionalInterface
    public interface LineVisitor {
        void visit(String segment, long lineNumber, byte[] line) throws IOException;
    }

    private static final class BoundedChannelInputStream extends InputStream {
        private final FileChannel channel;
        private final long length;
        private long position;

        private BoundedChannelInputStream(FileChannel channel, long length) {
            this.channel = channel;
            this.length = length;
        }

        @Override
        public int read() throws IOException {
            byte[] single = new byte[1];
            int n = read(single, 0, 1);
            return n == -1 ? -1 : single[0] & 0xFF;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (position >= length) {
                return -1;
            }
            int toRead = (int) Math.min(len, length - position);
            int n = channel.read(ByteBuffer.wrap(b, off, toRead), position);
            if (n < 0) {
                throw new IOException("ledger segment shrank below its snapshot length");
            }
            position += n;
            return n;
        }

        @Override
        public void close() {
            // the snapshot owns the channel
        }
    }
}
