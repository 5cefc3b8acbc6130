// file: storage/src/main/java/io/dripline/storage/FileWal.java
package io.dripline.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed WAL that appends header+payload records to segment files.
 * <p>
 * Properties:
 *  - On construction, it:
 *      - creates the directory if needed,
 *      - finds the newest segment ("00000001.log", "00000002.log", ...),
 *      - cuts off a torn tail left by a crash, so new records are not
 *        written behind bytes the reader would stop at,
 *      - opens it for append.
 * <p>
 *  - append(): writes the bytes and calls force(true).
 *  - rotateIfNeeded(): once the segment reaches rotateBytes, starts the next one.
 *  - checkpoint(): after a snapshot, starts the next segment and deletes the
 *    older ones, so disk use is bounded by one snapshot interval of records.
 * <p>
 *  - Reader: walks all segments in name order, validates magic/version/length
 *    and CRC, and stops at the first bad record.
 */
public class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new UncheckedIOException(e); }
        openNewestOrCreate();
    }

    @Override
    public void append(byte[] serializedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) ch.write(buf);
            ch.force(true); // fsync: metadata too, so new file appears durable after rotation
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            throw new UncheckedIOException("WAL append failed", e);
        }
    }

    @Override
    public void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        try {
            ch.close();
            int next = segmentNumber(current) + 1;
            current = dir.resolve(segmentName(next));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
            log.fine(() -> "WAL rotated to " + current.getFileName());
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    @Override
    public void checkpoint() {
        try {
            ch.close();
            current = dir.resolve(segmentName(segmentNumber(current) + 1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
        } catch (IOException e) { throw new UncheckedIOException(e); }

        int keep = segmentNumber(current);
        int dropped = 0;
        for (Path seg : segments(dir)) {
            if (segmentNumber(seg) >= keep) continue;
            try {
                Files.deleteIfExists(seg);
                dropped++;
            } catch (IOException e) {
                throw new UncheckedIOException("could not delete WAL segment " + seg.getFileName(), e);
            }
        }
        int n = dropped;
        log.fine(() -> "WAL checkpoint: now on " + current.getFileName() + ", dropped " + n + " segments");
    }

    @Override
    public WalReader openReader() { return new Reader(segments(dir)); }

    @Override
    public void close() {
        try {
            if (ch != null) ch.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * On startup:
     *  - If there are existing segments, open the newest one, drop any torn
     *    tail and position at the end.
     *  - If none, create "00000001.log".
     */
    private void openNewestOrCreate() {
        try {
            List<Path> segs = segments(dir);
            current = segs.isEmpty() ? dir.resolve(segmentName(1)) : segs.get(segs.size() - 1);
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            long valid = validLength(ch);
            if (valid < ch.size()) {
                log.warning("WAL segment " + current.getFileName() + " has a torn tail; truncating "
                        + (ch.size() - valid) + " bytes");
                ch.truncate(valid);
                ch.force(true);
            }
            writtenInSegment = valid;
            ch.position(valid);
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    private static String segmentName(int n) {
        return String.format("%08d.log", n);
    }

    private static int segmentNumber(Path seg) {
        return Integer.parseInt(seg.getFileName().toString().replace(".log", ""));
    }

    /** Byte length of the longest prefix of valid records. */
    private static long validLength(FileChannel ch) throws IOException {
        long pos = 0;
        while (true) {
            int len = readRecordLength(ch, pos, null);
            if (len < 0) return pos;
            pos += MutationCodec.HEADER_LEN + len;
        }
    }

    /**
     * Read and validate the record at {@code pos}.
     *
     * @param sink receives the payload when non-null
     * @return payload length, or -1 if there is no valid record at pos
     */
    private static int readRecordLength(FileChannel ch, long pos, byte[][] sink) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(MutationCodec.HEADER_LEN).order(ByteOrder.LITTLE_ENDIAN);
        while (hdr.hasRemaining()) {
            int r = ch.read(hdr, pos + hdr.position());
            if (r <= 0) return -1; // EOF or truncated header
        }
        hdr.flip();
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();
        if (magic != MutationCodec.MAGIC || ver != MutationCodec.VERSION || len < 0) return -1;
        if (pos + MutationCodec.HEADER_LEN + len > ch.size()) return -1; // truncated payload
        ByteBuffer payload = ByteBuffer.allocate(len);
        while (payload.hasRemaining()) {
            int r = ch.read(payload, pos + MutationCodec.HEADER_LEN + payload.position());
            if (r <= 0) return -1;
        }
        byte[] bytes = payload.array();
        if (MutationCodec.crc32(bytes) != crc) return -1; // bad tail
        if (sink != null) sink[0] = bytes;
        return len;
    }

    /**
     * Sequential reader for WAL segments used during recovery.
     */
    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segIdx = 0;
        private FileChannel ch;
        private long pos = 0;
        private boolean stopped;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            if (stopped) return null;
            try {
                while (true) {
                    if (ch == null) {
                        if (segIdx >= segments.size()) return null;
                        ch = FileChannel.open(segments.get(segIdx++), READ);
                        pos = 0;
                    }
                    byte[][] sink = new byte[1][];
                    int len = readRecordLength(ch, pos, sink);
                    if (len >= 0) {
                        pos += MutationCodec.HEADER_LEN + len;
                        return sink[0];
                    }
                    boolean cleanEnd = pos == ch.size();
                    ch.close();
                    ch = null;
                    if (!cleanEnd) {
                        // Corruption inside the log: nothing after it can be trusted.
                        stopped = true;
                        return null;
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        @Override
        public void close() {
            try {
                if (ch != null) ch.close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
