// file: storage/src/main/java/io/dripline/storage/FileSnapshotter.java
package io.dripline.storage;

import io.dripline.core.Hash32;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Binary snapshot implementation backed by a single file per snapshot.
 * <p>
 * Format (big-endian, DataOutputStream):
 *   int32  magic  = 0xD21F5EED
 *   int64  sequence of the last commit included
 *   int32  rootCount
 *     repeated: int64 period, 32 bytes root
 *   int32  wordCount
 *     repeated: int64 period, int64 word, 4 x int64 bits
 * <p>
 * Atomicity:
 *   - We write to "snapshot-<seq>.bin.tmp" first,
 *   - then move to "snapshot-<seq>.bin" using ATOMIC_MOVE.
 * The sequence is zero-padded so name order is sequence order.
 */
public final class FileSnapshotter implements Snapshotter {
    private static final int MAGIC = 0xD21F5EED;

    private final Path dir;

    public FileSnapshotter(Path dir) {
        this.dir = dir;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    @Override
    public String writeSnapshot(Image image) {
        String name = String.format("snapshot-%020d.bin", image.sequence());
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        try (var out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)))) {
            out.writeInt(MAGIC);
            out.writeLong(image.sequence());

            out.writeInt(image.roots().size());
            for (Map.Entry<Long, Hash32> e : image.roots().entrySet()) {
                out.writeLong(e.getKey());
                out.write(e.getValue().toBytes());
            }

            out.writeInt(image.words().size());
            for (Word w : image.words()) {
                out.writeLong(w.period());
                out.writeLong(w.word());
                for (long l : w.bits()) out.writeLong(l);
            }
        } catch (IOException ex) { throw new UncheckedIOException(ex); }

        // WAL segments are deleted once this returns, so the image must be on disk first.
        try (FileChannel fc = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
            fc.force(true);
        } catch (IOException ex) { throw new UncheckedIOException(ex); }

        try { Files.move(tmp, dst, ATOMIC_MOVE); }
        catch (IOException e) { throw new UncheckedIOException(e); }

        return dst.getFileName().toString();
    }

    @Override
    public Image loadLatest() {
        Path snap;
        try (Stream<Path> files = Files.list(dir)) {
            snap = files
                    .filter(p -> p.getFileName().toString().startsWith("snapshot-"))
                    .filter(p -> p.getFileName().toString().endsWith(".bin"))
                    .sorted()
                    .reduce((a, b) -> b)
                    .orElse(null);
        } catch (IOException e) { throw new UncheckedIOException(e); }

        if (snap == null) return null;

        try (var in = new DataInputStream(new BufferedInputStream(Files.newInputStream(snap)))) {
            if (in.readInt() != MAGIC) {
                throw new IllegalStateException("not a snapshot file: " + snap);
            }
            long seq = in.readLong();

            int rootCount = in.readInt();
            Map<Long, Hash32> roots = new HashMap<>(rootCount * 2);
            for (int i = 0; i < rootCount; i++) {
                long period = in.readLong();
                roots.put(period, Hash32.of(in.readNBytes(Hash32.LENGTH)));
            }

            int wordCount = in.readInt();
            List<Word> words = new ArrayList<>(wordCount);
            for (int i = 0; i < wordCount; i++) {
                long period = in.readLong();
                long word = in.readLong();
                long[] bits = new long[ClaimBitmap.LONGS_PER_WORD];
                for (int j = 0; j < bits.length; j++) bits[j] = in.readLong();
                words.add(new Word(period, word, bits));
            }
            return new Image(seq, roots, words);
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }
}
