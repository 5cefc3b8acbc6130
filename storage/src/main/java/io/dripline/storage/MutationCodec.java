// file: storage/src/main/java/io/dripline/storage/MutationCodec.java
package io.dripline.storage;

import io.dripline.core.Hash32;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records. One record = one committed unit.
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xD21F
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (little-endian)]
 *     - sequence: int64
 *     - count:    int32 number of mutations
 *       repeated count times:
 *         - type: byte (1 = root seeded, 2 = index claimed)
 *         - ROOT:  period int64, root 32 bytes
 *         - CLAIM: period int64, index int64
 */
final class MutationCodec {
    static final short MAGIC = (short) 0xD21F;
    static final byte VERSION = 1;
    static final int HEADER_LEN = 11;

    private static final byte TYPE_ROOT = 1;
    private static final byte TYPE_CLAIM = 2;

    /** Decoded payload. */
    record Entry(long sequence, List<StateMutation> mutations) {}

    private MutationCodec() {}

    static byte[] encode(long sequence, List<StateMutation> mutations) {
        byte[] payload = encodePayload(sequence, mutations);
        ByteBuffer out = ByteBuffer.allocate(HEADER_LEN + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    static Entry decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        long seq = b.getLong();
        int count = b.getInt();
        if (count < 0) throw new IllegalStateException("negative mutation count in WAL record " + seq);
        List<StateMutation> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            byte type = b.get();
            long period = b.getLong();
            switch (type) {
                case TYPE_ROOT -> {
                    byte[] root = new byte[Hash32.LENGTH];
                    b.get(root);
                    out.add(new StateMutation.RootSeeded(period, Hash32.of(root)));
                }
                case TYPE_CLAIM -> out.add(new StateMutation.IndexClaimed(period, b.getLong()));
                default -> throw new IllegalStateException("unknown mutation type " + type + " in WAL record " + seq);
            }
        }
        return new Entry(seq, List.copyOf(out));
    }

    private static byte[] encodePayload(long sequence, List<StateMutation> mutations) {
        int size = 8 + 4;
        for (StateMutation m : mutations) {
            size += 1 + 8 + (m instanceof StateMutation.RootSeeded ? Hash32.LENGTH : 8);
        }
        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        b.putLong(sequence);
        b.putInt(mutations.size());
        for (StateMutation m : mutations) {
            if (m instanceof StateMutation.RootSeeded r) {
                b.put(TYPE_ROOT).putLong(r.period()).put(r.root().toBytes());
            } else if (m instanceof StateMutation.IndexClaimed c) {
                b.put(TYPE_CLAIM).putLong(c.period()).putLong(c.index());
            }
        }
        return b.array();
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }
}
