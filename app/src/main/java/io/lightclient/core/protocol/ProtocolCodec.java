package io.lightclient.core.protocol;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Deterministic binary encoding used for hashing and vote sign bytes.
 * Length-prefixed byte[] and strings, big-endian ints and longs, instants as
 * (epoch seconds, nanos).
 */
public final class ProtocolCodec {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    public ProtocolCodec writeBytes(byte[] v) {
        byte[] b = v == null ? new byte[0] : v;
        writeInt(b.length);
        out.write(b, 0, b.length);
        return this;
    }

    public ProtocolCodec writeString(String v) {
        return writeBytes(v == null ? new byte[0] : v.getBytes(StandardCharsets.UTF_8));
    }

    public ProtocolCodec writeLong(long v) {
        byte[] b = ByteBuffer.allocate(8).putLong(v).array();
        out.write(b, 0, b.length);
        return this;
    }

    public ProtocolCodec writeInt(int v) {
        byte[] b = ByteBuffer.allocate(4).putInt(v).array();
        out.write(b, 0, b.length);
        return this;
    }

    public ProtocolCodec writeByte(byte v) {
        out.write(v);
        return this;
    }

    public ProtocolCodec writeInstant(Instant v) {
        writeLong(v.getEpochSecond());
        return writeInt(v.getNano());
    }

    public byte[] toBytes() {
        return out.toByteArray();
    }

    public static byte[] encodeLong(long v) {
        return new ProtocolCodec().writeLong(v).toBytes();
    }

    public static byte[] encodeString(String v) {
        return new ProtocolCodec().writeString(v).toBytes();
    }

    public static byte[] encodeInstant(Instant v) {
        return new ProtocolCodec().writeInstant(v).toBytes();
    }
}
