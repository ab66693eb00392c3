package com.monitoralert.common.codec;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collection;

/**
 * Binary writer for {@link Writeable} records.
 *
 * <p>Strings are written as a variable-length int byte count followed by UTF-8 bytes,
 * booleans as a single byte, optional values as a presence boolean followed by the value.
 */
public class RecordOutput {

    private final ByteArrayOutputStream buffer;
    private final DataOutputStream out;

    public RecordOutput() {
        this.buffer = new ByteArrayOutputStream();
        this.out = new DataOutputStream(buffer);
    }

    public RecordOutput(OutputStream target) {
        this.buffer = null;
        this.out = new DataOutputStream(target);
    }

    public void writeByte(byte value) throws IOException {
        out.writeByte(value);
    }

    public void writeBoolean(boolean value) throws IOException {
        out.writeByte(value ? 1 : 0);
    }

    public void writeInt(int value) throws IOException {
        out.writeInt(value);
    }

    public void writeLong(long value) throws IOException {
        out.writeLong(value);
    }

    public void writeVInt(int value) throws IOException {
        while ((value & ~0x7F) != 0) {
            out.writeByte((value & 0x7F) | 0x80);
            value >>>= 7;
        }
        out.writeByte(value);
    }

    public void writeString(String value) throws IOException {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        writeVInt(bytes.length);
        out.write(bytes);
    }

    public void writeOptionalString(String value) throws IOException {
        if (value != null) {
            writeBoolean(true);
            writeString(value);
        } else {
            writeBoolean(false);
        }
    }

    public void writeStringCollection(Collection<String> values) throws IOException {
        writeVInt(values.size());
        for (String value : values) {
            writeString(value);
        }
    }

    public void writeOptionalWriteable(Writeable value) throws IOException {
        if (value != null) {
            writeBoolean(true);
            value.writeTo(this);
        } else {
            writeBoolean(false);
        }
    }

    public <E extends Enum<E>> void writeEnum(E value) throws IOException {
        writeString(value.name());
    }

    public byte[] toByteArray() throws IOException {
        if (buffer == null) {
            throw new IllegalStateException("RecordOutput was created over an external stream");
        }
        out.flush();
        return buffer.toByteArray();
    }
}
