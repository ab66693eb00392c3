package com.monitoralert.common.codec;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Binary reader mirroring {@link RecordOutput}.
 */
public class RecordInput {

    private static final int MAX_STRING_BYTES = 16 * 1024 * 1024;
    private static final int MAX_LIST_SIZE = 64 * 1024;

    private final DataInputStream in;

    public RecordInput(byte[] bytes) {
        this(new ByteArrayInputStream(bytes));
    }

    public RecordInput(InputStream source) {
        this.in = new DataInputStream(source);
    }

    public byte readByte() throws IOException {
        return in.readByte();
    }

    public boolean readBoolean() throws IOException {
        byte value = in.readByte();
        if (value == 0) {
            return false;
        }
        if (value == 1) {
            return true;
        }
        throw new IOException("Unexpected byte for boolean: " + value);
    }

    public int readInt() throws IOException {
        return in.readInt();
    }

    public long readLong() throws IOException {
        return in.readLong();
    }

    public int readVInt() throws IOException {
        int value = 0;
        for (int shift = 0; shift < 35; shift += 7) {
            byte b = in.readByte();
            value |= (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return value;
            }
        }
        throw new IOException("Variable-length int is too long");
    }

    public String readString() throws IOException {
        int length = readVInt();
        if (length < 0 || length > MAX_STRING_BYTES) {
            throw new IOException("Invalid string length: " + length);
        }
        byte[] bytes = new byte[length];
        in.readFully(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    public String readOptionalString() throws IOException {
        return readBoolean() ? readString() : null;
    }

    public List<String> readStringList() throws IOException {
        int size = readVInt();
        if (size < 0 || size > MAX_LIST_SIZE) {
            throw new IOException("Invalid list size: " + size);
        }
        var values = new ArrayList<String>();
        for (int i = 0; i < size; i++) {
            values.add(readString());
        }
        return Collections.unmodifiableList(values);
    }

    public <T> T readOptionalWriteable(Writeable.Reader<T> reader) throws IOException {
        return readBoolean() ? reader.read(this) : null;
    }
}
