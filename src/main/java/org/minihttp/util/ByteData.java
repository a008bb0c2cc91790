package org.minihttp.util;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Growable byte sequence used for socket chunks and rendered messages.
 * <p>
 * Text conversion is strict: {@link #stringValue()} refuses malformed UTF-8
 * instead of substituting replacement characters.
 * </p>
 */
public final class ByteData {

    private static final int INITIAL_CAPACITY = 64;

    private byte[] raw;
    private int length;

    public ByteData() {
        this.raw = new byte[INITIAL_CAPACITY];
    }

    public ByteData(byte[] data) {
        this(data, 0, data.length);
    }

    public ByteData(byte[] data, int offset, int count) {
        this.raw = Arrays.copyOfRange(data, offset, offset + count);
        this.length = count;
    }

    public static ByteData of(String text) {
        return new ByteData(text.getBytes(StandardCharsets.UTF_8));
    }

    public ByteData append(byte b) {
        ensureCapacity(length + 1);
        raw[length++] = b;
        return this;
    }

    public ByteData append(byte[] data) {
        return append(data, 0, data.length);
    }

    public ByteData append(byte[] data, int offset, int count) {
        ensureCapacity(length + count);
        System.arraycopy(data, offset, raw, length, count);
        length += count;
        return this;
    }

    public ByteData append(String text) {
        return append(text.getBytes(StandardCharsets.UTF_8));
    }

    public int length() { return length; }

    public boolean isEmpty() { return length == 0; }

    public byte byteAt(int index) {
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException("index " + index + " out of [0," + length + ")");
        }
        return raw[index];
    }

    /** Copy of the bytes from {@code from} (inclusive) to the end. */
    public byte[] tail(int from) {
        if (from >= length) return new byte[0];
        return Arrays.copyOfRange(raw, from, length);
    }

    public byte[] toByteArray() {
        return Arrays.copyOf(raw, length);
    }

    /**
     * Decodes the content as UTF-8.
     *
     * @throws CharacterCodingException if the bytes are not valid UTF-8
     */
    public String stringValue() throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(raw, 0, length))
                .toString();
    }

    /** Hex dump followed by a printable rendering, for debug logging. */
    public String describe() {
        StringBuilder hex = new StringBuilder();
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < length; i++) {
            int b = raw[i] & 0xff;
            hex.append(Integer.toHexString(b)).append(' ');
            text.append(b >= 0x20 && b < 0x7f ? (char) b : '.');
        }
        return hex + "\n" + text + "\nData Length: " + length;
    }

    private void ensureCapacity(int needed) {
        if (needed > raw.length) {
            raw = Arrays.copyOf(raw, Math.max(needed, raw.length * 2));
        }
    }
}
