package io.github.drompincen.screencontrol.runtime.shell;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Growable byte accumulator that can drop its oldest bytes. Cuts and drains land on
 * UTF-8 character boundaries. Not thread-safe.
 */
final class OutputBuffer {

    private byte[] data = new byte[1024];
    private int size;

    void append(byte[] chunk, int offset, int length) {
        if (size + length > data.length) {
            data = Arrays.copyOf(data, Math.max(data.length * 2, size + length));
        }
        System.arraycopy(chunk, offset, data, size, length);
        size += length;
    }

    /**
     * Drops at least {@code count} bytes from the front, or everything when fewer remain,
     * extending the cut past continuation bytes. Returns how many were dropped.
     */
    int dropOldest(int count) {
        int dropped = Math.min(count, size);
        while (dropped < size && isContinuation(data[dropped])) {
            dropped++;
        }
        if (dropped > 0) {
            System.arraycopy(data, dropped, data, 0, size - dropped);
            size -= dropped;
        }
        return dropped;
    }

    int size() {
        return size;
    }

    String text() {
        return new String(data, 0, size, StandardCharsets.UTF_8);
    }

    /** Returns and removes the retained text, keeping an incomplete trailing character for the next drain. */
    String drain() {
        int complete = completeLength();
        String text = new String(data, 0, complete, StandardCharsets.UTF_8);
        System.arraycopy(data, complete, data, 0, size - complete);
        size -= complete;
        return text;
    }

    /** Returns and removes everything retained, incomplete trailing bytes included. */
    String drainAll() {
        String text = text();
        size = 0;
        return text;
    }

    private int completeLength() {
        int lead = size - 1;
        while (lead >= 0 && lead > size - 4 && isContinuation(data[lead])) {
            lead--;
        }
        if (lead < 0 || isContinuation(data[lead])) {
            return size;
        }
        return size - lead < sequenceLength(data[lead]) ? lead : size;
    }

    private static int sequenceLength(byte lead) {
        if ((lead & 0xE0) == 0xC0) {
            return 2;
        }
        if ((lead & 0xF0) == 0xE0) {
            return 3;
        }
        if ((lead & 0xF8) == 0xF0) {
            return 4;
        }
        return 1;
    }

    private static boolean isContinuation(byte b) {
        return (b & 0xC0) == 0x80;
    }
}
