package com.example.doccatalog.store;

import java.util.ArrayList;
import java.util.List;

/**
 * Stages entries in memory and hands them to a {@link BatchWriter} once the threshold is
 * reached or on {@link #flush()}. Owned by a single thread; callers serialize access.
 */
public class RecordBuffer<T> {
    private final int threshold;
    private final BatchWriter<T> writer;
    private final List<T> buffer;
    private int batchesWritten;
    private long entriesWritten;

    public RecordBuffer(int threshold, BatchWriter<T> writer) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive");
        }
        this.threshold = threshold;
        this.writer = writer == null ? BatchWriter.noop() : writer;
        this.buffer = new ArrayList<>(threshold);
    }

    /**
     * @return true if adding the entry triggered a flush
     */
    public boolean add(T entry) {
        buffer.add(entry);
        if (buffer.size() >= threshold) {
            flush();
            return true;
        }
        return false;
    }

    public void flush() {
        if (buffer.isEmpty()) {
            return;
        }
        writer.write(List.copyOf(buffer));
        entriesWritten += buffer.size();
        batchesWritten++;
        buffer.clear();
    }

    public int pending() {
        return buffer.size();
    }

    public int batchesWritten() {
        return batchesWritten;
    }

    public long entriesWritten() {
        return entriesWritten;
    }
}
