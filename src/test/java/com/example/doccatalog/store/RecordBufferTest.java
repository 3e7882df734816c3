package com.example.doccatalog.store;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecordBufferTest {
    @Test
    void flushesWhenThresholdReached() {
        List<List<String>> batches = new ArrayList<>();
        RecordBuffer<String> buffer = new RecordBuffer<>(2, batches::add);

        assertFalse(buffer.add("a"));
        assertTrue(buffer.add("b"));
        assertFalse(buffer.add("c"));

        assertEquals(List.of(List.of("a", "b")), batches);
        assertEquals(1, buffer.pending());
        assertEquals(2L, buffer.entriesWritten());

        buffer.flush();
        assertEquals(List.of("c"), batches.get(1));
        assertEquals(0, buffer.pending());
        assertEquals(2, buffer.batchesWritten());
    }

    @Test
    void emptyFlushWritesNothing() {
        List<List<String>> batches = new ArrayList<>();
        RecordBuffer<String> buffer = new RecordBuffer<>(5, batches::add);

        buffer.flush();

        assertTrue(batches.isEmpty());
        assertEquals(0, buffer.batchesWritten());
    }

    @Test
    void failedBatchStaysPending() {
        RecordBuffer<String> buffer = new RecordBuffer<>(10, batch -> {
            throw new IllegalStateException("disk full");
        });
        buffer.add("a");

        assertThrows(IllegalStateException.class, buffer::flush);
        assertEquals(1, buffer.pending());
        assertEquals(0L, buffer.entriesWritten());
    }

    @Test
    void rejectsNonPositiveThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new RecordBuffer<String>(0, BatchWriter.noop()));
    }
}
