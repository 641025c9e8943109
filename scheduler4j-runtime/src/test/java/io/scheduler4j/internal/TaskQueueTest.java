package io.scheduler4j.internal;

import io.scheduler4j.core.TaskRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskQueueTest {

    private static final Instant T = Instant.parse("2026-01-01T00:00:00Z");

    private static TaskRecord task(String id, long dueOffsetSeconds, int priority) {
        Instant due = T.plusSeconds(dueOffsetSeconds);
        return new TaskRecord(id, due, priority, Map.of(), false, null, T);
    }

    private static List<String> ids(List<TaskRecord> records) {
        return records.stream().map(TaskRecord::id).toList();
    }

    @Test
    void drainOrdersByDueTimeThenPriorityThenInsertion() {
        TaskQueue queue = new TaskQueue();
        queue.push(task("late", 20, 1));
        queue.push(task("a-low", 10, 3));
        queue.push(task("a-high", 10, 1));
        queue.push(task("a-high-second", 10, 1));

        TaskQueue.Drained drained = queue.drainDue(T.plusSeconds(30));

        assertEquals(List.of("a-high", "a-high-second", "a-low", "late"), ids(drained.due()));
        assertEquals(0, queue.size());
    }

    @Test
    void drainStopsAtFirstFutureEntry() {
        TaskQueue queue = new TaskQueue();
        queue.push(task("due", 5, 1));
        queue.push(task("future", 15, 1));

        assertEquals(List.of("due"), ids(queue.drainDue(T.plusSeconds(5)).due()));
        assertTrue(queue.contains("future"));
        assertEquals(1, queue.size());
    }

    @Test
    void cancelledEntryIsNeverReturned() {
        TaskQueue queue = new TaskQueue();
        queue.push(task("keep", 5, 1));
        queue.push(task("drop", 5, 1));

        assertTrue(queue.cancel("drop"));
        assertFalse(queue.cancel("drop"));
        assertEquals(1, queue.size());
        assertEquals(2, queue.heapSize());

        TaskQueue.Drained drained = queue.drainDue(T.plusSeconds(10));
        assertEquals(List.of("keep"), ids(drained.due()));
        assertEquals(1, drained.discarded());
        assertEquals(0, queue.tombstoneCount());
    }

    @Test
    void cancelledIdCanBeReused() {
        TaskQueue queue = new TaskQueue();
        queue.push(task("x", 50, 1));
        queue.cancel("x");
        queue.push(task("x", 5, 1));

        assertEquals(List.of("x"), ids(queue.drainDue(T.plusSeconds(100)).due()));
    }

    @Test
    void duplicateLiveIdIsRejected() {
        TaskQueue queue = new TaskQueue();
        queue.push(task("x", 5, 1));
        assertThrows(IllegalStateException.class, () -> queue.push(task("x", 6, 1)));
    }

    @Test
    void compactRemovesTombstonesOnly() {
        TaskQueue queue = new TaskQueue();
        for (int i = 0; i < 10; i++) {
            queue.push(task("t" + i, 100 + i, 1));
        }
        for (int i = 0; i < 10; i += 2) {
            queue.cancel("t" + i);
        }

        assertEquals(5, queue.compact());
        assertEquals(5, queue.heapSize());
        assertEquals(5, queue.size());
        assertEquals(0, queue.tombstoneCount());
        assertEquals(List.of("t1", "t3", "t5", "t7", "t9"), ids(queue.pending()));
        assertEquals(0, queue.compact());
    }

    @Test
    void pendingIsSortedAndDoesNotConsume() {
        TaskQueue queue = new TaskQueue();
        queue.push(task("b", 20, 1));
        queue.push(task("a", 10, 2));

        assertEquals(List.of("a", "b"), ids(queue.pending()));
        assertEquals(2, queue.size());
    }
}
