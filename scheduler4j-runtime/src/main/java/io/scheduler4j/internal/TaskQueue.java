package io.scheduler4j.internal;

import io.scheduler4j.core.TaskRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Binary min-heap of pending tasks plus an id index.
 *
 * <p>Heap order is {@code (dueTime, priority, insertion sequence)}. Cancellation tombstones the
 * heap entry and removes it from the index; the entry stays in the heap until it surfaces at
 * the top during {@link #drainDue(Instant)} or until {@link #compact()} rebuilds the heap.
 *
 * <p>Not thread-safe. The owning scheduler guards every call with one lock.
 */
public final class TaskQueue {

    private static final Comparator<Entry> ORDER = Comparator
            .comparing((Entry e) -> e.record.dueTime())
            .thenComparingInt(e -> e.record.priority())
            .thenComparingLong(e -> e.sequence);

    private final PriorityQueue<Entry> heap = new PriorityQueue<>(ORDER);
    private final Map<String, Entry> index = new HashMap<>();
    private long nextSequence;
    private int tombstones;

    private static final class Entry {
        private final TaskRecord record;
        private final long sequence;
        private boolean cancelled;

        private Entry(TaskRecord record, long sequence) {
            this.record = record;
            this.sequence = sequence;
        }
    }

    /**
     * Result of one drain: the due records in dispatch order and the number of tombstones discarded.
     */
    public record Drained(List<TaskRecord> due, int discarded) {
    }

    /**
     * @throws IllegalStateException if a pending task already uses the id
     */
    public void push(TaskRecord record) {
        if (index.containsKey(record.id())) {
            throw new IllegalStateException("Task id already pending: " + record.id());
        }
        Entry entry = new Entry(record, nextSequence++);
        heap.add(entry);
        index.put(record.id(), entry);
    }

    public boolean contains(String id) {
        return index.containsKey(id);
    }

    /**
     * Tombstone a pending task.
     *
     * @return false when no pending task has this id
     */
    public boolean cancel(String id) {
        Entry entry = index.remove(id);
        if (entry == null) {
            return false;
        }
        entry.cancelled = true;
        tombstones++;
        return true;
    }

    /**
     * Pop every live entry due at or before {@code now}, discarding tombstones met at the top.
     */
    public Drained drainDue(Instant now) {
        List<TaskRecord> due = new ArrayList<>();
        int discarded = 0;
        while (!heap.isEmpty()) {
            Entry top = heap.peek();
            if (top.cancelled) {
                heap.poll();
                tombstones--;
                discarded++;
                continue;
            }
            if (top.record.dueTime().isAfter(now)) {
                break;
            }
            heap.poll();
            index.remove(top.record.id());
            due.add(top.record);
        }
        return new Drained(due, discarded);
    }

    /**
     * Rebuild the heap from live entries only.
     *
     * @return number of tombstones removed
     */
    public int compact() {
        int removed = tombstones;
        if (removed == 0) {
            return 0;
        }
        List<Entry> live = new ArrayList<>(index.values());
        heap.clear();
        heap.addAll(live);
        tombstones = 0;
        return removed;
    }

    /**
     * Live records in heap order. Does not modify the queue.
     */
    public List<TaskRecord> pending() {
        List<Entry> live = new ArrayList<>(index.values());
        live.sort(ORDER);
        List<TaskRecord> records = new ArrayList<>(live.size());
        for (Entry e : live) {
            records.add(e.record);
        }
        return records;
    }

    /**
     * Number of live (pending, not cancelled) tasks.
     */
    public int size() {
        return index.size();
    }

    /**
     * Physical heap size, tombstones included.
     */
    public int heapSize() {
        return heap.size();
    }

    public int tombstoneCount() {
        return tombstones;
    }

    public void clear() {
        heap.clear();
        index.clear();
        tombstones = 0;
    }
}
