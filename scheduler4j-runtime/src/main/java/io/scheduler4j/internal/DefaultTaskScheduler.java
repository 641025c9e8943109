package io.scheduler4j.internal;

import io.scheduler4j.TaskBuilder;
import io.scheduler4j.TaskExecutor;
import io.scheduler4j.TaskScheduler;
import io.scheduler4j.config.SchedulerProperties;
import io.scheduler4j.core.CancelResult;
import io.scheduler4j.core.ControlResult;
import io.scheduler4j.core.ExecutionResult;
import io.scheduler4j.core.PendingTask;
import io.scheduler4j.core.PendingTasksResult;
import io.scheduler4j.core.ScheduleRequest;
import io.scheduler4j.core.ScheduleResult;
import io.scheduler4j.core.ScheduledTaskEvent;
import io.scheduler4j.core.SchedulerStats;
import io.scheduler4j.core.TaskRecord;
import io.scheduler4j.core.TaskValidationException;
import io.scheduler4j.store.TaskStore;
import io.scheduler4j.utils.DueTimeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.regex.Pattern;

/**
 * In-process task scheduler backed by a {@link TaskQueue} and a snapshot {@link TaskStore}.
 *
 * <p>Threading model:
 * <ul>
 *   <li>one background worker polls every {@code pollInterval} and dispatches due tasks</li>
 *   <li>any number of callers may schedule, cancel and list concurrently</li>
 *   <li>the queue is guarded by a single lock that is never held during executor calls or disk I/O</li>
 * </ul>
 *
 * <p>Cancellation is best-effort: a task already taken into a scan's ready batch still runs.
 * Recurring tasks are rescheduled {@code interval} after the scan that picked them up, before
 * they are dispatched, so a failing dispatch does not end the series.
 */
public class DefaultTaskScheduler implements TaskScheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultTaskScheduler.class);

    private static final Pattern NEXT_SUFFIX = Pattern.compile("_next_\\d+(-\\d+)?$");

    private final SchedulerProperties props;
    private final TaskStore store;
    private final TaskExecutor executor;
    private final Clock clock;
    private final ZoneId zone;

    private final TaskQueue queue = new TaskQueue();
    private final ReentrantLock queueLock = new ReentrantLock();
    // Serialises snapshot capture + write so an older snapshot never lands after a newer one.
    private final ReentrantLock persistLock = new ReentrantLock();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Semaphore wakeSignal = new Semaphore(0);
    private volatile Thread worker;

    private final AtomicLong idCounter = new AtomicLong();
    private final AtomicLong totalScheduled = new AtomicLong();
    private final AtomicLong totalExecuted = new AtomicLong();
    private final AtomicLong totalFailed = new AtomicLong();
    private final AtomicReference<Instant> lastExecution = new AtomicReference<>();

    public DefaultTaskScheduler(SchedulerProperties props, TaskStore store, TaskExecutor executor) {
        this(props, store, executor, Clock.systemUTC());
    }

    public DefaultTaskScheduler(SchedulerProperties props, TaskStore store, TaskExecutor executor, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = props.getTimezone() == null || props.getTimezone().isBlank()
                ? ZoneId.systemDefault()
                : ZoneId.of(props.getTimezone());
        restore();
    }

    private void restore() {
        List<TaskRecord> restored;
        try {
            restored = store.load(clock.instant());
        } catch (RuntimeException e) {
            log.error("Failed to restore task snapshot, starting empty msg={}", e.getMessage(), e);
            return;
        }

        int accepted = 0;
        queueLock.lock();
        try {
            queue.clear();
            for (TaskRecord record : restored) {
                if (queue.contains(record.id())) {
                    log.warn("Duplicate task id in snapshot, keeping the first id={}", record.id());
                    continue;
                }
                queue.push(record);
                accepted++;
            }
        } finally {
            queueLock.unlock();
        }
        log.info("Task scheduler restored pending={}", accepted);
    }

    @Override
    public ControlResult start() {
        if (!running.compareAndSet(false, true)) {
            return ControlResult.info("Scheduler is already running");
        }

        try {
            Duration interval = requirePositive(props.getPollInterval(), "scheduler4j.pollInterval");
            requirePositive(props.getErrorBackoff(), "scheduler4j.errorBackoff");

            log.info("Task scheduler starting with pollInterval={}, errorBackoff={}, stopTimeout={}, pending={}",
                    interval,
                    props.getErrorBackoff(),
                    props.getStopTimeout(),
                    getStats().tasksInQueue());

            wakeSignal.drainPermits();
            Thread t = new Thread(this::workerLoop);
            t.setName("scheduler4j.worker");
            t.setDaemon(true);
            worker = t;
            t.start();
            return ControlResult.success("Scheduler started");
        } catch (RuntimeException e) {
            worker = null;
            running.set(false);
            log.error("Task scheduler failed to start msg={}", e.getMessage(), e);
            return ControlResult.error("Failed to start scheduler: " + e.getMessage());
        }
    }

    @Override
    public ControlResult stop() {
        if (!running.compareAndSet(true, false)) {
            return ControlResult.info("Scheduler is not running");
        }

        log.info("Task scheduler stopping...");
        Thread t = worker;
        worker = null;
        wakeSignal.release();

        if (t == null || t == Thread.currentThread()) {
            return ControlResult.success("Scheduler stopped");
        }

        Duration timeout = props.getStopTimeout() == null ? Duration.ZERO : props.getStopTimeout();
        try {
            t.join(Math.max(1L, timeout.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ControlResult.info("Interrupted while waiting for the worker to exit");
        }

        if (t.isAlive()) {
            log.warn("Task scheduler worker still busy after stopTimeout={}; it exits once the in-flight task returns",
                    timeout);
            return ControlResult.info("Scheduler stop requested; worker is finishing an in-flight task");
        }

        log.info("Task scheduler stopped successfully.");
        return ControlResult.success("Scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public TaskBuilder create(Map<String, Object> payload) {
        return new SimpleTaskBuilder(payload, this::schedule);
    }

    @Override
    public ScheduleResult schedule(ScheduleRequest request) {
        if (request == null) {
            return ScheduleResult.error("request must not be null");
        }

        try {
            Instant now = clock.instant();
            Instant due = DueTimeResolver.resolve(request.executionTime(), now, zone);

            TaskRecord record;
            queueLock.lock();
            try {
                String id = request.taskId();
                if (id == null) {
                    id = generateId(now);
                } else if (queue.contains(id)) {
                    throw new TaskValidationException("Task " + id + " is already scheduled");
                }
                record = new TaskRecord(
                        id,
                        due,
                        request.priority(),
                        request.payload(),
                        request.recurring(),
                        request.recurring() ? request.interval() : null,
                        now
                );
                queue.push(record);
                totalScheduled.incrementAndGet();
            } finally {
                queueLock.unlock();
            }

            persistSnapshot();
            log.info("Task scheduled id={} dueTime={} priority={} recurring={}",
                    record.id(), due, record.priority(), record.recurring());
            return ScheduleResult.scheduled(record.id(), due);
        } catch (TaskValidationException e) {
            log.warn("Task rejected msg={}", e.getMessage());
            return ScheduleResult.error(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Failed to schedule task msg={}", e.getMessage(), e);
            return ScheduleResult.error("Failed to schedule task: " + e.getMessage());
        }
    }

    @Override
    public CancelResult cancel(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            return CancelResult.error(taskId, "task id must not be blank");
        }

        try {
            boolean cancelled;
            queueLock.lock();
            try {
                cancelled = queue.cancel(taskId);
                compactIfNeeded();
            } finally {
                queueLock.unlock();
            }

            if (!cancelled) {
                log.debug("Cancel ignored, no pending task id={}", taskId);
                return CancelResult.notFound(taskId);
            }

            persistSnapshot();
            log.info("Task cancelled id={}", taskId);
            return CancelResult.cancelled(taskId);
        } catch (RuntimeException e) {
            log.error("Failed to cancel task id={} msg={}", taskId, e.getMessage(), e);
            return CancelResult.error(taskId, "Failed to cancel task " + taskId + ": " + e.getMessage());
        }
    }

    @Override
    public PendingTasksResult listPending() {
        try {
            List<TaskRecord> records;
            queueLock.lock();
            try {
                records = queue.pending();
            } finally {
                queueLock.unlock();
            }

            List<PendingTask> tasks = new ArrayList<>(records.size());
            for (TaskRecord record : records) {
                tasks.add(PendingTask.of(record));
            }
            return PendingTasksResult.of(tasks);
        } catch (RuntimeException e) {
            log.error("Failed to list pending tasks msg={}", e.getMessage(), e);
            return PendingTasksResult.error("Failed to list pending tasks: " + e.getMessage());
        }
    }

    @Override
    public SchedulerStats getStats() {
        int inQueue;
        queueLock.lock();
        try {
            inQueue = queue.size();
        } finally {
            queueLock.unlock();
        }
        return new SchedulerStats(
                totalScheduled.get(),
                totalExecuted.get(),
                totalFailed.get(),
                inQueue,
                lastExecution.get()
        );
    }

    /**
     * Run one scan: take every due task, reschedule recurring ones, dispatch, persist.
     * The worker calls this every poll interval; callers may invoke it to force a scan.
     *
     * @return number of tasks dispatched
     */
    public int runDueTasks() {
        return runDueTasks(() -> true);
    }

    private int runDueTasks(BooleanSupplier keepDispatching) {
        Instant now = clock.instant();

        List<TaskRecord> ready;
        queueLock.lock();
        try {
            TaskQueue.Drained drained = queue.drainDue(now);
            ready = drained.due();
            if (drained.discarded() > 0) {
                log.debug("Discarded cancelled tasks count={}", drained.discarded());
            }

            for (TaskRecord record : ready) {
                if (record.recurring()) {
                    reschedule(record, now);
                }
            }
            compactIfNeeded();
        } finally {
            queueLock.unlock();
        }

        if (ready.isEmpty()) {
            return 0;
        }

        log.debug("Dispatching due tasks count={} scanTime={}", ready.size(), now);
        int dispatched = 0;
        for (TaskRecord record : ready) {
            if (!keepDispatching.getAsBoolean()) {
                requeue(ready.subList(dispatched, ready.size()));
                break;
            }
            dispatch(record);
            dispatched++;
        }

        persistSnapshot();
        return dispatched;
    }

    /**
     * Rebuild the heap without tombstones.
     *
     * @return number of tombstones removed
     */
    public int compact() {
        queueLock.lock();
        try {
            return queue.compact();
        } finally {
            queueLock.unlock();
        }
    }

    private void workerLoop() {
        Thread self = Thread.currentThread();
        log.info("Task scheduler worker running");

        while (running.get() && worker == self) {
            Duration sleep = props.getPollInterval();
            try {
                runDueTasks(() -> running.get() && worker == self);
            } catch (RuntimeException e) {
                log.error("Task scheduler scan failed msg={}", e.getMessage(), e);
                sleep = props.getErrorBackoff();
            }

            if (!running.get() || worker != self) {
                break;
            }

            try {
                wakeSignal.tryAcquire(sleep.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        log.info("Task scheduler worker exited");
    }

    // Caller holds queueLock. A failure here ends the series but never the batch.
    private void reschedule(TaskRecord record, Instant now) {
        try {
            TaskRecord next = record.nextOccurrence(nextOccurrenceId(record, now), now);
            queue.push(next);
            log.debug("Recurring task rescheduled id={} nextId={} dueTime={}",
                    record.id(), next.id(), next.dueTime());
        } catch (RuntimeException e) {
            log.error("Failed to reschedule recurring task, series ends id={} msg={}", record.id(), e.getMessage(), e);
        }
    }

    /**
     * Put back tasks a stopped or superseded worker drained but did not dispatch. Recurring
     * tasks go back as one-shot records because their next occurrence is already queued.
     */
    private void requeue(List<TaskRecord> undispatched) {
        queueLock.lock();
        try {
            for (TaskRecord record : undispatched) {
                if (queue.contains(record.id())) {
                    log.warn("Task id taken while the task was being dispatched, dropping id={}", record.id());
                    continue;
                }
                queue.push(record.recurring()
                        ? new TaskRecord(record.id(), record.dueTime(), record.priority(), record.payload(),
                                false, null, record.createdAt())
                        : record);
            }
        } finally {
            queueLock.unlock();
        }
        log.info("Worker stopped mid-batch, returned tasks to the queue count={}", undispatched.size());
    }

    private void dispatch(TaskRecord record) {
        log.info("Executing task id={} summary={}", record.id(), record.summary());

        boolean succeeded;
        try {
            ExecutionResult result = executor.execute(ScheduledTaskEvent.of(record, clock.instant()));
            succeeded = result != null && result.successful();
            if (succeeded) {
                log.info("Task executed id={}", record.id());
            } else {
                log.warn("Task reported failure id={} msg={}",
                        record.id(), result == null ? "no result" : result.message());
            }
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            succeeded = false;
            log.error("Task execution failed id={} msg={}", record.id(), e.getMessage(), e);
        }

        totalExecuted.incrementAndGet();
        if (!succeeded) {
            totalFailed.incrementAndGet();
        }
        lastExecution.set(clock.instant());
    }

    private void persistSnapshot() {
        persistLock.lock();
        try {
            List<TaskRecord> snapshot;
            queueLock.lock();
            try {
                snapshot = queue.pending();
            } finally {
                queueLock.unlock();
            }
            store.save(snapshot);
        } catch (RuntimeException e) {
            log.error("Failed to persist task snapshot; continuing in memory msg={}", e.getMessage(), e);
        } finally {
            persistLock.unlock();
        }
    }

    // Caller holds queueLock.
    private void compactIfNeeded() {
        int threshold = Math.max(1, props.getCompactionThreshold());
        if (queue.tombstoneCount() >= threshold) {
            int removed = queue.compact();
            log.debug("Task queue compacted removed={} heapSize={}", removed, queue.heapSize());
        }
    }

    // Caller holds queueLock.
    private String generateId(Instant now) {
        String id;
        do {
            id = "task_" + now.getEpochSecond() + "_" + idCounter.getAndIncrement();
        } while (queue.contains(id));
        return id;
    }

    // Caller holds queueLock. Keeps ids flat across a series: a_next_100 -> a_next_160, not a_next_100_next_160.
    private String nextOccurrenceId(TaskRecord record, Instant now) {
        String root = NEXT_SUFFIX.matcher(record.id()).replaceFirst("");
        String base = root + "_next_" + now.getEpochSecond();
        String id = base;
        int n = 1;
        while (queue.contains(id)) {
            id = base + "-" + n++;
        }
        return id;
    }

    private static Duration requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
        return d;
    }
}
