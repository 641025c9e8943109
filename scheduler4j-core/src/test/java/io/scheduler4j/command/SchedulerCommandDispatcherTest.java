package io.scheduler4j.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.scheduler4j.TaskScheduler;
import io.scheduler4j.core.CancelResult;
import io.scheduler4j.core.ControlResult;
import io.scheduler4j.core.DueTime;
import io.scheduler4j.core.PendingTasksResult;
import io.scheduler4j.core.ResultStatus;
import io.scheduler4j.core.ScheduleRequest;
import io.scheduler4j.core.ScheduleResult;
import io.scheduler4j.core.SchedulerResult;
import io.scheduler4j.core.SchedulerStats;
import io.scheduler4j.core.StatsResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SchedulerCommandDispatcherTest {

    private TaskScheduler scheduler;
    private SchedulerCommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        scheduler = mock(TaskScheduler.class);
        dispatcher = new SchedulerCommandDispatcher(scheduler, new ObjectMapper());
    }

    @Test
    void scheduleTaskJsonIsMappedToRequest() {
        Instant due = Instant.ofEpochSecond(1767225600);
        when(scheduler.schedule(any())).thenReturn(ScheduleResult.scheduled("daily", due));

        SchedulerResult result = dispatcher.dispatch("""
                {"action": "schedule_task",
                 "task_data": {"agent": "messaging", "action": "send_message"},
                 "execution_time": 1767225600,
                 "priority": 2,
                 "task_id": "daily",
                 "recurring": true,
                 "recurrence_interval": 86400}
                """);

        assertTrue(result.isSuccess());
        ArgumentCaptor<ScheduleRequest> captor = ArgumentCaptor.forClass(ScheduleRequest.class);
        verify(scheduler).schedule(captor.capture());
        ScheduleRequest request = captor.getValue();
        assertEquals("messaging", request.payload().get("agent"));
        assertEquals(DueTime.at(due), request.executionTime());
        assertEquals(2, request.priority());
        assertEquals("daily", request.taskId());
        assertTrue(request.recurring());
        assertEquals(Duration.ofDays(1), request.interval());
    }

    @Test
    void scheduleTaskDefaultsPriorityAndKeepsTextTime() {
        when(scheduler.schedule(any())).thenReturn(ScheduleResult.scheduled("t", Instant.EPOCH));

        dispatcher.dispatch("""
                {"action": "schedule_task", "task_data": {"agent": "scraper"}, "execution_time": "+5 minutes"}
                """);

        ArgumentCaptor<ScheduleRequest> captor = ArgumentCaptor.forClass(ScheduleRequest.class);
        verify(scheduler).schedule(captor.capture());
        assertEquals(1, captor.getValue().priority());
        assertEquals(DueTime.parse("+5 minutes"), captor.getValue().executionTime());
        assertNull(captor.getValue().taskId());
    }

    @Test
    void invalidRecurrenceIntervalIsErrorWithoutSchedulerCall() {
        SchedulerResult result = dispatcher.dispatch("""
                {"action": "schedule_task", "task_data": {}, "execution_time": "+1 minute",
                 "recurring": true, "recurrence_interval": -10}
                """);

        assertInstanceOf(ScheduleResult.class, result);
        assertEquals(ResultStatus.ERROR, result.status());
        verify(scheduler, never()).schedule(any());
    }

    @Test
    void cancelTaskDelegates() {
        CancelResult cancelled = CancelResult.cancelled("abc");
        when(scheduler.cancel("abc")).thenReturn(cancelled);

        assertSame(cancelled, dispatcher.dispatch("{\"action\": \"cancel_task\", \"task_id\": \"abc\"}"));
    }

    @Test
    void controlActionsDelegate() {
        when(scheduler.start()).thenReturn(ControlResult.success("Scheduler started"));
        when(scheduler.stop()).thenReturn(ControlResult.info("Scheduler is not running"));
        when(scheduler.listPending()).thenReturn(PendingTasksResult.of(List.of()));
        when(scheduler.getStats()).thenReturn(new SchedulerStats(3, 2, 1, 1, null));

        assertEquals(ResultStatus.SUCCESS, dispatcher.dispatch("{\"action\": \"start_scheduler\"}").status());
        assertEquals(ResultStatus.INFO, dispatcher.dispatch("{\"action\": \"stop_scheduler\"}").status());
        assertInstanceOf(PendingTasksResult.class, dispatcher.dispatch("{\"action\": \"get_pending_tasks\"}"));

        SchedulerResult stats = dispatcher.dispatch("{\"action\": \"get_stats\"}");
        assertEquals(3, ((StatsResult) stats).stats().totalScheduled());
    }

    @Test
    void unknownActionIsError() {
        SchedulerResult result = dispatcher.dispatch("{\"action\": \"reboot_universe\"}");

        assertEquals(ResultStatus.ERROR, result.status());
        verifyNoInteractions(scheduler);
    }

    @Test
    void malformedJsonIsError() {
        assertEquals(ResultStatus.ERROR, dispatcher.dispatch("{not json").status());
        assertEquals(ResultStatus.ERROR, dispatcher.dispatch((SchedulerCommand) null).status());
    }

    @Test
    void nullOrBlankJsonIsError() {
        assertEquals(ResultStatus.ERROR, dispatcher.dispatch((String) null).status());
        assertEquals(ResultStatus.ERROR, dispatcher.dispatch("   ").status());
        verifyNoInteractions(scheduler);
    }
}
