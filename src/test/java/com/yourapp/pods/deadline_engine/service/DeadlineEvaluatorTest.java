package com.yourapp.pods.deadline_engine.service;

import com.yourapp.pods.deadline_engine.config.DeadlineProperties;
import com.yourapp.pods.deadline_engine.exception.DeadlineEvaluationException;
import com.yourapp.pods.deadline_engine.model.CheckIn;
import com.yourapp.pods.deadline_engine.model.CheckInStatus;
import com.yourapp.pods.deadline_engine.model.EvaluationOutcome;
import com.yourapp.pods.deadline_engine.model.FrequencyType;
import com.yourapp.pods.deadline_engine.model.Goal;
import com.yourapp.pods.deadline_engine.service.EvaluationReport.Result;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class DeadlineEvaluatorTest {

    // 00:05 on Jan 16 in Chicago, the Jan 15 deadline (23:59 CST) passed at 05:59Z
    private static final Instant AFTER_DEADLINE = Instant.parse("2026-01-16T06:05:00Z");
    private static final LocalDate JAN_15 = LocalDate.of(2026, 1, 15);

    private GoalStore goalStore;
    private CheckInStore checkInStore;
    private EvaluationRunService runService;
    private NotificationDispatcher dispatcher;
    private DeadlineEvaluator evaluator;

    @BeforeEach
    void setUp() {
        goalStore = Mockito.mock(GoalStore.class);
        checkInStore = Mockito.mock(CheckInStore.class);
        runService = Mockito.mock(EvaluationRunService.class);
        dispatcher = Mockito.mock(NotificationDispatcher.class);
        evaluator = new DeadlineEvaluator(goalStore, checkInStore, runService, dispatcher,
            new DeadlineCalculator(), new DeadlineProperties(), Runnable::run);
    }

    private static Goal chicagoGoal(long id) {
        Goal goal = new Goal();
        goal.setId(id);
        goal.setUserId(100L + id);
        goal.setTitle("Read 20 pages");
        goal.setFrequencyType(FrequencyType.DAILY);
        goal.setDeadlineTime("23:59");
        goal.setTimeZone("America/Chicago");
        goal.setStartDate(LocalDate.of(2026, 1, 1));
        goal.setCreatedAt(Instant.parse("2026-01-01T00:00:00Z"));
        goal.setCurrentStreak(4);
        return goal;
    }

    private void givenGoals(Goal... goals) {
        when(goalStore.listActiveGoalsDueAround(any(Instant.class), any())).thenReturn(List.of(goals));
    }

    @Test
    void elapsed_deadline_without_check_in_records_a_miss() {
        Goal goal = chicagoGoal(1);
        givenGoals(goal);
        when(checkInStore.recordMissed(goal, JAN_15, AFTER_DEADLINE)).thenReturn(InsertResult.CREATED);

        EvaluationReport report = evaluator.evaluate(AFTER_DEADLINE);

        assertThat(report.getGoalsScanned()).isEqualTo(1);
        assertThat(report.getMissedRecorded()).isEqualTo(1);
        verify(checkInStore).recordMissed(goal, JAN_15, AFTER_DEADLINE);
        verify(runService).record(1L, JAN_15, EvaluationOutcome.MISSED_RECORDED, null, AFTER_DEADLINE);
        verify(dispatcher).notifyMissed(101L, 1L, "Read 20 pages");
    }

    @Test
    void honored_goal_is_left_alone() {
        Goal goal = chicagoGoal(1);
        givenGoals(goal);
        when(checkInStore.findByGoalAndDate(1L, JAN_15))
            .thenReturn(Optional.of(new CheckIn(goal, JAN_15, CheckInStatus.COMPLETED, Instant.parse("2026-01-15T20:00:00Z"))));

        EvaluationReport report = evaluator.evaluate(AFTER_DEADLINE);

        assertThat(report.count(Result.ALREADY_RESOLVED)).isEqualTo(1);
        assertThat(report.getMissedRecorded()).isZero();
        verify(checkInStore, never()).recordMissed(any(), any(), any());
        verifyNoInteractions(dispatcher);
    }

    @Test
    void goal_before_its_deadline_is_not_due() {
        givenGoals(chicagoGoal(1));

        // 17:30 local on Jan 15
        EvaluationReport report = evaluator.evaluate(Instant.parse("2026-01-15T23:30:00Z"));

        assertThat(report.count(Result.NOT_DUE)).isEqualTo(1);
        verifyNoInteractions(checkInStore, dispatcher);
    }

    @Test
    void unscheduled_weekday_is_not_due() {
        Goal goal = chicagoGoal(1);
        goal.setFrequencyType(FrequencyType.SPECIFIC_DAYS);
        goal.setFrequencyDays(Set.of(1, 3));
        goal.setTimeZone("UTC");
        goal.setDeadlineTime("20:00");
        givenGoals(goal);

        // Tuesday 2026-01-13, just after 20:00 UTC
        EvaluationReport report = evaluator.evaluate(Instant.parse("2026-01-13T20:05:00Z"));

        assertThat(report.count(Result.NOT_DUE)).isEqualTo(1);
        verifyNoInteractions(checkInStore, dispatcher);
    }

    @Test
    void losing_the_insert_race_is_already_resolved() {
        Goal goal = chicagoGoal(1);
        givenGoals(goal);
        when(checkInStore.recordMissed(goal, JAN_15, AFTER_DEADLINE)).thenReturn(InsertResult.ALREADY_EXISTS);

        EvaluationReport report = evaluator.evaluate(AFTER_DEADLINE);

        assertThat(report.count(Result.ALREADY_RESOLVED)).isEqualTo(1);
        verify(runService).record(1L, JAN_15, EvaluationOutcome.ALREADY_RESOLVED, null, AFTER_DEADLINE);
        verifyNoInteractions(dispatcher);
    }

    @Test
    void unique_constraint_violation_is_already_resolved() {
        Goal goal = chicagoGoal(1);
        givenGoals(goal);
        when(checkInStore.recordMissed(goal, JAN_15, AFTER_DEADLINE))
            .thenThrow(new DataIntegrityViolationException("uk_check_ins_goal_date"));

        EvaluationReport report = evaluator.evaluate(AFTER_DEADLINE);

        assertThat(report.count(Result.ALREADY_RESOLVED)).isEqualTo(1);
        assertThat(report.getFailures()).isZero();
        verifyNoInteractions(dispatcher);
    }

    @Test
    void misconfigured_goal_does_not_block_the_others() {
        Goal broken = chicagoGoal(2);
        broken.setTimeZone("Not/AZone");
        Goal healthy = chicagoGoal(1);
        givenGoals(broken, healthy);
        when(checkInStore.recordMissed(healthy, JAN_15, AFTER_DEADLINE)).thenReturn(InsertResult.CREATED);

        EvaluationReport report = evaluator.evaluate(AFTER_DEADLINE);

        assertThat(report.getConfigurationErrors()).isEqualTo(1);
        assertThat(report.getMisconfiguredGoalIds()).containsExactly(2L);
        assertThat(report.getMissedRecorded()).isEqualTo(1);
        verify(dispatcher).notifyMissed(101L, 1L, "Read 20 pages");
    }

    @Test
    void transient_store_error_fails_only_that_goal() {
        Goal flaky = chicagoGoal(1);
        Goal healthy = chicagoGoal(2);
        givenGoals(flaky, healthy);
        when(checkInStore.recordMissed(flaky, JAN_15, AFTER_DEADLINE)).thenThrow(new QueryTimeoutException("timeout"));
        when(checkInStore.recordMissed(healthy, JAN_15, AFTER_DEADLINE)).thenReturn(InsertResult.CREATED);

        EvaluationReport report = evaluator.evaluate(AFTER_DEADLINE);

        assertThat(report.getFailures()).isEqualTo(1);
        assertThat(report.getMissedRecorded()).isEqualTo(1);
        verify(runService).record(eq(1L), eq(JAN_15), eq(EvaluationOutcome.FAILED), anyString(), eq(AFTER_DEADLINE));
        verify(dispatcher, never()).notifyMissed(eq(101L), anyLong(), anyString());
    }

    @Test
    void notification_failure_keeps_the_recorded_miss() {
        Goal goal = chicagoGoal(1);
        givenGoals(goal);
        when(checkInStore.recordMissed(goal, JAN_15, AFTER_DEADLINE)).thenReturn(InsertResult.CREATED);
        doThrow(new IllegalStateException("queue full")).when(dispatcher).notifyMissed(anyLong(), anyLong(), anyString());

        EvaluationReport report = evaluator.evaluate(AFTER_DEADLINE);

        assertThat(report.getMissedRecorded()).isEqualTo(1);
        assertThat(report.getFailures()).isZero();
    }

    @Test
    void bookkeeping_failure_does_not_change_the_result() {
        Goal goal = chicagoGoal(1);
        givenGoals(goal);
        when(checkInStore.recordMissed(goal, JAN_15, AFTER_DEADLINE)).thenReturn(InsertResult.CREATED);
        doThrow(new DataAccessResourceFailureException("down"))
            .when(runService).record(anyLong(), any(), any(), isNull(), any());

        EvaluationReport report = evaluator.evaluate(AFTER_DEADLINE);

        assertThat(report.getMissedRecorded()).isEqualTo(1);
        verify(dispatcher).notifyMissed(101L, 1L, "Read 20 pages");
    }

    @Test
    void settled_date_is_skipped() {
        givenGoals(chicagoGoal(1));
        when(runService.isResolved(1L, JAN_15)).thenReturn(true);

        EvaluationReport report = evaluator.evaluate(AFTER_DEADLINE);

        assertThat(report.count(Result.SKIPPED)).isEqualTo(1);
        verifyNoInteractions(checkInStore, dispatcher);
    }

    @Test
    void rerun_at_the_same_instant_does_not_notify_twice() {
        Goal goal = chicagoGoal(1);
        givenGoals(goal);
        when(checkInStore.recordMissed(goal, JAN_15, AFTER_DEADLINE)).thenReturn(InsertResult.CREATED);

        evaluator.evaluate(AFTER_DEADLINE);

        when(checkInStore.findByGoalAndDate(1L, JAN_15))
            .thenReturn(Optional.of(new CheckIn(goal, JAN_15, CheckInStatus.MISSED, AFTER_DEADLINE)));
        EvaluationReport second = evaluator.evaluate(AFTER_DEADLINE);

        assertThat(second.getMissedRecorded()).isZero();
        assertThat(second.count(Result.ALREADY_RESOLVED)).isEqualTo(1);
        verify(checkInStore, times(1)).recordMissed(any(), any(), any());
        verify(dispatcher, times(1)).notifyMissed(anyLong(), anyLong(), anyString());
    }

    @Test
    void unavailable_goal_store_fails_the_whole_tick() {
        when(goalStore.listActiveGoalsDueAround(any(Instant.class), any()))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        DeadlineEvaluationException e = assertThrows(DeadlineEvaluationException.class,
            () -> evaluator.evaluate(AFTER_DEADLINE));
        assertThat(e.getCause()).isInstanceOf(DataAccessResourceFailureException.class);
        verifyNoInteractions(checkInStore, dispatcher);
    }
    @Test
    void interrupted_tick_is_aborted_and_pending_goals_are_never_looked_up() throws Exception {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        DeadlineEvaluator pooled = new DeadlineEvaluator(goalStore, checkInStore, runService, dispatcher,
            new DeadlineCalculator(), new DeadlineProperties(), pool);
        Goal first = chicagoGoal(1);
        givenGoals(first, chicagoGoal(2), chicagoGoal(3));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(checkInStore.findByGoalAndDate(1L, JAN_15)).thenAnswer(inv -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return Optional.empty();
        });
        when(checkInStore.recordMissed(first, JAN_15, AFTER_DEADLINE)).thenReturn(InsertResult.CREATED);

        AtomicReference<EvaluationReport> report = new AtomicReference<>();
        AtomicBoolean interruptKept = new AtomicBoolean();
        Thread tick = new Thread(() -> {
            report.set(pooled.evaluate(AFTER_DEADLINE));
            interruptKept.set(Thread.currentThread().isInterrupted());
        });
        try {
            tick.start();
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
            tick.interrupt();
            tick.join(5000);
        } finally {
            release.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(report.get()).isNotNull();
        assertThat(report.get().isAborted()).isTrue();
        assertThat(report.get().getGoalsScanned()).isEqualTo(3);
        assertThat(interruptKept).isTrue();
        verify(checkInStore, times(1)).findByGoalAndDate(anyLong(), any());
        verify(checkInStore, never()).findByGoalAndDate(eq(2L), any());
        verify(checkInStore, never()).findByGoalAndDate(eq(3L), any());
        // the goal already running finishes its write
        verify(checkInStore).recordMissed(first, JAN_15, AFTER_DEADLINE);
    }

    @Test
    void rejected_submission_stops_the_tick() {
        AtomicInteger accepted = new AtomicInteger();
        Executor saturated = task -> {
            if (accepted.getAndIncrement() > 0) {
                throw new RejectedExecutionException("queue full");
            }
            task.run();
        };
        DeadlineEvaluator limited = new DeadlineEvaluator(goalStore, checkInStore, runService, dispatcher,
            new DeadlineCalculator(), new DeadlineProperties(), saturated);
        Goal first = chicagoGoal(1);
        givenGoals(first, chicagoGoal(2), chicagoGoal(3));
        when(checkInStore.recordMissed(first, JAN_15, AFTER_DEADLINE)).thenReturn(InsertResult.CREATED);

        EvaluationReport report = limited.evaluate(AFTER_DEADLINE);

        assertThat(report.isAborted()).isTrue();
        assertThat(report.isDegraded()).isTrue();
        assertThat(report.getGoalsScanned()).isEqualTo(3);
        assertThat(report.getMissedRecorded()).isEqualTo(1);
        verify(checkInStore, never()).findByGoalAndDate(eq(2L), any());
        verify(checkInStore, never()).findByGoalAndDate(eq(3L), any());
    }
}
