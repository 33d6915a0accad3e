package com.yourapp.pods.deadline_engine.service;

import com.yourapp.pods.deadline_engine.config.DeadlineProperties;
import com.yourapp.pods.deadline_engine.exception.DeadlineEvaluationException;
import com.yourapp.pods.deadline_engine.exception.GoalConfigurationException;
import com.yourapp.pods.deadline_engine.model.CheckIn;
import com.yourapp.pods.deadline_engine.model.EvaluationOutcome;
import com.yourapp.pods.deadline_engine.model.Goal;
import com.yourapp.pods.deadline_engine.model.GoalSchedule;
import com.yourapp.pods.deadline_engine.service.EvaluationReport.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Turns elapsed goal deadlines into MISSED check-ins.
 * <p>
 * Each call looks at every active goal for the given tick instant. For each
 * goal-local date whose deadline fell inside the evaluation window and that
 * the goal's schedule covers, an absent check-in becomes a MISSED row, the
 * current streak goes to zero and the owner is notified. Dates that already
 * have any check-in are left alone. Re-running with the same or an
 * overlapping instant is harmless: the ledger's unique (goal, date) key lets
 * only one writer create the row.
 * <p>
 * The instant is always passed in; nothing here reads the clock.
 */
@Service
public class DeadlineEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(DeadlineEvaluator.class);

    private final GoalStore goalStore;
    private final CheckInStore checkInStore;
    private final EvaluationRunService runService;
    private final NotificationDispatcher notificationDispatcher;
    private final DeadlineCalculator calculator;
    private final DeadlineProperties props;
    private final Executor executor;

    @Autowired
    public DeadlineEvaluator(GoalStore goalStore,
                             CheckInStore checkInStore,
                             EvaluationRunService runService,
                             NotificationDispatcher notificationDispatcher,
                             DeadlineCalculator calculator,
                             DeadlineProperties props,
                             @Qualifier("deadlineEvaluationExecutor") Executor executor) {
        this.goalStore = goalStore;
        this.checkInStore = checkInStore;
        this.runService = runService;
        this.notificationDispatcher = notificationDispatcher;
        this.calculator = calculator;
        this.props = props;
        this.executor = executor;
    }

    /**
     * Evaluates all active goals at {@code nowUtc}.
     *
     * @throws DeadlineEvaluationException when the goals cannot be listed at all
     */
    public EvaluationReport evaluate(Instant nowUtc) {
        Duration window = props.getEvaluationWindow();

        List<Goal> goals;
        try {
            goals = goalStore.listActiveGoalsDueAround(nowUtc, window);
        } catch (RuntimeException e) {
            throw new DeadlineEvaluationException("Could not load active goals for tick " + nowUtc, e);
        }

        List<CompletableFuture<List<Result>>> futures = new ArrayList<>(goals.size());
        boolean aborted = false;
        for (Goal goal : goals) {
            try {
                futures.add(CompletableFuture.supplyAsync(() -> evaluateGoal(goal, nowUtc, window), executor));
            } catch (RejectedExecutionException e) {
                logger.warn("Executor rejected goal {} at tick {}, stopping submission", goal.getId(), nowUtc);
                aborted = true;
                break;
            }
        }

        Map<Result, Integer> counts = new EnumMap<>(Result.class);
        List<Long> misconfigured = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            CompletableFuture<List<Result>> future = futures.get(i);
            Long goalId = goals.get(i).getId();
            try {
                for (Result result : future.get()) {
                    counts.merge(result, 1, Integer::sum);
                    if (result == Result.CONFIGURATION_ERROR) {
                        misconfigured.add(goalId);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Tick {} interrupted, cancelling {} pending goal evaluations", nowUtc, futures.size() - i);
                futures.subList(i, futures.size()).forEach(f -> f.cancel(false));
                aborted = true;
                break;
            } catch (CancellationException e) {
                aborted = true;
            } catch (ExecutionException e) {
                logger.error("Unexpected failure evaluating goal {}", goalId, e.getCause());
                counts.merge(Result.FAILED, 1, Integer::sum);
            }
        }

        EvaluationReport report = new EvaluationReport(nowUtc, goals.size(), counts, misconfigured, aborted);
        logger.debug("Deadline evaluation finished: {}", report);
        return report;
    }

    /**
     * Evaluates one goal. Never throws; every failure becomes a result so one
     * goal cannot stop the batch.
     */
    List<Result> evaluateGoal(Goal goal, Instant nowUtc, Duration window) {
        try {
            GoalSchedule schedule = GoalSchedule.of(goal);
            List<LocalDate> dueDates = calculator.dueDates(goal, schedule, nowUtc, window);
            if (dueDates.isEmpty()) {
                return List.of(Result.NOT_DUE);
            }
            List<Result> results = new ArrayList<>(dueDates.size());
            for (LocalDate date : dueDates) {
                results.add(evaluateDate(goal, date, nowUtc));
            }
            return results;
        } catch (GoalConfigurationException e) {
            logger.error("Skipping goal {} until its configuration is corrected: {}", goal.getId(), e.getMessage());
            return List.of(Result.CONFIGURATION_ERROR);
        } catch (RuntimeException e) {
            logger.warn("Evaluation of goal {} failed, retrying on next tick", goal.getId(), e);
            return List.of(Result.FAILED);
        }
    }

    private Result evaluateDate(Goal goal, LocalDate date, Instant nowUtc) {
        if (runService.isResolved(goal.getId(), date)) {
            return Result.SKIPPED;
        }

        InsertResult insert;
        try {
            Optional<CheckIn> existing = checkInStore.findByGoalAndDate(goal.getId(), date);
            if (existing.isPresent()) {
                logger.debug("Goal {} already has a {} check-in for {}", goal.getId(), existing.get().getStatus(), date);
                recordRun(goal, date, EvaluationOutcome.ALREADY_RESOLVED, null, nowUtc);
                return Result.ALREADY_RESOLVED;
            }
            insert = recordMissed(goal, date, nowUtc);
        } catch (RuntimeException e) {
            logger.warn("Could not settle goal {} for {}, retrying on next tick: {}", goal.getId(), date, e.getMessage());
            recordRun(goal, date, EvaluationOutcome.FAILED, e.toString(), nowUtc);
            return Result.FAILED;
        }

        if (insert == InsertResult.ALREADY_EXISTS) {
            logger.debug("Another writer resolved goal {} for {} first", goal.getId(), date);
            recordRun(goal, date, EvaluationOutcome.ALREADY_RESOLVED, null, nowUtc);
            return Result.ALREADY_RESOLVED;
        }

        logger.info("Goal {} missed its {} deadline for {}, streak reset", goal.getId(), goal.getDeadlineTime(), date);
        recordRun(goal, date, EvaluationOutcome.MISSED_RECORDED, null, nowUtc);
        dispatchMissed(goal);
        return Result.MISSED_RECORDED;
    }

    private InsertResult recordMissed(Goal goal, LocalDate date, Instant nowUtc) {
        try {
            return checkInStore.recordMissed(goal, date, nowUtc);
        } catch (DataIntegrityViolationException e) {
            // a check-in for (goal, date) was committed after our existence check
            return InsertResult.ALREADY_EXISTS;
        }
    }

    private void recordRun(Goal goal, LocalDate date, EvaluationOutcome outcome, String error, Instant nowUtc) {
        try {
            runService.record(goal.getId(), date, outcome, error, nowUtc);
        } catch (RuntimeException e) {
            logger.warn("Could not record {} evaluation for goal {} on {}: {}", outcome, goal.getId(), date, e.getMessage());
        }
    }

    private void dispatchMissed(Goal goal) {
        try {
            notificationDispatcher.notifyMissed(goal.getUserId(), goal.getId(), goal.getTitle());
        } catch (RuntimeException e) {
            logger.warn("Missed-check-in notification for goal {} was not enqueued: {}", goal.getId(), e.getMessage());
        }
    }
}
