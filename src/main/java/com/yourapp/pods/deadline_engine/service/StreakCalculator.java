package com.yourapp.pods.deadline_engine.service;

import com.yourapp.pods.deadline_engine.model.CheckIn;
import com.yourapp.pods.deadline_engine.model.CheckInStatus;
import com.yourapp.pods.deadline_engine.model.Goal;
import com.yourapp.pods.deadline_engine.model.GoalSchedule;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts consecutive scheduled days with a COMPLETED check-in, walking back
 * from a given local date. SKIPPED days are excused: they neither count nor
 * break the run. A MISSED day, or a scheduled day before {@code today} with no
 * check-in, ends it. An open {@code today} does not break the run because its
 * deadline has not been judged yet.
 */
@Component
public class StreakCalculator {

    public int currentStreak(Goal goal, GoalSchedule schedule, LocalDate today, List<CheckIn> history) {
        if (history.isEmpty()) {
            return 0;
        }

        Map<LocalDate, CheckInStatus> byDate = new HashMap<>();
        LocalDate earliest = today;
        for (CheckIn checkIn : history) {
            byDate.put(checkIn.getDate(), checkIn.getStatus());
            if (checkIn.getDate().isBefore(earliest)) {
                earliest = checkIn.getDate();
            }
        }

        int streak = 0;
        for (LocalDate day = today; !day.isBefore(earliest); day = day.minusDays(1)) {
            if (!goal.isActiveOn(day) || !schedule.isScheduledOn(day.getDayOfWeek())) {
                continue;
            }
            CheckInStatus status = byDate.get(day);
            if (status == null) {
                if (day.equals(today)) {
                    continue;
                }
                break;
            }
            if (status == CheckInStatus.COMPLETED) {
                streak++;
            } else if (status == CheckInStatus.MISSED) {
                break;
            }
        }
        return streak;
    }
}
