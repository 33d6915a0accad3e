package com.yourapp.pods.deadline_engine.repository;

import com.yourapp.pods.deadline_engine.model.Goal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public interface GoalRepository extends JpaRepository<Goal, Long> {

    // Coarse pre-filter; the zone-aware due check happens per goal afterwards
    @Query("SELECT DISTINCT g FROM Goal g WHERE g.archived = false " +
           "AND g.startDate <= :latestLocalDate " +
           "AND (g.endDate IS NULL OR g.endDate >= :earliestLocalDate)")
    List<Goal> findActiveBetween(
        @Param("earliestLocalDate") LocalDate earliestLocalDate,
        @Param("latestLocalDate") LocalDate latestLocalDate);

    // Goals with a reminder time, same coarse window
    @Query("SELECT DISTINCT g FROM Goal g WHERE g.archived = false AND g.reminderTime IS NOT NULL " +
           "AND g.startDate <= :latestLocalDate " +
           "AND (g.endDate IS NULL OR g.endDate >= :earliestLocalDate)")
    List<Goal> findActiveWithReminderBetween(
        @Param("earliestLocalDate") LocalDate earliestLocalDate,
        @Param("latestLocalDate") LocalDate latestLocalDate);

    // longestStreak is left alone on purpose, it is a high-water mark
    @Modifying
    @Query("UPDATE Goal g SET g.currentStreak = 0, g.updatedAt = :now WHERE g.id = :goalId")
    int resetCurrentStreak(@Param("goalId") Long goalId, @Param("now") Instant now);
}
