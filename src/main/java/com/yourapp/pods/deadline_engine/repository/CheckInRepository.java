package com.yourapp.pods.deadline_engine.repository;

import com.yourapp.pods.deadline_engine.model.CheckIn;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface CheckInRepository extends JpaRepository<CheckIn, Long> {

    // (goal, date) is unique, so at most one row
    Optional<CheckIn> findByGoalIdAndDate(Long goalId, LocalDate date);

    boolean existsByGoalIdAndDate(Long goalId, LocalDate date);

    List<CheckIn> findByGoalIdOrderByDateDesc(Long goalId, Pageable pageable);

    // History for streak computation, newest first
    @Query("SELECT c FROM CheckIn c WHERE c.goal.id = :goalId AND c.date <= :upTo ORDER BY c.date DESC")
    List<CheckIn> findHistory(@Param("goalId") Long goalId, @Param("upTo") LocalDate upTo);
}
