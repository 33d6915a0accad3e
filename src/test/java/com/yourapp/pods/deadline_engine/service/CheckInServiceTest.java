package com.yourapp.pods.deadline_engine.service;

import com.yourapp.pods.deadline_engine.dto.CheckInResponse;
import com.yourapp.pods.deadline_engine.dto.TodayStatusResponse;
import com.yourapp.pods.deadline_engine.exception.ConflictException;
import com.yourapp.pods.deadline_engine.exception.ForbiddenException;
import com.yourapp.pods.deadline_engine.exception.NotFoundException;
import com.yourapp.pods.deadline_engine.exception.ValidationException;
import com.yourapp.pods.deadline_engine.model.CheckIn;
import com.yourapp.pods.deadline_engine.model.CheckInStatus;
import com.yourapp.pods.deadline_engine.model.FrequencyType;
import com.yourapp.pods.deadline_engine.model.Goal;
import com.yourapp.pods.deadline_engine.repository.CheckInRepository;
import com.yourapp.pods.deadline_engine.repository.GoalRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CheckInServiceTest {

    // 19:00 on Thursday Jan 15 in New York
    private static final Instant NOW = Instant.parse("2026-01-16T00:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2026, 1, 15);

    @Mock
    private GoalRepository goalRepository;

    @Mock
    private CheckInRepository checkInRepository;

    @Mock
    private CheckInStore checkInStore;

    private CheckInService checkInService;

    private Goal goal;

    @BeforeEach
    void setUp() {
        checkInService = new CheckInService(goalRepository, checkInRepository, checkInStore,
            new DeadlineCalculator(), new StreakCalculator());

        goal = new Goal();
        goal.setId(1L);
        goal.setUserId(10L);
        goal.setTitle("Run");
        goal.setFrequencyType(FrequencyType.DAILY);
        goal.setTimeZone("America/New_York");
        goal.setStartDate(LocalDate.of(2026, 1, 1));
        goal.setCurrentStreak(2);
        when(goalRepository.findById(1L)).thenReturn(Optional.of(goal));
    }

    @Test
    void check_in_uses_the_goal_local_date_and_extends_the_streak() {
        when(checkInStore.insertIfAbsent(any(CheckIn.class))).thenReturn(InsertResult.CREATED);
        when(checkInRepository.findHistory(1L, TODAY)).thenReturn(List.of(
            new CheckIn(goal, TODAY, CheckInStatus.COMPLETED, NOW),
            new CheckIn(goal, TODAY.minusDays(1), CheckInStatus.COMPLETED, NOW),
            new CheckIn(goal, TODAY.minusDays(2), CheckInStatus.COMPLETED, NOW)));

        CheckInResponse response = checkInService.checkIn(1L, 10L, null, "felt good", null, null, NOW);

        ArgumentCaptor<CheckIn> captor = ArgumentCaptor.forClass(CheckIn.class);
        verify(checkInStore).insertIfAbsent(captor.capture());
        assertThat(captor.getValue().getDate()).isEqualTo(TODAY);
        assertThat(captor.getValue().getStatus()).isEqualTo(CheckInStatus.COMPLETED);
        assertThat(captor.getValue().getComment()).isEqualTo("felt good");

        assertThat(response.getCurrentStreak()).isEqualTo(3);
        assertThat(response.getLongestStreak()).isEqualTo(3);
        verify(goalRepository).save(goal);
    }

    @Test
    void existing_row_for_today_is_a_conflict() {
        when(checkInStore.insertIfAbsent(any(CheckIn.class))).thenReturn(InsertResult.ALREADY_EXISTS);

        ConflictException e = assertThrows(ConflictException.class,
            () -> checkInService.checkIn(1L, 10L, CheckInStatus.COMPLETED, null, null, null, NOW));
        assertThat(e.getCode()).isEqualTo("ALREADY_CHECKED_IN");
        verify(goalRepository, never()).save(any());
    }

    @Test
    void users_cannot_write_missed_rows() {
        assertThrows(ValidationException.class,
            () -> checkInService.checkIn(1L, 10L, CheckInStatus.MISSED, null, null, null, NOW));
        verify(checkInStore, never()).insertIfAbsent(any(CheckIn.class));
    }

    @Test
    void unknown_goal_is_not_found() {
        when(goalRepository.findById(99L)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class,
            () -> checkInService.checkIn(99L, 10L, CheckInStatus.COMPLETED, null, null, null, NOW));
    }

    @Test
    void other_users_goal_is_forbidden() {
        assertThrows(ForbiddenException.class,
            () -> checkInService.checkIn(1L, 11L, CheckInStatus.COMPLETED, null, null, null, NOW));
        assertThrows(ForbiddenException.class, () -> checkInService.todayStatus(1L, 11L, NOW));
    }

    @Test
    void archived_goal_rejects_check_ins() {
        goal.setArchived(true);

        assertThrows(ValidationException.class,
            () -> checkInService.checkIn(1L, 10L, CheckInStatus.COMPLETED, null, null, null, NOW));
    }

    @Test
    void proof_is_required_only_for_completion() {
        goal.setRequiresProof(true);
        when(checkInStore.insertIfAbsent(any(CheckIn.class))).thenReturn(InsertResult.CREATED);

        assertThrows(ValidationException.class,
            () -> checkInService.checkIn(1L, 10L, CheckInStatus.COMPLETED, null, " ", null, NOW));

        checkInService.checkIn(1L, 10L, CheckInStatus.SKIPPED, null, null, null, NOW);
        verify(checkInStore).insertIfAbsent(any(CheckIn.class));
    }

    @Test
    void stale_client_timestamp_is_rejected() {
        Instant sevenHoursAgo = NOW.minusSeconds(7 * 3600);

        assertThrows(ValidationException.class,
            () -> checkInService.checkIn(1L, 10L, CheckInStatus.COMPLETED, null, null, sevenHoursAgo, NOW));
    }

    @Test
    void list_is_bounded_and_applies_offset() {
        when(checkInRepository.findByGoalIdOrderByDateDesc(eq(1L), any(Pageable.class))).thenReturn(List.of(
            new CheckIn(goal, TODAY, CheckInStatus.COMPLETED, NOW),
            new CheckIn(goal, TODAY.minusDays(1), CheckInStatus.MISSED, NOW),
            new CheckIn(goal, TODAY.minusDays(2), CheckInStatus.COMPLETED, NOW)));

        List<CheckInResponse> page = checkInService.listCheckIns(1L, 10L, 2, 1);

        assertThat(page).extracting(CheckInResponse::getDate).containsExactly(TODAY.minusDays(1), TODAY.minusDays(2));
        assertThrows(ValidationException.class, () -> checkInService.listCheckIns(1L, 10L, 101, 0));
        assertThrows(ValidationException.class, () -> checkInService.listCheckIns(1L, 10L, 10, -1));
    }

    @Test
    void today_status_reports_deadline_and_existing_row() {
        when(checkInRepository.findByGoalIdAndDate(1L, TODAY))
            .thenReturn(Optional.of(new CheckIn(goal, TODAY, CheckInStatus.SKIPPED, NOW)));

        TodayStatusResponse status = checkInService.todayStatus(1L, 10L, NOW);

        assertThat(status.getDate()).isEqualTo(TODAY);
        assertThat(status.isScheduledToday()).isTrue();
        assertThat(status.isCheckedIn()).isTrue();
        assertThat(status.getStatus()).isEqualTo(CheckInStatus.SKIPPED);
        // 23:59 EST
        assertThat(status.getDeadline()).isEqualTo(Instant.parse("2026-01-16T04:59:00Z"));
        assertThat(status.getCurrentStreak()).isEqualTo(2);
    }
}
