package com.yourapp.pods.deadline_engine.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;

@Entity
@Table(name = "goals")
public class Goal {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long userId;

    @Column(nullable = false)
    private Long podId;

    @Column(nullable = false)
    private String title;

    @Column(length = 2000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private FrequencyType frequencyType = FrequencyType.DAILY;

    // 0 = Sunday ... 6 = Saturday, only read for WEEKLY and SPECIFIC_DAYS
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "goal_frequency_days", joinColumns = @JoinColumn(name = "goal_id"))
    @Column(name = "weekday")
    private Set<Integer> frequencyDays = new HashSet<>();

    // HH:mm in the goal's time zone
    @Column(nullable = false)
    private String deadlineTime = "23:59";

    private String reminderTime;

    @Column(nullable = false)
    private String timeZone;

    private boolean requiresProof = false;

    @Column(nullable = false)
    private LocalDate startDate;

    private LocalDate endDate;

    @Column(name = "is_archived")
    private boolean archived = false;

    private int currentStreak = 0;
    private int longestStreak = 0;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getUserId() {
        return userId;
    }

    public void setUserId(Long userId) {
        this.userId = userId;
    }

    public Long getPodId() {
        return podId;
    }

    public void setPodId(Long podId) {
        this.podId = podId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public FrequencyType getFrequencyType() {
        return frequencyType;
    }

    public void setFrequencyType(FrequencyType frequencyType) {
        this.frequencyType = frequencyType;
    }

    public Set<Integer> getFrequencyDays() {
        if (frequencyDays == null) {
            frequencyDays = new HashSet<>();
        }
        return frequencyDays;
    }

    public void setFrequencyDays(Set<Integer> frequencyDays) {
        this.frequencyDays = frequencyDays != null ? new HashSet<>(frequencyDays) : new HashSet<>();
    }

    public String getDeadlineTime() {
        return deadlineTime;
    }

    public void setDeadlineTime(String deadlineTime) {
        this.deadlineTime = deadlineTime;
    }

    public String getReminderTime() {
        return reminderTime;
    }

    public void setReminderTime(String reminderTime) {
        this.reminderTime = reminderTime;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    public boolean isRequiresProof() {
        return requiresProof;
    }

    public void setRequiresProof(boolean requiresProof) {
        this.requiresProof = requiresProof;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public void setStartDate(LocalDate startDate) {
        this.startDate = startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public void setEndDate(LocalDate endDate) {
        this.endDate = endDate;
    }

    public boolean isArchived() {
        return archived;
    }

    public void setArchived(boolean archived) {
        this.archived = archived;
    }

    public int getCurrentStreak() {
        return currentStreak;
    }

    /**
     * Sets the current streak and raises the longest streak with it, so the
     * current value can never overtake the high-water mark.
     */
    public void setCurrentStreak(int currentStreak) {
        this.currentStreak = Math.max(0, currentStreak);
        if (this.currentStreak > this.longestStreak) {
            this.longestStreak = this.currentStreak;
        }
    }

    public int getLongestStreak() {
        return longestStreak;
    }

    public void setLongestStreak(int longestStreak) {
        this.longestStreak = longestStreak;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    /**
     * Whether the goal's schedule covers the given local date at all,
     * ignoring weekdays.
     */
    @Transient
    public boolean isActiveOn(LocalDate date) {
        if (startDate != null && date.isBefore(startDate)) {
            return false;
        }
        return endDate == null || !date.isAfter(endDate);
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (this.createdAt == null) {
            this.createdAt = now;
        }
        this.updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    @Override
    public String toString() {
        return "Goal{" +
                "id=" + id +
                ", userId=" + userId +
                ", frequencyType=" + frequencyType +
                ", deadlineTime='" + deadlineTime + '\'' +
                ", timeZone='" + timeZone + '\'' +
                ", currentStreak=" + currentStreak +
                ", longestStreak=" + longestStreak +
                '}';
    }
}
