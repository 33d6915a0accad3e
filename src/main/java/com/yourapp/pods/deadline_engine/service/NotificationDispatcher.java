package com.yourapp.pods.deadline_engine.service;

/**
 * Fire-and-forget notifications to goal owners. Implementations return
 * without waiting for delivery and never throw delivery errors to the caller.
 */
public interface NotificationDispatcher {

    void notifyMissed(Long userId, Long goalId, String goalTitle);

    void notifyReminder(Long userId, Long goalId, String goalTitle);
}
