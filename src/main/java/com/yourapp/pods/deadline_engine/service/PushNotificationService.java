package com.yourapp.pods.deadline_engine.service;

import com.yourapp.pods.deadline_engine.model.DeviceToken;
import com.yourapp.pods.deadline_engine.repository.DeviceTokenRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class PushNotificationService implements NotificationDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(PushNotificationService.class);

    private final DeviceTokenRepository deviceTokenRepository;
    private final PushGatewayClient gatewayClient;

    @Autowired
    public PushNotificationService(DeviceTokenRepository deviceTokenRepository, PushGatewayClient gatewayClient) {
        this.deviceTokenRepository = deviceTokenRepository;
        this.gatewayClient = gatewayClient;
    }

    @Async("notificationExecutor")
    @Override
    public void notifyMissed(Long userId, Long goalId, String goalTitle) {
        sendToUser(userId, new PushMessage(
            "Missed Check-in",
            "You missed your check-in for \"" + goalTitle + "\"",
            Map.of("type", "missed", "goalId", String.valueOf(goalId))));
    }

    @Async("notificationExecutor")
    @Override
    public void notifyReminder(Long userId, Long goalId, String goalTitle) {
        sendToUser(userId, new PushMessage(
            "Reminder",
            "Don't forget: " + goalTitle,
            Map.of("type", "reminder", "goalId", String.valueOf(goalId))));
    }

    void sendToUser(Long userId, PushMessage message) {
        List<DeviceToken> tokens;
        try {
            tokens = deviceTokenRepository.findByUserId(userId);
        } catch (RuntimeException e) {
            logger.error("Could not load device tokens for user {}, dropping {}", userId, message, e);
            return;
        }

        if (tokens.isEmpty()) {
            logger.info("No device tokens for user {}, dropping {}", userId, message);
            return;
        }

        for (DeviceToken token : tokens) {
            try {
                gatewayClient.send(token.getToken(), message);
            } catch (RuntimeException e) {
                // the gateway owns retries
                logger.warn("Push to device {} of user {} failed: {}", token.getId(), userId, e.getMessage());
            }
        }
    }
}
