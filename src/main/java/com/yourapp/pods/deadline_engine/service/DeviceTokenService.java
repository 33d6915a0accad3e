package com.yourapp.pods.deadline_engine.service;

import com.yourapp.pods.deadline_engine.exception.NotFoundException;
import com.yourapp.pods.deadline_engine.model.DeviceToken;
import com.yourapp.pods.deadline_engine.repository.DeviceTokenRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class DeviceTokenService {
    private static final Logger logger = LoggerFactory.getLogger(DeviceTokenService.class);

    private final DeviceTokenRepository deviceTokenRepository;

    @Autowired
    public DeviceTokenService(DeviceTokenRepository deviceTokenRepository) {
        this.deviceTokenRepository = deviceTokenRepository;
    }

    /**
     * Registers a push token for a user. A token already known under another
     * user moves to the caller, since a device has one signed-in user.
     */
    @Transactional
    public DeviceToken register(Long userId, String token, DeviceToken.Platform platform) {
        DeviceToken deviceToken = deviceTokenRepository.findByToken(token).orElseGet(DeviceToken::new);
        if (deviceToken.getId() != null && !userId.equals(deviceToken.getUserId())) {
            logger.info("Device token {} moves from user {} to user {}", deviceToken.getId(), deviceToken.getUserId(), userId);
        }
        deviceToken.setUserId(userId);
        deviceToken.setToken(token);
        deviceToken.setPlatform(platform != null ? platform : DeviceToken.Platform.IOS);
        return deviceTokenRepository.save(deviceToken);
    }

    @Transactional
    public void unregister(Long userId, String token) {
        if (deviceTokenRepository.deleteByUserIdAndToken(userId, token) == 0) {
            throw new NotFoundException("Device token not registered");
        }
    }
}
