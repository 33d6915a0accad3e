package com.yourapp.pods.deadline_engine.repository;

import com.yourapp.pods.deadline_engine.model.DeviceToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface DeviceTokenRepository extends JpaRepository<DeviceToken, Long> {

    List<DeviceToken> findByUserId(Long userId);

    Optional<DeviceToken> findByToken(String token);

    @Modifying
    @Query("DELETE FROM DeviceToken d WHERE d.userId = :userId AND d.token = :token")
    int deleteByUserIdAndToken(@Param("userId") Long userId, @Param("token") String token);
}
