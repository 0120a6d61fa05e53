package com.surveillance.engine.service;

import com.surveillance.engine.config.SurveillanceProperties;
import com.surveillance.engine.exception.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Optional guard against redelivery of the same detection.
 *
 * Detection events arrive at least once. When enabled, each detection id is claimed in
 * Redis with SET-if-absent and a TTL before processing, so a redelivered id is skipped
 * instead of being counted twice. Disabled, every delivery is processed.
 *
 * Redis keys: {@code detection:processed:{detectionId}}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeliveryGuard {

    static final String KEY_PREFIX = "detection:processed:";

    private final StringRedisTemplate stringRedisTemplate;
    private final SurveillanceProperties properties;

    /**
     * @return true if the caller owns this delivery and should process it
     */
    public boolean claim(String detectionId) {
        SurveillanceProperties.DeliveryGuard guard = properties.getDeliveryGuard();
        if (!guard.isEnabled()) {
            return true;
        }

        try {
            Boolean claimed = stringRedisTemplate.opsForValue()
                .setIfAbsent(KEY_PREFIX + detectionId, "1", guard.getTtl());
            return Boolean.TRUE.equals(claimed);
        } catch (DataAccessException e) {
            throw StorageException.translate("claim detection " + detectionId, e);
        }
    }

    /**
     * Gives a claim back after a failed invocation so the next delivery can retry it.
     */
    public void release(String detectionId) {
        if (!properties.getDeliveryGuard().isEnabled()) {
            return;
        }

        try {
            stringRedisTemplate.delete(KEY_PREFIX + detectionId);
        } catch (DataAccessException e) {
            log.warn("Failed to release claim on detection {}: {}", detectionId, e.getMessage());
        }
    }
}
