package com.hhplus.furniture.infrastructure.session;

import com.hhplus.furniture.application.session.SessionPrincipal;
import com.hhplus.furniture.application.session.SessionStore;
import com.hhplus.furniture.common.exception.ErrorCode;
import com.hhplus.furniture.common.exception.SystemException;
import com.hhplus.furniture.domain.user.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis 세션 저장소
 *
 * Key: {prefix}{token}, Value: "ROLE:accountId:email", TTL 적용
 */
@Repository
public class RedisSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(RedisSessionStore.class);
    private static final String SEPARATOR = ":";

    private final RedisTemplate<String, String> redisTemplate;
    private final String keyPrefix;

    public RedisSessionStore(RedisTemplate<String, String> redisTemplate,
                             @Value("${furniture.session.key-prefix:session:}") String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public void save(String token, SessionPrincipal principal, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(key(token), serialize(principal), ttl);
        } catch (DataAccessException e) {
            throw new SystemException(ErrorCode.SESSION_STORE_ERROR, "세션 저장 실패", e);
        }
    }

    @Override
    public Optional<SessionPrincipal> find(String token) {
        String value;
        try {
            value = redisTemplate.opsForValue().get(key(token));
        } catch (DataAccessException e) {
            throw new SystemException(ErrorCode.SESSION_STORE_ERROR, "세션 조회 실패", e);
        }
        if (value == null) {
            return Optional.empty();
        }
        return deserialize(value);
    }

    @Override
    public void touch(String token, Duration ttl) {
        try {
            redisTemplate.expire(key(token), ttl);
        } catch (DataAccessException e) {
            // 연장 실패는 기존 만료 시간을 유지한다
            log.warn("[RedisSessionStore] 세션 만료 연장 실패: {}", e.getMessage());
        }
    }

    @Override
    public void delete(String token) {
        try {
            redisTemplate.delete(key(token));
        } catch (DataAccessException e) {
            throw new SystemException(ErrorCode.SESSION_STORE_ERROR, "세션 삭제 실패", e);
        }
    }

    private String key(String token) {
        return keyPrefix + token;
    }

    static String serialize(SessionPrincipal principal) {
        return principal.getRole().name() + SEPARATOR + principal.getAccountId() + SEPARATOR + principal.getEmail();
    }

    static Optional<SessionPrincipal> deserialize(String value) {
        String[] parts = value.split(SEPARATOR, 3);
        if (parts.length != 3) {
            log.warn("[RedisSessionStore] 손상된 세션 값 무시");
            return Optional.empty();
        }
        try {
            return Optional.of(new SessionPrincipal(Long.valueOf(parts[1]), parts[2], Role.valueOf(parts[0])));
        } catch (IllegalArgumentException e) {
            log.warn("[RedisSessionStore] 손상된 세션 값 무시: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
