package com.hhplus.furniture.application.session;

import java.time.Duration;
import java.util.Optional;

/**
 * 세션 저장소 포트. 모든 항목은 TTL을 가진다.
 */
public interface SessionStore {

    void save(String token, SessionPrincipal principal, Duration ttl);

    Optional<SessionPrincipal> find(String token);

    /**
     * 만료 시간을 다시 ttl로 연장한다.
     */
    void touch(String token, Duration ttl);

    void delete(String token);
}
