package com.hhplus.furniture.domain.user;

import java.util.Optional;

/**
 * UserRepository - 사용자 저장소 포트
 */
public interface UserRepository {

    Optional<User> findById(Long userId);

    Optional<User> findByEmail(String email);

    /**
     * 비관적 쓰기 락으로 조회한다. 크레딧 변경 전에 사용한다.
     */
    Optional<User> findByIdForUpdate(Long userId);

    boolean existsByEmail(String email);

    User save(User user);

    void delete(User user);
}
