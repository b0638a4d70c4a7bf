package com.hhplus.furniture.domain.user;

import java.util.Optional;

/**
 * ManagerRepository - 매니저 저장소 포트
 */
public interface ManagerRepository {

    Optional<Manager> findByEmail(String email);

    Optional<Manager> findById(Long managerId);

    boolean existsByEmail(String email);

    Manager save(Manager manager);

    long count();
}
