package com.hhplus.furniture.infrastructure.persistence.user;

import com.hhplus.furniture.domain.user.Manager;
import com.hhplus.furniture.domain.user.ManagerRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * MySQL 기반 ManagerRepository 구현
 */
@Repository
@Primary
public class MySQLManagerRepository implements ManagerRepository {

    private final ManagerJpaRepository managerJpaRepository;

    public MySQLManagerRepository(ManagerJpaRepository managerJpaRepository) {
        this.managerJpaRepository = managerJpaRepository;
    }

    @Override
    public Optional<Manager> findByEmail(String email) {
        return managerJpaRepository.findByEmail(email);
    }

    @Override
    public Optional<Manager> findById(Long managerId) {
        return managerJpaRepository.findById(managerId);
    }

    @Override
    public boolean existsByEmail(String email) {
        return managerJpaRepository.existsByEmail(email);
    }

    @Override
    public Manager save(Manager manager) {
        return managerJpaRepository.save(manager);
    }

    @Override
    public long count() {
        return managerJpaRepository.count();
    }
}
