package com.hhplus.furniture.infrastructure.persistence.user;

import com.hhplus.furniture.domain.user.Manager;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ManagerJpaRepository extends JpaRepository<Manager, Long> {

    Optional<Manager> findByEmail(String email);

    boolean existsByEmail(String email);
}
