package com.hhplus.furniture.domain.user;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Manager 도메인 엔티티 (재고/주문/사용자 관리 권한을 가진 운영자)
 */
@Entity
@Table(name = "managers")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Manager implements Account {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "manager_id")
    private Long managerId;

    @Column(name = "email", nullable = false, unique = true, length = AccountPolicy.MAX_EMAIL_LENGTH)
    private String email;

    @Column(name = "name", nullable = false, length = AccountPolicy.MAX_NAME_LENGTH)
    private String name;

    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static Manager createManager(String name, String email, String passwordHash) {
        return Manager.builder()
                .name(AccountPolicy.requireName(name))
                .email(AccountPolicy.normalizeEmail(email))
                .passwordHash(passwordHash)
                .createdAt(LocalDateTime.now())
                .build();
    }

    public void changePassword(String newPasswordHash) {
        this.passwordHash = newPasswordHash;
    }

    @Override
    public Long getAccountId() {
        return managerId;
    }

    @Override
    public Role getRole() {
        return Role.MANAGER;
    }
}
