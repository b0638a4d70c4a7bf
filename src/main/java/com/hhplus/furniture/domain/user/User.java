package com.hhplus.furniture.domain.user;

import com.hhplus.furniture.common.exception.DomainException;
import com.hhplus.furniture.common.exception.ErrorCode;
import com.hhplus.furniture.domain.catalog.PricePolicy;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * User 도메인 엔티티 (구매자)
 *
 * 핵심 비즈니스 규칙:
 * - 이메일은 유일하며 소문자로 저장
 * - 크레딧은 음수가 될 수 없음 (>= 0)
 * - 크레딧은 결제 시 자동으로 먼저 차감된다
 */
@Entity
@Table(name = "users")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User implements Account {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "user_id")
    private Long userId;

    @Column(name = "email", nullable = false, unique = true, length = AccountPolicy.MAX_EMAIL_LENGTH)
    private String email;

    @Column(name = "name", nullable = false, length = AccountPolicy.MAX_NAME_LENGTH)
    private String name;

    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash;

    @Column(name = "address", nullable = false)
    private String address;

    @Column(name = "credit", nullable = false, precision = 12, scale = 2)
    private BigDecimal credit;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 사용자 생성 팩토리 메서드. 비밀번호는 해시된 값을 받는다.
     */
    public static User createUser(String name, String email, String passwordHash, String address, BigDecimal credit) {
        LocalDateTime now = LocalDateTime.now();
        return User.builder()
                .name(AccountPolicy.requireName(name))
                .email(AccountPolicy.normalizeEmail(email))
                .passwordHash(passwordHash)
                .address(AccountPolicy.requireAddress(address))
                .credit(PricePolicy.money(AccountPolicy.requireCredit(credit)))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 크레딧 충전 (매니저)
     *
     * @throws DomainException 충전액이 0 이하인 경우
     */
    public void addCredit(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new DomainException(ErrorCode.INVALID_CREDIT, "충전액은 0보다 커야 합니다: " + amount);
        }
        this.credit = PricePolicy.money(this.credit.add(amount));
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 크레딧 사용 (결제)
     *
     * @throws InsufficientCreditException 보유 크레딧보다 많이 사용하려는 경우
     */
    public void useCredit(BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new DomainException(ErrorCode.INVALID_CREDIT, "사용액은 0 이상이어야 합니다: " + amount);
        }
        if (this.credit.compareTo(amount) < 0) {
            throw new InsufficientCreditException(this.userId, this.credit, amount);
        }
        this.credit = PricePolicy.money(this.credit.subtract(amount));
        this.updatedAt = LocalDateTime.now();
    }

    public void updateProfile(String name, String address) {
        if (name != null) {
            this.name = AccountPolicy.requireName(name);
        }
        if (address != null) {
            this.address = AccountPolicy.requireAddress(address);
        }
        this.updatedAt = LocalDateTime.now();
    }

    public void changePassword(String newPasswordHash) {
        this.passwordHash = newPasswordHash;
        this.updatedAt = LocalDateTime.now();
    }

    @Override
    public Long getAccountId() {
        return userId;
    }

    @Override
    public Role getRole() {
        return Role.USER;
    }
}
