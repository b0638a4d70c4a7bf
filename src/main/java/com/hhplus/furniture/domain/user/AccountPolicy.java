package com.hhplus.furniture.domain.user;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * AccountPolicy - 계정 입력값 검증 규칙
 *
 * - 이름/주소: 공백 불가
 * - 이메일: 형식 검증, 25자 이하, 소문자로 정규화
 * - 비밀번호: 8자 이상
 * - 크레딧: 0 이상
 */
public final class AccountPolicy {

    public static final int MAX_EMAIL_LENGTH = 25;
    public static final int MIN_PASSWORD_LENGTH = 8;
    public static final int MAX_NAME_LENGTH = 20;

    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("^[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$");

    private AccountPolicy() {
        throw new AssertionError("AccountPolicy는 인스턴스화할 수 없습니다");
    }

    public static String normalizeEmail(String email) {
        if (email == null || email.isBlank()) {
            throw new InvalidAccountFieldException("이메일은 필수입니다");
        }
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        if (normalized.length() > MAX_EMAIL_LENGTH) {
            throw new InvalidAccountFieldException("이메일은 " + MAX_EMAIL_LENGTH + "자 이하여야 합니다");
        }
        if (!EMAIL_PATTERN.matcher(normalized).matches()) {
            throw new InvalidAccountFieldException("이메일 형식이 올바르지 않습니다: " + email);
        }
        return normalized;
    }

    public static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidAccountFieldException("이름은 필수입니다");
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new InvalidAccountFieldException("이름은 " + MAX_NAME_LENGTH + "자 이하여야 합니다");
        }
        return trimmed;
    }

    public static String requireAddress(String address) {
        if (address == null || address.isBlank()) {
            throw new InvalidAccountFieldException("주소는 필수입니다");
        }
        return address.trim();
    }

    public static void validatePassword(String rawPassword) {
        if (rawPassword == null || rawPassword.length() < MIN_PASSWORD_LENGTH) {
            throw new InvalidAccountFieldException("비밀번호는 " + MIN_PASSWORD_LENGTH + "자 이상이어야 합니다");
        }
    }

    public static BigDecimal requireCredit(BigDecimal credit) {
        if (credit == null) {
            return BigDecimal.ZERO;
        }
        if (credit.signum() < 0) {
            throw new InvalidAccountFieldException("크레딧은 0 이상이어야 합니다");
        }
        return credit;
    }
}
