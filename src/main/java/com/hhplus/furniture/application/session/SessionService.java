package com.hhplus.furniture.application.session;

import com.hhplus.furniture.application.user.AccountService;
import com.hhplus.furniture.common.exception.ApplicationException;
import com.hhplus.furniture.common.exception.ErrorCode;
import com.hhplus.furniture.domain.user.Account;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * SessionService - 로그인 세션 관리
 *
 * - 로그인 성공 시 불투명 토큰(UUID)을 발급하고 세션 저장소에 TTL과 함께 저장
 * - 요청마다 토큰으로 로그인 주체를 찾고 만료 시간을 연장 (sliding expiration)
 * - 이메일을 세션 키로 사용하지 않는다
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final AccountService accountService;
    private final SessionStore sessionStore;
    private final Duration ttl;

    public SessionService(AccountService accountService,
                          SessionStore sessionStore,
                          @Value("${furniture.session.ttl:30m}") Duration ttl) {
        this.accountService = accountService;
        this.sessionStore = sessionStore;
        this.ttl = ttl;
    }

    /**
     * @throws ApplicationException 이메일 또는 비밀번호가 틀린 경우 (둘을 구분하지 않음)
     */
    public SessionToken signIn(String email, String password) {
        Account account = accountService.authenticate(email, password)
                .orElseThrow(() -> new ApplicationException(ErrorCode.INVALID_CREDENTIALS));

        String token = UUID.randomUUID().toString();
        sessionStore.save(token, SessionPrincipal.of(account), ttl);

        log.info("[SessionService] 로그인: accountId={}, role={}", account.getAccountId(), account.getRole());
        return new SessionToken(token, account.getEmail(), account.getRole(), ttl.getSeconds());
    }

    public void signOut(String token) {
        if (token == null || token.isBlank()) {
            return;
        }
        sessionStore.delete(token);
        log.info("[SessionService] 로그아웃 처리");
    }

    public Optional<SessionPrincipal> resolve(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        Optional<SessionPrincipal> principal = sessionStore.find(token);
        principal.ifPresent(p -> sessionStore.touch(token, ttl));
        return principal;
    }

    /**
     * 구매자 세션만 허용한다.
     *
     * @throws ApplicationException 세션이 없으면 401, 매니저 세션이면 403
     */
    public SessionPrincipal requireUser(String token) {
        SessionPrincipal principal = resolve(token)
                .orElseThrow(() -> new ApplicationException(ErrorCode.UNAUTHORIZED));
        if (principal.isManager()) {
            throw new ApplicationException(ErrorCode.FORBIDDEN, "구매자 전용 기능입니다");
        }
        return principal;
    }

    /**
     * @throws ApplicationException 세션이 없으면 401, 구매자 세션이면 403
     */
    public SessionPrincipal requireManager(String token) {
        SessionPrincipal principal = resolve(token)
                .orElseThrow(() -> new ApplicationException(ErrorCode.UNAUTHORIZED));
        if (!principal.isManager()) {
            throw new ApplicationException(ErrorCode.FORBIDDEN, "매니저 전용 기능입니다");
        }
        return principal;
    }

    public SessionPrincipal requireAny(String token) {
        return resolve(token)
                .orElseThrow(() -> new ApplicationException(ErrorCode.UNAUTHORIZED));
    }
}
