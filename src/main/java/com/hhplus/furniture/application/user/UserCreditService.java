package com.hhplus.furniture.application.user;

import com.hhplus.furniture.application.user.dto.UserInfo;
import com.hhplus.furniture.common.exception.ErrorCode;
import com.hhplus.furniture.common.exception.SystemException;
import com.hhplus.furniture.domain.user.User;
import com.hhplus.furniture.domain.user.UserNotFoundException;
import com.hhplus.furniture.domain.user.UserRepository;
import com.hhplus.furniture.infrastructure.lock.DistributedLock;
import com.hhplus.furniture.infrastructure.lock.LockKeyGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

/**
 * UserCreditService - 크레딧 충전
 *
 * 동시성 제어:
 * - Redis 분산락 (user:credit:{userId})
 * - DB 비관적 락 (SELECT ... FOR UPDATE): 결제 트랜잭션의 크레딧 차감과 직렬화
 */
@Service
public class UserCreditService {

    private static final Logger log = LoggerFactory.getLogger(UserCreditService.class);

    private final UserRepository userRepository;

    public UserCreditService(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    /**
     * @throws UserNotFoundException 사용자가 없는 경우
     * @throws com.hhplus.furniture.common.exception.DomainException 충전액이 0 이하인 경우
     * @throws SystemException 저장소 오류 (롤백 후)
     */
    @DistributedLock(key = LockKeyGenerator.USER_CREDIT_KEY_TEMPLATE, waitTime = 5, leaseTime = 2)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public UserInfo addCredit(Long userId, BigDecimal amount) {
        try {
            User user = userRepository.findByIdForUpdate(userId)
                    .orElseThrow(() -> new UserNotFoundException(userId));
            user.addCredit(amount);
            User saved = userRepository.save(user);

            log.info("[UserCreditService] 크레딧 충전 완료: userId={}, amount={}, credit={}",
                    userId, amount, saved.getCredit());
            return UserInfo.from(saved);
        } catch (DataAccessException e) {
            throw new SystemException(ErrorCode.DATABASE_ERROR, "크레딧 충전 실패: userId=" + userId, e);
        }
    }
}
