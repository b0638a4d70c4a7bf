package com.hhplus.furniture.infrastructure.lock;

import com.hhplus.furniture.common.exception.ErrorCode;
import com.hhplus.furniture.common.exception.SystemException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.core.Ordered;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * 분산락 AOP 처리 (TransactionSynchronization 기반)
 *
 * 실행 순서:
 * 1. 락 획득 (@Transactional보다 먼저 실행되도록 order 지정)
 * 2. @Transactional 시작, 비즈니스 로직 실행
 * 3. 커밋/롤백
 * 4. afterCompletion 콜백에서 락 해제 (트랜잭션이 없으면 finally에서 해제)
 */
@Aspect
@Component
@Slf4j
@RequiredArgsConstructor
public class DistributedLockAop implements Ordered {

    private final RedissonClient redissonClient;
    private final ExpressionParser expressionParser = new SpelExpressionParser();

    @Around("@annotation(distributedLock)")
    public Object around(ProceedingJoinPoint joinPoint, DistributedLock distributedLock) throws Throwable {
        String dynamicKey = generateKey(joinPoint, distributedLock.key());
        RLock rLock = redissonClient.getLock(dynamicKey);

        boolean lockAcquired = false;
        boolean releaseOnCompletion = false;
        try {
            lockAcquired = rLock.tryLock(
                    distributedLock.waitTime(),
                    distributedLock.leaseTime(),
                    distributedLock.timeUnit()
            );

            if (!lockAcquired) {
                log.warn("[DistributedLock] 락 획득 실패 - key: {}", dynamicKey);
                throw new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED, "key=" + dynamicKey);
            }
            log.debug("[DistributedLock] 락 획득 - key: {}", dynamicKey);

            // 호출자가 이미 트랜잭션 안에 있으면 그 트랜잭션이 끝날 때 해제
            if (TransactionSynchronizationManager.isSynchronizationActive()) {
                TransactionSynchronizationManager.registerSynchronization(
                        new LockReleaseSynchronization(rLock, dynamicKey)
                );
                releaseOnCompletion = true;
            }

            return joinPoint.proceed();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[DistributedLock] 락 대기 중 인터럽트 - key: {}", dynamicKey, e);
            throw new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED, "interrupted: key=" + dynamicKey, e);

        } finally {
            if (lockAcquired && !releaseOnCompletion) {
                unlock(rLock, dynamicKey);
            }
        }
    }

    private static void unlock(RLock rLock, String lockKey) {
        try {
            if (rLock.isHeldByCurrentThread()) {
                rLock.unlock();
                log.debug("[DistributedLock] 락 해제 - key: {}", lockKey);
            }
        } catch (Exception e) {
            log.error("[DistributedLock] 락 해제 중 오류 발생 - key: {}", lockKey, e);
        }
    }

    private static class LockReleaseSynchronization implements TransactionSynchronization {
        private final RLock rLock;
        private final String lockKey;

        LockReleaseSynchronization(RLock rLock, String lockKey) {
            this.rLock = rLock;
            this.lockKey = lockKey;
        }

        @Override
        public void afterCompletion(int status) {
            unlock(rLock, lockKey);
        }
    }

    private String generateKey(ProceedingJoinPoint joinPoint, String keyPattern) {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Object[] args = joinPoint.getArgs();

        EvaluationContext context = new StandardEvaluationContext();
        for (int i = 0; i < args.length; i++) {
            context.setVariable("p" + i, args[i]);
        }
        context.setVariable("args", args);

        try {
            return expressionParser.parseExpression(keyPattern).getValue(context, String.class);
        } catch (Exception e) {
            log.error("[DistributedLock] 동적 키 생성 실패 - method: {}, pattern: {}",
                    signature.getName(), keyPattern, e);
            throw new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED, "invalid key pattern: " + keyPattern, e);
        }
    }

    /**
     * @Transactional (기본 order = LOWEST_PRECEDENCE)보다 바깥에서 실행
     */
    @Override
    public int getOrder() {
        return Ordered.LOWEST_PRECEDENCE - 1000;
    }
}
