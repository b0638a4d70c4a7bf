package com.hhplus.furniture;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * 가구 쇼핑몰 애플리케이션 메인 클래스
 *
 * 활성화된 기능:
 * - @EnableAsync: 주문 이벤트 비동기 전달
 * - @EnableRetry: 재고 조정 낙관적 락 충돌 재시도
 * - @EnableAspectJAutoProxy: 분산락 Aspect
 */
@EnableAsync
@EnableRetry
@EnableAspectJAutoProxy
@SpringBootApplication
public class FurnitureStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(FurnitureStoreApplication.class, args);
    }

}
