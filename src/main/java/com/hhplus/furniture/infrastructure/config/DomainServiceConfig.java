package com.hhplus.furniture.infrastructure.config;

import com.hhplus.furniture.domain.catalog.FurnitureFactory;
import com.hhplus.furniture.domain.payment.CardPaymentValidator;
import com.hhplus.furniture.domain.payment.PaymentValidator;
import com.hhplus.furniture.domain.user.CreditDomainService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * DomainServiceConfig - 외부 의존성이 없는 도메인 서비스를 Spring Bean으로 등록
 */
@Configuration
public class DomainServiceConfig {

    @Bean
    public FurnitureFactory furnitureFactory() {
        return new FurnitureFactory();
    }

    @Bean
    public CreditDomainService creditDomainService() {
        return new CreditDomainService();
    }

    @Bean
    public PaymentValidator paymentValidator() {
        return new CardPaymentValidator();
    }
}
