package com.hhplus.furniture.application.user.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * 사용자 장바구니 금액에 세율을 적용한 견적
 */
@Getter
@AllArgsConstructor
public class TaxQuote {

    private final String email;
    private final BigDecimal taxRate;
    private final BigDecimal cartTotal;
    private final BigDecimal totalWithTax;
}
