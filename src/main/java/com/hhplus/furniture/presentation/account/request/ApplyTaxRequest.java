package com.hhplus.furniture.presentation.account.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApplyTaxRequest {

    @JsonProperty("email")
    private String email;

    @JsonProperty("tax_rate")
    private BigDecimal taxRate;
}
