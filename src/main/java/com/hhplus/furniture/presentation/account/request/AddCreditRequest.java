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
public class AddCreditRequest {

    @JsonProperty("email")
    private String email;

    @JsonProperty("amount")
    private BigDecimal amount;
}
