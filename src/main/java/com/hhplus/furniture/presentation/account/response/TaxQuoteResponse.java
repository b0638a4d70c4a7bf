package com.hhplus.furniture.presentation.account.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.furniture.application.user.dto.TaxQuote;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class TaxQuoteResponse {

    @JsonProperty("email")
    private String email;

    @JsonProperty("tax_rate")
    private BigDecimal taxRate;

    @JsonProperty("cart_total")
    private BigDecimal cartTotal;

    @JsonProperty("total_with_tax")
    private BigDecimal totalWithTax;

    public static TaxQuoteResponse from(TaxQuote quote) {
        return new TaxQuoteResponse(quote.getEmail(), quote.getTaxRate(), quote.getCartTotal(),
                quote.getTotalWithTax());
    }
}
