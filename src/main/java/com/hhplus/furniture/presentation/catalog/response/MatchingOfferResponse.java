package com.hhplus.furniture.presentation.catalog.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.furniture.application.catalog.dto.MatchingOffer;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class MatchingOfferResponse {

    @JsonProperty("matched")
    private boolean matched;

    @JsonProperty("matching_item_id")
    private Long matchingItemId;

    @JsonProperty("message")
    private String message;

    public static MatchingOfferResponse from(MatchingOffer offer) {
        return new MatchingOfferResponse(offer.isMatched(), offer.getCatalogItemId(), offer.getMessage());
    }
}
