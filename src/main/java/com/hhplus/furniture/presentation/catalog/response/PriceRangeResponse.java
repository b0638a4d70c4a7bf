package com.hhplus.furniture.presentation.catalog.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class PriceRangeResponse {

    public static final String EMPTY_MESSAGE = "There are no furnitures in this price range";

    @JsonProperty("message")
    private String message;

    @JsonProperty("items")
    private List<CatalogItemResponse> items;
}
