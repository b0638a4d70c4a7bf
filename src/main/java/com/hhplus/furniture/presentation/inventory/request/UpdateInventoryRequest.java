package com.hhplus.furniture.presentation.inventory.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.furniture.presentation.catalog.request.FurnitureItemRequest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 재고 조정 요청 DTO
 *
 * sign: "+" (입고) / "-" (출고), "1" / "-1"도 허용
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateInventoryRequest {

    private Integer quantity;

    private String sign;

    @JsonProperty("object_type")
    private String objectType;

    private FurnitureItemRequest item;
}
