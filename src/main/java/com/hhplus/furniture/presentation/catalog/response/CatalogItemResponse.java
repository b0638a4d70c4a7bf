package com.hhplus.furniture.presentation.catalog.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.furniture.application.catalog.dto.CatalogItemInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CatalogItemResponse {

    @JsonProperty("id")
    private Long id;

    @JsonProperty("furniture_type")
    private String furnitureType;

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("color")
    private String color;

    @JsonProperty("material")
    private String material;

    @JsonProperty("is_adjustable")
    private Boolean adjustable;

    @JsonProperty("has_armrest")
    private Boolean armrest;

    @JsonProperty("price")
    private BigDecimal price;

    @JsonProperty("dimensions")
    private String dimensions;

    public static CatalogItemResponse from(CatalogItemInfo info) {
        return CatalogItemResponse.builder()
                .id(info.getCatalogItemId())
                .furnitureType(info.getKind())
                .name(info.getName())
                .description(info.getDescription())
                .color(info.getColor())
                .material(info.getMaterial())
                .adjustable(info.getAdjustable())
                .armrest(info.getArmrest())
                .price(info.getPrice())
                .dimensions(info.getDimensions())
                .build();
    }
}
