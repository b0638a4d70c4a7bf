package com.hhplus.furniture.presentation.catalog.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.furniture.application.catalog.dto.VariantCommand;
import com.hhplus.furniture.domain.catalog.FurnitureKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 가구 구성 요청 본문의 item 부분
 *
 * {"color": "brown", "table": {"material": "wood"}}
 * {"color": "blue", "chair": {"is_adjustable": true, "has_armrest": false}}
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FurnitureItemRequest {

    private String color;

    private TableSpec table;

    private ChairSpec chair;

    /**
     * object_type(종류 이름 또는 코드)과 함께 구성 값을 만든다. 속성 검증은 FurnitureFactory가 한다.
     */
    public VariantCommand toCommand(String objectType) {
        return new VariantCommand(
                FurnitureKind.from(objectType),
                color,
                table == null ? null : table.getMaterial(),
                chair == null ? null : chair.getAdjustable(),
                chair == null ? null : chair.getArmrest());
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TableSpec {
        private String material;
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChairSpec {
        @JsonProperty("is_adjustable")
        private Boolean adjustable;

        @JsonProperty("has_armrest")
        private Boolean armrest;
    }
}
