package com.hhplus.furniture.application.catalog.dto;

import com.hhplus.furniture.domain.catalog.FurnitureKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 상품 구성 선택 값. 테이블은 material, 의자는 adjustable/armrest를 채운다.
 */
@Getter
@Builder
@ToString
@AllArgsConstructor
public class VariantCommand {

    private final FurnitureKind kind;
    private final String color;
    private final String material;
    private final Boolean adjustable;
    private final Boolean armrest;

    public static VariantCommand table(FurnitureKind kind, String color, String material) {
        return new VariantCommand(kind, color, material, null, null);
    }

    public static VariantCommand chair(FurnitureKind kind, String color, boolean adjustable, boolean armrest) {
        return new VariantCommand(kind, color, null, adjustable, armrest);
    }
}
