package com.hhplus.furniture.domain.catalog;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Locale;

/**
 * VariantKey - 구매 가능한 가구 구성의 식별 속성
 *
 * 테이블: (종류, 색상, 소재)
 * 의자: (종류, 색상, 높이 조절 여부, 팔걸이 여부)
 *
 * 색상과 소재는 소문자로 정규화되며, 모든 필드가 같으면 같은 상품이다.
 * 생성 시 종류별 허용 색상/소재를 검증한다.
 */
@Getter
@EqualsAndHashCode
public final class VariantKey {

    private final FurnitureKind kind;
    private final String color;
    private final String material;
    private final boolean adjustable;
    private final boolean armrest;

    private VariantKey(FurnitureKind kind, String color, String material, boolean adjustable, boolean armrest) {
        this.kind = kind;
        this.color = color;
        this.material = material;
        this.adjustable = adjustable;
        this.armrest = armrest;
    }

    public static VariantKey table(FurnitureKind kind, String color, String material) {
        requireKind(kind);
        if (!kind.isTable()) {
            throw new InvalidFurnitureAttributeException(kind.name() + "은(는) 테이블이 아닙니다");
        }
        String normalizedColor = validateColor(kind, color);
        if (!kind.allowsMaterial(material)) {
            throw new InvalidFurnitureAttributeException(
                    "허용 소재가 아닙니다: " + material + " (허용: " + kind.getAllowedMaterials() + ")");
        }
        return new VariantKey(kind, normalizedColor, normalize(material), false, false);
    }

    public static VariantKey chair(FurnitureKind kind, String color, boolean adjustable, boolean armrest) {
        requireKind(kind);
        if (kind.isTable()) {
            throw new InvalidFurnitureAttributeException(kind.name() + "은(는) 의자가 아닙니다");
        }
        return new VariantKey(kind, validateColor(kind, color), null, adjustable, armrest);
    }

    /**
     * 저장소 유일 키. 모든 식별 속성이 null 없이 들어간다.
     * 예: DINING_TABLE:brown:metal, GAMING_CHAIR:black:adjustable=true:armrest=false
     */
    public String storageKey() {
        if (kind.isTable()) {
            return kind.name() + ":" + color + ":" + material;
        }
        return kind.name() + ":" + color + ":adjustable=" + adjustable + ":armrest=" + armrest;
    }

    public FurnitureFamily getFamily() {
        return kind.getFamily();
    }

    public FurnitureKind.Dimensions getDimensions() {
        return kind.getDimensions();
    }

    private static void requireKind(FurnitureKind kind) {
        if (kind == null) {
            throw new InvalidFurnitureAttributeException("가구 종류는 필수입니다");
        }
    }

    private static String validateColor(FurnitureKind kind, String color) {
        if (!kind.allowsColor(color)) {
            throw new InvalidFurnitureAttributeException(
                    "허용 색상이 아닙니다: " + color + " (허용: " + kind.getAllowedColors() + ")");
        }
        return normalize(color);
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        if (kind.isTable()) {
            return kind.name() + "(" + color + ", " + material + ")";
        }
        return kind.name() + "(" + color + ", adjustable=" + adjustable + ", armrest=" + armrest + ")";
    }
}
