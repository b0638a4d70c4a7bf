package com.hhplus.furniture.domain.catalog;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * FurnitureKind - 판매 가능한 가구 종류
 *
 * 종류마다 고정 치수(높이, 깊이, 너비)와 허용 색상, 허용 소재(테이블만)가 정해져 있다.
 * code는 저장소와 외부 요청에서 사용하는 숫자 식별자이다.
 */
public enum FurnitureKind {

    DINING_TABLE(1, "Dining Table", FurnitureFamily.TABLE, new Dimensions(100, 50, 60),
            List.of("brown", "gray"), List.of("wood", "metal")),
    WORK_DESK(2, "Work Desk", FurnitureFamily.TABLE, new Dimensions(120, 55, 65),
            List.of("black", "white"), List.of("wood", "glass")),
    COFFEE_TABLE(3, "Coffee Table", FurnitureFamily.TABLE, new Dimensions(130, 60, 70),
            List.of("gray", "red"), List.of("glass", "plastic")),
    WORK_CHAIR(4, "Work Chair", FurnitureFamily.CHAIR, new Dimensions(140, 65, 75),
            List.of("red", "white"), List.of()),
    GAMING_CHAIR(5, "Gaming Chair", FurnitureFamily.CHAIR, new Dimensions(150, 70, 80),
            List.of("black", "blue"), List.of());

    private final int code;
    private final String displayName;
    private final FurnitureFamily family;
    private final Dimensions dimensions;
    private final List<String> allowedColors;
    private final List<String> allowedMaterials;

    FurnitureKind(int code, String displayName, FurnitureFamily family, Dimensions dimensions,
                  List<String> allowedColors, List<String> allowedMaterials) {
        this.code = code;
        this.displayName = displayName;
        this.family = family;
        this.dimensions = dimensions;
        this.allowedColors = allowedColors;
        this.allowedMaterials = allowedMaterials;
    }

    public int getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public FurnitureFamily getFamily() {
        return family;
    }

    public Dimensions getDimensions() {
        return dimensions;
    }

    public List<String> getAllowedColors() {
        return allowedColors;
    }

    public List<String> getAllowedMaterials() {
        return allowedMaterials;
    }

    public boolean isTable() {
        return family == FurnitureFamily.TABLE;
    }

    public boolean allowsColor(String color) {
        return color != null && allowedColors.contains(color.trim().toLowerCase(Locale.ROOT));
    }

    public boolean allowsMaterial(String material) {
        return material != null && allowedMaterials.contains(material.trim().toLowerCase(Locale.ROOT));
    }

    public static List<FurnitureKind> ofFamily(FurnitureFamily family) {
        return Arrays.stream(values())
                .filter(kind -> kind.family == family)
                .collect(Collectors.toList());
    }

    /**
     * 숫자 코드("1") 또는 이름("DINING_TABLE", "dining table")으로 종류를 찾는다.
     */
    public static FurnitureKind from(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidFurnitureAttributeException("가구 종류가 비어 있습니다");
        }
        String normalized = value.trim();
        for (FurnitureKind kind : values()) {
            if (String.valueOf(kind.code).equals(normalized)
                    || kind.name().equalsIgnoreCase(normalized.replace(' ', '_'))
                    || kind.displayName.equalsIgnoreCase(normalized)) {
                return kind;
            }
        }
        throw new InvalidFurnitureAttributeException("알 수 없는 가구 종류: " + value);
    }

    /**
     * 가구 고정 치수 (단위: cm)
     */
    @Getter
    @EqualsAndHashCode
    @AllArgsConstructor
    public static final class Dimensions {
        private final int height;
        private final int depth;
        private final int width;

        @Override
        public String toString() {
            return height + "x" + depth + "x" + width;
        }
    }
}
