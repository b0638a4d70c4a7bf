package com.hhplus.furniture.domain.catalog;

import java.util.Optional;

/**
 * FurnitureFactory - 상품 객체 생성 도메인 서비스
 *
 * 저장소 의존성 없이 검증된 VariantKey와 (선택적) 카탈로그 스냅샷으로 상품을 조립한다.
 * 카탈로그 조회는 애플리케이션 계층(CatalogService)이 담당한다.
 */
public class FurnitureFactory {

    public Furniture create(VariantKey key, Optional<CatalogEntry> catalogEntry) {
        CatalogEntry entry = catalogEntry.orElse(null);
        switch (key.getFamily()) {
            case TABLE:
                return new TableVariant(key, entry);
            case CHAIR:
                return new ChairVariant(key, entry);
            default:
                throw new InvalidFurnitureAttributeException("지원하지 않는 가구 계열: " + key.getFamily());
        }
    }

    /**
     * 요청 속성으로 VariantKey를 만든다. 테이블은 material, 의자는 adjustable/armrest를 사용한다.
     */
    public VariantKey keyOf(FurnitureKind kind, String color, String material, Boolean adjustable, Boolean armrest) {
        if (kind == null) {
            throw new InvalidFurnitureAttributeException("가구 종류는 필수입니다");
        }
        if (kind.isTable()) {
            if (material == null) {
                throw new InvalidFurnitureAttributeException("테이블은 소재가 필수입니다");
            }
            return VariantKey.table(kind, color, material);
        }
        if (material != null) {
            throw new InvalidFurnitureAttributeException("의자는 소재를 지정할 수 없습니다");
        }
        if (adjustable == null || armrest == null) {
            throw new InvalidFurnitureAttributeException("의자는 높이 조절/팔걸이 여부가 필수입니다");
        }
        return VariantKey.chair(kind, color, adjustable, armrest);
    }
}
