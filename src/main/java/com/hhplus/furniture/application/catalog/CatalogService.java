package com.hhplus.furniture.application.catalog;

import com.hhplus.furniture.application.catalog.dto.CatalogItemInfo;
import com.hhplus.furniture.application.catalog.dto.MatchingOffer;
import com.hhplus.furniture.application.catalog.dto.VariantCommand;
import com.hhplus.furniture.domain.catalog.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * CatalogService - 상품 구성 ↔ 카탈로그 행 매핑 (Application 계층)
 *
 * 조회 실패 정책:
 * - 행이 없거나 저장소 오류가 나면 빈 결과를 반환하고 로그만 남긴다 (예외를 던지지 않음)
 * - 가격이 없는 상품은 생성되지만 가격을 사용하는 시점에 UnpricedVariantException이 발생한다
 * - 조회 예외를 직접 처리하는 메서드는 트랜잭션을 열지 않는다 (rollback-only 방지)
 */
@Service
public class CatalogService {

    public static final String PRICE_RANGE_CACHE = "catalogPriceRange";

    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);

    private final CatalogRepository catalogRepository;
    private final FurnitureFactory furnitureFactory;

    public CatalogService(CatalogRepository catalogRepository, FurnitureFactory furnitureFactory) {
        this.catalogRepository = catalogRepository;
        this.furnitureFactory = furnitureFactory;
    }

    /**
     * 요청 속성으로 상품을 만든다. 속성 검증에 실패하면 InvalidFurnitureAttributeException.
     */
    public Furniture variantOf(FurnitureKind kind, String color, String material, Boolean adjustable, Boolean armrest) {
        VariantKey key = furnitureFactory.keyOf(kind, color, material, adjustable, armrest);
        return furnitureFactory.create(key, resolve(key));
    }

    public Furniture variantOf(VariantCommand command) {
        return variantOf(command.getKind(), command.getColor(), command.getMaterial(),
                command.getAdjustable(), command.getArmrest());
    }

    /**
     * 요청 속성을 검증해 VariantKey로 변환한다 (카탈로그 조회 없음).
     */
    public VariantKey keyOf(VariantCommand command) {
        return furnitureFactory.keyOf(command.getKind(), command.getColor(), command.getMaterial(),
                command.getAdjustable(), command.getArmrest());
    }

    /**
     * 식별 속성이 정확히 일치하는 카탈로그 행의 가격/이름/설명
     */
    public Optional<CatalogEntry> resolve(VariantKey key) {
        return findItem(key).map(CatalogItem::toEntry);
    }

    /**
     * 상품의 식별 속성으로 카탈로그 행 ID를 다시 조회한다.
     */
    public Optional<Long> resolveId(Furniture furniture) {
        return findItem(furniture.variantKey()).map(CatalogItem::getId);
    }

    /**
     * 가격 범위 조회 (양 끝 포함)
     *
     * @throws InvalidPriceRangeException 음수이거나 min > max인 경우
     */
    @Cacheable(value = PRICE_RANGE_CACHE, key = "#minPrice.toPlainString() + ':' + #maxPrice.toPlainString()")
    @Transactional(readOnly = true)
    public List<CatalogItemInfo> findByPriceRange(BigDecimal minPrice, BigDecimal maxPrice) {
        if (minPrice == null || maxPrice == null) {
            throw new InvalidPriceRangeException("min_price와 max_price는 필수입니다");
        }
        if (minPrice.signum() < 0 || maxPrice.signum() < 0) {
            throw new InvalidPriceRangeException("가격은 음수일 수 없습니다");
        }
        if (minPrice.compareTo(maxPrice) > 0) {
            throw new InvalidPriceRangeException("min_price가 max_price보다 큽니다");
        }

        List<CatalogItemInfo> items = catalogRepository.findByPriceBetween(minPrice, maxPrice).stream()
                .map(CatalogItemInfo::from)
                .collect(Collectors.toList());
        log.debug("[CatalogService] 가격 범위 조회: min={}, max={}, count={}", minPrice, maxPrice, items.size());
        return items;
    }

    /**
     * 테이블이면 같은 색상의 재고 있는 의자를, 의자면 같은 색상의 재고 있는 테이블을 추천한다.
     */
    public MatchingOffer matchingOffer(Furniture furniture) {
        FurnitureFamily target = furniture.variantKey().getFamily().complement();
        try {
            return catalogRepository.findInStock(FurnitureKind.ofFamily(target), furniture.color()).stream()
                    .findFirst()
                    .map(MatchingOffer::of)
                    .orElseGet(MatchingOffer::none);
        } catch (DataAccessException e) {
            log.warn("[CatalogService] 추천 상품 조회 실패: variant={}", furniture.variantKey(), e);
            return MatchingOffer.none();
        }
    }

    /**
     * 카탈로그 행 등록 (초기 데이터 적재)
     */
    @CacheEvict(value = PRICE_RANGE_CACHE, allEntries = true)
    @Transactional
    public CatalogItem register(VariantKey key, String name, String description, BigDecimal price, int quantity) {
        CatalogItem saved = catalogRepository.save(CatalogItem.create(key, name, description, price, quantity));
        log.info("[CatalogService] 카탈로그 등록: id={}, variant={}, price={}", saved.getId(), key, price);
        return saved;
    }

    private Optional<CatalogItem> findItem(VariantKey key) {
        try {
            Optional<CatalogItem> item = catalogRepository.findByKey(key);
            if (item.isEmpty()) {
                log.debug("[CatalogService] 카탈로그 행 없음: variant={}", key);
            }
            return item;
        } catch (DataAccessException e) {
            log.warn("[CatalogService] 카탈로그 조회 실패: variant={}", key, e);
            return Optional.empty();
        }
    }
}
