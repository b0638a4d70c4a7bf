package com.hhplus.furniture.domain.catalog;

import com.hhplus.furniture.domain.inventory.InsufficientStockException;
import com.hhplus.furniture.domain.inventory.InvalidStockQuantityException;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * CatalogItem - 카탈로그 행 (가격/설명/재고의 단일 원천)
 *
 * 핵심 비즈니스 규칙:
 * - (종류, 색상, 소재 | 높이 조절 + 팔걸이) 조합마다 하나의 행 (variant_key 유일 제약)
 * - 재고는 음수가 될 수 없음
 * - version 컬럼으로 낙관적 락
 */
@Entity
@Table(name = "inventory",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_inventory_variant",
                columnNames = "variant_key"),
        indexes = @Index(name = "idx_inventory_price", columnList = "price"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "variant_key", nullable = false, length = 100)
    private String variantKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "furniture_kind", nullable = false, length = 20)
    private FurnitureKind kind;

    @Column(name = "color", nullable = false, length = 50)
    private String color;

    @Column(name = "material", length = 50)
    private String material;

    @Column(name = "is_adjustable", nullable = false)
    private boolean adjustable;

    @Column(name = "has_armrest", nullable = false)
    private boolean armrest;

    @Column(name = "f_name", nullable = false, length = 500)
    private String name;

    @Column(name = "f_desc", nullable = false, length = 1000)
    private String description;

    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "height", nullable = false)
    private int height;

    @Column(name = "depth", nullable = false)
    private int depth;

    @Column(name = "width", nullable = false)
    private int width;

    @Column(name = "quantity", nullable = false)
    private int quantity;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 카탈로그 행 생성 팩토리 메서드. 치수는 가구 종류의 고정 치수를 따른다.
     */
    public static CatalogItem create(VariantKey key, String name, String description,
                                     BigDecimal price, int initialQuantity) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("상품명은 필수입니다");
        }
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("가격은 0 이상이어야 합니다");
        }
        if (initialQuantity < 0) {
            throw new IllegalArgumentException("초기 재고는 0 이상이어야 합니다");
        }

        FurnitureKind.Dimensions dimensions = key.getDimensions();
        LocalDateTime now = LocalDateTime.now();
        return CatalogItem.builder()
                .variantKey(key.storageKey())
                .kind(key.getKind())
                .color(key.getColor())
                .material(key.getMaterial())
                .adjustable(key.isAdjustable())
                .armrest(key.isArmrest())
                .name(name)
                .description(description == null ? "" : description)
                .price(PricePolicy.money(price))
                .height(dimensions.getHeight())
                .depth(dimensions.getDepth())
                .width(dimensions.getWidth())
                .quantity(initialQuantity)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 재고 입고 (매니저 재입고)
     */
    public void increase(int amount) {
        if (amount < 0) {
            throw new InvalidStockQuantityException(amount);
        }
        this.quantity += amount;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 재고 차감 (주문/매니저 조정). 보유 수량을 넘는 차감은 거부한다.
     */
    public void decrease(int amount) {
        if (amount < 0) {
            throw new InvalidStockQuantityException(amount);
        }
        if (this.quantity < amount) {
            throw new InsufficientStockException(id, name, quantity, amount);
        }
        this.quantity -= amount;
        this.updatedAt = LocalDateTime.now();
    }

    public boolean hasStock(int amount) {
        return this.quantity >= amount;
    }

    public VariantKey variantKey() {
        if (kind.isTable()) {
            return VariantKey.table(kind, color, material);
        }
        return VariantKey.chair(kind, color, adjustable, armrest);
    }

    public CatalogEntry toEntry() {
        return new CatalogEntry(id, name, description, price);
    }
}
