package com.hhplus.furniture.application.inventory;

import com.hhplus.furniture.application.inventory.dto.StockAdjustment;
import com.hhplus.furniture.domain.catalog.AvailabilityChecker;
import com.hhplus.furniture.domain.catalog.CatalogItem;
import com.hhplus.furniture.domain.catalog.CatalogItemNotFoundException;
import com.hhplus.furniture.domain.catalog.CatalogRepository;
import com.hhplus.furniture.domain.catalog.VariantKey;
import com.hhplus.furniture.domain.inventory.InvalidStockQuantityException;
import com.hhplus.furniture.domain.inventory.StockDirection;
import com.hhplus.furniture.infrastructure.lock.DistributedLock;
import com.hhplus.furniture.infrastructure.lock.LockKeyGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * InventoryService - 재고 장부 (Application 계층)
 *
 * 역할:
 * - 매니저 재입고/조정: 분산락 + 낙관적 락(version) 재시도
 * - 재고 확인: 행이 없거나 저장소 오류면 false (fail-closed)
 * - 결제 차감: 결제 트랜잭션 안에서 비관적 락으로 재확인 후 차감
 */
@Service
public class InventoryService implements AvailabilityChecker {

    private static final Logger log = LoggerFactory.getLogger(InventoryService.class);

    private final CatalogRepository catalogRepository;

    public InventoryService(CatalogRepository catalogRepository) {
        this.catalogRepository = catalogRepository;
    }

    /**
     * 매니저 재고 조정
     * PUT /api/update_inventory
     *
     * @param key       조정할 상품 구성
     * @param quantity  조정 수량 (0 이상)
     * @param direction 증가/감소
     * @throws CatalogItemNotFoundException 카탈로그 행이 없는 경우 (404)
     * @throws InvalidStockQuantityException 수량이 음수인 경우
     * @throws com.hhplus.furniture.domain.inventory.InsufficientStockException 감소량이 보유 재고보다 큰 경우
     */
    @DistributedLock(key = LockKeyGenerator.INVENTORY_KEY_TEMPLATE, waitTime = 5, leaseTime = 3)
    @Retryable(
            retryFor = ObjectOptimisticLockingFailureException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 50, multiplier = 2, maxDelay = 1000, random = true)
    )
    @Transactional
    public StockAdjustment adjust(VariantKey key, int quantity, StockDirection direction) {
        if (quantity < 0) {
            throw new InvalidStockQuantityException(quantity);
        }

        CatalogItem item = catalogRepository.findByKey(key)
                .orElseThrow(() -> new CatalogItemNotFoundException(key));

        if (direction == StockDirection.INCREASE) {
            item.increase(quantity);
        } else {
            item.decrease(quantity);
        }
        catalogRepository.save(item);

        log.info("[InventoryService] 재고 조정 완료: catalogItemId={}, direction={}, quantity={}, onHand={}",
                item.getId(), direction, quantity, item.getQuantity());
        return StockAdjustment.of(item, direction, quantity);
    }

    /**
     * 보유 재고가 amount 이상인지 확인한다. 행이 없거나 조회 실패 시 false.
     * 조회 예외를 여기서 처리하므로 트랜잭션을 열지 않는다.
     */
    public boolean available(VariantKey key, int amount) {
        try {
            return catalogRepository.findByKey(key)
                    .map(item -> item.hasStock(amount))
                    .orElseGet(() -> {
                        log.debug("[InventoryService] 재고 확인 대상 없음: variant={}", key);
                        return false;
                    });
        } catch (DataAccessException e) {
            log.warn("[InventoryService] 재고 확인 실패, 품절로 처리: variant={}", key, e);
            return false;
        }
    }

    @Override
    public boolean isAvailable(VariantKey key, int amount) {
        return available(key, amount);
    }

    /**
     * 결제 트랜잭션 안에서 재고를 차감한다. SELECT ... FOR UPDATE 후 재확인.
     *
     * @throws CatalogItemNotFoundException 행이 없는 경우
     * @throws com.hhplus.furniture.domain.inventory.InsufficientStockException 재고 부족
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public CatalogItem decreaseForCheckout(Long catalogItemId, int quantity) {
        CatalogItem item = catalogRepository.findByIdForUpdate(catalogItemId)
                .orElseThrow(() -> new CatalogItemNotFoundException(catalogItemId));
        item.decrease(quantity);
        CatalogItem saved = catalogRepository.save(item);

        log.info("[InventoryService] 주문 재고 차감: catalogItemId={}, quantity={}, onHand={}",
                catalogItemId, quantity, saved.getQuantity());
        return saved;
    }
}
