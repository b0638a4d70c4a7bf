package com.hhplus.furniture.presentation.inventory;

import com.hhplus.furniture.application.catalog.CatalogService;
import com.hhplus.furniture.application.inventory.InventoryService;
import com.hhplus.furniture.application.inventory.dto.StockAdjustment;
import com.hhplus.furniture.application.session.SessionService;
import com.hhplus.furniture.common.exception.ApplicationException;
import com.hhplus.furniture.common.exception.ErrorCode;
import com.hhplus.furniture.domain.catalog.VariantKey;
import com.hhplus.furniture.domain.inventory.StockDirection;
import com.hhplus.furniture.presentation.common.SessionHeaders;
import com.hhplus.furniture.presentation.inventory.request.UpdateInventoryRequest;
import com.hhplus.furniture.presentation.inventory.response.StockAdjustmentResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * InventoryController - 재고 조정 API (매니저 전용)
 */
@RestController
public class InventoryController {

    private final SessionService sessionService;
    private final CatalogService catalogService;
    private final InventoryService inventoryService;

    public InventoryController(SessionService sessionService, CatalogService catalogService,
                               InventoryService inventoryService) {
        this.sessionService = sessionService;
        this.catalogService = catalogService;
        this.inventoryService = inventoryService;
    }

    /**
     * PUT /update_inventory
     */
    @PutMapping("/update_inventory")
    public ResponseEntity<StockAdjustmentResponse> updateInventory(
            @RequestHeader(SessionHeaders.SESSION_TOKEN) String token,
            @RequestBody UpdateInventoryRequest request) {
        sessionService.requireManager(token);
        if (request.getQuantity() == null || request.getItem() == null) {
            throw new ApplicationException(ErrorCode.INVALID_INPUT, "quantity와 item은 필수입니다");
        }

        VariantKey key = catalogService.keyOf(request.getItem().toCommand(request.getObjectType()));
        StockAdjustment adjustment = inventoryService.adjust(
                key, request.getQuantity(), StockDirection.fromSign(request.getSign()));
        return ResponseEntity.ok(StockAdjustmentResponse.from(adjustment));
    }
}
