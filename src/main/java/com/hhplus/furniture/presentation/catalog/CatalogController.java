package com.hhplus.furniture.presentation.catalog;

import com.hhplus.furniture.application.catalog.CatalogService;
import com.hhplus.furniture.application.catalog.dto.CatalogItemInfo;
import com.hhplus.furniture.domain.catalog.Furniture;
import com.hhplus.furniture.domain.catalog.FurnitureKind;
import com.hhplus.furniture.presentation.catalog.response.CatalogItemResponse;
import com.hhplus.furniture.presentation.catalog.response.MatchingOfferResponse;
import com.hhplus.furniture.presentation.catalog.response.PriceRangeResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * CatalogController - 카탈로그 조회 API (로그인 불필요)
 */
@RestController
public class CatalogController {

    private final CatalogService catalogService;

    public CatalogController(CatalogService catalogService) {
        this.catalogService = catalogService;
    }

    /**
     * GET /get_furniture_info_by_price_range?min_price=100&max_price=200
     */
    @GetMapping("/get_furniture_info_by_price_range")
    public ResponseEntity<PriceRangeResponse> getByPriceRange(
            @RequestParam("min_price") BigDecimal minPrice,
            @RequestParam("max_price") BigDecimal maxPrice) {
        List<CatalogItemInfo> items = catalogService.findByPriceRange(minPrice, maxPrice);
        if (items.isEmpty()) {
            return ResponseEntity.ok(new PriceRangeResponse(PriceRangeResponse.EMPTY_MESSAGE, List.of()));
        }
        List<CatalogItemResponse> body = items.stream()
                .map(CatalogItemResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(new PriceRangeResponse(null, body));
    }

    /**
     * GET /get_matching_offer?object_type=DINING_TABLE&color=brown&material=wood
     */
    @GetMapping("/get_matching_offer")
    public ResponseEntity<MatchingOfferResponse> getMatchingOffer(
            @RequestParam("object_type") String objectType,
            @RequestParam("color") String color,
            @RequestParam(value = "material", required = false) String material,
            @RequestParam(value = "is_adjustable", required = false) Boolean adjustable,
            @RequestParam(value = "has_armrest", required = false) Boolean armrest) {
        Furniture furniture = catalogService.variantOf(FurnitureKind.from(objectType), color, material, adjustable, armrest);
        return ResponseEntity.ok(MatchingOfferResponse.from(catalogService.matchingOffer(furniture)));
    }
}
