package com.hhplus.furniture.presentation.catalog;

import com.hhplus.furniture.application.catalog.CatalogService;
import com.hhplus.furniture.application.catalog.dto.CatalogItemInfo;
import com.hhplus.furniture.application.catalog.dto.MatchingOffer;
import com.hhplus.furniture.domain.catalog.Furniture;
import com.hhplus.furniture.domain.catalog.FurnitureKind;
import com.hhplus.furniture.domain.catalog.InvalidPriceRangeException;
import com.hhplus.furniture.presentation.common.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * CatalogControllerTest - Presentation Layer Unit Test
 *
 * 테스트 대상: CatalogController
 * - GET /get_furniture_info_by_price_range - 가격 범위 조회
 * - GET /get_matching_offer - 어울리는 상품 추천
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CatalogController 단위 테스트")
class CatalogControllerTest {

    private MockMvc mockMvc;

    @Mock
    private CatalogService catalogService;

    @InjectMocks
    private CatalogController catalogController;

    @BeforeEach
    void setup() {
        this.mockMvc = MockMvcBuilders.standaloneSetup(catalogController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    // ========== 가격 범위 조회 ==========

    @Test
    @DisplayName("가격 범위 조회 - 성공")
    void testGetByPriceRange_Success() throws Exception {
        // Given
        CatalogItemInfo table = CatalogItemInfo.builder()
                .catalogItemId(1L)
                .kind("DINING_TABLE")
                .name("Brown Wood Dining Table")
                .description("Solid wood")
                .color("brown")
                .material("wood")
                .price(new BigDecimal("120.00"))
                .dimensions("100x50x60")
                .build();
        when(catalogService.findByPriceRange(new BigDecimal("100"), new BigDecimal("200")))
                .thenReturn(List.of(table));

        // When & Then
        mockMvc.perform(get("/get_furniture_info_by_price_range")
                        .param("min_price", "100")
                        .param("max_price", "200"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(1))
                .andExpect(jsonPath("$.items[0].id").value(1))
                .andExpect(jsonPath("$.items[0].furniture_type").value("DINING_TABLE"))
                .andExpect(jsonPath("$.items[0].material").value("wood"))
                .andExpect(jsonPath("$.items[0].is_adjustable").doesNotExist())
                .andExpect(jsonPath("$.items[0].price").value(120.00));
    }

    @Test
    @DisplayName("가격 범위 조회 - 결과 없음 안내 메시지")
    void testGetByPriceRange_Empty() throws Exception {
        // Given
        when(catalogService.findByPriceRange(any(), any())).thenReturn(List.of());

        // When & Then
        mockMvc.perform(get("/get_furniture_info_by_price_range")
                        .param("min_price", "5000")
                        .param("max_price", "6000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("There are no furnitures in this price range"))
                .andExpect(jsonPath("$.items").isEmpty());
    }

    @Test
    @DisplayName("가격 범위 조회 - 최소가가 최대가보다 크면 400")
    void testGetByPriceRange_InvalidRange() throws Exception {
        // Given
        when(catalogService.findByPriceRange(any(), any()))
                .thenThrow(new InvalidPriceRangeException("min=300, max=100"));

        // When & Then
        mockMvc.perform(get("/get_furniture_info_by_price_range")
                        .param("min_price", "300")
                        .param("max_price", "100"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_CATALOG_INVALID_PRICE_RANGE"));
    }

    @Test
    @DisplayName("가격 범위 조회 - 파라미터 누락 시 400")
    void testGetByPriceRange_MissingParam() throws Exception {
        mockMvc.perform(get("/get_furniture_info_by_price_range")
                        .param("min_price", "100"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("APP_INVALID_INPUT"));

        verifyNoInteractions(catalogService);
    }

    // ========== 추천 조회 ==========

    @Test
    @DisplayName("추천 조회 - 재고 있는 의자 추천")
    void testGetMatchingOffer_Matched() throws Exception {
        // Given
        Furniture table = mock(Furniture.class);
        when(catalogService.variantOf(FurnitureKind.DINING_TABLE, "brown", "wood", null, null)).thenReturn(table);
        when(catalogService.matchingOffer(table)).thenReturn(new MatchingOffer(true, 7L, "*** SPECIAL OFFER !!! ***"));

        // When & Then
        mockMvc.perform(get("/get_matching_offer")
                        .param("object_type", "Dining Table")
                        .param("color", "brown")
                        .param("material", "wood"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.matched").value(true))
                .andExpect(jsonPath("$.matching_item_id").value(7))
                .andExpect(jsonPath("$.message").value("*** SPECIAL OFFER !!! ***"));
    }

    @Test
    @DisplayName("추천 조회 - 추천 없음")
    void testGetMatchingOffer_None() throws Exception {
        // Given
        Furniture chair = mock(Furniture.class);
        when(catalogService.variantOf(FurnitureKind.GAMING_CHAIR, "blue", null, true, false)).thenReturn(chair);
        when(catalogService.matchingOffer(chair)).thenReturn(MatchingOffer.none());

        // When & Then
        mockMvc.perform(get("/get_matching_offer")
                        .param("object_type", "5")
                        .param("color", "blue")
                        .param("is_adjustable", "true")
                        .param("has_armrest", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.matched").value(false))
                .andExpect(jsonPath("$.message").value(MatchingOffer.UNIQUE_ITEM_MESSAGE));
    }

    @Test
    @DisplayName("추천 조회 - 알 수 없는 가구 종류는 400")
    void testGetMatchingOffer_UnknownKind() throws Exception {
        mockMvc.perform(get("/get_matching_offer")
                        .param("object_type", "Sofa")
                        .param("color", "brown"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_CATALOG_INVALID_ATTRIBUTE"));

        verifyNoInteractions(catalogService);
    }
}
