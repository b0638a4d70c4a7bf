package com.hhplus.furniture.presentation.cart;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hhplus.furniture.application.cart.CartService;
import com.hhplus.furniture.application.cart.dto.AddItemResult;
import com.hhplus.furniture.application.cart.dto.CartView;
import com.hhplus.furniture.application.catalog.dto.VariantCommand;
import com.hhplus.furniture.application.session.SessionPrincipal;
import com.hhplus.furniture.application.session.SessionService;
import com.hhplus.furniture.common.exception.ApplicationException;
import com.hhplus.furniture.common.exception.ErrorCode;
import com.hhplus.furniture.domain.cart.CartItemNotFoundException;
import com.hhplus.furniture.domain.catalog.FurnitureKind;
import com.hhplus.furniture.domain.catalog.VariantKey;
import com.hhplus.furniture.domain.user.Role;
import com.hhplus.furniture.presentation.cart.request.CartItemRequest;
import com.hhplus.furniture.presentation.catalog.request.FurnitureItemRequest;
import com.hhplus.furniture.presentation.common.GlobalExceptionHandler;
import com.hhplus.furniture.presentation.common.SessionHeaders;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * CartControllerTest - Presentation Layer Unit Test
 *
 * 테스트 대상: CartController
 * - GET /view_shoppingcart - 장바구니 조회 (쿠폰 적용 포함)
 * - PUT /add_item_to_cart - 담기 (재고 부족 시 400)
 * - DELETE /remove_item_from_cart - 제거
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CartController 단위 테스트")
class CartControllerTest {

    private static final String USER_TOKEN = "user-token";
    private static final Long TEST_USER_ID = 1001L;

    private MockMvc mockMvc;

    private ObjectMapper objectMapper;

    @Mock
    private SessionService sessionService;

    @Mock
    private CartService cartService;

    @InjectMocks
    private CartController cartController;

    @BeforeEach
    void setup() {
        this.mockMvc = MockMvcBuilders.standaloneSetup(cartController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
        this.objectMapper = new ObjectMapper();
    }

    private void givenUserSession() {
        when(sessionService.requireUser(USER_TOKEN))
                .thenReturn(new SessionPrincipal(TEST_USER_ID, "buyer@example.com", Role.USER));
    }

    private CartView cartWithTable(int quantity) {
        BigDecimal unitPrice = new BigDecimal("100.00");
        BigDecimal total = unitPrice.multiply(BigDecimal.valueOf(quantity));
        CartView.Line line = new CartView.Line(1L, "DINING_TABLE", "Brown Wood Dining Table",
                "brown", "wood", null, null, quantity, unitPrice, total);
        return CartView.builder()
                .userId(TEST_USER_ID)
                .lines(List.of(line))
                .totalQuantity(quantity)
                .totalPrice(total)
                .build();
    }

    private CartItemRequest chairRequest(Integer amount) {
        return CartItemRequest.builder()
                .objectType("GAMING_CHAIR")
                .item(FurnitureItemRequest.builder()
                        .color("black")
                        .chair(new FurnitureItemRequest.ChairSpec(true, true))
                        .build())
                .amount(amount)
                .build();
    }

    // ========== 장바구니 조회 ==========

    @Test
    @DisplayName("장바구니 조회 - 성공")
    void testViewCart_Success() throws Exception {
        // Given
        givenUserSession();
        when(cartService.view(TEST_USER_ID, null)).thenReturn(cartWithTable(2));

        // When & Then
        mockMvc.perform(get("/view_shoppingcart")
                        .header(SessionHeaders.SESSION_TOKEN, USER_TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].item_id").value(1))
                .andExpect(jsonPath("$.items[0].quantity").value(2))
                .andExpect(jsonPath("$.total_quantity").value(2))
                .andExpect(jsonPath("$.total_price").value(200.00))
                .andExpect(jsonPath("$.coupon_code").doesNotExist());
    }

    @Test
    @DisplayName("장바구니 조회 - 쿠폰 할인 적용")
    void testViewCart_WithCoupon() throws Exception {
        // Given
        givenUserSession();
        CartView base = cartWithTable(2);
        CartView discounted = CartView.builder()
                .userId(TEST_USER_ID)
                .lines(base.getLines())
                .totalQuantity(2)
                .totalPrice(base.getTotalPrice())
                .couponCode("SAVE10")
                .discountPercent(10)
                .discountedTotal(new BigDecimal("180.00"))
                .build();
        when(cartService.view(TEST_USER_ID, "SAVE10")).thenReturn(discounted);

        // When & Then
        mockMvc.perform(get("/view_shoppingcart")
                        .header(SessionHeaders.SESSION_TOKEN, USER_TOKEN)
                        .param("coupon_code", "SAVE10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.coupon_code").value("SAVE10"))
                .andExpect(jsonPath("$.discount_percent").value(10))
                .andExpect(jsonPath("$.discounted_total").value(180.00));
    }

    @Test
    @DisplayName("장바구니 조회 - 매니저 세션은 403")
    void testViewCart_ForbiddenForManager() throws Exception {
        // Given
        when(sessionService.requireUser("manager-token"))
                .thenThrow(new ApplicationException(ErrorCode.FORBIDDEN, "구매자 전용 기능입니다"));

        // When & Then
        mockMvc.perform(get("/view_shoppingcart")
                        .header(SessionHeaders.SESSION_TOKEN, "manager-token"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(cartService);
    }

    // ========== 담기 ==========

    @Test
    @DisplayName("장바구니 담기 - 성공")
    void testAddItem_Success() throws Exception {
        // Given
        givenUserSession();
        when(cartService.addItem(eq(TEST_USER_ID), any(VariantCommand.class), eq(3)))
                .thenReturn(new AddItemResult(true, "Black Gaming Chair", cartWithTable(1)));

        // When & Then
        mockMvc.perform(put("/add_item_to_cart")
                        .header(SessionHeaders.SESSION_TOKEN, USER_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(chairRequest(3))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.added").value(true))
                .andExpect(jsonPath("$.message").value("Black Gaming Chair was added to the cart"));

        verify(cartService).addItem(eq(TEST_USER_ID), argThat(command ->
                command.getKind() == FurnitureKind.GAMING_CHAIR
                        && Boolean.TRUE.equals(command.getAdjustable())
                        && Boolean.TRUE.equals(command.getArmrest())), eq(3));
    }

    @Test
    @DisplayName("장바구니 담기 - amount 생략 시 1개")
    void testAddItem_DefaultAmount() throws Exception {
        // Given
        givenUserSession();
        when(cartService.addItem(eq(TEST_USER_ID), any(VariantCommand.class), eq(1)))
                .thenReturn(new AddItemResult(true, "Black Gaming Chair", cartWithTable(1)));

        // When & Then
        mockMvc.perform(put("/add_item_to_cart")
                        .header(SessionHeaders.SESSION_TOKEN, USER_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(chairRequest(null))))
                .andExpect(status().isOk());
    }

    @Test
    @DisplayName("장바구니 담기 - 재고 부족 시 400과 기존 장바구니")
    void testAddItem_NotEnoughStock() throws Exception {
        // Given
        givenUserSession();
        when(cartService.addItem(eq(TEST_USER_ID), any(VariantCommand.class), eq(50)))
                .thenReturn(new AddItemResult(false, "Black Gaming Chair", cartWithTable(1)));

        // When & Then
        mockMvc.perform(put("/add_item_to_cart")
                        .header(SessionHeaders.SESSION_TOKEN, USER_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(chairRequest(50))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.added").value(false))
                .andExpect(jsonPath("$.message").value("There is not enough stock for Black Gaming Chair"))
                .andExpect(jsonPath("$.cart.total_quantity").value(1));
    }

    @Test
    @DisplayName("장바구니 담기 - item 누락 시 400")
    void testAddItem_MissingItem() throws Exception {
        // Given
        givenUserSession();

        // When & Then
        mockMvc.perform(put("/add_item_to_cart")
                        .header(SessionHeaders.SESSION_TOKEN, USER_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"object_type\":\"GAMING_CHAIR\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("APP_INVALID_INPUT"));

        verifyNoInteractions(cartService);
    }

    // ========== 제거 ==========

    @Test
    @DisplayName("장바구니 제거 - 성공")
    void testRemoveItem_Success() throws Exception {
        // Given
        givenUserSession();
        CartView empty = CartView.builder()
                .userId(TEST_USER_ID)
                .lines(List.of())
                .totalQuantity(0)
                .totalPrice(new BigDecimal("0.00"))
                .build();
        when(cartService.removeItem(eq(TEST_USER_ID), any(VariantCommand.class))).thenReturn(empty);

        // When & Then
        mockMvc.perform(delete("/remove_item_from_cart")
                        .header(SessionHeaders.SESSION_TOKEN, USER_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(chairRequest(null))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items").isEmpty())
                .andExpect(jsonPath("$.total_quantity").value(0));
    }

    @Test
    @DisplayName("장바구니 제거 - 담기지 않은 상품은 404")
    void testRemoveItem_NotInCart() throws Exception {
        // Given
        givenUserSession();
        when(cartService.removeItem(eq(TEST_USER_ID), any(VariantCommand.class)))
                .thenThrow(new CartItemNotFoundException(VariantKey.chair(FurnitureKind.GAMING_CHAIR, "black", true, true)));

        // When & Then
        mockMvc.perform(delete("/remove_item_from_cart")
                        .header(SessionHeaders.SESSION_TOKEN, USER_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(chairRequest(null))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_CART_ITEM_NOT_FOUND"));
    }
}
