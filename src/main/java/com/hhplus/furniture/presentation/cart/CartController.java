package com.hhplus.furniture.presentation.cart;

import com.hhplus.furniture.application.cart.CartService;
import com.hhplus.furniture.application.cart.dto.AddItemResult;
import com.hhplus.furniture.application.cart.dto.CartView;
import com.hhplus.furniture.application.catalog.dto.VariantCommand;
import com.hhplus.furniture.application.checkout.CheckoutMessages;
import com.hhplus.furniture.application.session.SessionPrincipal;
import com.hhplus.furniture.application.session.SessionService;
import com.hhplus.furniture.common.exception.ApplicationException;
import com.hhplus.furniture.common.exception.ErrorCode;
import com.hhplus.furniture.presentation.cart.request.CartItemRequest;
import com.hhplus.furniture.presentation.cart.response.AddCartItemResponse;
import com.hhplus.furniture.presentation.cart.response.CartResponse;
import com.hhplus.furniture.presentation.common.SessionHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * CartController - 장바구니 API (구매자 전용)
 */
@RestController
public class CartController {

    private final SessionService sessionService;
    private final CartService cartService;

    public CartController(SessionService sessionService, CartService cartService) {
        this.sessionService = sessionService;
        this.cartService = cartService;
    }

    /**
     * GET /view_shoppingcart?coupon_code=SAVE10
     */
    @GetMapping("/view_shoppingcart")
    public ResponseEntity<CartResponse> viewCart(
            @RequestHeader(SessionHeaders.SESSION_TOKEN) String token,
            @RequestParam(value = "coupon_code", required = false) String couponCode) {
        SessionPrincipal principal = sessionService.requireUser(token);
        CartView view = cartService.view(principal.getAccountId(), couponCode);
        return ResponseEntity.ok(CartResponse.from(view));
    }

    /**
     * PUT /add_item_to_cart
     * 이미 담긴 상품이면 수량을 교체한다. 재고가 부족하면 400.
     */
    @PutMapping("/add_item_to_cart")
    public ResponseEntity<AddCartItemResponse> addItem(
            @RequestHeader(SessionHeaders.SESSION_TOKEN) String token,
            @RequestBody CartItemRequest request) {
        SessionPrincipal principal = sessionService.requireUser(token);
        int amount = request.getAmount() == null ? 1 : request.getAmount();

        AddItemResult result = cartService.addItem(principal.getAccountId(), toCommand(request), amount);
        CartResponse cart = CartResponse.from(result.getCart());
        if (!result.isAdded()) {
            String message = String.format(CheckoutMessages.NOT_ENOUGH_STOCK, result.getItemName());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new AddCartItemResponse(false, message, cart));
        }
        return ResponseEntity.ok(new AddCartItemResponse(true, result.getItemName() + " was added to the cart", cart));
    }

    /**
     * DELETE /remove_item_from_cart
     */
    @DeleteMapping("/remove_item_from_cart")
    public ResponseEntity<CartResponse> removeItem(
            @RequestHeader(SessionHeaders.SESSION_TOKEN) String token,
            @RequestBody CartItemRequest request) {
        SessionPrincipal principal = sessionService.requireUser(token);
        CartView view = cartService.removeItem(principal.getAccountId(), toCommand(request));
        return ResponseEntity.ok(CartResponse.from(view));
    }

    private VariantCommand toCommand(CartItemRequest request) {
        if (request.getItem() == null) {
            throw new ApplicationException(ErrorCode.INVALID_INPUT, "item은 필수입니다");
        }
        return request.getItem().toCommand(request.getObjectType());
    }
}
