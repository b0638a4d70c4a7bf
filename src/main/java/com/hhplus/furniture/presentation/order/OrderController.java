package com.hhplus.furniture.presentation.order;

import com.hhplus.furniture.application.checkout.CheckoutResult;
import com.hhplus.furniture.application.checkout.CheckoutService;
import com.hhplus.furniture.application.order.OrderService;
import com.hhplus.furniture.application.session.SessionPrincipal;
import com.hhplus.furniture.application.session.SessionService;
import com.hhplus.furniture.common.exception.ApplicationException;
import com.hhplus.furniture.common.exception.ErrorCode;
import com.hhplus.furniture.presentation.common.SessionHeaders;
import com.hhplus.furniture.presentation.order.request.CheckoutRequest;
import com.hhplus.furniture.presentation.order.request.UpdateOrderStatusRequest;
import com.hhplus.furniture.presentation.order.response.CheckoutResponse;
import com.hhplus.furniture.presentation.order.response.OrderResponse;
import com.hhplus.furniture.presentation.order.response.OrderStatusResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * OrderController - 결제 및 주문 API
 *
 * 결제 실패는 예외가 아닌 CheckoutResult로 전달되며 400 + message로 응답한다.
 */
@RestController
public class OrderController {

    private final SessionService sessionService;
    private final CheckoutService checkoutService;
    private final OrderService orderService;

    public OrderController(SessionService sessionService, CheckoutService checkoutService,
                           OrderService orderService) {
        this.sessionService = sessionService;
        this.checkoutService = checkoutService;
        this.orderService = orderService;
    }

    /**
     * POST /checkout
     */
    @PostMapping("/checkout")
    public ResponseEntity<CheckoutResponse> checkout(
            @RequestHeader(SessionHeaders.SESSION_TOKEN) String token,
            @RequestBody CheckoutRequest request) {
        SessionPrincipal principal = sessionService.requireUser(token);
        CheckoutResult result = checkoutService.checkout(
                principal.getAccountId(), request.getCouponCode(), request.getCreditCardNum());

        if (!result.isSuccess()) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(CheckoutResponse.from(result));
        }
        return ResponseEntity.ok(CheckoutResponse.from(result));
    }

    /**
     * PUT /update_order_status (매니저)
     */
    @PutMapping("/update_order_status")
    public ResponseEntity<OrderStatusResponse> updateOrderStatus(
            @RequestHeader(SessionHeaders.SESSION_TOKEN) String token,
            @RequestBody UpdateOrderStatusRequest request) {
        sessionService.requireManager(token);
        if (request.getOrderId() == null) {
            throw new ApplicationException(ErrorCode.INVALID_INPUT, "order_id는 필수입니다");
        }
        return ResponseEntity.ok(OrderStatusResponse.from(orderService.advanceStatus(request.getOrderId())));
    }

    /**
     * GET /get_all_orders_by_manager (매니저)
     */
    @GetMapping("/get_all_orders_by_manager")
    public ResponseEntity<List<OrderResponse>> getAllOrders(
            @RequestHeader(SessionHeaders.SESSION_TOKEN) String token) {
        sessionService.requireManager(token);
        return ResponseEntity.ok(orderService.findAll().stream()
                .map(OrderResponse::from)
                .collect(Collectors.toList()));
    }

    /**
     * GET /get_user's_orders_history (구매자 본인)
     */
    @GetMapping("/get_user's_orders_history")
    public ResponseEntity<List<OrderResponse>> getOrderHistory(
            @RequestHeader(SessionHeaders.SESSION_TOKEN) String token) {
        SessionPrincipal principal = sessionService.requireUser(token);
        return ResponseEntity.ok(orderService.history(principal.getAccountId()).stream()
                .map(OrderResponse::from)
                .collect(Collectors.toList()));
    }
}
