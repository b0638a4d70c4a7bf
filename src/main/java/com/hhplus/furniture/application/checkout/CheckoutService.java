package com.hhplus.furniture.application.checkout;

import com.hhplus.furniture.application.cart.CartService;
import com.hhplus.furniture.application.inventory.InventoryService;
import com.hhplus.furniture.common.exception.BizException;
import com.hhplus.furniture.domain.cart.CartLine;
import com.hhplus.furniture.domain.cart.ShoppingCart;
import com.hhplus.furniture.domain.coupon.Coupon;
import com.hhplus.furniture.domain.inventory.InsufficientStockException;
import com.hhplus.furniture.domain.order.Order;
import com.hhplus.furniture.domain.payment.InvalidPaymentException;
import com.hhplus.furniture.domain.payment.PaymentValidator;
import com.hhplus.furniture.domain.user.CreditDomainService;
import com.hhplus.furniture.domain.user.CreditDomainService.CreditPlan;
import com.hhplus.furniture.domain.user.User;
import com.hhplus.furniture.domain.user.UserNotFoundException;
import com.hhplus.furniture.domain.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * CheckoutService - 장바구니를 주문으로 전환하는 결제 흐름
 *
 * 순서:
 * 1. 빈 장바구니 거부
 * 2. 모든 줄의 재고 재확인 (하나라도 부족하면 전체 중단, 아무것도 변경하지 않음)
 * 3. 쿠폰 할인 적용
 * 4. 크레딧 적용 금액 계산 (변경 없음)
 * 5. 크레딧 적용 후 금액으로 결제 수단 검증 (잔액 변경 전)
 * 6. CheckoutTransactionService에서 크레딧 차감/재고 차감/주문 저장을 한 트랜잭션으로 처리
 * 7. 커밋 후 주문된 줄만 장바구니에서 제거
 *
 * 어떤 실패도 호출자에게 예외로 전달하지 않고 CheckoutResult.failure로 변환한다.
 */
@Service
public class CheckoutService {

    private static final Logger log = LoggerFactory.getLogger(CheckoutService.class);

    private final CartService cartService;
    private final InventoryService inventoryService;
    private final UserRepository userRepository;
    private final CreditDomainService creditDomainService;
    private final PaymentValidator paymentValidator;
    private final CheckoutTransactionService checkoutTransactionService;

    public CheckoutService(CartService cartService,
                           InventoryService inventoryService,
                           UserRepository userRepository,
                           CreditDomainService creditDomainService,
                           PaymentValidator paymentValidator,
                           CheckoutTransactionService checkoutTransactionService) {
        this.cartService = cartService;
        this.inventoryService = inventoryService;
        this.userRepository = userRepository;
        this.creditDomainService = creditDomainService;
        this.paymentValidator = paymentValidator;
        this.checkoutTransactionService = checkoutTransactionService;
    }

    public CheckoutResult checkout(Long userId, String couponCode, String cardNumber) {
        try {
            ShoppingCart cart = cartService.cartOf(userId);
            List<CartLine> lines = cart.lines();
            if (lines.isEmpty()) {
                return CheckoutResult.failure(CheckoutMessages.EMPTY_CART);
            }

            for (CartLine line : lines) {
                if (!line.getFurniture().checkAvailability(inventoryService, line.getQuantity())) {
                    log.info("[CheckoutService] 재고 부족으로 결제 중단: userId={}, variant={}, quantity={}",
                            userId, line.getFurniture().variantKey(), line.getQuantity());
                    return CheckoutResult.failure(CheckoutMessages.notEnoughStock(line.getFurniture().name()));
                }
            }

            Optional<Coupon> coupon = cartService.lookupCoupon(couponCode);
            BigDecimal total = coupon
                    .map(c -> cart.discountedTotal(c.getDiscountPercent()))
                    .orElseGet(cart::total);

            User buyer = userRepository.findById(userId)
                    .orElseThrow(() -> new UserNotFoundException(userId));
            CreditPlan plan = creditDomainService.plan(buyer.getCredit(), total);
            if (!paymentValidator.isValid(plan.getRemainingTotal(), cardNumber)) {
                log.info("[CheckoutService] 결제 수단 검증 실패: userId={}, amountDue={}", userId, plan.getRemainingTotal());
                return CheckoutResult.failure(CheckoutMessages.INVALID_PAYMENT);
            }

            Order order = checkoutTransactionService.placeOrder(new PlaceOrderCommand(
                    userId, lines, coupon.map(Coupon::getCouponId).orElse(null), total, cardNumber));
            cart.removeCheckedOut(lines);

            log.info("[CheckoutService] 결제 완료: userId={}, orderId={}, couponApplied={}, total={}",
                    userId, order.getOrderId(), coupon.isPresent(), order.getTotalPrice());
            return CheckoutResult.success(order);

        } catch (InsufficientStockException e) {
            log.info("[CheckoutService] 결제 중 재고 부족: userId={}, reason={}", userId, e.getMessage());
            return CheckoutResult.failure(CheckoutMessages.notEnoughStock(e.getItemName()));
        } catch (InvalidPaymentException e) {
            return CheckoutResult.failure(CheckoutMessages.INVALID_PAYMENT);
        } catch (BizException e) {
            log.warn("[CheckoutService] 결제 실패: userId={}, errorCode={}, reason={}",
                    userId, e.getErrorCodeValue(), e.getMessage());
            return CheckoutResult.failure(CheckoutMessages.failed(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("[CheckoutService] 결제 중 예기치 못한 오류: userId={}", userId, e);
            return CheckoutResult.failure(CheckoutMessages.failed(e.getMessage()));
        }
    }
}
