package com.hhplus.furniture.application.checkout;

import com.hhplus.furniture.application.inventory.InventoryService;
import com.hhplus.furniture.domain.cart.CartLine;
import com.hhplus.furniture.domain.catalog.CatalogItem;
import com.hhplus.furniture.domain.catalog.Furniture;
import com.hhplus.furniture.domain.catalog.UnpricedVariantException;
import com.hhplus.furniture.domain.order.Order;
import com.hhplus.furniture.domain.order.OrderItem;
import com.hhplus.furniture.domain.order.OrderRepository;
import com.hhplus.furniture.domain.order.event.OrderPlacedEvent;
import com.hhplus.furniture.domain.payment.InvalidPaymentException;
import com.hhplus.furniture.domain.payment.PaymentValidator;
import com.hhplus.furniture.domain.user.CreditDomainService;
import com.hhplus.furniture.domain.user.CreditDomainService.CreditPlan;
import com.hhplus.furniture.domain.user.User;
import com.hhplus.furniture.domain.user.UserNotFoundException;
import com.hhplus.furniture.domain.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * CheckoutTransactionService - 결제 단일 트랜잭션
 *
 * 하나의 트랜잭션 안에서:
 * 1. 구매자 행 잠금 (SELECT ... FOR UPDATE) 후 크레딧 재계산
 * 2. 잠금 상태의 크레딧 기준으로 결제 수단 재검증
 * 3. 크레딧 차감
 * 4. 카탈로그 행을 ID 순서로 잠그고 재고 차감 (교착 상태 방지)
 * 5. 주문 저장 및 OrderPlacedEvent 발행 (커밋 후 전달)
 *
 * 어느 단계든 실패하면 전체가 롤백된다.
 */
@Service
public class CheckoutTransactionService {

    private static final Logger log = LoggerFactory.getLogger(CheckoutTransactionService.class);

    private final UserRepository userRepository;
    private final OrderRepository orderRepository;
    private final InventoryService inventoryService;
    private final CreditDomainService creditDomainService;
    private final PaymentValidator paymentValidator;
    private final ApplicationEventPublisher eventPublisher;

    public CheckoutTransactionService(UserRepository userRepository,
                                      OrderRepository orderRepository,
                                      InventoryService inventoryService,
                                      CreditDomainService creditDomainService,
                                      PaymentValidator paymentValidator,
                                      ApplicationEventPublisher eventPublisher) {
        this.userRepository = userRepository;
        this.orderRepository = orderRepository;
        this.inventoryService = inventoryService;
        this.creditDomainService = creditDomainService;
        this.paymentValidator = paymentValidator;
        this.eventPublisher = eventPublisher;
    }

    @Transactional(rollbackFor = Exception.class)
    public Order placeOrder(PlaceOrderCommand command) {
        User buyer = userRepository.findByIdForUpdate(command.getUserId())
                .orElseThrow(() -> new UserNotFoundException(command.getUserId()));

        CreditPlan plan = creditDomainService.plan(buyer.getCredit(), command.getTotalBeforeCredit());
        if (!paymentValidator.isValid(plan.getRemainingTotal(), command.getCardNumber())) {
            throw new InvalidPaymentException();
        }

        if (plan.getCreditUsed().signum() > 0) {
            buyer.useCredit(plan.getCreditUsed());
            userRepository.save(buyer);
        }

        List<OrderItem> orderItems = new ArrayList<>();
        for (CartLine line : sortedByCatalogItemId(command.getLines())) {
            Furniture furniture = line.getFurniture();
            Long catalogItemId = furniture.catalogItemId()
                    .orElseThrow(() -> new UnpricedVariantException(furniture.variantKey()));

            CatalogItem item = inventoryService.decreaseForCheckout(catalogItemId, line.getQuantity());
            orderItems.add(OrderItem.createOrderItem(catalogItemId, item.getName(), line.getQuantity(), furniture.price()));
        }

        Order order = orderRepository.save(Order.createOrder(
                buyer.getUserId(), buyer.getEmail(), command.getCouponId(),
                plan.getCreditUsed(), plan.getRemainingTotal(), orderItems));

        log.info("[CheckoutTransactionService] 주문 저장: orderId={}, userId={}, creditUsed={}, total={}",
                order.getOrderId(), buyer.getUserId(), plan.getCreditUsed(), plan.getRemainingTotal());

        eventPublisher.publishEvent(new OrderPlacedEvent(order.getOrderId(), buyer.getUserId(),
                buyer.getEmail(), order.getTotalPrice(), order.getTotalQuantity()));
        return order;
    }

    private List<CartLine> sortedByCatalogItemId(List<CartLine> lines) {
        List<CartLine> sorted = new ArrayList<>(lines);
        sorted.sort(Comparator.comparing(line -> line.getFurniture().catalogItemId().orElse(Long.MAX_VALUE)));
        return sorted;
    }
}
