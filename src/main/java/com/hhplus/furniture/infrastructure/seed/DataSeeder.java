package com.hhplus.furniture.infrastructure.seed;

import com.hhplus.furniture.application.catalog.CatalogService;
import com.hhplus.furniture.application.coupon.CouponService;
import com.hhplus.furniture.application.user.AccountService;
import com.hhplus.furniture.domain.catalog.CatalogRepository;
import com.hhplus.furniture.domain.catalog.FurnitureKind;
import com.hhplus.furniture.domain.catalog.VariantKey;
import com.hhplus.furniture.domain.coupon.CouponRepository;
import com.hhplus.furniture.domain.user.ManagerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * 초기 데이터 적재 (테이블이 비어 있을 때만)
 *
 * - 카탈로그/재고 행
 * - 쿠폰 코드
 * - 최초 매니저 계정
 */
@Component
@ConditionalOnProperty(name = "furniture.seed.enabled", havingValue = "true")
public class DataSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    private final CatalogRepository catalogRepository;
    private final CouponRepository couponRepository;
    private final ManagerRepository managerRepository;
    private final CatalogService catalogService;
    private final CouponService couponService;
    private final AccountService accountService;

    private final String managerName;
    private final String managerEmail;
    private final String managerPassword;

    public DataSeeder(CatalogRepository catalogRepository,
                      CouponRepository couponRepository,
                      ManagerRepository managerRepository,
                      CatalogService catalogService,
                      CouponService couponService,
                      AccountService accountService,
                      @Value("${furniture.seed.manager-name}") String managerName,
                      @Value("${furniture.seed.manager-email}") String managerEmail,
                      @Value("${furniture.seed.manager-password}") String managerPassword) {
        this.catalogRepository = catalogRepository;
        this.couponRepository = couponRepository;
        this.managerRepository = managerRepository;
        this.catalogService = catalogService;
        this.couponService = couponService;
        this.accountService = accountService;
        this.managerName = managerName;
        this.managerEmail = managerEmail;
        this.managerPassword = managerPassword;
    }

    @Override
    public void run(ApplicationArguments args) {
        seedCatalog();
        seedCoupons();
        seedManager();
    }

    private void seedCatalog() {
        if (catalogRepository.count() > 0) {
            return;
        }
        table(FurnitureKind.DINING_TABLE, "brown", "wood", "120.00", 0);
        table(FurnitureKind.DINING_TABLE, "brown", "metal", "99.99", 10);
        table(FurnitureKind.DINING_TABLE, "gray", "wood", "120.00", 5);
        table(FurnitureKind.DINING_TABLE, "gray", "metal", "99.99", 0);

        table(FurnitureKind.WORK_DESK, "black", "wood", "150.00", 8);
        table(FurnitureKind.WORK_DESK, "white", "glass", "180.00", 4);
        table(FurnitureKind.COFFEE_TABLE, "gray", "glass", "85.50", 6);
        table(FurnitureKind.COFFEE_TABLE, "red", "plastic", "45.00", 12);

        chair(FurnitureKind.GAMING_CHAIR, "black", true, true, "250.00", 7);
        chair(FurnitureKind.GAMING_CHAIR, "blue", true, false, "210.00", 3);
        chair(FurnitureKind.WORK_CHAIR, "red", false, true, "95.00", 9);
        chair(FurnitureKind.WORK_CHAIR, "white", true, true, "130.00", 2);

        log.info("[DataSeeder] 카탈로그 초기 데이터 적재: rows={}", catalogRepository.count());
    }

    private void table(FurnitureKind kind, String color, String material, String price, int quantity) {
        String name = color + " " + kind.getDisplayName().toLowerCase();
        catalogService.register(VariantKey.table(kind, color, material), name,
                "A high quality " + kind.getDisplayName().toLowerCase() + " in " + color + ".",
                new BigDecimal(price), quantity);
    }

    private void chair(FurnitureKind kind, String color, boolean adjustable, boolean armrest,
                       String price, int quantity) {
        String name = color + " " + kind.getDisplayName().toLowerCase();
        catalogService.register(VariantKey.chair(kind, color, adjustable, armrest), name,
                "A comfortable " + kind.getDisplayName().toLowerCase() + " in " + color + ".",
                new BigDecimal(price), quantity);
    }

    private void seedCoupons() {
        if (couponRepository.count() > 0) {
            return;
        }
        couponService.register("SAVE10", 10);
        couponService.register("DISCOUNT20", 20);
        couponService.register("PROMO30", 30);
        couponService.register("COUPON40", 40);
        couponService.register("OFFER50", 50);
        log.info("[DataSeeder] 쿠폰 초기 데이터 적재: count={}", couponRepository.count());
    }

    private void seedManager() {
        if (managerRepository.count() > 0) {
            return;
        }
        accountService.registerManager(managerName, managerEmail, managerPassword);
        log.info("[DataSeeder] 최초 매니저 등록: email={}", managerEmail);
    }
}
