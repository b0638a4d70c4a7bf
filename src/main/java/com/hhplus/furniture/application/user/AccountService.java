package com.hhplus.furniture.application.user;

import com.hhplus.furniture.application.cart.CartService;
import com.hhplus.furniture.application.user.dto.RegisterUserCommand;
import com.hhplus.furniture.application.user.dto.TaxQuote;
import com.hhplus.furniture.application.user.dto.UserInfo;
import com.hhplus.furniture.common.exception.ApplicationException;
import com.hhplus.furniture.common.exception.ErrorCode;
import com.hhplus.furniture.common.exception.SystemException;
import com.hhplus.furniture.domain.cart.ShoppingCart;
import com.hhplus.furniture.domain.catalog.PricePolicy;
import com.hhplus.furniture.domain.user.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * AccountService - 사용자/매니저 계정 관리
 *
 * 역할:
 * - 회원 가입 (구매자, 매니저가 등록하는 보조 매니저)
 * - 인증 (이메일 없음/비밀번호 불일치를 구분하지 않음)
 * - 프로필/비밀번호 변경, 크레딧 충전, 사용자 삭제 (매니저)
 *
 * 저장소 오류는 롤백 후 SystemException으로 감싸서 다시 던진다.
 */
@Service
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private final UserRepository userRepository;
    private final ManagerRepository managerRepository;
    private final PasswordHasher passwordHasher;
    private final UserCreditService userCreditService;
    private final CartService cartService;

    public AccountService(UserRepository userRepository,
                          ManagerRepository managerRepository,
                          PasswordHasher passwordHasher,
                          UserCreditService userCreditService,
                          CartService cartService) {
        this.userRepository = userRepository;
        this.managerRepository = managerRepository;
        this.passwordHasher = passwordHasher;
        this.userCreditService = userCreditService;
        this.cartService = cartService;
    }

    /**
     * 구매자 회원 가입
     * POST /api/user_register
     *
     * @throws InvalidAccountFieldException 입력값 검증 실패
     * @throws DuplicateEmailException 이미 사용 중인 이메일 (사용자/매니저 공통)
     */
    @Transactional
    public UserInfo registerUser(RegisterUserCommand command) {
        AccountPolicy.validatePassword(command.getPassword());
        String email = AccountPolicy.normalizeEmail(command.getEmail());
        ensureEmailAvailable(email);

        User user = User.createUser(command.getName(), email, passwordHasher.hash(command.getPassword()),
                command.getAddress(), command.getCredit());
        User saved = persist(() -> userRepository.save(user), email);

        log.info("[AccountService] 사용자 가입: userId={}, email={}", saved.getUserId(), saved.getEmail());
        return UserInfo.from(saved);
    }

    /**
     * 매니저 등록 (기존 매니저만 호출 가능)
     * POST /api/secondary_manager_register
     */
    @Transactional
    public Manager registerManager(String name, String email, String password) {
        AccountPolicy.validatePassword(password);
        String normalized = AccountPolicy.normalizeEmail(email);
        ensureEmailAvailable(normalized);

        Manager manager = Manager.createManager(name, normalized, passwordHasher.hash(password));
        Manager saved = persist(() -> managerRepository.save(manager), normalized);

        log.info("[AccountService] 매니저 등록: managerId={}, email={}", saved.getManagerId(), saved.getEmail());
        return saved;
    }

    /**
     * 이메일/비밀번호 확인. 실패 사유는 구분하지 않고 빈 값을 반환한다.
     */
    @Transactional(readOnly = true)
    public Optional<Account> authenticate(String email, String password) {
        if (email == null || password == null) {
            return Optional.empty();
        }
        String normalized = email.trim().toLowerCase(Locale.ROOT);

        Optional<Account> account = userRepository.findByEmail(normalized)
                .map(user -> (Account) user)
                .or(() -> managerRepository.findByEmail(normalized).map(manager -> (Account) manager));

        Optional<Account> authenticated = account
                .filter(found -> passwordHasher.matches(password, found.getPasswordHash()));
        if (authenticated.isEmpty()) {
            log.info("[AccountService] 인증 실패");
        }
        return authenticated;
    }

    @Transactional(readOnly = true)
    public UserInfo userInfo(Long userId) {
        return UserInfo.from(findUser(userId));
    }

    @Transactional(readOnly = true)
    public Manager managerInfo(Long managerId) {
        return managerRepository.findById(managerId)
                .orElseThrow(() -> new ManagerNotFoundException(managerId));
    }

    /**
     * 이름/주소 변경. null 필드는 유지한다.
     */
    @Transactional
    public UserInfo updateProfile(Long userId, String name, String address) {
        User user = findUser(userId);
        user.updateProfile(name, address);
        User saved = persist(() -> userRepository.save(user), user.getEmail());

        log.info("[AccountService] 프로필 변경: userId={}", userId);
        return UserInfo.from(saved);
    }

    /**
     * 현재 비밀번호 확인 후 변경 (구매자/매니저 공통)
     *
     * @throws ApplicationException 현재 비밀번호가 틀린 경우 (401)
     */
    @Transactional
    public void changePassword(Long accountId, Role role, String currentPassword, String newPassword) {
        AccountPolicy.validatePassword(newPassword);

        if (role == Role.MANAGER) {
            Manager manager = managerRepository.findById(accountId)
                    .orElseThrow(() -> new ManagerNotFoundException(accountId));
            verifyPassword(currentPassword, manager.getPasswordHash());
            manager.changePassword(passwordHasher.hash(newPassword));
            persist(() -> managerRepository.save(manager), manager.getEmail());
        } else {
            User user = findUser(accountId);
            verifyPassword(currentPassword, user.getPasswordHash());
            user.changePassword(passwordHasher.hash(newPassword));
            persist(() -> userRepository.save(user), user.getEmail());
        }
        log.info("[AccountService] 비밀번호 변경: accountId={}, role={}", accountId, role);
    }

    /**
     * 크레딧 충전 (매니저)
     * PUT /api/add_credit_to_user
     */
    public UserInfo addCredit(String email, BigDecimal amount) {
        User user = findUserByEmail(email);
        return userCreditService.addCredit(user.getUserId(), amount);
    }

    /**
     * 사용자 삭제 (매니저). 주문 기록은 남기고 장바구니는 폐기한다.
     * DELETE /api/delete_user
     */
    @Transactional
    public void deleteUser(String email) {
        User user = findUserByEmail(email);
        try {
            userRepository.delete(user);
        } catch (DataAccessException e) {
            throw new SystemException(ErrorCode.DATABASE_ERROR, "사용자 삭제 실패: email=" + user.getEmail(), e);
        }
        cartService.discard(user.getUserId());
        log.info("[AccountService] 사용자 삭제: userId={}, email={}", user.getUserId(), user.getEmail());
    }

    /**
     * 사용자 장바구니 합계에 세율을 적용한 견적 (매니저). 장바구니/크레딧은 변경하지 않는다.
     * PUT /api/apply_tax_on_user
     *
     * @throws com.hhplus.furniture.common.exception.DomainException 세율이 음수인 경우
     */
    @Transactional(readOnly = true)
    public TaxQuote taxQuote(String email, BigDecimal taxRate) {
        User user = findUserByEmail(email);
        ShoppingCart cart = cartService.cartOf(user.getUserId());

        BigDecimal cartTotal = cart.total();
        BigDecimal totalWithTax = PricePolicy.tax(cartTotal, taxRate);

        log.info("[AccountService] 세금 견적: userId={}, taxRate={}, total={}",
                user.getUserId(), taxRate, totalWithTax);
        return new TaxQuote(user.getEmail(), taxRate, cartTotal, totalWithTax);
    }

    private User findUserByEmail(String email) {
        String normalized = AccountPolicy.normalizeEmail(email);
        return userRepository.findByEmail(normalized)
                .orElseThrow(() -> new UserNotFoundException(normalized));
    }

    private User findUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));
    }

    private void ensureEmailAvailable(String email) {
        if (userRepository.existsByEmail(email) || managerRepository.existsByEmail(email)) {
            throw new DuplicateEmailException(email);
        }
    }

    private void verifyPassword(String rawPassword, String passwordHash) {
        if (rawPassword == null || !passwordHasher.matches(rawPassword, passwordHash)) {
            throw new ApplicationException(ErrorCode.INVALID_CREDENTIALS);
        }
    }

    private <T> T persist(Supplier<T> action, String email) {
        try {
            return action.get();
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateEmailException(email);
        } catch (DataAccessException e) {
            throw new SystemException(ErrorCode.DATABASE_ERROR, "계정 저장 실패: email=" + email, e);
        }
    }
}
