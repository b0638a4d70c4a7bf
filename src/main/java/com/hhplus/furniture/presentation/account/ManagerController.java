package com.hhplus.furniture.presentation.account;

import com.hhplus.furniture.application.session.SessionService;
import com.hhplus.furniture.application.user.AccountService;
import com.hhplus.furniture.application.user.dto.UserInfo;
import com.hhplus.furniture.domain.user.Manager;
import com.hhplus.furniture.presentation.account.request.AddCreditRequest;
import com.hhplus.furniture.presentation.account.request.ApplyTaxRequest;
import com.hhplus.furniture.presentation.account.request.DeleteUserRequest;
import com.hhplus.furniture.presentation.account.request.RegisterManagerRequest;
import com.hhplus.furniture.presentation.account.response.ManagerResponse;
import com.hhplus.furniture.presentation.account.response.TaxQuoteResponse;
import com.hhplus.furniture.presentation.account.response.UserResponse;
import com.hhplus.furniture.presentation.common.SessionHeaders;
import com.hhplus.furniture.presentation.common.response.MessageResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * ManagerController - 매니저 전용 계정 관리 API
 */
@RestController
public class ManagerController {

    private final AccountService accountService;
    private final SessionService sessionService;

    public ManagerController(AccountService accountService, SessionService sessionService) {
        this.accountService = accountService;
        this.sessionService = sessionService;
    }

    @PostMapping("/secondary_manager_register")
    public ResponseEntity<ManagerResponse> registerManager(
            @RequestHeader(SessionHeaders.SESSION_TOKEN) String token,
            @RequestBody RegisterManagerRequest request) {
        sessionService.requireManager(token);
        Manager manager = accountService.registerManager(request.getName(), request.getEmail(), request.getPassword());
        return ResponseEntity.status(HttpStatus.CREATED).body(ManagerResponse.from(manager));
    }

    @DeleteMapping("/delete_user")
    public ResponseEntity<MessageResponse> deleteUser(
            @RequestHeader(SessionHeaders.SESSION_TOKEN) String token,
            @RequestBody DeleteUserRequest request) {
        sessionService.requireManager(token);
        accountService.deleteUser(request.getEmailToDelete());
        return ResponseEntity.ok(MessageResponse.of("User deleted successfully"));
    }

    /**
     * PUT /apply_tax_on_user
     * 장바구니 합계에 세율을 적용한 금액만 계산한다.
     */
    @PutMapping("/apply_tax_on_user")
    public ResponseEntity<TaxQuoteResponse> applyTax(
            @RequestHeader(SessionHeaders.SESSION_TOKEN) String token,
            @RequestBody ApplyTaxRequest request) {
        sessionService.requireManager(token);
        return ResponseEntity.ok(TaxQuoteResponse.from(
                accountService.taxQuote(request.getEmail(), request.getTaxRate())));
    }

    @PutMapping("/add_credit_to_user")
    public ResponseEntity<UserResponse> addCredit(
            @RequestHeader(SessionHeaders.SESSION_TOKEN) String token,
            @RequestBody AddCreditRequest request) {
        sessionService.requireManager(token);
        UserInfo info = accountService.addCredit(request.getEmail(), request.getAmount());
        return ResponseEntity.ok(UserResponse.from(info));
    }
}
