package com.hhplus.furniture.presentation.account;

import com.hhplus.furniture.application.session.SessionPrincipal;
import com.hhplus.furniture.application.session.SessionService;
import com.hhplus.furniture.application.session.SessionToken;
import com.hhplus.furniture.application.user.AccountService;
import com.hhplus.furniture.application.user.dto.RegisterUserCommand;
import com.hhplus.furniture.application.user.dto.UserInfo;
import com.hhplus.furniture.common.exception.ApplicationException;
import com.hhplus.furniture.common.exception.ErrorCode;
import com.hhplus.furniture.presentation.account.request.EditUserRequest;
import com.hhplus.furniture.presentation.account.request.RegisterUserRequest;
import com.hhplus.furniture.presentation.account.request.SignInRequest;
import com.hhplus.furniture.presentation.account.request.UpdatePasswordRequest;
import com.hhplus.furniture.presentation.account.response.ManagerResponse;
import com.hhplus.furniture.presentation.account.response.SignInResponse;
import com.hhplus.furniture.presentation.account.response.UserResponse;
import com.hhplus.furniture.presentation.common.SessionHeaders;
import com.hhplus.furniture.presentation.common.response.MessageResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * AccountController - 회원 가입, 로그인/로그아웃, 내 정보 API
 */
@RestController
public class AccountController {

    private final AccountService accountService;
    private final SessionService sessionService;

    public AccountController(AccountService accountService, SessionService sessionService) {
        this.accountService = accountService;
        this.sessionService = sessionService;
    }

    /**
     * POST /user_register
     * 201 Created, 이메일 중복이면 409
     */
    @PostMapping("/user_register")
    public ResponseEntity<UserResponse> register(@RequestBody RegisterUserRequest request) {
        RegisterUserCommand command = RegisterUserCommand.builder()
                .name(request.getName())
                .email(request.getEmail())
                .password(request.getPassword())
                .address(request.getAddress())
                .credit(request.getCredit())
                .build();
        UserInfo info = accountService.registerUser(command);
        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.from(info));
    }

    /**
     * GET /sign_in?email=...&password=...
     */
    @GetMapping("/sign_in")
    public ResponseEntity<SignInResponse> signInWithParams(
            @RequestParam("email") String email,
            @RequestParam("password") String password) {
        SessionToken token = sessionService.signIn(email, password);
        return ResponseEntity.ok(SignInResponse.from(token));
    }

    /**
     * POST /sign_in
     */
    @PostMapping("/sign_in")
    public ResponseEntity<SignInResponse> signIn(@RequestBody SignInRequest request) {
        SessionToken token = sessionService.signIn(request.getEmail(), request.getPassword());
        return ResponseEntity.ok(SignInResponse.from(token));
    }

    /**
     * POST /sign_out
     * 토큰이 없거나 이미 만료되어도 200
     */
    @PostMapping("/sign_out")
    public ResponseEntity<MessageResponse> signOut(
            @RequestHeader(value = SessionHeaders.SESSION_TOKEN, required = false) String token) {
        sessionService.signOut(token);
        return ResponseEntity.ok(MessageResponse.of("Signed out successfully"));
    }

    /**
     * GET /get_user_info
     * 매니저 세션이면 매니저 정보를 반환한다.
     */
    @GetMapping("/get_user_info")
    public ResponseEntity<?> getUserInfo(@RequestHeader(SessionHeaders.SESSION_TOKEN) String token) {
        SessionPrincipal principal = sessionService.requireAny(token);
        if (principal.isManager()) {
            return ResponseEntity.ok(ManagerResponse.from(accountService.managerInfo(principal.getAccountId())));
        }
        return ResponseEntity.ok(UserResponse.from(accountService.userInfo(principal.getAccountId())));
    }

    /**
     * PUT /edit_user's_details
     */
    @PutMapping("/edit_user's_details")
    public ResponseEntity<UserResponse> editDetails(
            @RequestHeader(SessionHeaders.SESSION_TOKEN) String token,
            @RequestBody EditUserRequest request) {
        SessionPrincipal principal = sessionService.requireUser(token);
        if (request.getNewName() == null && request.getNewAddress() == null) {
            throw new ApplicationException(ErrorCode.INVALID_INPUT, "No details were submitted for update.");
        }
        UserInfo info = accountService.updateProfile(principal.getAccountId(),
                request.getNewName(), request.getNewAddress());
        return ResponseEntity.ok(UserResponse.from(info));
    }

    /**
     * PUT /update_password
     */
    @PutMapping("/update_password")
    public ResponseEntity<MessageResponse> updatePassword(
            @RequestHeader(SessionHeaders.SESSION_TOKEN) String token,
            @RequestBody UpdatePasswordRequest request) {
        SessionPrincipal principal = sessionService.requireAny(token);
        accountService.changePassword(principal.getAccountId(), principal.getRole(),
                request.getCurrentPassword(), request.getNewPassword());
        return ResponseEntity.ok(MessageResponse.of("Password updated successfully"));
    }
}
