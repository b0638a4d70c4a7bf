package com.hhplus.furniture.presentation.account;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hhplus.furniture.application.session.SessionPrincipal;
import com.hhplus.furniture.application.session.SessionService;
import com.hhplus.furniture.application.session.SessionToken;
import com.hhplus.furniture.application.user.AccountService;
import com.hhplus.furniture.application.user.dto.RegisterUserCommand;
import com.hhplus.furniture.application.user.dto.UserInfo;
import com.hhplus.furniture.common.exception.ApplicationException;
import com.hhplus.furniture.common.exception.ErrorCode;
import com.hhplus.furniture.domain.user.DuplicateEmailException;
import com.hhplus.furniture.domain.user.Manager;
import com.hhplus.furniture.domain.user.Role;
import com.hhplus.furniture.presentation.account.request.EditUserRequest;
import com.hhplus.furniture.presentation.account.request.RegisterUserRequest;
import com.hhplus.furniture.presentation.account.request.SignInRequest;
import com.hhplus.furniture.presentation.account.request.UpdatePasswordRequest;
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

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * AccountControllerTest - Presentation Layer Unit Test
 *
 * 테스트 대상: 회원 가입, 로그인/로그아웃, 내 정보 조회/수정, 비밀번호 변경
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AccountController 단위 테스트")
class AccountControllerTest {

    private static final String USER_TOKEN = "user-token";
    private static final Long TEST_USER_ID = 1001L;

    private MockMvc mockMvc;

    private ObjectMapper objectMapper;

    @Mock
    private AccountService accountService;

    @Mock
    private SessionService sessionService;

    @InjectMocks
    private AccountController accountController;

    @BeforeEach
    void setup() {
        this.mockMvc = MockMvcBuilders.standaloneSetup(accountController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
        this.objectMapper = new ObjectMapper();
    }

    private UserInfo buyer() {
        return UserInfo.builder()
                .userId(TEST_USER_ID)
                .name("Buyer")
                .email("buyer@example.com")
                .address("Seoul")
                .credit(new BigDecimal("50.00"))
                .build();
    }

    // ========== 회원 가입 ==========

    @Test
    @DisplayName("회원 가입 - 201 Created")
    void testRegister_Success() throws Exception {
        // Given
        RegisterUserRequest request = RegisterUserRequest.builder()
                .name("Buyer")
                .email("buyer@example.com")
                .password("secret-1")
                .address("Seoul")
                .credit(new BigDecimal("50"))
                .build();
        when(accountService.registerUser(any(RegisterUserCommand.class))).thenReturn(buyer());

        // When & Then
        mockMvc.perform(post("/user_register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.user_id").value(TEST_USER_ID))
                .andExpect(jsonPath("$.email").value("buyer@example.com"))
                .andExpect(jsonPath("$.role").value("USER"))
                .andExpect(jsonPath("$.password").doesNotExist());

        verify(accountService).registerUser(argThat(command ->
                "buyer@example.com".equals(command.getEmail()) && "secret-1".equals(command.getPassword())));
    }

    @Test
    @DisplayName("회원 가입 - 이메일 중복 시 409")
    void testRegister_DuplicateEmail() throws Exception {
        // Given
        when(accountService.registerUser(any(RegisterUserCommand.class)))
                .thenThrow(new DuplicateEmailException("buyer@example.com"));

        // When & Then
        mockMvc.perform(post("/user_register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Buyer\",\"email\":\"buyer@example.com\",\"password\":\"secret-1\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_ACCOUNT_DUPLICATE_EMAIL"));
    }

    // ========== 로그인 / 로그아웃 ==========

    @Test
    @DisplayName("로그인 (POST) - 토큰 발급")
    void testSignIn_Body() throws Exception {
        // Given
        when(sessionService.signIn("buyer@example.com", "secret-1"))
                .thenReturn(new SessionToken("token-abc", "buyer@example.com", Role.USER, 1800L));

        // When & Then
        mockMvc.perform(post("/sign_in")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new SignInRequest("buyer@example.com", "secret-1"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Signed in successfully"))
                .andExpect(jsonPath("$.token").value("token-abc"))
                .andExpect(jsonPath("$.role").value("USER"))
                .andExpect(jsonPath("$.expires_in").value(1800));
    }

    @Test
    @DisplayName("로그인 (GET) - 쿼리 파라미터")
    void testSignIn_Params() throws Exception {
        // Given
        when(sessionService.signIn("hili@example.com", "manager-pass-1"))
                .thenReturn(new SessionToken("token-mgr", "hili@example.com", Role.MANAGER, 1800L));

        // When & Then
        mockMvc.perform(get("/sign_in")
                        .param("email", "hili@example.com")
                        .param("password", "manager-pass-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.role").value("MANAGER"));
    }

    @Test
    @DisplayName("로그인 - 잘못된 비밀번호는 401")
    void testSignIn_InvalidCredentials() throws Exception {
        // Given
        when(sessionService.signIn("buyer@example.com", "wrong"))
                .thenThrow(new ApplicationException(ErrorCode.INVALID_CREDENTIALS));

        // When & Then
        mockMvc.perform(post("/sign_in")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new SignInRequest("buyer@example.com", "wrong"))))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error_code").value("APP_SESSION_INVALID_CREDENTIALS"));
    }

    @Test
    @DisplayName("로그아웃 - 토큰 없이도 200")
    void testSignOut_WithoutToken() throws Exception {
        mockMvc.perform(post("/sign_out"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Signed out successfully"));

        verify(sessionService).signOut(null);
    }

    // ========== 내 정보 ==========

    @Test
    @DisplayName("내 정보 조회 - 구매자")
    void testGetUserInfo_User() throws Exception {
        // Given
        when(sessionService.requireAny(USER_TOKEN))
                .thenReturn(new SessionPrincipal(TEST_USER_ID, "buyer@example.com", Role.USER));
        when(accountService.userInfo(TEST_USER_ID)).thenReturn(buyer());

        // When & Then
        mockMvc.perform(get("/get_user_info")
                        .header(SessionHeaders.SESSION_TOKEN, USER_TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Buyer"))
                .andExpect(jsonPath("$.credit").value(50.00));
    }

    @Test
    @DisplayName("내 정보 조회 - 매니저 세션이면 매니저 정보")
    void testGetUserInfo_Manager() throws Exception {
        // Given
        when(sessionService.requireAny("manager-token"))
                .thenReturn(new SessionPrincipal(1L, "hili@example.com", Role.MANAGER));
        when(accountService.managerInfo(1L)).thenReturn(Manager.createManager("Hili", "hili@example.com", "hash"));

        // When & Then
        mockMvc.perform(get("/get_user_info")
                        .header(SessionHeaders.SESSION_TOKEN, "manager-token"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value("hili@example.com"))
                .andExpect(jsonPath("$.role").value("MANAGER"));

        verify(accountService, never()).userInfo(any());
    }

    @Test
    @DisplayName("내 정보 수정 - 이름만 변경")
    void testEditDetails_NameOnly() throws Exception {
        // Given
        when(sessionService.requireUser(USER_TOKEN))
                .thenReturn(new SessionPrincipal(TEST_USER_ID, "buyer@example.com", Role.USER));
        when(accountService.updateProfile(TEST_USER_ID, "New Name", null)).thenReturn(buyer());

        // When & Then
        mockMvc.perform(put("/edit_user's_details")
                        .header(SessionHeaders.SESSION_TOKEN, USER_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new EditUserRequest("New Name", null))))
                .andExpect(status().isOk());
    }

    @Test
    @DisplayName("내 정보 수정 - 변경 값이 없으면 400")
    void testEditDetails_Nothing() throws Exception {
        // Given
        when(sessionService.requireUser(USER_TOKEN))
                .thenReturn(new SessionPrincipal(TEST_USER_ID, "buyer@example.com", Role.USER));

        // When & Then
        mockMvc.perform(put("/edit_user's_details")
                        .header(SessionHeaders.SESSION_TOKEN, USER_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("No details were submitted for update."));

        verifyNoInteractions(accountService);
    }

    @Test
    @DisplayName("비밀번호 변경 - 성공")
    void testUpdatePassword() throws Exception {
        // Given
        when(sessionService.requireAny(USER_TOKEN))
                .thenReturn(new SessionPrincipal(TEST_USER_ID, "buyer@example.com", Role.USER));

        // When & Then
        mockMvc.perform(put("/update_password")
                        .header(SessionHeaders.SESSION_TOKEN, USER_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new UpdatePasswordRequest("secret-1", "secret-2"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Password updated successfully"));

        verify(accountService).changePassword(TEST_USER_ID, Role.USER, "secret-1", "secret-2");
    }
}
