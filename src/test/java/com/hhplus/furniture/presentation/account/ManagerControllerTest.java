package com.hhplus.furniture.presentation.account;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hhplus.furniture.application.session.SessionPrincipal;
import com.hhplus.furniture.application.session.SessionService;
import com.hhplus.furniture.application.user.AccountService;
import com.hhplus.furniture.application.user.dto.TaxQuote;
import com.hhplus.furniture.application.user.dto.UserInfo;
import com.hhplus.furniture.common.exception.ApplicationException;
import com.hhplus.furniture.common.exception.ErrorCode;
import com.hhplus.furniture.domain.user.Manager;
import com.hhplus.furniture.domain.user.Role;
import com.hhplus.furniture.domain.user.UserNotFoundException;
import com.hhplus.furniture.presentation.account.request.AddCreditRequest;
import com.hhplus.furniture.presentation.account.request.ApplyTaxRequest;
import com.hhplus.furniture.presentation.account.request.DeleteUserRequest;
import com.hhplus.furniture.presentation.account.request.RegisterManagerRequest;
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

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * ManagerControllerTest - 매니저 전용 API 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ManagerController 단위 테스트")
class ManagerControllerTest {

    private static final String MANAGER_TOKEN = "manager-token";

    private MockMvc mockMvc;

    private ObjectMapper objectMapper;

    @Mock
    private AccountService accountService;

    @Mock
    private SessionService sessionService;

    @InjectMocks
    private ManagerController managerController;

    @BeforeEach
    void setup() {
        this.mockMvc = MockMvcBuilders.standaloneSetup(managerController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
        this.objectMapper = new ObjectMapper();
    }

    private void givenManagerSession() {
        when(sessionService.requireManager(MANAGER_TOKEN))
                .thenReturn(new SessionPrincipal(1L, "hili@example.com", Role.MANAGER));
    }

    @Test
    @DisplayName("보조 매니저 등록 - 201 Created")
    void testRegisterManager() throws Exception {
        // Given
        givenManagerSession();
        when(accountService.registerManager("Second", "second@example.com", "pass-2"))
                .thenReturn(Manager.createManager("Second", "second@example.com", "hash"));

        // When & Then
        mockMvc.perform(post("/secondary_manager_register")
                        .header(SessionHeaders.SESSION_TOKEN, MANAGER_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new RegisterManagerRequest("Second", "second@example.com", "pass-2"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.email").value("second@example.com"))
                .andExpect(jsonPath("$.role").value("MANAGER"));
    }

    @Test
    @DisplayName("보조 매니저 등록 - 구매자 세션은 403")
    void testRegisterManager_ForbiddenForUser() throws Exception {
        // Given
        when(sessionService.requireManager("user-token"))
                .thenThrow(new ApplicationException(ErrorCode.FORBIDDEN, "매니저 전용 기능입니다"));

        // When & Then
        mockMvc.perform(post("/secondary_manager_register")
                        .header(SessionHeaders.SESSION_TOKEN, "user-token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new RegisterManagerRequest("Second", "second@example.com", "pass-2"))))
                .andExpect(status().isForbidden());

        verifyNoInteractions(accountService);
    }

    @Test
    @DisplayName("사용자 삭제 - 성공")
    void testDeleteUser() throws Exception {
        // Given
        givenManagerSession();

        // When & Then
        mockMvc.perform(delete("/delete_user")
                        .header(SessionHeaders.SESSION_TOKEN, MANAGER_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new DeleteUserRequest("buyer@example.com"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("User deleted successfully"));

        verify(accountService).deleteUser("buyer@example.com");
    }

    @Test
    @DisplayName("사용자 삭제 - 없는 사용자는 404")
    void testDeleteUser_NotFound() throws Exception {
        // Given
        givenManagerSession();
        doThrow(new UserNotFoundException("ghost@example.com"))
                .when(accountService).deleteUser("ghost@example.com");

        // When & Then
        mockMvc.perform(delete("/delete_user")
                        .header(SessionHeaders.SESSION_TOKEN, MANAGER_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new DeleteUserRequest("ghost@example.com"))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_USER_NOT_FOUND"));
    }

    @Test
    @DisplayName("세금 견적 - 장바구니 합계에 세율 적용")
    void testApplyTax() throws Exception {
        // Given
        givenManagerSession();
        when(accountService.taxQuote("buyer@example.com", new BigDecimal("17")))
                .thenReturn(new TaxQuote("buyer@example.com", new BigDecimal("17"),
                        new BigDecimal("200.00"), new BigDecimal("234.00")));

        // When & Then
        mockMvc.perform(put("/apply_tax_on_user")
                        .header(SessionHeaders.SESSION_TOKEN, MANAGER_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"buyer@example.com\",\"tax_rate\":17}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cart_total").value(200.00))
                .andExpect(jsonPath("$.total_with_tax").value(234.00));
    }

    @Test
    @DisplayName("크레딧 추가 - 갱신된 사용자 정보 반환")
    void testAddCredit() throws Exception {
        // Given
        givenManagerSession();
        UserInfo updated = UserInfo.builder()
                .userId(1001L)
                .name("Buyer")
                .email("buyer@example.com")
                .address("Seoul")
                .credit(new BigDecimal("150.00"))
                .build();
        when(accountService.addCredit("buyer@example.com", new BigDecimal("100"))).thenReturn(updated);

        // When & Then
        mockMvc.perform(put("/add_credit_to_user")
                        .header(SessionHeaders.SESSION_TOKEN, MANAGER_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new AddCreditRequest("buyer@example.com", new BigDecimal("100")))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.credit").value(150.00));
    }
}
