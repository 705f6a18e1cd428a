package com.realgaming.marketplace.adapter.in.web;

import com.realgaming.marketplace.application.port.in.UserResult;
import com.realgaming.marketplace.application.port.in.user.CreateUserUseCase;
import com.realgaming.marketplace.application.port.in.user.GetUserUseCase;
import com.realgaming.marketplace.application.port.in.user.ListUsersUseCase;
import com.realgaming.marketplace.application.port.in.user.UpdateUserStatusUseCase;
import com.realgaming.marketplace.application.port.in.user.UpdateUserUseCase;
import com.realgaming.marketplace.common.error.GlobalErrorCode;
import com.realgaming.marketplace.common.exception.BusinessException;
import com.realgaming.marketplace.domain.exception.EmailAlreadyExistsException;
import com.realgaming.marketplace.domain.exception.UserNotFoundException;
import com.realgaming.marketplace.domain.model.Role;
import com.realgaming.marketplace.domain.model.Status;
import com.realgaming.marketplace.global.config.MarketplaceSecurityProperties;
import com.realgaming.marketplace.infra.config.SecurityConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(UserController.class)
@Import(SecurityConfig.class)
@EnableConfigurationProperties(MarketplaceSecurityProperties.class)
class UserControllerTest {

    private static final String VALID_CREATE_BODY = """
            {
              "email": "player@example.com",
              "password": "s3cret-pass",
              "first_name": "Abebe",
              "last_name": "Kebede",
              "role": "gamer",
              "phone": "0101234567"
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CreateUserUseCase createUserUseCase;
    @MockBean
    private GetUserUseCase getUserUseCase;
    @MockBean
    private UpdateUserUseCase updateUserUseCase;
    @MockBean
    private UpdateUserStatusUseCase updateUserStatusUseCase;
    @MockBean
    private ListUsersUseCase listUsersUseCase;

    @Test
    void createUser_valid_returnsCreatedEnvelopeWithoutPassword() throws Exception {
        UserResult user = userResult(UUID.randomUUID(), Role.GAMER);
        when(createUserUseCase.createUser(any())).thenReturn(user);

        mockMvc.perform(post("/api/v1/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_CREATE_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("User created successfully"))
                .andExpect(jsonPath("$.data.id").value(user.userId().toString()))
                .andExpect(jsonPath("$.data.first_name").value("Abebe"))
                .andExpect(jsonPath("$.data.role").value("gamer"))
                .andExpect(jsonPath("$.data.status").value("active"))
                .andExpect(jsonPath("$.data.avatar_url").doesNotExist())
                .andExpect(jsonPath("$.data.password").doesNotExist())
                .andExpect(jsonPath("$.data.password_hash").doesNotExist());

        verify(createUserUseCase).createUser(new CreateUserUseCase.Command(
                "player@example.com", "s3cret-pass", "Abebe", "Kebede", Role.GAMER, "0101234567"));
    }

    @Test
    void createUser_invalidFields_returnsValidationErrors() throws Exception {
        String body = """
                {
                  "email": "not-an-email",
                  "password": "short",
                  "first_name": "A",
                  "last_name": "Kebede",
                  "role": "gamer"
                }
                """;

        mockMvc.perform(post("/api/v1/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("G-400"))
                .andExpect(jsonPath("$.validation.email").exists())
                .andExpect(jsonPath("$.validation.password").exists())
                .andExpect(jsonPath("$.validation.firstName").exists());

        verifyNoInteractions(createUserUseCase);
    }

    @Test
    void createUser_passwordOver72Utf8Bytes_returnsValidationError() throws Exception {
        // 25 글자지만 75 바이트
        String body = VALID_CREATE_BODY.replace("s3cret-pass", "가".repeat(25));

        mockMvc.perform(post("/api/v1/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.validation.password").value("must be at most 72 bytes"));

        verifyNoInteractions(createUserUseCase);
    }

    @Test
    void createUser_passwordOfExactly72Utf8Bytes_isAccepted() throws Exception {
        String password = "가".repeat(24);
        when(createUserUseCase.createUser(any())).thenReturn(userResult(UUID.randomUUID(), Role.GAMER));

        mockMvc.perform(post("/api/v1/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_CREATE_BODY.replace("s3cret-pass", password)))
                .andExpect(status().isCreated());

        verify(createUserUseCase).createUser(new CreateUserUseCase.Command(
                "player@example.com", password, "Abebe", "Kebede", Role.GAMER, "0101234567"));
    }

    @Test
    void createUser_unknownRole_returnsBadRequest() throws Exception {
        String body = VALID_CREATE_BODY.replace("\"gamer\"", "\"buyer\"");

        mockMvc.perform(post("/api/v1/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));

        verifyNoInteractions(createUserUseCase);
    }

    @Test
    void createUser_duplicateEmail_returnsConflict() throws Exception {
        when(createUserUseCase.createUser(any())).thenThrow(new EmailAlreadyExistsException());

        mockMvc.perform(post("/api/v1/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_CREATE_BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("U-001"));
    }

    @Test
    void getUser_missing_returnsNotFound() throws Exception {
        UUID userId = UUID.randomUUID();
        when(getUserUseCase.getUserById(userId)).thenThrow(new UserNotFoundException());

        mockMvc.perform(get("/api/v1/users/{id}", userId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("U-002"))
                .andExpect(jsonPath("$.message").value("User not found."));
    }

    @Test
    void getUser_malformedId_returnsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/users/{id}", "not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("G-400"));

        verifyNoInteractions(getUserUseCase);
    }

    @Test
    void getUser_persistenceFailure_hidesDetail() throws Exception {
        UUID userId = UUID.randomUUID();
        when(getUserUseCase.getUserById(userId)).thenThrow(new BusinessException(
                GlobalErrorCode.INTERNAL_SERVER_ERROR, "Error while getting user",
                new IllegalStateException("connection refused")));

        mockMvc.perform(get("/api/v1/users/{id}", userId))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Internal server error."))
                .andExpect(content().string(not(containsString("connection refused"))));
    }

    @Test
    void getUserByEmail_returnsUser() throws Exception {
        UserResult user = userResult(UUID.randomUUID(), Role.ADMIN);
        when(getUserUseCase.getUserByEmail("player@example.com")).thenReturn(user);

        mockMvc.perform(get("/api/v1/users/by-email").param("email", "player@example.com"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.id").value(user.userId().toString()))
                .andExpect(jsonPath("$.data.role").value("admin"));
    }

    @Test
    void listUsers_outOfRangeParams_areDefaultedAndClamped() throws Exception {
        when(listUsersUseCase.listUsers(any())).thenReturn(List.of());
        when(listUsersUseCase.countUsers(null, null)).thenReturn(0L);

        mockMvc.perform(get("/api/v1/users").param("page", "0").param("limit", "500"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data").isArray())
                .andExpect(jsonPath("$.pagination.page").value(1))
                .andExpect(jsonPath("$.pagination.limit").value(100));

        verify(listUsersUseCase).listUsers(new ListUsersUseCase.Query(null, null, 1, 100));
    }

    @Test
    void listUsers_maxPage_returnsEmptyPage() throws Exception {
        when(listUsersUseCase.listUsers(any())).thenReturn(List.of());
        when(listUsersUseCase.countUsers(null, null)).thenReturn(3L);

        mockMvc.perform(get("/api/v1/users").param("page", String.valueOf(Integer.MAX_VALUE)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isEmpty())
                .andExpect(jsonPath("$.pagination.page").value(Integer.MAX_VALUE))
                .andExpect(jsonPath("$.pagination.total").value(3));

        verify(listUsersUseCase).listUsers(new ListUsersUseCase.Query(null, null, Integer.MAX_VALUE, 10));
    }

    @Test
    void listUsers_unparsableParams_useDefaults() throws Exception {
        when(listUsersUseCase.listUsers(any())).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/users").param("page", "abc").param("limit", "-3"))
                .andExpect(status().isOk());

        verify(listUsersUseCase).listUsers(new ListUsersUseCase.Query(null, null, 1, 10));
    }

    @Test
    void listUsers_filters_reportTotalPages() throws Exception {
        UserResult admin = userResult(UUID.randomUUID(), Role.ADMIN);
        when(listUsersUseCase.listUsers(any())).thenReturn(List.of(admin));
        when(listUsersUseCase.countUsers(Role.ADMIN, Status.ACTIVE)).thenReturn(25L);

        mockMvc.perform(get("/api/v1/users")
                        .param("role", "admin")
                        .param("status", "active")
                        .param("page", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].role").value("admin"))
                .andExpect(jsonPath("$.pagination.page").value(2))
                .andExpect(jsonPath("$.pagination.limit").value(10))
                .andExpect(jsonPath("$.pagination.total").value(25))
                .andExpect(jsonPath("$.pagination.total_pages").value(3));

        verify(listUsersUseCase).listUsers(new ListUsersUseCase.Query(Role.ADMIN, Status.ACTIVE, 2, 10));
    }

    @Test
    void listUsers_unknownRole_returnsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/users").param("role", "buyer"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(listUsersUseCase);
    }

    @Test
    void updateUser_passesPartialFields() throws Exception {
        UUID userId = UUID.randomUUID();
        when(updateUserUseCase.updateUser(any())).thenReturn(userResult(userId, Role.GAMER));

        mockMvc.perform(put("/api/v1/users/{id}", userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"first_name": "Sara", "last_name": "Tesfaye"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("User updated successfully"));

        verify(updateUserUseCase).updateUser(
                new UpdateUserUseCase.Command(userId, "Sara", "Tesfaye", null, null));
    }

    @Test
    void updateUser_invalidAvatarUrl_returnsBadRequest() throws Exception {
        mockMvc.perform(put("/api/v1/users/{id}", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"first_name": "Sara", "last_name": "Tesfaye", "avatar_url": "not a url"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.validation.avatarUrl").exists());

        verifyNoInteractions(updateUserUseCase);
    }

    @Test
    void deleteUser_marksUserInactive() throws Exception {
        UUID userId = UUID.randomUUID();

        mockMvc.perform(delete("/api/v1/users/{id}", userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("User deleted successfully"))
                .andExpect(jsonPath("$.data").doesNotExist());

        verify(updateUserStatusUseCase).updateUserStatus(userId, Status.INACTIVE);
    }

    @Test
    void deleteUser_missing_returnsNotFound() throws Exception {
        UUID userId = UUID.randomUUID();
        doThrow(new UserNotFoundException()).when(updateUserStatusUseCase).updateUserStatus(userId, Status.INACTIVE);

        mockMvc.perform(delete("/api/v1/users/{id}", userId))
                .andExpect(status().isNotFound());
    }

    @Test
    void preflight_allowsCrossOriginRequests() throws Exception {
        mockMvc.perform(options("/api/v1/users")
                        .header("Origin", "http://localhost:3000")
                        .header("Access-Control-Request-Method", "POST"))
                .andExpect(status().isOk())
                .andExpect(header().exists("Access-Control-Allow-Origin"));
    }

    private static UserResult userResult(UUID userId, Role role) {
        LocalDateTime now = LocalDateTime.of(2024, 1, 1, 12, 0);
        return new UserResult(userId, "player@example.com", "Abebe", "Kebede", role, Status.ACTIVE,
                null, "0101234567", now, now);
    }
}
