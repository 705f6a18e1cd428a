package com.realgaming.marketplace.adapter.in.web;

import com.realgaming.marketplace.adapter.in.web.dto.ApiResponse;
import com.realgaming.marketplace.adapter.in.web.dto.CreateUserRequest;
import com.realgaming.marketplace.adapter.in.web.dto.PageResponse;
import com.realgaming.marketplace.adapter.in.web.dto.UpdateUserRequest;
import com.realgaming.marketplace.adapter.in.web.dto.UserResponse;
import com.realgaming.marketplace.application.port.in.UserResult;
import com.realgaming.marketplace.application.port.in.user.CreateUserUseCase;
import com.realgaming.marketplace.application.port.in.user.GetUserUseCase;
import com.realgaming.marketplace.application.port.in.user.ListUsersUseCase;
import com.realgaming.marketplace.application.port.in.user.UpdateUserStatusUseCase;
import com.realgaming.marketplace.application.port.in.user.UpdateUserUseCase;
import com.realgaming.marketplace.domain.model.Role;
import com.realgaming.marketplace.domain.model.Status;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/users")
public class UserController {

    private static final int DEFAULT_PAGE = 1;
    private static final int DEFAULT_LIMIT = 10;
    private static final int MAX_LIMIT = 100;

    private final CreateUserUseCase createUserUseCase;
    private final GetUserUseCase getUserUseCase;
    private final UpdateUserUseCase updateUserUseCase;
    private final UpdateUserStatusUseCase updateUserStatusUseCase;
    private final ListUsersUseCase listUsersUseCase;

    @PostMapping
    public ResponseEntity<ApiResponse<UserResponse>> createUser(@RequestBody @Valid CreateUserRequest request) {
        UserResult user = createUserUseCase.createUser(request.toCommand());
        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(ApiResponse.success(UserResponse.from(user), "User created successfully"));
    }

    @GetMapping
    public ResponseEntity<PageResponse<UserResponse>> listUsers(
            @RequestParam(required = false) String page,
            @RequestParam(required = false) String limit,
            @RequestParam(required = false) Role role,
            @RequestParam(required = false) Status status
    ) {
        int pageNumber = parsePositive(page, DEFAULT_PAGE);
        int pageSize = Math.min(parsePositive(limit, DEFAULT_LIMIT), MAX_LIMIT);

        List<UserResponse> users = listUsersUseCase
                .listUsers(new ListUsersUseCase.Query(role, status, pageNumber, pageSize))
                .stream()
                .map(UserResponse::from)
                .toList();
        long total = listUsersUseCase.countUsers(role, status);

        return ResponseEntity.ok(PageResponse.of(users, pageNumber, pageSize, total));
    }

    @GetMapping("/by-email")
    public ResponseEntity<ApiResponse<UserResponse>> getUserByEmail(@RequestParam String email) {
        UserResult user = getUserUseCase.getUserByEmail(email);
        return ResponseEntity.ok(ApiResponse.success(UserResponse.from(user)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<UserResponse>> getUser(@PathVariable("id") UUID userId) {
        UserResult user = getUserUseCase.getUserById(userId);
        return ResponseEntity.ok(ApiResponse.success(UserResponse.from(user)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<UserResponse>> updateUser(
            @PathVariable("id") UUID userId,
            @RequestBody @Valid UpdateUserRequest request
    ) {
        UserResult user = updateUserUseCase.updateUser(request.toCommand(userId));
        return ResponseEntity.ok(ApiResponse.success(UserResponse.from(user), "User updated successfully"));
    }

    // 실제 삭제가 아니라 비활성화
    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteUser(@PathVariable("id") UUID userId) {
        updateUserStatusUseCase.updateUserStatus(userId, Status.INACTIVE);
        log.info("User deactivated: {}", userId);
        return ResponseEntity.ok(ApiResponse.success(null, "User deleted successfully"));
    }

    private static int parsePositive(String value, int defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed < 1 ? defaultValue : parsed;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
