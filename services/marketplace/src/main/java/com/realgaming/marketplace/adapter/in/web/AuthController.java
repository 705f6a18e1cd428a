package com.realgaming.marketplace.adapter.in.web;

import com.realgaming.marketplace.adapter.in.web.dto.ApiResponse;
import com.realgaming.marketplace.adapter.in.web.dto.LoginRequest;
import com.realgaming.marketplace.adapter.in.web.dto.UserResponse;
import com.realgaming.marketplace.application.port.in.UserResult;
import com.realgaming.marketplace.application.port.in.auth.LoginUseCase;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/auth")
public class AuthController {
    private final LoginUseCase loginUseCase;

    @PostMapping("/login")
    public ResponseEntity<ApiResponse<UserResponse>> login(@RequestBody @Valid LoginRequest loginRequest) {
        UserResult user = loginUseCase.login(loginRequest.toCommand());
        return ResponseEntity.ok(ApiResponse.success(UserResponse.from(user), "Login successful"));
    }
}
