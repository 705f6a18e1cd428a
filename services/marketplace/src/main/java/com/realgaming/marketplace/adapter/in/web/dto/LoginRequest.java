package com.realgaming.marketplace.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.realgaming.marketplace.application.port.in.auth.LoginUseCase;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record LoginRequest(
        @Email
        @NotBlank
        @JsonProperty("email")
        String email,

        @NotBlank
        @JsonProperty("password")
        String password
) {
    public LoginUseCase.Command toCommand() {
        return new LoginUseCase.Command(email, password);
    }
}
