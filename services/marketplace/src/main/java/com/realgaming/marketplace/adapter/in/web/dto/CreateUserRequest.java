package com.realgaming.marketplace.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.realgaming.marketplace.adapter.in.web.validation.MaxUtf8Bytes;
import com.realgaming.marketplace.application.port.in.user.CreateUserUseCase;
import com.realgaming.marketplace.domain.model.Role;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreateUserRequest(
        @Email
        @NotBlank
        @Size(max = 255)
        @JsonProperty("email")
        String email,

        // bcrypt 는 72 바이트 뒤를 잘라 버린다
        @NotBlank
        @Size(min = 8)
        @MaxUtf8Bytes(72)
        @JsonProperty("password")
        String password,

        @NotBlank
        @Size(min = 2, max = 100)
        @JsonProperty("first_name")
        String firstName,

        @NotBlank
        @Size(min = 2, max = 100)
        @JsonProperty("last_name")
        String lastName,

        @NotNull
        @JsonProperty("role")
        Role role,

        // 빈 문자열은 "입력 안 함"
        @Pattern(regexp = "^$|^[0-9+\\-() ]{10,20}$", message = "phone must be 10 to 20 digits")
        @JsonProperty("phone")
        String phone
) {
    public CreateUserUseCase.Command toCommand() {
        return new CreateUserUseCase.Command(email, password, firstName, lastName, role, phone);
    }
}
