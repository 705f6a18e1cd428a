package com.realgaming.marketplace.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.realgaming.marketplace.application.port.in.user.UpdateUserUseCase;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import org.hibernate.validator.constraints.URL;

import java.util.UUID;

public record UpdateUserRequest(
        @NotBlank
        @Size(min = 2, max = 100)
        @JsonProperty("first_name")
        String firstName,

        @NotBlank
        @Size(min = 2, max = 100)
        @JsonProperty("last_name")
        String lastName,

        // 빈 문자열은 "입력 안 함"
        @Pattern(regexp = "^$|^[0-9+\\-() ]{10,20}$", message = "phone must be 10 to 20 digits")
        @JsonProperty("phone")
        String phone,

        @URL
        @Size(max = 500)
        @JsonProperty("avatar_url")
        String avatarUrl
) {
    public UpdateUserUseCase.Command toCommand(UUID userId) {
        return new UpdateUserUseCase.Command(userId, firstName, lastName, phone, avatarUrl);
    }
}
