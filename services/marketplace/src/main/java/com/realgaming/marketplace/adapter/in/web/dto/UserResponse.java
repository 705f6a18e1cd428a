package com.realgaming.marketplace.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.realgaming.marketplace.application.port.in.UserResult;
import com.realgaming.marketplace.domain.model.Role;
import com.realgaming.marketplace.domain.model.Status;

import java.time.LocalDateTime;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserResponse(
        @JsonProperty("id")
        UUID id,
        @JsonProperty("email")
        String email,
        @JsonProperty("first_name")
        String firstName,
        @JsonProperty("last_name")
        String lastName,
        @JsonProperty("role")
        Role role,
        @JsonProperty("status")
        Status status,
        @JsonProperty("avatar_url")
        String avatarUrl,
        @JsonProperty("phone")
        String phone,
        @JsonProperty("created_at")
        LocalDateTime createdAt,
        @JsonProperty("updated_at")
        LocalDateTime updatedAt
) {
    public static UserResponse from(UserResult user) {
        return new UserResponse(
                user.userId(),
                user.email(),
                user.firstName(),
                user.lastName(),
                user.role(),
                user.status(),
                user.avatarUrl(),
                user.phone(),
                user.createdAt(),
                user.updatedAt()
        );
    }
}
