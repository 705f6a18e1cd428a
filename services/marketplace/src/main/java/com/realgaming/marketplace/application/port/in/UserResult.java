package com.realgaming.marketplace.application.port.in;

import com.realgaming.marketplace.domain.model.Role;
import com.realgaming.marketplace.domain.model.Status;
import com.realgaming.marketplace.domain.model.User;

import java.time.LocalDateTime;
import java.util.UUID;

public record UserResult(
        UUID userId,
        String email,
        String firstName,
        String lastName,
        Role role,
        Status status,
        String avatarUrl,
        String phone,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static UserResult from(User user) {
        return new UserResult(
                user.getUserId(),
                user.getEmail(),
                user.getFirstName(),
                user.getLastName(),
                user.getRole(),
                user.getStatus(),
                user.getAvatarUrl(),
                user.getPhone(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
