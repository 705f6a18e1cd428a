package com.realgaming.marketplace.application.port.in.user;

import com.realgaming.marketplace.application.port.in.UserResult;

import java.util.UUID;

public interface UpdateUserUseCase {
    UserResult updateUser(Command command);

    /**
     * {@code phone}, {@code avatarUrl}가 null 이거나 비어 있으면 기존 값을 유지한다.
     */
    record Command(
            UUID userId,
            String firstName,
            String lastName,
            String phone,
            String avatarUrl
    ) {}
}
