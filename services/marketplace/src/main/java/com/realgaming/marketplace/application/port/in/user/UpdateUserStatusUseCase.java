package com.realgaming.marketplace.application.port.in.user;

import com.realgaming.marketplace.domain.model.Status;

import java.util.UUID;

public interface UpdateUserStatusUseCase {
    void updateUserStatus(UUID userId, Status status);
}
