package com.realgaming.marketplace.application.port.in.user;

import com.realgaming.marketplace.application.port.in.UserResult;

import java.util.UUID;

public interface GetUserUseCase {
    UserResult getUserById(UUID userId);
    UserResult getUserByEmail(String email);
}
