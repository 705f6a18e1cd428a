package com.realgaming.marketplace.application.port.in.auth;

import com.realgaming.marketplace.application.port.in.UserResult;

public interface LoginUseCase {
    UserResult login(Command command);

    record Command(
            String email,
            String password
    ){}
}
