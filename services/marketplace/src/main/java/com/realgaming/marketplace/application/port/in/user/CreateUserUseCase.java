package com.realgaming.marketplace.application.port.in.user;

import com.realgaming.marketplace.application.port.in.UserResult;
import com.realgaming.marketplace.domain.model.Role;

public interface CreateUserUseCase {
    UserResult createUser(Command command);

    record Command(
            String email,
            String password,
            String firstName,
            String lastName,
            Role role,
            String phone
    ) {}
}
