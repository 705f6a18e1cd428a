package com.realgaming.marketplace.application.service;

import com.realgaming.marketplace.application.port.in.UserResult;
import com.realgaming.marketplace.application.port.in.auth.LoginUseCase;
import com.realgaming.marketplace.application.port.out.PasswordEncodePort;
import com.realgaming.marketplace.application.port.out.UserRepositoryPort;
import com.realgaming.marketplace.domain.exception.AccountInactiveException;
import com.realgaming.marketplace.domain.exception.LoginFailedException;
import com.realgaming.marketplace.domain.model.Status;
import com.realgaming.marketplace.domain.model.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
public class AuthService implements LoginUseCase {
    private final UserRepositoryPort userRepository;

    private final PasswordEncodePort encoder;

    // 없는 이메일도 같은 비용의 해시 비교를 거치게 한다
    private final String placeholderHash;

    public AuthService(UserRepositoryPort userRepository, PasswordEncodePort encoder) {
        this.userRepository = userRepository;
        this.encoder = encoder;
        this.placeholderHash = encoder.encode(UUID.randomUUID().toString());
    }

    @Override
    @Transactional(readOnly = true)
    public UserResult login(Command command) {
        Optional<User> found;
        try {
            found = userRepository.findByEmail(command.email());
        } catch (DataAccessException | TransactionException e) {
            throw PersistenceFailures.wrap("getting user", e);
        }

        if (found.isEmpty()) {
            encoder.matches(command.password(), placeholderHash);
            throw new LoginFailedException();
        }
        User user = found.get();
        if (!encoder.matches(command.password(), user.getPasswordHash())) {
            throw new LoginFailedException();
        }
        // 상태 확인은 비밀번호 검증 이후에만
        if (user.getStatus() != Status.ACTIVE) {
            throw new AccountInactiveException(user.getStatus());
        }

        log.info("User logged in: {}", user.getUserId());
        return UserResult.from(user);
    }
}
