package com.realgaming.marketplace.application.service;

import com.realgaming.marketplace.application.port.in.UserResult;
import com.realgaming.marketplace.application.port.in.user.CreateUserUseCase;
import com.realgaming.marketplace.application.port.in.user.GetUserUseCase;
import com.realgaming.marketplace.application.port.in.user.ListUsersUseCase;
import com.realgaming.marketplace.application.port.in.user.UpdateUserStatusUseCase;
import com.realgaming.marketplace.application.port.in.user.UpdateUserUseCase;
import com.realgaming.marketplace.application.port.out.PasswordEncodePort;
import com.realgaming.marketplace.application.port.out.UserRepositoryPort;
import com.realgaming.marketplace.domain.exception.EmailAlreadyExistsException;
import com.realgaming.marketplace.domain.exception.UserNotFoundException;
import com.realgaming.marketplace.domain.model.Role;
import com.realgaming.marketplace.domain.model.Status;
import com.realgaming.marketplace.domain.model.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService implements CreateUserUseCase, GetUserUseCase, UpdateUserUseCase,
        UpdateUserStatusUseCase, ListUsersUseCase {

    private final UserRepositoryPort userRepository;
    private final PasswordEncodePort encoder;

    @Override
    @Transactional
    public UserResult createUser(CreateUserUseCase.Command command) {
        String email = command.email();
        try {
            userRepository.findByEmail(email).ifPresent(
                    user -> {
                        throw new EmailAlreadyExistsException();
                    });

            User user = User.signupBuilder()
                    .email(email)
                    .passwordHash(encodePassword(command.password()))
                    .firstName(command.firstName())
                    .lastName(command.lastName())
                    .role(command.role())
                    .phone(command.phone())
                    .build();

            User created = userRepository.create(user);
            log.info("User registered: {} (ID: {})", created.getEmail(), created.getUserId());
            return UserResult.from(created);
        } catch (DataIntegrityViolationException e) {
            // 사전 조회를 통과한 동시 가입 요청은 unique 제약에서 걸린다
            log.debug("Unique constraint rejected signup for {}", email);
            throw new EmailAlreadyExistsException(e);
        } catch (DataAccessException | TransactionException e) {
            throw PersistenceFailures.wrap("creating user", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public UserResult getUserById(UUID userId) {
        try {
            return userRepository.findById(userId)
                    .map(UserResult::from)
                    .orElseThrow(UserNotFoundException::new);
        } catch (DataAccessException | TransactionException e) {
            throw PersistenceFailures.wrap("getting user", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public UserResult getUserByEmail(String email) {
        try {
            return userRepository.findByEmail(email)
                    .map(UserResult::from)
                    .orElseThrow(UserNotFoundException::new);
        } catch (DataAccessException | TransactionException e) {
            throw PersistenceFailures.wrap("getting user", e);
        }
    }

    @Override
    @Transactional
    public UserResult updateUser(UpdateUserUseCase.Command command) {
        try {
            User user = userRepository.findById(command.userId())
                    .orElseThrow(UserNotFoundException::new);

            user.updateProfile(command.firstName(), command.lastName(), command.phone(), command.avatarUrl());

            User updated = userRepository.update(user);
            log.debug("User updated: {}", updated.getUserId());
            return UserResult.from(updated);
        } catch (DataAccessException | TransactionException e) {
            throw PersistenceFailures.wrap("updating user", e);
        }
    }

    @Override
    @Transactional
    public void updateUserStatus(UUID userId, Status status) {
        try {
            userRepository.findById(userId).orElseThrow(UserNotFoundException::new);
            userRepository.updateStatus(userId, status);
            log.info("User status changed: {} -> {}", userId, status);
        } catch (DataAccessException | TransactionException e) {
            throw PersistenceFailures.wrap("updating user status", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<UserResult> listUsers(Query query) {
        long offset = (long) (query.page() - 1) * query.limit();
        // JPA 는 int 범위 offset 만 받는다. 그 너머에는 조회할 행이 없다
        if (offset > Integer.MAX_VALUE) {
            log.debug("Page {} (limit {}) is beyond the addressable range", query.page(), query.limit());
            return List.of();
        }
        try {
            return userRepository.findAll(query.role(), query.status(), query.limit(), (int) offset).stream()
                    .map(UserResult::from)
                    .toList();
        } catch (DataAccessException | TransactionException e) {
            throw PersistenceFailures.wrap("listing users", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public long countUsers(Role role, Status status) {
        try {
            return userRepository.count(role, status);
        } catch (DataAccessException | TransactionException e) {
            throw PersistenceFailures.wrap("counting users", e);
        }
    }

    private String encodePassword(String password) {
        try {
            return encoder.encode(password);
        } catch (IllegalArgumentException e) {
            throw PersistenceFailures.wrap("hashing password", e);
        }
    }
}
