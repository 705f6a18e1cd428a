package com.realgaming.marketplace.application.port.out;

import com.realgaming.marketplace.domain.model.Role;
import com.realgaming.marketplace.domain.model.Status;
import com.realgaming.marketplace.domain.model.User;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * users 테이블 접근. 조회 결과가 없으면 예외가 아니라 {@link Optional#empty()}를 돌려준다.
 */
public interface UserRepositoryPort {
    User create(User user);
    Optional<User> findById(UUID userId);
    Optional<User> findByEmail(String email);
    User update(User user);
    void updateStatus(UUID userId, Status status);

    /**
     * role, status 가 null 이면 해당 조건은 무시한다. 최신 가입 순.
     */
    List<User> findAll(Role role, Status status, int limit, int offset);
    long count(Role role, Status status);
}
