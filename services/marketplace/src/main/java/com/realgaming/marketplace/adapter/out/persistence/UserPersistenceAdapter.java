package com.realgaming.marketplace.adapter.out.persistence;

import com.realgaming.marketplace.adapter.out.persistence.repository.UserJpaRepository;
import com.realgaming.marketplace.application.port.out.UserRepositoryPort;
import com.realgaming.marketplace.domain.model.Role;
import com.realgaming.marketplace.domain.model.Status;
import com.realgaming.marketplace.domain.model.User;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class UserPersistenceAdapter implements UserRepositoryPort {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final UserJpaRepository repository;

    @Override
    public User create(User user) {
        // flush 해야 unique 제약 위반이 여기서 드러난다
        return repository.saveAndFlush(user);
    }

    @Override
    public Optional<User> findById(UUID userId) {
        return repository.findById(userId);
    }

    @Override
    public Optional<User> findByEmail(String email) {
        return repository.findByEmail(email);
    }

    @Override
    public User update(User user) {
        return repository.saveAndFlush(user);
    }

    @Override
    public void updateStatus(UUID userId, Status status) {
        repository.updateStatus(userId, status, LocalDateTime.now());
    }

    @Override
    public List<User> findAll(Role role, Status status, int limit, int offset) {
        // offset 은 항상 limit 의 배수
        PageRequest pageable = PageRequest.of(offset / limit, limit, NEWEST_FIRST);
        return repository.findAllByFilter(role, status, pageable);
    }

    @Override
    public long count(Role role, Status status) {
        return repository.countByFilter(role, status);
    }
}
