package com.realgaming.marketplace.adapter.out.persistence.repository;

import com.realgaming.marketplace.domain.model.Role;
import com.realgaming.marketplace.domain.model.Status;
import com.realgaming.marketplace.domain.model.User;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface UserJpaRepository extends JpaRepository<User, UUID> {

    Optional<User> findByEmail(String email);

    @Query("""
            select u from User u
            where (:role is null or u.role = :role)
              and (:status is null or u.status = :status)
            """)
    List<User> findAllByFilter(@Param("role") Role role, @Param("status") Status status, Pageable pageable);

    @Query("""
            select count(u) from User u
            where (:role is null or u.role = :role)
              and (:status is null or u.status = :status)
            """)
    long countByFilter(@Param("role") Role role, @Param("status") Status status);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update User u set u.status = :status, u.updatedAt = :updatedAt where u.userId = :userId")
    int updateStatus(@Param("userId") UUID userId,
                     @Param("status") Status status,
                     @Param("updatedAt") LocalDateTime updatedAt);
}
