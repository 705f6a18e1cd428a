package com.realgaming.marketplace.application.port.in.user;

import com.realgaming.marketplace.application.port.in.UserResult;
import com.realgaming.marketplace.domain.model.Role;
import com.realgaming.marketplace.domain.model.Status;

import java.util.List;

public interface ListUsersUseCase {
    List<UserResult> listUsers(Query query);
    long countUsers(Role role, Status status);

    /**
     * page, limit 은 1 이상이어야 한다. 기본값과 상한은 호출하는 쪽에서 정한다.
     */
    record Query(
            Role role,
            Status status,
            int page,
            int limit
    ) {}
}
