package com.daoindexer.domain;

import java.util.Optional;

public interface UserRepository extends TrackedEntityRepository<User> {

    Optional<User> findFirstByAddress(String address);
}
