package com.daoindexer.domain;

import java.util.Optional;

public interface AdminRepository extends TrackedEntityRepository<Admin> {

    Optional<Admin> findFirstByAddress(String address);
}
