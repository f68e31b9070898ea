package com.daoindexer.domain;

import java.util.Optional;

public interface OrderRepository extends TrackedEntityRepository<Order> {

    Optional<Order> findFirstByAddress(String address);
}
