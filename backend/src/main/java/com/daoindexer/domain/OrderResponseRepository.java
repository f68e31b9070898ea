package com.daoindexer.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface OrderResponseRepository extends MongoRepository<OrderResponse, String>, OrderResponseRepositoryCustom {

    /** Highest price first. */
    List<OrderResponse> findByOrderIdOrderByPriceDesc(long orderId);

    Optional<OrderResponse> findFirstByOrderIdAndFreelancerAddress(long orderId, String freelancerAddress);
}
