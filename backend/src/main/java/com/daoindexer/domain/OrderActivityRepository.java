package com.daoindexer.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface OrderActivityRepository extends MongoRepository<OrderActivity, String> {

    List<OrderActivity> findBySenderAddressOrderByTimestampDesc(String senderAddress, Pageable pageable);

    List<OrderActivity> findByOrderIdOrderByTimestampDesc(long orderId, Pageable pageable);
}
