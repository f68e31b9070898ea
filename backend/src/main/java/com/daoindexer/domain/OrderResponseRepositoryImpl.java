package com.daoindexer.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;

/**
 * Distinct lookup via MongoTemplate.findDistinct.
 */
@RequiredArgsConstructor
public class OrderResponseRepositoryImpl implements OrderResponseRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public List<String> findDistinctFreelancerAddressesByOrderId(long orderId) {
        Query query = new Query(Criteria.where("orderId").is(orderId));
        return mongoTemplate.findDistinct(query, "freelancerAddress", OrderResponse.class, String.class);
    }
}
