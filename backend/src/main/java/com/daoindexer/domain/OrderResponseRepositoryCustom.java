package com.daoindexer.domain;

import java.util.List;

/**
 * Custom queries for order_responses.
 */
public interface OrderResponseRepositoryCustom {

    /** Distinct freelancer addresses that responded to the order. */
    List<String> findDistinctFreelancerAddressesByOrderId(long orderId);
}
