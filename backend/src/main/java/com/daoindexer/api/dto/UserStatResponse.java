package com.daoindexer.api.dto;

import java.util.Map;

/**
 * Order counts of one user by role and order status.
 */
public record UserStatResponse(
        int asCustomerTotal,
        Map<Integer, Integer> asCustomerByStatus,
        int asFreelancerTotal,
        Map<Integer, Integer> asFreelancerByStatus
) {
}
