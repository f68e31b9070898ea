package com.daoindexer.api.dto;

import java.util.Map;

/**
 * Order counts of one user by their status in the order. Every status is listed, zeros included;
 * the freelancer map also carries {@code completedTotal} and {@code failedTotal}.
 */
public record UserRoleStatResponse(
        Map<String, Long> asCustomerByStatus,
        Map<String, Long> asFreelancerByStatus
) {
}
