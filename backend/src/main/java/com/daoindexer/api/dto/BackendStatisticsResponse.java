package com.daoindexer.api.dto;

import com.daoindexer.domain.UserStatus;

import java.util.Map;

/**
 * GET /api/stat. Drill-down maps only contain non-zero counts.
 */
public record BackendStatisticsResponse(
        int orderCount,
        Map<Integer, Integer> orderCountByStatus,
        Map<String, Integer> orderCountByCategory,
        Map<String, Integer> orderCountByLanguage,
        int userCount,
        Map<UserStatus, Integer> userCountByStatus,
        Map<String, Integer> userCountByLanguage
) {
}
