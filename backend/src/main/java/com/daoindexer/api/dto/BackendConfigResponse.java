package com.daoindexer.api.dto;

import com.daoindexer.domain.Category;
import com.daoindexer.domain.Language;

import java.util.List;

/**
 * GET /api/config.
 */
public record BackendConfigResponse(
        String masterContractAddress,
        boolean mainnet,
        List<Category> categories,
        List<Language> languages
) {
}
