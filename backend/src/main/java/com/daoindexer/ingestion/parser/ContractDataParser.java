package com.daoindexer.ingestion.parser;

import com.daoindexer.domain.Admin;
import com.daoindexer.domain.Order;
import com.daoindexer.domain.User;

/**
 * Populates an entity from its contract's current on-chain state and sets {@code lastSync} to the
 * freshness actually achieved. Implementations may leave the passed entity half-updated on failure;
 * callers hand in a copy.
 */
public interface ContractDataParser {

    void updateAdmin(Admin admin);

    void updateUser(User user);

    void updateOrder(Order order);
}
