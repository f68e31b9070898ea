package com.daoindexer.ingestion.refresh;

import com.daoindexer.domain.EntityType;
import com.daoindexer.domain.Order;
import com.daoindexer.domain.OrderRepository;
import com.daoindexer.ingestion.parser.ContractDataParser;
import org.springframework.stereotype.Component;

/**
 * Order refresh. Transient joins (customer, freelancer, translations) are never persisted.
 */
@Component
public class OrderRefresher extends AbstractEntityRefresher<Order> {

    private final ContractDataParser parser;

    public OrderRefresher(OrderRepository repository, ContractDataParser parser) {
        super(repository);
        this.parser = parser;
    }

    @Override
    public EntityType entityType() {
        return EntityType.ORDER;
    }

    @Override
    protected Order copyOf(Order stored) {
        return new Order(stored);
    }

    @Override
    protected void parse(Order copy) {
        parser.updateOrder(copy);
    }
}
