package com.daoindexer.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One operation seen on an order contract.
 */
@Document(collection = "order_activities")
@CompoundIndexes({
        @CompoundIndex(name = "order_ts", def = "{'orderId': 1, 'timestamp': -1}"),
        @CompoundIndex(name = "sender_ts", def = "{'senderAddress': 1, 'timestamp': -1}")
})
@NoArgsConstructor
@Getter
@Setter
public class OrderActivity {

    @Id
    private String id;
    private long orderId;
    private String senderAddress;
    private int opCode;
    private BigDecimal amount;
    private Instant timestamp;
    private String txHash;

    @Transient
    private Order order;
    @Transient
    private User sender;
}
