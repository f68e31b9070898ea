package com.daoindexer.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Freelancer's bid on an order.
 */
@Document(collection = "order_responses")
@NoArgsConstructor
@Getter
@Setter
public class OrderResponse {

    @Id
    private String id;
    @Indexed
    private long orderId;
    private String freelancerAddress;
    private String text;
    private BigDecimal price;
    private Instant timestamp;

    @Transient
    private User freelancer;

    public OrderResponse(long orderId, String freelancerAddress, BigDecimal price) {
        this.orderId = orderId;
        this.freelancerAddress = freelancerAddress;
        this.price = price;
        this.timestamp = Instant.now();
    }
}
