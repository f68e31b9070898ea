package com.daoindexer.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Where an order stands from its customer's point of view. Several contract statuses fold into one value:
 * {@link #ARBITRATION} is pre-arbitration or arbitration, {@link #COMPLETED} is any final status.
 */
public enum CustomerInOrderStatus {
    ON_MODERATION("onModeration"),
    NO_RESPONSES("noResponses"),
    HAVE_RESPONSES("haveResponses"),
    OFFER_MADE("offerMade"),
    IN_THE_WORK("inTheWork"),
    PENDING_PAYMENT("pendingPayment"),
    ARBITRATION("arbitration"),
    COMPLETED("completed");

    private final String key;

    CustomerInOrderStatus(String key) {
        this.key = key;
    }

    /** Name used in API payloads and accepted, ignoring case, as a request parameter. */
    public String key() {
        return key;
    }

    public static Optional<CustomerInOrderStatus> fromKey(String value) {
        return Arrays.stream(values()).filter(s -> s.key.equalsIgnoreCase(value)).findFirst();
    }
}
