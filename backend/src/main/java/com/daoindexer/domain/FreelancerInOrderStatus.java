package com.daoindexer.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Where an order stands from a freelancer's point of view. {@link #RESPONSE_SENT} and {@link #RESPONSE_DENIED}
 * cover orders the user only bid on; the rest cover orders assigned to the user.
 */
public enum FreelancerInOrderStatus {
    RESPONSE_SENT("responseSent"),
    RESPONSE_DENIED("responseDenied"),
    AN_OFFER_CAME_IN("anOfferCameIn"),
    IN_THE_WORK("inTheWork"),
    ON_INSPECTION("onInspection"),
    ARBITRATION("arbitration"),
    TERMINATED("terminated");

    private final String key;

    FreelancerInOrderStatus(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<FreelancerInOrderStatus> fromKey(String value) {
        return Arrays.stream(values()).filter(s -> s.key.equalsIgnoreCase(value)).findFirst();
    }
}
