package com.daoindexer.snapshot;

import com.daoindexer.domain.CustomerInOrderStatus;
import com.daoindexer.domain.FreelancerInOrderStatus;
import com.daoindexer.domain.Order;

import java.util.Objects;
import java.util.stream.Stream;

/**
 * Selects a user's orders by their status from the user's side. Addresses are compared exactly.
 *
 * <p>Bids are only known for active orders, so {@link FreelancerInOrderStatus#RESPONSE_SENT} sees active orders
 * the user responded to, and {@link FreelancerInOrderStatus#RESPONSE_DENIED} sees orders that went to another
 * freelancer while the user's bid was still on record.
 */
public final class UserOrders {

    private UserOrders() {
    }

    public static Stream<Order> asCustomer(CachedSnapshot data, String userAddress, CustomerInOrderStatus status) {
        Stream<Order> own = data.allOrders().stream().filter(o -> Objects.equals(o.getCustomerAddress(), userAddress));
        return switch (status) {
            case ON_MODERATION -> own.filter(o -> o.getStatus() == Order.STATUS_MODERATION);
            case NO_RESPONSES -> own.filter(o -> o.getStatus() == Order.STATUS_ACTIVE && o.getResponsesCount() == 0);
            case HAVE_RESPONSES -> own.filter(o -> o.getStatus() == Order.STATUS_ACTIVE && o.getResponsesCount() > 0);
            case OFFER_MADE -> own.filter(o -> o.getStatus() == Order.STATUS_OFFER_MADE);
            case IN_THE_WORK -> own.filter(o -> o.getStatus() == Order.STATUS_IN_WORK);
            case PENDING_PAYMENT -> own.filter(o -> o.getStatus() == Order.STATUS_PENDING_PAYMENT);
            case ARBITRATION -> own.filter(UserOrders::inArbitration);
            case COMPLETED -> own.filter(UserOrders::isFinished);
        };
    }

    public static Stream<Order> asFreelancer(CachedSnapshot data, String userAddress, FreelancerInOrderStatus status) {
        Stream<Order> all = data.allOrders().stream();
        Stream<Order> assigned = data.allOrders().stream().filter(o -> Objects.equals(o.getFreelancerAddress(), userAddress));
        return switch (status) {
            case RESPONSE_SENT -> all.filter(o -> o.getStatus() == Order.STATUS_ACTIVE
                    && data.respondersOf(o.getIndex()).contains(userAddress));
            case RESPONSE_DENIED -> all.filter(o -> o.getStatus() == Order.STATUS_OFFER_MADE
                    && !Objects.equals(o.getFreelancerAddress(), userAddress)
                    && data.respondersOf(o.getIndex()).contains(userAddress));
            case AN_OFFER_CAME_IN -> assigned.filter(o -> o.getStatus() == Order.STATUS_OFFER_MADE);
            case IN_THE_WORK -> assigned.filter(o -> o.getStatus() == Order.STATUS_IN_WORK);
            case ON_INSPECTION -> assigned.filter(o -> o.getStatus() == Order.STATUS_PENDING_PAYMENT);
            case ARBITRATION -> assigned.filter(UserOrders::inArbitration);
            case TERMINATED -> assigned.filter(UserOrders::isFinished);
        };
    }

    /** Paid to the freelancer: completed, payment forced, or arbitration awarded the freelancer 100%. */
    public static long completedAsFreelancer(CachedSnapshot data, String userAddress) {
        return data.allOrders().stream()
                .filter(o -> Objects.equals(o.getFreelancerAddress(), userAddress))
                .filter(o -> o.getStatus() == Order.STATUS_COMPLETED
                        || o.getStatus() == Order.STATUS_PAYMENT_FORCED
                        || (o.getStatus() == Order.STATUS_ARBITRATION_SOLVED && o.getArbitrationFreelancerPart() >= 100))
                .count();
    }

    /** Refunded to the customer, or arbitration gave the freelancer less than 100%. */
    public static long failedAsFreelancer(CachedSnapshot data, String userAddress) {
        return data.allOrders().stream()
                .filter(o -> Objects.equals(o.getFreelancerAddress(), userAddress))
                .filter(o -> o.getStatus() == Order.STATUS_REFUNDED
                        || (o.getStatus() == Order.STATUS_ARBITRATION_SOLVED && o.getArbitrationFreelancerPart() < 100))
                .count();
    }

    private static boolean inArbitration(Order order) {
        return order.getStatus() == Order.STATUS_PRE_ARBITRATION || order.getStatus() == Order.STATUS_ON_ARBITRATION;
    }

    private static boolean isFinished(Order order) {
        int status = order.getStatus();
        return status == Order.STATUS_REFUNDED
                || status == Order.STATUS_COMPLETED
                || status == Order.STATUS_PAYMENT_FORCED
                || status == Order.STATUS_ARBITRATION_SOLVED;
    }
}
