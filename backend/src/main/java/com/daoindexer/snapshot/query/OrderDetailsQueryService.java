package com.daoindexer.snapshot.query;

import com.daoindexer.domain.Order;
import com.daoindexer.domain.OrderActivity;
import com.daoindexer.domain.OrderActivityRepository;
import com.daoindexer.domain.OrderResponse;
import com.daoindexer.domain.OrderResponseRepository;
import com.daoindexer.domain.User;
import com.daoindexer.snapshot.CachedSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Detail lists not kept in the snapshot. Rows are read from the store on every call and linked to
 * entities of the snapshot the caller is serving from.
 */
@Service
@RequiredArgsConstructor
public class OrderDetailsQueryService {

    private final OrderActivityRepository orderActivityRepository;
    private final OrderResponseRepository orderResponseRepository;

    /** Activity sent by the user, newest first, each linked to its order. */
    public List<OrderActivity> userActivity(CachedSnapshot data, User user, int page, int pageSize) {
        List<OrderActivity> list = orderActivityRepository.findBySenderAddressOrderByTimestampDesc(
                user.getUserAddress(), PageRequest.of(page, pageSize));
        for (OrderActivity item : list) {
            item.setOrder(data.findOrder(item.getOrderId()).orElse(null));
        }
        return list;
    }

    /** Activity on the order, newest first, each linked to its sender. */
    public List<OrderActivity> orderActivity(CachedSnapshot data, Order order, int page, int pageSize) {
        List<OrderActivity> list = orderActivityRepository.findByOrderIdOrderByTimestampDesc(
                order.getIndex(), PageRequest.of(page, pageSize));
        for (OrderActivity item : list) {
            item.setSender(data.findUserByAddress(item.getSenderAddress()).orElse(null));
        }
        return list;
    }

    /** All responses to the order, highest price first. */
    public List<OrderResponse> orderResponses(CachedSnapshot data, Order order) {
        List<OrderResponse> list = orderResponseRepository.findByOrderIdOrderByPriceDesc(order.getIndex());
        for (OrderResponse item : list) {
            item.setFreelancer(data.findUserByAddress(item.getFreelancerAddress()).orElse(null));
        }
        return list;
    }

    public Optional<OrderResponse> responseOf(long orderIndex, String freelancerAddress) {
        return orderResponseRepository.findFirstByOrderIdAndFreelancerAddress(orderIndex, freelancerAddress);
    }
}
