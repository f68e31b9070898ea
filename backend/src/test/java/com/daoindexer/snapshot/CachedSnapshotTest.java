package com.daoindexer.snapshot;

import com.daoindexer.domain.Language;
import com.daoindexer.domain.Order;
import com.daoindexer.domain.User;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CachedSnapshotTest {

    private static Order order(long index, String address) {
        Order order = new Order();
        order.setIndex(index);
        order.setAddress(address);
        order.setStatus(Order.STATUS_ACTIVE);
        return order;
    }

    private static User user(long index, String userAddress) {
        User user = new User();
        user.setIndex(index);
        user.setUserAddress(userAddress);
        return user;
    }

    private static CachedSnapshot snapshot(List<Order> orders, Map<String, List<Order>> translated) {
        return new CachedSnapshot("EQmaster", false, 10L, List.of(), List.of(user(1, "EQu1")), orders, orders,
                List.of(), List.of(new Language("lang-en", "English")), translated,
                Map.of(), Map.of(), Map.of(), Map.of(), Map.of(), Map.of(1L, Set.of("EQu1")), Instant.now());
    }

    @Test
    @DisplayName("empty snapshot has no data and a built time of epoch")
    void empty() {
        CachedSnapshot empty = CachedSnapshot.empty();

        assertThat(empty.allOrders()).isEmpty();
        assertThat(empty.activeOrdersTranslated()).isEmpty();
        assertThat(empty.builtAt()).isEqualTo(Instant.EPOCH);
        assertThat(empty.translatedActiveOrders("English")).isEmpty();
        assertThat(empty.respondersOf(1)).isEmpty();
    }

    @Test
    @DisplayName("collections are copied and cannot be modified")
    void immutable() {
        List<Order> orders = new ArrayList<>(List.of(order(1, "EQo1")));
        Map<String, List<Order>> translated = new HashMap<>();
        translated.put("lang-en", orders);
        CachedSnapshot snapshot = snapshot(orders, translated);

        orders.add(order(2, "EQo2"));
        translated.clear();

        assertThat(snapshot.allOrders()).hasSize(1);
        assertThat(snapshot.translatedActiveOrders("lang-en").orElseThrow()).hasSize(1);
        assertThatThrownBy(() -> snapshot.allOrders().add(order(3, "EQo3")))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> snapshot.activeOrdersTranslated().put("x", List.of()))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("both keys of one language still share one list after copying")
    void translatedKeysShareList() {
        List<Order> orders = List.of(order(1, "EQo1"));
        Map<String, List<Order>> translated = new HashMap<>();
        translated.put("lang-en", orders);
        translated.put("English", orders);

        CachedSnapshot snapshot = snapshot(orders, translated);

        assertThat(snapshot.translatedActiveOrders("LANG-EN").orElseThrow())
                .isSameAs(snapshot.translatedActiveOrders("english").orElseThrow());
        assertThat(snapshot.translatedActiveOrders(null)).isEmpty();
    }

    @Test
    void lookups() {
        CachedSnapshot snapshot = snapshot(List.of(order(1, "EQo1"), order(2, "EQo2")), Map.of());

        assertThat(snapshot.findOrder(2)).map(Order::getAddress).contains("EQo2");
        assertThat(snapshot.findOrderByAddress("EQo1")).map(Order::getIndex).contains(1L);
        assertThat(snapshot.findOrder(9)).isEmpty();
        assertThat(snapshot.findUserByAddress("EQu1")).isPresent();
        assertThat(snapshot.findUser(5)).isEmpty();
        assertThat(snapshot.findLanguage("ENGLISH")).map(Language::getHash).contains("lang-en");
        assertThat(snapshot.respondersOf(1)).containsExactly("EQu1");
    }
}
