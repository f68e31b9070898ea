package com.daoindexer.snapshot;

import com.daoindexer.domain.Admin;
import com.daoindexer.domain.Category;
import com.daoindexer.domain.Language;
import com.daoindexer.domain.Order;
import com.daoindexer.domain.User;
import com.daoindexer.domain.UserStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Point-in-time read model published by {@link CachedDataRebuildJob}. All collections are unmodifiable;
 * the entities inside are never mutated after publication, readers that need to change one work on a copy.
 *
 * <p>{@code activeOrdersTranslated} is keyed by both the language hash and the language name, case-insensitive,
 * and both keys of one language map to the same list instance.
 */
public record CachedSnapshot(
        String masterAddress,
        boolean inMainnet,
        long lastKnownSeqno,
        List<Admin> allAdmins,
        List<User> allUsers,
        List<Order> allOrders,
        List<Order> activeOrders,
        List<Category> allCategories,
        List<Language> allLanguages,
        Map<String, List<Order>> activeOrdersTranslated,
        Map<Integer, Integer> orderCountByStatus,
        Map<String, Integer> orderCountByCategory,
        Map<String, Integer> orderCountByLanguage,
        Map<UserStatus, Integer> userCountByStatus,
        Map<String, Integer> userCountByLanguage,
        Map<Long, Set<String>> activeOrdersUsersResponded,
        Instant builtAt
) {

    public CachedSnapshot {
        masterAddress = masterAddress != null ? masterAddress : "";
        allAdmins = List.copyOf(allAdmins);
        allUsers = List.copyOf(allUsers);
        allOrders = List.copyOf(allOrders);
        activeOrders = List.copyOf(activeOrders);
        allCategories = List.copyOf(allCategories);
        allLanguages = List.copyOf(allLanguages);
        activeOrdersTranslated = translatedView(activeOrdersTranslated);
        orderCountByStatus = Collections.unmodifiableMap(new LinkedHashMap<>(orderCountByStatus));
        orderCountByCategory = Collections.unmodifiableMap(new LinkedHashMap<>(orderCountByCategory));
        orderCountByLanguage = Collections.unmodifiableMap(new LinkedHashMap<>(orderCountByLanguage));
        userCountByStatus = Collections.unmodifiableMap(new LinkedHashMap<>(userCountByStatus));
        userCountByLanguage = Collections.unmodifiableMap(new LinkedHashMap<>(userCountByLanguage));
        activeOrdersUsersResponded = respondedView(activeOrdersUsersResponded);
        Objects.requireNonNull(builtAt, "builtAt");
    }

    /** Snapshot current before the first rebuild completes. */
    public static CachedSnapshot empty() {
        return new CachedSnapshot("", false, 0L, List.of(), List.of(), List.of(), List.of(), List.of(), List.of(),
                Map.of(), Map.of(), Map.of(), Map.of(), Map.of(), Map.of(), Map.of(), Instant.EPOCH);
    }

    /** Active orders translated into the language given by hash or name, ignoring case. */
    public Optional<List<Order>> translatedActiveOrders(String languageKeyOrName) {
        if (languageKeyOrName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(activeOrdersTranslated.get(languageKeyOrName));
    }

    public Optional<Language> findLanguage(String languageKeyOrName) {
        return allLanguages.stream().filter(l -> l.matches(languageKeyOrName)).findFirst();
    }

    public Optional<User> findUser(long index) {
        return allUsers.stream().filter(u -> u.getIndex() == index).findFirst();
    }

    public Optional<User> findUserByAddress(String userAddress) {
        return allUsers.stream().filter(u -> Objects.equals(u.getUserAddress(), userAddress)).findFirst();
    }

    public Optional<Order> findOrder(long index) {
        return allOrders.stream().filter(o -> o.getIndex() == index).findFirst();
    }

    public Optional<Order> findOrderByAddress(String address) {
        return allOrders.stream().filter(o -> Objects.equals(o.getAddress(), address)).findFirst();
    }

    public Set<String> respondersOf(long orderIndex) {
        return activeOrdersUsersResponded.getOrDefault(orderIndex, Set.of());
    }

    private static Map<String, List<Order>> translatedView(Map<String, List<Order>> source) {
        Map<List<Order>, List<Order>> copies = new IdentityHashMap<>();
        TreeMap<String, List<Order>> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        source.forEach((key, list) -> map.put(key, copies.computeIfAbsent(list, List::copyOf)));
        return Collections.unmodifiableMap(map);
    }

    private static Map<Long, Set<String>> respondedView(Map<Long, Set<String>> source) {
        Map<Long, Set<String>> map = new LinkedHashMap<>();
        source.forEach((orderIndex, addresses) -> map.put(orderIndex, Set.copyOf(addresses)));
        return Collections.unmodifiableMap(map);
    }
}
