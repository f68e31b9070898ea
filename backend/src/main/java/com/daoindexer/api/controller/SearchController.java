package com.daoindexer.api.controller;

import com.daoindexer.api.dto.BackendConfigResponse;
import com.daoindexer.api.dto.BackendStatisticsResponse;
import com.daoindexer.api.dto.ErrorBody;
import com.daoindexer.api.dto.FindResult;
import com.daoindexer.api.dto.UserRoleStatResponse;
import com.daoindexer.api.dto.UserStatResponse;
import com.daoindexer.domain.CustomerInOrderStatus;
import com.daoindexer.domain.FreelancerInOrderStatus;
import com.daoindexer.domain.Language;
import com.daoindexer.domain.Order;
import com.daoindexer.domain.User;
import com.daoindexer.domain.UserStatus;
import com.daoindexer.snapshot.CachedDataHolder;
import com.daoindexer.snapshot.CachedSnapshot;
import com.daoindexer.snapshot.OrderTranslations;
import com.daoindexer.snapshot.UserOrders;
import com.daoindexer.snapshot.query.OrderDetailsQueryService;
import com.daoindexer.snapshot.query.TranslationLookupService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Read-only query surface. Everything is answered from the current snapshot, taken once per request;
 * activity and response lists are read from the store and joined against that snapshot.
 *
 * <p>{@code translateTo} accepts a language hash or name. Translated fields are null when not translated yet
 * or when the original is already in that language; clients show {@code nameTranslated ?? name}.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SearchController {

    static final int MIN_PAGE_SIZE = 10;
    static final int MAX_PAGE_SIZE = 100;

    private static final String UNKNOWN_LANGUAGE = "Unknown (unsupported) language value";

    private final CachedDataHolder cachedDataHolder;
    private final TranslationLookupService translationLookupService;
    private final OrderDetailsQueryService orderDetailsQueryService;

    @GetMapping("/config")
    public BackendConfigResponse config() {
        CachedSnapshot data = cachedDataHolder.current();
        return new BackendConfigResponse(data.masterAddress(), data.inMainnet(), data.allCategories(), data.allLanguages());
    }

    @GetMapping("/stat")
    public BackendStatisticsResponse stat() {
        CachedSnapshot data = cachedDataHolder.current();
        return new BackendStatisticsResponse(
                data.allOrders().size(),
                data.orderCountByStatus(),
                data.orderCountByCategory(),
                data.orderCountByLanguage(),
                data.allUsers().size(),
                data.userCountByStatus(),
                data.userCountByLanguage());
    }

    /**
     * Active orders matching the filter. {@code orderBy} is {@code createdAt} or {@code deadline},
     * {@code sort} is {@code asc} or {@code desc}.
     */
    @GetMapping("/search")
    public ResponseEntity<?> search(@RequestParam(required = false) String query,
                                    @RequestParam(required = false) String category,
                                    @RequestParam(required = false) String language,
                                    @RequestParam(required = false) BigDecimal minPrice,
                                    @RequestParam(defaultValue = "createdAt") String orderBy,
                                    @RequestParam(defaultValue = "asc") String sort,
                                    @RequestParam(required = false) String translateTo,
                                    @RequestParam(defaultValue = "0") int page,
                                    @RequestParam(defaultValue = "10") int pageSize) {
        Optional<ErrorBody> invalidPage = checkPage(page, pageSize);
        if (invalidPage.isPresent()) {
            return ResponseEntity.badRequest().body(invalidPage.get());
        }
        Function<Order, Instant> sortKey;
        if ("createdAt".equalsIgnoreCase(orderBy)) {
            sortKey = Order::getCreatedAt;
        } else if ("deadline".equalsIgnoreCase(orderBy)) {
            sortKey = Order::getDeadline;
        } else {
            return badRequest("orderBy", "must be 'createdAt' or 'deadline'");
        }
        Optional<Boolean> ascending = parseSort(sort);
        if (ascending.isEmpty()) {
            return badRequest("sort", "must be 'asc' or 'desc'");
        }

        CachedSnapshot data = cachedDataHolder.current();
        List<Order> source = data.activeOrders();
        if (translateTo != null && !translateTo.isEmpty()) {
            Optional<List<Order>> translated = data.translatedActiveOrders(translateTo);
            if (translated.isEmpty()) {
                return badRequest("translateTo", UNKNOWN_LANGUAGE);
            }
            source = translated.get();
        }

        Comparator<Order> comparator = Comparator.comparing(sortKey, Comparator.nullsLast(Comparator.<Instant>naturalOrder()));
        if (!ascending.get()) {
            comparator = Comparator.comparing(sortKey, Comparator.nullsLast(Comparator.<Instant>naturalOrder().reversed()));
        }
        List<Order> result = filterActiveOrders(source, query, category, language, minPrice)
                .sorted(comparator)
                .skip((long) page * pageSize)
                .limit(pageSize)
                .toList();
        return ResponseEntity.ok(result);
    }

    @GetMapping("/searchCount")
    public long searchCount(@RequestParam(required = false) String query,
                            @RequestParam(required = false) String category,
                            @RequestParam(required = false) String language,
                            @RequestParam(required = false) BigDecimal minPrice) {
        return filterActiveOrders(cachedDataHolder.current().activeOrders(), query, category, language, minPrice).count();
    }

    @GetMapping("/findUser")
    public ResponseEntity<?> findUser(@RequestParam(required = false) String address,
                                      @RequestParam(required = false) String translateTo) {
        if (address == null || address.isBlank()) {
            return badRequest("address", "Address is required.");
        }
        CachedSnapshot data = cachedDataHolder.current();
        Optional<Language> language = Optional.empty();
        if (translateTo != null && !translateTo.isEmpty()) {
            language = data.findLanguage(translateTo);
            if (language.isEmpty()) {
                return badRequest("translateTo", UNKNOWN_LANGUAGE);
            }
        }
        User user = data.findUserByAddress(address.trim()).orElse(null);
        if (user != null && language.isPresent()) {
            user = OrderTranslations.translatedCopy(user, language.get(), translationLookupService::findTranslatedText);
        }
        return ResponseEntity.ok(FindResult.of(user));
    }

    @GetMapping("/getUser")
    public ResponseEntity<?> getUser(@RequestParam long index,
                                     @RequestParam(required = false) String translateTo) {
        CachedSnapshot data = cachedDataHolder.current();
        Optional<User> user = data.findUser(index);
        if (user.isEmpty()) {
            return badRequest("index", "Invalid index (or user does not exist).");
        }
        if (translateTo == null || translateTo.isEmpty()) {
            return ResponseEntity.ok(user.get());
        }
        Optional<Language> language = data.findLanguage(translateTo);
        if (language.isEmpty()) {
            return badRequest("translateTo", UNKNOWN_LANGUAGE);
        }
        return ResponseEntity.ok(OrderTranslations.translatedCopy(user.get(), language.get(), translationLookupService::findTranslatedText));
    }

    /**
     * Order by index. With {@code currentUserIndex} the response carries that user's bid, if any.
     */
    @GetMapping("/getOrder")
    public ResponseEntity<?> getOrder(@RequestParam long index,
                                      @RequestParam(required = false) String translateTo,
                                      @RequestParam(required = false) Long currentUserIndex) {
        CachedSnapshot data = cachedDataHolder.current();
        Optional<Order> found = data.findOrder(index);
        if (found.isEmpty()) {
            return badRequest("index", "Invalid index (or order does not exist).");
        }
        User currentUser = null;
        if (currentUserIndex != null) {
            currentUser = data.findUser(currentUserIndex).orElse(null);
            if (currentUser == null) {
                return badRequest("currentUserIndex", "Invalid index (or user does not exist).");
            }
        }
        Optional<Language> language = Optional.empty();
        if (translateTo != null && !translateTo.isEmpty()) {
            language = data.findLanguage(translateTo);
            if (language.isEmpty()) {
                return badRequest("translateTo", UNKNOWN_LANGUAGE);
            }
        }

        Order order = language.isPresent()
                ? OrderTranslations.translatedCopy(found.get(), language.get(), translationLookupService::findTranslatedText)
                : new Order(found.get());
        if (currentUser != null) {
            order.setCurrentUserResponse(orderDetailsQueryService
                    .responseOf(order.getIndex(), currentUser.getUserAddress())
                    .orElse(null));
        }
        return ResponseEntity.ok(order);
    }

    @GetMapping("/findOrder")
    public ResponseEntity<?> findOrder(@RequestParam(required = false) String address,
                                       @RequestParam(required = false) String translateTo) {
        if (address == null || address.isBlank()) {
            return badRequest("address", "Address is required.");
        }
        CachedSnapshot data = cachedDataHolder.current();
        Optional<Language> language = Optional.empty();
        if (translateTo != null && !translateTo.isEmpty()) {
            language = data.findLanguage(translateTo);
            if (language.isEmpty()) {
                return badRequest("translateTo", UNKNOWN_LANGUAGE);
            }
        }
        Order order = data.findOrderByAddress(address.trim()).orElse(null);
        if (order != null && language.isPresent()) {
            order = OrderTranslations.translatedCopy(order, language.get(), translationLookupService::findTranslatedText);
        }
        return ResponseEntity.ok(FindResult.of(order));
    }

    /** Order counts by status, as customer and as freelancer. Only non-zero statuses are listed. */
    @GetMapping("/getUserStats")
    public ResponseEntity<?> getUserStats(@RequestParam long index) {
        CachedSnapshot data = cachedDataHolder.current();
        Optional<User> user = data.findUser(index);
        if (user.isEmpty()) {
            return badRequest("index", "Invalid index (or user does not exist).");
        }
        String address = user.get().getUserAddress();
        Map<Integer, Integer> asCustomer = countByStatus(data.allOrders().stream()
                .filter(o -> Objects.equals(o.getCustomerAddress(), address)));
        Map<Integer, Integer> asFreelancer = countByStatus(data.allOrders().stream()
                .filter(o -> Objects.equals(o.getFreelancerAddress(), address)));
        return ResponseEntity.ok(new UserStatResponse(
                asCustomer.values().stream().mapToInt(Integer::intValue).sum(),
                asCustomer,
                asFreelancer.values().stream().mapToInt(Integer::intValue).sum(),
                asFreelancer));
    }

    /**
     * Order counts by the user's status in the order, see {@link CustomerInOrderStatus} and
     * {@link FreelancerInOrderStatus}. Use {@code getUserOrders} to list the orders behind one count.
     */
    @GetMapping("/getUserStats2")
    public ResponseEntity<?> getUserStats2(@RequestParam long index) {
        CachedSnapshot data = cachedDataHolder.current();
        Optional<User> user = data.findUser(index);
        if (user.isEmpty()) {
            return badRequest("index", "Invalid index (or user does not exist).");
        }
        String address = user.get().getUserAddress();
        Map<String, Long> asCustomer = new LinkedHashMap<>();
        for (CustomerInOrderStatus status : CustomerInOrderStatus.values()) {
            asCustomer.put(status.key(), UserOrders.asCustomer(data, address, status).count());
        }
        Map<String, Long> asFreelancer = new LinkedHashMap<>();
        for (FreelancerInOrderStatus status : FreelancerInOrderStatus.values()) {
            asFreelancer.put(status.key(), UserOrders.asFreelancer(data, address, status).count());
        }
        asFreelancer.put("completedTotal", UserOrders.completedAsFreelancer(data, address));
        asFreelancer.put("failedTotal", UserOrders.failedAsFreelancer(data, address));
        return ResponseEntity.ok(new UserRoleStatResponse(asCustomer, asFreelancer));
    }

    /**
     * The user's orders in one status, highest index first. Exactly one of {@code customerStatus} and
     * {@code freelancerStatus} must be given; both are matched ignoring case.
     */
    @GetMapping("/getUserOrders")
    public ResponseEntity<?> getUserOrders(@RequestParam long index,
                                           @RequestParam(required = false) String customerStatus,
                                           @RequestParam(required = false) String freelancerStatus,
                                           @RequestParam(required = false) String translateTo) {
        boolean byCustomer = customerStatus != null && !customerStatus.isEmpty();
        boolean byFreelancer = freelancerStatus != null && !freelancerStatus.isEmpty();
        if (byCustomer == byFreelancer) {
            return badRequest("freelancerStatus", "Exactly one of 'customerStatus' and 'freelancerStatus' must be set.");
        }
        Optional<CustomerInOrderStatus> asCustomer = Optional.empty();
        Optional<FreelancerInOrderStatus> asFreelancer = Optional.empty();
        if (byCustomer) {
            asCustomer = CustomerInOrderStatus.fromKey(customerStatus);
            if (asCustomer.isEmpty()) {
                return badRequest("customerStatus", "Unknown status value");
            }
        } else {
            asFreelancer = FreelancerInOrderStatus.fromKey(freelancerStatus);
            if (asFreelancer.isEmpty()) {
                return badRequest("freelancerStatus", "Unknown status value");
            }
        }

        CachedSnapshot data = cachedDataHolder.current();
        Optional<Language> language = Optional.empty();
        if (translateTo != null && !translateTo.isEmpty()) {
            language = data.findLanguage(translateTo);
            if (language.isEmpty()) {
                return badRequest("translateTo", UNKNOWN_LANGUAGE);
            }
        }
        Optional<User> user = data.findUser(index);
        if (user.isEmpty()) {
            return badRequest("index", "Invalid index (or user does not exist).");
        }

        String address = user.get().getUserAddress();
        Stream<Order> orders = asCustomer.isPresent()
                ? UserOrders.asCustomer(data, address, asCustomer.get())
                : UserOrders.asFreelancer(data, address, asFreelancer.get());
        Stream<Order> sorted = orders.sorted(Comparator.comparing(Order::getIndex).reversed());
        if (language.isPresent()) {
            Language target = language.get();
            sorted = sorted.map(o -> OrderTranslations.translatedCopy(o, target, translationLookupService::findTranslatedText));
        }
        return ResponseEntity.ok(sorted.toList());
    }

    /** The user's operations on orders, newest first. */
    @GetMapping("/getUserActivity")
    public ResponseEntity<?> getUserActivity(@RequestParam long index,
                                             @RequestParam(defaultValue = "0") int page,
                                             @RequestParam(defaultValue = "10") int pageSize) {
        Optional<ErrorBody> invalidPage = checkPage(page, pageSize);
        if (invalidPage.isPresent()) {
            return ResponseEntity.badRequest().body(invalidPage.get());
        }
        CachedSnapshot data = cachedDataHolder.current();
        Optional<User> user = data.findUser(index);
        if (user.isEmpty()) {
            return badRequest("index", "Invalid index (or user does not exist).");
        }
        return ResponseEntity.ok(orderDetailsQueryService.userActivity(data, user.get(), page, pageSize));
    }

    @GetMapping("/getOrderActivity")
    public ResponseEntity<?> getOrderActivity(@RequestParam long index,
                                              @RequestParam(defaultValue = "0") int page,
                                              @RequestParam(defaultValue = "10") int pageSize) {
        Optional<ErrorBody> invalidPage = checkPage(page, pageSize);
        if (invalidPage.isPresent()) {
            return ResponseEntity.badRequest().body(invalidPage.get());
        }
        CachedSnapshot data = cachedDataHolder.current();
        Optional<Order> order = data.findOrder(index);
        if (order.isEmpty()) {
            return badRequest("index", "Invalid index (or order does not exist).");
        }
        return ResponseEntity.ok(orderDetailsQueryService.orderActivity(data, order.get(), page, pageSize));
    }

    /**
     * All responses to the order, highest price first. A contract holds at most 255 responses, so there is no paging.
     */
    @GetMapping("/getOrderResponses")
    public ResponseEntity<?> getOrderResponses(@RequestParam long index) {
        CachedSnapshot data = cachedDataHolder.current();
        Optional<Order> order = data.findOrder(index);
        if (order.isEmpty()) {
            return badRequest("index", "Invalid index (or order does not exist).");
        }
        return ResponseEntity.ok(orderDetailsQueryService.orderResponses(data, order.get()));
    }

    /** All orders by index, without translations and without linked users. */
    @GetMapping("/listOrders")
    public ResponseEntity<?> listOrders(@RequestParam(required = false) Integer status,
                                        @RequestParam(required = false) String category,
                                        @RequestParam(required = false) String language,
                                        @RequestParam(defaultValue = "asc") String sort,
                                        @RequestParam(defaultValue = "0") int page,
                                        @RequestParam(defaultValue = "10") int pageSize) {
        Optional<ErrorBody> invalidPage = checkPage(page, pageSize);
        if (invalidPage.isPresent()) {
            return ResponseEntity.badRequest().body(invalidPage.get());
        }
        Optional<Boolean> ascending = parseSort(sort);
        if (ascending.isEmpty()) {
            return badRequest("sort", "must be 'asc' or 'desc'");
        }
        Comparator<Order> byIndex = Comparator.comparing(Order::getIndex);
        List<Order> result = cachedDataHolder.current().allOrders().stream()
                .filter(o -> status == null || o.getStatus() == status)
                .filter(o -> category == null || category.isEmpty() || category.equals(o.getCategory()))
                .filter(o -> language == null || language.isEmpty() || language.equals(o.getLanguage()))
                .sorted(ascending.get() ? byIndex : byIndex.reversed())
                .skip((long) page * pageSize)
                .limit(pageSize)
                .map(o -> {
                    Order copy = new Order(o);
                    copy.setCustomer(null);
                    copy.setFreelancer(null);
                    return copy;
                })
                .toList();
        return ResponseEntity.ok(result);
    }

    @GetMapping("/listUsers")
    public ResponseEntity<?> listUsers(@RequestParam(required = false) String status,
                                       @RequestParam(required = false) String language,
                                       @RequestParam(defaultValue = "asc") String sort,
                                       @RequestParam(defaultValue = "0") int page,
                                       @RequestParam(defaultValue = "10") int pageSize) {
        Optional<ErrorBody> invalidPage = checkPage(page, pageSize);
        if (invalidPage.isPresent()) {
            return ResponseEntity.badRequest().body(invalidPage.get());
        }
        Optional<Boolean> ascending = parseSort(sort);
        if (ascending.isEmpty()) {
            return badRequest("sort", "must be 'asc' or 'desc'");
        }
        UserStatus userStatus = null;
        if (status != null && !status.isEmpty()) {
            userStatus = Arrays.stream(UserStatus.values())
                    .filter(s -> s.name().equalsIgnoreCase(status))
                    .findFirst()
                    .orElse(null);
            if (userStatus == null) {
                return badRequest("status", "must be 'active', 'moderation' or 'banned'");
            }
        }
        UserStatus wanted = userStatus;
        Comparator<User> byIndex = Comparator.comparing(User::getIndex);
        List<User> result = cachedDataHolder.current().allUsers().stream()
                .filter(u -> wanted == null || u.getUserStatus() == wanted)
                .filter(u -> language == null || language.isEmpty() || language.equals(u.getLanguage()))
                .sorted(ascending.get() ? byIndex : byIndex.reversed())
                .skip((long) page * pageSize)
                .limit(pageSize)
                .toList();
        return ResponseEntity.ok(result);
    }

    static Stream<Order> filterActiveOrders(List<Order> source, String query, String category, String language,
                                            BigDecimal minPrice) {
        Stream<Order> list = source.stream();
        if (category != null && !category.isBlank()) {
            list = list.filter(o -> category.equalsIgnoreCase(o.getCategory()));
        }
        if (language != null && !language.isBlank()) {
            list = list.filter(o -> language.equalsIgnoreCase(o.getLanguage()));
        }
        if (minPrice != null) {
            list = list.filter(o -> o.getPrice() != null && o.getPrice().compareTo(minPrice) >= 0);
        }
        if (query != null && !query.isBlank()) {
            String[] words = query.toUpperCase(Locale.ROOT).trim().split("\\s+");
            list = list.filter(o -> {
                String text = o.searchableText();
                return Arrays.stream(words).allMatch(text::contains);
            });
        }
        return list;
    }

    private static Map<Integer, Integer> countByStatus(Stream<Order> orders) {
        Map<Integer, Integer> counts = new LinkedHashMap<>();
        orders.forEach(o -> counts.merge(o.getStatus(), 1, Integer::sum));
        return counts;
    }

    private static Optional<ErrorBody> checkPage(int page, int pageSize) {
        if (page < 0) {
            return Optional.of(ErrorBody.of("INVALID_REQUEST", "page: must be 0 or greater"));
        }
        if (pageSize < MIN_PAGE_SIZE || pageSize > MAX_PAGE_SIZE) {
            return Optional.of(ErrorBody.of("INVALID_REQUEST",
                    "pageSize: must be between " + MIN_PAGE_SIZE + " and " + MAX_PAGE_SIZE));
        }
        return Optional.empty();
    }

    private static Optional<Boolean> parseSort(String sort) {
        if ("asc".equalsIgnoreCase(sort)) {
            return Optional.of(true);
        }
        if ("desc".equalsIgnoreCase(sort)) {
            return Optional.of(false);
        }
        return Optional.empty();
    }

    private static ResponseEntity<ErrorBody> badRequest(String field, String message) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", field + ": " + message));
    }
}
