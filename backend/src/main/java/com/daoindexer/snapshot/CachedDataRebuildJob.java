package com.daoindexer.snapshot;

import com.daoindexer.common.RecurringWork;
import com.daoindexer.common.TaskContext;
import com.daoindexer.domain.Admin;
import com.daoindexer.domain.AdminRepository;
import com.daoindexer.domain.Category;
import com.daoindexer.domain.CategoryRepository;
import com.daoindexer.domain.Language;
import com.daoindexer.domain.LanguageRepository;
import com.daoindexer.domain.Order;
import com.daoindexer.domain.OrderRepository;
import com.daoindexer.domain.OrderResponseRepository;
import com.daoindexer.domain.Setting;
import com.daoindexer.domain.SettingRepository;
import com.daoindexer.domain.TrackedEntity;
import com.daoindexer.domain.Translation;
import com.daoindexer.domain.TranslationRepository;
import com.daoindexer.domain.User;
import com.daoindexer.domain.UserRepository;
import com.daoindexer.domain.UserStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Rebuilds the read model from the store and publishes it through {@link CachedDataHolder}.
 *
 * <p>A run either publishes a complete new snapshot or nothing: any failure is logged and the previous
 * snapshot stays current. Loaded entities are linked and counted before publication and not touched after it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CachedDataRebuildJob implements RecurringWork {

    private final SettingRepository settingRepository;
    private final AdminRepository adminRepository;
    private final UserRepository userRepository;
    private final OrderRepository orderRepository;
    private final CategoryRepository categoryRepository;
    private final LanguageRepository languageRepository;
    private final TranslationRepository translationRepository;
    private final OrderResponseRepository orderResponseRepository;
    private final CachedDataHolder cachedDataHolder;

    @Override
    public void run(TaskContext context) {
        CachedSnapshot snapshot;
        try {
            snapshot = rebuild();
        } catch (RuntimeException e) {
            log.error("Cache rebuild failed, keeping snapshot built at {}", cachedDataHolder.current().builtAt(), e);
            return;
        }
        cachedDataHolder.publish(snapshot);
    }

    /** Builds a new snapshot from the current store contents without publishing it. */
    public CachedSnapshot rebuild() {
        String master = settingRepository.findById(Setting.MASTER_ADDRESS).map(Setting::getStringValue).orElse("");
        boolean mainnet = settingRepository.findById(Setting.IN_MAINNET).map(Setting::getBoolValue).orElse(false);
        long seqno = settingRepository.findById(Setting.LAST_SEQNO).map(Setting::getLongValue).orElse(0L);

        List<Admin> admins = adminRepository.findAll();
        List<Admin> adminsWithData = withData(admins, master);
        log.trace("Loaded {} admins with data (of {} total)", adminsWithData.size(), admins.size());

        List<User> users = userRepository.findAll();
        List<User> usersWithData = withData(users, master);
        log.trace("Loaded {} users with data (of {} total)", usersWithData.size(), users.size());

        List<Order> orders = orderRepository.findAll();
        List<Order> ordersWithData = withData(orders, master);
        List<Order> activeOrders = ordersWithData.stream().filter(Order::isActive).toList();
        log.trace("Loaded {} orders (including {} active) of {} total", ordersWithData.size(), activeOrders.size(), orders.size());

        linkUsers(ordersWithData, usersWithData);

        List<Category> categories = categoryRepository.findAll();
        List<Language> languages = languageRepository.findAll();
        log.trace("Loaded {} categories, {} languages", categories.size(), languages.size());

        Map<String, List<Order>> translated = translateActiveOrders(activeOrders, languages);
        Map<Long, Set<String>> responded = respondersOf(activeOrders);

        CachedSnapshot snapshot = new CachedSnapshot(
                master,
                mainnet,
                seqno,
                adminsWithData,
                usersWithData,
                ordersWithData,
                activeOrders,
                categories,
                languages,
                translated,
                countBy(ordersWithData, Order::getStatus),
                countBy(ordersWithData, o -> blankToNull(o.getCategory())),
                countBy(ordersWithData, o -> blankToNull(o.getLanguage())),
                countBy(usersWithData, User::getUserStatus),
                countBy(usersWithData, u -> blankToNull(u.getLanguage())),
                responded,
                Instant.now());

        log.debug("Reloaded at {}: {} of {} admins, {} of {} users, {} of {} orders (incl. {} active), {} categories, {} languages",
                seqno, adminsWithData.size(), admins.size(), usersWithData.size(), users.size(),
                ordersWithData.size(), orders.size(), activeOrders.size(), categories.size(), languages.size());
        return snapshot;
    }

    /** Drops the placeholder rows that stand for the master contract. */
    private static <T extends TrackedEntity> List<T> withData(List<T> all, String master) {
        return all.stream().filter(e -> !Objects.equals(e.ownerAddress(), master)).toList();
    }

    /** Resolves customer and freelancer by exact address. */
    private static void linkUsers(List<Order> orders, List<User> users) {
        Map<String, User> byAddress = new HashMap<>();
        for (User user : users) {
            if (user.getUserAddress() != null) {
                byAddress.putIfAbsent(user.getUserAddress(), user);
            }
        }
        for (Order order : orders) {
            order.setCustomer(order.getCustomerAddress() == null ? null : byAddress.get(order.getCustomerAddress()));
            order.setFreelancer(order.getFreelancerAddress() == null ? null : byAddress.get(order.getFreelancerAddress()));
        }
        log.trace("Users applied to orders");
    }

    private Map<String, List<Order>> translateActiveOrders(List<Order> activeOrders, List<Language> languages) {
        List<String> hashes = activeOrders.stream()
                .flatMap(o -> Stream.of(o.getNameHash(), o.getDescriptionHash(), o.getTechnicalTaskHash()))
                .filter(Objects::nonNull)
                .distinct()
                .toList();

        Map<String, List<Order>> result = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (Language language : languages) {
            Map<String, String> texts = new HashMap<>();
            if (!hashes.isEmpty()) {
                for (Translation t : translationRepository.findByLanguageAndHashIn(language.getName(), hashes)) {
                    if (t.getTranslatedText() != null) {
                        texts.putIfAbsent(t.getHash(), t.getTranslatedText());
                    }
                }
            }
            List<Order> copies = activeOrders.stream()
                    .map(o -> OrderTranslations.translatedCopy(o, language, (hash, name) -> texts.get(hash)))
                    .toList();
            result.put(language.getHash(), copies);
            result.put(language.getName(), copies);
        }
        log.trace("Translations applied to {} active orders in {} languages", activeOrders.size(), languages.size());
        return result;
    }

    private Map<Long, Set<String>> respondersOf(List<Order> activeOrders) {
        Map<Long, Set<String>> result = new LinkedHashMap<>();
        for (Order order : activeOrders) {
            List<String> addresses = orderResponseRepository.findDistinctFreelancerAddressesByOrderId(order.getIndex());
            result.put(order.getIndex(), addresses.stream()
                    .filter(Objects::nonNull)
                    .collect(Collectors.toCollection(LinkedHashSet::new)));
        }
        return result;
    }

    /** Group-and-count; rows with a null key are not counted. */
    private static <T, K> Map<K, Integer> countBy(List<T> items, Function<T, K> key) {
        Map<K, Integer> counts = new LinkedHashMap<>();
        for (T item : items) {
            K k = key.apply(item);
            if (k != null) {
                counts.merge(k, 1, Integer::sum);
            }
        }
        return counts;
    }

    private static String blankToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
