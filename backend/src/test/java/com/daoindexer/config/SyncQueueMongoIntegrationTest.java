package com.daoindexer.config;

import com.daoindexer.domain.EntityType;
import com.daoindexer.domain.Order;
import com.daoindexer.domain.OrderRepository;
import com.daoindexer.domain.OrderResponse;
import com.daoindexer.domain.OrderResponseRepository;
import com.daoindexer.domain.SyncQueueItem;
import com.daoindexer.domain.SyncQueueItemRepository;
import com.daoindexer.domain.Translation;
import com.daoindexer.domain.TranslationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@DataMongoTest(properties = "spring.data.mongodb.auto-index-creation=true")
@Testcontainers(disabledWithoutDocker = true)
@Import(MongoConfig.class)
class SyncQueueMongoIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    SyncQueueItemRepository syncQueueItemRepository;

    @Autowired
    OrderRepository orderRepository;

    @Autowired
    OrderResponseRepository orderResponseRepository;

    @Autowired
    TranslationRepository translationRepository;

    @BeforeEach
    void clean() {
        syncQueueItemRepository.deleteAll();
        orderRepository.deleteAll();
        orderResponseRepository.deleteAll();
        translationRepository.deleteAll();
    }

    @Test
    @DisplayName("earliest due row is returned first")
    void earliestDueFirst() {
        Instant t0 = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        syncQueueItemRepository.save(new SyncQueueItem(EntityType.ORDER, 2, t0.plusSeconds(10), t0));
        syncQueueItemRepository.save(new SyncQueueItem(EntityType.USER, 1, t0, t0));

        SyncQueueItem first = syncQueueItemRepository.findFirstByOrderBySyncAtAsc().orElseThrow();

        assertThat(first.getEntityType()).isEqualTo(EntityType.USER);
        assertThat(first.getIndex()).isEqualTo(1L);
    }

    @Test
    @DisplayName("rows of a key are removed only up to the achieved freshness, inclusive")
    void deleteUpToAchieved() {
        Instant t0 = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        syncQueueItemRepository.save(new SyncQueueItem(EntityType.ORDER, 42, t0, t0.minusSeconds(5)));
        syncQueueItemRepository.save(new SyncQueueItem(EntityType.ORDER, 42, t0, t0));
        syncQueueItemRepository.save(new SyncQueueItem(EntityType.ORDER, 42, t0, t0.plusSeconds(5)));
        syncQueueItemRepository.save(new SyncQueueItem(EntityType.USER, 42, t0, t0.minusSeconds(5)));

        long deleted = syncQueueItemRepository.deleteByEntityTypeAndIndexAndMinLastSyncLessThanEqual(
                EntityType.ORDER, 42, t0);

        assertThat(deleted).isEqualTo(2);
        assertThat(syncQueueItemRepository.findAll())
                .extracting(SyncQueueItem::getEntityType, SyncQueueItem::getMinLastSync)
                .containsExactlyInAnyOrder(
                        tuple(EntityType.ORDER, t0.plusSeconds(5)),
                        tuple(EntityType.USER, t0.minusSeconds(5)));
        assertThat(syncQueueItemRepository.existsByEntityTypeAndIndex(EntityType.ORDER, 42)).isTrue();
        assertThat(syncQueueItemRepository.deleteByEntityTypeAndIndex(EntityType.ORDER, 42)).isEqualTo(1);
        assertThat(syncQueueItemRepository.existsByEntityTypeAndIndex(EntityType.ORDER, 42)).isFalse();
    }

    @Test
    @DisplayName("order price round-trips through Decimal128 and stale orders are found")
    void orderPersistence() {
        Order order = new Order();
        order.setIndex(7L);
        order.setAddress("EQorder7");
        order.setPrice(new BigDecimal("123.450000001"));
        order.setLastSync(Instant.parse("2024-01-01T00:00:00Z"));
        orderRepository.save(order);
        Order neverSynced = new Order();
        neverSynced.setIndex(8L);
        neverSynced.setAddress("EQorder8");
        orderRepository.save(neverSynced);

        assertThat(orderRepository.findById(7L).orElseThrow().getPrice())
                .isEqualByComparingTo(new BigDecimal("123.450000001"));
        assertThat(orderRepository.findByLastSyncBeforeOrLastSyncIsNull(Instant.parse("2024-06-01T00:00:00Z")))
                .extracting(Order::getIndex)
                .containsExactlyInAnyOrder(7L, 8L);
        assertThat(orderRepository.findFirstByAddress("EQorder8")).isPresent();
    }

    @Test
    @DisplayName("distinct responders of an order")
    void distinctResponders() {
        orderResponseRepository.saveAll(List.of(
                new OrderResponse(1, "EQf1", new BigDecimal("10")),
                new OrderResponse(1, "EQf2", new BigDecimal("12")),
                new OrderResponse(1, "EQf1", new BigDecimal("11")),
                new OrderResponse(2, "EQf3", new BigDecimal("9"))));

        assertThat(orderResponseRepository.findDistinctFreelancerAddressesByOrderId(1))
                .containsExactlyInAnyOrder("EQf1", "EQf2");
        assertThat(orderResponseRepository.findByOrderIdOrderByPriceDesc(1))
                .extracting(OrderResponse::getPrice)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("12"), new BigDecimal("11"), new BigDecimal("10"));
    }

    @Test
    @DisplayName("one translation per hash and language")
    void translationUniqueness() {
        translationRepository.save(new Translation("h1", "English", "Hello"));

        assertThat(translationRepository.findByLanguageAndHashIn("English", List.of("h1", "h2")))
                .extracting(Translation::getTranslatedText)
                .containsExactly("Hello");
        assertThatThrownBy(() -> translationRepository.save(new Translation("h1", "English", "Hi")))
                .isInstanceOf(DuplicateKeyException.class);
    }
}
