package com.daoindexer.api.controller;

import com.daoindexer.domain.Category;
import com.daoindexer.domain.Language;
import com.daoindexer.domain.Order;
import com.daoindexer.domain.OrderResponse;
import com.daoindexer.domain.User;
import com.daoindexer.domain.UserStatus;
import com.daoindexer.snapshot.CachedDataHolder;
import com.daoindexer.snapshot.CachedSnapshot;
import com.daoindexer.snapshot.query.OrderDetailsQueryService;
import com.daoindexer.snapshot.query.TranslationLookupService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SearchControllerTest {

    @Mock
    private CachedDataHolder cachedDataHolder;
    @Mock
    private TranslationLookupService translationLookupService;
    @Mock
    private OrderDetailsQueryService orderDetailsQueryService;

    private WebTestClient webTestClient;

    private Order landing;
    private Order logo;
    private Order bot;

    @BeforeEach
    void setUp() {
        User customer = new User();
        customer.setIndex(1L);
        customer.setUserAddress("EQcustomer");
        customer.setUserStatus(UserStatus.ACTIVE);
        customer.setLanguage("lang-en");
        User freelancer = new User();
        freelancer.setIndex(2L);
        freelancer.setUserAddress("EQfreelancer");
        freelancer.setUserStatus(UserStatus.MODERATION);

        landing = order(1, Order.STATUS_ACTIVE, "Landing page", "design", "lang-en", "10", "2024-01-01T00:00:00Z", "2024-03-01T00:00:00Z");
        logo = order(2, Order.STATUS_ACTIVE, "Logo for landing", "design", "lang-ru", "50", "2024-01-02T00:00:00Z", "2024-02-01T00:00:00Z");
        bot = order(3, Order.STATUS_ACTIVE, "Telegram bot", "dev", "lang-en", "100", "2024-01-03T00:00:00Z", null);
        Order done = order(4, Order.STATUS_COMPLETED, "Old job", "dev", "lang-en", "5", "2023-12-01T00:00:00Z", null);
        done.setCustomerAddress("EQcustomer");
        done.setFreelancerAddress("EQfreelancer");
        landing.setCustomerAddress("EQcustomer");
        landing.setNameHash("h-landing");

        Order landingRu = new Order(landing);
        landingRu.setNameTranslated("Лендинг");
        Language english = new Language("lang-en", "English");
        Language russian = new Language("lang-ru", "Russian");
        List<Order> active = List.of(landing, logo, bot);
        List<Order> inRussian = List.of(landingRu, new Order(logo), new Order(bot));

        CachedSnapshot snapshot = new CachedSnapshot("EQmaster", true, 77L,
                List.of(), List.of(customer, freelancer), List.of(landing, logo, bot, done), active,
                List.of(new Category("design", "Design")), List.of(english, russian),
                Map.of("lang-en", active, "English", active, "lang-ru", inRussian, "Russian", inRussian),
                Map.of(Order.STATUS_ACTIVE, 3, Order.STATUS_COMPLETED, 1), Map.of("design", 2, "dev", 2),
                Map.of("lang-en", 3, "lang-ru", 1), Map.of(UserStatus.ACTIVE, 1, UserStatus.MODERATION, 1),
                Map.of("lang-en", 1), Map.of(1L, Set.of("EQfreelancer")), Instant.now());
        when(cachedDataHolder.current()).thenReturn(snapshot);

        SearchController controller = new SearchController(cachedDataHolder, translationLookupService, orderDetailsQueryService);
        webTestClient = WebTestClient.bindToController(controller)
                .controllerAdvice(new ValidationExceptionHandler())
                .build();
    }

    private static Order order(long index, int status, String name, String category, String language, String price,
                               String createdAt, String deadline) {
        Order order = new Order();
        order.setIndex(index);
        order.setAddress("EQorder" + index);
        order.setStatus(status);
        order.setName(name);
        order.setCategory(category);
        order.setLanguage(language);
        order.setPrice(new BigDecimal(price));
        order.setCreatedAt(Instant.parse(createdAt));
        order.setDeadline(deadline == null ? null : Instant.parse(deadline));
        return order;
    }

    @Test
    @DisplayName("config exposes master address, network, categories and languages")
    void config() {
        webTestClient.get().uri("/api/config")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.masterContractAddress").isEqualTo("EQmaster")
                .jsonPath("$.mainnet").isEqualTo(true)
                .jsonPath("$.categories.length()").isEqualTo(1)
                .jsonPath("$.languages.length()").isEqualTo(2);
    }

    @Test
    void stat() {
        webTestClient.get().uri("/api/stat")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.orderCount").isEqualTo(4)
                .jsonPath("$.userCount").isEqualTo(2)
                .jsonPath("$.orderCountByCategory.design").isEqualTo(2);
    }

    @Test
    @DisplayName("search matches every word of the query, case-insensitively, within active orders")
    void searchByQuery() {
        webTestClient.get().uri("/api/search?query=landing")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].index").isEqualTo(1)
                .jsonPath("$[1].index").isEqualTo(2);

        webTestClient.get().uri(b -> b.path("/api/search").queryParam("query", "LOGO landing").build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].index").isEqualTo(2);

        webTestClient.get().uri("/api/search?query=old")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(0);
    }

    @Test
    @DisplayName("search sorts by deadline descending with missing deadlines last")
    void searchSortedByDeadline() {
        webTestClient.get().uri("/api/search?orderBy=deadline&sort=desc")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].index").isEqualTo(1)
                .jsonPath("$[1].index").isEqualTo(2)
                .jsonPath("$[2].index").isEqualTo(3);
    }

    @Test
    void searchFilters() {
        webTestClient.get().uri("/api/search?category=design&minPrice=20")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].index").isEqualTo(2);

        webTestClient.get().uri("/api/searchCount?language=lang-en")
                .exchange()
                .expectStatus().isOk()
                .expectBody(Long.class).isEqualTo(2L);
    }

    @Test
    @DisplayName("search with translateTo serves the translated copies")
    void searchTranslated() {
        webTestClient.get().uri("/api/search?translateTo=russian&query=page")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].name").isEqualTo("Landing page")
                .jsonPath("$[0].nameTranslated").isEqualTo("Лендинг");
    }

    @Test
    @DisplayName("unknown translateTo language is rejected")
    void unknownLanguage() {
        webTestClient.get().uri("/api/search?translateTo=klingon")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_REQUEST")
                .jsonPath("$.message").value(m -> assertThat((String) m).startsWith("translateTo:"));
    }

    @Test
    @DisplayName("page size outside 10..100 is rejected")
    void pageSizeBounds() {
        webTestClient.get().uri("/api/search?pageSize=5")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").value(m -> assertThat((String) m).startsWith("pageSize:"));

        webTestClient.get().uri("/api/listOrders?pageSize=101")
                .exchange()
                .expectStatus().isBadRequest();

        webTestClient.get().uri("/api/search?orderBy=price")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void findUser() {
        webTestClient.get().uri("/api/findUser?address=EQcustomer")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.found").isEqualTo(true)
                .jsonPath("$.data.index").isEqualTo(1);

        webTestClient.get().uri("/api/findUser?address=EQnobody")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.found").isEqualTo(false);

        webTestClient.get().uri("/api/findUser")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    @DisplayName("getOrder attaches the current user's response and the stored translation")
    void getOrderWithCurrentUser() {
        OrderResponse response = new OrderResponse(1, "EQfreelancer", new BigDecimal("9"));
        when(orderDetailsQueryService.responseOf(1L, "EQfreelancer")).thenReturn(Optional.of(response));
        when(translationLookupService.findTranslatedText("h-landing", "Russian")).thenReturn("Лендинг");

        webTestClient.get().uri("/api/getOrder?index=1&currentUserIndex=2&translateTo=lang-ru")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.index").isEqualTo(1)
                .jsonPath("$.nameTranslated").isEqualTo("Лендинг")
                .jsonPath("$.currentUserResponse.freelancerAddress").isEqualTo("EQfreelancer");

        assertThat(landing.getCurrentUserResponse()).isNull();
        assertThat(landing.getNameTranslated()).isNull();
    }

    @Test
    void getOrderUnknownIndex() {
        webTestClient.get().uri("/api/getOrder?index=99")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").value(m -> assertThat((String) m).startsWith("index:"));

        webTestClient.get().uri("/api/getOrder?index=1&currentUserIndex=99")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    @DisplayName("unparsable index is reported as INVALID_REQUEST")
    void unparsableIndex() {
        webTestClient.get().uri("/api/getUser?index=abc")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_REQUEST");
    }

    @Test
    void getUserStats() {
        webTestClient.get().uri("/api/getUserStats?index=1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.asCustomerTotal").isEqualTo(2)
                .jsonPath("$.asFreelancerTotal").isEqualTo(0);

        webTestClient.get().uri("/api/getUserStats?index=2")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.asCustomerTotal").isEqualTo(0)
                .jsonPath("$.asFreelancerTotal").isEqualTo(1);
    }

    @Test
    void listOrdersAndUsers() {
        webTestClient.get().uri("/api/listOrders?sort=desc&status=1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(3)
                .jsonPath("$[0].index").isEqualTo(3);

        webTestClient.get().uri("/api/listUsers?status=moderation")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].index").isEqualTo(2);

        webTestClient.get().uri("/api/listUsers?status=unknown")
                .exchange()
                .expectStatus().isBadRequest();
    }
}
