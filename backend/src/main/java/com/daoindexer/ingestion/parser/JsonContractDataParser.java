package com.daoindexer.ingestion.parser;

import com.daoindexer.common.ContentHash;
import com.daoindexer.domain.Admin;
import com.daoindexer.domain.Order;
import com.daoindexer.domain.TrackedEntity;
import com.daoindexer.domain.User;
import com.daoindexer.domain.UserStatus;
import com.daoindexer.ingestion.refresh.EntityRefreshException;
import com.daoindexer.ingestion.remote.RemoteDataClient;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;

/**
 * Maps the decoded contract JSON returned by {@link RemoteDataClient#getContractData(String)} onto entities.
 * Free-text fields get a content hash so translations can be looked up by it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JsonContractDataParser implements ContractDataParser {

    private final RemoteDataClient remoteDataClient;

    @Override
    public void updateAdmin(Admin admin) {
        JsonNode data = load(admin);
        admin.setAdminAddress(text(data, "adminAddress"));
        admin.setCategory(text(data, "category"));
        admin.setCanApproveUser(data.path("canApproveUser").asBoolean(false));
        admin.setCanRevokeUser(data.path("canRevokeUser").asBoolean(false));
        admin.setNickname(text(data, "nickname"));
        admin.setAbout(text(data, "about"));
        admin.setWebsite(text(data, "website"));
        admin.setPortfolio(text(data, "portfolio"));
        admin.setResume(text(data, "resume"));
        admin.setSpecialization(text(data, "specialization"));
        admin.setRevokedAt(epochSeconds(data, "revokedAt"));
    }

    @Override
    public void updateUser(User user) {
        JsonNode data = load(user);
        user.setUserAddress(text(data, "userAddress"));
        user.setUserStatus(userStatus(user, text(data, "userStatus")));
        user.setUser(data.path("isUser").asBoolean(false));
        user.setFreelancer(data.path("isFreelancer").asBoolean(false));
        user.setNickname(text(data, "nickname"));
        user.setTelegram(text(data, "telegram"));
        user.setAbout(text(data, "about"));
        user.setAboutHash(ContentHash.of(user.getAbout()));
        user.setWebsite(text(data, "website"));
        user.setPortfolio(text(data, "portfolio"));
        user.setResume(text(data, "resume"));
        user.setSpecialization(text(data, "specialization"));
        user.setLanguage(text(data, "language"));
        user.setFreelancerSince(epochSeconds(data, "freelancerSince"));
    }

    @Override
    public void updateOrder(Order order) {
        JsonNode data = load(order);
        order.setStatus(data.path("status").asInt(Order.STATUS_MODERATION));
        order.setCategory(text(data, "category"));
        order.setLanguage(text(data, "language"));
        order.setName(text(data, "name"));
        order.setNameHash(ContentHash.of(order.getName()));
        order.setDescription(text(data, "description"));
        order.setDescriptionHash(ContentHash.of(order.getDescription()));
        order.setTechnicalTask(text(data, "technicalTask"));
        order.setTechnicalTaskHash(ContentHash.of(order.getTechnicalTask()));
        order.setPrice(decimal(order, data, "price"));
        order.setDeadline(epochSeconds(data, "deadline"));
        order.setTimeForCheck(data.path("timeForCheck").asLong(0));
        order.setCustomerAddress(text(data, "customerAddress"));
        order.setFreelancerAddress(text(data, "freelancerAddress"));
        order.setResponsesCount(data.path("responsesCount").asInt(0));
        order.setArbitrationFreelancerPart(data.path("arbitrationFreelancerPart").asInt(0));
        Instant createdAt = epochSeconds(data, "createdAt");
        if (createdAt != null) {
            order.setCreatedAt(createdAt);
        }
    }

    /** Fetches contract state, sets lastSync and returns the {@code data} node. */
    private JsonNode load(TrackedEntity entity) {
        if (entity.getAddress() == null || entity.getAddress().isBlank()) {
            throw new EntityRefreshException(entity.entityType(), entity.getIndex(), "entity has no address");
        }
        JsonNode result = remoteDataClient.getContractData(entity.getAddress());
        JsonNode syncTime = result.get("syncTime");
        if (syncTime == null || !syncTime.canConvertToLong()) {
            throw new EntityRefreshException(entity.entityType(), entity.getIndex(), "no syncTime in contract data");
        }
        JsonNode data = result.get("data");
        if (data == null || !data.isObject()) {
            throw new EntityRefreshException(entity.entityType(), entity.getIndex(), "contract is not initialized");
        }
        entity.setLastSync(Instant.ofEpochSecond(syncTime.asLong()));
        log.trace("Loaded {} #{} at {}", entity.entityType(), entity.getIndex(), entity.getLastSync());
        return data;
    }

    private static String text(JsonNode data, String field) {
        JsonNode node = data.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isEmpty() ? null : value;
    }

    private static Instant epochSeconds(JsonNode data, String field) {
        long seconds = data.path(field).asLong(0);
        return seconds > 0 ? Instant.ofEpochSecond(seconds) : null;
    }

    private static BigDecimal decimal(TrackedEntity entity, JsonNode data, String field) {
        String value = text(data, field);
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw new EntityRefreshException(entity.entityType(), entity.getIndex(), "invalid " + field + ": " + value, e);
        }
    }

    private static UserStatus userStatus(User user, String value) {
        if (value == null) {
            return UserStatus.MODERATION;
        }
        try {
            return UserStatus.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new EntityRefreshException(user.entityType(), user.getIndex(), "unknown user status " + value, e);
        }
    }
}
