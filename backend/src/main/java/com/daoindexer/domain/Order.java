package com.daoindexer.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Transient;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Order contract mirror. Status values follow the contract: see the {@code STATUS_*} constants.
 */
@Document(collection = "orders")
@NoArgsConstructor
@Getter
@Setter
public class Order extends TrackedEntity {

    public static final int STATUS_MODERATION = 0;
    public static final int STATUS_ACTIVE = 1;
    public static final int STATUS_OFFER_MADE = 2;
    public static final int STATUS_IN_WORK = 3;
    public static final int STATUS_PENDING_PAYMENT = 4;
    public static final int STATUS_REFUNDED = 5;
    public static final int STATUS_COMPLETED = 6;
    public static final int STATUS_PAYMENT_FORCED = 7;
    public static final int STATUS_PRE_ARBITRATION = 8;
    public static final int STATUS_ON_ARBITRATION = 9;
    public static final int STATUS_ARBITRATION_SOLVED = 10;

    private int status;
    private String category;
    private String language;
    private String name;
    private String nameHash;
    private String description;
    private String descriptionHash;
    private String technicalTask;
    private String technicalTaskHash;
    private BigDecimal price;
    private Instant deadline;
    private long timeForCheck;
    private String customerAddress;
    private String freelancerAddress;
    private int responsesCount;
    private int arbitrationFreelancerPart;

    @Transient
    private User customer;
    @Transient
    private User freelancer;
    @Transient
    private String nameTranslated;
    @Transient
    private String descriptionTranslated;
    @Transient
    private String technicalTaskTranslated;
    @Transient
    private OrderResponse currentUserResponse;

    public Order(Order source) {
        super(source);
        this.status = source.status;
        this.category = source.category;
        this.language = source.language;
        this.name = source.name;
        this.nameHash = source.nameHash;
        this.description = source.description;
        this.descriptionHash = source.descriptionHash;
        this.technicalTask = source.technicalTask;
        this.technicalTaskHash = source.technicalTaskHash;
        this.price = source.price;
        this.deadline = source.deadline;
        this.timeForCheck = source.timeForCheck;
        this.customerAddress = source.customerAddress;
        this.freelancerAddress = source.freelancerAddress;
        this.responsesCount = source.responsesCount;
        this.arbitrationFreelancerPart = source.arbitrationFreelancerPart;
        this.customer = source.customer;
        this.freelancer = source.freelancer;
        this.nameTranslated = source.nameTranslated;
        this.descriptionTranslated = source.descriptionTranslated;
        this.technicalTaskTranslated = source.technicalTaskTranslated;
        this.currentUserResponse = source.currentUserResponse;
    }

    @Override
    public EntityType entityType() {
        return EntityType.ORDER;
    }

    @Override
    public String ownerAddress() {
        return customerAddress;
    }

    public boolean isActive() {
        return status == STATUS_ACTIVE;
    }

    /** Upper-cased free text matched by search queries. */
    public String searchableText() {
        return Stream.of(name, description, technicalTask)
                .filter(Objects::nonNull)
                .collect(Collectors.joining(" "))
                .toUpperCase(Locale.ROOT);
    }
}
