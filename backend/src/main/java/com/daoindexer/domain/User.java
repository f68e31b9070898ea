package com.daoindexer.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Transient;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "users")
@NoArgsConstructor
@Getter
@Setter
public class User extends TrackedEntity {

    private String userAddress;
    private UserStatus userStatus;
    private boolean isUser;
    private boolean isFreelancer;
    private String nickname;
    private String telegram;
    private String about;
    private String aboutHash;
    private String website;
    private String portfolio;
    private String resume;
    private String specialization;
    private String language;
    private Instant freelancerSince;

    /** Filled on copies served to readers only. */
    @Transient
    private String aboutTranslated;

    public User(User source) {
        super(source);
        this.userAddress = source.userAddress;
        this.userStatus = source.userStatus;
        this.isUser = source.isUser;
        this.isFreelancer = source.isFreelancer;
        this.nickname = source.nickname;
        this.telegram = source.telegram;
        this.about = source.about;
        this.aboutHash = source.aboutHash;
        this.website = source.website;
        this.portfolio = source.portfolio;
        this.resume = source.resume;
        this.specialization = source.specialization;
        this.language = source.language;
        this.freelancerSince = source.freelancerSince;
        this.aboutTranslated = source.aboutTranslated;
    }

    @Override
    public EntityType entityType() {
        return EntityType.USER;
    }

    @Override
    public String ownerAddress() {
        return userAddress;
    }
}
