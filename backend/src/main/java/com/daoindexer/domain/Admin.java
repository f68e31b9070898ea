package com.daoindexer.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "admins")
@NoArgsConstructor
@Getter
@Setter
public class Admin extends TrackedEntity {

    private String adminAddress;
    private String category;
    private boolean canApproveUser;
    private boolean canRevokeUser;
    private String nickname;
    private String about;
    private String website;
    private String portfolio;
    private String resume;
    private String specialization;
    private Instant revokedAt;

    public Admin(Admin source) {
        super(source);
        this.adminAddress = source.adminAddress;
        this.category = source.category;
        this.canApproveUser = source.canApproveUser;
        this.canRevokeUser = source.canRevokeUser;
        this.nickname = source.nickname;
        this.about = source.about;
        this.website = source.website;
        this.portfolio = source.portfolio;
        this.resume = source.resume;
        this.specialization = source.specialization;
        this.revokedAt = source.revokedAt;
    }

    @Override
    public EntityType entityType() {
        return EntityType.ADMIN;
    }

    @Override
    public String ownerAddress() {
        return adminAddress;
    }
}
