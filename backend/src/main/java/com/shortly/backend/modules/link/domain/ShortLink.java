package com.shortly.backend.modules.link.domain;

import java.util.UUID;

import com.shortly.backend.global.jpa.AbstractTimestampedEntity;
import com.shortly.backend.modules.auth.domain.AppUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "short_link", uniqueConstraints = @UniqueConstraint(
        name = "uk_short_link_short_code",
        columnNames = "short_code"))
public class ShortLink extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "short_code", nullable = false, length = 16)
    private String shortCode;

    @Column(name = "url", nullable = false, length = 2048)
    private String url;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private AppUser owner;

    @Column(name = "user_id", nullable = false, insertable = false, updatable = false, columnDefinition = "uuid")
    private UUID ownerId;

    protected ShortLink() {
    }

    public ShortLink(AppUser owner, String shortCode, String url) {
        this.owner = owner;
        this.ownerId = owner.getId();
        this.shortCode = shortCode;
        this.url = url;
    }

    public UUID getId() {
        return id;
    }

    public String getShortCode() {
        return shortCode;
    }

    public String getUrl() {
        return url;
    }

    public UUID getOwnerId() {
        return ownerId;
    }

    public void retarget(String shortCode, String url) {
        this.shortCode = shortCode;
        this.url = url;
    }
}
