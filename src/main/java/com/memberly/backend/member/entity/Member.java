package com.memberly.backend.member.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.Optional;

@Getter
@Entity
@Table(name = "members",
        indexes = @Index(name = "idx_members_active_end", columnList = "is_active,subscription_end_utc")
)
public class Member {

    /** 外部系統指派，建立後不可變 */
    @Id
    @Column(nullable = false, updatable = false)
    private Long id;

    @Setter
    @Column(name = "display_name", length = 255)
    private String name;

    /**
     * 快取的權益旗標：只由 renew / expiry sweep 改寫，讀取時不依日期重算。
     */
    @Setter
    @Column(name = "is_active", nullable = false)
    private boolean active;

    /** null = 從未建立訂閱（sweep 永不處理） */
    @Setter
    @Column(name = "subscription_end_utc")
    private Instant subscriptionEnd;

    @Column(name = "created_at_utc", nullable = false, updatable = false)
    private Instant createdAtUtc;

    @Column(name = "updated_at_utc", nullable = false)
    private Instant updatedAtUtc;

    public Member() {
    }

    public Member(Long id, String name) {
        this.id = id;
        this.name = name;
    }

    public Optional<Instant> getSubscriptionEnd() {
        return Optional.ofNullable(subscriptionEnd);
    }

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAtUtc == null) createdAtUtc = now;
        if (updatedAtUtc == null) updatedAtUtc = now;
    }

    @PreUpdate
    void preUpdate() {
        updatedAtUtc = Instant.now();
    }
}
