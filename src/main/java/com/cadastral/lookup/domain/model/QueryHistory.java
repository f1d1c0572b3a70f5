package com.cadastral.lookup.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * One submitted cadastral query and the resolver's answer for it.
 * Rows are insert-only; they disappear only together with their owning user.
 */
@Entity
@Table(name = "queryhistory", indexes = {
        @Index(name = "idx_queryhistory_cadastral_number", columnList = "cadastral_number"),
        @Index(name = "idx_queryhistory_user_created", columnList = "user_id,created_at")
})
@EntityListeners(AuditingEntityListener.class)
@Getter
@NoArgsConstructor
public class QueryHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "cadastral_number", nullable = false, length = 25, updatable = false)
    private String cadastralNumber;

    @Column(name = "latitude", precision = 8, scale = 6, updatable = false)
    private BigDecimal latitude;

    @Column(name = "longitude", precision = 9, scale = 6, updatable = false)
    private BigDecimal longitude;

    @Column(name = "result", nullable = false, updatable = false)
    private boolean result;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    public QueryHistory(Long userId, String cadastralNumber, BigDecimal latitude, BigDecimal longitude,
            boolean result) {
        this.userId = userId;
        this.cadastralNumber = cadastralNumber;
        this.latitude = latitude;
        this.longitude = longitude;
        this.result = result;
    }

    /**
     * Fallback for contexts where JPA auditing is not active (slice tests).
     */
    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }
}
