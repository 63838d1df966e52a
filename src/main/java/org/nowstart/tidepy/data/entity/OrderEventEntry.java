package org.nowstart.tidepy.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.nowstart.tidepy.data.type.DeltaReason;
import org.nowstart.tidepy.data.type.ErrorCategory;
import org.nowstart.tidepy.data.type.ExecutionMode;
import org.nowstart.tidepy.data.type.OrderSide;
import org.nowstart.tidepy.data.type.OrderStatus;

/**
 * Archived copy of an order that reached a terminal status.
 */
@Entity
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "order_event_entry")
public class OrderEventEntry extends AuditableEntity {

    @Id
    private String orderId;

    private String asset;

    private String exchangeOrderId;

    @Enumerated(EnumType.STRING)
    private OrderSide side;

    @Enumerated(EnumType.STRING)
    private DeltaReason reason;

    @Enumerated(EnumType.STRING)
    private ExecutionMode mode;

    @Enumerated(EnumType.STRING)
    private OrderStatus status;

    @Column(precision = 38, scale = 12)
    private BigDecimal requestedNotional;

    @Column(precision = 38, scale = 12)
    private BigDecimal filledNotional;

    @Column(precision = 38, scale = 12)
    private BigDecimal filledQuantity;

    @Column(precision = 38, scale = 12)
    private BigDecimal avgFillPrice;

    private int attempts;

    @Enumerated(EnumType.STRING)
    private ErrorCategory failureCategory;

    @Column(length = 1024)
    private String failure;

    private Instant createdAt;

    private Instant settledAt;
}
