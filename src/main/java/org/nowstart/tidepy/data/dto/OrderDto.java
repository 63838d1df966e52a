package org.nowstart.tidepy.data.dto;

import java.math.BigDecimal;
import java.time.Instant;
import org.nowstart.tidepy.data.entity.OrderEventEntry;
import org.nowstart.tidepy.data.model.Order;
import org.nowstart.tidepy.data.type.DeltaReason;
import org.nowstart.tidepy.data.type.OrderSide;
import org.nowstart.tidepy.data.type.OrderStatus;

public record OrderDto(
        String orderId,
        String asset,
        OrderSide side,
        DeltaReason reason,
        OrderStatus status,
        BigDecimal requestedNotional,
        BigDecimal filledNotional,
        BigDecimal filledQuantity,
        BigDecimal avgFillPrice,
        int attempts,
        String failure,
        Instant createdAt,
        Instant updatedAt
) {

    public static OrderDto from(Order order) {
        return new OrderDto(
                order.getId(),
                order.getAsset(),
                order.getSide(),
                order.getReason(),
                order.getStatus(),
                order.getRequestedNotional(),
                order.getFilledNotional(),
                order.getFilledQuantity(),
                order.getAvgFillPrice(),
                order.getAttempts(),
                order.getFailure(),
                order.getCreatedAt(),
                order.getUpdatedAt()
        );
    }

    public static OrderDto from(OrderEventEntry entry) {
        return new OrderDto(
                entry.getOrderId(),
                entry.getAsset(),
                entry.getSide(),
                entry.getReason(),
                entry.getStatus(),
                entry.getRequestedNotional(),
                entry.getFilledNotional(),
                entry.getFilledQuantity(),
                entry.getAvgFillPrice(),
                entry.getAttempts(),
                entry.getFailure(),
                entry.getCreatedAt(),
                entry.getSettledAt()
        );
    }
}
