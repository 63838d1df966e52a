package org.nowstart.tidepy.data.type;

import java.util.EnumSet;
import java.util.Set;

public enum OrderStatus {
    CREATED,
    SUBMITTED,
    PARTIALLY_FILLED,
    FILLED,
    REJECTED,
    CANCELED,
    FAILED;

    public boolean isTerminal() {
        return this == FILLED || this == REJECTED || this == CANCELED || this == FAILED;
    }

    public boolean canTransitionTo(OrderStatus next) {
        return allowedNext().contains(next);
    }

    private Set<OrderStatus> allowedNext() {
        return switch (this) {
            case CREATED -> EnumSet.of(SUBMITTED, REJECTED, FAILED);
            case SUBMITTED -> EnumSet.of(PARTIALLY_FILLED, FILLED, REJECTED, CANCELED, FAILED);
            case PARTIALLY_FILLED -> EnumSet.of(SUBMITTED, FILLED, REJECTED, CANCELED, FAILED);
            case FILLED, REJECTED, CANCELED, FAILED -> EnumSet.noneOf(OrderStatus.class);
        };
    }
}
