package org.nowstart.tidepy.data.model;

import org.nowstart.tidepy.data.type.RejectionReason;

public record ValidationResult(
        boolean approved,
        ApprovedDelta approvedDelta,
        RejectionReason rejectionReason,
        String message
) {

    public static ValidationResult approved(ApprovedDelta approvedDelta) {
        return new ValidationResult(true, approvedDelta, null, null);
    }

    public static ValidationResult rejected(RejectionReason reason, String message) {
        return new ValidationResult(false, null, reason, message);
    }
}
