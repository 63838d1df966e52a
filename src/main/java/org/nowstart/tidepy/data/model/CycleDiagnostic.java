package org.nowstart.tidepy.data.model;

import org.nowstart.tidepy.data.type.ErrorCategory;

public record CycleDiagnostic(
        ErrorCategory category,
        String asset,
        String orderId,
        String message
) {

    public static CycleDiagnostic dataGap(String asset, String field) {
        return new CycleDiagnostic(ErrorCategory.DATA_GAP, asset, null, "missing or invalid " + field);
    }

    public static CycleDiagnostic forAsset(ErrorCategory category, String asset, String message) {
        return new CycleDiagnostic(category, asset, null, message);
    }

    public static CycleDiagnostic forOrder(ErrorCategory category, String asset, String orderId, String message) {
        return new CycleDiagnostic(category, asset, orderId, message);
    }
}
