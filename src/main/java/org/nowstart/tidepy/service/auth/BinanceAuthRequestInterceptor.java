package org.nowstart.tidepy.service.auth;

import feign.RequestInterceptor;
import feign.RequestTemplate;
import java.time.Clock;
import java.util.Set;
import lombok.RequiredArgsConstructor;

/**
 * Signs private endpoints: appends {@code timestamp} and {@code recvWindow}, then a {@code signature} over
 * the resulting query line, and sets the API key header. Public market-data calls pass through untouched.
 */
@RequiredArgsConstructor
public class BinanceAuthRequestInterceptor implements RequestInterceptor {

    static final String API_KEY_HEADER = "X-MBX-APIKEY";
    static final Set<String> SIGNED_PATHS = Set.of("/fapi/v1/order", "/fapi/v2/account");
    static final long RECV_WINDOW_MILLIS = 5000L;

    private final BinanceRequestSigner binanceRequestSigner;
    private final Clock clock;

    @Override
    public void apply(RequestTemplate template) {
        template.header("Accept", "application/json");
        template.header("User-Agent", "tidepy/1.0");
        if (!isSigned(template.path())) {
            return;
        }

        template.query("recvWindow", String.valueOf(RECV_WINDOW_MILLIS));
        template.query("timestamp", String.valueOf(clock.millis()));
        String queryLine = template.queryLine();
        String payload = queryLine.startsWith("?") ? queryLine.substring(1) : queryLine;

        template.query("signature", binanceRequestSigner.sign(payload));
        template.header(API_KEY_HEADER, binanceRequestSigner.getApiKey());
    }

    private boolean isSigned(String path) {
        if (path == null) {
            return false;
        }
        return SIGNED_PATHS.stream().anyMatch(path::endsWith);
    }
}
