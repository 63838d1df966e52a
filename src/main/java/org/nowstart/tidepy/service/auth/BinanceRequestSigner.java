package org.nowstart.tidepy.service.auth;

import java.nio.charset.StandardCharsets;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * HMAC-SHA256 signature over the exact query string sent to a signed endpoint, hex encoded.
 */
@RequiredArgsConstructor
public class BinanceRequestSigner {

    private static final String ALGORITHM = "HmacSHA256";

    @Getter
    private final String apiKey;
    private final String secretKey;

    public String sign(String queryString) {
        if (secretKey == null || secretKey.isBlank()) {
            throw new IllegalStateException("Binance secret key is not configured");
        }
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secretKey.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] signature = mac.doFinal(queryString.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(signature.length * 2);
            for (byte b : signature) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (Exception e) {
            throw new IllegalStateException("Failed to sign Binance request", e);
        }
    }
}
