package com.primemath.backend.modules.notification.infrastructure.sms;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * SOLAPI HMAC-SHA256 Authorization 헤더.
 * signature = hex(HMAC-SHA256(apiSecret, date + salt))
 */
public final class SolapiAuthorization {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int SALT_BYTES = 16;

    private SolapiAuthorization() {
    }

    public static String header(String apiKey, String apiSecret, Instant now) {
        byte[] saltBytes = new byte[SALT_BYTES];
        RANDOM.nextBytes(saltBytes);
        return header(apiKey, apiSecret, now.toString(), HexFormat.of().formatHex(saltBytes));
    }

    static String header(String apiKey, String apiSecret, String date, String salt) {
        return "HMAC-SHA256 apiKey=" + apiKey
                + ", date=" + date
                + ", salt=" + salt
                + ", signature=" + sign(apiSecret, date + salt);
    }

    static String sign(String secret, String data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return HexFormat.of().formatHex(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HmacSHA256 unavailable", ex);
        }
    }
}
