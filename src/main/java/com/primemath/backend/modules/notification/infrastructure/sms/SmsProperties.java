package com.primemath.backend.modules.notification.infrastructure.sms;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.sms")
public class SmsProperties {

    private String baseUrl = "https://api.solapi.com";
    private Duration timeout = Duration.ofSeconds(5);
    private String encryptionKey;
    private Duration credentialCacheTtl = Duration.ofMinutes(5);
    private int credentialCacheMaxEntries = 100;
    private Map<String, Fallback> fallback = new LinkedHashMap<>();

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public String getEncryptionKey() {
        return encryptionKey;
    }

    public void setEncryptionKey(String encryptionKey) {
        this.encryptionKey = encryptionKey;
    }

    public Duration getCredentialCacheTtl() {
        return credentialCacheTtl;
    }

    public void setCredentialCacheTtl(Duration credentialCacheTtl) {
        this.credentialCacheTtl = credentialCacheTtl;
    }

    public int getCredentialCacheMaxEntries() {
        return credentialCacheMaxEntries;
    }

    public void setCredentialCacheMaxEntries(int credentialCacheMaxEntries) {
        this.credentialCacheMaxEntries = credentialCacheMaxEntries;
    }

    public Map<String, Fallback> getFallback() {
        return fallback;
    }

    public void setFallback(Map<String, Fallback> fallback) {
        this.fallback = fallback;
    }

    public static class Fallback {

        private String apiKey;
        private String apiSecret;
        private String senderNumber;

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getApiSecret() {
            return apiSecret;
        }

        public void setApiSecret(String apiSecret) {
            this.apiSecret = apiSecret;
        }

        public String getSenderNumber() {
            return senderNumber;
        }

        public void setSenderNumber(String senderNumber) {
            this.senderNumber = senderNumber;
        }
    }
}
