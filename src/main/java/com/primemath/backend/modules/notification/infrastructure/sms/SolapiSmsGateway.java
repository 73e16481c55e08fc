package com.primemath.backend.modules.notification.infrastructure.sms;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.primemath.backend.modules.notification.application.SmsCredentialResolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * SOLAPI 단건 발송(POST /messages/v4/send). 호출은 app.sms.timeout 안에서 끝나야 한다.
 */
@Component
public class SolapiSmsGateway implements SmsGateway {

    private static final Logger log = LoggerFactory.getLogger(SolapiSmsGateway.class);

    static final String SEND_PATH = "/messages/v4/send";
    static final String NOT_CONFIGURED = "SMS not configured for center";

    private final WebClient webClient;
    private final SmsCredentialResolver credentialResolver;
    private final SmsProperties properties;
    private final Clock clock;

    public SolapiSmsGateway(
            WebClient.Builder webClientBuilder,
            SmsCredentialResolver credentialResolver,
            SmsProperties properties,
            Clock clock
    ) {
        this.webClient = webClientBuilder.baseUrl(properties.getBaseUrl()).build();
        this.credentialResolver = credentialResolver;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public SmsSendResult send(SmsMessage message, UUID centerId) {
        Optional<SmsCredentials> credentials = credentialResolver.resolve(centerId);
        if (credentials.isEmpty()) {
            log.info("sms skipped: credentials missing for center={}", centerId);
            return SmsSendResult.failed(NOT_CONFIGURED);
        }
        SmsCredentials creds = credentials.get();

        Map<String, Object> body = Map.of("message", Map.of(
                "to", digits(message.to()),
                "from", digits(creds.senderNumber()),
                "text", message.text()
        ));

        try {
            webClient.post()
                    .uri(SEND_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(HttpHeaders.AUTHORIZATION,
                            SolapiAuthorization.header(creds.apiKey(), creds.apiSecret(), clock.instant()))
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(properties.getTimeout());
            return SmsSendResult.sent();
        } catch (WebClientResponseException ex) {
            log.warn("sms rejected center={} status={} body={}", centerId, ex.getStatusCode().value(),
                    ex.getResponseBodyAsString());
            return SmsSendResult.failed("SOLAPI " + ex.getStatusCode().value() + ": " + ex.getResponseBodyAsString());
        } catch (RuntimeException ex) {
            log.warn("sms send failed center={}: {}", centerId, ex.toString());
            return SmsSendResult.failed(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
        }
    }

    static String digits(String phone) {
        return phone == null ? "" : phone.replaceAll("\\D", "");
    }
}
