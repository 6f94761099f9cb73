package br.gc.stock.tracker.http;

import br.gc.stock.tracker.config.StockTrackerProperties;
import br.gc.stock.tracker.exceptions.FetchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Blocking access to the InfoMoney site shared by the history, stock list and news clients.
 * <p>
 * Every request is preceded by a random pause and retried with linear backoff on I/O errors,
 * 429 and 5xx answers. Other 4xx answers fail at once.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class InfomoneyHttpClient {

    private final RestTemplate restTemplate;
    private final StockTrackerProperties properties;

    public String get(String url, String referer) {
        return exchange(HttpMethod.GET, url, new HttpEntity<>(BrowserHeaders.page(referer)));
    }

    public String postForm(String url, MultiValueMap<String, String> form, String referer) {
        HttpHeaders headers = BrowserHeaders.ajaxForm(referer, properties.getInfomoney().getSiteUrl());
        return exchange(HttpMethod.POST, url, new HttpEntity<>(form, headers));
    }

    private String exchange(HttpMethod method, String url, HttpEntity<?> request) {
        int maxAttempts = Math.max(1, properties.getInfomoney().getMaxAttempts());
        RestClientException lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            pause(jitter());
            try {
                ResponseEntity<String> response = restTemplate.exchange(url, method, request, String.class);
                String body = response.getBody();
                return body == null ? "" : body;
            } catch (HttpStatusCodeException e) {
                if (!isRetryable(e.getStatusCode())) {
                    throw new FetchException(method + " " + url + " answered " + e.getStatusCode().value(), e);
                }
                lastError = e;
            } catch (RestClientException e) {
                lastError = e;
            }

            if (attempt < maxAttempts) {
                log.warn("{} {} failed (attempt {}/{}): {}", method, url, attempt, maxAttempts, lastError.getMessage());
                pause(properties.getInfomoney().getRetryBackoffMs() * attempt);
            }
        }
        throw new FetchException(method + " " + url + " failed after " + maxAttempts + " attempts: "
                + lastError.getMessage(), lastError);
    }

    private static boolean isRetryable(HttpStatusCode status) {
        return status.is5xxServerError() || status.value() == 429;
    }

    private long jitter() {
        long bound = properties.getInfomoney().getRequestJitterMs();
        return bound <= 0 ? 0 : ThreadLocalRandom.current().nextLong(bound / 4, bound + 1);
    }

    private static void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("Interrupted while waiting to call InfoMoney", e);
        }
    }
}
