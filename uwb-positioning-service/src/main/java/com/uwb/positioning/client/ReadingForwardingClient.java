package com.uwb.positioning.client;

import com.uwb.positioning.config.UwbProperties;
import com.uwb.positioning.dto.StoredReading;
import com.uwb.positioning.dto.StoredReadingBatchRequest;
import com.uwb.positioning.repository.RawReadingEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.List;

/**
 * Pushes newly committed raw readings to the downstream endpoint.
 *
 * <p>Forwarding happens after the batch is committed and is best effort: every failure is logged
 * and reported as {@code false}, never thrown, and never touches stored data.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReadingForwardingClient {

    private static final String PATH_SEPARATOR = "/";

    private final WebClient forwardingWebClient;
    private final UwbProperties properties;

    /**
     * Forwards the stored readings.
     *
     * @param stored readings committed in the current batch
     * @return whether the downstream endpoint accepted them
     */
    public boolean forward(List<RawReadingEntity> stored) {
        UwbProperties.Forwarding forwarding = properties.getForwarding();
        if (!forwarding.isEnabled()) {
            log.debug("Forwarding disabled, {} readings kept local", stored.size());
            return false;
        }
        if (stored.isEmpty()) {
            return false;
        }

        StoredReadingBatchRequest body = new StoredReadingBatchRequest(
            stored.stream().map(StoredReading::from).toList());
        long startTime = System.nanoTime();

        try {
            forwardingWebClient
                .post()
                .uri(buildUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .timeout(Duration.ofMillis(forwarding.getReadTimeoutMs()))
                .block();

            long latencyMs = (System.nanoTime() - startTime) / 1_000_000;
            log.info("Forwarded {} readings downstream in {}ms", stored.size(), latencyMs);
            return true;

        } catch (WebClientResponseException e) {
            log.warn("Downstream endpoint returned HTTP error {}: {}",
                e.getStatusCode().value(), e.getMessage());
            return false;

        } catch (WebClientRequestException e) {
            log.warn("Failed to connect to downstream endpoint: {}", e.getMessage());
            return false;

        } catch (Exception e) {
            // timeouts arrive here wrapped by block()
            log.warn("Unexpected error forwarding {} readings: {}", stored.size(), e.getMessage());
            return false;
        }
    }

    private String buildUrl() {
        String baseUrl = properties.getForwarding().getBaseUrl();
        String path = properties.getForwarding().getPath();

        if (baseUrl.endsWith(PATH_SEPARATOR)) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        if (!path.startsWith(PATH_SEPARATOR)) {
            path = PATH_SEPARATOR + path;
        }
        return baseUrl + path;
    }
}
