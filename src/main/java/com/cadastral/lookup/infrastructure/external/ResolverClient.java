package com.cadastral.lookup.infrastructure.external;

import com.cadastral.lookup.application.port.out.CadastralResolver;
import com.cadastral.lookup.domain.model.ResolutionResult;
import com.cadastral.lookup.infrastructure.config.ResolverProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Client for the cadastral resolver endpoint.
 *
 * Makes a single GET per call, bounded by the configured timeout and never retried.
 * Timeouts and transport failures are logged and reported as an empty result so that
 * history recording is never blocked by the resolver.
 */
@Service
public class ResolverClient implements CadastralResolver {

    private static final Logger logger = LoggerFactory.getLogger(ResolverClient.class);

    static final String CADASTRAL_NUMBER_PARAM = "cadastral_number";

    private final WebClient webClient;
    private final String path;
    private final Duration timeout;

    public ResolverClient(WebClient.Builder webClientBuilder, ResolverProperties resolverProperties) {
        this.path = resolverProperties.getPath();
        this.timeout = resolverProperties.getTimeout();
        // clone so the shared builder keeps no base URL
        this.webClient = webClientBuilder.clone()
                .baseUrl(resolverProperties.getBaseUrl())
                .build();
    }

    @Override
    public Optional<ResolutionResult> resolve(String cadastralNumber, String authorization) {
        logger.debug("Resolving cadastral number {} (timeout {})", cadastralNumber, timeout);

        try {
            ResolverPayload payload = webClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path(path)
                            .queryParam(CADASTRAL_NUMBER_PARAM, cadastralNumber)
                            .build())
                    .headers(headers -> {
                        if (authorization != null && !authorization.isBlank()) {
                            headers.set(HttpHeaders.AUTHORIZATION, authorization);
                        }
                    })
                    .retrieve()
                    .bodyToMono(ResolverPayload.class)
                    .timeout(timeout)
                    .block();

            if (payload == null || payload.getResult() == null) {
                logger.warn("Resolver returned no result for {}", cadastralNumber);
                return Optional.empty();
            }
            return Optional.of(new ResolutionResult(payload.getResult()));
        } catch (WebClientResponseException e) {
            logger.warn("Resolver returned {} for {}", e.getStatusCode(), cadastralNumber);
            return Optional.empty();
        } catch (WebClientException e) {
            logger.warn("Resolver unavailable for {}: {}", cadastralNumber, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                logger.warn("Resolver timed out after {} for {}", timeout, cadastralNumber);
            } else {
                logger.warn("Resolver call failed for {}", cadastralNumber, e);
            }
            return Optional.empty();
        }
    }

    /**
     * Response body of the resolver: {@code {"result": true|false}}.
     */
    @Getter
    @Setter
    @NoArgsConstructor
    public static class ResolverPayload {
        @JsonProperty("result")
        private Boolean result;
    }
}
