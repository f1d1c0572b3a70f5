package com.cadastral.lookup.api.controller;

import com.cadastral.lookup.api.dto.ResolverResultDto;
import com.cadastral.lookup.infrastructure.config.ResolverProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Stand-in for the external cadastral registry.
 *
 * Answers a uniformly random boolean after a random delay between the configured
 * bounds, so the resolver client's timeout handling is exercised in real deployments.
 */
@RestController
public class ResolverStubController {

    private static final Logger logger = LoggerFactory.getLogger(ResolverStubController.class);

    private final Duration minDelay;
    private final Duration maxDelay;

    public ResolverStubController(ResolverProperties resolverProperties) {
        this.minDelay = resolverProperties.getStub().getMinDelay();
        this.maxDelay = resolverProperties.getStub().getMaxDelay();
    }

    /**
     * GET /result?cadastral_number=X
     */
    @GetMapping("/result")
    public ResponseEntity<ResolverResultDto> result(@RequestParam("cadastral_number") String cadastralNumber) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        boolean result = random.nextBoolean();
        long delayMillis = randomDelayMillis(random);

        logger.debug("Stub resolver answering {} for {} after {} ms", result, cadastralNumber, delayMillis);
        try {
            Thread.sleep(delayMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
        return ResponseEntity.ok(new ResolverResultDto(result));
    }

    private long randomDelayMillis(ThreadLocalRandom random) {
        long min = minDelay.toMillis();
        long max = Math.max(min, maxDelay.toMillis());
        return min == max ? min : random.nextLong(min, max + 1);
    }
}
