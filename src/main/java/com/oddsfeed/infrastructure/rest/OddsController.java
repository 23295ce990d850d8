package com.oddsfeed.infrastructure.rest;

import com.oddsfeed.application.usecase.FetchOddsUseCase;
import com.oddsfeed.domain.model.OddsResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for event odds.
 */
@RestController
@RequestMapping("/odds")
public class OddsController {

    private static final Logger logger = LoggerFactory.getLogger(OddsController.class);

    private final FetchOddsUseCase fetchOddsUseCase;

    public OddsController(FetchOddsUseCase fetchOddsUseCase) {
        this.fetchOddsUseCase = fetchOddsUseCase;
    }

    /**
     * Returns the normalized odds of an event.
     *
     * GET /odds/{eventId}
     *
     * Upstream failures are rendered by {@link OddsApiExceptionHandler}.
     */
    @GetMapping("/{eventId}")
    public ResponseEntity<OddsResponse> getOdds(@PathVariable String eventId) {
        logger.info("Received odds request for event {}", eventId);
        return ResponseEntity.ok(fetchOddsUseCase.execute(eventId));
    }
}
