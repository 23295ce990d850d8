package com.oddsfeed;

import com.oddsfeed.application.usecase.FetchOddsUseCase;
import com.oddsfeed.domain.ports.OddsGateway;
import com.oddsfeed.domain.ports.OddsPayloadNormalizer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
class OddsFeedApplicationTest {

    @Autowired
    private FetchOddsUseCase fetchOddsUseCase;

    @Autowired
    private OddsGateway oddsGateway;

    @Autowired
    private OddsPayloadNormalizer oddsPayloadNormalizer;

    @Test
    void contextLoads() {
        assertNotNull(fetchOddsUseCase);
        assertNotNull(oddsPayloadNormalizer);
        assertEquals("livesport", oddsGateway.getProviderName());
    }
}
