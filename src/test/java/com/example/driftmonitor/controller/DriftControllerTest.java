package com.example.driftmonitor.controller;

import com.example.driftmonitor.config.DriftProperties;
import com.example.driftmonitor.model.InteractionRecord;
import com.example.driftmonitor.monitor.behavior.BehaviorDriftMonitor;
import com.example.driftmonitor.service.DriftPipelineService;
import com.example.driftmonitor.store.InMemoryLogAccessor;
import com.example.driftmonitor.store.LogStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

@ExtendWith(MockitoExtension.class)
class DriftControllerTest {

    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");

    @Mock
    private DriftPipelineService pipelineService;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        InMemoryLogAccessor logs = new InMemoryLogAccessor();
        for (int i = 0; i < 3; i++) {
            logs.add(LogStream.INTERACTIONS, InteractionRecord.builder().id("r" + i)
                    .timestamp(NOW.minus(Duration.ofHours(i + 1))).userQuery("q" + i)
                    .modelResponse("I cannot help with that").refusalFlag(true).build());
        }
        BehaviorDriftMonitor monitor = new BehaviorDriftMonitor(logs, new DriftProperties.Behavior(), 10_000,
                Clock.fixed(NOW, ZoneOffset.UTC));
        client = WebTestClient.bindToController(new DriftController(pipelineService, monitor)).build();
    }

    @Test
    void testRefusals_ZeroLimitReturnsOneRow() {
        client.get().uri("/drift/refusals?days=7&limit=0")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].query").isEqualTo("q0");
    }

    @Test
    void testRefusals_NonPositiveDaysIsBadRequest() {
        client.get().uri("/drift/refusals?days=0")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("days must be positive, got 0");
    }
}
