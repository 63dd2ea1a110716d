package com.example.driftmonitor.action.runner;

import com.example.driftmonitor.config.DriftProperties;
import com.example.driftmonitor.decision.DriftAction;
import com.example.driftmonitor.error.ActionExecutionException;
import com.example.driftmonitor.model.DriftWindows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Calls the external action services over HTTP. Each call is a single POST carrying the
 * drift windows, blocked on for at most {@code drift.actions.timeout-ms}. No retries.
 */
public class HttpActionRunner implements ReindexRunner, FineTuneRunner, SafetyFilterRunner {

    private static final Logger logger = LoggerFactory.getLogger(HttpActionRunner.class);

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final DriftProperties.Actions config;

    public HttpActionRunner(WebClient webClient, DriftProperties.Actions config) {
        this.webClient = webClient;
        this.config = config;
    }

    @Override
    public Map<String, Object> reindex(DriftWindows windows) {
        return post(DriftAction.REINDEX_DOCUMENTS, config.getReindexUrl(), windows);
    }

    @Override
    public Map<String, Object> triggerFineTune(DriftWindows windows) {
        return post(DriftAction.FINE_TUNE_MODEL, config.getFineTuneUrl(), windows);
    }

    @Override
    public Map<String, Object> updateSafetyFilters(DriftWindows windows) {
        return post(DriftAction.UPDATE_SAFETY_FILTERS, config.getSafetyFilterUrl(), windows);
    }

    private Map<String, Object> post(DriftAction action, String url, DriftWindows windows) {
        if (url == null || url.isBlank()) {
            throw new ActionExecutionException(action, "No endpoint configured for " + action);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("action", action.value());
        body.put("baseline_start", windows.getBaseline().getStart().toString());
        body.put("baseline_end", windows.getBaseline().getEnd().toString());
        body.put("current_start", windows.getCurrent().getStart().toString());
        body.put("current_end", windows.getCurrent().getEnd().toString());

        logger.info("Dispatching {} to {}", action, url);
        try {
            Map<String, Object> response = webClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JSON_OBJECT)
                    .block(Duration.ofMillis(config.getTimeoutMs()));
            if (response == null) {
                throw new ActionExecutionException(action, "Empty response from " + url);
            }
            return response;
        } catch (WebClientException e) {
            throw new ActionExecutionException(action, action + " call failed: " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            // block(Duration) signals a timeout this way
            throw new ActionExecutionException(action,
                    action + " timed out after " + config.getTimeoutMs() + "ms", e);
        }
    }
}
