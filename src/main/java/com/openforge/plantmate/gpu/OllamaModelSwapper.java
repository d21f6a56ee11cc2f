package com.openforge.plantmate.gpu;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Swaps models on an Ollama server through empty {@code /api/generate} requests:
 * {@code keep_alive "0s"} evicts the current model, {@code keep_alive "-1"} loads
 * the target and pins it until the next swap. The context size is sent on every
 * load, otherwise Ollama falls back to its small default.
 */
@Slf4j
@Component
public class OllamaModelSwapper implements ModelSwapper {

    private final HttpClient   httpClient;
    private final ObjectMapper objectMapper;
    private final Duration     requestTimeout;

    public OllamaModelSwapper(HttpClient httpClient, ObjectMapper objectMapper, GpuProperties properties) {
        this.httpClient     = httpClient;
        this.objectMapper   = objectMapper;
        this.requestTimeout = properties.swapTimeout();
    }

    @Override
    public void swap(ModelSlot slot, List<String> evictModels, String targetModel)
            throws IOException, InterruptedException {

        for (String model : evictModels) {
            if (model.equals(targetModel)) {
                continue;
            }
            log.info("[GPU:{}] Unloading {}", slot.id(), model);
            ObjectNode unload = objectMapper.createObjectNode()
                    .put("model", model)
                    .put("prompt", "")
                    .put("keep_alive", "0s");
            try {
                post(slot, unload);
            } catch (IOException e) {
                // the load below evicts it anyway once memory runs short
                log.warn("[GPU:{}] Unload of {} failed: {}. Loading {} regardless.",
                        slot.id(), model, e.getMessage(), targetModel);
            }
        }

        log.info("[GPU:{}] Loading {} (num_ctx={})", slot.id(), targetModel, slot.numCtx());
        ObjectNode load = objectMapper.createObjectNode()
                .put("model", targetModel)
                .put("prompt", "")
                .put("keep_alive", "-1");
        load.putObject("options").put("num_ctx", slot.numCtx());
        post(slot, load);
        log.info("[GPU:{}] Loaded {}", slot.id(), targetModel);
    }

    private void post(ModelSlot slot, ObjectNode body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(slot.baseUrl() + "/api/generate"))
                .header("Content-Type", "application/json")
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() / 100 != 2) {
            throw new IOException("Ollama %s returned HTTP %d: %s".formatted(
                    slot.baseUrl(), response.statusCode(), response.body()));
        }
    }
}
