package com.ai.trialmatch.service;

import com.ai.trialmatch.exception.NlpModelException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the externally hosted intent and NER models.
 * <pre>
 * POST {base}/intent    {"text": "..."}         -> {"label": "find_trials", "confidence": 0.97}
 * POST {base}/entities  {"words": ["..", ".."]} -> {"labels": ["O", "B-LOCATION", ..]}
 * </pre>
 */
@Service
public class NlpModelClient {

    private static final Logger log = LoggerFactory.getLogger(NlpModelClient.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String baseUrl;

    public NlpModelClient(@Qualifier("nlpModelRestTemplate") RestTemplate restTemplate,
                          @Value("${nlp.model.base-url:}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = StringUtils.removeEnd(StringUtils.trimToEmpty(baseUrl), "/");
    }

    public boolean isConfigured() {
        return StringUtils.isNotBlank(baseUrl);
    }

    public IntentPrediction predictIntent(String text) {
        Map<String, Object> body = new HashMap<>();
        body.put("text", text);
        JsonNode root = post("/intent", body);
        String label = root.path("label").asText("");
        if (label.isEmpty()) {
            throw new NlpModelException("Intent model response has no label");
        }
        return new IntentPrediction(label, root.path("confidence").asDouble(0.0));
    }

    public List<String> predictTokenLabels(List<String> words) {
        Map<String, Object> body = new HashMap<>();
        body.put("words", words);
        JsonNode labels = post("/entities", body).path("labels");
        if (!labels.isArray()) {
            throw new NlpModelException("NER model response has no labels array");
        }
        List<String> result = new ArrayList<>(labels.size());
        labels.forEach(node -> result.add(node.asText("O")));
        return result;
    }

    private JsonNode post(String path, Map<String, Object> body) {
        if (!isConfigured()) {
            throw new NlpModelException("nlp.model.base-url is not set");
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    baseUrl + path, new HttpEntity<>(body, headers), String.class);
            if (StringUtils.isBlank(response.getBody())) {
                throw new NlpModelException("Empty response from model at " + path);
            }
            return mapper.readTree(response.getBody());
        } catch (RestClientException e) {
            throw new NlpModelException("Model call to " + path + " failed: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            log.debug("Unreadable model response from {}", path, e);
            throw new NlpModelException("Model at " + path + " returned invalid JSON", e);
        }
    }

    public static final class IntentPrediction {
        private final String label;
        private final double confidence;

        public IntentPrediction(String label, double confidence) {
            this.label = label;
            this.confidence = confidence;
        }

        public String getLabel() {
            return label;
        }

        public double getConfidence() {
            return confidence;
        }
    }
}
