package com.ai.trialmatch.service;

import com.ai.trialmatch.exception.UpstreamParseException;
import com.ai.trialmatch.exception.UpstreamTimeoutException;
import com.ai.trialmatch.exception.UpstreamUnavailableException;
import com.ai.trialmatch.model.Trial;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Single-request gateway to the ClinicalTrials.gov v2 {@code /studies} endpoint.
 * Only recruiting studies are requested, one page of {@value #PAGE_SIZE}.
 * Fallback policy lives in {@link TrialSearchService}, not here.
 */
@Service
public class ClinicalTrialsClient {

    private static final Logger log = LoggerFactory.getLogger(ClinicalTrialsClient.class);

    public static final int PAGE_SIZE = 10;
    static final String RECRUITING = "RECRUITING";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();
    private final StudyRecordMapper studyMapper = new StudyRecordMapper();
    private final String baseUrl;

    public ClinicalTrialsClient(@Qualifier("clinicalTrialsRestTemplate") RestTemplate restTemplate,
                                @Value("${clinicaltrials.base-url:https://clinicaltrials.gov/api/v2}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = StringUtils.removeEnd(baseUrl.trim(), "/");
    }

    /**
     * @param location normalized "City, ST" filter, or {@code null} for a nationwide query
     * @return at most {@value #PAGE_SIZE} trials; malformed study records are skipped
     * @throws UpstreamTimeoutException     when the registry does not answer in time
     * @throws UpstreamUnavailableException on connection errors, error statuses or an unreadable body
     */
    public List<Trial> fetchStudies(String condition, String location) {
        URI uri = buildUri(condition, location);
        log.info("Calling ClinicalTrials.gov: cond='{}' locn='{}'", condition, location);

        String body;
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(uri, String.class);
            body = response.getBody();
        } catch (ResourceAccessException e) {
            if (ExceptionUtils.indexOfType(e, SocketTimeoutException.class) >= 0) {
                throw new UpstreamTimeoutException("ClinicalTrials.gov timed out", e);
            }
            throw new UpstreamUnavailableException("ClinicalTrials.gov unreachable: " + e.getMessage(), e);
        } catch (RestClientResponseException e) {
            throw new UpstreamUnavailableException("ClinicalTrials.gov returned HTTP " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new UpstreamUnavailableException("ClinicalTrials.gov call failed: " + e.getMessage(), e);
        }

        if (StringUtils.isBlank(body)) {
            throw new UpstreamUnavailableException("ClinicalTrials.gov returned an empty body");
        }
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new UpstreamUnavailableException("ClinicalTrials.gov returned invalid JSON", e);
        }
        return parseStudies(root, location);
    }

    URI buildUri(String condition, String location) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl).path("/studies");
        if (StringUtils.isNotBlank(condition)) {
            builder.queryParam("query.cond", condition);
        }
        if (StringUtils.isNotBlank(location)) {
            builder.queryParam("query.locn", location);
        }
        return builder
                .queryParam("filter.overallStatus", RECRUITING)
                .queryParam("pageSize", PAGE_SIZE)
                .queryParam("format", "json")
                .encode()
                .build()
                .toUri();
    }

    private List<Trial> parseStudies(JsonNode root, String location) {
        JsonNode studies = root.path("studies");
        List<Trial> trials = new ArrayList<>();
        if (!studies.isArray()) {
            return trials;
        }
        for (JsonNode study : studies) {
            if (trials.size() >= PAGE_SIZE) break;
            try {
                trials.add(studyMapper.toTrial(study, location));
            } catch (UpstreamParseException e) {
                log.warn("Skipping study record: {}", e.getMessage());
            }
        }
        return trials;
    }
}
