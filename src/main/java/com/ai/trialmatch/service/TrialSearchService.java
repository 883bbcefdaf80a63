package com.ai.trialmatch.service;

import com.ai.trialmatch.exception.TrialRegistryException;
import com.ai.trialmatch.model.Trial;
import com.ai.trialmatch.model.TrialSearchResult;
import com.ai.trialmatch.utils.LocationNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Two-step trial search: a location-scoped query, then, only if that found nothing or failed,
 * one nationwide query without the location filter. Never throws for registry trouble; a search
 * whose last attempt failed comes back empty and {@code degraded}.
 */
@Service
public class TrialSearchService {

    private static final Logger log = LoggerFactory.getLogger(TrialSearchService.class);

    private final ClinicalTrialsClient client;

    public TrialSearchService(ClinicalTrialsClient client) {
        this.client = client;
    }

    public TrialSearchResult search(String cancerType, String location) {
        String normalized = LocationNormalizer.normalize(location);

        Attempt local = attempt(cancerType, normalized);
        if (!local.failed && !local.trials.isEmpty()) {
            return TrialSearchResult.local(mark(local.trials, false));
        }
        if (normalized == null) {
            return local.failed ? TrialSearchResult.degraded() : TrialSearchResult.empty();
        }

        log.info("No local {} trials near '{}' ({}), searching nationwide",
                cancerType, normalized, local.failed ? "search failed" : "empty");
        Attempt nationwide = attempt(cancerType, null);
        if (nationwide.failed) {
            return TrialSearchResult.degraded();
        }
        if (nationwide.trials.isEmpty()) {
            return TrialSearchResult.empty();
        }
        return TrialSearchResult.nationwide(mark(nationwide.trials, true));
    }

    private Attempt attempt(String cancerType, String location) {
        try {
            return new Attempt(client.fetchStudies(cancerType, location), false);
        } catch (TrialRegistryException e) {
            log.warn("Trial search attempt failed (cond='{}' locn='{}'): {}",
                    cancerType, location, e.getMessage());
            return new Attempt(List.of(), true);
        }
    }

    private static List<Trial> mark(List<Trial> trials, boolean nationwide) {
        return trials.stream()
                .limit(ClinicalTrialsClient.PAGE_SIZE)
                .map(t -> t.asNationwide(nationwide))
                .collect(Collectors.toList());
    }

    private static final class Attempt {
        private final List<Trial> trials;
        private final boolean failed;

        private Attempt(List<Trial> trials, boolean failed) {
            this.trials = trials != null ? trials : List.of();
            this.failed = failed;
        }
    }
}
