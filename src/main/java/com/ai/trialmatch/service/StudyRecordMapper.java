package com.ai.trialmatch.service;

import com.ai.trialmatch.exception.UpstreamParseException;
import com.ai.trialmatch.model.Trial;
import com.ai.trialmatch.model.TrialContact;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Maps one ClinicalTrials.gov v2 study record onto a {@link Trial}.
 */
public class StudyRecordMapper {

    static final String STUDY_LINK_PREFIX = "https://clinicaltrials.gov/study/";

    private static final String MULTIPLE_SITES = "Multiple Sites";

    /**
     * @param requestedLocation location the search was scoped to, or {@code null} for a nationwide search
     * @throws UpstreamParseException when the record has no protocol section or no NCT id
     */
    public Trial toTrial(JsonNode study, String requestedLocation) {
        if (study == null || !study.isObject()) {
            throw new UpstreamParseException("Study record is not an object");
        }
        JsonNode protocol = study.path("protocolSection");
        if (!protocol.isObject()) {
            throw new UpstreamParseException("Study record has no protocolSection");
        }

        JsonNode identification = protocol.path("identificationModule");
        String nctId = text(identification, "nctId");
        if (nctId == null) {
            throw new UpstreamParseException("Study record has no nctId");
        }
        String title = StringUtils.firstNonBlank(
                text(identification, "briefTitle"),
                text(identification, "officialTitle"),
                "Untitled Study");

        String status = formatStatus(text(protocol.path("statusModule"), "overallStatus"));

        JsonNode phases = protocol.path("designModule").path("phases");
        String phase = phases.isArray() && phases.size() > 0
                ? formatPhase(phases.get(0).asText(""))
                : "Not Specified";

        String location = StringUtils.defaultIfBlank(requestedLocation, MULTIPLE_SITES);
        String facility = MULTIPLE_SITES;
        TrialContact contact = null;
        JsonNode sites = protocol.path("contactsLocationsModule").path("locations");
        if (sites.isArray() && sites.size() > 0) {
            JsonNode site = sites.get(0);
            facility = StringUtils.defaultIfBlank(text(site, "facility"), "Unknown Facility");
            String city = text(site, "city");
            String state = text(site, "state");
            if (city != null && state != null) {
                location = city + ", " + state;
            }
            contact = firstContact(site.path("contacts"));
        }

        String sponsor = StringUtils.defaultIfBlank(
                text(protocol.path("sponsorCollaboratorsModule").path("leadSponsor"), "name"),
                "Unknown Sponsor");

        return Trial.builder()
                .nctId(nctId)
                .title(title)
                .phase(phase)
                .status(status)
                .location(location)
                .facility(facility)
                .sponsor(sponsor)
                .contact(contact)
                .link(STUDY_LINK_PREFIX + nctId)
                .build();
    }

    /** "PHASE2" -> "Phase 2", "EARLY_PHASE1" -> "Early Phase 1", "NA" -> "Not Applicable". */
    static String formatPhase(String raw) {
        if (StringUtils.isBlank(raw)) return "Not Specified";
        String p = raw.trim().toUpperCase(Locale.ROOT);
        if ("NA".equals(p)) return "Not Applicable";
        return p.replace("EARLY_", "Early ").replace("PHASE", "Phase ").trim();
    }

    /** "RECRUITING" -> "Recruiting", "NOT_YET_RECRUITING" -> "Not Yet Recruiting". */
    static String formatStatus(String raw) {
        if (StringUtils.isBlank(raw)) return "Unknown";
        return Arrays.stream(raw.trim().toLowerCase(Locale.ROOT).split("_"))
                .filter(StringUtils::isNotEmpty)
                .map(StringUtils::capitalize)
                .collect(Collectors.joining(" "));
    }

    private static TrialContact firstContact(JsonNode contacts) {
        if (!contacts.isArray() || contacts.size() == 0) return null;
        JsonNode c = contacts.get(0);
        String name = text(c, "name");
        String phone = text(c, "phone");
        String email = text(c, "email");
        if (name == null && phone == null && email == null) return null;
        return new TrialContact(name, phone, email);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isValueNode()) return null;
        return StringUtils.trimToNull(value.asText());
    }
}
