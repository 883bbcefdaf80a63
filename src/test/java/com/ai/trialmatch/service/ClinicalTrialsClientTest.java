package com.ai.trialmatch.service;

import com.ai.trialmatch.exception.UpstreamTimeoutException;
import com.ai.trialmatch.exception.UpstreamUnavailableException;
import com.ai.trialmatch.model.Trial;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.client.RequestMatcher;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

public class ClinicalTrialsClientTest {

    private static final String BASE_URL = "https://registry.test/api/v2";

    private MockRestServiceServer server;
    private ClinicalTrialsClient client;

    @BeforeEach
    public void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new ClinicalTrialsClient(restTemplate, BASE_URL + "/");
    }

    @Test
    public void shouldQueryRecruitingStudiesForConditionAndLocation() {
        server.expect(method(HttpMethod.GET))
                .andExpect(path("/api/v2/studies"))
                .andExpect(query("query.cond=breast cancer"))
                .andExpect(query("query.locn=Boston, MA"))
                .andExpect(query("filter.overallStatus=RECRUITING"))
                .andExpect(query("pageSize=10"))
                .andRespond(withSuccess(new ClassPathResource("clinicaltrials/studies-breast-boston.json"), MediaType.APPLICATION_JSON));

        List<Trial> trials = client.fetchStudies("breast cancer", "Boston, MA");

        server.verify();
        assertThat(trials).extracting(Trial::getNctId).containsExactly("NCT05123456", "NCT06000001");

        Trial first = trials.get(0);
        assertThat(first.getTitle()).isEqualTo("Neoadjuvant Therapy in Stage II HER2+ Breast Cancer");
        assertThat(first.getPhase()).isEqualTo("Phase 2");
        assertThat(first.getStatus()).isEqualTo("Recruiting");
        assertThat(first.getLocation()).isEqualTo("Boston, Massachusetts");
        assertThat(first.getFacility()).isEqualTo("Dana-Farber Cancer Institute");
        assertThat(first.getSponsor()).isEqualTo("Dana-Farber Cancer Institute");
        assertThat(first.getLink()).isEqualTo("https://clinicaltrials.gov/study/NCT05123456");
        assertThat(first.getContact().getPhone()).isEqualTo("617-555-0100");
        assertThat(first.isNationwide()).isFalse();

        Trial second = trials.get(1);
        assertThat(second.getTitle()).isEqualTo("Exercise During Adjuvant Endocrine Therapy");
        assertThat(second.getPhase()).isEqualTo("Early Phase 1");
        assertThat(second.getStatus()).isEqualTo("Not Yet Recruiting");
        assertThat(second.getLocation()).isEqualTo("Boston, MA");
        assertThat(second.getFacility()).isEqualTo("Multiple Sites");
        assertThat(second.getSponsor()).isEqualTo("Unknown Sponsor");
        assertThat(second.getContact()).isNull();
    }

    @Test
    public void shouldOmitLocationFilterForNationwideQuery() {
        server.expect(method(HttpMethod.GET))
                .andExpect(request -> assertThat(request.getURI().getQuery()).doesNotContain("query.locn"))
                .andRespond(withSuccess("{\"studies\": []}", MediaType.APPLICATION_JSON));

        assertThat(client.fetchStudies("lung cancer", null)).isEmpty();
        server.verify();
    }

    @Test
    public void shouldTreatMissingStudiesArrayAsEmpty() {
        server.expect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"totalCount\": 0}", MediaType.APPLICATION_JSON));

        assertThat(client.fetchStudies("lung cancer", "Austin, TX")).isEmpty();
    }

    @Test
    public void shouldRaiseTimeoutWhenRegistryStalls() {
        server.expect(method(HttpMethod.GET))
                .andRespond(request -> {
                    throw new SocketTimeoutException("Read timed out");
                });

        assertThatThrownBy(() -> client.fetchStudies("lung cancer", "Austin, TX"))
                .isInstanceOf(UpstreamTimeoutException.class);
    }

    @Test
    public void shouldRaiseUnavailableOnServerError() {
        server.expect(method(HttpMethod.GET)).andRespond(withServerError());

        assertThatThrownBy(() -> client.fetchStudies("lung cancer", "Austin, TX"))
                .isInstanceOf(UpstreamUnavailableException.class)
                .hasMessageContaining("500");
    }

    @Test
    public void shouldRaiseUnavailableOnInvalidJson() {
        server.expect(method(HttpMethod.GET))
                .andRespond(withSuccess("<html>maintenance</html>", MediaType.TEXT_HTML));

        assertThatThrownBy(() -> client.fetchStudies("lung cancer", "Austin, TX"))
                .isInstanceOf(UpstreamUnavailableException.class);
    }

    private static RequestMatcher path(String expected) {
        return request -> assertThat(request.getURI().getPath()).isEqualTo(expected);
    }

    private static RequestMatcher query(String expectedPair) {
        return request -> assertThat(request.getURI().getQuery()).contains(expectedPair);
    }
}
