package com.ai.trialmatch.service;

import com.ai.trialmatch.component.ConversationStore;
import com.ai.trialmatch.component.ResponsePhrases;
import com.ai.trialmatch.component.SessionLockRegistry;
import com.ai.trialmatch.conversation.ConversationIntent;
import com.ai.trialmatch.conversation.ConversationState;
import com.ai.trialmatch.model.ExtractedEntities;
import com.ai.trialmatch.model.PatientIntake;
import com.ai.trialmatch.model.Session;
import com.ai.trialmatch.model.Trial;
import com.ai.trialmatch.model.TrialSearchResult;
import com.ai.trialmatch.model.Turn;
import com.ai.trialmatch.model.TurnRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ConversationOrchestratorTest {

    private ConversationStore store;
    private EntityExtractor entityExtractor;
    private TrialSearchService trialSearchService;
    private ConversationOrchestrator orchestrator;

    @BeforeEach
    public void setUp() {
        store = new ConversationStore();
        entityExtractor = mock(EntityExtractor.class);
        trialSearchService = mock(TrialSearchService.class);
        when(entityExtractor.extract(anyString())).thenReturn(ExtractedEntities.none());
        orchestrator = new ConversationOrchestrator(
                store,
                new SessionLockRegistry(Duration.ofSeconds(5)),
                new KeywordIntentResolver(),
                entityExtractor,
                new EntityMerger(),
                trialSearchService,
                new ResponsePhrases());
    }

    @Test
    public void shouldRequireIntakeWithoutStoringAnything() {
        ConversationOrchestrator.Reply reply = orchestrator.handleMessage("ghost", "find trials");

        assertThat(reply.isRequiresIntake()).isTrue();
        assertThat(reply.getText()).isEqualTo("Please complete the intake form before proceeding.");
        assertThat(store.find("ghost")).isEmpty();
        verify(trialSearchService, never()).search(any(), any());
    }

    @Test
    public void shouldAcknowledgeIntake() {
        String ack = orchestrator.submitIntake(intake("lung cancer", "California"));

        assertThat(ack).contains("lung cancer").contains("California");
        assertThat(store.get("u1").getState()).isEqualTo(ConversationState.INTAKE_COMPLETE);
    }

    @Test
    public void shouldSearchWithMergedCriteriaAndRecordTurns() {
        orchestrator.submitIntake(intake("lung cancer", "California"));
        when(entityExtractor.extract("Find trials in Los Angeles"))
                .thenReturn(ExtractedEntities.builder().location("Los Angeles").build());
        when(trialSearchService.search("lung cancer", "Los Angeles, CA"))
                .thenReturn(TrialSearchResult.local(List.of(trial("NCT00000001"), trial("NCT00000002"))));

        ConversationOrchestrator.Reply reply = orchestrator.handleMessage("u1", "Find trials in Los Angeles");

        assertThat(reply.getIntent()).isEqualTo(ConversationIntent.FIND_TRIALS);
        assertThat(reply.getTrials()).hasSize(2);
        assertThat(reply.isNationwide()).isFalse();
        assertThat(reply.isDegraded()).isFalse();
        assertThat(reply.getText()).isEqualTo("Here are 2 lung cancer clinical trials recruiting near Los Angeles, CA:");

        Session session = store.get("u1");
        assertThat(session.getTurns()).extracting(Turn::getRole).containsExactly(TurnRole.USER, TurnRole.BOT);
        assertThat(session.getTurns().get(1).hasTrials()).isTrue();
    }

    @Test
    public void shouldExplainNationwideFallback() {
        orchestrator.submitIntake(intake("lung cancer", "Siloam Springs, AR"));
        when(trialSearchService.search("lung cancer", "Siloam Springs, AR"))
                .thenReturn(TrialSearchResult.nationwide(List.of(trial("NCT00000003").asNationwide(true))));

        ConversationOrchestrator.Reply reply = orchestrator.handleMessage("u1", "any trials for me?");

        assertThat(reply.isNationwide()).isTrue();
        assertThat(reply.getText())
                .isEqualTo("I couldn't find any lung cancer trials near Siloam Springs, AR, so here is 1 recruiting trial nationwide:");
    }

    @Test
    public void shouldReportDegradedSearch() {
        orchestrator.submitIntake(intake("lung cancer", "Austin, TX"));
        when(trialSearchService.search(any(), any())).thenReturn(TrialSearchResult.degraded());

        ConversationOrchestrator.Reply reply = orchestrator.handleMessage("u1", "find trials");

        assertThat(reply.isDegraded()).isTrue();
        assertThat(reply.getTrials()).isEmpty();
        assertThat(reply.getText()).contains(ResponsePhrases.REGISTRY_URL);
    }

    @Test
    public void shouldReportNoTrials() {
        orchestrator.submitIntake(intake("rare sarcoma", "Austin, TX"));
        when(trialSearchService.search(any(), any())).thenReturn(TrialSearchResult.empty());

        ConversationOrchestrator.Reply reply = orchestrator.handleMessage("u1", "find trials");

        assertThat(reply.isDegraded()).isFalse();
        assertThat(reply.getTrials()).isEmpty();
        assertThat(reply.getText()).startsWith("I couldn't find any recruiting rare sarcoma trials near Austin, TX");
    }

    @Test
    public void shouldGreetWithoutSearching() {
        orchestrator.submitIntake(intake("lung cancer", "California"));

        ConversationOrchestrator.Reply reply = orchestrator.handleMessage("u1", "Hello there");

        assertThat(reply.getIntent()).isEqualTo(ConversationIntent.GREETING);
        assertThat(reply.getTrials()).isNull();
        assertThat(reply.getText()).contains("lung cancer");
        verify(trialSearchService, never()).search(any(), any());
    }

    @Test
    public void shouldEndConversationOnGoodbyeAndStayEnded() {
        orchestrator.submitIntake(intake("lung cancer", "California"));

        ConversationOrchestrator.Reply bye = orchestrator.handleMessage("u1", "ok bye");
        ConversationOrchestrator.Reply after = orchestrator.handleMessage("u1", "find trials please");

        assertThat(bye.getIntent()).isEqualTo(ConversationIntent.GOODBYE);
        assertThat(bye.getText()).isEqualTo("Goodbye! Feel free to return anytime you need help finding clinical trials.");
        assertThat(after.getIntent()).isNull();
        assertThat(after.getText()).contains("ended");
        assertThat(store.get("u1").getState()).isEqualTo(ConversationState.ENDED);
        assertThat(store.get("u1").getTurns()).hasSize(4);
        verify(trialSearchService, never()).search(any(), any());
    }

    @Test
    public void shouldReopenEndedConversationOnNewIntake() {
        orchestrator.submitIntake(intake("lung cancer", "California"));
        orchestrator.handleMessage("u1", "goodbye");

        orchestrator.submitIntake(intake("breast cancer", "Boston, MA"));
        ConversationOrchestrator.Reply reply = orchestrator.handleMessage("u1", "hi");

        assertThat(reply.getIntent()).isEqualTo(ConversationIntent.GREETING);
        assertThat(reply.getText()).contains("breast cancer");
    }

    @Test
    public void shouldAskForClarificationOnBlankMessage() {
        orchestrator.submitIntake(intake("lung cancer", "California"));

        ConversationOrchestrator.Reply reply = orchestrator.handleMessage("u1", "   ");

        assertThat(reply.getIntent()).isEqualTo(ConversationIntent.UNKNOWN);
        verify(trialSearchService, never()).search(any(), any());
    }

    @Test
    public void shouldForgetSessionOnEnd() {
        orchestrator.submitIntake(intake("lung cancer", "California"));

        orchestrator.endSession("u1");
        orchestrator.endSession("u1");

        assertThat(store.find("u1")).isEmpty();
        assertThat(orchestrator.handleMessage("u1", "find trials").isRequiresIntake()).isTrue();
    }

    private static PatientIntake intake(String cancerType, String location) {
        return PatientIntake.builder()
                .userId("u1")
                .cancerType(cancerType)
                .stage("stage 2")
                .age(60)
                .sex("male")
                .location(location)
                .build();
    }

    private static Trial trial(String nctId) {
        return Trial.builder()
                .nctId(nctId)
                .title("Study " + nctId)
                .phase("Phase 2")
                .status("Recruiting")
                .location("Los Angeles, CA")
                .link("https://clinicaltrials.gov/study/" + nctId)
                .build();
    }
}
