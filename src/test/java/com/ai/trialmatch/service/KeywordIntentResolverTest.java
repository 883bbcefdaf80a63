package com.ai.trialmatch.service;

import com.ai.trialmatch.conversation.ConversationIntent;
import com.ai.trialmatch.conversation.IntentContext;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class KeywordIntentResolverTest {

    private final KeywordIntentResolver resolver = new KeywordIntentResolver();
    private final IntentContext complete = IntentContext.intakeComplete("u1");
    private final IntentContext incomplete = IntentContext.withoutIntake("u1");

    @Test
    public void shouldRecogniseGreetings() {
        assertThat(resolver.classify("Hello!", complete)).isEqualTo(ConversationIntent.GREETING);
        assertThat(resolver.classify("hi there", complete)).isEqualTo(ConversationIntent.GREETING);
        assertThat(resolver.classify("Hey", incomplete)).isEqualTo(ConversationIntent.GREETING);
    }

    @Test
    public void shouldRecogniseGoodbyes() {
        assertThat(resolver.classify("Thanks, bye", complete)).isEqualTo(ConversationIntent.GOODBYE);
        assertThat(resolver.classify("Thank you, goodbye!", complete)).isEqualTo(ConversationIntent.GOODBYE);
    }

    @Test
    public void shouldPreferGreetingWhenBothKeywordsPresent() {
        assertThat(resolver.classify("Hi, bye", complete)).isEqualTo(ConversationIntent.GREETING);
        assertThat(resolver.classify("Bye, hi", complete)).isEqualTo(ConversationIntent.GREETING);
    }

    @Test
    public void shouldRecogniseGreetingAfterComma() {
        assertThat(resolver.classify("Oh, hi", complete)).isEqualTo(ConversationIntent.GREETING);
        assertThat(resolver.classify("Thanks, hi there", complete)).isEqualTo(ConversationIntent.GREETING);
        assertThat(resolver.classify("Well, hi!", incomplete)).isEqualTo(ConversationIntent.GREETING);
    }

    @Test
    public void shouldDefaultToFindTrialsOnlyWhenIntakeComplete() {
        assertThat(resolver.classify("Find me trials in Los Angeles", complete)).isEqualTo(ConversationIntent.FIND_TRIALS);
        assertThat(resolver.classify("Find me trials in Los Angeles", incomplete)).isEqualTo(ConversationIntent.UNKNOWN);
    }

    @Test
    public void shouldNotMatchKeywordsInsideWords() {
        assertThat(resolver.classify("which trials are in Ohio or this city", complete)).isEqualTo(ConversationIntent.FIND_TRIALS);
        assertThat(resolver.classify("anything in Honolulu, HI", complete)).isEqualTo(ConversationIntent.FIND_TRIALS);
        assertThat(resolver.classify("trials near Hilo, HI?", complete)).isEqualTo(ConversationIntent.FIND_TRIALS);
    }

    @Test
    public void shouldTreatBlankTextAsUnknown() {
        assertThat(resolver.classify("   ", complete)).isEqualTo(ConversationIntent.UNKNOWN);
        assertThat(resolver.classify(null, complete)).isEqualTo(ConversationIntent.UNKNOWN);
    }
}
