package com.ai.trialmatch.service;

import com.ai.trialmatch.component.ConversationStore;
import com.ai.trialmatch.component.ResponsePhrases;
import com.ai.trialmatch.component.SessionLockRegistry;
import com.ai.trialmatch.conversation.ConversationIntent;
import com.ai.trialmatch.conversation.ConversationState;
import com.ai.trialmatch.conversation.IntentContext;
import com.ai.trialmatch.exception.SessionNotFoundException;
import com.ai.trialmatch.model.ExtractedEntities;
import com.ai.trialmatch.model.PatientIntake;
import com.ai.trialmatch.model.SearchCriteria;
import com.ai.trialmatch.model.Session;
import com.ai.trialmatch.model.Trial;
import com.ai.trialmatch.model.TrialSearchResult;
import com.ai.trialmatch.model.Turn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Single entry for the conversation: turns one inbound intake or message into one reply and
 * moves the session through NEW -> INTAKE_COMPLETE -> ENDED. Everything for one user runs under
 * that user's lock, so turns are stored in the order requests were accepted.
 */
@Service
public class ConversationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConversationOrchestrator.class);

    private final ConversationStore store;
    private final SessionLockRegistry locks;
    private final IntentResolver intentResolver;
    private final EntityExtractor entityExtractor;
    private final EntityMerger entityMerger;
    private final TrialSearchService trialSearchService;
    private final ResponsePhrases phrases;

    public ConversationOrchestrator(ConversationStore store,
                                    SessionLockRegistry locks,
                                    IntentResolver intentResolver,
                                    EntityExtractor entityExtractor,
                                    EntityMerger entityMerger,
                                    TrialSearchService trialSearchService,
                                    ResponsePhrases phrases) {
        this.store = store;
        this.locks = locks;
        this.intentResolver = intentResolver;
        this.entityExtractor = entityExtractor;
        this.entityMerger = entityMerger;
        this.trialSearchService = trialSearchService;
        this.phrases = phrases;
    }

    /**
     * Stores (or replaces) the intake and opens the conversation.
     */
    public String submitIntake(PatientIntake intake) {
        String userId = intake.getUserId();
        Optional<SessionLockRegistry.Handle> handle = locks.acquire(userId);
        try {
            store.upsertIntake(userId, intake);
        } finally {
            handle.ifPresent(SessionLockRegistry.Handle::close);
        }
        return phrases.intakeAccepted(intake.getCancerType(), intake.getLocation());
    }

    public Reply handleMessage(String userId, String text) {
        Optional<SessionLockRegistry.Handle> handle = locks.acquire(userId);
        if (handle.isEmpty()) {
            return Reply.text(phrases.stillWorking(), null);
        }
        try (SessionLockRegistry.Handle ignored = handle.get()) {
            return handleLocked(userId, text);
        } catch (SessionNotFoundException e) {
            log.info("[{}] Message without a session", userId);
            return Reply.requiresIntake(phrases.requiresIntake());
        }
    }

    /**
     * Removes the session. Always succeeds, whether or not a session existed.
     */
    public void endSession(String userId) {
        Optional<SessionLockRegistry.Handle> handle = locks.acquire(userId);
        try {
            store.clear(userId);
        } finally {
            handle.ifPresent(SessionLockRegistry.Handle::close);
        }
    }

    private Reply handleLocked(String userId, String text) {
        Session session = store.get(userId);
        if (!session.isIntakeComplete()) {
            return Reply.requiresIntake(phrases.requiresIntake());
        }
        store.appendTurn(userId, Turn.user(text));

        if (session.isEnded()) {
            return respond(userId, Reply.text(phrases.conversationEnded(), null));
        }

        PatientIntake intake = session.getIntake();
        ConversationIntent intent = intentResolver.classify(text, IntentContext.intakeComplete(userId));
        log.debug("[{}] intent={} via {}", userId, intent, intentResolver.name());

        switch (intent) {
            case GREETING:
                return respond(userId, Reply.text(phrases.greeting(intake.getCancerType()), intent));
            case GOODBYE:
                store.transition(userId, ConversationState.ENDED);
                return respond(userId, Reply.text(phrases.goodbye(), intent));
            case FIND_TRIALS:
                return respond(userId, findTrials(userId, intake, text));
            case UNKNOWN:
            default:
                return respond(userId, Reply.text(phrases.clarify(), ConversationIntent.UNKNOWN));
        }
    }

    private Reply findTrials(String userId, PatientIntake intake, String text) {
        ExtractedEntities entities = entityExtractor.extract(text);
        SearchCriteria criteria = entityMerger.merge(intake, entities);
        log.info("[{}] Searching trials: {}", userId, criteria);

        TrialSearchResult result = trialSearchService.search(criteria.getCancerType(), criteria.getLocation());
        String cancerType = criteria.getCancerType();
        String location = criteria.getLocation();

        String message;
        if (result.isDegraded()) {
            message = phrases.searchUnavailable(cancerType, location);
        } else if (result.isEmpty()) {
            message = phrases.noTrialsFound(cancerType, location);
        } else if (result.isNationwide()) {
            message = phrases.nationwideTrialsFound(result.size(), cancerType, location);
        } else {
            message = phrases.trialsFound(result.size(), cancerType, location);
        }
        return Reply.trials(message, result);
    }

    private Reply respond(String userId, Reply reply) {
        Turn turn = reply.getTrials() != null
                ? Turn.botWithTrials(reply.getText(), reply.getTrials())
                : Turn.bot(reply.getText());
        store.appendTurn(userId, turn);
        return reply;
    }

    public static final class Reply {
        private final String text;
        private final ConversationIntent intent;
        private final List<Trial> trials;
        private final boolean nationwide;
        private final boolean degraded;
        private final boolean requiresIntake;

        private Reply(String text, ConversationIntent intent, List<Trial> trials,
                      boolean nationwide, boolean degraded, boolean requiresIntake) {
            this.text = text != null ? text : "";
            this.intent = intent;
            this.trials = trials;
            this.nationwide = nationwide;
            this.degraded = degraded;
            this.requiresIntake = requiresIntake;
        }

        static Reply text(String text, ConversationIntent intent) {
            return new Reply(text, intent, null, false, false, false);
        }

        static Reply trials(String text, TrialSearchResult result) {
            return new Reply(text, ConversationIntent.FIND_TRIALS, result.getTrials(),
                    result.isNationwide(), result.isDegraded(), false);
        }

        static Reply requiresIntake(String text) {
            return new Reply(text, null, null, false, false, true);
        }

        public String getText() {
            return text;
        }

        public ConversationIntent getIntent() {
            return intent;
        }

        /** Non-null only for trial searches, possibly empty. */
        public List<Trial> getTrials() {
            return trials;
        }

        public boolean isNationwide() {
            return nationwide;
        }

        public boolean isDegraded() {
            return degraded;
        }

        public boolean isRequiresIntake() {
            return requiresIntake;
        }
    }
}
