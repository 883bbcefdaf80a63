package com.ai.trialmatch.controller;

import com.ai.trialmatch.dto.EndSessionRequest;
import com.ai.trialmatch.dto.IntakeRequest;
import com.ai.trialmatch.dto.IntakeResponse;
import com.ai.trialmatch.dto.MessageRequest;
import com.ai.trialmatch.dto.MessageResponse;
import com.ai.trialmatch.exception.MissingFieldException;
import com.ai.trialmatch.model.PatientIntake;
import com.ai.trialmatch.service.ConversationOrchestrator;
import com.ai.trialmatch.service.IntakeValidator;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class ChatController {

    private static final Logger log = LoggerFactory.getLogger(ChatController.class);

    static final String SESSION_CLEARED = "session_cleared";

    private final ConversationOrchestrator orchestrator;
    private final IntakeValidator intakeValidator;

    public ChatController(ConversationOrchestrator orchestrator, IntakeValidator intakeValidator) {
        this.orchestrator = orchestrator;
        this.intakeValidator = intakeValidator;
    }

    @PostMapping("/intake")
    public IntakeResponse intake(@RequestBody IntakeRequest request) {
        PatientIntake intake = intakeValidator.validate(request);
        log.info("[{}] Intake received | cancer={} stage={} location={}",
                intake.getUserId(), intake.getCancerType(), intake.getStage(), intake.getLocation());
        return new IntakeResponse(orchestrator.submitIntake(intake), true);
    }

    @PostMapping("/message")
    public MessageResponse message(@RequestBody MessageRequest request) {
        String userId = requireUserId(request.getUserId());
        ConversationOrchestrator.Reply reply = orchestrator.handleMessage(userId, StringUtils.defaultString(request.getMessage()));

        if (reply.isRequiresIntake()) {
            return MessageResponse.builder()
                    .response(reply.getText())
                    .requiresIntake(true)
                    .build();
        }
        MessageResponse.MessageResponseBuilder response = MessageResponse.builder()
                .response(reply.getText())
                .intent(reply.getIntent() != null ? reply.getIntent().getLabel() : null);
        if (reply.getTrials() != null) {
            response.trials(reply.getTrials())
                    .nationwide(reply.isNationwide())
                    .degraded(reply.isDegraded());
        }
        return response.build();
    }

    @PostMapping("/end-session")
    public Map<String, String> endSession(@RequestBody(required = false) EndSessionRequest request) {
        String userId = request != null ? request.getUserId() : null;
        if (StringUtils.isNotBlank(userId)) {
            orchestrator.endSession(userId.trim());
        }
        return Map.of("status", SESSION_CLEARED);
    }

    private static String requireUserId(String userId) {
        if (StringUtils.isBlank(userId)) {
            throw new MissingFieldException("user_id");
        }
        return userId.trim();
    }
}
