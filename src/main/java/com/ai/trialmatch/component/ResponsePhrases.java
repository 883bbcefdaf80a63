package com.ai.trialmatch.component;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

@Component
public class ResponsePhrases {

    public static final String REGISTRY_URL = "https://clinicaltrials.gov";

    public String intakeAccepted(String cancerType, String location) {
        return "Thanks! I've saved your information. I can now look for " + cancerType
                + " clinical trials near " + location
                + ". Ask me something like \"find trials near me\", or name another city.";
    }

    public String requiresIntake() {
        return "Please complete the intake form before proceeding.";
    }

    public String greeting(String cancerType) {
        return "Hello! I can help you find clinical trials for " + cancerType
                + ". Just ask me to find trials, and tell me a city if you'd like to search somewhere else.";
    }

    public String goodbye() {
        return "Goodbye! Feel free to return anytime you need help finding clinical trials.";
    }

    public String clarify() {
        return "Could you clarify your request? You can ask me to find clinical trials, optionally naming a city or state.";
    }

    public String conversationEnded() {
        return "Our conversation has ended. To search again, please submit the intake form again.";
    }

    public String stillWorking() {
        return "I'm still working on your previous message. Please give me a moment and try again.";
    }

    public String trialsFound(int count, String cancerType, String location) {
        String where = StringUtils.isNotBlank(location) ? " near " + location : "";
        return "Here " + (count == 1 ? "is 1 " : "are " + count + " ") + cancerType
                + " clinical " + plural(count) + " recruiting" + where + ":";
    }

    public String nationwideTrialsFound(int count, String cancerType, String location) {
        return "I couldn't find any " + cancerType + " trials near " + location
                + ", so here " + (count == 1 ? "is 1 recruiting " : "are " + count + " recruiting ")
                + plural(count) + " nationwide:";
    }

    public String noTrialsFound(String cancerType, String location) {
        if (StringUtils.isBlank(location)) {
            return "I couldn't find any recruiting " + cancerType + " trials right now. New trials open often, so please check back later.";
        }
        return "I couldn't find any recruiting " + cancerType + " trials near " + location
                + " or nationwide right now. New trials open often, so please check back later.";
    }

    public String searchUnavailable(String cancerType, String location) {
        String where = StringUtils.isNotBlank(location) ? " near " + location : "";
        return "I'm having trouble reaching ClinicalTrials.gov right now, so I couldn't search for "
                + cancerType + " trials" + where + ". Please try again in a moment, or visit "
                + REGISTRY_URL + " directly.";
    }

    public String internalError() {
        return "Sorry, something went wrong on our side. Please try again.";
    }

    private static String plural(int count) {
        return count == 1 ? "trial" : "trials";
    }
}
