package com.autonomous.shellagent.service.decision;

/**
 * Upstream decision-maker (a language model). Returns free text that may embed action markers.
 */
public interface DecisionMaker {

    String decide(String prompt, String systemPrompt);
}
