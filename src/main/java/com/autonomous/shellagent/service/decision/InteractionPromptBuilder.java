package com.autonomous.shellagent.service.decision;

import com.autonomous.shellagent.model.ConversationMessage;
import com.autonomous.shellagent.model.InteractionCategory;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class InteractionPromptBuilder {

    static final String AGENT_SYSTEM_PROMPT =
        "You operate a remote shell on the user's behalf. You can act by embedding markers in your reply:\n"
            + "- RUN_COMMAND{command} runs a shell command, e.g. RUN_COMMAND{ls -la /}\n"
            + "- SEND_KEYS{\"key1\",\"key2\"} sends keys, e.g. SEND_KEYS{\"ctrl\",\"c\"}\n"
            + "- WAIT{seconds} pauses, e.g. WAIT{3}\n"
            + "Run commands yourself instead of asking the user to type them. Keep answers short.";

    static final String INTERACTION_SYSTEM_PROMPT =
        "You resolve interactive terminal prompts. Answer only with SEND_KEYS or WAIT markers and a short reason.";

    public String agentSystemPrompt() {
        return AGENT_SYSTEM_PROMPT;
    }

    public String interactionSystemPrompt() {
        return INTERACTION_SYSTEM_PROMPT;
    }

    public String interactionPrompt(InteractionCategory category, String output, List<ConversationMessage> history) {
        StringBuilder prompt = new StringBuilder();
        appendHistory(prompt, history);
        prompt.append("The last command is waiting for input.\n\n");
        prompt.append("Output:\n").append(output == null ? "" : output.strip()).append("\n\n");
        prompt.append("Interaction type: ").append(category.getLabel()).append("\n\n");
        prompt.append("Decide how to respond:\n");
        prompt.append("1. For a yes/no question, answer with SEND_KEYS{\"y\",\"enter\"} or SEND_KEYS{\"n\",\"enter\"} ")
            .append("based on what the command is meant to do.\n");
        prompt.append("2. For a confirmation, confirm only if it matches the intent of the command.\n");
        prompt.append("3. For \"press any key\", use SEND_KEYS{\"enter\"}.\n");
        prompt.append("4. For a password prompt, say that the user has to provide it.\n");
        prompt.append("5. Never issue RUN_COMMAND here; it will be ignored.\n");
        return prompt.toString();
    }

    public String userPrompt(String message, List<ConversationMessage> history) {
        StringBuilder prompt = new StringBuilder();
        appendHistory(prompt, history);
        prompt.append("User: ").append(message);
        return prompt.toString();
    }

    private void appendHistory(StringBuilder prompt, List<ConversationMessage> history) {
        if (history == null || history.isEmpty()) {
            return;
        }
        prompt.append("Conversation so far:\n");
        for (ConversationMessage message : history) {
            prompt.append('[').append(message.getRole()).append("] ").append(message.getContent()).append('\n');
        }
        prompt.append('\n');
    }
}
