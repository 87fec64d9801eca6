package com.autonomous.shellagent.service.decision;

import com.autonomous.shellagent.model.Conversation;
import com.autonomous.shellagent.model.InteractionCategory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InteractionPromptBuilderTest {

    private final InteractionPromptBuilder promptBuilder = new InteractionPromptBuilder();

    @Test
    void shouldIncludeOutputCategoryAndHistory() {
        Conversation conversation = new Conversation("s1");
        conversation.addUserMessage("clean up the build directory");

        String prompt = promptBuilder.interactionPrompt(InteractionCategory.CONFIRMATION,
            "rm: remove 'build'? (y/n)\n", conversation.recent(10));

        assertTrue(prompt.contains("clean up the build directory"));
        assertTrue(prompt.contains("rm: remove 'build'? (y/n)"));
        assertTrue(prompt.contains("Interaction type: confirmation"));
        assertTrue(prompt.contains("SEND_KEYS"));
    }

    @Test
    void shouldBuildUserPromptWithoutHistory() {
        assertEquals("User: hi", promptBuilder.userPrompt("hi", List.of()));
        assertFalse(promptBuilder.agentSystemPrompt().isBlank());
        assertFalse(promptBuilder.interactionSystemPrompt().isBlank());
    }
}
