package com.autonomous.shellagent.service.event;

import com.slack.api.Slack;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.SlackApiException;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.response.chat.ChatPostMessageResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;

@Slf4j
@Service
public class SlackNotifier {

    @Value("${slack.bot.token:}")
    private String slackBotToken;

    private final Slack slack;

    public SlackNotifier() {
        this(Slack.getInstance());
    }

    SlackNotifier(Slack slack) {
        this.slack = slack;
    }

    public void setSlackBotToken(String slackBotToken) {
        this.slackBotToken = slackBotToken;
    }

    public boolean isConfigured() {
        return slackBotToken != null && !slackBotToken.isBlank();
    }

    /**
     * Posts a message to a channel and returns the message timestamp.
     * The timestamp can be used to create a thread.
     */
    public String postMessage(String channel, String message) {
        return post(ChatPostMessageRequest.builder()
            .channel(channel)
            .text(message)
            .build());
    }

    /**
     * Posts a message as a reply in an existing thread.
     */
    public String postMessageInThread(String channel, String threadTs, String message) {
        return post(ChatPostMessageRequest.builder()
            .channel(channel)
            .threadTs(threadTs)
            .text(message)
            .build());
    }

    private String post(ChatPostMessageRequest request) {
        if (!isConfigured()) {
            log.debug("Slack token not set, dropping message to {}", request.getChannel());
            return null;
        }
        try {
            MethodsClient methods = slack.methods(slackBotToken);
            ChatPostMessageResponse response = methods.chatPostMessage(request);

            if (response.isOk()) {
                return response.getTs();
            }
            log.error("Failed to post message to {}: {}", request.getChannel(), response.getError());
            return null;
        } catch (IOException | SlackApiException e) {
            log.error("Slack API call failed for {}", request.getChannel(), e);
            return null;
        }
    }
}
