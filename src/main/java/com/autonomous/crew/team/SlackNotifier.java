package com.autonomous.crew.team;

import com.autonomous.crew.config.CrewProperties;
import com.slack.api.Slack;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.SlackApiException;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.response.chat.ChatPostMessageResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Mirrors team feed messages to a Slack channel when a bot token and channel are configured.
 */
@Slf4j
@Service
public class SlackNotifier {

    private final CrewProperties properties;
    private final Slack slack;

    @Autowired
    public SlackNotifier(CrewProperties properties) {
        this(properties, Slack.getInstance());
    }

    SlackNotifier(CrewProperties properties, Slack slack) {
        this.properties = properties;
        this.slack = slack;
    }

    public boolean isEnabled() {
        CrewProperties.SlackSettings settings = properties.getSlack();
        return notBlank(settings.getBotToken()) && notBlank(settings.getFeedChannel());
    }

    /**
     * Posts a message to the feed channel.
     *
     * @return the message timestamp, or null when Slack is disabled or the post failed
     */
    public String postToFeed(String markdown) {
        if (!isEnabled()) {
            return null;
        }
        CrewProperties.SlackSettings settings = properties.getSlack();
        try {
            MethodsClient methods = slack.methods(settings.getBotToken());

            ChatPostMessageRequest request = ChatPostMessageRequest.builder()
                .channel(settings.getFeedChannel())
                .text(toMrkdwn(markdown))
                .build();

            ChatPostMessageResponse response = methods.chatPostMessage(request);

            if (response.isOk()) {
                return response.getTs();
            }
            log.warn("Failed to post to Slack channel {}: {}", settings.getFeedChannel(), response.getError());
            return null;
        } catch (IOException | SlackApiException e) {
            log.warn("Failed to post to Slack channel {}: {}", settings.getFeedChannel(), e.getMessage());
            return null;
        }
    }

    /** Slack bolds with single asterisks. */
    static String toMrkdwn(String markdown) {
        return markdown.replace("**", "*");
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
