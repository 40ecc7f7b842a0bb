package com.autonomous.crew.team;

import com.autonomous.crew.model.AgentProfile;
import com.autonomous.crew.model.Channel;
import com.autonomous.crew.model.ChannelType;
import com.autonomous.crew.service.AgentProfileService;
import com.autonomous.crew.store.CommunicationHub;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.stream.Collectors;

/**
 * Posts to the shared team-feed channel, creating it on first use.
 */
@Slf4j
@Service
public class FeedBroadcaster {

    public static final String TEAM_FEED_CHANNEL = "team-feed";

    private final CommunicationHub hub;
    private final AgentProfileService profiles;
    private final SlackNotifier slack;

    private volatile String feedChannelId;

    public FeedBroadcaster(CommunicationHub hub, AgentProfileService profiles, SlackNotifier slack) {
        this.hub = hub;
        this.profiles = profiles;
        this.slack = slack;
    }

    public void broadcast(String senderId, String content) {
        try {
            hub.sendMessage(feedChannelId(), senderId, content);
        } catch (RuntimeException e) {
            log.warn("[{}] Failed to broadcast to team feed: {}", senderId, e.getMessage());
        }
        slack.postToFeed(content);
    }

    private String feedChannelId() {
        String id = feedChannelId;
        if (id == null) {
            Channel channel = hub.findChannelByName(TEAM_FEED_CHANNEL)
                .orElseGet(() -> {
                    log.info("Creating {} broadcast channel", TEAM_FEED_CHANNEL);
                    return hub.createChannel(TEAM_FEED_CHANNEL, ChannelType.BROADCAST,
                        profiles.listProfiles().stream().map(AgentProfile::getId).collect(Collectors.toList()));
                });
            id = channel.getId();
            feedChannelId = id;
        }
        return id;
    }
}
