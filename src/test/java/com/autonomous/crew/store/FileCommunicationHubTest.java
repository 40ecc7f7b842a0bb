package com.autonomous.crew.store;

import com.autonomous.crew.model.Channel;
import com.autonomous.crew.model.ChannelMessage;
import com.autonomous.crew.model.ChannelType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FileCommunicationHubTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T09:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dataDir;

    @Mock
    private ScheduledExecutorService timer;

    @Mock
    private ScheduledFuture<Object> future;

    private FileCommunicationHub hub;

    @BeforeEach
    void setUp() {
        lenient().doReturn(future).when(timer).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        hub = new FileCommunicationHub(dataDir, timer, 500, CLOCK);
    }

    @Test
    void shouldReturnExistingChannelForSameName() {
        Channel first = hub.createChannel("team-feed", ChannelType.BROADCAST, List.of("dev"));
        Channel second = hub.createChannel("team-feed", ChannelType.BROADCAST, List.of("ops"));

        assertEquals(first.getId(), second.getId());
        assertEquals(1, hub.listChannels().size());
    }

    @Test
    void shouldReturnMostRecentMessagesUpToLimit() {
        Channel channel = hub.createChannel("general", ChannelType.TEAM, List.of("dev", "ops"));
        hub.sendMessage(channel.getId(), "dev", "one");
        hub.sendMessage(channel.getId(), "ops", "two");
        hub.sendMessage(channel.getId(), "dev", "three");

        List<ChannelMessage> recent = hub.getMessages(channel.getId(), 2);

        assertEquals(List.of("two", "three"), recent.stream().map(ChannelMessage::getContent).toList());
    }

    @Test
    void shouldSkipMalformedMessageLines() throws Exception {
        Channel channel = hub.createChannel("general", ChannelType.TEAM, List.of("dev"));
        hub.sendMessage(channel.getId(), "dev", "valid");
        Files.writeString(dataDir.resolve("channels").resolve(channel.getId() + ".jsonl"),
            "{not json\n", StandardOpenOption.APPEND);

        assertEquals(1, hub.getMessages(channel.getId(), 10).size());
    }

    @Test
    void shouldRejectMessagesToUnknownChannel() {
        assertThrows(NoSuchElementException.class, () -> hub.sendMessage("nope", "dev", "hello"));
    }

    @Test
    void shouldReloadChannelsAfterFlush() {
        Channel channel = hub.createChannel("team-feed", ChannelType.BROADCAST, List.of("dev"));
        hub.flush();

        FileCommunicationHub reloaded = new FileCommunicationHub(dataDir, timer, 500, CLOCK);

        assertEquals(channel.getId(), reloaded.findChannelByName("team-feed").orElseThrow().getId());
    }
}
