package com.autonomous.crew.store;

import com.autonomous.crew.model.Channel;
import com.autonomous.crew.model.ChannelMessage;
import com.autonomous.crew.model.ChannelType;
import com.autonomous.crew.support.DebounceTimer;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Channels in {@code channels/channels.json}; each channel's messages appended to {@code channels/{id}.jsonl}.
 */
@Slf4j
public class FileCommunicationHub implements CommunicationHub {

    private final Path dir;
    private final Clock clock;
    private final JsonFileSupport json = new JsonFileSupport();
    private final Map<String, Channel> channels = new LinkedHashMap<>();
    private final DebounceTimer writer;

    public FileCommunicationHub(Path dataDir, ScheduledExecutorService timer, long debounceMs, Clock clock) {
        this.dir = dataDir.resolve("channels");
        this.clock = clock;
        this.writer = new DebounceTimer("channels", timer, debounceMs, this::persist);
        json.readList(dir.resolve("channels.json"), new TypeReference<List<Channel>>() {})
            .forEach(c -> channels.put(c.getId(), c));
    }

    @Override
    public synchronized Channel createChannel(String name, ChannelType type, List<String> participants) {
        Optional<Channel> existing = findChannelByName(name);
        if (existing.isPresent()) {
            return existing.get();
        }
        Channel channel = Channel.builder()
            .id(UUID.randomUUID().toString())
            .name(name)
            .type(type)
            .participants(new ArrayList<>(participants))
            .createdAt(clock.instant())
            .build();
        channels.put(channel.getId(), channel);
        writer.schedule();
        log.info("Created {} channel '{}'", type, name);
        return channel;
    }

    @Override
    public synchronized Optional<Channel> getChannel(String channelId) {
        return Optional.ofNullable(channels.get(channelId));
    }

    @Override
    public synchronized Optional<Channel> findChannelByName(String name) {
        return channels.values().stream().filter(c -> c.getName().equals(name)).findFirst();
    }

    @Override
    public synchronized List<Channel> listChannels() {
        return new ArrayList<>(channels.values());
    }

    @Override
    public ChannelMessage sendMessage(String channelId, String senderId, String content) {
        if (getChannel(channelId).isEmpty()) {
            throw new NoSuchElementException("Channel not found: " + channelId);
        }
        ChannelMessage message = ChannelMessage.builder()
            .id(UUID.randomUUID().toString())
            .channelId(channelId)
            .senderId(senderId)
            .content(content)
            .timestamp(clock.instant())
            .build();
        try {
            json.appendLine(messagesFile(channelId), message);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append message to channel " + channelId, e);
        }
        return message;
    }

    @Override
    public List<ChannelMessage> getMessages(String channelId, int limit) {
        List<ChannelMessage> all = json.readLines(messagesFile(channelId), ChannelMessage.class);
        return new ArrayList<>(all.subList(Math.max(0, all.size() - limit), all.size()));
    }

    @Override
    public void flush() {
        writer.flushNow();
    }

    private void persist() throws Exception {
        List<Channel> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(channels.values());
        }
        json.writeAtomically(dir.resolve("channels.json"), snapshot);
    }

    private Path messagesFile(String channelId) {
        return dir.resolve(channelId + ".jsonl");
    }
}
