package com.autonomous.crew.store;

import com.autonomous.crew.model.Channel;
import com.autonomous.crew.model.ChannelMessage;
import com.autonomous.crew.model.ChannelType;

import java.util.List;
import java.util.Optional;

public interface CommunicationHub {

    Channel createChannel(String name, ChannelType type, List<String> participants);

    Optional<Channel> getChannel(String channelId);

    Optional<Channel> findChannelByName(String name);

    List<Channel> listChannels();

    ChannelMessage sendMessage(String channelId, String senderId, String content);

    List<ChannelMessage> getMessages(String channelId, int limit);

    void flush();
}
