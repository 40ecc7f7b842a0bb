package com.autonomous.crew.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Channel {
    private String id;
    private String name;
    private ChannelType type;
    @Builder.Default
    private List<String> participants = new ArrayList<>();
    private Instant createdAt;
}
