package com.autonomous.crew.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Task {
    private String id;
    private String title;
    private String description;
    private TaskStatus status;
    private TaskPriority priority;
    private TaskSource source;
    private String createdBy;
    private String assignedTo;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private String result;
    private String error;
    @Builder.Default
    private List<String> tags = new ArrayList<>();
    private String parentTaskId;

    public Task copy() {
        return toBuilder()
            .tags(tags == null ? new ArrayList<>() : new ArrayList<>(tags))
            .build();
    }

    public boolean hasTag(String tag) {
        return tags != null && tags.contains(tag);
    }
}
