package com.autonomous.crew.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskTemplate {
    private String title;
    private String description;
    @Builder.Default
    private TaskPriority priority = TaskPriority.NORMAL;
    private String assignedTo;
    @Builder.Default
    private List<String> tags = new ArrayList<>();
}
