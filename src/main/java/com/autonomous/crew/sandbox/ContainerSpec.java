package com.autonomous.crew.sandbox;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
public class ContainerSpec {
    private String name;
    private String agentId;
    private String image;
    private double cpus;
    private int memoryMb;
    private int pidsLimit;
    @Builder.Default
    private List<Mount> mounts = new ArrayList<>();
    @Builder.Default
    private List<Mount> volumes = new ArrayList<>();
    /** host port -> container port */
    @Builder.Default
    private Map<Integer, Integer> ports = new LinkedHashMap<>();
    private String workdir;
    @Builder.Default
    private Map<String, String> env = new LinkedHashMap<>();
    @Builder.Default
    private List<String> command = List.of("sleep", "infinity");
}
