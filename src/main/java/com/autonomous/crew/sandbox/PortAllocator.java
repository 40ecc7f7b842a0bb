package com.autonomous.crew.sandbox;

import com.autonomous.crew.model.PortAllocation;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeSet;

/**
 * Hands out fixed-size blocks of host ports, one block per agent. A block maps 1:1 onto the same
 * container-side range for every agent. Released slots are reused lowest-first.
 */
public class PortAllocator {

    private final int portRangeStart;
    private final int portsPerAgent;
    private final int containerPortStart;

    private final Map<String, PortAllocation> allocations = new HashMap<>();
    private final TreeSet<Integer> usedSlots = new TreeSet<>();

    public PortAllocator(int portRangeStart, int portsPerAgent, int containerPortStart) {
        this.portRangeStart = portRangeStart;
        this.portsPerAgent = portsPerAgent;
        this.containerPortStart = containerPortStart;
    }

    /** Idempotent per agent. */
    public synchronized PortAllocation allocate(String agentId) {
        PortAllocation existing = allocations.get(agentId);
        if (existing != null) {
            return existing;
        }
        int slot = 0;
        while (usedSlots.contains(slot)) {
            slot++;
        }
        usedSlots.add(slot);
        PortAllocation allocation = new PortAllocation(agentId, slot,
            portRangeStart + slot * portsPerAgent, containerPortStart, portsPerAgent);
        allocations.put(agentId, allocation);
        return allocation;
    }

    /**
     * Records a block that is already in use, e.g. by a container that outlived the previous process.
     *
     * @throws IllegalStateException when the slot belongs to another agent or the agent holds a different slot
     */
    public synchronized PortAllocation reserve(String agentId, int slot) {
        if (slot < 0) {
            throw new IllegalArgumentException("Invalid port slot " + slot);
        }
        PortAllocation existing = allocations.get(agentId);
        if (existing != null) {
            if (existing.getSlot() == slot) {
                return existing;
            }
            throw new IllegalStateException("Agent " + agentId + " already holds port slot " + existing.getSlot());
        }
        if (usedSlots.contains(slot)) {
            throw new IllegalStateException("Port slot " + slot + " is already allocated");
        }
        usedSlots.add(slot);
        PortAllocation allocation = new PortAllocation(agentId, slot,
            portRangeStart + slot * portsPerAgent, containerPortStart, portsPerAgent);
        allocations.put(agentId, allocation);
        return allocation;
    }

    /** Slot whose block starts at the given host port; empty for ports outside the managed range. */
    public OptionalInt slotForHostPort(int hostPort) {
        int offset = hostPort - portRangeStart;
        if (offset < 0 || offset % portsPerAgent != 0) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(offset / portsPerAgent);
    }

    public synchronized void release(String agentId) {
        PortAllocation removed = allocations.remove(agentId);
        if (removed != null) {
            usedSlots.remove(removed.getSlot());
        }
    }

    public synchronized Optional<PortAllocation> get(String agentId) {
        return Optional.ofNullable(allocations.get(agentId));
    }

    public synchronized OptionalInt resolveHostPort(String agentId, int containerPort) {
        PortAllocation allocation = allocations.get(agentId);
        if (allocation == null || !allocation.containsContainerPort(containerPort)) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(allocation.hostPortFor(containerPort));
    }

    /** host port -> container port for the agent's whole block; empty when nothing is allocated. */
    public synchronized Map<Integer, Integer> buildPortMappings(String agentId) {
        Map<Integer, Integer> mappings = new LinkedHashMap<>();
        PortAllocation allocation = allocations.get(agentId);
        if (allocation == null) {
            return mappings;
        }
        for (int i = 0; i < allocation.getCount(); i++) {
            mappings.put(allocation.getHostStart() + i, allocation.getContainerStart() + i);
        }
        return mappings;
    }
}
