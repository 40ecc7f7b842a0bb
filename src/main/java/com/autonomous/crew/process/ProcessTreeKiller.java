package com.autonomous.crew.process;

import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Terminates a process together with every descendant it spawned.
 */
@Slf4j
public final class ProcessTreeKiller {

    private ProcessTreeKiller() {
    }

    public static void kill(ProcessHandle root) {
        // snapshot first: once the root dies its children get re-parented and drop out of descendants()
        List<ProcessHandle> descendants = root.descendants()
            .sorted(Comparator.comparingLong(ProcessHandle::pid).reversed())
            .collect(Collectors.toList());

        root.destroy();
        for (ProcessHandle child : descendants) {
            if (child.isAlive() && !child.destroy()) {
                log.debug("Process {} refused termination, forcing", child.pid());
                child.destroyForcibly();
            }
        }
        log.debug("Killed process tree of {} ({} descendants)", root.pid(), descendants.size());
    }

    public static void kill(long pid) {
        ProcessHandle.of(pid).ifPresent(ProcessTreeKiller::kill);
    }
}
