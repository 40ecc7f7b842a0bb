package com.autonomous.crew.sandbox;

import com.autonomous.crew.config.CrewProperties;
import com.autonomous.crew.model.AgentProfile;
import com.autonomous.crew.model.ContainerInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ContainerManagerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T09:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Mock
    private DockerClient docker;

    @Mock
    private ImageManager images;

    private PortAllocator ports;
    private ContainerManager manager;

    @BeforeEach
    void setUp() {
        ports = new PortAllocator(10000, 20, 3000);
        Path home = tempDir.resolve("home");
        manager = new ContainerManager(docker, ports, images, new CrewProperties.Sandbox(),
            tempDir.resolve("workspaces"), home, CLOCK);
    }

    @Test
    void shouldCreateContainerWithWorkspaceAndCredentials() throws Exception {
        Files.createDirectories(tempDir.resolve("home").resolve(".claude"));
        when(docker.status("crew-dev")).thenReturn(Optional.empty());
        when(images.ensureImage()).thenReturn("crew-agent:12345678");
        when(docker.create(any(ContainerSpec.class))).thenReturn("cid-1");

        ContainerInfo info = manager.createAndStart(AgentProfile.builder().id("dev").build());

        assertEquals("cid-1", info.getContainerId());
        assertEquals(20, info.getPortMappings().size());
        verify(docker).start("cid-1");
        ArgumentCaptor<ContainerSpec> spec = ArgumentCaptor.forClass(ContainerSpec.class);
        verify(docker).create(spec.capture());
        List<Mount> mounts = spec.getValue().getMounts();
        assertEquals(new Mount(tempDir.resolve("workspaces").resolve("dev").toAbsolutePath().toString(),
            "/workspace", false), mounts.get(0));
        assertTrue(mounts.contains(new Mount(tempDir.resolve("home").resolve(".claude").toString(),
            "/home/agent/.claude", true)));
        assertTrue(Files.isDirectory(tempDir.resolve("workspaces").resolve("dev")));
        assertEquals(Optional.of("cid-1"), manager.getContainerId("dev"));
    }

    @Test
    void shouldReuseRunningContainer() {
        when(docker.status("crew-dev")).thenReturn(Optional.empty());
        when(images.ensureImage()).thenReturn("img");
        when(docker.create(any(ContainerSpec.class))).thenReturn("cid-1");
        AgentProfile profile = AgentProfile.builder().id("dev").build();
        manager.createAndStart(profile);
        when(docker.status("cid-1")).thenReturn(Optional.of("running"));

        ContainerInfo again = manager.createAndStart(profile);

        assertEquals("cid-1", again.getContainerId());
        verify(docker, times(1)).create(any());
    }

    @Test
    void shouldRemoveStaleContainerBeforeCreating() {
        when(docker.status("crew-dev")).thenReturn(Optional.of("exited"));
        when(images.ensureImage()).thenReturn("img");
        when(docker.create(any(ContainerSpec.class))).thenReturn("cid-2");

        manager.createAndStart(AgentProfile.builder().id("dev").build());

        verify(docker).remove("crew-dev");
    }

    @Test
    void shouldReleasePortsWhenCreateFails() {
        when(docker.status("crew-dev")).thenReturn(Optional.empty());
        when(images.ensureImage()).thenReturn("img");
        when(docker.create(any(ContainerSpec.class))).thenThrow(new SandboxException("no space left"));

        assertThrows(SandboxException.class, () -> manager.createAndStart(AgentProfile.builder().id("dev").build()));

        assertTrue(ports.get("dev").isEmpty());
        assertFalse(manager.isRunning("dev"));
    }

    @Test
    void shouldStopAndReleaseEvenWhenTeardownFails() {
        when(docker.status("crew-dev")).thenReturn(Optional.empty());
        when(images.ensureImage()).thenReturn("img");
        when(docker.create(any(ContainerSpec.class))).thenReturn("cid-1");
        manager.createAndStart(AgentProfile.builder().id("dev").build());
        doThrow(new SandboxException("daemon gone")).when(docker).stop(eq("cid-1"), anyInt());

        manager.stop("dev");

        assertFalse(manager.isRunning("dev"));
        assertTrue(ports.get("dev").isEmpty());
    }

    @Test
    void shouldAdoptRunningAndRemoveDeadContainers() {
        when(docker.listManaged()).thenReturn(List.of(
            new ContainerSummary("abc", "crew-dev", "Up 3 hours", "dev", "0.0.0.0:10000-10019->3000-3019/tcp"),
            new ContainerSummary("def", "crew-old", "Exited (137) 2 days ago", "old", null),
            new ContainerSummary("ghi", "crew-orphan", "Up 1 minute", null, null)));

        List<String> adopted = manager.reclaimExisting();

        assertEquals(List.of("dev"), adopted);
        assertEquals(Optional.of("abc"), manager.getContainerId("dev"));
        assertTrue(ports.get("dev").isPresent());
        verify(docker).remove("def");
        verify(docker).remove("ghi");
    }

    @Test
    void shouldKeepHostPortsOfAdoptedContainer() {
        when(docker.listManaged()).thenReturn(List.of(
            new ContainerSummary("aaa", "crew-a", "Exited (0) 1 hour ago", "a", null),
            new ContainerSummary("bbb", "crew-b", "Up 2 hours", "b",
                "0.0.0.0:10020-10039->3000-3019/tcp, :::10020-10039->3000-3019/tcp")));

        assertEquals(List.of("b"), manager.reclaimExisting());

        assertEquals(1, ports.get("b").orElseThrow().getSlot());
        assertEquals(OptionalInt.of(10020), ports.resolveHostPort("b", 3000));
        assertEquals(3000, manager.list().get(0).getPortMappings().get(10020));

        when(docker.status("crew-c")).thenReturn(Optional.empty());
        when(images.ensureImage()).thenReturn("img");
        when(docker.create(any(ContainerSpec.class))).thenReturn("cid-c");
        ContainerInfo c = manager.createAndStart(AgentProfile.builder().id("c").build());

        assertTrue(c.getPortMappings().containsKey(10000));
        assertFalse(c.getPortMappings().containsKey(10020));
    }

    @Test
    void shouldGiveContainerWithoutPortsAFreeBlock() {
        when(docker.listManaged()).thenReturn(List.of(
            new ContainerSummary("xxx", "crew-x", "Up 5 minutes", "x", null),
            new ContainerSummary("yyy", "crew-y", "Up 5 minutes", "y", "0.0.0.0:10000-10019->3000-3019/tcp")));

        assertEquals(List.of("y", "x"), manager.reclaimExisting());

        assertEquals(0, ports.get("y").orElseThrow().getSlot());
        assertEquals(1, ports.get("x").orElseThrow().getSlot());
    }
}
