package io.mural.server.replication;

import io.mural.core.LamportClock;
import io.mural.core.LogicalTimestamp;
import io.mural.core.Message;
import io.mural.server.cluster.ClusterConfig;
import io.mural.server.node.FailureSimulator;
import io.mural.server.node.NodeState;
import io.mural.server.peer.PeerClient;
import io.mural.server.peer.PeerRegistry;
import io.mural.storage.DurableMessageStore;
import io.mural.storage.FileWal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;

class ReplicationManagerTest {

    private static final RetryPolicy FAST = new RetryPolicy(Duration.ofMillis(5), Duration.ofMillis(20), 3);
    private static final List<ClusterConfig.Node> NODES = List.of(
            new ClusterConfig.Node("node-a", "localhost", 8081, 50051),
            new ClusterConfig.Node("node-b", "localhost", 8082, 50052),
            new ClusterConfig.Node("node-c", "localhost", 8083, 50053)
    );

    @TempDir
    Path dir;

    private final NodeState state = new NodeState("node-a");
    private PeerRegistry registry;
    private ScheduledExecutorService workers;
    private FileWal wal;
    private FailureSimulator simulator;

    @BeforeEach
    void setUp() {
        registry = new PeerRegistry("node-a", NODES, 3);
        workers = Executors.newScheduledThreadPool(2);
        wal = new FileWal(dir, 1L << 20);
        var store = new DurableMessageStore(wal, new LamportClock("node-a"));
        var reconciliation = new ReconciliationService(state, store, registry, Map.of(),
                Duration.ofSeconds(1), Duration.ofSeconds(1), workers);
        simulator = new FailureSimulator(state, reconciliation);
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
        wal.close();
    }

    private ReplicationManager manager(PeerClient b, PeerClient c) {
        return new ReplicationManager(state, registry, Map.of("node-b", b, "node-c", c), FAST,
                Duration.ofSeconds(1), workers);
    }

    private static Message msg(long counter) {
        return Message.create("alice", "m" + counter, new LogicalTimestamp(counter, "node-a"));
    }

    private static List<PushOutcome> join(List<CompletableFuture<PushOutcome>> fs) {
        return fs.stream().map(CompletableFuture::join).toList();
    }

    @Test
    void delivers_to_every_reachable_peer() {
        var b = ScriptedPeerClient.healthy("node-b");
        var c = ScriptedPeerClient.healthy("node-c");
        Message m = msg(1);

        List<PushOutcome> outcomes = join(manager(b, c).onLocalWrite(m));

        assertEquals(2, outcomes.size());
        for (PushOutcome o : outcomes) {
            assertEquals(PushOutcome.Status.DELIVERED, o.status());
            assertEquals(1, o.attempts());
            assertEquals(m.id(), o.messageId());
        }
        assertEquals(List.of(m), b.pushed);
        assertEquals(List.of(m), c.pushed);
    }

    @Test
    void retries_transient_failures_then_delivers() {
        var b = new ScriptedPeerClient("node-b", 2);
        var c = ScriptedPeerClient.healthy("node-c");

        PushOutcome toB = join(manager(b, c).onLocalWrite(msg(1))).get(0);

        assertEquals("node-b", toB.peerId());
        assertEquals(PushOutcome.Status.DELIVERED, toB.status());
        assertEquals(3, toB.attempts());
        assertEquals(0, registry.find("node-b").orElseThrow().consecutiveFailures());
        assertTrue(registry.find("node-b").orElseThrow().reachable());
    }

    @Test
    void abandons_after_max_attempts_and_marks_peer_unreachable() {
        var b = ScriptedPeerClient.down("node-b");
        var c = ScriptedPeerClient.healthy("node-c");

        List<PushOutcome> outcomes = join(manager(b, c).onLocalWrite(msg(1)));

        PushOutcome toB = outcomes.get(0);
        assertEquals(PushOutcome.Status.ABANDONED, toB.status());
        assertEquals(3, toB.attempts());
        assertNotNull(toB.lastError());
        assertEquals(3, b.calls.get());
        assertFalse(registry.find("node-b").orElseThrow().reachable());
        assertEquals(PushOutcome.Status.DELIVERED, outcomes.get(1).status());
    }

    @Test
    void unreachable_peer_is_skipped() {
        var b = ScriptedPeerClient.healthy("node-b");
        var c = ScriptedPeerClient.healthy("node-c");
        for (int i = 0; i < 3; i++) registry.markResult("node-b", false);

        List<PushOutcome> outcomes = join(manager(b, c).onLocalWrite(msg(1)));

        assertEquals(PushOutcome.Status.SKIPPED_UNREACHABLE, outcomes.get(0).status());
        assertEquals(0, b.calls.get());
        assertEquals(PushOutcome.Status.DELIVERED, outcomes.get(1).status());
    }

    @Test
    void offline_node_sends_nothing() {
        var b = ScriptedPeerClient.healthy("node-b");
        var c = ScriptedPeerClient.healthy("node-c");
        simulator.goOffline();

        List<PushOutcome> outcomes = join(manager(b, c).onLocalWrite(msg(1)));

        assertTrue(outcomes.stream().allMatch(o -> o.status() == PushOutcome.Status.SKIPPED_OFFLINE));
        assertEquals(0, b.calls.get() + c.calls.get());
    }

    @Test
    void going_offline_between_retries_abandons_the_push() {
        var b = ScriptedPeerClient.down("node-b");
        var c = ScriptedPeerClient.healthy("node-c");
        b.onCall = simulator::goOffline;

        PushOutcome toB = join(manager(b, c).onLocalWrite(msg(1))).get(0);

        assertEquals(PushOutcome.Status.ABANDONED, toB.status());
        assertEquals(1, b.calls.get());
        assertEquals("node offline", toB.lastError());
    }

    @Test
    void stopped_pool_abandons_instead_of_throwing() {
        var b = ScriptedPeerClient.healthy("node-b");
        var c = ScriptedPeerClient.healthy("node-c");
        var mgr = manager(b, c);
        mgr.shutdown();

        List<PushOutcome> outcomes = join(mgr.onLocalWrite(msg(1)));

        assertTrue(outcomes.stream().allMatch(o -> o.status() == PushOutcome.Status.ABANDONED));
    }

    @Test
    void every_peer_needs_a_client() {
        assertThrows(IllegalArgumentException.class, () -> new ReplicationManager(state, registry,
                Map.of("node-b", ScriptedPeerClient.healthy("node-b")), FAST, Duration.ofSeconds(1), workers));
    }
}
