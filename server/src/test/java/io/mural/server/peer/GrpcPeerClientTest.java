package io.mural.server.peer;

import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.mural.core.LogicalTimestamp;
import io.mural.core.Message;
import io.mural.server.node.NodeOfflineException;
import io.mural.server.replica.GrpcMessageReplicaService;
import io.mural.server.replica.MessageReplicaGrpc;
import io.mural.server.replica.MessageReplicaProto;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end checks for GrpcPeerClient:
 *  - In-process gRPC server exposing GrpcMessageReplicaService over an in-memory endpoint.
 *  - Push and pull round trips, offline and bad-input status mapping.
 */
class GrpcPeerClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    /** Set-backed endpoint that can pretend to be offline. */
    private static final class MemoryEndpoint implements ReplicaEndpoint {
        final Set<Message> messages = new HashSet<>();
        volatile boolean offline;
        volatile String lastFrom;

        @Override
        public synchronized boolean acceptPush(Message message, String fromNode) {
            if (offline) throw new NodeOfflineException("node-b");
            lastFrom = fromNode;
            return messages.add(message);
        }

        @Override
        public synchronized Set<Message> serveSnapshot(String fromNode) {
            if (offline) throw new NodeOfflineException("node-b");
            lastFrom = fromNode;
            return Set.copyOf(messages);
        }
    }

    private final MemoryEndpoint endpoint = new MemoryEndpoint();
    private Server server;
    private ManagedChannel channel;
    private GrpcPeerClient client;

    @BeforeEach
    void setUp() throws IOException {
        String name = InProcessServerBuilder.generateName();
        server = InProcessServerBuilder
                .forName(name)
                .directExecutor()
                .addService(new GrpcMessageReplicaService(endpoint))
                .build()
                .start();
        channel = InProcessChannelBuilder
                .forName(name)
                .directExecutor()
                .build();
        client = new GrpcPeerClient("node-b", "node-a", "inproc:" + name, channel);
    }

    @AfterEach
    void tearDown() {
        client.shutdown();
        server.shutdownNow();
    }

    @Test
    void push_is_idempotent_over_grpc() throws Exception {
        Message m = Message.create("alice", "hi", new LogicalTimestamp(7, "node-a"));

        assertTrue(client.push(m, TIMEOUT));
        assertFalse(client.push(m, TIMEOUT));

        assertEquals(Set.of(m), endpoint.messages);
        assertEquals("node-a", endpoint.lastFrom);
    }

    @Test
    void pull_returns_full_snapshot() throws Exception {
        Message m1 = Message.create("alice", "one", new LogicalTimestamp(1, "node-b"));
        Message m2 = Message.create("bob", "two", new LogicalTimestamp(4, "node-c"));
        endpoint.messages.add(m1);
        endpoint.messages.add(m2);

        List<Message> pulled = client.pullSnapshot(TIMEOUT);

        assertEquals(Set.of(m1, m2), new HashSet<>(pulled));
    }

    @Test
    void offline_peer_is_reported_unreachable() {
        endpoint.offline = true;
        Message m = Message.create("alice", "hi", new LogicalTimestamp(1, "node-a"));

        var push = assertThrows(PeerUnreachableException.class, () -> client.push(m, TIMEOUT));
        assertEquals("node-b", push.peerId());
        assertEquals(Status.Code.UNAVAILABLE, ((StatusRuntimeException) push.getCause()).getStatus().getCode());

        assertThrows(PeerUnreachableException.class, () -> client.pullSnapshot(TIMEOUT));
    }

    @Test
    void malformed_record_is_invalid_argument() {
        var stub = MessageReplicaGrpc.newBlockingStub(channel);
        var bad = MessageReplicaProto.PushMessageRequest.newBuilder()
                .setMessage(MessageReplicaProto.MessageRecord.newBuilder()
                        .setOriginNode("node-a")
                        .setSequence(1)
                        .setAuthor("alice")
                        .setContent("x")
                        .setClockCounter(0) // counters start at 1
                        .setClockNode("node-a"))
                .setFromNode("node-a")
                .build();

        var ex = assertThrows(StatusRuntimeException.class, () -> stub.pushMessage(bad));
        assertEquals(Status.Code.INVALID_ARGUMENT, ex.getStatus().getCode());

        var missing = MessageReplicaProto.PushMessageRequest.newBuilder().setFromNode("node-a").build();
        var ex2 = assertThrows(StatusRuntimeException.class, () -> stub.pushMessage(missing));
        assertEquals(Status.Code.INVALID_ARGUMENT, ex2.getStatus().getCode());
        assertTrue(endpoint.messages.isEmpty());
    }
}
