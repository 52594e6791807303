// file: server/src/main/java/io/mural/server/peer/GrpcPeerClient.java
package io.mural.server.peer;

import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.StatusRuntimeException;
import io.mural.core.Message;
import io.mural.server.replica.MessageReplicaGrpc;
import io.mural.server.replica.MessageReplicaProto;
import io.mural.server.replica.ReplicaMessages;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * gRPC-based PeerClient implementation.
 *
 * One GrpcPeerClient instance represents a single remote node (host:port). Every
 * call carries its own deadline; any non-OK status is reported as
 * PeerUnreachableException so the caller can retry or defer to reconciliation.
 */
public final class GrpcPeerClient implements PeerClient {

    private final String peerId;
    private final String localNodeId;
    private final String target; // "host:port" or in-process name
    private final ManagedChannel channel;
    private final MessageReplicaGrpc.MessageReplicaBlockingStub stub;

    /**
     * Production constructor using host and port.
     */
    public GrpcPeerClient(String peerId, String localNodeId, String host, int port) {
        this(peerId, localNodeId, host + ":" + port,
                ManagedChannelBuilder
                        .forAddress(host, port)
                        .usePlaintext() // internal traffic; terminate TLS at edge if needed
                        .build());
    }

    /**
     * Test-only constructor allowing a pre-built channel (e.g., in-process).
     */
    public GrpcPeerClient(String peerId, String localNodeId, String target, ManagedChannel channel) {
        this.peerId = peerId;
        this.localNodeId = localNodeId;
        this.target = target;
        this.channel = channel;
        this.stub = MessageReplicaGrpc.newBlockingStub(channel);
    }

    @Override
    public String peerId() {
        return peerId;
    }

    @Override
    public boolean push(Message message, Duration timeout) throws PeerUnreachableException {
        try {
            MessageReplicaProto.PushMessageRequest req =
                    MessageReplicaProto.PushMessageRequest.newBuilder()
                            .setMessage(ReplicaMessages.toProto(message))
                            .setFromNode(localNodeId)
                            .build();

            return stub.withDeadlineAfter(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .pushMessage(req)
                    .getAdded();
        } catch (StatusRuntimeException sre) {
            throw new PeerUnreachableException(peerId,
                    "gRPC push to node " + peerId + " (" + target + ") failed: " + sre.getStatus().getCode(), sre);
        }
    }

    @Override
    public List<Message> pullSnapshot(Duration timeout) throws PeerUnreachableException {
        List<Message> out = new ArrayList<>();
        try {
            // The deadline covers the whole stream, not each record.
            Iterator<MessageReplicaProto.MessageRecord> records =
                    stub.withDeadlineAfter(timeout.toMillis(), TimeUnit.MILLISECONDS)
                            .pullSnapshot(MessageReplicaProto.PullSnapshotRequest.newBuilder()
                                    .setFromNode(localNodeId)
                                    .build());
            while (records.hasNext()) {
                out.add(ReplicaMessages.fromProto(records.next()));
            }
        } catch (StatusRuntimeException sre) {
            throw new PeerUnreachableException(peerId,
                    "gRPC pull from node " + peerId + " (" + target + ") failed after "
                            + out.size() + " records: " + sre.getStatus().getCode(), sre);
        }
        return out;
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * Allow graceful shutdown for tests or node stop.
     */
    public void shutdown() {
        channel.shutdown();
        try {
            if (!channel.awaitTermination(5, TimeUnit.SECONDS)) {
                channel.shutdownNow();
            }
        } catch (InterruptedException e) {
            channel.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
