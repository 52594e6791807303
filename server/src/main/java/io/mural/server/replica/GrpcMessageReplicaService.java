// file: server/src/main/java/io/mural/server/replica/GrpcMessageReplicaService.java
package io.mural.server.replica;

import io.grpc.Status;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;
import io.mural.core.Message;
import io.mural.server.node.NodeOfflineException;
import io.mural.server.peer.ReplicaEndpoint;

import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * gRPC replica service that exposes a node's ReplicaEndpoint to other nodes.
 *
 * This is the node-to-node replication API (internal), not the external HTTP API.
 *
 * Responsibilities:
 *  - Decode gRPC requests into ReplicaEndpoint calls.
 *  - Map NodeOfflineException to UNAVAILABLE, IllegalArgumentException to
 *    INVALID_ARGUMENT, everything else to INTERNAL.
 */
public final class GrpcMessageReplicaService extends MessageReplicaGrpc.MessageReplicaImplBase {
    private static final Logger log = Logger.getLogger(GrpcMessageReplicaService.class.getName());

    private final ReplicaEndpoint endpoint;

    public GrpcMessageReplicaService(ReplicaEndpoint endpoint) {
        this.endpoint = endpoint;
    }

    @Override
    public void pushMessage(
            MessageReplicaProto.PushMessageRequest request,
            StreamObserver<MessageReplicaProto.PushMessageResponse> responseObserver
    ) {
        try {
            if (!request.hasMessage()) {
                throw new IllegalArgumentException("message required");
            }
            Message m = ReplicaMessages.fromProto(request.getMessage());
            boolean added = endpoint.acceptPush(m, request.getFromNode());

            responseObserver.onNext(
                    MessageReplicaProto.PushMessageResponse.newBuilder()
                            .setAdded(added)
                            .build());
            responseObserver.onCompleted();
        } catch (Exception e) {
            responseObserver.onError(toStatus(e));
        }
    }

    @Override
    public void pullSnapshot(
            MessageReplicaProto.PullSnapshotRequest request,
            StreamObserver<MessageReplicaProto.MessageRecord> responseObserver
    ) {
        Set<Message> all;
        try {
            all = endpoint.serveSnapshot(request.getFromNode());
        } catch (Exception e) {
            responseObserver.onError(toStatus(e));
            return;
        }
        var call = (ServerCallStreamObserver<MessageReplicaProto.MessageRecord>) responseObserver;
        for (Message m : all) {
            if (call.isCancelled()) {
                log.log(Level.FINE, "Snapshot pull by {0} cancelled", request.getFromNode());
                return;
            }
            call.onNext(ReplicaMessages.toProto(m));
        }
        responseObserver.onCompleted();
    }

    private static Exception toStatus(Exception e) {
        if (e instanceof NodeOfflineException) {
            return Status.UNAVAILABLE.withDescription(e.getMessage()).asException();
        }
        if (e instanceof IllegalArgumentException) {
            return Status.INVALID_ARGUMENT.withDescription(e.getMessage()).asException();
        }
        log.log(Level.WARNING, "Replica call failed", e);
        return Status.INTERNAL.withDescription(e.getMessage()).asException();
    }
}
