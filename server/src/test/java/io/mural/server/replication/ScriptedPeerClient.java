package io.mural.server.replication;

import io.mural.core.Message;
import io.mural.server.peer.PeerClient;
import io.mural.server.peer.PeerUnreachableException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/** PeerClient whose first N calls fail; records what was pushed. */
final class ScriptedPeerClient implements PeerClient {
    private final String peerId;
    private final AtomicInteger failuresLeft;
    final AtomicInteger calls = new AtomicInteger();
    final List<Message> pushed = new CopyOnWriteArrayList<>();
    final List<Message> remote = new CopyOnWriteArrayList<>();
    volatile Runnable onCall = () -> { };

    ScriptedPeerClient(String peerId, int failures) {
        this.peerId = peerId;
        this.failuresLeft = new AtomicInteger(failures);
    }

    static ScriptedPeerClient healthy(String peerId) {
        return new ScriptedPeerClient(peerId, 0);
    }

    static ScriptedPeerClient down(String peerId) {
        return new ScriptedPeerClient(peerId, Integer.MAX_VALUE);
    }

    @Override
    public String peerId() {
        return peerId;
    }

    @Override
    public boolean push(Message message, Duration timeout) throws PeerUnreachableException {
        call();
        pushed.add(message);
        if (remote.contains(message)) {
            return false;
        }
        remote.add(message);
        return true;
    }

    @Override
    public List<Message> pullSnapshot(Duration timeout) throws PeerUnreachableException {
        call();
        return new ArrayList<>(remote);
    }

    private void call() throws PeerUnreachableException {
        calls.incrementAndGet();
        onCall.run();
        if (failuresLeft.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new PeerUnreachableException(peerId, "scripted failure", null);
        }
    }
}
