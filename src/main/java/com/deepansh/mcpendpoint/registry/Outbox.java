package com.deepansh.mcpendpoint.registry;

import com.deepansh.mcpendpoint.transport.PeerChannel;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Frames and closes queued while an agent's lock is held.
 *
 * Nothing is written to a socket under the lock; {@link ConnectionRegistry} drains
 * the outbox after unlocking and performs the I/O.
 */
public class Outbox {

    private final List<Delivery> deliveries = new ArrayList<>();

    public void send(PeerChannel target, String payload) {
        deliveries.add(new Delivery(target, payload, null, 0, null));
    }

    /**
     * @param onFailure invoked outside the lock if the write fails
     */
    public void send(PeerChannel target, String payload, Consumer<IOException> onFailure) {
        deliveries.add(new Delivery(target, payload, onFailure, 0, null));
    }

    public void close(PeerChannel target, int code, String reason) {
        deliveries.add(new Delivery(target, null, null, code, reason));
    }

    List<Delivery> drain() {
        if (deliveries.isEmpty()) {
            return List.of();
        }
        List<Delivery> drained = new ArrayList<>(deliveries);
        deliveries.clear();
        return drained;
    }

    record Delivery(
            PeerChannel target,
            String payload,
            Consumer<IOException> onFailure,
            int closeCode,
            String closeReason
    ) {
        boolean isClose() {
            return payload == null;
        }
    }
}
