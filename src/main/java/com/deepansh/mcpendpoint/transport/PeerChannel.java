package com.deepansh.mcpendpoint.transport;

import java.io.IOException;

/**
 * Outbound side of one live connection, provider or client.
 *
 * Implementations must allow {@link #send} from any thread.
 */
public interface PeerChannel {

    /** Unique for the lifetime of the process */
    String getId();

    boolean isOpen();

    void send(String text) throws IOException;

    /** Close with a WebSocket close code. Closing twice is a no-op. */
    void close(int code, String reason);
}
