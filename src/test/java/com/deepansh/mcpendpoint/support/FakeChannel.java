package com.deepansh.mcpendpoint.support;

import com.deepansh.mcpendpoint.transport.PeerChannel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory channel that records everything written to it.
 */
public class FakeChannel implements PeerChannel {

    private static final AtomicInteger SEQ = new AtomicInteger();
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String id;
    private final List<String> sent = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile boolean failSends;
    private volatile Integer closeCode;
    private volatile String closeReason;

    public FakeChannel() {
        this.id = "fake-" + SEQ.incrementAndGet();
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void send(String text) throws IOException {
        if (!open) {
            throw new IOException("channel closed");
        }
        if (failSends) {
            throw new IOException("broken pipe");
        }
        sent.add(text);
    }

    @Override
    public void close(int code, String reason) {
        open = false;
        closeCode = code;
        closeReason = reason;
    }

    public void setOpen(boolean open) {
        this.open = open;
    }

    public void setFailSends(boolean failSends) {
        this.failSends = failSends;
    }

    public Integer getCloseCode() {
        return closeCode;
    }

    public String getCloseReason() {
        return closeReason;
    }

    public List<String> getSent() {
        return sent;
    }

    public List<JsonNode> messages() {
        List<JsonNode> nodes = new ArrayList<>();
        for (String text : sent) {
            nodes.add(parse(text));
        }
        return nodes;
    }

    public JsonNode last() {
        if (sent.isEmpty()) {
            throw new AssertionError("nothing was sent on " + id);
        }
        return parse(sent.get(sent.size() - 1));
    }

    public void clear() {
        sent.clear();
    }

    private static JsonNode parse(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
