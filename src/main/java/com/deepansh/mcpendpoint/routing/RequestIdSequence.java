package com.deepansh.mcpendpoint.routing;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Ids for requests the relay sends to providers. Client ids are never forwarded
 * verbatim since two clients of one agent may well use the same id at the same time.
 */
@Component
public class RequestIdSequence {

    private static final String PREFIX = "mcpe-";

    private final AtomicLong counter = new AtomicLong();

    public String next() {
        return PREFIX + counter.incrementAndGet();
    }
}
