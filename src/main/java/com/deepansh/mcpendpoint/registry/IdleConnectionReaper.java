package com.deepansh.mcpendpoint.registry;

import com.deepansh.mcpendpoint.config.EndpointProperties;
import com.deepansh.mcpendpoint.transport.PeerChannel;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Closes connections that have sent nothing for endpoint.registry.idle-timeout.
 * Registry cleanup follows from the transport's close callback.
 */
@Component
@Slf4j
public class IdleConnectionReaper {

    static final int CLOSE_GOING_AWAY = 1001;

    private final ConnectionRegistry registry;
    private final TaskScheduler scheduler;
    private final EndpointProperties properties;

    private ScheduledFuture<?> sweepTask;

    public IdleConnectionReaper(ConnectionRegistry registry,
                                @Qualifier("brokerTaskScheduler") TaskScheduler scheduler,
                                EndpointProperties properties) {
        this.registry = registry;
        this.scheduler = scheduler;
        this.properties = properties;
    }

    @PostConstruct
    public void start() {
        Duration idleTimeout = properties.getRegistry().getIdleTimeout();
        if (idleTimeout.isZero() || idleTimeout.isNegative()) {
            log.info("Idle connection sweep disabled");
            return;
        }
        Duration interval = properties.getRegistry().getIdleSweepInterval();
        sweepTask = scheduler.scheduleAtFixedRate(this::sweep, interval);
        log.info("Idle connection sweep every {} [idleTimeout={}]", interval, idleTimeout);
    }

    @PreDestroy
    public void stop() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
        }
    }

    /** @return number of connections closed */
    public int sweep() {
        Instant cutoff = Instant.now().minus(properties.getRegistry().getIdleTimeout());
        List<PeerChannel> idle = registry.findIdleChannels(cutoff);
        for (PeerChannel channel : idle) {
            log.info("Closing idle connection {}", channel.getId());
            channel.close(CLOSE_GOING_AWAY, "Idle timeout");
        }
        return idle.size();
    }
}
