package com.deepansh.mcpendpoint.registry;

import com.deepansh.mcpendpoint.config.EndpointProperties;
import com.deepansh.mcpendpoint.support.FakeChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class IdleConnectionReaperTest {

    private EndpointProperties props;
    private ConnectionRegistry registry;
    private TaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        props = new EndpointProperties();
        registry = new ConnectionRegistry(props);
        scheduler = mock(TaskScheduler.class);
    }

    @Test
    void disabledByDefault_schedulesNothing() {
        new IdleConnectionReaper(registry, scheduler, props).start();

        verify(scheduler, never()).scheduleAtFixedRate(any(Runnable.class), any(Duration.class));
    }

    @Test
    void enabled_schedulesSweepAtConfiguredInterval() {
        props.getRegistry().setIdleTimeout(Duration.ofMinutes(5));
        props.getRegistry().setIdleSweepInterval(Duration.ofSeconds(30));

        new IdleConnectionReaper(registry, scheduler, props).start();

        verify(scheduler).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofSeconds(30)));
    }

    @Test
    void sweep_closesOnlyIdleConnections() throws Exception {
        props.getRegistry().setIdleTimeout(Duration.ofMillis(50));
        FakeChannel stale = new FakeChannel();
        registry.registerProvider("agent", "calc", stale);
        Thread.sleep(120);
        FakeChannel fresh = new FakeChannel();
        registry.registerClient("agent", fresh);

        int closed = new IdleConnectionReaper(registry, scheduler, props).sweep();

        assertThat(closed).isEqualTo(1);
        assertThat(stale.isOpen()).isFalse();
        assertThat(stale.getCloseCode()).isEqualTo(IdleConnectionReaper.CLOSE_GOING_AWAY);
        assertThat(fresh.isOpen()).isTrue();
    }
}
