package com.rms.authsync.consumer;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.rms.authsync.jetstream.config.ConsumerProperties;
import com.rms.authsync.jetstream.config.ConsumerProperties.StreamBinding;
import com.rms.authsync.jetstream.consumer.DurableConsumerBinder;

import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import reactor.core.publisher.Mono;

class StreamPollerTest {

    private final StreamBinding broken = new StreamBinding("LEGACY_EVENTS", "qa-app-legacy-replica", "legacy.>");
    private final StreamBinding healthy = new StreamBinding("AUTH_EVENTS", "qa-app-auth-replica", "auth.v1.>");

    private DurableConsumerBinder binder;
    private EventProcessor processor;
    private JetStreamSubscription subscription;
    private ConsumerProperties props;
    private StreamPoller poller;

    @BeforeEach
    void setUp() throws Exception {
        binder = mock(DurableConsumerBinder.class);
        processor = mock(EventProcessor.class);
        subscription = mock(JetStreamSubscription.class);

        props = new ConsumerProperties();
        props.setStreams(List.of(broken, healthy));
        props.setBatchSize(10);
        props.setPullTimeout(Duration.ofMillis(50));
        props.setSleep(Duration.ofMillis(10));
        props.setErrorBackoff(Duration.ofMillis(10));
        props.setShutdownGrace(Duration.ofSeconds(2));

        when(binder.ensure(broken)).thenThrow(new IOException("stream unavailable"));
        when(binder.ensure(healthy)).thenReturn(subscription);
        when(subscription.fetch(eq(10), any(Duration.class)))
                .thenReturn(List.of(mock(Message.class), mock(Message.class)));
        when(processor.process(any(InboundMessage.class), eq(healthy))).thenReturn(Mono.just(Disposition.APPLIED));

        poller = new StreamPoller(binder, processor, props);
    }

    @AfterEach
    void tearDown() {
        poller.destroy();
    }

    @Test
    void failingStreamDoesNotStopTheSweep() {
        poller.sweep().block(Duration.ofSeconds(5));

        verify(binder).invalidate(broken);
        verify(subscription).fetch(10, props.getPullTimeout());
        verify(processor, times(2)).process(any(InboundMessage.class), eq(healthy));
        verify(processor, never()).process(any(InboundMessage.class), eq(broken));
    }

    @Test
    void emptyFetchProcessesNothing() {
        when(subscription.fetch(eq(10), any(Duration.class))).thenReturn(List.of());

        poller.sweep().block(Duration.ofSeconds(5));

        verifyNoInteractions(processor);
    }

    @Test
    void loopKeepsSweepingUntilDestroyed() {
        poller.start();
        assertTrue(poller.isRunning());

        await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> verify(processor, atLeast(6)).process(any(InboundMessage.class), eq(healthy)));

        poller.destroy();

        assertFalse(poller.isRunning());
        verify(binder).releaseAll();
    }

    @Test
    void refusesToStartWithoutStreams() {
        ConsumerProperties empty = new ConsumerProperties();
        empty.setStreams(List.of());

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> new StreamPoller(binder, processor, empty));
        assertTrue(e.getMessage().contains("No streams configured"));
    }
}
