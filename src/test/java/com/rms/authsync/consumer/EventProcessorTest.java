package com.rms.authsync.consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.rms.authsync.core.error.DependencyNotReadyException;
import com.rms.authsync.core.error.InvalidEventException;
import com.rms.authsync.core.error.UnroutableEventException;
import com.rms.authsync.core.model.EventEnvelope;
import com.rms.authsync.core.model.InboxRecord;
import com.rms.authsync.core.model.InboxState;
import com.rms.authsync.core.model.ReplicatedStore;
import com.rms.authsync.core.subject.EventSubjects;
import com.rms.authsync.jetstream.config.ConsumerProperties;
import com.rms.authsync.jetstream.config.ConsumerProperties.StreamBinding;
import com.rms.authsync.replication.EventRouter;
import com.rms.authsync.replication.ReplicationHandler;
import com.rms.authsync.support.ReadModelFixture;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

class EventProcessorTest {

    private static final StreamBinding BINDING = new StreamBinding("AUTH_EVENTS", "qa-app-auth-replica", "auth.v1.>");

    private ReadModelFixture fx;
    private ConsumerProperties props;
    private EventRouter router;
    private EventProcessor processor;

    private final AtomicInteger invocations = new AtomicInteger();
    private Function<EventEnvelope, Mono<Void>> behaviour;

    @BeforeEach
    void setUp() {
        fx = ReadModelFixture.create();
        props = new ConsumerProperties();
        props.setNakDelay(Duration.ofSeconds(5));
        props.setHandlerTimeout(Duration.ofSeconds(5));
        props.setMaxDeliver(5);

        behaviour = event -> Mono.empty();
        ReplicationHandler handler = new ReplicationHandler() {
            @Override
            public String subject() {
                return EventSubjects.STORE_CREATED;
            }

            @Override
            public Mono<Void> apply(EventEnvelope event) {
                invocations.incrementAndGet();
                return behaviour.apply(event);
            }
        };

        router = mock(EventRouter.class);
        when(router.resolve(EventSubjects.STORE_CREATED)).thenReturn(handler);
        when(router.resolve("auth.v1.tenant.created")).thenThrow(new UnroutableEventException("auth.v1.tenant.created"));

        processor = new EventProcessor(fx.codec, router, fx.gate, fx.tx, props);
    }

    private static FakeMessage message(String id, String subject, long deliveries) {
        String body = "{\"id\":\"" + id + "\",\"subject\":\"" + subject + "\",\"data\":{\"store\":{\"id\":1,\"name\":\"North\"}}}";
        return new FakeMessage(body, deliveries);
    }

    private InboxRecord inbox(String id) {
        return fx.inbox.findById(id).block();
    }

    @Test
    void redeliveredEventIsAppliedOnce() {
        FakeMessage first = message("evt-1", EventSubjects.STORE_CREATED, 1);
        FakeMessage again = message("evt-1", EventSubjects.STORE_CREATED, 2);

        StepVerifier.create(processor.process(first, BINDING)).expectNext(Disposition.APPLIED).verifyComplete();
        StepVerifier.create(processor.process(again, BINDING)).expectNext(Disposition.DUPLICATE).verifyComplete();

        assertEquals(1, invocations.get());
        assertEquals(1, first.acks);
        assertEquals(1, again.acks);
        assertEquals(InboxState.PROCESSED, inbox("evt-1").state());
    }

    @Test
    void concurrentRedeliveryWaitsOnTheRowLockAndIsAppliedOnce() {
        behaviour = event -> Mono.delay(Duration.ofMillis(300)).then();
        FakeMessage first = message("evt-9", EventSubjects.STORE_CREATED, 1);
        FakeMessage second = message("evt-9", EventSubjects.STORE_CREATED, 2);

        List<Disposition> dispositions = Flux.merge(
                        processor.process(first, BINDING).subscribeOn(Schedulers.boundedElastic()),
                        processor.process(second, BINDING).subscribeOn(Schedulers.boundedElastic()))
                .collectSortedList()
                .block(Duration.ofSeconds(10));

        assertEquals(List.of(Disposition.APPLIED, Disposition.DUPLICATE), dispositions);
        assertEquals(1, invocations.get());
        assertEquals(1, first.acks);
        assertEquals(1, second.acks);
        assertTrue(first.naks.isEmpty());
        assertTrue(second.naks.isEmpty());
        assertEquals(InboxState.PROCESSED, inbox("evt-9").state());
    }

    @Test
    void undecodableBodyIsAckedWithoutInboxRow() {
        FakeMessage garbage = new FakeMessage("{\"subject\":\"auth.v1.store.created\"}", 1);

        StepVerifier.create(processor.process(garbage, BINDING)).expectNext(Disposition.DISCARDED).verifyComplete();

        assertEquals(1, garbage.acks);
        assertTrue(garbage.naks.isEmpty());
        assertEquals(0, fx.count("SELECT COUNT(*) FROM event_inbox"));
    }

    @Test
    void unknownSubjectIsAckedWithoutInboxRow() {
        FakeMessage unknown = message("evt-2", "auth.v1.tenant.created", 1);

        StepVerifier.create(processor.process(unknown, BINDING)).expectNext(Disposition.UNROUTABLE).verifyComplete();

        assertEquals(1, unknown.acks);
        assertNull(inbox("evt-2"));
        assertEquals(0, invocations.get());
    }

    @Test
    void missingDependencyRollsBackAndNaks() {
        behaviour = event -> fx.stores.upsert(new ReplicatedStore(1, "North", 69))
                .then(Mono.error(new DependencyNotReadyException("Permission 'orders.view' not found for guard web")));
        FakeMessage msg = message("evt-3", EventSubjects.STORE_CREATED, 1);

        StepVerifier.create(processor.process(msg, BINDING)).expectNext(Disposition.RETRY).verifyComplete();

        assertEquals(0, msg.acks);
        assertEquals(List.of(Duration.ofSeconds(5)), msg.naks);
        assertNull(fx.stores.findById(1).block());

        InboxRecord row = inbox("evt-3");
        assertEquals(InboxState.FAILED, row.state());
        assertEquals("Permission 'orders.view' not found for guard web", row.lastError());
        assertEquals(1, row.attempts());

        behaviour = event -> fx.stores.upsert(new ReplicatedStore(1, "North", 69));
        FakeMessage redelivery = message("evt-3", EventSubjects.STORE_CREATED, 2);
        StepVerifier.create(processor.process(redelivery, BINDING)).expectNext(Disposition.APPLIED).verifyComplete();

        row = inbox("evt-3");
        assertEquals(InboxState.PROCESSED, row.state());
        assertNull(row.lastError());
        assertNotNull(fx.stores.findById(1).block());
    }

    @Test
    void invalidEventIsParked() {
        behaviour = event -> {
            throw new InvalidEventException("auth.v1.store.created: missing store.name");
        };
        FakeMessage msg = message("evt-4", EventSubjects.STORE_CREATED, 1);

        StepVerifier.create(processor.process(msg, BINDING)).expectNext(Disposition.PARKED).verifyComplete();

        assertEquals(1, msg.acks);
        InboxRecord row = inbox("evt-4");
        assertEquals(InboxState.PARKED, row.state());
        assertEquals("Invalid event: auth.v1.store.created: missing store.name", row.lastError());
    }

    @Test
    void invalidEventIsRetriedWhenParkingIsDisabled() {
        props.setParkInvalidEvents(false);
        behaviour = event -> Mono.error(new InvalidEventException("bad"));
        FakeMessage msg = message("evt-5", EventSubjects.STORE_CREATED, 1);

        StepVerifier.create(processor.process(msg, BINDING)).expectNext(Disposition.RETRY).verifyComplete();

        assertEquals(1, msg.naks.size());
        assertEquals(InboxState.FAILED, inbox("evt-5").state());
    }

    @Test
    void lastDeliveryParksWithoutRunningHandler() {
        FakeMessage msg = message("evt-6", EventSubjects.STORE_CREATED, 5);

        StepVerifier.create(processor.process(msg, BINDING)).expectNext(Disposition.PARKED).verifyComplete();

        assertEquals(0, invocations.get());
        assertEquals(1, msg.acks);
        InboxRecord row = inbox("evt-6");
        assertEquals(InboxState.PARKED, row.state());
        assertTrue(row.lastError().startsWith("Parked after 5 deliveries"));
    }

    @Test
    void slowHandlerTimesOutAndIsRetried() {
        props.setHandlerTimeout(Duration.ofMillis(100));
        behaviour = event -> Mono.never();
        FakeMessage msg = message("evt-7", EventSubjects.STORE_CREATED, 1);

        StepVerifier.create(processor.process(msg, BINDING)).expectNext(Disposition.RETRY).verifyComplete();

        assertEquals("Handler timed out", inbox("evt-7").lastError());
    }

    @Test
    void ackFailureDoesNotUndoProcessing() {
        FakeMessage msg = message("evt-8", EventSubjects.STORE_CREATED, 1);
        msg.failAck = true;

        StepVerifier.create(processor.process(msg, BINDING)).expectNext(Disposition.APPLIED).verifyComplete();

        assertEquals(InboxState.PROCESSED, inbox("evt-8").state());
    }

    @Test
    void previewIsTruncated() {
        String longBody = "x".repeat(500);

        assertEquals(200, EventProcessor.preview(longBody.getBytes(StandardCharsets.UTF_8)).length());
        assertEquals("", EventProcessor.preview(null));
    }

    static final class FakeMessage implements InboundMessage {

        private final byte[] body;
        private final long deliveries;
        int acks;
        final List<Duration> naks = new ArrayList<>();
        boolean failAck;

        FakeMessage(String body, long deliveries) {
            this.body = body.getBytes(StandardCharsets.UTF_8);
            this.deliveries = deliveries;
        }

        @Override
        public byte[] body() {
            return body;
        }

        @Override
        public long deliveryCount() {
            return deliveries;
        }

        @Override
        public void ack() {
            if (failAck) {
                throw new IllegalStateException("connection closed");
            }
            acks++;
        }

        @Override
        public void nak(Duration delay) {
            naks.add(delay);
        }
    }
}
