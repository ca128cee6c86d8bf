package com.rms.authsync.consumer;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.rms.authsync.jetstream.config.ConsumerProperties;
import com.rms.authsync.jetstream.config.ConsumerProperties.StreamBinding;
import com.rms.authsync.jetstream.consumer.DurableConsumerBinder;
import com.rms.authsync.jetstream.consumer.NatsInboundMessage;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Top-level consumption loop.
 *
 * <ul>
 *   <li>One sweep visits every configured stream in order: bind the durable, fetch up to
 *       {@code batch-size} messages waiting at most {@code pull-timeout}, process them one at a time.</li>
 *   <li>Sweeps repeat forever with {@code sleep} in between.</li>
 *   <li>A failing stream (broker unreachable, stream missing) is logged, its subscription dropped,
 *       and the sweep moves on after {@code error-backoff}.</li>
 *   <li>Starts after the application is ready, never from the constructor.</li>
 * </ul>
 *
 * <h2>Shutdown</h2>
 * Stops fetching and stops taking messages from the current batch, then waits up to
 * {@code shutdown-grace} for the message in flight to settle. Unprocessed messages of the batch are
 * left unacked and come back after the ack wait.
 */
@Component
@ConditionalOnProperty(prefix = "authsync.consumer", name = "enabled", havingValue = "true", matchIfMissing = true)
public class StreamPoller implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(StreamPoller.class);

    private final DurableConsumerBinder binder;
    private final EventProcessor processor;
    private final ConsumerProperties props;

    private final AtomicReference<Disposable> running = new AtomicReference<>();
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final CountDownLatch stopped = new CountDownLatch(1);

    public StreamPoller(DurableConsumerBinder binder, EventProcessor processor, ConsumerProperties props) {
        if (props.getStreams() == null || props.getStreams().isEmpty()) {
            throw new IllegalStateException("No streams configured (authsync.consumer.streams)");
        }
        this.binder = binder;
        this.processor = processor;
        this.props = props;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onAppReady() {
        start();
    }

    /**
     * Idempotent.
     */
    public void start() {
        if (running.get() != null || stopping.get()) {
            return;
        }

        Disposable d = Mono.defer(this::sweep)
                .then(Mono.delay(props.getSleep()))
                .repeat(() -> !stopping.get())
                .subscribeOn(Schedulers.boundedElastic())
                .doFinally(signal -> stopped.countDown())
                .subscribe(
                        tick -> { },
                        err -> log.error("Stream poller terminated unexpectedly: {}", err.toString(), err));

        if (!running.compareAndSet(null, d)) {
            d.dispose();
            return;
        }
        log.info("Stream poller started streams={} batchSize={} pullTimeout={} sleep={}",
                props.getStreams(), props.getBatchSize(), props.getPullTimeout(), props.getSleep());
    }

    /**
     * One pass over all streams. Completes normally even when streams fail.
     */
    Mono<Void> sweep() {
        return Flux.fromIterable(props.getStreams())
                .takeWhile(binding -> !stopping.get())
                .concatMap(binding -> pollStream(binding)
                        .onErrorResume(err -> {
                            log.warn("Stream poll failed, will retry next sweep stream={} durable={} err={}",
                                    binding.getName(), binding.getDurable(), err.toString());
                            binder.invalidate(binding);
                            return Mono.delay(props.getErrorBackoff()).then();
                        }))
                .then();
    }

    private Mono<Void> pollStream(StreamBinding binding) {
        return Mono.fromCallable(() -> binder.ensure(binding).fetch(props.getBatchSize(), props.getPullTimeout()))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(Flux::fromIterable)
                .takeWhile(message -> !stopping.get())
                .concatMap(message -> processor.process(new NatsInboundMessage(message), binding))
                .then();
    }

    public boolean isRunning() {
        return running.get() != null && !stopping.get();
    }

    @Override
    public void destroy() {
        stopping.set(true);
        Disposable d = running.getAndSet(null);
        if (d != null) {
            Duration grace = props.getShutdownGrace();
            try {
                if (!stopped.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Stream poller did not stop within {}; cancelling", grace);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            d.dispose();
        }
        binder.releaseAll();
        log.info("Stream poller stopped");
    }
}
