package com.rms.authsync.jetstream.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Durable pull consumer settings, bound from {@code authsync.consumer}.
 *
 * <pre>
 * authsync:
 *   consumer:
 *     enabled: true
 *     streams:
 *       - name: AUTH_EVENTS
 *         durable: qa-app-auth-replica
 *         filter-subject: auth.v1.&gt;
 *     batch-size: 25
 *     pull-timeout: 2s
 *     sleep: 250ms
 * </pre>
 *
 * <p>Validated at startup: an empty {@code streams} list stops the application from starting.</p>
 */
@Validated
@ConfigurationProperties(prefix = "authsync.consumer")
public class ConsumerProperties {

    /** Turns the polling loop on. The admin API and read model work without it. */
    private boolean enabled = true;

    @NotEmpty(message = "No streams configured (authsync.consumer.streams)")
    @Valid
    private List<StreamBinding> streams = new ArrayList<>();

    /** Upper bound on messages per fetch. */
    @Min(1)
    private int batchSize = 25;

    /** Max wait for one fetch when the stream is idle. */
    @NotNull
    private Duration pullTimeout = Duration.ofSeconds(2);

    /** Pause between two sweeps over all streams. */
    @NotNull
    private Duration sleep = Duration.ofMillis(250);

    /** Pause after a stream-level failure before that stream is tried again in the next sweep. */
    @NotNull
    private Duration errorBackoff = Duration.ofSeconds(1);

    /**
     * Deliveries after which a message is parked instead of processed again. Also written to
     * {@code max_deliver} on consumers this process creates, so the last delivery the server makes
     * is the one that parks.
     */
    @Min(2)
    private int maxDeliver = 5;

    @NotNull
    private Duration ackWait = Duration.ofSeconds(30);

    @Min(1)
    private long maxAckPending = 2000;

    @Min(1)
    private long maxPullWaiting = 128;

    /** Redelivery delay requested on nak. Zero means an immediate plain nak. */
    @NotNull
    private Duration nakDelay = Duration.ofSeconds(5);

    @NotNull
    private Duration handlerTimeout = Duration.ofSeconds(30);

    /** How long shutdown waits for the in-flight message to settle. */
    @NotNull
    private Duration shutdownGrace = Duration.ofSeconds(10);

    /** Dead-letter events that fail validation instead of nak'ing them until max-deliver. */
    private boolean parkInvalidEvents = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<StreamBinding> getStreams() {
        return streams;
    }

    public void setStreams(List<StreamBinding> streams) {
        this.streams = streams;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getPullTimeout() {
        return pullTimeout;
    }

    public void setPullTimeout(Duration pullTimeout) {
        this.pullTimeout = pullTimeout;
    }

    public Duration getSleep() {
        return sleep;
    }

    public void setSleep(Duration sleep) {
        this.sleep = sleep;
    }

    public Duration getErrorBackoff() {
        return errorBackoff;
    }

    public void setErrorBackoff(Duration errorBackoff) {
        this.errorBackoff = errorBackoff;
    }

    public int getMaxDeliver() {
        return maxDeliver;
    }

    public void setMaxDeliver(int maxDeliver) {
        this.maxDeliver = maxDeliver;
    }

    public Duration getAckWait() {
        return ackWait;
    }

    public void setAckWait(Duration ackWait) {
        this.ackWait = ackWait;
    }

    public long getMaxAckPending() {
        return maxAckPending;
    }

    public void setMaxAckPending(long maxAckPending) {
        this.maxAckPending = maxAckPending;
    }

    public long getMaxPullWaiting() {
        return maxPullWaiting;
    }

    public void setMaxPullWaiting(long maxPullWaiting) {
        this.maxPullWaiting = maxPullWaiting;
    }

    public Duration getNakDelay() {
        return nakDelay;
    }

    public void setNakDelay(Duration nakDelay) {
        this.nakDelay = nakDelay;
    }

    public Duration getHandlerTimeout() {
        return handlerTimeout;
    }

    public void setHandlerTimeout(Duration handlerTimeout) {
        this.handlerTimeout = handlerTimeout;
    }

    public Duration getShutdownGrace() {
        return shutdownGrace;
    }

    public void setShutdownGrace(Duration shutdownGrace) {
        this.shutdownGrace = shutdownGrace;
    }

    public boolean isParkInvalidEvents() {
        return parkInvalidEvents;
    }

    public void setParkInvalidEvents(boolean parkInvalidEvents) {
        this.parkInvalidEvents = parkInvalidEvents;
    }

    /**
     * One {@code (stream, durable, filter)} triple the poller sweeps.
     */
    public static class StreamBinding {

        @NotBlank
        private String name;

        @NotBlank
        private String durable;

        /** Defaults to everything the stream carries. */
        @NotBlank
        private String filterSubject = ">";

        public StreamBinding() {
        }

        public StreamBinding(String name, String durable, String filterSubject) {
            this.name = name;
            this.durable = durable;
            this.filterSubject = filterSubject;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getDurable() { return durable; }
        public void setDurable(String durable) { this.durable = durable; }

        public String getFilterSubject() { return filterSubject; }
        public void setFilterSubject(String filterSubject) { this.filterSubject = filterSubject; }

        @Override
        public String toString() {
            return name + "/" + durable + "(" + filterSubject + ")";
        }
    }
}
