package com.rms.authsync.jetstream.admin;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import com.rms.authsync.core.model.InboxRecord;
import com.rms.authsync.core.model.InboxState;
import com.rms.authsync.jetstream.config.ConsumerProperties;
import com.rms.authsync.jetstream.config.ConsumerProperties.StreamBinding;
import com.rms.authsync.r2dbc.store.InboxEventStore;

import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.ConsumerInfo;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Read-only operational endpoints over the inbox ledger and the durable consumers.
 *
 * Disabled by default. Enable explicitly: authsync.admin.enabled=true
 */
@RestController
@RequestMapping(path = "/admin/replication", produces = MediaType.APPLICATION_JSON_VALUE)
@ConditionalOnProperty(prefix = "authsync.admin", name = "enabled", havingValue = "true", matchIfMissing = false)
@Validated
public class ReplicationAdminController {

	static final int MAX_LIMIT = 500;
	private static final int DEFAULT_LIMIT = 50;

	private final InboxEventStore inbox;
	private final JetStreamManagement jsm;
	private final ConsumerProperties consumerProps;

	public ReplicationAdminController(InboxEventStore inbox, JetStreamManagement jsm,
			ConsumerProperties consumerProps) {
		this.inbox = inbox;
		this.jsm = jsm;
		this.consumerProps = consumerProps;
	}

	/**
	 * Inbox rows in the given state, most recently touched first. Defaults to FAILED, which is what
	 * operators usually look for.
	 */
	@GetMapping("/inbox")
	public Flux<InboxEventResponse> inbox(@RequestParam(name = "state", required = false) String state,
			@RequestParam(name = "limit", required = false) @Min(1) @Max(MAX_LIMIT) Integer limit) {
		InboxState parsed = parseState(state);
		return inbox.findByState(parsed, clampLimit(limit)).map(InboxEventResponse::of);
	}

	@GetMapping("/inbox/{eventId}")
	public Mono<ResponseEntity<InboxEventResponse>> inboxEvent(@PathVariable("eventId") String eventId) {
		String id = requireNonBlank(eventId, "eventId");
		return inbox.findById(id).map(r -> ResponseEntity.ok(InboxEventResponse.of(r)))
				.defaultIfEmpty(ResponseEntity.notFound().build());
	}

	/**
	 * Server-side state of every configured durable. A binding whose consumer cannot be read is
	 * reported with an error instead of failing the whole response.
	 */
	@GetMapping("/consumers")
	public Flux<ConsumerStatusResponse> consumers() {
		return Flux.fromIterable(consumerProps.getStreams())
				.concatMap(b -> Mono.fromCallable(() -> consumerStatus(b)).subscribeOn(Schedulers.boundedElastic()));
	}

	private ConsumerStatusResponse consumerStatus(StreamBinding b) throws Exception {
		try {
			ConsumerInfo ci = jsm.getConsumerInfo(b.getName(), b.getDurable());
			return new ConsumerStatusResponse(b.getName(), b.getDurable(), b.getFilterSubject(), ci.getNumPending(),
					ci.getNumAckPending(), ci.getRedelivered(), ci.getNumWaiting(), null);
		} catch (JetStreamApiException e) {
			return new ConsumerStatusResponse(b.getName(), b.getDurable(), b.getFilterSubject(), null, null, null,
					null, e.getErrorDescription() + " (" + e.getApiErrorCode() + ")");
		}
	}

	// ---------------------------------------------------------------------
	// DTOs
	// ---------------------------------------------------------------------

	public record InboxEventResponse(String eventId, String subject, String source, String stream,
			String consumerName, String state, int attempts, String lastError, Instant processedAt, Instant parkedAt,
			Instant createdAt, Instant updatedAt, String payload) {

		static InboxEventResponse of(InboxRecord r) {
			return new InboxEventResponse(r.eventId(), r.subject(), r.source(), r.stream(), r.consumerName(),
					r.state().name(), r.attempts(), r.lastError(), r.processedAt(), r.parkedAt(), r.createdAt(),
					r.updatedAt(), r.payload());
		}
	}

	public record ConsumerStatusResponse(String stream, String durable, String filterSubject, Long numPending,
			Long numAckPending, Long redelivered, Long numWaiting, String error) {
	}

	// ---------------------------------------------------------------------
	// Small helpers
	// ---------------------------------------------------------------------

	static InboxState parseState(String state) {
		if (state == null || state.isBlank()) {
			return InboxState.FAILED;
		}
		try {
			return InboxState.valueOf(state.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("state must be one of " + List.of(InboxState.values()));
		}
	}

	static int clampLimit(Integer requested) {
		if (requested == null || requested <= 0) {
			return DEFAULT_LIMIT;
		}
		return Math.min(requested, MAX_LIMIT);
	}

	private static String requireNonBlank(String v, String field) {
		if (v == null || v.isBlank()) {
			throw new IllegalArgumentException(field + " is required");
		}
		return v.trim();
	}
}

/**
 * Error mapping for the admin API. Internal details stay in the server log.
 */
@RestControllerAdvice(assignableTypes = ReplicationAdminController.class)
class ReplicationAdminExceptionHandler {

	private static final Logger log = LoggerFactory.getLogger(ReplicationAdminExceptionHandler.class);

	@ExceptionHandler({ IllegalArgumentException.class, ConstraintViolationException.class })
	public ResponseEntity<ApiError> badRequest(RuntimeException e) {
		return ResponseEntity.badRequest().body(new ApiError("bad_request", e.getMessage()));
	}

	@ExceptionHandler(ServerWebInputException.class)
	public ResponseEntity<ApiError> badInput(ServerWebInputException e) {
		return ResponseEntity.badRequest().body(new ApiError("bad_request", e.getReason()));
	}

	@ExceptionHandler(Exception.class)
	public ResponseEntity<ApiError> internal(Exception e) {
		log.error("Admin endpoint failure", e);
		return ResponseEntity.status(500).body(new ApiError("internal_error", "Request failed"));
	}

	record ApiError(String code, String message) {
	}
}
