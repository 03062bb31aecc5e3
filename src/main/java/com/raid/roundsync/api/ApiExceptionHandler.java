package com.raid.roundsync.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import com.raid.roundsync.core.error.ContentNotFoundException;
import com.raid.roundsync.core.error.InvalidCourseDefinitionException;
import com.raid.roundsync.core.error.InvalidPlayerSetException;
import com.raid.roundsync.core.error.LocalStorageException;
import com.raid.roundsync.core.error.NotAParticipantException;
import com.raid.roundsync.core.error.ReadOnlyAccountException;
import com.raid.roundsync.core.error.RelayPublishException;
import com.raid.roundsync.core.error.RelayUnavailableException;
import com.raid.roundsync.core.error.UntrustedContentException;

/**
 * Maps domain errors to HTTP responses with a consistent {@code {code, message}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

	private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

	@ExceptionHandler({ InvalidPlayerSetException.class, InvalidCourseDefinitionException.class,
			IllegalArgumentException.class })
	public ResponseEntity<ApiError> badRequest(RuntimeException e) {
		return error(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage());
	}

	@ExceptionHandler(WebExchangeBindException.class)
	public ResponseEntity<ApiError> invalid(WebExchangeBindException e) {
		String detail = e.getFieldErrors().stream().map(f -> f.getField() + " " + f.getDefaultMessage()).findFirst()
				.orElse("invalid request");
		return error(HttpStatus.BAD_REQUEST, "bad_request", detail);
	}

	@ExceptionHandler(ContentNotFoundException.class)
	public ResponseEntity<ApiError> notFound(ContentNotFoundException e) {
		return error(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
	}

	@ExceptionHandler(NotAParticipantException.class)
	public ResponseEntity<ApiError> forbidden(NotAParticipantException e) {
		return error(HttpStatus.FORBIDDEN, "not_a_participant", e.getMessage());
	}

	@ExceptionHandler(UntrustedContentException.class)
	public ResponseEntity<ApiError> untrusted(UntrustedContentException e) {
		log.warn("Rejected untrusted content: {}", e.getMessage());
		return error(HttpStatus.UNPROCESSABLE_ENTITY, "untrusted_content", e.getMessage());
	}

	@ExceptionHandler({ ReadOnlyAccountException.class, IllegalStateException.class })
	public ResponseEntity<ApiError> conflict(RuntimeException e) {
		return error(HttpStatus.CONFLICT, "conflict", e.getMessage());
	}

	@ExceptionHandler({ RelayPublishException.class, RelayUnavailableException.class })
	public ResponseEntity<ApiError> relay(RuntimeException e) {
		log.warn("Relay network error: {}", e.getMessage());
		return error(HttpStatus.BAD_GATEWAY, "relay_unavailable", e.getMessage());
	}

	@ExceptionHandler(LocalStorageException.class)
	public ResponseEntity<ApiError> storage(LocalStorageException e) {
		log.error("Local storage failure", e);
		return error(HttpStatus.SERVICE_UNAVAILABLE, "local_storage", e.getMessage());
	}

	private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message) {
		return ResponseEntity.status(status).body(new ApiError(code, message));
	}

	public record ApiError(String code, String message) {
	}
}
