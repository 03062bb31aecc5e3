package com.raid.roundsync.api;

import static org.junit.Assert.assertEquals;

import java.util.List;

import org.junit.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import com.raid.roundsync.api.ApiExceptionHandler.ApiError;
import com.raid.roundsync.core.error.ContentNotFoundException;
import com.raid.roundsync.core.error.InvalidPlayerSetException;
import com.raid.roundsync.core.error.LocalStorageException;
import com.raid.roundsync.core.error.NotAParticipantException;
import com.raid.roundsync.core.error.ReadOnlyAccountException;
import com.raid.roundsync.core.error.RelayPublishException;
import com.raid.roundsync.core.error.UntrustedContentException;

public class ApiExceptionHandlerTest {

    private final ApiExceptionHandler handler = new ApiExceptionHandler();

    @Test
    public void mapsDomainErrorsToStatusCodes() {
        assertStatus(HttpStatus.BAD_REQUEST, "bad_request", handler.badRequest(new InvalidPlayerSetException("dup")));
        assertStatus(HttpStatus.NOT_FOUND, "not_found", handler.notFound(new ContentNotFoundException("No round 7")));
        assertStatus(HttpStatus.FORBIDDEN, "not_a_participant",
                handler.forbidden(new NotAParticipantException("ab".repeat(32))));
        assertStatus(HttpStatus.UNPROCESSABLE_ENTITY, "untrusted_content",
                handler.untrusted(new UntrustedContentException("course", "aa", "bb")));
        assertStatus(HttpStatus.CONFLICT, "conflict", handler.conflict(new ReadOnlyAccountException("publish round 1")));
        assertStatus(HttpStatus.BAD_GATEWAY, "relay_unavailable",
                handler.relay(new RelayPublishException("ab".repeat(32), List.of("nats://a:4222"), null)));
        assertStatus(HttpStatus.SERVICE_UNAVAILABLE, "local_storage",
                handler.storage(new LocalStorageException("Local write failed", new IllegalStateException("disk"))));
    }

    @Test
    public void keepsMessage() {
        ResponseEntity<ApiError> r = handler.notFound(new ContentNotFoundException("No round 7"));
        assertEquals("No round 7", r.getBody().message());
    }

    private static void assertStatus(HttpStatus status, String code, ResponseEntity<ApiError> response) {
        assertEquals(status, response.getStatusCode());
        assertEquals(code, response.getBody().code());
    }
}
