package com.raid.roundsync.api;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Application-wide {@link ObjectMapper}, used by the HTTP API and by the stores that keep JSON
 * columns (remote scores, cached lists) and the relay client.
 *
 * <ul>
 *   <li>{@link JavaTimeModule} so {@code Instant}, {@code LocalDate} and {@code Duration} work
 *       in request and response bodies.</li>
 *   <li>Dates as ISO-8601 text, not numeric timestamps.</li>
 *   <li>Unknown properties are ignored: relay payloads may carry fields this client does not
 *       know.</li>
 * </ul>
 *
 * Event ids and hashes never go through this mapper; they use {@code CanonicalJson}.
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
