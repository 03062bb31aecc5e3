package com.raid.roundsync.jetstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * =====================================================================
 * RelayBootstrapProperties
 * =====================================================================
 *
 * PURPOSE ------- Controls whether this device provisions the event stream on
 * the relays it is configured with, and how strictly an existing stream is
 * validated.
 *
 * Relays run by third parties usually already carry the stream; bootstrap is
 * meant for self-hosted relays and local development.
 *
 * CONFIGURATION PREFIX -------------------- raid.bootstrap.*
 */
@ConfigurationProperties(prefix = "raid.bootstrap")
public class RelayBootstrapProperties {

	/**
	 * Creates the stream on every configured relay at startup when missing.
	 *
	 * DEFAULT ------- false
	 */
	private boolean enabled = false;

	/**
	 * Determines behavior when an existing stream does NOT match the desired
	 * configuration.
	 *
	 * WHEN TRUE ---------- startup FAILS
	 *
	 * WHEN FALSE ----------- a WARNING is logged and startup continues
	 *
	 * It only controls **reaction**, not **repair**: existing streams are never
	 * modified.
	 */
	private boolean failOnMismatch = false;

	public boolean isEnabled() {
		return enabled;
	}

	public void setEnabled(boolean enabled) {
		this.enabled = enabled;
	}

	public boolean isFailOnMismatch() {
		return failOnMismatch;
	}

	public void setFailOnMismatch(boolean failOnMismatch) {
		this.failOnMismatch = failOnMismatch;
	}
}
