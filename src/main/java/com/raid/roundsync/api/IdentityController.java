package com.raid.roundsync.api;

import java.util.List;
import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.raid.roundsync.core.model.AccountState;
import com.raid.roundsync.core.model.CachedList;
import com.raid.roundsync.core.model.Profile;
import com.raid.roundsync.core.model.SocialListKind;
import com.raid.roundsync.service.identity.ThreeTierIdentityCache;
import com.raid.roundsync.service.invite.DirectMessageInviter;
import com.raid.roundsync.service.invite.IncomingInvite;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping(path = "/api/identity", produces = MediaType.APPLICATION_JSON_VALUE)
public class IdentityController {

	private final ThreeTierIdentityCache identities;
	private final DirectMessageInviter inviter;
	private final AccountState account;

	public IdentityController(ThreeTierIdentityCache identities, DirectMessageInviter inviter, AccountState account) {
		this.identities = identities;
		this.inviter = inviter;
		this.account = account;
	}

	@GetMapping
	public Map<String, Object> me() {
		return Map.of("publicKey", account.publicKeyHex(), "activated", account.activated());
	}

	/**
	 * Profiles of the given keys. {@code cachedOnly=true} skips the relay round trip.
	 */
	@GetMapping("/profiles")
	public Mono<Map<String, Profile>> profiles(@RequestParam("keys") List<String> keys,
			@RequestParam(name = "cachedOnly", defaultValue = "false") boolean cachedOnly) {
		return cachedOnly ? identities.cached(keys) : identities.resolve(keys);
	}

	@GetMapping("/lists/{kind}/{owner}")
	public Mono<CachedList> list(@PathVariable SocialListKind kind, @PathVariable String owner) {
		return identities.list(kind, owner);
	}

	@GetMapping("/invites")
	public Flux<IncomingInvite> invites() {
		return inviter.fetchIncomingInvites();
	}
}
