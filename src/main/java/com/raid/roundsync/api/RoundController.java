package com.raid.roundsync.api;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.raid.roundsync.core.crypto.IdentityKeys;
import com.raid.roundsync.core.error.ContentNotFoundException;
import com.raid.roundsync.core.error.LocalStorageException;
import com.raid.roundsync.core.model.HoleDefinition;
import com.raid.roundsync.core.model.HoleScoreEvent;
import com.raid.roundsync.core.model.JoinedVia;
import com.raid.roundsync.core.model.RemotePlayerScores;
import com.raid.roundsync.core.model.Round;
import com.raid.roundsync.core.model.RoundPlayer;
import com.raid.roundsync.core.model.ScorecardStatus;
import com.raid.roundsync.core.model.ScoringMode;
import com.raid.roundsync.jetstream.config.RaidProperties;
import com.raid.roundsync.r2dbc.store.RoundNetworkStore;
import com.raid.roundsync.service.course.ContentAddressedCourseStore;
import com.raid.roundsync.service.invite.DirectMessageInviter;
import com.raid.roundsync.service.invite.InviteCodec;
import com.raid.roundsync.service.invite.InviteReport;
import com.raid.roundsync.service.join.JoinResult;
import com.raid.roundsync.service.join.RoundJoinService;
import com.raid.roundsync.service.publish.EventPublisher;
import com.raid.roundsync.service.round.ActiveRound;
import com.raid.roundsync.service.round.ActiveRoundRegistry;
import com.raid.roundsync.service.round.RoundAggregate;
import com.raid.roundsync.service.round.RoundDetails;
import com.raid.roundsync.service.round.RoundState;
import com.raid.roundsync.service.sync.SyncPoller;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Round lifecycle over HTTP: create, score, finish, publish, sync and invite.
 *
 * <p>Network-facing calls that the core treats as best-effort (background initiation publish,
 * final records on finish) never fail the request; their outcome is reported in the body.</p>
 */
@RestController
@RequestMapping(path = "/api/rounds", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class RoundController {

	private static final Logger log = LoggerFactory.getLogger(RoundController.class);

	private static final int MAX_AWAIT_ATTEMPTS = 60;
	private static final Duration MAX_AWAIT_INTERVAL = Duration.ofSeconds(30);

	private final ContentAddressedCourseStore courses;
	private final RoundAggregate rounds;
	private final ActiveRoundRegistry activeRounds;
	private final EventPublisher publisher;
	private final SyncPoller poller;
	private final DirectMessageInviter inviter;
	private final RoundJoinService joiner;
	private final RoundNetworkStore network;
	private final IdentityKeys keys;
	private final RaidProperties props;
	private final Clock clock;

	public RoundController(ContentAddressedCourseStore courses, RoundAggregate rounds, ActiveRoundRegistry activeRounds,
			EventPublisher publisher, SyncPoller poller, DirectMessageInviter inviter, RoundJoinService joiner,
			RoundNetworkStore network, IdentityKeys keys, RaidProperties props, Clock clock) {
		this.courses = courses;
		this.rounds = rounds;
		this.activeRounds = activeRounds;
		this.publisher = publisher;
		this.poller = poller;
		this.inviter = inviter;
		this.joiner = joiner;
		this.network = network;
		this.keys = keys;
		this.props = props;
		this.clock = clock;
	}

	/**
	 * Stores the course, creates the round with this device at index 0 and, for multi-device
	 * rounds or when asked, starts publishing the initiation in the background.
	 */
	@PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
	@ResponseStatus(HttpStatus.CREATED)
	public Mono<RoundResponse> create(@Valid @RequestBody CreateRoundRequest req) {
		ScoringMode mode = req.mode() == null ? ScoringMode.SAME_DEVICE : req.mode();
		List<HoleDefinition> holes = req.holes().stream().map(h -> new HoleDefinition(h.holeNumber(), h.par())).toList();
		LocalDate date = req.roundDate() == null ? LocalDate.now(clock) : req.roundDate();
		List<String> others = req.otherPlayers() == null ? List.of() : req.otherPlayers();

		return courses.getOrCreate(req.courseName(), req.teeSet(), holes)
				.flatMap(course -> rounds.createRound(course, keys.publicKeyHex(), others, date, mode))
				.doOnNext(round -> {
					if (mode == ScoringMode.MULTI_DEVICE || Boolean.TRUE.equals(req.publish())) {
						publisher.publishInitiationInBackground(round.roundId(), JoinedVia.forCreatedRound(mode));
					}
				})
				.flatMap(round -> view(round.roundId()));
	}

	@GetMapping
	public Flux<Round> list() {
		return rounds.rounds();
	}

	@GetMapping("/{roundId}")
	public Mono<RoundResponse> get(@PathVariable long roundId) {
		return view(roundId);
	}

	@PostMapping(path = "/{roundId}/scores", consumes = MediaType.APPLICATION_JSON_VALUE)
	@ResponseStatus(HttpStatus.CREATED)
	public Mono<HoleScoreEvent> recordScore(@PathVariable long roundId, @Valid @RequestBody RecordScoreRequest req) {
		return rounds.recordScore(roundId, req.playerIndex(), req.holeNumber(), req.strokes());
	}

	@GetMapping("/{roundId}/players/{playerIndex}/scores")
	public Mono<Map<Integer, Integer>> scores(@PathVariable long roundId, @PathVariable int playerIndex) {
		return rounds.round(roundId).then(rounds.currentScores(roundId, playerIndex));
	}

	@GetMapping("/{roundId}/finish-enabled")
	public Mono<Map<String, Object>> finishEnabled(@PathVariable long roundId,
			@RequestParam(name = "playerIndex", defaultValue = "0") int playerIndex) {
		return rounds.isFinishEnabled(roundId, playerIndex)
				.map(enabled -> Map.<String, Object>of("roundId", roundId, "playerIndex", playerIndex, "enabled", enabled));
	}

	@GetMapping("/{roundId}/active")
	public Mono<RoundState> activeState(@PathVariable long roundId) {
		return activeRounds.get(roundId).map(ActiveRound::state);
	}

	/**
	 * Drives the scoring session: {@code confirm}, {@code increment}, {@code decrement},
	 * {@code next}, {@code previous}, {@code player} (with {@code playerIndex}) and {@code finish}.
	 */
	@PostMapping("/{roundId}/active/{command}")
	public Mono<RoundState> command(@PathVariable long roundId, @PathVariable String command,
			@RequestParam(name = "playerIndex", required = false) Integer playerIndex) {
		return activeRounds.get(roundId).flatMap(active -> switch (command) {
			case "confirm" -> active.confirmAtPar();
			case "increment" -> active.increment();
			case "decrement" -> active.decrement();
			case "next" -> Mono.fromCallable(active::advanceHole);
			case "previous" -> Mono.fromCallable(active::retreatHole);
			case "player" -> {
				if (playerIndex == null) {
					yield Mono.<RoundState>error(new IllegalArgumentException("playerIndex is required"));
				}
				yield Mono.fromCallable(() -> active.switchPlayer(playerIndex));
			}
			case "finish" -> active.requestFinish();
			default -> Mono.<RoundState>error(new IllegalArgumentException("Unknown command: " + command));
		});
	}

	/** Publishes the initiation now and returns its id (the stored one if already published). */
	@PostMapping("/{roundId}/publish")
	public Mono<Map<String, Object>> publish(@PathVariable long roundId) {
		return rounds.round(roundId)
				.flatMap(r -> publisher.publishInitiation(roundId, JoinedVia.forCreatedRound(r.scoringMode())))
				.map(id -> Map.<String, Object>of("roundId", roundId, "initiationEventId", id));
	}

	/**
	 * Completes the round and publishes the final records this device owns. A publish failure
	 * leaves the round completed and is reported in {@code publishError}.
	 */
	@PostMapping("/{roundId}/finish")
	public Mono<FinishResponse> finish(@PathVariable long roundId) {
		return rounds.completeRound(roundId)
				.doOnNext(r -> activeRounds.close(roundId))
				.flatMap(round -> publisher.publishFinalRecords(roundId)
						.map(ids -> new FinishResponse(round, ids, null))
						.onErrorResume(err -> !(err instanceof LocalStorageException), err -> {
							log.warn("Final records for round {} not published: {}", roundId, err.toString());
							return Mono.just(new FinishResponse(round, List.of(), err.getMessage()));
						}));
	}

	@PostMapping("/{roundId}/live-scorecard")
	public Mono<Map<String, Object>> liveScorecard(@PathVariable long roundId,
			@RequestParam(name = "status", defaultValue = "in_progress") String status) {
		return publisher.publishLiveScorecard(roundId, ScorecardStatus.fromWire(status))
				.map(id -> Map.<String, Object>of("roundId", roundId, "eventId", id));
	}

	@PostMapping("/{roundId}/remote-scores/refresh")
	public Mono<Map<String, RemotePlayerScores>> refreshRemoteScores(@PathVariable long roundId) {
		return poller.refreshRemoteScores(roundId);
	}

	/**
	 * Waits (bounded) for the initiation id and returns the invite token for it.
	 *
	 * @throws ContentNotFoundException if the id did not appear in time
	 */
	@PostMapping(path = "/{roundId}/invite-token")
	public Mono<InviteTokenResponse> inviteToken(@PathVariable long roundId,
			@RequestBody(required = false) AwaitRequest req) {
		int attempts = req == null || req.attempts() == null ? props.getInvite().getAwaitAttempts()
				: Math.min(req.attempts(), MAX_AWAIT_ATTEMPTS);
		Duration interval = req == null || req.interval() == null ? props.getInvite().getAwaitInterval()
				: clamp(req.interval());
		List<String> hints = props.getRelays().getPublish();
		return rounds.round(roundId)
				.then(poller.awaitInitiationRecord(roundId, attempts, interval))
				.switchIfEmpty(Mono.error(() -> new ContentNotFoundException(
						"Round " + roundId + " has no initiation id after " + attempts + " attempts")))
				.map(id -> new InviteTokenResponse(id, InviteCodec.encode(id, hints), InviteCodec.toUri(id, hints)));
	}

	@PostMapping(path = "/{roundId}/invites", consumes = MediaType.APPLICATION_JSON_VALUE)
	public Mono<InviteReport> sendInvites(@PathVariable long roundId, @Valid @RequestBody SendInvitesRequest req) {
		return inviter.sendInvites(roundId, req.recipients());
	}

	@PostMapping(path = "/join", consumes = MediaType.APPLICATION_JSON_VALUE)
	public Mono<JoinResult> join(@Valid @RequestBody JoinRequest req) {
		return joiner.joinRound(req.token());
	}

	private Mono<RoundResponse> view(long roundId) {
		return rounds.details(roundId).flatMap(d -> Flux.fromIterable(d.players())
				.filter(p -> d.round().scoringMode().scoresLocally(p.playerIndex()))
				.concatMap(p -> rounds.currentScores(roundId, p.playerIndex()).map(s -> Map.entry(p.playerIndex(), s)))
				.collectMap(Map.Entry::getKey, Map.Entry::getValue)
				.zipWith(rounds.isFinishEnabled(roundId, 0))
				.zipWith(network.findByRoundId(roundId).map(r -> r.initiationEventId()).defaultIfEmpty(""))
				.map(t -> toResponse(d, t.getT1().getT1(), t.getT1().getT2(), t.getT2())));
	}

	private static RoundResponse toResponse(RoundDetails d, Map<Integer, Map<Integer, Integer>> scores,
			boolean finishEnabled, String initiationId) {
		return new RoundResponse(d.round(), d.course().contentHash(), d.course().courseName(), d.course().teeSetName(),
				d.course().holes(), d.players(), scores, finishEnabled, initiationId.isEmpty() ? null : initiationId);
	}

	private static Duration clamp(Duration requested) {
		if (requested.isNegative() || requested.isZero()) {
			throw new IllegalArgumentException("interval must be positive");
		}
		return requested.compareTo(MAX_AWAIT_INTERVAL) > 0 ? MAX_AWAIT_INTERVAL : requested;
	}

	// ---------------------------------------------------------------------
	// DTOs
	// ---------------------------------------------------------------------

	public record HoleRequest(@Min(1) @Max(18) int holeNumber, @Min(3) @Max(6) int par) {
	}

	public record CreateRoundRequest(@NotBlank String courseName, @NotBlank String teeSet,
			@NotEmpty List<@Valid HoleRequest> holes, List<String> otherPlayers, LocalDate roundDate, ScoringMode mode,
			Boolean publish) {
	}

	public record RecordScoreRequest(@Min(0) int playerIndex, @Min(1) @Max(18) int holeNumber,
			@Min(1) @Max(20) int strokes) {
	}

	public record AwaitRequest(@Min(1) Integer attempts,
			@JsonDeserialize(using = FlexibleDurationDeserializer.class) Duration interval) {
	}

	public record SendInvitesRequest(@NotNull @NotEmpty List<String> recipients) {
	}

	public record JoinRequest(@NotBlank String token) {
	}

	public record RoundResponse(Round round, String courseHash, String courseName, String teeSet,
			List<HoleDefinition> holes, List<RoundPlayer> players, Map<Integer, Map<Integer, Integer>> scores,
			boolean finishEnabled, String initiationEventId) {
	}

	public record FinishResponse(Round round, List<String> finalRecordIds, String publishError) {
	}

	public record InviteTokenResponse(String initiationEventId, String token, String uri) {
	}
}
