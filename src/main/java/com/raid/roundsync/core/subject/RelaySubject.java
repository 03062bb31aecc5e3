package com.raid.roundsync.core.subject;

import java.util.Objects;
import java.util.regex.Pattern;

import com.raid.roundsync.core.canonical.ContentHasher;
import com.raid.roundsync.core.event.EventKind;
import com.raid.roundsync.core.event.RelayEvent;

/**
 * =====================================================================
 * RelaySubject
 * =====================================================================
 *
 * PURPOSE ------- Maps an event onto the JetStream subject it is stored under
 * on a relay, so that queries can select events by kind, author and reference
 * with a subject filter instead of scanning the stream.
 *
 * CANONICAL FORMAT (LOCKED) ------------------------
 *
 * raid.<kind>.<author>.<ref>.<id>
 *
 * Token Count: EXACTLY 5
 *
 * The ref token is the event's primary pointer: - d tag for addressable kinds
 * (live scorecard, favorites set) - e tag for final records - p tag for gift
 * wraps (the recipient) - "_" otherwise
 *
 * A ref that is not token-safe (e.g. arbitrary d tags) is replaced by its
 * SHA-256 hex so wildcard characters can never reach the subject.
 *
 * Examples: raid.1501.<author>._.<id> raid.30501.<author>.<initiation>.<id>
 * raid.1059.<ephemeral>.<recipient>.<id>
 */
public final class RelaySubject {

	public static final String ROOT = "raid";

	/** Placeholder for "no reference". */
	public static final String NO_REF = "_";

	/** Matches any single token in a filter subject. */
	public static final String ANY = "*";

	/**
	 * Token rule: must start with alphanumeric, may contain alphanumeric,
	 * underscore and hyphen, at most 64 chars.
	 */
	private static final Pattern TOKEN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_-]{0,63}$");

	private final int kind;
	private final String author;
	private final String ref;
	private final String id;

	private RelaySubject(int kind, String author, String ref, String id) {
		this.kind = kind;
		this.author = requireToken(author, "author");
		this.ref = ref;
		this.id = requireToken(id, "id");
	}

	public static RelaySubject of(RelayEvent event) {
		Objects.requireNonNull(event, "event");
		return new RelaySubject(event.kind(), event.pubkey(), refToken(refOf(event)), event.id());
	}

	public String toSubject() {
		return ROOT + "." + kind + "." + author + "." + ref + "." + id;
	}

	/**
	 * Filter subject for a query. Null arguments become single-token wildcards.
	 */
	public static String filter(int kind, String author, String ref, String id) {
		return ROOT + "." + kind + "." + (author == null ? ANY : requireToken(author, "author")) + "."
				+ (ref == null ? ANY : refToken(ref)) + "." + (id == null ? ANY : requireToken(id, "id"));
	}

	/**
	 * Attempts to parse a subject string. Returns null if the subject is not
	 * canonical.
	 */
	public static Parsed tryParse(String subject) {
		if (subject == null)
			return null;

		String[] t = subject.split("\\.");
		if (t.length != 5 || !ROOT.equals(t[0]))
			return null;
		if (!t[1].chars().allMatch(Character::isDigit) || t[1].isEmpty() || t[1].length() > 9)
			return null;
		return new Parsed(Integer.parseInt(t[1]), t[2], t[3], t[4]);
	}

	/**
	 * Reference a relay stores this event under.
	 */
	static String refOf(RelayEvent event) {
		if (EventKind.isAddressable(event.kind())) {
			return event.identifier();
		}
		return switch (event.kind()) {
		case EventKind.FINAL_RECORD -> event.firstTag("e").orElse(NO_REF);
		case EventKind.GIFT_WRAP -> event.firstTag("p").orElse(NO_REF);
		default -> NO_REF;
		};
	}

	public static String refToken(String ref) {
		if (ref == null || ref.isEmpty() || NO_REF.equals(ref)) {
			return NO_REF;
		}
		return TOKEN.matcher(ref).matches() ? ref : ContentHasher.sha256Hex(ref);
	}

	private static String requireToken(String value, String name) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException(name + " is required");
		}
		if (!TOKEN.matcher(value).matches()) {
			throw new IllegalArgumentException(name + " must match " + TOKEN.pattern() + " but was: " + value);
		}
		return value;
	}

	public int kind() {
		return kind;
	}

	public String author() {
		return author;
	}

	public String ref() {
		return ref;
	}

	public String id() {
		return id;
	}

	/**
	 * Lightweight view of a parsed subject.
	 */
	public static final class Parsed {

		public final int kind;
		public final String author;
		public final String ref;
		public final String id;

		public Parsed(int kind, String author, String ref, String id) {
			this.kind = kind;
			this.author = author;
			this.ref = ref;
			this.id = id;
		}

		@Override
		public String toString() {
			return "Parsed{" + "kind=" + kind + ", author='" + author + '\'' + ", ref='" + ref + '\'' + ", id='" + id
					+ '\'' + '}';
		}
	}
}
