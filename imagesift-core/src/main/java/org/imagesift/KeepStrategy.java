package org.imagesift;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * How the keeper of a duplicate group is chosen.
 */
public enum KeepStrategy {

	/** The group's first member. */
	FIRST("first"),

	/** Highest {@code width * height}. */
	LARGEST("largest"),

	/** Highest byte size on disk. */
	LARGEST_FILE("largest-file"),

	/** Latest modification time. */
	NEWEST("newest"),

	/** Earliest modification time. */
	OLDEST("oldest");

	private final String code;

	KeepStrategy(String code) {
		this.code = code;
	}

	public String code() {
		return code;
	}

	/**
	 * Decode a command-line or configuration value.
	 * @throws IllegalArgumentException for unknown codes
	 */
	public static KeepStrategy fromCode(String code) {
		String normalized = code.trim().toLowerCase(Locale.ROOT);
		return Arrays.stream(values())
			.filter(strategy -> strategy.code.equals(normalized))
			.findFirst()
			.orElseThrow(() -> new IllegalArgumentException(
					"Invalid keep strategy '" + code + "': must be one of " + codes()));
	}

	public static String codes() {
		return Arrays.stream(values()).map(KeepStrategy::code).collect(Collectors.joining(", "));
	}

}
