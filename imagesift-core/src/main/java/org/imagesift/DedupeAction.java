package org.imagesift;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * What happens to the redundant members of a duplicate group.
 */
public enum DedupeAction {

	/** Report only; every file continues down the pipeline. */
	LIST("list"),

	/** Remove redundant files (trash in Preview, discard in Commit). */
	DELETE("delete"),

	/** Relocate redundant files to the configured move directory. */
	MOVE("move");

	private final String code;

	DedupeAction(String code) {
		this.code = code;
	}

	public String code() {
		return code;
	}

	public static DedupeAction fromCode(String code) {
		String normalized = code.trim().toLowerCase(Locale.ROOT);
		return Arrays.stream(values())
			.filter(action -> action.code.equals(normalized))
			.findFirst()
			.orElseThrow(() -> new IllegalArgumentException("Invalid dedupe action '" + code + "': must be one of "
					+ Arrays.stream(values()).map(DedupeAction::code).collect(Collectors.joining(", "))));
	}

}
