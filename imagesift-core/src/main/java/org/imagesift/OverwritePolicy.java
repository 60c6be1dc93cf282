package org.imagesift;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Behaviour when a destination path is already taken.
 */
public enum OverwritePolicy {

	OVERWRITE("overwrite"),

	SKIP("skip"),

	RENAME("rename");

	private final String code;

	OverwritePolicy(String code) {
		this.code = code;
	}

	public String code() {
		return code;
	}

	public static OverwritePolicy fromCode(String code) {
		String normalized = code.trim().toLowerCase(Locale.ROOT);
		return Arrays.stream(values())
			.filter(policy -> policy.code.equals(normalized))
			.findFirst()
			.orElseThrow(() -> new IllegalArgumentException("Invalid overwrite policy '" + code
					+ "': must be one of "
					+ Arrays.stream(values()).map(OverwritePolicy::code).collect(Collectors.joining(", "))));
	}

}
