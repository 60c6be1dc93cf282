package org.imagesift;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Which existing group members a candidate record is compared against.
 */
public enum GroupingStrictness {

	/**
	 * Compare only against each group's first member. Cheap, but a record close to a
	 * later member can still start a new group.
	 */
	REPRESENTATIVE("representative"),

	/**
	 * Compare against every member; the record joins the first group with any member
	 * within the threshold.
	 */
	ANY_MEMBER("any-member");

	private final String code;

	GroupingStrictness(String code) {
		this.code = code;
	}

	public String code() {
		return code;
	}

	public static GroupingStrictness fromCode(String code) {
		String normalized = code.trim().toLowerCase(Locale.ROOT);
		return Arrays.stream(values())
			.filter(strictness -> strictness.code.equals(normalized))
			.findFirst()
			.orElseThrow(() -> new IllegalArgumentException("Invalid grouping strictness '" + code
					+ "': must be one of "
					+ Arrays.stream(values()).map(GroupingStrictness::code).collect(Collectors.joining(", "))));
	}

}
