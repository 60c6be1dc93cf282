package org.imagesift;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * A named aspect ratio used by the classification stage.
 *
 * @param width ratio width, 1..10000
 * @param height ratio height, 1..10000
 */
public record AspectRatio(int width, int height) {

	private static final Logger logger = LoggerFactory.getLogger(AspectRatio.class);

	/** Ratios used when none are configured. */
	public static final String DEFAULT_RATIOS = "16:9,3:2,4:3,1:1,21:9";

	static final int MAX_SIDE = 10_000;

	public AspectRatio {
		if (width < 1 || width > MAX_SIDE || height < 1 || height > MAX_SIDE) {
			throw new IllegalArgumentException("Ratio sides must be within 1.." + MAX_SIDE + ": " + width + ":" + height);
		}
	}

	public double value() {
		return (double) width / height;
	}

	/**
	 * Folder-safe label, e.g. {@code 4x3}.
	 */
	public String label() {
		return width + "x" + height;
	}

	/**
	 * Parse ratios from free text such as {@code "16:9, 4x3;1:1"}. Tokens are separated by
	 * commas, semicolons or whitespace; {@code x} is accepted in place of {@code :}.
	 * Malformed or out-of-range tokens are ignored, duplicates keep their first position.
	 * Blank text yields {@link #DEFAULT_RATIOS}.
	 */
	public static List<AspectRatio> parseList(String text) {
		String source = text.isBlank() ? DEFAULT_RATIOS : text.trim();
		Set<AspectRatio> ratios = new LinkedHashSet<>();
		for (String token : source.split("[;,\\s]+")) {
			if (token.isEmpty()) {
				continue;
			}
			String normalized = token.toLowerCase(Locale.ROOT).replace('x', ':');
			String[] parts = normalized.split(":", 2);
			if (parts.length != 2 || !isDigits(parts[0]) || !isDigits(parts[1])) {
				logger.debug("Ignoring malformed ratio '{}'", token);
				continue;
			}
			try {
				ratios.add(new AspectRatio(Integer.parseInt(parts[0]), Integer.parseInt(parts[1])));
			}
			catch (IllegalArgumentException e) {
				logger.debug("Ignoring ratio '{}': {}", token, e.getMessage());
			}
		}
		return List.copyOf(ratios);
	}

	private static boolean isDigits(String value) {
		return !value.isEmpty() && value.chars().allMatch(Character::isDigit);
	}

	@Override
	public String toString() {
		return width + ":" + height;
	}

}
