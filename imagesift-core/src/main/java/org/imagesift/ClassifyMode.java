package org.imagesift;

import java.util.Locale;

/**
 * Classification criterion.
 */
public enum ClassifyMode {

	/** Match against a list of target aspect ratios. */
	RATIO,

	/** Square, landscape or portrait. */
	SHAPE;

	public static ClassifyMode fromCode(String code) {
		return switch (code.trim().toLowerCase(Locale.ROOT)) {
			case "ratio" -> RATIO;
			case "shape" -> SHAPE;
			default -> throw new IllegalArgumentException(
					"Invalid classify mode '" + code + "': must be 'ratio' or 'shape'");
		};
	}

}
