package org.imagesift;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands rename patterns.
 *
 * <p>
 * Supported tokens: {@code {name}} (stem), {@code {ext}} (source extension without dot),
 * {@code {fmt}} (current format), {@code {index}} (padded to the configured width),
 * {@code {index:N}} (padded to N digits) and {@code {ratio}} (classification label).
 * Unknown tokens are left as they are.
 */
public final class RenamePattern {

	private static final Pattern INDEX_WIDTH = Pattern.compile("\\{index:(\\d+)}");

	/** Upper bound for {@code {index:N}} and the configured index width. */
	public static final int MAX_INDEX_WIDTH = 32;

	private final String pattern;

	private final int width;

	public RenamePattern(String pattern, int width) {
		validate(pattern, width);
		this.pattern = pattern;
		this.width = width;
	}

	/**
	 * Check the index widths of a pattern.
	 * @throws IllegalArgumentException if {@code width} or any {@code {index:N}} is out of
	 * range
	 */
	public static void validate(String pattern, int width) {
		if (width < 0 || width > MAX_INDEX_WIDTH) {
			throw new IllegalArgumentException(
					"Index width must be within 0.." + MAX_INDEX_WIDTH + " (got: " + width + ")");
		}
		Matcher matcher = INDEX_WIDTH.matcher(pattern);
		while (matcher.find()) {
			String digits = matcher.group(1);
			int digitCount = digits.length() > 9 ? Integer.MAX_VALUE : Integer.parseInt(digits);
			if (digitCount < 1 || digitCount > MAX_INDEX_WIDTH) {
				throw new IllegalArgumentException("Index width in '" + matcher.group() + "' must be within 1.."
						+ MAX_INDEX_WIDTH);
			}
		}
	}

	/**
	 * Expand the pattern for one file. A result without a dot gets {@code .fmt} appended.
	 */
	public String expand(String name, String ext, String fmt, long index, String ratio) {
		Matcher matcher = INDEX_WIDTH.matcher(pattern);
		StringBuilder expanded = new StringBuilder();
		while (matcher.find()) {
			int digits = Integer.parseInt(matcher.group(1));
			matcher.appendReplacement(expanded, Matcher.quoteReplacement(pad(index, digits)));
		}
		matcher.appendTail(expanded);

		String result = expanded.toString()
			.replace("{index}", pad(index, width))
			.replace("{name}", name)
			.replace("{ext}", ext)
			.replace("{fmt}", fmt)
			.replace("{ratio}", ratio);

		String fileName = result.substring(result.lastIndexOf('/') + 1);
		if (!fileName.contains(".") && !fmt.isEmpty()) {
			result = result + "." + fmt;
		}
		return result;
	}

	static String pad(long value, int digits) {
		if (value < 0) {
			return "-" + pad(-value, digits);
		}
		String text = Long.toString(value);
		if (text.length() >= digits) {
			return text;
		}
		return "0".repeat(digits - text.length()) + text;
	}

	@Override
	public String toString() {
		return pattern;
	}

}
