package org.imagesift;

import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Parameters forwarded to {@link ImageCodec#encode}.
 *
 * <p>
 * The pipeline only routes these values; their meaning belongs to the codec.
 *
 * @param format target format, lower case (e.g. {@code png})
 * @param quality lossy quality 1..100, or null for the codec default
 * @param extras format specific pass-through options
 */
public record EncodeOptions(String format, @Nullable Integer quality, Map<String, String> extras) {

	public EncodeOptions {
		extras = Map.copyOf(extras);
	}

	public static EncodeOptions of(String format) {
		return new EncodeOptions(format, null, Map.of());
	}

	@Nullable
	public String extra(String key) {
		return extras.get(key);
	}

}
