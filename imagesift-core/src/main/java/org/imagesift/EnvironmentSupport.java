package org.imagesift;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code IMAGESIFT_*} settings from the environment.
 *
 * <p>
 * A variable is looked up in a {@code .env} file in the working directory, where
 * dotenv-java also consults the process environment, and then in {@code ~/.env}. Both
 * files are optional and read once.
 */
public final class EnvironmentSupport {

	private static final Logger logger = LoggerFactory.getLogger(EnvironmentSupport.class);

	/** Default worker pool size. */
	public static final String WORKERS = "IMAGESIFT_WORKERS";

	/** Default parent directory for shadow workspaces. */
	public static final String CACHE_DIR = "IMAGESIFT_CACHE_DIR";

	private static final Dotenv WORKING_DIR_ENV = dotenvIn(null);

	private static final Dotenv USER_HOME_ENV = dotenvIn(System.getProperty("user.home"));

	private EnvironmentSupport() {
	}

	private static Dotenv dotenvIn(@Nullable String directory) {
		var configuration = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed();
		return (directory != null ? configuration.directory(directory) : configuration).load();
	}

	/**
	 * Value of a variable.
	 * @return the value, or {@code null} when neither file nor environment defines it
	 */
	@Nullable
	public static String get(String name) {
		String value = WORKING_DIR_ENV.get(name);
		return value != null ? value : USER_HOME_ENV.get(name);
	}

	/**
	 * Get a positive integer variable.
	 * @return the value, or {@code fallback} when unset or not a positive integer
	 */
	public static int getPositiveInt(String name, int fallback) {
		String value = get(name);
		if (value == null || value.isBlank()) {
			return fallback;
		}
		try {
			int parsed = Integer.parseInt(value.trim());
			if (parsed > 0) {
				return parsed;
			}
		}
		catch (NumberFormatException e) {
			logger.warn("Ignoring {}={}: {}", name, value, e.getMessage());
			return fallback;
		}
		logger.warn("Ignoring {}={}: expected a positive integer", name, value);
		return fallback;
	}

	/**
	 * Apply environment overrides to a properties bean.
	 */
	public static PipelineProperties applyTo(PipelineProperties properties) {
		properties.setWorkers(getPositiveInt(WORKERS, properties.getWorkers()));
		String cacheDir = get(CACHE_DIR);
		if (cacheDir != null && !cacheDir.isBlank()) {
			properties.setCacheDirectory(cacheDir.trim());
		}
		return properties;
	}

}
