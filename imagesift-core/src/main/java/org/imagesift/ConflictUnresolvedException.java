package org.imagesift;

import java.io.IOException;
import java.nio.file.Path;

/**
 * No free alternative name was found within {@link ConflictResolver#MAX_ATTEMPTS}
 * attempts. Reported like any other per-file I/O failure.
 */
public class ConflictUnresolvedException extends IOException {

	public ConflictUnresolvedException(Path desired, int attempts) {
		super("No free name for " + desired + " after " + attempts + " attempts");
	}

}
