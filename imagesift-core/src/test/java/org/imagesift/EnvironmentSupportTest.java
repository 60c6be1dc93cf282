package org.imagesift;

import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("EnvironmentSupport Tests")
class EnvironmentSupportTest {

	private static final String UNSET = "IMAGESIFT_TEST_NEVER_DEFINED";

	@Test
	@DisplayName("Unset variables resolve to null")
	void unsetVariableIsNull() {
		assertThat(EnvironmentSupport.get(UNSET)).isNull();
	}

	@Test
	@DisplayName("Unset integers fall back to the default")
	void unsetIntegerFallsBack() {
		assertThat(EnvironmentSupport.getPositiveInt(UNSET, 7)).isEqualTo(7);
	}

	@Test
	@DisplayName("Overrides leave properties untouched when nothing is set")
	void applyToKeepsDefaults() {
		PipelineProperties properties = new PipelineProperties();
		properties.setWorkers(3);
		String workers = EnvironmentSupport.get(EnvironmentSupport.WORKERS);
		String cacheDir = EnvironmentSupport.get(EnvironmentSupport.CACHE_DIR);
		Assumptions.assumeTrue(workers == null && cacheDir == null);

		PipelineProperties applied = EnvironmentSupport.applyTo(properties);

		assertThat(applied).isSameAs(properties);
		assertThat(applied.getWorkers()).isEqualTo(3);
	}

}
