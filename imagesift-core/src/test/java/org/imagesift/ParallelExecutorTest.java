package org.imagesift;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ParallelExecutor Tests")
class ParallelExecutorTest {

	@Test
	@DisplayName("Results come back in input order")
	void keepsInputOrder() {
		List<Integer> items = IntStream.range(0, 50).boxed().toList();
		List<Integer> progress = new CopyOnWriteArrayList<>();

		try (ParallelExecutor executor = new ParallelExecutor(4, new AtomicBoolean())) {
			List<Integer> results = executor.map(items, i -> {
				sleep((50 - i) % 5);
				return i * 2;
			}, (done, total) -> progress.add(done));

			assertThat(results).containsExactlyElementsOf(items.stream().map(i -> i * 2).toList());
			assertThat(progress).hasSize(50).contains(50);
		}
	}

	@Test
	@DisplayName("Tasks starting after cancellation do no work and return null")
	void cancelledTasksReturnNull() {
		AtomicBoolean cancelled = new AtomicBoolean();
		AtomicInteger started = new AtomicInteger();

		try (ParallelExecutor executor = new ParallelExecutor(1, cancelled)) {
			List<String> results = executor.map(List.of("a", "b", "c"), item -> {
				started.incrementAndGet();
				cancelled.set(true);
				return item;
			}, (done, total) -> {
			});

			assertThat(results).containsExactly("a", null, null);
			assertThat(started).hasValue(1);
		}
	}

	@Test
	@DisplayName("An unexpected task failure surfaces as a PipelineException")
	void unexpectedFailure() {
		try (ParallelExecutor executor = new ParallelExecutor(2, new AtomicBoolean())) {
			assertThatThrownBy(() -> executor.map(List.of(1), i -> {
				throw new IllegalStateException("bug");
			}, (done, total) -> {
			})).isInstanceOf(PipelineException.class).hasRootCauseMessage("bug");
		}
	}

	private static void sleep(long millis) {
		try {
			Thread.sleep(millis);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

}
