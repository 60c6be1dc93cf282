package org.imagesift;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Bounded worker pool for per-file tasks.
 *
 * <p>
 * Tasks check the cancellation flag when they start; a task that starts after
 * cancellation returns {@code null} without doing any work. Results are returned in input
 * order regardless of completion order.
 */
public class ParallelExecutor implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(ParallelExecutor.class);

	private final ExecutorService executor;

	private final AtomicBoolean cancelled;

	private final int workers;

	public ParallelExecutor(int workers, AtomicBoolean cancelled) {
		this.workers = workers;
		this.cancelled = cancelled;
		this.executor = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
	}

	public int getWorkers() {
		return workers;
	}

	/**
	 * Apply {@code task} to every item on the pool.
	 * @param items inputs
	 * @param task per-item work; must handle its own per-file failures
	 * @param onDone called after each completed task with the completed count
	 * @return results in input order, {@code null} for tasks skipped by cancellation
	 */
	public <T, R> List<@Nullable R> map(List<T> items, Function<T, R> task, ProgressCallback onDone) {
		AtomicInteger completed = new AtomicInteger();
		List<Future<@Nullable R>> futures = new ArrayList<>(items.size());
		for (T item : items) {
			futures.add(executor.submit(() -> {
				if (cancelled.get()) {
					return null;
				}
				R result = task.apply(item);
				onDone.completed(completed.incrementAndGet(), items.size());
				return result;
			}));
		}

		List<@Nullable R> results = new ArrayList<>(items.size());
		for (Future<@Nullable R> future : futures) {
			try {
				results.add(future.get());
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				cancelled.set(true);
				futures.forEach(pending -> pending.cancel(false));
				throw new PipelineException("Interrupted while waiting for workers", e);
			}
			catch (ExecutionException e) {
				throw new PipelineException("Worker task failed unexpectedly", e.getCause());
			}
		}
		return results;
	}

	@Override
	public void close() {
		executor.shutdown();
		try {
			if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
				logger.warn("Worker pool did not terminate in time, forcing shutdown");
				executor.shutdownNow();
			}
		}
		catch (InterruptedException e) {
			executor.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}

	/**
	 * Receives the number of finished tasks.
	 */
	@FunctionalInterface
	public interface ProgressCallback {

		void completed(int done, int total);

	}

	private static final class WorkerThreadFactory implements ThreadFactory {

		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, "imagesift-worker-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}

	}

}
