package org.imagesift;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Multi-producer, single-consumer channel for pipeline events.
 *
 * <p>
 * Worker threads {@link #publish(PipelineEvent) publish} events; one dispatcher thread
 * drains the queue and hands each message to every registered listener in publication
 * order. {@link #close()} drains what is left and stops the dispatcher.
 */
public class EventChannel implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(EventChannel.class);

	private final BlockingQueue<Message> queue = new LinkedBlockingQueue<>();

	private final List<PipelineEventListener> listeners = new CopyOnWriteArrayList<>();

	private final Thread dispatcher;

	private volatile boolean closed = false;

	public EventChannel() {
		this.dispatcher = new Thread(this::dispatchLoop, "imagesift-events");
		this.dispatcher.setDaemon(true);
		this.dispatcher.start();
	}

	public EventChannel(List<? extends PipelineEventListener> listeners) {
		this();
		this.listeners.addAll(listeners);
	}

	public void addListener(PipelineEventListener listener) {
		listeners.add(listener);
	}

	public void removeListener(PipelineEventListener listener) {
		listeners.remove(listener);
	}

	public void publish(PipelineEvent event) {
		offer(new EventMessage(event));
	}

	public void progress(PipelineStage stage, int done, int total) {
		offer(new ProgressMessage(stage, done, total));
	}

	private void offer(Message message) {
		if (closed) {
			logger.debug("Dropping message after close: {}", message);
			return;
		}
		queue.add(message);
	}

	/**
	 * Block until every message published so far has been delivered.
	 */
	public void flush() {
		if (Thread.currentThread() == dispatcher) {
			return;
		}
		FlushMessage marker = new FlushMessage(new CountDownLatch(1));
		queue.add(marker);
		try {
			if (!marker.latch().await(30, TimeUnit.SECONDS)) {
				logger.warn("Timed out waiting for event listeners to catch up");
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	private void dispatchLoop() {
		while (true) {
			Message message;
			try {
				message = queue.take();
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return;
			}
			if (message instanceof StopMessage) {
				return;
			}
			deliver(message);
		}
	}

	private void deliver(Message message) {
		if (message instanceof FlushMessage flush) {
			flush.latch().countDown();
			return;
		}
		for (PipelineEventListener listener : listeners) {
			try {
				if (message instanceof EventMessage event) {
					listener.onEvent(event.event());
				}
				else if (message instanceof ProgressMessage progress) {
					listener.onProgress(progress.stage(), progress.done(), progress.total());
				}
			}
			catch (RuntimeException e) {
				logger.error("Event listener {} failed", listener.getClass().getSimpleName(), e);
			}
		}
	}

	@Override
	public void close() {
		if (closed) {
			return;
		}
		closed = true;
		queue.add(new StopMessage());
		try {
			dispatcher.join(TimeUnit.SECONDS.toMillis(30));
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	private interface Message {

	}

	private record EventMessage(PipelineEvent event) implements Message {
	}

	private record ProgressMessage(PipelineStage stage, int done, int total) implements Message {
	}

	private record FlushMessage(CountDownLatch latch) implements Message {
	}

	private record StopMessage() implements Message {
	}

}
