package dev.linkchecker.reporting;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reporting thread that receives progress events from the pipeline and logs them in order, so
 * stage workers never block on output. Keeps track of the stages currently running and of the
 * failures reported.
 */
public class ProgressReporter implements ProgressListener, Runnable, AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(ProgressReporter.class);
	private static final ProgressEvent POISON_PILL = ProgressEvent.progress(ProgressEvent.Stage.DISCOVER, "");

	private final BlockingQueue<ProgressEvent> eventQueue;
	private final Set<ProgressEvent.Stage> runningStages;
	private final List<String> failures;
	private final AtomicBoolean running;
	private Thread reporterThread;

	public ProgressReporter() {
		this.eventQueue = new LinkedBlockingQueue<>();
		this.runningStages = ConcurrentHashMap.newKeySet();
		this.failures = new CopyOnWriteArrayList<>();
		this.running = new AtomicBoolean(false);
	}

	/** Start the reporter thread */
	public void start() {
		if (running.compareAndSet(false, true)) {
			reporterThread = new Thread(this, "ProgressReporter");
			reporterThread.setDaemon(false);
			reporterThread.start();
		}
	}

	/** Submit a progress event to be processed */
	@Override
	public void report(ProgressEvent event) {
		try {
			eventQueue.put(event);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.error("Interrupted while submitting event", e);
		}
	}

	@Override
	public void run() {
		while (running.get() || !eventQueue.isEmpty()) {
			try {
				ProgressEvent event = eventQueue.take();
				if (event == POISON_PILL) {
					break;
				}
				processEvent(event);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.warn("Reporter thread interrupted");
				break;
			} catch (Exception e) {
				logger.error("Error processing event", e);
			}
		}
	}

	void processEvent(ProgressEvent event) {
		switch (event.eventType()) {
			case STARTED -> {
				runningStages.add(event.stage());
				logger.info("{} | {}", event.stage(), event.message());
			}
			case PROGRESS -> logger.info("{} | {}", event.stage(), event.message());
			case COMPLETED -> {
				runningStages.remove(event.stage());
				logger.info("{} | {}", event.stage(), event.message());
			}
			case FAILED -> {
				runningStages.remove(event.stage());
				failures.add(event.message());
				logger.error("{} FAILED | {}", event.stage(), event.message());
			}
		}
	}

	/** Get a snapshot of the stages that started but have not completed */
	public Set<ProgressEvent.Stage> getRunningStages() {
		return Set.copyOf(runningStages);
	}

	/** Failure messages reported so far */
	public List<String> getFailures() {
		return new ArrayList<>(failures);
	}

	/** Shutdown the reporter and wait for all events to be processed */
	@Override
	public void close() {
		if (running.compareAndSet(true, false)) {
			try {
				eventQueue.put(POISON_PILL);
				if (reporterThread != null) {
					reporterThread.join(5000);
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.error("Interrupted while shutting down reporter", e);
			}
		}
	}
}
