package dev.linkchecker.pipeline;

import static dev.linkchecker.reporting.ProgressEvent.Stage.ANALYZE;
import static dev.linkchecker.reporting.ProgressEvent.Stage.CHECK;
import static dev.linkchecker.reporting.ProgressEvent.Stage.DISCOVER;

import dev.linkchecker.fetch.PoliteFetcher;
import dev.linkchecker.fetch.Response;
import dev.linkchecker.model.CheckedResource;
import dev.linkchecker.model.CollectionDescriptor;
import dev.linkchecker.model.CollectionJudgement;
import dev.linkchecker.model.ResourceRecord;
import dev.linkchecker.reporting.ProgressEvent;
import dev.linkchecker.reporting.ProgressListener;
import dev.linkchecker.source.CollectionSource;
import dev.linkchecker.store.RecordStore;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a link check in three stages. Discover lists the collections of the upstream source and
 * stores their resources; Check probes every stored resource link and stores the status codes;
 * Analyze reports the collections whose share of broken links reaches the failure threshold.
 *
 * <p>The two record stores hand work from one stage to the next, so a run that was interrupted
 * after discovery can be resumed with {@link #resume(ProgressListener)}.
 */
public class LinkCheckPipeline {
	private static final Logger logger = LoggerFactory.getLogger(LinkCheckPipeline.class);

	static final String INVALID_KEY_MESSAGE = "Failed to retrieve online resources from OCLC: The WSKey was invalid.";
	static final String CONNECTION_MESSAGE = "Failed to retrieve online resources from OCLC: "
			+ "Could not connect to the OCLC WorldCat Knowledge Base API endpoint.";

	private final CollectionSource source;
	private final PoliteFetcher fetcher;
	private final RecordStore<ResourceRecord> resourceStore;
	private final RecordStore<CheckedResource> resultStore;
	private final int workerThreads;
	private volatile double failureThreshold;
	private volatile PipelineState state = PipelineState.IDLE;

	public LinkCheckPipeline(
			CollectionSource source,
			PoliteFetcher fetcher,
			RecordStore<ResourceRecord> resourceStore,
			RecordStore<CheckedResource> resultStore,
			int workerThreads,
			double failureThreshold) {
		this.source = source;
		this.fetcher = fetcher;
		this.resourceStore = resourceStore;
		this.resultStore = resultStore;
		this.workerThreads = Math.max(1, workerThreads);
		this.failureThreshold = failureThreshold;
	}

	public PipelineState state() {
		return state;
	}

	/**
	 * Run all three stages.
	 *
	 * @param retainStores keep the records of a previous run instead of starting with empty stores
	 * @return the analysis, empty if discovery failed
	 */
	public AnalysisReport run(ProgressListener listener, boolean retainStores) {
		state = PipelineState.IDLE;
		resourceStore.prepare(retainStores);
		resultStore.prepare(retainStores);
		fetcher.clearPolicies();
		if (!discover(listener)) {
			return AnalysisReport.empty();
		}
		check(listener);
		return analyze(listener);
	}

	/** Check and analyze the resources stored by an earlier discovery */
	public AnalysisReport resume(ProgressListener listener) {
		state = PipelineState.IDLE;
		resourceStore.prepare(true);
		resultStore.prepare(false);
		fetcher.clearPolicies();
		check(listener);
		return analyze(listener);
	}

	/**
	 * Store the resources of every collection of the source.
	 *
	 * @return false if the source rejected the credentials or could not be reached
	 */
	public boolean discover(ProgressListener listener) {
		state = PipelineState.DISCOVERING;
		listener.report(ProgressEvent.started(DISCOVER, "Searching for resources. Please do not exit..."));
		try {
			int code = source.testConnection();
			if (code != 200) {
				String message = code == 401 || code == 403 ? INVALID_KEY_MESSAGE : CONNECTION_MESSAGE;
				logger.error("Connection test returned status {}", code);
				state = PipelineState.FAILED;
				listener.report(ProgressEvent.failed(DISCOVER, message));
				return false;
			}

			AtomicInteger resourceTotal = new AtomicInteger();
			int collectionTotal = 0;
			ExecutorService executor = Executors.newFixedThreadPool(workerThreads);
			try {
				List<Future<?>> tasks = new ArrayList<>();
				Iterator<CollectionDescriptor> collections = source.collections();
				while (collections.hasNext()) {
					CollectionDescriptor collection = collections.next();
					tasks.add(executor.submit(() -> storeResources(collection, resourceTotal, listener)));
					collectionTotal++;
				}
				awaitAll(tasks);
			} finally {
				executor.shutdown();
			}

			listener.report(ProgressEvent.completed(
					DISCOVER,
					"Search complete. Found %d online resource(s) across %d collection(s)."
							.formatted(resourceTotal.get(), collectionTotal)));
			return true;
		} finally {
			source.close();
		}
	}

	private void storeResources(CollectionDescriptor collection, AtomicInteger resourceTotal, ProgressListener listener) {
		int count = 0;
		for (ResourceRecord resource : source.resources(collection)) {
			if (resource.isEmpty()) {
				continue;
			}
			if (resourceStore.append(resource)) {
				count++;
			}
		}
		resourceTotal.addAndGet(count);
		listener.report(ProgressEvent.progress(
				DISCOVER, "Cached %d online resources for collection %s.".formatted(count, collection.title())));
	}

	private static void awaitAll(List<Future<?>> tasks) {
		for (Future<?> task : tasks) {
			try {
				task.get();
			} catch (ExecutionException e) {
				logger.error("Failed to store the resources of a collection", e.getCause());
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.warn("Interrupted while waiting for discovery to finish");
				return;
			}
		}
	}

	/** Probe every stored resource link, in random order, and store the status codes */
	public void check(ProgressListener listener) {
		state = PipelineState.CHECKING;
		int total = resourceStore.count();
		listener.report(ProgressEvent.started(CHECK, "Identified %d links.".formatted(total)));
		listener.report(ProgressEvent.progress(CHECK, "Checking links. Please do not exit..."));

		AtomicInteger checked = new AtomicInteger();
		int maxPending = workerThreads * 2;
		Semaphore pending = new Semaphore(maxPending);
		ExecutorService executor = Executors.newFixedThreadPool(workerThreads);
		try (Stream<ResourceRecord> resources = resourceStore.stream(true)) {
			Iterator<ResourceRecord> iterator = resources.iterator();
			while (iterator.hasNext()) {
				ResourceRecord resource = iterator.next();
				pending.acquire();
				executor.execute(() -> {
					try {
						checkResource(resource, checked, total, listener);
					} finally {
						pending.release();
					}
				});
			}
			pending.acquire(maxPending);
			pending.release(maxPending);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.warn("Interrupted while checking links, {} of {} checked", checked.get(), total);
		} finally {
			executor.shutdown();
			fetcher.close();
		}

		listener.report(ProgressEvent.completed(CHECK, "Check complete."));
	}

	private void checkResource(ResourceRecord resource, AtomicInteger checked, int total, ProgressListener listener) {
		try {
			Response response = fetcher.head(resource.link());
			resultStore.append(CheckedResource.of(resource, response.statusCode()));
		} catch (RuntimeException e) {
			logger.error("Failed to check link \"{}\"", resource.link(), e);
		}
		int count = checked.incrementAndGet();
		listener.report(ProgressEvent.progress(CHECK, "Checked %d / %d links.".formatted(count, total)));
	}

	/** Compute the broken share of every collection in the result store */
	public AnalysisReport analyze(ProgressListener listener) {
		state = PipelineState.ANALYZING;
		listener.report(ProgressEvent.started(ANALYZE, "Calculating percentages..."));

		Map<String, Tally> tallies = new TreeMap<>();
		try (Stream<CheckedResource> results = resultStore.stream(false)) {
			results.forEach(result -> tallies.computeIfAbsent(result.collectionId(), id -> new Tally())
					.add(result));
		}

		double threshold = failureThreshold;
		List<CollectionJudgement> judgements = new ArrayList<>();
		tallies.forEach((collectionId, tally) -> {
			CollectionJudgement judgement = CollectionJudgement.of(collectionId, tally.broken, tally.total, threshold);
			judgements.add(judgement);
			if (judgement.isBroken()) {
				listener.report(ProgressEvent.progress(ANALYZE, judgement.toString()));
			}
		});

		AnalysisReport report = new AnalysisReport(judgements);
		listener.report(ProgressEvent.completed(
				ANALYZE,
				"Analysis complete. %d collection(s) exceeded the failure threshold.".formatted(report.brokenCount())));
		state = PipelineState.DONE;
		return report;
	}

	/** Swap the user settings without rebuilding the clients or stores */
	public void updateSettings(LinkCheckerSettings settings) {
		source.updateApiKey(settings.apiKey());
		fetcher.updateUserAgent(settings.userAgent());
		fetcher.updateIgnorelist(settings.ignorelist());
		this.failureThreshold = settings.failureThreshold();
	}

	/** Check only the robots and ignorelist policies of each link's domain */
	public void setDomainsOnly(boolean domainsOnly) {
		fetcher.setDomainsOnly(domainsOnly);
	}

	public double getFailureThreshold() {
		return failureThreshold;
	}

	private static final class Tally {
		int broken;
		int total;

		void add(CheckedResource result) {
			total++;
			if (!result.isAvailable()) {
				broken++;
			}
		}
	}
}
