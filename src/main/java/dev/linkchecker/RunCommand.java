package dev.linkchecker;

import dev.linkchecker.fetch.FetcherConfig;
import dev.linkchecker.fetch.PoliteFetcher;
import dev.linkchecker.model.CheckedResource;
import dev.linkchecker.model.CollectionJudgement;
import dev.linkchecker.model.ResourceRecord;
import dev.linkchecker.pipeline.AnalysisReport;
import dev.linkchecker.pipeline.LinkCheckPipeline;
import dev.linkchecker.pipeline.LinkCheckerSettings;
import dev.linkchecker.pipeline.PipelineState;
import dev.linkchecker.reporting.ProgressReporter;
import dev.linkchecker.source.KnowledgeBaseClient;
import dev.linkchecker.store.RecordStore;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/** Run command: discover, check and analyze the resources of all collections */
@Command(
		name = "run",
		description = "Find the online resources of all collections, check their links and report broken collections",
		mixinStandardHelpOptions = true)
public class RunCommand implements Callable<Integer> {

	@Spec
	CommandSpec spec;

	@Option(
			names = {"-k", "--wskey"},
			description = "WSKey for the OCLC WorldCat Knowledge Base API (default: $WSKEY)",
			defaultValue = "${env:WSKEY}")
	private String apiKey;

	@Option(
			names = {"-a", "--user-agent"},
			description = "User-Agent sent with every link check (default: " + FetcherConfig.DEFAULT_USER_AGENT + ")")
	private String userAgent;

	@Option(
			names = {"-i", "--ignore"},
			description = "Comma-separated list of domains that are never contacted",
			split = ",")
	private List<String> ignorelist;

	@Option(
			names = {"-f", "--failure-threshold"},
			description = "Share of broken links (0.0 - 1.0) at which a collection is reported (default: 0.5)",
			defaultValue = "0.5")
	private double failureThreshold;

	@Option(
			names = {"-d", "--data-dir"},
			description = "Directory of the resource and result stores (default: data)",
			defaultValue = "data")
	private Path dataDir;

	@Option(
			names = {"-t", "--threads"},
			description = "Number of worker threads (default: 20)",
			defaultValue = "20")
	private int threads;

	@Option(
			names = {"-r", "--requests"},
			description = "Maximum number of link checks in flight at once (default: 5)",
			defaultValue = "5")
	private int maxRequests;

	@Option(
			names = {"--retries"},
			description = "Retries per link after the first attempt (default: 2)",
			defaultValue = "2")
	private int maxRetries;

	@Option(
			names = {"--domains-only"},
			description = "Only check the robots.txt and ignorelist policies of each link's domain")
	private boolean domainsOnly;

	@Option(
			names = {"--resume"},
			description = "Skip discovery and check the resources found by the previous run")
	private boolean resume;

	@Override
	public Integer call() {
		LinkCheckerSettings settings;
		try {
			settings = new LinkCheckerSettings(apiKey, userAgent, ignorelist, failureThreshold);
		} catch (IllegalArgumentException e) {
			throw new ParameterException(spec.commandLine(), e.getMessage(), e);
		}
		if (!resume && !settings.hasApiKey()) {
			throw new ParameterException(spec.commandLine(), "No WSKey was found.");
		}

		System.out.println("Collection Link Checker");
		System.out.println("=======================");
		System.out.println("Data directory: " + dataDir.toAbsolutePath());
		System.out.println("Failure threshold: " + settings.failureThreshold());
		System.out.println("Ignored domains: " + (settings.ignorelist().isEmpty() ? "none" : settings.ignorelist()));
		System.out.println("Mode: " + (domainsOnly ? "domains only" : "full scan"));
		System.out.println();

		FetcherConfig fetcherConfig = FetcherConfig.defaults()
				.withMaxRequests(maxRequests)
				.withMaxRetries(maxRetries);
		try (var reporter = new ProgressReporter();
				var fetcher = new PoliteFetcher(fetcherConfig);
				var source = new KnowledgeBaseClient(settings.apiKey())) {
			reporter.start();

			var pipeline = new LinkCheckPipeline(
					source,
					fetcher,
					new RecordStore<>(dataDir.resolve(Main.RESOURCE_STORE), ResourceRecord.class),
					new RecordStore<>(dataDir.resolve(Main.RESULT_STORE), CheckedResource.class),
					threads,
					settings.failureThreshold());
			pipeline.updateSettings(settings);
			pipeline.setDomainsOnly(domainsOnly);

			long startTime = System.currentTimeMillis();
			AnalysisReport report = resume ? pipeline.resume(reporter) : pipeline.run(reporter, false);
			reporter.close();

			if (pipeline.state() == PipelineState.FAILED) {
				System.err.println("Run failed: " + String.join("; ", reporter.getFailures()));
				return 1;
			}
			printSummary(report, (System.currentTimeMillis() - startTime) / 1000.0);
			return report.brokenCount() > 0 ? 1 : 0;
		}
	}

	static void printSummary(AnalysisReport report, double seconds) {
		System.out.println();
		System.out.println("Summary");
		System.out.println("=======");
		for (CollectionJudgement judgement : report.brokenCollections()) {
			System.out.println(judgement);
		}
		System.out.println(report);
		if (seconds >= 0) {
			System.out.println("Completed in " + seconds + " seconds");
		}
	}
}
