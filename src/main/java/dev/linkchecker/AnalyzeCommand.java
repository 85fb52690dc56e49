package dev.linkchecker;

import dev.linkchecker.fetch.FetcherConfig;
import dev.linkchecker.fetch.PoliteFetcher;
import dev.linkchecker.model.CheckedResource;
import dev.linkchecker.model.ResourceRecord;
import dev.linkchecker.pipeline.AnalysisReport;
import dev.linkchecker.pipeline.LinkCheckPipeline;
import dev.linkchecker.pipeline.LinkCheckerSettings;
import dev.linkchecker.reporting.ProgressReporter;
import dev.linkchecker.source.KnowledgeBaseClient;
import dev.linkchecker.store.RecordStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/** Analyze command: report broken collections from the results of an earlier run */
@Command(
		name = "analyze",
		description = "Report the collections whose share of broken links in the stored results reaches the threshold",
		mixinStandardHelpOptions = true)
public class AnalyzeCommand implements Callable<Integer> {

	@Spec
	CommandSpec spec;

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

	@Override
	public Integer call() {
		LinkCheckerSettings settings;
		try {
			settings = new LinkCheckerSettings("", null, List.of(), failureThreshold);
		} catch (IllegalArgumentException e) {
			throw new ParameterException(spec.commandLine(), e.getMessage(), e);
		}
		Path results = dataDir.resolve(Main.RESULT_STORE);
		if (!Files.isRegularFile(results)) {
			System.err.println("No results found at " + results.toAbsolutePath());
			return 1;
		}

		try (var reporter = new ProgressReporter();
				var fetcher = new PoliteFetcher(FetcherConfig.defaults());
				var source = new KnowledgeBaseClient(settings.apiKey())) {
			reporter.start();
			var pipeline = new LinkCheckPipeline(
					source,
					fetcher,
					new RecordStore<>(dataDir.resolve(Main.RESOURCE_STORE), ResourceRecord.class),
					new RecordStore<>(results, CheckedResource.class),
					1,
					settings.failureThreshold());
			AnalysisReport report = pipeline.analyze(reporter);
			reporter.close();
			RunCommand.printSummary(report, -1);
			return report.brokenCount() > 0 ? 1 : 0;
		}
	}
}
