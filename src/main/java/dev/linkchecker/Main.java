package dev.linkchecker;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/** Main application class with CLI support */
@Command(
		name = "link-checker",
		version = "1.0.0",
		description = "Checks the online resources of knowledge base collections for broken links",
		mixinStandardHelpOptions = true,
		subcommands = {RunCommand.class, AnalyzeCommand.class})
public class Main implements Callable<Integer> {
	static final String RESOURCE_STORE = "resources.csv";
	static final String RESULT_STORE = "results.csv";

	@Spec
	CommandSpec spec;

	@Override
	public Integer call() {
		spec.commandLine().usage(System.out);
		return 0;
	}

	public static void main(String[] args) {
		int exitCode = new CommandLine(new Main()).execute(args);
		System.exit(exitCode);
	}
}
