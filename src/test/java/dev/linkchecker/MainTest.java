package dev.linkchecker;

import static org.assertj.core.api.Assertions.*;

import dev.linkchecker.model.CheckedResource;
import dev.linkchecker.store.RecordStore;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class MainTest {

	@TempDir
	Path tempDir;

	private final StringWriter err = new StringWriter();

	private int execute(String... args) {
		CommandLine commandLine = new CommandLine(new Main());
		commandLine.setErr(new PrintWriter(err));
		return commandLine.execute(args);
	}

	private void storeResults(CheckedResource... results) {
		RecordStore<CheckedResource> store = new RecordStore<>(tempDir.resolve(Main.RESULT_STORE), CheckedResource.class);
		store.prepare(false);
		for (CheckedResource result : results) {
			store.append(result);
		}
	}

	@Test
	void testAnalyzeReportsBrokenCollections() {
		// Given
		storeResults(
				new CheckedResource("C1", "r1", "Good", "https://good-site.org/a", 200),
				new CheckedResource("C1", "r2", "Bad", "https://bad-site.org/b", 404));

		// When
		int exitCode = execute("analyze", "-d", tempDir.toString(), "-f", "0.5");

		// Then
		assertThat(exitCode).isEqualTo(1);
	}

	@Test
	void testAnalyzeHealthyCollections() {
		// Given
		storeResults(
				new CheckedResource("C1", "r1", "Good", "https://good-site.org/a", 200),
				new CheckedResource("C1", "r2", "Bad", "https://bad-site.org/b", 404));

		// When
		int exitCode = execute("analyze", "-d", tempDir.toString(), "-f", "0.75");

		// Then
		assertThat(exitCode).isZero();
	}

	@Test
	void testAnalyzeWithoutResults() {
		assertThat(execute("analyze", "-d", tempDir.resolve("missing").toString())).isEqualTo(1);
	}

	@Test
	void testInvalidThresholdIsUsageError() {
		// When
		int exitCode = execute("run", "-k", "key", "-f", "1.5", "-d", tempDir.toString());

		// Then
		assertThat(exitCode).isEqualTo(2);
		assertThat(err.toString()).contains("Failure threshold must be between 0.0 and 1.0.");
	}

	@Test
	void testInvalidIgnorelistIsUsageError() {
		// When
		int exitCode = execute("run", "-k", "key", "-i", "site.org,localhost", "-d", tempDir.toString());

		// Then
		assertThat(exitCode).isEqualTo(2);
		assertThat(err.toString()).contains("Invalid domain in ignorelist: localhost");
	}
}
