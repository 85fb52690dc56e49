package dev.linkchecker.util;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileUtilsTest {

	@TempDir
	Path tempDir;

	@Test
	void testEnsureFileCreatesParents() throws IOException {
		Path file = tempDir.resolve("a/b/store.csv");

		assertThat(FileUtils.ensureFile(file)).isTrue();
		assertThat(file).exists();
		assertThat(FileUtils.ensureFile(file)).isFalse();
	}

	@Test
	void testGetFileSize() throws IOException {
		Path file = tempDir.resolve("store.csv");

		assertThat(FileUtils.getFileSize(file)).isZero();
		Files.writeString(file, "abc");
		assertThat(FileUtils.getFileSize(file)).isEqualTo(3);
	}
}
