package dev.linkchecker.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Utility class for file operations */
public class FileUtils {

	/** Ensure a directory exists, creating it if necessary */
	public static void ensureDirectory(Path directory) throws IOException {
		if (directory != null && !Files.exists(directory)) {
			Files.createDirectories(directory);
		}
	}

	/** Get the size of a file in bytes, 0 if it does not exist */
	public static long getFileSize(Path file) throws IOException {
		return Files.exists(file) ? Files.size(file) : 0L;
	}

	/** Create an empty file (and its parent directories) unless it already exists */
	public static boolean ensureFile(Path file) throws IOException {
		if (Files.isRegularFile(file)) {
			return false;
		}
		ensureDirectory(file.toAbsolutePath().getParent());
		Files.createFile(file);
		return true;
	}
}
