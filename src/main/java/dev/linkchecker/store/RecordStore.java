package dev.linkchecker.store;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import dev.linkchecker.util.FileUtils;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only CSV file of records of one type. The header is derived from the record type's
 * property order and written with the first record. Appends are serialized and forced to disk, so
 * a row is either written completely or not at all.
 *
 * <p>Storage failures are logged and never thrown: appends report {@code false}, reads yield no
 * records.
 */
public class RecordStore<T> {
	private static final Logger logger = LoggerFactory.getLogger(RecordStore.class);

	private final Path path;
	private final Class<T> type;
	private final CsvSchema schema;
	private final ObjectWriter headerWriter;
	private final ObjectWriter rowWriter;
	private final ObjectReader reader;
	private final ReentrantLock lock = new ReentrantLock();

	public RecordStore(Path path, Class<T> type) {
		this.path = path;
		this.type = type;
		CsvMapper mapper = new CsvMapper();
		this.schema = mapper.schemaFor(type).withLineSeparator("\n");
		this.headerWriter = mapper.writerFor(type).with(schema.withHeader());
		this.rowWriter = mapper.writerFor(type).with(schema.withoutHeader());
		this.reader = mapper.readerFor(type).with(schema.withHeader());
	}

	public Path getPath() {
		return path;
	}

	/** Column names, in the order they are written */
	public List<String> getColumns() {
		List<String> columns = new ArrayList<>();
		schema.forEach(column -> columns.add(column.getName()));
		return columns;
	}

	/**
	 * Get the store file ready for a run.
	 *
	 * @param retain keep records from a previous run instead of starting empty
	 */
	public void prepare(boolean retain) {
		lock.lock();
		try {
			if (Files.isRegularFile(path)) {
				if (retain) {
					logger.info("Found existing store file at \"{}\"", path);
					return;
				}
				Files.delete(path);
				FileUtils.ensureFile(path);
				logger.info("Refreshed store file at \"{}\"", path);
			} else if (FileUtils.ensureFile(path)) {
				logger.info("Created store file at \"{}\"", path);
			}
		} catch (AccessDeniedException e) {
			logger.error("Failed to create store at \"{}\" - Permission denied", path);
		} catch (IOException e) {
			logger.error("Failed to create store at \"{}\"", path, e);
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Durably append one record.
	 *
	 * @return true if the record was written
	 */
	public boolean append(T record) {
		lock.lock();
		try {
			boolean firstRecord = FileUtils.getFileSize(path) == 0;
			String row = (firstRecord ? headerWriter : rowWriter).writeValueAsString(record);
			ByteBuffer bytes = StandardCharsets.UTF_8.encode(row);
			try (FileChannel channel = FileChannel.open(
					path, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
				while (bytes.hasRemaining()) {
					channel.write(bytes);
				}
				channel.force(false);
			}
			return true;
		} catch (NoSuchFileException e) {
			logger.error("Failed to store record at \"{}\" - No store file found", path);
		} catch (AccessDeniedException e) {
			logger.error("Failed to store record at \"{}\" - Permission denied", path);
		} catch (IOException e) {
			logger.error("Failed to store record at \"{}\"", path, e);
		} finally {
			lock.unlock();
		}
		return false;
	}

	/**
	 * Read the records back. Only rows that were completely written when this method was called
	 * are read. The stream holds the store file open and should be closed.
	 *
	 * @param randomize shuffle the records instead of returning them in append order
	 */
	public Stream<T> stream(boolean randomize) {
		long extent;
		lock.lock();
		try {
			extent = Files.size(path);
		} catch (NoSuchFileException e) {
			logger.error("Failed to read store at \"{}\" - No store file found", path);
			return Stream.empty();
		} catch (IOException e) {
			logger.error("Failed to read store at \"{}\" - {}", path, e.toString());
			return Stream.empty();
		} finally {
			lock.unlock();
		}
		if (extent == 0) {
			return Stream.empty();
		}

		Stream<T> records;
		InputStream input = null;
		try {
			input = new ExtentInputStream(Files.newInputStream(path), extent);
			MappingIterator<T> rows = reader.readValues(new InputStreamReader(input, StandardCharsets.UTF_8));
			records = StreamSupport.stream(
							Spliterators.spliteratorUnknownSize(new SafeIterator<>(rows, path), Spliterator.ORDERED),
							false)
					.onClose(() -> closeQuietly(rows));
		} catch (IOException | RuntimeException e) {
			logger.error("Failed to read store at \"{}\" - {}", path, e.toString());
			closeQuietly(input);
			return Stream.empty();
		}
		if (!randomize) {
			return records;
		}

		List<T> all;
		try (records) {
			all = records.collect(Collectors.toCollection(ArrayList::new));
		}
		Collections.shuffle(all);
		return all.stream();
	}

	/** Number of records in the store; 0 if it is empty, missing or unreadable */
	public int count() {
		try (Stream<T> records = stream(false)) {
			return (int) records.count();
		}
	}

	private void closeQuietly(MappingIterator<T> rows) {
		try {
			rows.close();
		} catch (IOException e) {
			logger.debug("Failed to close store reader for \"{}\"", path, e);
		}
	}

	private void closeQuietly(InputStream input) {
		if (input == null) {
			return;
		}
		try {
			input.close();
		} catch (IOException e) {
			logger.debug("Failed to close store file \"{}\"", path, e);
		}
	}

	@Override
	public String toString() {
		return "RecordStore[" + type.getSimpleName() + " @ " + path + "]";
	}

	/** Ends iteration at the first row that cannot be read */
	private static final class SafeIterator<T> implements Iterator<T> {
		private final MappingIterator<T> rows;
		private final Path path;
		private T next;
		private boolean done;

		SafeIterator(MappingIterator<T> rows, Path path) {
			this.rows = rows;
			this.path = path;
		}

		@Override
		public boolean hasNext() {
			if (next != null) {
				return true;
			}
			if (done) {
				return false;
			}
			try {
				if (rows.hasNextValue()) {
					next = rows.nextValue();
				}
			} catch (IOException | RuntimeException e) {
				logger.error("Failed to read store at \"{}\" - {}", path, e.toString());
			}
			done = next == null;
			return !done;
		}

		@Override
		public T next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			T value = next;
			next = null;
			return value;
		}
	}

	/** Reads a file up to a fixed number of bytes */
	private static final class ExtentInputStream extends FilterInputStream {
		private long remaining;

		ExtentInputStream(InputStream in, long extent) {
			super(in);
			this.remaining = extent;
		}

		@Override
		public int read() throws IOException {
			if (remaining <= 0) {
				return -1;
			}
			int b = super.read();
			if (b >= 0) {
				remaining--;
			}
			return b;
		}

		@Override
		public int read(byte[] buffer, int offset, int length) throws IOException {
			if (remaining <= 0) {
				return -1;
			}
			int n = super.read(buffer, offset, (int) Math.min(length, remaining));
			if (n > 0) {
				remaining -= n;
			}
			return n;
		}

		@Override
		public long skip(long n) throws IOException {
			long skipped = super.skip(Math.min(n, remaining));
			remaining -= skipped;
			return skipped;
		}

		@Override
		public int available() throws IOException {
			return (int) Math.min(super.available(), remaining);
		}
	}
}
