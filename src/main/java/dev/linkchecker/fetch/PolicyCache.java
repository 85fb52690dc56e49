package dev.linkchecker.fetch;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Per-key decision cache. Concurrent first lookups of the same key share a single computation:
 * the first caller computes while the others wait on its pending result. Entries are never
 * replaced until {@link #clear()}.
 */
public class PolicyCache<K, V> {
	private final ReentrantLock lock = new ReentrantLock();
	private final Map<K, CompletableFuture<V>> entries = new HashMap<>();

	/**
	 * Get the value for a key, computing it with the loader if no other caller has started to.
	 * A loader failure is rethrown to every waiting caller and the key is left unset.
	 */
	public V computeIfAbsent(K key, Function<? super K, ? extends V> loader) {
		CompletableFuture<V> pending;
		boolean owner = false;
		lock.lock();
		try {
			pending = entries.get(key);
			if (pending == null) {
				pending = new CompletableFuture<>();
				entries.put(key, pending);
				owner = true;
			}
		} finally {
			lock.unlock();
		}

		if (owner) {
			try {
				pending.complete(loader.apply(key));
			} catch (RuntimeException e) {
				lock.lock();
				try {
					entries.remove(key, pending);
				} finally {
					lock.unlock();
				}
				pending.completeExceptionally(e);
				throw e;
			}
		}
		return pending.join();
	}

	/** Get a completed value without waiting for one in progress */
	public Optional<V> getIfPresent(K key) {
		CompletableFuture<V> entry;
		lock.lock();
		try {
			entry = entries.get(key);
		} finally {
			lock.unlock();
		}
		if (entry == null || !entry.isDone() || entry.isCompletedExceptionally()) {
			return Optional.empty();
		}
		return Optional.ofNullable(entry.join());
	}

	/**
	 * Record a value unless the key already has one.
	 *
	 * @return true if the value was stored
	 */
	public boolean putIfAbsent(K key, V value) {
		lock.lock();
		try {
			if (entries.containsKey(key)) {
				return false;
			}
			entries.put(key, CompletableFuture.completedFuture(value));
			return true;
		} finally {
			lock.unlock();
		}
	}

	public int size() {
		lock.lock();
		try {
			return entries.size();
		} finally {
			lock.unlock();
		}
	}

	public void clear() {
		lock.lock();
		try {
			entries.clear();
		} finally {
			lock.unlock();
		}
	}
}
