package dev.linkchecker.source;

import dev.linkchecker.model.CollectionDescriptor;
import dev.linkchecker.model.ResourceRecord;
import java.io.Closeable;
import java.util.Iterator;
import java.util.List;

/** Upstream listing of the collections an institution holds and the resources in them */
public interface CollectionSource extends Closeable {

	/**
	 * Probe the source with a minimal request.
	 *
	 * @return the HTTP status code of the probe, -1 if there was no response
	 */
	int testConnection();

	/** Lazily iterate over all collections */
	Iterator<CollectionDescriptor> collections();

	/**
	 * List the resources of a collection. A collection whose list cannot be read yields a single
	 * {@link ResourceRecord#empty(String)} placeholder.
	 */
	List<ResourceRecord> resources(CollectionDescriptor collection);

	/** Replace the credential sent to the source */
	void updateApiKey(String apiKey);

	@Override
	void close();
}
