package dev.linkchecker.fetch;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.util.Map;

/** Performs single HTTP exchanges for a {@link PoliteFetcher} */
public interface HttpTransport extends Closeable {

	/**
	 * Send one request, following redirects.
	 *
	 * @param method {@code GET} or {@code HEAD}
	 * @throws IOException on connection failures and timeouts
	 */
	TransportResponse send(String method, URI uri, Map<String, String> headers) throws IOException;

	/** Release pooled connections. The transport may be used again afterwards. */
	@Override
	void close();
}
