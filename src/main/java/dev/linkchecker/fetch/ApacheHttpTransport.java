package dev.linkchecker.fetch;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.client5.http.protocol.HttpClientContext;
import org.apache.hc.client5.http.protocol.RedirectLocations;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.io.CloseMode;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link HttpTransport} backed by Apache HttpClient 5. The connection pool is created on first use
 * and shared by all requests until {@link #close()}.
 *
 * <p>Besides the per-phase timeouts every exchange has a total deadline of {@code maxWait}: a
 * request still running when it passes is aborted and fails with a {@link SocketTimeoutException}.
 */
public class ApacheHttpTransport implements HttpTransport {
	private static final Logger logger = LoggerFactory.getLogger(ApacheHttpTransport.class);

	private final int maxConnections;
	private final Duration maxWait;
	private final Timeout timeout;
	private CloseableHttpClient httpClient;
	private ScheduledExecutorService deadlines;

	public ApacheHttpTransport(int maxConnections, Duration maxWait) {
		this.maxConnections = Math.max(1, maxConnections);
		this.maxWait = maxWait;
		this.timeout = Timeout.of(maxWait);
	}

	private synchronized CloseableHttpClient client() {
		if (httpClient == null) {
			PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
					.setMaxConnTotal(maxConnections)
					.setMaxConnPerRoute(maxConnections)
					.setDefaultConnectionConfig(ConnectionConfig.custom()
							.setConnectTimeout(timeout)
							.setSocketTimeout(timeout)
							.build())
					.build();
			httpClient = HttpClients.custom()
					.setConnectionManager(connectionManager)
					.setDefaultRequestConfig(RequestConfig.custom()
							.setConnectionRequestTimeout(timeout)
							.setResponseTimeout(timeout)
							.build())
					.disableAutomaticRetries()
					.disableCookieManagement()
					.build();
			deadlines = Executors.newSingleThreadScheduledExecutor(runnable -> {
				Thread thread = new Thread(runnable, "RequestDeadlines");
				thread.setDaemon(true);
				return thread;
			});
			logger.debug("Opened connection pool ({} connections)", maxConnections);
		}
		return httpClient;
	}

	@Override
	public TransportResponse send(String method, URI uri, Map<String, String> headers) throws IOException {
		HttpUriRequestBase request = new HttpUriRequestBase(method, uri);
		headers.forEach(request::setHeader);
		HttpClientContext context = HttpClientContext.create();

		CloseableHttpClient client;
		ScheduledFuture<?> deadline;
		AtomicBoolean expired = new AtomicBoolean();
		synchronized (this) {
			client = client();
			deadline = deadlines.schedule(
					() -> {
						expired.set(true);
						request.cancel();
					},
					maxWait.toMillis(),
					TimeUnit.MILLISECONDS);
		}

		TransportResponse result;
		try {
			result = client.execute(request, context, response -> {
				String body = "";
				HttpEntity entity = response.getEntity();
				if (entity != null) {
					body = EntityUtils.toString(entity, StandardCharsets.UTF_8);
				}
				Header retryAfter = response.getFirstHeader(HttpHeaders.RETRY_AFTER);
				return new TransportResponse(
						finalUrl(uri, context), response.getCode(), body, retryAfter != null ? retryAfter.getValue() : null);
			});
		} catch (IOException e) {
			throw expired.get() ? exceededMaxWait(uri, e) : e;
		} catch (RuntimeException e) {
			if (expired.get()) {
				throw exceededMaxWait(uri, e);
			}
			throw new IOException("Failed to send HTTP " + method + " request to " + uri + ": " + e.getMessage(), e);
		} finally {
			deadline.cancel(false);
		}
		if (expired.get()) {
			throw exceededMaxWait(uri, null);
		}
		return result;
	}

	private SocketTimeoutException exceededMaxWait(URI uri, Throwable cause) {
		SocketTimeoutException timeout =
				new SocketTimeoutException("Request to " + uri + " exceeded " + maxWait.toMillis() + " ms");
		if (cause != null) {
			timeout.initCause(cause);
		}
		return timeout;
	}

	private static String finalUrl(URI requested, HttpClientContext context) {
		RedirectLocations redirects = context.getRedirectLocations();
		if (redirects == null || redirects.size() == 0) {
			return requested.toString();
		}
		return redirects.get(redirects.size() - 1).toString();
	}

	@Override
	public synchronized void close() {
		if (httpClient != null) {
			httpClient.close(CloseMode.GRACEFUL);
			httpClient = null;
			deadlines.shutdownNow();
			deadlines = null;
			logger.debug("Closed connection pool");
		}
	}
}
