package dev.linkchecker.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import dev.linkchecker.fetch.FetcherConfig;
import dev.linkchecker.fetch.PoliteFetcher;
import dev.linkchecker.fetch.Response;
import dev.linkchecker.model.CollectionDescriptor;
import dev.linkchecker.model.ResourceRecord;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for the OCLC WorldCat Knowledge Base collections API. Collections are searched page by
 * page; the resources of a collection come from its KBART file, a tab separated title list.
 */
public class KnowledgeBaseClient implements CollectionSource {
	private static final Logger logger = LoggerFactory.getLogger(KnowledgeBaseClient.class);

	public static final String DEFAULT_ENDPOINT = "https://worldcat.org/webservices/kb/rest/collections/search";
	static final String API_KEY_HEADER = "wskey";
	static final int PAGE_SIZE = 50;

	static final String KBART_ID = "oclc_number";
	static final String KBART_TITLE = "publication_title";
	static final String KBART_URL = "title_url";

	private final PoliteFetcher fetcher;
	private final String endpoint;
	private final ObjectMapper objectMapper = new ObjectMapper();
	private final ObjectReader kbartReader;

	public KnowledgeBaseClient(String apiKey) {
		this(new PoliteFetcher(FetcherConfig.forApi(Map.of(API_KEY_HEADER, apiKey))), DEFAULT_ENDPOINT);
	}

	public KnowledgeBaseClient(PoliteFetcher fetcher, String endpoint) {
		this.fetcher = fetcher;
		this.endpoint = endpoint;
		CsvSchema schema = CsvSchema.emptySchema()
				.withHeader()
				.withColumnSeparator('\t')
				.withoutQuoteChar();
		this.kbartReader = new CsvMapper()
				.readerForMapOf(String.class)
				.with(schema)
				.with(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
				.with(CsvParser.Feature.SKIP_EMPTY_LINES);
	}

	@Override
	public int testConnection() {
		return search(1, 1).statusCode();
	}

	@Override
	public Iterator<CollectionDescriptor> collections() {
		return new PaginatedIterator<>() {
			private int total = 0;

			@Override
			protected List<CollectionDescriptor> fetchPage(int pageNumber) throws Exception {
				Response response = search(startIndex(pageNumber), PAGE_SIZE);
				if (response.statusCode() != 200 && response.statusCode() != 202) {
					throw new UpstreamFormatException("Could not connect to API endpoint at URL \"" + endpoint + "\"");
				}
				JsonNode page = parseJson(response.body());
				total = page.path("os:totalResults").asInt(0);
				List<CollectionDescriptor> collections = new ArrayList<>();
				for (JsonNode entry : page.path("entries")) {
					collections.add(toCollection(entry));
				}
				logger.debug("Fetched {} collections starting at {} of {}", collections.size(), startIndex(pageNumber), total);
				return collections;
			}

			@Override
			protected boolean hasMorePages(int pageNumber) {
				return startIndex(pageNumber) <= total;
			}

			@Override
			protected void handleFetchError(Exception e) {
				logger.error("Failed to retrieve collections from OCLC - {}", e.getMessage());
			}
		};
	}

	private static int startIndex(int pageNumber) {
		return (pageNumber - 1) * PAGE_SIZE + 1;
	}

	private Response search(int startIndex, int itemsPerPage) {
		Response response = fetcher.get(
				endpoint, Map.of("startIndex", String.valueOf(startIndex), "itemsPerPage", String.valueOf(itemsPerPage)));
		switch (response.statusCode()) {
			case 200, 202 -> {}
			case 401, 403 -> logger.error(
					"Failed to connect to OCLC WorldCat Knowledge Base - User provided invalid or expired WSKey");
			case 405 -> logger.error(
					"Failed to connect to OCLC WorldCat Knowledge Base - Service does not support HTTP GET requests");
			default -> logger.error(
					"Failed to connect to OCLC WorldCat Knowledge Base - Could not connect to API endpoint at URL \"{}\"",
					endpoint);
		}
		return response;
	}

	private JsonNode parseJson(String body) throws UpstreamFormatException {
		JsonNode root;
		try {
			root = objectMapper.readTree(body);
		} catch (JsonProcessingException e) {
			throw new UpstreamFormatException("API did not return a JSON object", e);
		}
		if (root == null || !root.isObject() || !root.path("entries").isArray()) {
			throw new UpstreamFormatException("API did not return a JSON object");
		}
		return root;
	}

	/** Collection id, title and the link of its KBART file (the "enclosure" link) */
	static CollectionDescriptor toCollection(JsonNode entry) {
		String link = "";
		for (JsonNode candidate : entry.path("links")) {
			if ("enclosure".equals(candidate.path("rel").asText())) {
				link = candidate.path("href").asText("");
			}
		}
		return new CollectionDescriptor(
				entry.path("kb:collection_uid").asText(""), entry.path("title").asText(""), link);
	}

	@Override
	public List<ResourceRecord> resources(CollectionDescriptor collection) {
		if (collection.isEmpty()) {
			logger.warn("Failed to find resources for collection {} - No KBART link", collection.id());
			return List.of(ResourceRecord.empty(collection.id()));
		}
		Response response = fetcher.get(collection.downloadLink());
		if (response.isSentinel() || response.statusCode() >= 400) {
			logger.warn("Failed to find resources for collection {} - Could not download KBART from OCLC", collection.id());
			return List.of(ResourceRecord.empty(collection.id()));
		}
		try {
			return parseKbart(collection.id(), response.body());
		} catch (UpstreamFormatException e) {
			logger.warn("Failed to find resources for collection {} - {}", collection.id(), e.getMessage());
			return List.of(ResourceRecord.empty(collection.id()));
		}
	}

	List<ResourceRecord> parseKbart(String collectionId, String body) throws UpstreamFormatException {
		String header = body.lines().findFirst().orElse("");
		if (!Arrays.asList(header.split("\t")).contains(KBART_URL)) {
			throw new UpstreamFormatException("API did not return KBART");
		}
		List<ResourceRecord> resources = new ArrayList<>();
		try (MappingIterator<Map<String, String>> rows = kbartReader.readValues(body)) {
			while (rows.hasNextValue()) {
				Map<String, String> row = rows.nextValue();
				resources.add(new ResourceRecord(
						collectionId, row.get(KBART_ID), row.get(KBART_TITLE), row.get(KBART_URL)));
			}
		} catch (IOException | RuntimeException e) {
			throw new UpstreamFormatException("API returned malformed KBART", e);
		}
		return resources;
	}

	@Override
	public void updateApiKey(String apiKey) {
		if (!apiKey.equals(fetcher.getHeader(API_KEY_HEADER))) {
			fetcher.setHeader(API_KEY_HEADER, apiKey);
			logger.debug("WSKey changed");
		}
	}

	@Override
	public void close() {
		fetcher.close();
	}
}
