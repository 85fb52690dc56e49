package dev.linkchecker.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A resource annotated with the status code its link returned. A status code of -1 means no
 * usable response was obtained.
 */
@JsonPropertyOrder({"collection_id", "resource_id", "title", "link", "status_code"})
public record CheckedResource(
		@JsonProperty("collection_id") String collectionId,
		@JsonProperty("resource_id") String resourceId,
		@JsonProperty("title") String title,
		@JsonProperty("link") String link,
		@JsonProperty("status_code") int statusCode) {

	public static CheckedResource of(ResourceRecord resource, int statusCode) {
		return new CheckedResource(
				resource.collectionId(), resource.resourceId(), resource.title(), resource.link(), statusCode);
	}

	@JsonIgnore
	public boolean isAvailable() {
		return statusCode == 200;
	}
}
