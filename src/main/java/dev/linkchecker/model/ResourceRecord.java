package dev.linkchecker.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** An online resource listed in a collection, as found during discovery */
@JsonPropertyOrder({"collection_id", "resource_id", "title", "link"})
public record ResourceRecord(
		@JsonProperty("collection_id") String collectionId,
		@JsonProperty("resource_id") String resourceId,
		@JsonProperty("title") String title,
		@JsonProperty("link") String link) {

	public ResourceRecord {
		collectionId = collectionId == null ? "" : collectionId;
		resourceId = resourceId == null ? "" : resourceId;
		title = title == null ? "" : title;
		link = link == null ? "" : link.trim();
	}

	/** Placeholder for a collection whose resource list could not be read */
	public static ResourceRecord empty(String collectionId) {
		return new ResourceRecord(collectionId, "", "", "");
	}

	/** True if the resource has no link to check */
	@JsonIgnore
	public boolean isEmpty() {
		return link.isEmpty();
	}
}
