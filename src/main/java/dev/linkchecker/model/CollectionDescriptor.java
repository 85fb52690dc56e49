package dev.linkchecker.model;

/** A knowledge base collection and the link to its resource list */
public record CollectionDescriptor(String id, String title, String downloadLink) {

	public CollectionDescriptor {
		id = id == null ? "" : id;
		title = title == null ? "" : title.strip();
		downloadLink = downloadLink == null ? "" : downloadLink.trim();
	}

	public boolean isEmpty() {
		return downloadLink.isEmpty();
	}
}
