package com.silverlakesymmetri.cbs.fileConverter.source;

/**
 * Read access to a datastore holding the records of a resource.
 */
public interface DatastoreClient {

	ResourceMetadata showResource(String resourceId);

	/**
	 * Returns up to {@code limit} records starting at {@code offset}. An empty page marks the end.
	 */
	DatastorePage search(String resourceId, int limit, int offset);
}
