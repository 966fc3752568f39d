package com.silverlakesymmetri.cbs.fileConverter.source;

import com.silverlakesymmetri.cbs.fileConverter.dto.DynamicRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.item.ItemReader;

import java.util.Iterator;
import java.util.Map;

/**
 * Presents the paged datastore search as a single stream of records. Pages are requested with a
 * fixed size and increasing offset until one comes back empty.
 */
public class DatastoreRecordReader implements ItemReader<DynamicRecord> {
	private static final Logger logger = LoggerFactory.getLogger(DatastoreRecordReader.class);

	private final DatastoreClient client;
	private final String resourceId;
	private final int pageSize;

	private Iterator<Map<String, Object>> currentPage;
	private int pageIndex;
	private boolean exhausted;

	public DatastoreRecordReader(DatastoreClient client, String resourceId, int pageSize) {
		if (pageSize < 1) {
			throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
		}
		this.client = client;
		this.resourceId = resourceId;
		this.pageSize = pageSize;
	}

	@Override
	public DynamicRecord read() {
		while (!exhausted) {
			if (currentPage != null && currentPage.hasNext()) {
				return DynamicRecord.fromMap(currentPage.next());
			}
			fetchNextPage();
		}
		return null;
	}

	private void fetchNextPage() {
		int offset = pageIndex * pageSize;
		DatastorePage page = client.search(resourceId, pageSize, offset);
		if (page.isEmpty()) {
			logger.debug("Datastore {} exhausted after {} pages", resourceId, pageIndex);
			exhausted = true;
			currentPage = null;
			return;
		}
		logger.debug("Fetched {} records from {} at offset {}", page.getRecords().size(), resourceId, offset);
		currentPage = page.getRecords().iterator();
		pageIndex++;
	}
}
