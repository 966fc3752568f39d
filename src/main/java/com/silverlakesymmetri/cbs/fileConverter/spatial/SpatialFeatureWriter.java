package com.silverlakesymmetri.cbs.fileConverter.spatial;

import java.io.Closeable;
import java.io.IOException;

/**
 * Writes features of a single layer. {@link #close()} completes the file; a writer that
 * fails part way leaves an incomplete file that the caller discards.
 */
public interface SpatialFeatureWriter extends Closeable {

	void write(Feature feature) throws IOException;

	long getFeatureCount();
}
