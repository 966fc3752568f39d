package com.silverlakesymmetri.cbs.fileConverter.source;

/**
 * The parts of a resource description the converter needs.
 */
public final class ResourceMetadata {

	private final String id;
	private final String name;
	private final Object datastoreActive;

	public ResourceMetadata(String id, String name, Object datastoreActive) {
		this.id = id;
		this.name = name;
		this.datastoreActive = datastoreActive;
	}

	public String getId() {
		return id;
	}

	public String getName() {
		return name;
	}

	public Object getDatastoreActive() {
		return datastoreActive;
	}

	/**
	 * {@code false}, {@code "false"} and {@code "False"} mark a resource without datastore
	 * records; anything else, including a missing flag, is treated as active.
	 */
	public boolean isDatastoreActive() {
		if (datastoreActive == null) {
			return true;
		}
		return !(Boolean.FALSE.equals(datastoreActive)
				|| "false".equals(datastoreActive)
				|| "False".equals(datastoreActive));
	}
}
