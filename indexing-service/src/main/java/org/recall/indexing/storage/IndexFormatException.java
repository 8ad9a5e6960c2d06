package org.recall.indexing.storage;

import java.io.IOException;

/**
 * Thrown when a persisted index is not valid JSON or does not match the expected structure.
 */
public class IndexFormatException extends IOException {
	public IndexFormatException(String message) {
		super(message);
	}

	public IndexFormatException(String message, Throwable cause) {
		super(message, cause);
	}
}
