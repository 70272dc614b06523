package org.biosignal.archiver.common;

import java.util.Collections;
import java.util.LinkedList;
import java.util.List;

/**
 * The declared size or boundaries of an upload batch do not match its payload.
 * Carries every problem found so that the device side can fix all of them in one go.
 */
public class BatchIntegrityException extends ArchiverException {
	private static final long serialVersionUID = 1936032485917311247L;
	private final List<String> errors;

	public BatchIntegrityException(List<String> errors) {
		super(ResultCode.BATCH_INTEGRITY_ERROR, "Batch data validation failed: " + String.join("; ", errors));
		this.errors = Collections.unmodifiableList(new LinkedList<String>(errors));
	}

	public List<String> getErrors() {
		return errors;
	}
}
