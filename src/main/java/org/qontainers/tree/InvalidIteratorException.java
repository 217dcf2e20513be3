package org.qontainers.tree;

/**
 * Thrown when an operation is given a {@link TreeIterator} that cannot be used for it: an iterator whose element has been erased, an
 * iterator belonging to a different tree, or an end iterator where an element is required
 */
public class InvalidIteratorException extends IllegalArgumentException {
	/** @param message The message for the exception */
	public InvalidIteratorException(String message) {
		super(message);
	}
}
