package org.qontainers.tree;

/** Thrown when an insertion or merge would grow a {@link RedBlackTree} beyond its {@link RedBlackTree#maxSize() maximum size} */
public class CapacityExceededException extends IllegalStateException {
	private final int theMaxSize;

	/**
	 * @param message The message for the exception
	 * @param maxSize The maximum size of the tree that rejected the operation
	 */
	public CapacityExceededException(String message, int maxSize) {
		super(message);
		theMaxSize = maxSize;
	}

	/** @return The maximum size of the tree that rejected the operation */
	public int getMaxSize() {
		return theMaxSize;
	}
}
