package org.qontainers.tree;

import java.util.Objects;

/**
 * The result of an insertion into a {@link RedBlackTree}
 *
 * @param <E> The type of values in the tree
 */
public final class InsertResult<E> {
	private final TreeIterator<E> thePosition;
	private final boolean isInserted;

	InsertResult(TreeIterator<E> position, boolean inserted) {
		thePosition = position;
		isInserted = inserted;
	}

	/** @return The position of the new element, or of the equal element that prevented the insertion */
	public TreeIterator<E> getPosition() {
		return thePosition;
	}

	/** @return Whether a new element was added to the tree */
	public boolean isInserted() {
		return isInserted;
	}

	@Override
	public int hashCode() {
		return Objects.hash(thePosition, isInserted);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof InsertResult))
			return false;
		InsertResult<?> other = (InsertResult<?>) obj;
		return isInserted == other.isInserted && thePosition.equals(other.thePosition);
	}

	@Override
	public String toString() {
		return thePosition + (isInserted ? " (inserted)" : " (present)");
	}
}
