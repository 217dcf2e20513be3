package org.qontainers.tree;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * A contiguous run of elements in a {@link RedBlackTree}, from a lower position (inclusive) to an upper position (exclusive). The range is
 * empty when the two positions are equal.
 *
 * @param <E> The type of values in the tree
 */
public final class TreeRange<E> implements Iterable<E> {
	private final TreeIterator<E> theLower;
	private final TreeIterator<E> theUpper;

	TreeRange(TreeIterator<E> lower, TreeIterator<E> upper) {
		theLower = lower;
		theUpper = upper;
	}

	/** @return The first position in the range */
	public TreeIterator<E> getLower() {
		return theLower;
	}

	/** @return The position just after the last position in the range */
	public TreeIterator<E> getUpper() {
		return theUpper;
	}

	/** @return Whether this range contains no elements */
	public boolean isEmpty() {
		return theLower.equals(theUpper);
	}

	@Override
	public Iterator<E> iterator() {
		return new Iterator<E>() {
			private TreeIterator<E> theCursor = theLower;

			@Override
			public boolean hasNext() {
				return !theCursor.equals(theUpper);
			}

			@Override
			public E next() {
				if (!hasNext())
					throw new NoSuchElementException();
				E value = theCursor.get();
				theCursor = theCursor.next();
				return value;
			}
		};
	}

	@Override
	public String toString() {
		return "[" + theLower + ", " + theUpper + ")";
	}
}
