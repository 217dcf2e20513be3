package org.qontainers.tree;

import java.util.NoSuchElementException;

/**
 * <p>
 * A position in a {@link RedBlackTree}: either an element of the tree or the tree's end position, which sits just after its last element.
 * </p>
 *
 * <p>
 * A TreeIterator is immutable. {@link #next()} and {@link #previous()} return new positions rather than moving this one, so a pair of
 * iterators (e.g. a {@link TreeRange}) cannot be disturbed by stepping either of them.
 * </p>
 *
 * <p>
 * An iterator referring to an element follows that element, not the tree: it remains usable while other elements are inserted or erased
 * and when the element is {@link RedBlackTree#merge(RedBlackTree) merged} into another tree. It becomes invalid the moment its own element
 * is erased or its tree is cleared.
 * </p>
 *
 * @param <E> The type of values in the tree
 */
public final class TreeIterator<E> {
	private final RedBlackTree<E> theTree;
	private final RedBlackNode<E> theNode;

	TreeIterator(RedBlackTree<E> tree, RedBlackNode<E> node) {
		theTree = tree;
		theNode = node;
	}

	/** @return The tree that this position is currently in */
	public RedBlackTree<E> getTree() {
		return theNode == null ? theTree : theNode.getTree();
	}

	/** @return The node this iterator refers to, or null if this is an end iterator */
	RedBlackNode<E> getNode() {
		return theNode;
	}

	/** @return Whether this is the end position of its tree */
	public boolean isEnd() {
		return theNode == null;
	}

	/** @return Whether this iterator may still be used, i.e. it is an end position or its element has not been removed */
	public boolean isValid() {
		return theNode == null || theNode.isPresent();
	}

	/**
	 * @return The value at this position
	 * @throws NoSuchElementException If this is an end iterator
	 * @throws InvalidIteratorException If this iterator's element has been removed
	 */
	public E get() {
		return checkElement().getValue();
	}

	/**
	 * @return The position after this one
	 * @throws NoSuchElementException If this is an end iterator
	 * @throws InvalidIteratorException If this iterator's element has been removed
	 */
	public TreeIterator<E> next() {
		RedBlackNode<E> node = checkElement();
		return new TreeIterator<>(node.getTree(), node.getClosest(false));
	}

	/**
	 * @return The position before this one. The position before the end is the last element.
	 * @throws NoSuchElementException If this is the first element or the end of an empty tree
	 * @throws InvalidIteratorException If this iterator's element has been removed
	 */
	public TreeIterator<E> previous() {
		RedBlackNode<E> prev;
		if (theNode == null) {
			prev = theTree.getLastNode();
			if (prev == null)
				throw new NoSuchElementException("No element before the end of an empty tree");
			return new TreeIterator<>(theTree, prev);
		}
		prev = checkElement().getClosest(true);
		if (prev == null)
			throw new NoSuchElementException("No element before the first element");
		return new TreeIterator<>(prev.getTree(), prev);
	}

	private RedBlackNode<E> checkElement() {
		if (theNode == null)
			throw new NoSuchElementException("End iterator has no element");
		if (!theNode.isPresent())
			throw new InvalidIteratorException("Element " + theNode.getValue() + " has been removed");
		return theNode;
	}

	@Override
	public int hashCode() {
		return theNode == null ? System.identityHashCode(theTree) : System.identityHashCode(theNode);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		else if (!(obj instanceof TreeIterator))
			return false;
		TreeIterator<?> other = (TreeIterator<?>) obj;
		if (theNode != null || other.theNode != null)
			return theNode == other.theNode;
		return theTree == other.theTree;
	}

	@Override
	public String toString() {
		if (theNode == null)
			return "end";
		else if (!theNode.isPresent())
			return "removed(" + theNode.getValue() + ")";
		else
			return String.valueOf(theNode.getValue());
	}
}
