package org.qontainers.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.TreeSet;

import org.apache.log4j.Logger;

/**
 * <p>
 * A red-black tree structure holding values in the order of a {@link Comparator}.
 * </p>
 *
 * <p>
 * The tree itself does not decide whether equal values may coexist. {@link #insert(Object)} always adds, placing a value after any values
 * equal to it, while {@link #insertUnique(Object)} refuses values that are already present. A tree used in one mode should generally only
 * be modified in that mode.
 * </p>
 *
 * <p>
 * Positions in the tree are represented by {@link TreeIterator}s. A tree is not thread-safe.
 * </p>
 *
 * @param <E> The type of values stored in the tree
 */
public class RedBlackTree<E> implements Iterable<E> {
	private static final Logger log = Logger.getLogger(RedBlackTree.class);

	/** The default {@link #maxSize() maximum size} of a tree */
	public static final int DEFAULT_MAX_SIZE = Integer.MAX_VALUE;

	private Comparator<? super E> theCompare;
	private int theMaxSize;
	private TreeStructure<E> theStructure;

	/** @param compare The ordering for the tree's values */
	public RedBlackTree(Comparator<? super E> compare) {
		this(compare, DEFAULT_MAX_SIZE);
	}

	/**
	 * @param compare The ordering for the tree's values
	 * @param maxSize The maximum number of values the tree may hold
	 */
	public RedBlackTree(Comparator<? super E> compare, int maxSize) {
		if (compare == null)
			throw new NullPointerException("Comparator may not be null");
		if (maxSize <= 0)
			throw new IllegalArgumentException("Max size must be positive: " + maxSize);
		theCompare = compare;
		theMaxSize = maxSize;
		theStructure = new TreeStructure<>(this);
	}

	/** @return The ordering of this tree's values */
	public Comparator<? super E> comparator() {
		return theCompare;
	}

	/** @return The number of values in this tree */
	public int size() {
		return theStructure.theSize;
	}

	/** @return Whether this tree has no values */
	public boolean isEmpty() {
		return theStructure.theRoot == null;
	}

	/** @return The maximum number of values this tree may hold */
	public int maxSize() {
		return theMaxSize;
	}

	/** @return The root node of this tree, or null if the tree is empty */
	public RedBlackNode<E> getRoot() {
		return theStructure.theRoot;
	}

	RedBlackNode<E> getFirstNode() {
		return theStructure.theFirst;
	}

	RedBlackNode<E> getLastNode() {
		return theStructure.theLast;
	}

	/** @return The position of the first value in this tree, or {@link #end()} if the tree is empty */
	public TreeIterator<E> begin() {
		return iter(theStructure.theFirst);
	}

	/** @return The position after the last value in this tree */
	public TreeIterator<E> end() {
		return iter(null);
	}

	/** @return The position of the last value in this tree, or {@link #end()} if the tree is empty */
	public TreeIterator<E> last() {
		return iter(theStructure.theLast);
	}

	private TreeIterator<E> iter(RedBlackNode<E> node) {
		return new TreeIterator<>(this, node);
	}

	/**
	 * Adds a value to the tree, after any values equal to it
	 *
	 * @param value The value to add
	 * @return The position of the new value
	 * @throws CapacityExceededException If this tree is already at its {@link #maxSize() maximum size}
	 */
	public TreeIterator<E> insert(E value) {
		RedBlackNode<E> parent = null;
		int comp = 0;
		for (RedBlackNode<E> node = theStructure.theRoot; node != null; node = node.getChild(comp < 0)) {
			comp = theCompare.compare(value, node.getValue());
			parent = node;
		}
		return iter(linkNew(value, parent, comp < 0));
	}

	/**
	 * Adds a value to the tree if no equal value is present
	 *
	 * @param value The value to add
	 * @return The position of the new value, or of the equal value that was already present
	 * @throws CapacityExceededException If the value is not present and this tree is already at its {@link #maxSize() maximum size}
	 */
	public InsertResult<E> insertUnique(E value) {
		RedBlackNode<E> parent = null;
		int comp = 0;
		for (RedBlackNode<E> node = theStructure.theRoot; node != null; node = node.getChild(comp < 0)) {
			comp = theCompare.compare(value, node.getValue());
			if (comp == 0)
				return new InsertResult<>(iter(node), false);
			parent = node;
		}
		return new InsertResult<>(iter(linkNew(value, parent, comp < 0)), true);
	}

	/**
	 * {@link #insert(Object) Inserts} each value in turn
	 *
	 * @param values The values to add
	 * @return The result of each insertion, in order
	 * @throws CapacityExceededException If this tree cannot hold all the values. Nothing is inserted in this case.
	 */
	public List<InsertResult<E>> insertMany(Iterable<? extends E> values) {
		List<E> toAdd = new ArrayList<>();
		for (E value : values)
			toAdd.add(value);
		checkCapacity(toAdd.size());
		List<InsertResult<E>> results = new ArrayList<>(toAdd.size());
		for (E value : toAdd)
			results.add(new InsertResult<>(insert(value), true));
		return results;
	}

	/**
	 * @param values The values to add
	 * @return The result of each insertion, in order
	 * @see #insertMany(Iterable)
	 */
	@SafeVarargs
	public final List<InsertResult<E>> insertMany(E... values) {
		return insertMany(Arrays.asList(values));
	}

	/**
	 * {@link #insertUnique(Object) Inserts} each value in turn, so a value equal to an earlier one in the sequence is not added
	 *
	 * @param values The values to add
	 * @return The result of each insertion, in order
	 * @throws CapacityExceededException If this tree cannot hold all the values that would be added. Nothing is inserted in this case.
	 */
	public List<InsertResult<E>> insertManyUnique(Iterable<? extends E> values) {
		List<E> toAdd = new ArrayList<>();
		TreeSet<E> absent = new TreeSet<>(theCompare);
		for (E value : values) {
			toAdd.add(value);
			if (!contains(value))
				absent.add(value);
		}
		checkCapacity(absent.size());
		List<InsertResult<E>> results = new ArrayList<>(toAdd.size());
		for (E value : toAdd)
			results.add(insertUnique(value));
		return results;
	}

	/**
	 * @param values The values to add
	 * @return The result of each insertion, in order
	 * @see #insertManyUnique(Iterable)
	 */
	@SafeVarargs
	public final List<InsertResult<E>> insertManyUnique(E... values) {
		return insertManyUnique(Arrays.asList(values));
	}

	private RedBlackNode<E> linkNew(E value, RedBlackNode<E> parent, boolean left) {
		checkCapacity(1);
		RedBlackNode<E> node = new RedBlackNode<>(theStructure, value);
		link(node, parent, left);
		return node;
	}

	private void link(RedBlackNode<E> node, RedBlackNode<E> parent, boolean left) {
		if (parent == null)
			node.linkAsRoot();
		else
			parent.add(node, left);
		theStructure.theSize++;
		theStructure.theStructureStamp++;
	}

	private void unlink(RedBlackNode<E> node) {
		node.delete();
		theStructure.theSize--;
		theStructure.theStructureStamp++;
	}

	private void checkCapacity(int toAdd) {
		if (toAdd > theMaxSize - theStructure.theSize) {
			String msg = "Cannot add " + toAdd + " value(s) to a tree of size " + theStructure.theSize + " (max " + theMaxSize + ")";
			log.warn(msg);
			throw new CapacityExceededException(msg, theMaxSize);
		}
	}

	/**
	 * Removes the value at a position
	 *
	 * @param position The position of the value to remove
	 * @return The position after the removed value
	 * @throws InvalidIteratorException If the position is the end, has already been removed, or does not belong to this tree
	 */
	public TreeIterator<E> erase(TreeIterator<E> position) {
		RedBlackNode<E> node = position.getNode();
		if (node == null)
			throw new InvalidIteratorException("The end position cannot be erased");
		else if (!node.isPresent())
			throw new InvalidIteratorException("Element " + node.getValue() + " has already been removed");
		else if (node.getOwner() != theStructure)
			throw new InvalidIteratorException("Element " + node.getValue() + " does not belong to this tree");
		RedBlackNode<E> next = node.getClosest(false);
		unlink(node);
		return iter(next);
	}

	/**
	 * Removes all values equal to the given value
	 *
	 * @param value The value to remove
	 * @return The number of values removed
	 */
	public int erase(E value) {
		int removed = 0;
		RedBlackNode<E> node = lowerBoundNode(value);
		while (node != null && theCompare.compare(node.getValue(), value) == 0) {
			RedBlackNode<E> next = node.getClosest(false);
			unlink(node);
			removed++;
			node = next;
		}
		return removed;
	}

	/**
	 * @param value The value to find
	 * @return The position of the first value in this tree equal to the given value, or {@link #end()} if there is none
	 */
	public TreeIterator<E> find(E value) {
		RedBlackNode<E> found = lowerBoundNode(value);
		if (found != null && theCompare.compare(found.getValue(), value) != 0)
			found = null;
		return iter(found);
	}

	/**
	 * @param value The value to check
	 * @return Whether a value equal to the given value is present in this tree
	 */
	public boolean contains(E value) {
		return !find(value).isEnd();
	}

	/**
	 * @param value The value to search for
	 * @return The position of the first value in this tree not less than the given value, or {@link #end()} if there is none
	 */
	public TreeIterator<E> lowerBound(E value) {
		return iter(lowerBoundNode(value));
	}

	/**
	 * @param value The value to search for
	 * @return The position of the first value in this tree greater than the given value, or {@link #end()} if there is none
	 */
	public TreeIterator<E> upperBound(E value) {
		RedBlackNode<E> found = null;
		RedBlackNode<E> node = theStructure.theRoot;
		while (node != null) {
			if (theCompare.compare(node.getValue(), value) > 0) {
				found = node;
				node = node.getLeft();
			} else
				node = node.getRight();
		}
		return iter(found);
	}

	private RedBlackNode<E> lowerBoundNode(E value) {
		RedBlackNode<E> found = null;
		RedBlackNode<E> node = theStructure.theRoot;
		while (node != null) {
			if (theCompare.compare(node.getValue(), value) >= 0) {
				found = node;
				node = node.getLeft();
			} else
				node = node.getRight();
		}
		return found;
	}

	/**
	 * @param value The value to search for
	 * @return The range of values in this tree equal to the given value. Empty if there are none.
	 */
	public TreeRange<E> equalRange(E value) {
		return new TreeRange<>(lowerBound(value), upperBound(value));
	}

	/**
	 * @param value The value to count
	 * @return The number of values in this tree equal to the given value
	 */
	public int count(E value) {
		int count = 0;
		for (RedBlackNode<E> node = lowerBoundNode(value); node != null
			&& theCompare.compare(node.getValue(), value) == 0; node = node.getClosest(false))
			count++;
		return count;
	}

	/**
	 * Moves all of another tree's values into this tree. The nodes themselves are moved, so positions in the other tree remain valid
	 * positions of the same values in this tree. Values equal to ones already in this tree are placed after them.
	 *
	 * @param other The tree to move values from. Will be empty afterward.
	 * @throws CapacityExceededException If this tree cannot hold all the other tree's values. Neither tree is modified in this case.
	 */
	public void merge(RedBlackTree<E> other) {
		if (other == this) {
			log.debug("Ignoring merge of a tree into itself");
			return;
		}
		int toMove = other.size();
		checkCapacity(toMove);
		RedBlackNode<E> node = other.theStructure.theFirst;
		while (node != null) {
			RedBlackNode<E> next = node.getClosest(false);
			RedBlackNode<E> parent = null;
			int comp = 0;
			for (RedBlackNode<E> n = theStructure.theRoot; n != null; n = n.getChild(comp < 0)) {
				comp = theCompare.compare(node.getValue(), n.getValue());
				parent = n;
			}
			transfer(other, node, parent, comp < 0);
			node = next;
		}
		if (log.isDebugEnabled())
			log.debug("Merged " + toMove + " values, size is now " + size());
	}

	/**
	 * Moves values of another tree that are not present in this tree into this tree. Nodes themselves are moved, so positions of moved
	 * values remain valid. Values that are already present in this tree stay in the other tree.
	 *
	 * @param other The tree to move values from. Will contain only the values that were already present in this tree afterward.
	 * @throws CapacityExceededException If this tree cannot hold all the values that would be moved. Neither tree is modified in this case.
	 */
	public void mergeUnique(RedBlackTree<E> other) {
		if (other == this) {
			log.debug("Ignoring merge of a tree into itself");
			return;
		}
		// The other tree's ordering may differ, so values equal under this tree's ordering need not be adjacent there
		TreeSet<E> moving = new TreeSet<>(theCompare);
		for (RedBlackNode<E> node = other.theStructure.theFirst; node != null; node = node.getClosest(false)) {
			if (!contains(node.getValue()))
				moving.add(node.getValue());
		}
		int toMove = moving.size();
		checkCapacity(toMove);
		RedBlackNode<E> node = other.theStructure.theFirst;
		while (node != null) {
			RedBlackNode<E> next = node.getClosest(false);
			RedBlackNode<E> parent = null;
			int comp = 1;
			for (RedBlackNode<E> n = theStructure.theRoot; n != null; n = n.getChild(comp < 0)) {
				comp = theCompare.compare(node.getValue(), n.getValue());
				if (comp == 0)
					break;
				parent = n;
			}
			if (comp != 0)
				transfer(other, node, parent, comp < 0);
			node = next;
		}
		if (log.isDebugEnabled())
			log.debug("Merged " + toMove + " unique values, " + other.size() + " left in the source");
	}

	private void transfer(RedBlackTree<E> from, RedBlackNode<E> node, RedBlackNode<E> parent, boolean left) {
		from.unlink(node);
		node.adopt(theStructure);
		link(node, parent, left);
	}

	/**
	 * Exchanges the contents of this tree with another's, including their orderings and maximum sizes. No nodes are touched.
	 *
	 * @param other The tree to swap contents with
	 */
	public void swap(RedBlackTree<E> other) {
		if (other == this)
			return;
		TreeStructure<E> tempStructure = theStructure;
		theStructure = other.theStructure;
		other.theStructure = tempStructure;
		theStructure.theTree = this;
		other.theStructure.theTree = other;

		Comparator<? super E> tempCompare = theCompare;
		theCompare = other.theCompare;
		other.theCompare = tempCompare;
		int tempMax = theMaxSize;
		theMaxSize = other.theMaxSize;
		other.theMaxSize = tempMax;
		if (log.isDebugEnabled())
			log.debug("Swapped trees of size " + other.size() + " and " + size());
	}

	/** Removes all values from this tree. Positions of the removed values become invalid. */
	public void clear() {
		if (theStructure.theRoot == null)
			return;
		int size = theStructure.theSize;
		RedBlackNode<E> node = theStructure.theFirst;
		while (node != null) {
			RedBlackNode<E> next = node.getClosest(false);
			node.discard();
			node = next;
		}
		theStructure.setRoot(null);
		theStructure.theSize = 0;
		if (log.isDebugEnabled())
			log.debug("Cleared " + size + " values");
	}

	/** @return An independent copy of this tree with the same shape, ordering and maximum size */
	public RedBlackTree<E> copy() {
		RedBlackTree<E> copy = new RedBlackTree<>(theCompare, theMaxSize);
		if (theStructure.theRoot != null) {
			copy.theStructure.setRoot(RedBlackNode.deepCopy(theStructure.theRoot, copy.theStructure));
			copy.theStructure.theSize = theStructure.theSize;
		}
		return copy;
	}

	/**
	 * Runs debugging checks on this tree to assure that all internal constraints are currently met
	 *
	 * @throws IllegalStateException If any constraint is violated
	 */
	public void checkValid() {
		checkValid(false);
	}

	/**
	 * Runs debugging checks on this tree to assure that all internal constraints are currently met
	 *
	 * @param distinct Whether to also check that no two values in the tree are equal
	 * @throws IllegalStateException If any constraint is violated
	 */
	public void checkValid(boolean distinct) {
		RedBlackNode<E> root = theStructure.theRoot;
		if (root == null) {
			if (theStructure.theSize != 0 || theStructure.theFirst != null || theStructure.theLast != null)
				throw new IllegalStateException("Empty tree has size " + theStructure.theSize + " or dangling terminal nodes");
			return;
		}
		if (root.getParent() != null)
			throw new IllegalStateException("The root (" + root + ") has a parent");
		if (root.isRed())
			throw new IllegalStateException("The root is red!");
		root.checkValid();
		if (theStructure.theFirst != root.getTerminal(true))
			throw new IllegalStateException("First node is " + theStructure.theFirst + ", not " + root.getTerminal(true));
		if (theStructure.theLast != root.getTerminal(false))
			throw new IllegalStateException("Last node is " + theStructure.theLast + ", not " + root.getTerminal(false));
		int count = 0;
		RedBlackNode<E> prev = null;
		for (RedBlackNode<E> node = theStructure.theFirst; node != null; node = node.getClosest(false)) {
			if (node.getOwner() != theStructure)
				throw new IllegalStateException("Node " + node + " is owned by another tree");
			if (prev != null) {
				int comp = theCompare.compare(prev.getValue(), node.getValue());
				if (comp > 0 || (distinct && comp == 0))
					throw new IllegalStateException("Nodes out of order: " + prev + ", " + node);
			}
			prev = node;
			count++;
		}
		if (count != theStructure.theSize)
			throw new IllegalStateException("Size is " + theStructure.theSize + ", but " + count + " nodes are linked");
	}

	/**
	 * The returned iterator is fail-fast: modification of this tree other than through the iterator's own {@link Iterator#remove()} causes
	 * it to throw {@link ConcurrentModificationException}.
	 */
	@Override
	public Iterator<E> iterator() {
		return new Iterator<E>() {
			private final TreeStructure<E> theIterStructure = theStructure;
			private long theStamp = theStructure.theStructureStamp;
			private RedBlackNode<E> theNext = theStructure.theFirst;
			private RedBlackNode<E> theLastReturned;

			@Override
			public boolean hasNext() {
				checkModification();
				return theNext != null;
			}

			@Override
			public E next() {
				checkModification();
				if (theNext == null)
					throw new NoSuchElementException();
				theLastReturned = theNext;
				theNext = theNext.getClosest(false);
				return theLastReturned.getValue();
			}

			@Override
			public void remove() {
				checkModification();
				if (theLastReturned == null)
					throw new IllegalStateException("next() has not been called, or the element has already been removed");
				unlink(theLastReturned);
				theLastReturned = null;
				theStamp = theStructure.theStructureStamp;
			}

			private void checkModification() {
				if (theStructure != theIterStructure || theStructure.theStructureStamp != theStamp)
					throw new ConcurrentModificationException("Tree has been modified since this iterator was created");
			}
		};
	}

	@Override
	public String toString() {
		return RedBlackNode.print(theStructure.theRoot);
	}
}
