package org.qontainers.collect;

import java.util.AbstractCollection;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

import org.qontainers.tree.CapacityExceededException;
import org.qontainers.tree.InvalidIteratorException;
import org.qontainers.tree.RedBlackTree;
import org.qontainers.tree.TreeIterator;

import com.google.common.collect.Ordering;
import com.google.common.reflect.TypeToken;

/**
 * A {@link java.util.Collection} that keeps its values sorted in a {@link RedBlackTree}. This class holds everything the unique and
 * duplicate-allowing sub-types have in common.
 *
 * @param <E> The type of values in the collection
 */
public abstract class OrderedCollection<E> extends AbstractCollection<E> {
	/**
	 * Configures and builds ordered collections
	 *
	 * @param <E> The type of values for the collection
	 * @param <C> The sub-type of collection to build
	 * @param <B> The sub-type of this builder
	 */
	public static abstract class Builder<E, C extends OrderedCollection<E>, B extends Builder<E, C, B>> {
		private final Comparator<? super E> theCompare;
		private TypeToken<E> theType;
		private String theDescription;
		private int theMaxSize;

		/**
		 * @param compare The ordering for the collection's values
		 * @param defaultDescrip The initial (default) description for collections built with this builder
		 */
		protected Builder(Comparator<? super E> compare, String defaultDescrip) {
			if (compare == null)
				throw new NullPointerException("Comparator may not be null");
			theCompare = compare;
			theType = (TypeToken<E>) TypeToken.of(Object.class);
			theDescription = defaultDescrip;
			theMaxSize = RedBlackTree.DEFAULT_MAX_SIZE;
		}

		/**
		 * @param type The type of values the collection will accept
		 * @return This builder
		 */
		public B withType(TypeToken<E> type) {
			if (type == null)
				throw new NullPointerException("null type not allowed");
			theType = type;
			return (B) this;
		}

		/**
		 * @param type The type of values the collection will accept
		 * @return This builder
		 */
		public B withType(Class<E> type) {
			return withType(TypeToken.of(type));
		}

		/**
		 * @param descrip The description for the collection
		 * @return This builder
		 */
		public B withDescription(String descrip) {
			if (descrip == null)
				throw new NullPointerException("null description not allowed");
			theDescription = descrip;
			return (B) this;
		}

		/**
		 * @param maxSize The maximum number of values the collection may hold
		 * @return This builder
		 */
		public B withMaxSize(int maxSize) {
			if (maxSize <= 0)
				throw new IllegalArgumentException("Max size must be positive: " + maxSize);
			theMaxSize = maxSize;
			return (B) this;
		}

		/** @return The ordering for the new collection */
		protected Comparator<? super E> getCompare() {
			return theCompare;
		}

		/** @return The value type for the new collection */
		protected TypeToken<E> getType() {
			return theType;
		}

		/** @return The description for the new collection */
		public String getDescription() {
			return theDescription;
		}

		/** @return The maximum size for the new collection */
		protected int getMaxSize() {
			return theMaxSize;
		}

		/** @return The new, empty collection */
		public abstract C build();

		/**
		 * @param values The initial values for the collection
		 * @return The new collection
		 */
		public C build(Iterable<? extends E> values) {
			C collection = build();
			for (E value : values)
				collection.add(value);
			return collection;
		}
	}

	private TypeToken<E> theType;
	private String theDescription;
	private final RedBlackTree<E> theTree;

	/**
	 * @param type The type of values the collection accepts
	 * @param descrip The description of the collection
	 * @param compare The ordering for the collection's values
	 * @param maxSize The maximum number of values the collection may hold
	 */
	protected OrderedCollection(TypeToken<E> type, String descrip, Comparator<? super E> compare, int maxSize) {
		theType = type;
		theDescription = descrip;
		theTree = new RedBlackTree<>(compare, maxSize);
	}

	/**
	 * Creates an independent copy of a collection's values
	 *
	 * @param toCopy The collection to copy
	 */
	protected OrderedCollection(OrderedCollection<E> toCopy) {
		theType = toCopy.theType;
		theDescription = toCopy.theDescription;
		theTree = toCopy.theTree.copy();
	}

	/**
	 * @param <E> The type to order
	 * @return The natural ordering of {@link Comparable} values
	 */
	protected static <E> Comparator<? super E> naturalOrder() {
		return (Comparator<? super E>) (Comparator<?>) Ordering.natural();
	}

	/** @return The type of values in this collection */
	public TypeToken<E> getType() {
		return theType;
	}

	/** @return This collection's description */
	public String getDescription() {
		return theDescription;
	}

	/** @return The tree structure holding this collection's values */
	protected RedBlackTree<E> getTree() {
		return theTree;
	}

	/** @return Whether this collection refuses values equal to ones already present */
	protected abstract boolean isDistinct();

	/**
	 * @param value The value to check
	 * @return The value
	 * @throws NullPointerException If the value is null
	 * @throws IllegalArgumentException If the value is not an instance of this collection's {@link #getType() type}
	 */
	protected E checkValue(E value) {
		if (value == null)
			throw new NullPointerException("Null values are not allowed in " + theDescription);
		if (!theType.wrap().getRawType().isInstance(value))
			throw new IllegalArgumentException(
				"Value " + value + " of type " + value.getClass().getName() + " is not allowed in " + theDescription + " of " + theType);
		return value;
	}

	private boolean belongs(Object value) {
		return value != null && theType.wrap().getRawType().isInstance(value);
	}

	/**
	 * @param values The values to check
	 * @return The values, all checked
	 */
	protected Iterable<E> checkValues(Iterable<? extends E> values) {
		List<E> checked = new ArrayList<>();
		for (E value : values)
			checked.add(checkValue(value));
		return checked;
	}

	@Override
	public int size() {
		return theTree.size();
	}

	@Override
	public boolean isEmpty() {
		return theTree.isEmpty();
	}

	/** @return The maximum number of values this collection may hold */
	public int maxSize() {
		return theTree.maxSize();
	}

	/** @return The ordering of this collection's values */
	public Comparator<? super E> comparator() {
		return theTree.comparator();
	}

	/** @return The position of this collection's first value, or {@link #end()} if it is empty */
	public TreeIterator<E> begin() {
		return theTree.begin();
	}

	/** @return The position after this collection's last value */
	public TreeIterator<E> end() {
		return theTree.end();
	}

	/** @return The position of this collection's last value, or {@link #end()} if it is empty */
	public TreeIterator<E> last() {
		return theTree.last();
	}

	/**
	 * @param value The value to find
	 * @return The position of the first value equal to the given value, or {@link #end()} if there is none
	 */
	public TreeIterator<E> find(E value) {
		return theTree.find(value);
	}

	/**
	 * @param value The value to search for
	 * @return The position of the first value not less than the given value, or {@link #end()} if there is none
	 */
	public TreeIterator<E> lowerBound(E value) {
		return theTree.lowerBound(value);
	}

	/**
	 * @param value The value to search for
	 * @return The position of the first value greater than the given value, or {@link #end()} if there is none
	 */
	public TreeIterator<E> upperBound(E value) {
		return theTree.upperBound(value);
	}

	@Override
	public boolean contains(Object o) {
		return belongs(o) && theTree.contains((E) o);
	}

	/**
	 * Removes the value at a position
	 *
	 * @param position The position of the value to remove
	 * @return The position after the removed value
	 * @throws InvalidIteratorException If the position is the end, was already removed, or is not in this collection
	 */
	public TreeIterator<E> erase(TreeIterator<E> position) {
		return theTree.erase(position);
	}

	/**
	 * @param value The value to remove
	 * @return The number of values equal to the given value that were removed
	 */
	public int eraseAll(E value) {
		return theTree.erase(value);
	}

	@Override
	public boolean remove(Object o) {
		if (!belongs(o))
			return false;
		TreeIterator<E> found = theTree.find((E) o);
		if (found.isEnd())
			return false;
		theTree.erase(found);
		return true;
	}

	@Override
	public void clear() {
		theTree.clear();
	}

	@Override
	public Iterator<E> iterator() {
		return theTree.iterator();
	}

	/**
	 * Replaces this collection's contents with a copy of another's, including its type, description, ordering and maximum size
	 *
	 * @param other The collection to copy
	 */
	protected void assignFrom(OrderedCollection<E> other) {
		if (other == this)
			return;
		theTree.clear();
		theTree.swap(other.theTree.copy());
		theType = other.theType;
		theDescription = other.theDescription;
	}

	/**
	 * Exchanges this collection's contents with another's, along with their types and descriptions
	 *
	 * @param other The collection to swap contents with
	 * @see RedBlackTree#swap(RedBlackTree)
	 */
	protected void swapWith(OrderedCollection<E> other) {
		if (other == this)
			return;
		theTree.swap(other.theTree);
		TypeToken<E> tempType = theType;
		theType = other.theType;
		other.theType = tempType;
		String tempDescrip = theDescription;
		theDescription = other.theDescription;
		other.theDescription = tempDescrip;
	}

	/**
	 * Moves values from another collection into this one
	 *
	 * @param other The collection to move values from
	 * @throws IllegalArgumentException If any of the other collection's values is not of this collection's type. Neither collection is
	 *         modified in this case.
	 * @throws CapacityExceededException If this collection cannot hold the values to move
	 * @see RedBlackTree#merge(RedBlackTree)
	 * @see RedBlackTree#mergeUnique(RedBlackTree)
	 */
	protected void mergeFrom(OrderedCollection<E> other) {
		if (other == this)
			return;
		if (!theType.isSupertypeOf(other.theType)) {
			for (E value : other)
				checkValue(value);
		}
		if (isDistinct())
			theTree.mergeUnique(other.theTree);
		else
			theTree.merge(other.theTree);
	}

	/**
	 * Runs debugging checks on this collection's structure
	 *
	 * @throws IllegalStateException If the structure is corrupt
	 */
	public void checkValid() {
		theTree.checkValid(isDistinct());
	}
}
