package org.qontainers.collect;

import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

import org.qontainers.tree.InsertResult;
import org.qontainers.tree.RedBlackTree;

import com.google.common.reflect.TypeToken;

/**
 * An {@link OrderedCollection} whose values are distinct under its ordering
 *
 * @param <E> The type of values in the set
 */
public class OrderedSet<E> extends OrderedCollection<E> implements Set<E> {
	private static final String DEFAULT_DESCRIPTION = "ordered-set";

	/**
	 * Builds {@link OrderedSet}s
	 *
	 * @param <E> The type of values for the set
	 */
	public static class Builder<E> extends OrderedCollection.Builder<E, OrderedSet<E>, Builder<E>> {
		Builder(Comparator<? super E> compare) {
			super(compare, DEFAULT_DESCRIPTION);
		}

		@Override
		public OrderedSet<E> build() {
			return new OrderedSet<>(getType(), getDescription(), getCompare(), getMaxSize());
		}
	}

	/**
	 * @param <E> The type of values for the set
	 * @param compare The ordering for the set's values
	 * @return A builder for the set
	 */
	public static <E> Builder<E> build(Comparator<? super E> compare) {
		return new Builder<>(compare);
	}

	/** Creates a set of {@link Comparable} values in their natural order */
	public OrderedSet() {
		this(naturalOrder());
	}

	/** @param compare The ordering for the set's values */
	public OrderedSet(Comparator<? super E> compare) {
		this((TypeToken<E>) TypeToken.of(Object.class), DEFAULT_DESCRIPTION, compare, RedBlackTree.DEFAULT_MAX_SIZE);
	}

	/**
	 * Creates a set of {@link Comparable} values in their natural order
	 *
	 * @param values The initial values for the set
	 */
	public OrderedSet(Iterable<? extends E> values) {
		this();
		insertMany(values);
	}

	/**
	 * Creates an independent copy of another set
	 *
	 * @param toCopy The set to copy
	 */
	public OrderedSet(OrderedSet<E> toCopy) {
		super(toCopy);
	}

	/**
	 * @param type The type of values the set accepts
	 * @param descrip The description of the set
	 * @param compare The ordering for the set's values
	 * @param maxSize The maximum number of values the set may hold
	 */
	protected OrderedSet(TypeToken<E> type, String descrip, Comparator<? super E> compare, int maxSize) {
		super(type, descrip, compare, maxSize);
	}

	@Override
	protected boolean isDistinct() {
		return true;
	}

	/**
	 * Adds a value to the set if it is not already present
	 *
	 * @param value The value to add
	 * @return The position of the value in the set, and whether it was added
	 */
	public InsertResult<E> insert(E value) {
		return getTree().insertUnique(checkValue(value));
	}

	@Override
	public boolean add(E value) {
		return insert(value).isInserted();
	}

	@Override
	public boolean addAll(Collection<? extends E> values) {
		boolean modified = false;
		for (InsertResult<E> result : insertMany(values))
			modified |= result.isInserted();
		return modified;
	}

	/**
	 * Adds each value in turn, skipping values equal to any already in the set (including earlier values in the sequence)
	 *
	 * @param values The values to add
	 * @return The result of each insertion, in order
	 */
	public List<InsertResult<E>> insertMany(Iterable<? extends E> values) {
		return getTree().insertManyUnique(checkValues(values));
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
	 * Moves the values of another set that are not in this set into this set. Values already present in this set stay in the other set.
	 *
	 * @param other The set to move values from
	 * @throws IllegalArgumentException If any of the other set's values is not of this set's type. Nothing is moved in this case.
	 */
	public void merge(OrderedSet<E> other) {
		mergeFrom(other);
	}

	/** @param other The set to exchange contents, value types and descriptions with */
	public void swap(OrderedSet<E> other) {
		swapWith(other);
	}

	/**
	 * Replaces this set's contents with a copy of another set's
	 *
	 * @param other The set to copy
	 * @return This set
	 */
	public OrderedSet<E> assign(OrderedSet<E> other) {
		assignFrom(other);
		return this;
	}

	@Override
	public boolean equals(Object o) {
		if (o == this)
			return true;
		if (!(o instanceof Set))
			return false;
		Collection<?> c = (Collection<?>) o;
		if (c.size() != size())
			return false;
		try {
			return containsAll(c);
		} catch (ClassCastException | NullPointerException unused) {
			return false;
		}
	}

	@Override
	public int hashCode() {
		int h = 0;
		for (E value : this)
			h += value.hashCode();
		return h;
	}
}
