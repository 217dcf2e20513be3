package org.qontainers.collect;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

import org.qontainers.tree.InsertResult;
import org.qontainers.tree.RedBlackTree;
import org.qontainers.tree.TreeIterator;
import org.qontainers.tree.TreeRange;

import com.google.common.reflect.TypeToken;

/**
 * An {@link OrderedCollection} that may hold any number of equal values. Equal values are kept in the order they were added.
 *
 * @param <E> The type of values in the multiset
 */
public class OrderedMultiset<E> extends OrderedCollection<E> {
	private static final String DEFAULT_DESCRIPTION = "ordered-multiset";

	/**
	 * Builds {@link OrderedMultiset}s
	 *
	 * @param <E> The type of values for the multiset
	 */
	public static class Builder<E> extends OrderedCollection.Builder<E, OrderedMultiset<E>, Builder<E>> {
		Builder(Comparator<? super E> compare) {
			super(compare, DEFAULT_DESCRIPTION);
		}

		@Override
		public OrderedMultiset<E> build() {
			return new OrderedMultiset<>(getType(), getDescription(), getCompare(), getMaxSize());
		}
	}

	/**
	 * @param <E> The type of values for the multiset
	 * @param compare The ordering for the multiset's values
	 * @return A builder for the multiset
	 */
	public static <E> Builder<E> build(Comparator<? super E> compare) {
		return new Builder<>(compare);
	}

	/** Creates a multiset of {@link Comparable} values in their natural order */
	public OrderedMultiset() {
		this(naturalOrder());
	}

	/** @param compare The ordering for the multiset's values */
	public OrderedMultiset(Comparator<? super E> compare) {
		this((TypeToken<E>) TypeToken.of(Object.class), DEFAULT_DESCRIPTION, compare, RedBlackTree.DEFAULT_MAX_SIZE);
	}

	/**
	 * Creates a multiset of {@link Comparable} values in their natural order
	 *
	 * @param values The initial values for the multiset
	 */
	public OrderedMultiset(Iterable<? extends E> values) {
		this();
		insertMany(values);
	}

	/**
	 * Creates an independent copy of another multiset
	 *
	 * @param toCopy The multiset to copy
	 */
	public OrderedMultiset(OrderedMultiset<E> toCopy) {
		super(toCopy);
	}

	/**
	 * @param type The type of values the multiset accepts
	 * @param descrip The description of the multiset
	 * @param compare The ordering for the multiset's values
	 * @param maxSize The maximum number of values the multiset may hold
	 */
	protected OrderedMultiset(TypeToken<E> type, String descrip, Comparator<? super E> compare, int maxSize) {
		super(type, descrip, compare, maxSize);
	}

	@Override
	protected boolean isDistinct() {
		return false;
	}

	/**
	 * Adds a value to the multiset, after any values equal to it
	 *
	 * @param value The value to add
	 * @return The position of the new value
	 */
	public TreeIterator<E> insert(E value) {
		return getTree().insert(checkValue(value));
	}

	@Override
	public boolean add(E value) {
		insert(value);
		return true;
	}

	/**
	 * Adds each value in turn
	 *
	 * @param values The values to add
	 * @return The result of each insertion, in order. Every value is inserted.
	 */
	public List<InsertResult<E>> insertMany(Iterable<? extends E> values) {
		return getTree().insertMany(checkValues(values));
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
	 * @param value The value to count
	 * @return The number of values in this multiset equal to the given value
	 */
	public int count(E value) {
		return getTree().count(value);
	}

	/**
	 * @param value The value to search for
	 * @return The run of values in this multiset equal to the given value. Empty if there are none.
	 */
	public TreeRange<E> equalRange(E value) {
		return getTree().equalRange(value);
	}

	/**
	 * Moves all values of another multiset into this one
	 *
	 * @param other The multiset to move values from. Will be empty afterward.
	 * @throws IllegalArgumentException If any of the other multiset's values is not of this multiset's type. Nothing is moved in this case.
	 */
	public void merge(OrderedMultiset<E> other) {
		mergeFrom(other);
	}

	/** @param other The multiset to exchange contents, value types and descriptions with */
	public void swap(OrderedMultiset<E> other) {
		swapWith(other);
	}

	/**
	 * Replaces this multiset's contents with a copy of another multiset's
	 *
	 * @param other The multiset to copy
	 * @return This multiset
	 */
	public OrderedMultiset<E> assign(OrderedMultiset<E> other) {
		assignFrom(other);
		return this;
	}

	@Override
	public boolean equals(Object o) {
		if (o == this)
			return true;
		if (!(o instanceof OrderedMultiset))
			return false;
		OrderedMultiset<?> other = (OrderedMultiset<?>) o;
		if (other.size() != size())
			return false;
		Iterator<?> otherIter = other.iterator();
		for (E value : this) {
			if (!Objects.equals(value, otherIter.next()))
				return false;
		}
		return true;
	}

	@Override
	public int hashCode() {
		int h = 1;
		for (E value : this)
			h = 31 * h + value.hashCode();
		return h;
	}
}
