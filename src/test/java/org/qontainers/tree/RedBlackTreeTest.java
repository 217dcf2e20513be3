package org.qontainers.tree;

import static java.util.Arrays.asList;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.TreeMap;

import org.junit.Assert;
import org.junit.Test;

/** Runs tests on the red-black tree structure behind the ordered collections */
public class RedBlackTreeTest {
	/**
	 * Adds sequential values into a tree and removes them, checking validity of the tree at each step.
	 *
	 * @param <T> The type of values to put in the tree
	 * @param tree The tree
	 * @param values The sequence of values to add to the tree
	 */
	public static <T> void test(RedBlackTree<T> tree, Iterable<T> values) {
		int size = 0;
		for (T value : values) {
			tree.insert(value);
			size++;
			tree.checkValid();
			Assert.assertEquals(size, tree.size());
		}

		for (T value : values) {
			Assert.assertEquals(value, tree.begin().get());
			tree.erase(tree.begin());
			size--;
			tree.checkValid();
			Assert.assertEquals(size, tree.size());
		}
		Assert.assertTrue(tree.isEmpty());
	}

	/**
	 * Iterates through the alphabet from 'a' up to the given character
	 *
	 * @param last The last letter to be returned from the iterator
	 * @return An alphabet iterable
	 */
	protected static final Iterable<String> alphaBet(char last) {
		return () -> {
			return new Iterator<String>() {
				private char theNext = 'a';

				@Override
				public boolean hasNext() {
					return theNext <= last;
				}

				@Override
				public String next() {
					String ret = "" + theNext;
					theNext++;
					return ret;
				}
			};
		};
	}

	private static List<Integer> values(RedBlackTree<Integer> tree) {
		List<Integer> values = new ArrayList<>(tree.size());
		for (Integer v : tree)
			values.add(v);
		return values;
	}

	/** A simple test of sequential insertion and removal */
	@Test
	public void testTreeBasic() {
		test(new RedBlackTree<>(Comparator.<String> naturalOrder()), alphaBet('z'));
	}

	/** Sequential insertion in descending order, then removal from the middle */
	@Test
	public void testDescendingAndMiddleRemoval() {
		RedBlackTree<Integer> tree = new RedBlackTree<>(Comparator.naturalOrder());
		for (int i = 1000; i > 0; i--) {
			tree.insert(i);
			tree.checkValid(true);
		}
		Assert.assertEquals(Integer.valueOf(1), tree.begin().get());
		Assert.assertEquals(Integer.valueOf(1000), tree.last().get());
		// Remove the root repeatedly, which always has two children until the tree is tiny
		while (!tree.isEmpty()) {
			RedBlackNode<Integer> root = tree.getRoot();
			tree.erase(tree.find(root.getValue()));
			tree.checkValid(true);
		}
	}

	/** Checks the exact shape of a small tree after a merge */
	@Test
	public void testMergeShape() {
		RedBlackTree<Integer> tree1 = new RedBlackTree<>(Comparator.naturalOrder());
		RedBlackTree<Integer> tree2 = new RedBlackTree<>(Comparator.naturalOrder());
		tree1.insertMany(1, 2, 3);
		tree2.insertMany(4, 5, 6);

		tree1.merge(tree2);

		RedBlackNode<Integer> root = tree1.getRoot();
		Assert.assertEquals(Integer.valueOf(2), root.getValue());
		Assert.assertFalse(root.isRed());
		Assert.assertEquals(Integer.valueOf(1), root.getLeft().getValue());
		Assert.assertEquals(Integer.valueOf(4), root.getRight().getValue());
		Assert.assertEquals(Integer.valueOf(3), root.getRight().getLeft().getValue());
		Assert.assertEquals(Integer.valueOf(5), root.getRight().getRight().getValue());
		Assert.assertEquals(Integer.valueOf(6), root.getRight().getRight().getRight().getValue());
		Assert.assertTrue(root.getRight().isRed());
		Assert.assertTrue(root.getRight().getRight().getRight().isRed());
		Assert.assertTrue(tree2.isEmpty());
		tree1.checkValid(true);
	}

	/** Tests {@link RedBlackTree#copy()} */
	@Test
	public void testTreeCopy() {
		RedBlackTree<Integer> tree = new RedBlackTree<>(Comparator.naturalOrder());
		for (int i = 0; i < 100000; i++)
			tree.insert(i);
		checkIntegrity(tree);

		RedBlackTree<Integer> copy = tree.copy();
		checkIntegrity(copy);
		copy.checkValid(true);
		Assert.assertEquals(tree.getRoot().getValue(), copy.getRoot().getValue());
		Assert.assertNotSame(tree.getRoot(), copy.getRoot());

		copy.erase(Integer.valueOf(5));
		Assert.assertEquals(100000, tree.size());
		Assert.assertTrue(tree.contains(5));
		Assert.assertFalse(copy.contains(5));
	}

	private void checkIntegrity(RedBlackTree<Integer> tree) {
		RedBlackNode<Integer> node = tree.getFirstNode();
		Assert.assertEquals(Integer.valueOf(0), node.getValue());
		RedBlackNode<Integer> next = node.getClosest(false);
		int count = 1;
		while (next != null) {
			Assert.assertEquals("[" + count + "]", node.getValue() + 1, next.getValue().intValue());
			node = next;
			count++;
			next = node.getClosest(false);
		}
		Assert.assertEquals(tree.size(), count);
		Assert.assertEquals(tree.getLastNode().getValue(), node.getValue());

		count = 1;
		RedBlackNode<Integer> prev = node.getClosest(true);
		while (prev != null) {
			Assert.assertEquals("[" + count + "]", node.getValue() - 1, prev.getValue().intValue());
			node = prev;
			count++;
			prev = node.getClosest(true);
		}
		Assert.assertEquals(tree.size(), count);
		Assert.assertEquals(tree.getFirstNode().getValue(), node.getValue());
	}

	/** Equal values are kept in insertion order, after each other */
	@Test
	public void testDuplicateOrdering() {
		// Order by the first character only
		RedBlackTree<String> tree = new RedBlackTree<>(Comparator.comparing((String s) -> s.charAt(0)));
		tree.insertMany("b1", "a1", "b2", "c1", "b3", "a2");
		tree.checkValid();
		List<String> values = new ArrayList<>();
		tree.forEach(values::add);
		Assert.assertEquals(asList("a1", "a2", "b1", "b2", "b3", "c1"), values);
		Assert.assertEquals("b1", tree.find("b").get());
		Assert.assertEquals(3, tree.count("b"));
		Assert.assertEquals(0, tree.count("d"));
	}

	/** Tests {@link RedBlackTree#insertUnique(Object)} and {@link RedBlackTree#insertManyUnique(Object...)} */
	@Test
	public void testInsertUnique() {
		RedBlackTree<Integer> tree = new RedBlackTree<>(Comparator.naturalOrder());
		InsertResult<Integer> first = tree.insertUnique(3);
		Assert.assertTrue(first.isInserted());
		InsertResult<Integer> second = tree.insertUnique(3);
		Assert.assertFalse(second.isInserted());
		Assert.assertEquals(first.getPosition(), second.getPosition());
		Assert.assertEquals(1, tree.size());

		List<InsertResult<Integer>> results = tree.insertManyUnique(1, 3, 1, 2);
		Assert.assertEquals(4, results.size());
		Assert.assertTrue(results.get(0).isInserted());
		Assert.assertFalse(results.get(1).isInserted());
		// The second 1 sees the effect of the first
		Assert.assertFalse(results.get(2).isInserted());
		Assert.assertEquals(results.get(0).getPosition(), results.get(2).getPosition());
		Assert.assertTrue(results.get(3).isInserted());
		Assert.assertEquals(asList(1, 2, 3), values(tree));
		tree.checkValid(true);
	}

	/** Tests {@link RedBlackTree#lowerBound(Object)}, {@link RedBlackTree#upperBound(Object)} and {@link RedBlackTree#equalRange(Object)} */
	@Test
	public void testBounds() {
		RedBlackTree<Integer> tree = new RedBlackTree<>(Comparator.naturalOrder());
		tree.insertManyUnique(1, 2, 4, 8);
		Assert.assertEquals(Integer.valueOf(4), tree.lowerBound(3).get());
		Assert.assertEquals(Integer.valueOf(4), tree.lowerBound(4).get());
		Assert.assertEquals(Integer.valueOf(8), tree.upperBound(4).get());
		Assert.assertEquals(Integer.valueOf(1), tree.lowerBound(0).get());
		Assert.assertEquals(tree.end(), tree.lowerBound(9));
		Assert.assertEquals(tree.end(), tree.upperBound(8));

		TreeRange<Integer> range = tree.equalRange(3);
		Assert.assertTrue(range.isEmpty());
		Assert.assertEquals(range.getLower(), range.getUpper());
		Assert.assertEquals(Integer.valueOf(4), range.getLower().get());

		range = tree.equalRange(4);
		Assert.assertFalse(range.isEmpty());
		List<Integer> inRange = new ArrayList<>();
		range.forEach(inRange::add);
		Assert.assertEquals(asList(4), inRange);

		Assert.assertTrue(tree.equalRange(100).isEmpty());
		Assert.assertEquals(tree.end(), tree.find(5));
	}

	/** Tests stepping {@link TreeIterator}s in both directions */
	@Test
	public void testIteratorStepping() {
		RedBlackTree<Integer> tree = new RedBlackTree<>(Comparator.naturalOrder());
		Assert.assertEquals(tree.begin(), tree.end());
		try {
			tree.end().previous();
			Assert.fail("Should not be able to step back from the end of an empty tree");
		} catch (NoSuchElementException e) {
			// expected
		}

		tree.insertMany(5, 3, 8);
		List<Integer> forward = new ArrayList<>();
		for (TreeIterator<Integer> iter = tree.begin(); !iter.isEnd(); iter = iter.next())
			forward.add(iter.get());
		Assert.assertEquals(asList(3, 5, 8), forward);

		List<Integer> backward = new ArrayList<>();
		TreeIterator<Integer> iter = tree.end();
		while (!iter.equals(tree.begin())) {
			iter = iter.previous();
			backward.add(iter.get());
		}
		Assert.assertEquals(asList(8, 5, 3), backward);

		try {
			tree.end().get();
			Assert.fail("End iterator should have no value");
		} catch (NoSuchElementException e) {
			// expected
		}
		try {
			tree.end().next();
			Assert.fail("Should not be able to step past the end");
		} catch (NoSuchElementException e) {
			// expected
		}
		try {
			tree.begin().previous();
			Assert.fail("Should not be able to step before the first element");
		} catch (NoSuchElementException e) {
			// expected
		}
	}

	/** Iterators stay valid across modifications elsewhere and become invalid when their element is removed */
	@Test
	public void testIteratorStability() {
		RedBlackTree<Integer> tree = new RedBlackTree<>(Comparator.naturalOrder());
		for (int i = 0; i < 100; i++)
			tree.insert(i * 2);
		TreeIterator<Integer> fifty = tree.find(50);
		TreeIterator<Integer> sixty = tree.find(60);
		for (int i = 0; i < 100; i++)
			tree.insert(i * 2 + 1);
		// Erase everything but the two, which forces many rotations and node switches around them
		for (TreeIterator<Integer> iter = tree.begin(); !iter.isEnd();) {
			if (iter.equals(fifty) || iter.equals(sixty))
				iter = iter.next();
			else
				iter = tree.erase(iter);
			tree.checkValid();
		}
		Assert.assertEquals(2, tree.size());
		Assert.assertEquals(Integer.valueOf(50), fifty.get());
		Assert.assertEquals(sixty, fifty.next());
		Assert.assertEquals(tree.end(), sixty.next());

		TreeIterator<Integer> after = tree.erase(fifty);
		Assert.assertEquals(sixty, after);
		Assert.assertFalse(fifty.isValid());
		try {
			fifty.get();
			Assert.fail("Removed iterator should be invalid");
		} catch (InvalidIteratorException e) {
			// expected
		}

		tree.clear();
		Assert.assertFalse(sixty.isValid());
		Assert.assertTrue(tree.end().isValid());
	}

	/** Erasing the end, a removed element or another tree's element is rejected without modification */
	@Test
	public void testEraseInvalid() {
		RedBlackTree<Integer> tree = new RedBlackTree<>(Comparator.naturalOrder());
		RedBlackTree<Integer> other = new RedBlackTree<>(Comparator.naturalOrder());
		tree.insertMany(1, 2, 3);
		other.insertMany(1, 2, 3);

		try {
			tree.erase(tree.end());
			Assert.fail("Should not be able to erase the end");
		} catch (InvalidIteratorException e) {
			// expected
		}
		try {
			tree.erase(other.find(2));
			Assert.fail("Should not be able to erase another tree's element");
		} catch (InvalidIteratorException e) {
			// expected
		}
		TreeIterator<Integer> two = tree.find(2);
		tree.erase(two);
		try {
			tree.erase(two);
			Assert.fail("Should not be able to erase an element twice");
		} catch (InvalidIteratorException e) {
			// expected
		}
		Assert.assertEquals(asList(1, 3), values(tree));
		Assert.assertEquals(3, other.size());
		tree.checkValid();
		other.checkValid();
	}

	/** Tests {@link RedBlackTree#erase(Object)} */
	@Test
	public void testEraseValue() {
		RedBlackTree<Integer> tree = new RedBlackTree<>(Comparator.naturalOrder());
		tree.insertMany(4, 2, 2, 7, 2, 9);
		Assert.assertEquals(3, tree.erase(Integer.valueOf(2)));
		Assert.assertEquals(0, tree.erase(Integer.valueOf(2)));
		Assert.assertEquals(asList(4, 7, 9), values(tree));
		tree.checkValid();
	}

	/** Tests {@link RedBlackTree#merge(RedBlackTree)} with duplicates */
	@Test
	public void testMerge() {
		RedBlackTree<Integer> a = new RedBlackTree<>(Comparator.naturalOrder());
		RedBlackTree<Integer> b = new RedBlackTree<>(Comparator.naturalOrder());
		a.insertMany(1, 2);
		b.insertMany(2, 3);
		TreeIterator<Integer> bTwo = b.find(2);
		a.merge(b);
		Assert.assertEquals(asList(1, 2, 2, 3), values(a));
		Assert.assertTrue(b.isEmpty());
		Assert.assertEquals(b.end(), b.begin());
		a.checkValid();
		// The moved node is still valid, now in the destination, after the pre-existing equal value
		Assert.assertSame(a, bTwo.getTree());
		Assert.assertEquals(Integer.valueOf(2), bTwo.get());
		Assert.assertEquals(bTwo, a.find(2).next());

		a.merge(a);
		Assert.assertEquals(4, a.size());
	}

	/** Tests {@link RedBlackTree#mergeUnique(RedBlackTree)} leaving duplicates in the source */
	@Test
	public void testMergeUnique() {
		RedBlackTree<Integer> a = new RedBlackTree<>(Comparator.naturalOrder());
		RedBlackTree<Integer> b = new RedBlackTree<>(Comparator.naturalOrder());
		a.insertManyUnique(1, 3, 5);
		b.insertManyUnique(2, 3, 4, 5, 6);
		TreeIterator<Integer> bThree = b.find(3);
		a.mergeUnique(b);
		Assert.assertEquals(asList(1, 2, 3, 4, 5, 6), values(a));
		Assert.assertEquals(asList(3, 5), values(b));
		Assert.assertSame(b, bThree.getTree());
		a.checkValid(true);
		b.checkValid(true);
	}

	/** Tests {@link RedBlackTree#swap(RedBlackTree)} */
	@Test
	public void testSwap() {
		RedBlackTree<Integer> a = new RedBlackTree<>(Comparator.naturalOrder());
		RedBlackTree<Integer> b = new RedBlackTree<>(Comparator.reverseOrder(), 10);
		a.insertMany(1, 2);
		b.insertMany(3, 4, 5);
		TreeIterator<Integer> one = a.find(1);

		a.swap(b);
		Assert.assertEquals(asList(5, 4, 3), values(a));
		Assert.assertEquals(asList(1, 2), values(b));
		Assert.assertEquals(10, a.maxSize());
		Assert.assertEquals(RedBlackTree.DEFAULT_MAX_SIZE, b.maxSize());
		Assert.assertSame(b, one.getTree());
		b.erase(one);
		Assert.assertEquals(asList(2), values(b));
		a.checkValid(true);
		b.checkValid(true);

		a.swap(a);
		Assert.assertEquals(3, a.size());
	}

	/** Insertions and merges beyond the maximum size are rejected without modification */
	@Test
	public void testCapacity() {
		RedBlackTree<Integer> tree = new RedBlackTree<>(Comparator.naturalOrder(), 3);
		tree.insertMany(1, 2, 3);
		try {
			tree.insert(4);
			Assert.fail("Tree should be full");
		} catch (CapacityExceededException e) {
			Assert.assertEquals(3, e.getMaxSize());
		}
		// An already-present value doesn't need room
		Assert.assertFalse(tree.insertUnique(2).isInserted());
		Assert.assertEquals(asList(1, 2, 3), values(tree));

		RedBlackTree<Integer> other = new RedBlackTree<>(Comparator.naturalOrder());
		other.insertMany(3, 4);
		try {
			tree.merge(other);
			Assert.fail("Tree should be full");
		} catch (CapacityExceededException e) {
			// expected
		}
		Assert.assertEquals(2, other.size());
		Assert.assertEquals(3, tree.size());

		tree.erase(tree.begin());
		// Only 4 would move, so this fits
		tree.mergeUnique(other);
		Assert.assertEquals(asList(2, 3, 4), values(tree));
		Assert.assertEquals(asList(3), values(other));
		tree.checkValid(true);
	}

	/** A unique merge counts the values it would move by the destination's ordering, not the source's */
	@Test
	public void testMergeUniqueMixedOrderings() {
		RedBlackTree<Integer> dest = new RedBlackTree<>(Comparator.comparingInt((Integer i) -> i % 10), 2);
		RedBlackTree<Integer> src = new RedBlackTree<>(Comparator.naturalOrder());
		src.insertMany(1, 5, 11);
		// 1 and 11 are equal in the destination, but 5 sits between them in the source
		dest.mergeUnique(src);
		Assert.assertEquals(asList(1, 5), values(dest));
		Assert.assertEquals(asList(11), values(src));
		dest.checkValid(true);
		src.checkValid();
	}

	/** Bulk insertions that would overflow the tree insert nothing */
	@Test
	public void testInsertManyCapacity() {
		RedBlackTree<Integer> tree = new RedBlackTree<>(Comparator.naturalOrder(), 3);
		tree.insert(1);
		try {
			tree.insertMany(2, 3, 4);
			Assert.fail("Tree should not have room for 3 more values");
		} catch (CapacityExceededException e) {
			// expected
		}
		Assert.assertEquals(asList(1), values(tree));
		try {
			tree.insertManyUnique(2, 3, 4, 1);
			Assert.fail("Tree should not have room for 3 more values");
		} catch (CapacityExceededException e) {
			// expected
		}
		Assert.assertEquals(asList(1), values(tree));

		// Values already present and repeats don't need room
		List<InsertResult<Integer>> results = tree.insertManyUnique(1, 2, 3, 2, 3);
		Assert.assertEquals(5, results.size());
		Assert.assertEquals(asList(1, 2, 3), values(tree));
		tree.checkValid(true);
	}

	/** Clearing twice is harmless */
	@Test
	public void testClear() {
		RedBlackTree<Integer> tree = new RedBlackTree<>(Comparator.naturalOrder());
		tree.insertMany(1, 2, 3);
		tree.clear();
		Assert.assertEquals(0, tree.size());
		tree.checkValid();
		tree.clear();
		Assert.assertEquals(0, tree.size());
		Assert.assertEquals(tree.end(), tree.begin());
		tree.insert(7);
		Assert.assertEquals(asList(7), values(tree));
	}

	/** The java iterator fails fast and removes through the tree */
	@Test
	public void testJavaIterator() {
		RedBlackTree<Integer> tree = new RedBlackTree<>(Comparator.naturalOrder());
		tree.insertMany(1, 2, 3, 4, 5, 6);
		Iterator<Integer> iter = tree.iterator();
		while (iter.hasNext()) {
			if (iter.next() % 2 == 0)
				iter.remove();
		}
		Assert.assertEquals(asList(1, 3, 5), values(tree));
		tree.checkValid();

		iter = tree.iterator();
		iter.next();
		tree.insert(10);
		try {
			iter.next();
			Assert.fail("Iterator should detect the modification");
		} catch (ConcurrentModificationException e) {
			// expected
		}
	}

	/** Random operations checked against a {@link TreeMap} of counts */
	@Test
	public void testRandomOperations() {
		Random random = new Random(8675309);
		for (int run = 0; run < 20; run++) {
			boolean distinct = run % 2 == 0;
			RedBlackTree<Integer> tree = new RedBlackTree<>(Comparator.naturalOrder());
			TreeMap<Integer, Integer> model = new TreeMap<>();
			for (int op = 0; op < 2000; op++) {
				int value = random.nextInt(200);
				int choice = random.nextInt(10);
				if (choice < 5) {
					if (distinct) {
						boolean inserted = tree.insertUnique(value).isInserted();
						Assert.assertEquals(!model.containsKey(value), inserted);
						model.putIfAbsent(value, 1);
					} else {
						Assert.assertEquals(Integer.valueOf(value), tree.insert(value).get());
						model.merge(value, 1, Integer::sum);
					}
				} else if (choice < 8) {
					TreeIterator<Integer> found = tree.find(value);
					Assert.assertEquals(model.containsKey(value), !found.isEnd());
					if (!found.isEnd()) {
						tree.erase(found);
						if (model.get(value) == 1)
							model.remove(value);
						else
							model.put(value, model.get(value) - 1);
					}
				} else if (choice < 9) {
					Integer lower = model.ceilingKey(value);
					Integer higher = model.higherKey(value);
					TreeIterator<Integer> lb = tree.lowerBound(value);
					TreeIterator<Integer> ub = tree.upperBound(value);
					Assert.assertEquals(lower, lb.isEnd() ? null : lb.get());
					Assert.assertEquals(higher, ub.isEnd() ? null : ub.get());
					Assert.assertEquals(model.getOrDefault(value, 0).intValue(), tree.count(value));
				} else {
					RedBlackTree<Integer> other = new RedBlackTree<>(Comparator.naturalOrder());
					TreeMap<Integer, Integer> otherModel = new TreeMap<>();
					int otherSize = random.nextInt(20);
					for (int i = 0; i < otherSize; i++) {
						int v = random.nextInt(200);
						if (distinct) {
							other.insertUnique(v);
							otherModel.putIfAbsent(v, 1);
						} else {
							other.insert(v);
							otherModel.merge(v, 1, Integer::sum);
						}
					}
					if (distinct) {
						tree.mergeUnique(other);
						TreeMap<Integer, Integer> leftOver = new TreeMap<>();
						for (Map.Entry<Integer, Integer> entry : otherModel.entrySet()) {
							if (model.containsKey(entry.getKey()))
								leftOver.put(entry.getKey(), 1);
							else
								model.put(entry.getKey(), 1);
						}
						Assert.assertEquals(new ArrayList<>(leftOver.keySet()), values(other));
						other.checkValid(true);
					} else {
						tree.merge(other);
						for (Map.Entry<Integer, Integer> entry : otherModel.entrySet())
							model.merge(entry.getKey(), entry.getValue(), Integer::sum);
						Assert.assertTrue(other.isEmpty());
					}
				}
				if (op % 50 == 0)
					tree.checkValid(distinct);
			}
			tree.checkValid(distinct);
			List<Integer> expected = new ArrayList<>();
			for (Map.Entry<Integer, Integer> entry : model.entrySet()) {
				for (int i = 0; i < entry.getValue(); i++)
					expected.add(entry.getKey());
			}
			Assert.assertEquals(expected, values(tree));
			Assert.assertEquals(expected.size(), tree.size());
		}
	}
}
