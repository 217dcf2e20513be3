package org.qontainers.tree;

/**
 * The node storage of a {@link RedBlackTree}. Every node points to the structure that owns it rather than to the tree itself, so that two
 * trees may exchange their whole contents in constant time by exchanging structures.
 *
 * @param <E> The type of values stored in the structure
 */
final class TreeStructure<E> {
	RedBlackTree<E> theTree;
	RedBlackNode<E> theRoot;
	RedBlackNode<E> theFirst;
	RedBlackNode<E> theLast;
	int theSize;
	long theStructureStamp;

	TreeStructure(RedBlackTree<E> tree) {
		theTree = tree;
	}

	/** @return The tree currently holding this structure */
	RedBlackTree<E> getTree() {
		return theTree;
	}

	void setRoot(RedBlackNode<E> root) {
		theStructureStamp++;
		if (root == null)
			theFirst = theLast = null;
		theRoot = root;
	}
}
