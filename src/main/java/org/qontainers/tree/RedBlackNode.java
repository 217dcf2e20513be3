package org.qontainers.tree;

import org.apache.log4j.Logger;

/**
 * A node in a red/black binary tree structure.
 *
 * This class does all the work of keeping itself balanced. It does not decide where values belong: {@link RedBlackTree} finds the
 * position for a value by descending with its comparator and then calls {@link #add(RedBlackNode, boolean) add}, which links the new node
 * adjacent to this one and rebalances. Removal through {@link #delete()} likewise only cares about structure.
 *
 * Besides the parent/left/right structure, every node keeps links to the nodes immediately before and after it in the tree's order, so
 * stepping an iterator is a constant-time operation.
 *
 * A node is owned by exactly one {@link TreeStructure} at a time. Nodes may be detached from one structure and re-linked into another (see
 * {@link RedBlackTree#merge(RedBlackTree)}), but they are never shared.
 *
 * @param <E> The type of value that the node holds
 */
public final class RedBlackNode<E> {
	private static final Logger log = Logger.getLogger(RedBlackNode.class);

	private TreeStructure<E> theOwner;
	private boolean isRed;
	private boolean isPresent;

	private RedBlackNode<E> theParent;
	private RedBlackNode<E> theLeft;
	private RedBlackNode<E> theRight;
	private RedBlackNode<E> theNext;
	private RedBlackNode<E> thePrevious;

	private final E theValue;

	RedBlackNode(TreeStructure<E> owner, E value) {
		theOwner = owner;
		isRed = true;
		theValue = value;
	}

	TreeStructure<E> getOwner() {
		return theOwner;
	}

	/** @return The tree that this node currently belongs (or last belonged) to */
	public RedBlackTree<E> getTree() {
		return theOwner.getTree();
	}

	/** @return This node's value */
	public E getValue() {
		return theValue;
	}

	/** @return Whether this node is red or black */
	public boolean isRed() {
		return isRed;
	}

	/** @return Whether this node is still linked into its tree */
	public boolean isPresent() {
		return isPresent;
	}

	/** @return The parent of this node in the tree structure. Will be null if and only if this node is the root (or an orphan). */
	public RedBlackNode<E> getParent() {
		return theParent;
	}

	/** @return The root of the tree structure holding this node */
	public RedBlackNode<E> getRoot() {
		RedBlackNode<E> root = this;
		while (root.theParent != null)
			root = root.theParent;
		return root;
	}

	/** @return The child node that is on the left of this node */
	public RedBlackNode<E> getLeft() {
		return theLeft;
	}

	/** @return The child node that is on the right of this node */
	public RedBlackNode<E> getRight() {
		return theRight;
	}

	/**
	 * @param left Whether to get the left or right child
	 * @return The left or right child of this node
	 */
	public RedBlackNode<E> getChild(boolean left) {
		return left ? theLeft : theRight;
	}

	/** @return Whether this node is on the right (false) or the left (true) of its parent. False for the root. */
	public boolean getSide() {
		if (theParent == null)
			return false;
		return this == theParent.theLeft;
	}

	/** @return The other child of this node's parent. Null if the parent is null. */
	public RedBlackNode<E> getSibling() {
		if (theParent == null)
			return null;
		else if (theParent.theLeft == this)
			return theParent.theRight;
		else
			return theParent.theLeft;
	}

	/**
	 * @param left Whether to get the closest node on the left or right
	 * @return The node immediately before (<code>left</code>) or after this node in the tree's order, or null if this node is the first
	 *         or last
	 */
	public RedBlackNode<E> getClosest(boolean left) {
		return left ? thePrevious : theNext;
	}

	/**
	 * @param left Whether to get the first node or the last node
	 * @return The first or last node in this sub-tree
	 */
	public RedBlackNode<E> getTerminal(boolean left) {
		RedBlackNode<E> parent = this;
		RedBlackNode<E> child = parent.getChild(left);
		while (child != null) {
			parent = child;
			child = parent.getChild(left);
		}
		return parent;
	}

	/**
	 * Runs debugging checks on this sub-tree structure to assure that its red/black and linkage constraints are currently met.
	 *
	 * @return The black height of this sub-tree, counting the null leaves below it
	 * @throws IllegalStateException If any constraint is violated
	 */
	int checkValid() {
		if (!isPresent)
			throw new IllegalStateException("(" + this + ") is linked but not marked present");
		if (theLeft != null && theLeft.theParent != this)
			throw new IllegalStateException("(" + this + "): left (" + theLeft + ")'s parent is not this");
		if (theRight != null && theRight.theParent != this)
			throw new IllegalStateException("(" + this + "): right (" + theRight + ")'s parent is not this");
		if (thePrevious != null && thePrevious.theNext != this)
			throw new IllegalStateException("(" + this + "): previous (" + thePrevious + ")'s next is not this");
		if (theNext != null && theNext.thePrevious != this)
			throw new IllegalStateException("(" + this + "): next (" + theNext + ")'s previous is not this");
		if (isRed && (isRed(theLeft) || isRed(theRight)))
			throw new IllegalStateException("Red node (" + this + ") has red children");
		int leftDepth = theLeft == null ? 1 : theLeft.checkValid();
		int rightDepth = theRight == null ? 1 : theRight.checkValid();
		if (leftDepth != rightDepth)
			throw new IllegalStateException("Different black depths under (" + this + "): " + leftDepth + " and " + rightDepth);
		return isRed ? leftDepth : leftDepth + 1;
	}

	private RedBlackNode<E> setParent(RedBlackNode<E> parent) {
		if (parent == this)
			throw new IllegalArgumentException("A tree node cannot be its own parent: " + parent);
		RedBlackNode<E> oldParent = theParent;
		theParent = parent;
		return oldParent;
	}

	private RedBlackNode<E> setChild(RedBlackNode<E> child, boolean left) {
		if (child == this)
			throw new IllegalArgumentException(
				"A tree node cannot have itself as a child: " + this + " (" + (left ? "left" : "right") + ")");
		RedBlackNode<E> oldChild;
		if (left) {
			oldChild = theLeft;
			theLeft = child;
		} else {
			oldChild = theRight;
			theRight = child;
		}
		if (child != null)
			child.setParent(this);
		return oldChild;
	}

	private void setRed(boolean red) {
		isRed = red;
	}

	/**
	 * Prepares an orphaned node to be linked into a (possibly different) structure
	 *
	 * @param owner The structure that will own this node
	 */
	void adopt(TreeStructure<E> owner) {
		if (isPresent)
			throw new IllegalStateException("Node " + this + " must be removed before it can be adopted");
		theOwner = owner;
		theParent = theLeft = theRight = null;
		theNext = thePrevious = null;
		isRed = true;
	}

	/** Makes this solitary node the root of its owner */
	void linkAsRoot() {
		isRed = false;
		isPresent = true;
		theOwner.setRoot(this);
		theOwner.theFirst = theOwner.theLast = this;
	}

	/** Marks this node as no longer present and drops its structural links, without any rebalancing. Used when clearing a whole tree. */
	void discard() {
		isPresent = false;
		theParent = theLeft = theRight = null;
		theNext = thePrevious = null;
	}

	/**
	 * Causes this node to switch places in the tree with the given node. Colors are switched as well, so the shape and coloring of the
	 * structure is unaffected. Each value stays with its node.
	 *
	 * @param node The node to switch places with
	 */
	private void switchWith(RedBlackNode<E> node) {
		if (node.theOwner != theOwner)
			throw new IllegalArgumentException("Can't mix nodes from different trees");
		boolean thisRed = isRed;
		setRed(node.isRed);
		node.setRed(thisRed);

		if (theParent == node) {
			boolean thisSide = getSide();
			RedBlackNode<E> sib = node.getChild(!thisSide);
			if (node.theParent != null)
				node.theParent.setChild(this, node.getSide());
			else
				setParent(null);
			node.setChild(theLeft, true);
			node.setChild(theRight, false);
			setChild(node, thisSide);
			setChild(sib, !thisSide);
		} else if (node.theParent == this) {
			boolean nodeSide = node.getSide();
			RedBlackNode<E> sib = getChild(!nodeSide);
			if (theParent != null)
				theParent.setChild(node, getSide());
			else
				node.setParent(null);
			setChild(node.theLeft, true);
			setChild(node.theRight, false);
			node.setChild(this, nodeSide);
			node.setChild(sib, !nodeSide);
		} else {
			boolean thisSide = getSide();
			RedBlackNode<E> temp = theParent;
			if (node.theParent != null)
				node.theParent.setChild(this, node.getSide());
			else
				setParent(null);
			if (temp != null)
				temp.setChild(node, thisSide);
			else
				node.setParent(null);

			temp = theLeft;
			setChild(node.theLeft, true);
			node.setChild(temp, true);
			temp = theRight;
			setChild(node.theRight, false);
			node.setChild(temp, false);
		}
	}

	/**
	 * Performs a rotation for balancing.
	 *
	 * @param left Whether to rotate left or right
	 * @return The new parent of this node
	 */
	private RedBlackNode<E> rotate(boolean left) {
		RedBlackNode<E> oldChild = getChild(!left);
		RedBlackNode<E> newChild = oldChild.getChild(left);
		RedBlackNode<E> oldParent = theParent;
		boolean oldSide = getSide();
		oldChild.setChild(this, left);
		setChild(newChild, !left);
		if (oldParent != null)
			oldParent.setChild(oldChild, oldSide);
		else
			oldChild.setParent(null);
		return oldChild;
	}

	/**
	 * Adds a new node into the tree, adjacent to this node in the structure's order, rebalancing if necessary
	 *
	 * @param node The node to add
	 * @param left The side on which to place the node
	 */
	void add(RedBlackNode<E> node, boolean left) {
		if (node.theOwner != theOwner)
			throw new IllegalArgumentException("Can't mix nodes from different trees");
		// First let's link up the next and previous fields
		if (left) {
			if (thePrevious != null)
				thePrevious.theNext = node;
			else
				theOwner.theFirst = node;
			node.thePrevious = thePrevious;
			thePrevious = node;
			node.theNext = this;
		} else {
			if (theNext != null)
				theNext.thePrevious = node;
			else
				theOwner.theLast = node;
			node.theNext = theNext;
			theNext = node;
			node.thePrevious = this;
		}

		RedBlackNode<E> parent = this;
		RedBlackNode<E> child = getChild(left);
		boolean childSide = child == null ? left : !left;
		while (child != null) {
			parent = child;
			child = parent.getChild(childSide);
		}
		parent.setChild(node, childSide);
		node.isPresent = true;
		theOwner.setRoot(fixAfterInsertion(node));
	}

	/** Removes this node (but not its children) from the tree, rebalancing if necessary */
	void delete() {
		if (!isPresent)
			throw new IllegalStateException("This node has already been removed");

		// First let's link up the next and previous fields
		if (theNext != null)
			theNext.thePrevious = thePrevious;
		else
			theOwner.theLast = thePrevious;
		if (thePrevious != null)
			thePrevious.theNext = theNext;
		else
			theOwner.theFirst = theNext;

		if (theLeft != null && theRight != null) {
			RedBlackNode<E> successor = theNext;
			switchWith(successor);
			// Now we've switched locations with successor, so we have either 0 or 1 children and can continue with delete
		}
		RedBlackNode<E> replacement = null;
		if (theLeft != null)
			replacement = theLeft;
		else if (theRight != null)
			replacement = theRight;

		RedBlackNode<E> newRoot;
		if (replacement != null) {
			if (theParent != null)
				theParent.setChild(replacement, getSide());
			else
				replacement.setParent(null);
			setParent(null);
			setChild(null, true);
			setChild(null, false);
			if (!isRed)
				newRoot = fixAfterDeletion(replacement);
			else
				newRoot = replacement.getRoot();
		} else if (theParent == null)
			newRoot = null;
		else {
			newRoot = isRed ? getRoot() : fixAfterDeletion(this);
			theParent.setChild(null, getSide());
			setParent(null);
		}
		if (newRoot != null)
			newRoot.setRed(false); // Root is black
		theOwner.setRoot(newRoot);
		isPresent = false;
		theNext = thePrevious = null;
	}

	@Override
	public String toString() {
		return new StringBuilder().append(theValue).append(" (").append(isRed ? "red" : "black").append(')').toString();
	}

	/** This is the rebalancing code from {@link java.util.TreeMap}, refactored for RedBlackNode. */
	private static <E> RedBlackNode<E> fixAfterInsertion(RedBlackNode<E> x) {
		while (x != null && isRed(x.theParent) && x.theParent.theParent != null) {
			boolean parentLeft = x.theParent.getSide();
			RedBlackNode<E> uncle = x.theParent.getSibling();
			if (isRed(uncle)) {
				if (log.isTraceEnabled())
					log.trace("Insert fixup at " + x + ": red uncle, recoloring");
				setRed(x.theParent, false);
				setRed(uncle, false);
				setRed(x.theParent.theParent, true);
				x = x.theParent.theParent;
			} else {
				if (parentLeft != x.getSide()) {
					if (log.isTraceEnabled())
						log.trace("Insert fixup at " + x + ": inner child, rotating " + (parentLeft ? "left" : "right") + " at parent");
					x = x.theParent;
					x.rotate(parentLeft);
				}
				if (log.isTraceEnabled())
					log.trace("Insert fixup at " + x + ": outer child, rotating " + (parentLeft ? "right" : "left") + " at grandparent");
				setRed(x.theParent, false);
				setRed(x.theParent.theParent, true);
				x.theParent.theParent.rotate(!parentLeft);
			}
		}
		RedBlackNode<E> root = x.getRoot();
		setRed(root, false);
		return root;
	}

	private static <E> RedBlackNode<E> fixAfterDeletion(RedBlackNode<E> node) {
		while (node.theParent != null && !isRed(node)) {
			boolean nodeLeft = node.getSide();
			RedBlackNode<E> sib = node.theParent.getChild(!nodeLeft);

			if (isRed(sib)) {
				if (log.isTraceEnabled())
					log.trace("Delete fixup at " + node + ": red sibling " + sib);
				setRed(sib, false);
				setRed(node.theParent, true);
				node.theParent.rotate(nodeLeft);
				sib = node.theParent.getChild(!nodeLeft);
			}
			if (sib == null || !isRed(sib.theLeft) && !isRed(sib.theRight)) {
				if (log.isTraceEnabled())
					log.trace("Delete fixup at " + node + ": black sibling with black children");
				setRed(sib, true);
				node = node.theParent;
			} else {
				if (!isRed(sib.getChild(!nodeLeft))) {
					if (log.isTraceEnabled())
						log.trace("Delete fixup at " + node + ": black sibling with red inner child");
					setRed(sib.getChild(nodeLeft), false);
					setRed(sib, true);
					sib.rotate(!nodeLeft);
					sib = node.theParent.getChild(!nodeLeft);
				}
				if (log.isTraceEnabled())
					log.trace("Delete fixup at " + node + ": black sibling with red outer child");
				setRed(sib, isRed(node.theParent));
				setRed(node.theParent, false);
				setRed(sib.getChild(!nodeLeft), false);
				node.theParent.rotate(nodeLeft);
				node = node.getRoot();
			}
		}

		setRed(node, false);
		return node.getRoot();
	}

	private static boolean isRed(RedBlackNode<?> node) {
		return node != null && node.isRed;
	}

	private static void setRed(RedBlackNode<?> node, boolean red) {
		if (node != null)
			node.setRed(red);
	}

	/**
	 * Creates a structural copy of a sub-tree for a new owner, with the same shape and colors
	 *
	 * @param <E> The type of the nodes
	 * @param root The root of the sub-tree to copy
	 * @param owner The structure that will own the copied nodes
	 * @return The root of the copy
	 */
	static <E> RedBlackNode<E> deepCopy(RedBlackNode<E> root, TreeStructure<E> owner) {
		RedBlackNode<E> copy = _deepCopy(root, owner, null, true, true);
		// The only thing the private method leaves undone is hooking up the next/previous links
		copy._hookUpAdjacentLinks(new RedBlackNode[2]);
		return copy;
	}

	private static <E> RedBlackNode<E> _deepCopy(RedBlackNode<E> node, TreeStructure<E> owner, RedBlackNode<E> parent,
		boolean mayBeFirst, boolean mayBeLast) {
		RedBlackNode<E> copy = new RedBlackNode<>(owner, node.theValue);
		copy.theParent = parent;
		copy.isPresent = true;
		if (node.theLeft != null)
			copy.theLeft = _deepCopy(node.theLeft, owner, copy, mayBeFirst, false);
		else if (mayBeFirst)
			owner.theFirst = copy;
		if (node.theRight != null)
			copy.theRight = _deepCopy(node.theRight, owner, copy, false, mayBeLast);
		else if (mayBeLast)
			owner.theLast = copy;

		copy.isRed = node.isRed;
		return copy;
	}

	private void _hookUpAdjacentLinks(RedBlackNode<E>[] bounds) {
		RedBlackNode<E> leftBound = bounds[0];
		RedBlackNode<E> rightBound = bounds[1];
		if (theLeft != null) {
			bounds[1] = this;
			theLeft._hookUpAdjacentLinks(bounds);
			thePrevious = bounds[1];
			leftBound = bounds[0];
		} else {
			thePrevious = leftBound;
			leftBound = this;
		}
		if (theRight != null) {
			bounds[0] = this;
			bounds[1] = rightBound;
			theRight._hookUpAdjacentLinks(bounds);
			theNext = bounds[0];
			rightBound = bounds[1];
		} else {
			theNext = rightBound;
			rightBound = this;
		}
		bounds[0] = leftBound;
		bounds[1] = rightBound;
	}

	/**
	 * Prints a tree in a way that indicates the position of each node in the tree
	 *
	 * @param tree The tree node to print
	 * @return The printed representation of the node
	 */
	public static String print(RedBlackNode<?> tree) {
		StringBuilder ret = new StringBuilder();
		print(tree, ret, 0);
		return ret.toString();
	}

	/**
	 * Prints a tree in a way that indicates the position of each node in the tree
	 *
	 * @param tree The tree node to print
	 * @param str The string builder to append the printed tree representation to
	 * @param indent The amount of indentation with which to indent the root of the tree
	 */
	public static void print(RedBlackNode<?> tree, StringBuilder str, int indent) {
		if (tree == null) {
			for (int i = 0; i < indent; i++)
				str.append('\t');
			str.append(tree).append('\n');
			return;
		}

		RedBlackNode<?> right = tree.getRight();
		if (right != null)
			print(right, str, indent + 1);

		for (int i = 0; i < indent; i++)
			str.append('\t');
		str.append(tree).append('\n');

		RedBlackNode<?> left = tree.getLeft();
		if (left != null)
			print(left, str, indent + 1);
	}
}
