//   QuadtreeIterator.java
//   Smart Quadtree Library
//
//  This library is free software; you can redistribute it and/or
//  modify it under the terms of the GNU Lesser General Public
//  License as published by the Free Software Foundation; either
//  version 2.1 of the License, or (at your option) any later version.
//
//  This library is distributed in the hope that it will be useful,
//  but WITHOUT ANY WARRANTY; without even the implied warranty of
//  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the GNU
//  Lesser General Public License for more details.
//
//  You should have received a copy of the GNU Lesser General Public
//  License along with this library; if not, write to the Free Software
//  Foundation, Inc., 59 Temple Place, Suite 330, Boston, MA  02111-1307  USA

package net.sf.smartquadtree.quadtree;

import gnu.trove.stack.TIntStack;
import gnu.trove.stack.array.TIntArrayStack;

import java.util.Iterator;
import java.util.NoSuchElementException;

import net.sf.smartquadtree.PolygonMask;
import net.sf.smartquadtree.Rectangle;

/**
 * Lazy depth-first iteration over the entries of a quadtree. Children are
 * visited NW, NE, SW, SE; entries of a leaf in insertion order.
 * <p>
 * If a mask is passed, subtrees whose region does not overlap it are skipped,
 * subtrees it covers completely are walked without further tests, and the
 * entries of leaves it only partly overlaps are tested one by one.
 * </p>
 * The quadtree must not be modified while an iterator is in use.
 */
class QuadtreeIterator<T> implements Iterator<T> {
	private static final int PARTIAL = 0;
	private static final int COVERED = 1;

	private final Quadtree<T> tree;
	private final PolygonMask mask;

	// node ids still to visit, and whether the mask covers each of them
	private final TIntStack parents = new TIntArrayStack();
	private final TIntStack parentsCoverage = new TIntArrayStack();

	private Node<T> leaf = null;
	private boolean leafCovered;
	private int entryIndex;

	private T next;
	private boolean nextReady = false;

	QuadtreeIterator(Quadtree<T> tree, PolygonMask mask) {
		this.tree = tree;
		this.mask = mask;
		Node<T> root = tree.getNode(tree.getRootNodeId());
		if (mask == null) {
			push(root.nodeId, COVERED);
		} else if (mask.overlaps(root.bounds)) {
			push(root.nodeId, mask.covers(root.bounds) ? COVERED : PARTIAL);
		}
	}

	private void push(int nodeId, int coverage) {
		parents.push(nodeId);
		parentsCoverage.push(coverage);
	}

	private boolean advance() {
		while (true) {
			if (leaf != null) {
				while (entryIndex < leaf.getEntryCount()) {
					int i = entryIndex++;
					if (leafCovered || mask.contains(leaf.getEntryX(i), leaf.getEntryY(i))) {
						next = leaf.getEntry(i);
						return true;
					}
				}
				leaf = null;
			}

			if (parents.size() == 0) {
				return false;
			}

			Node<T> n = tree.getNode(parents.pop());
			boolean covered = parentsCoverage.pop() == COVERED;

			if (n.isLeaf()) {
				leaf = n;
				leafCovered = covered;
				entryIndex = 0;
				continue;
			}

			// pushed in reverse, so that NW is popped first
			for (int q = n.childIds.length - 1; q >= 0; q--) {
				int childId = n.childIds[q];
				if (covered) {
					push(childId, COVERED);
				} else {
					Rectangle r = tree.getNode(childId).bounds;
					if (mask.overlaps(r)) {
						push(childId, mask.covers(r) ? COVERED : PARTIAL);
					}
				}
			}
		}
	}

	public boolean hasNext() {
		if (!nextReady) {
			nextReady = advance();
		}
		return nextReady;
	}

	public T next() {
		if (!hasNext()) {
			throw new NoSuchElementException();
		}
		nextReady = false;
		T result = next;
		next = null;
		return result;
	}

	public void remove() {
		throw new UnsupportedOperationException("Quadtree iterators are read only");
	}
}
