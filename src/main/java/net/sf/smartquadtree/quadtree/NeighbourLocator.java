//   NeighbourLocator.java
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

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.stack.TIntStack;
import gnu.trove.stack.array.TIntArrayStack;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.sf.smartquadtree.Direction;
import net.sf.smartquadtree.Quadrant;
import net.sf.smartquadtree.Rectangle;

/**
 * <p>
 * Finds the leaves adjacent to a node across one of its edges, using only the
 * shape of the tree.
 * </p>
 *
 * <p>
 * The search climbs from the node towards the root while the step stays on
 * the outer side of each parent, remembering the quadrant taken at every
 * level. The first ancestor reached through a quadrant that does not touch
 * the edge is the common ancestor of the node and its neighbour. From there
 * the recorded quadrants are replayed downwards, each one mirrored across the
 * edge. Because every child is an exact quarter of its parent, the replayed
 * path ends on the region of the same size directly across the edge, or
 * earlier on a larger leaf covering it.
 * </p>
 */
class NeighbourLocator<T> {
	private static final Logger log = LoggerFactory.getLogger(NeighbourLocator.class);

	private static final Quadrant[] QUADRANTS = Quadrant.values();

	private final Quadtree<T> tree;

	NeighbourLocator(Quadtree<T> tree) {
		this.tree = tree;
	}

	/**
	 * @return the ids of the leaves touching the edge of the node facing the
	 *         passed direction, in NW, NE, SW, SE traversal order; empty if
	 *         that edge lies on the boundary of the tree
	 */
	TIntArrayList find(Node<T> node, Direction d) {
		TIntArrayList neighbours = new TIntArrayList();

		// N1 [Climb] Record quadrants until one does not exit its parent
		// towards d.
		TIntStack path = new TIntArrayStack();
		Node<T> ancestor = null;
		Node<T> n = node;
		while (n.parentId != Node.NO_NODE) {
			path.push(n.quadrant.ordinal());
			Node<T> parent = tree.getNode(n.parentId);
			if (!n.quadrant.exits(d)) {
				ancestor = parent;
				break;
			}
			n = parent;
		}

		if (ancestor == null) {
			if (log.isDebugEnabled()) {
				log.debug("No neighbour " + d + " of node " + node.nodeId + ": edge is on the tree boundary");
			}
			return neighbours;
		}

		// N2 [Mirrored descent] Replay the path reflected across the edge,
		// stopping at the first leaf.
		Node<T> m = ancestor;
		while (path.size() > 0 && !m.isLeaf()) {
			Quadrant q = QUADRANTS[path.pop()];
			m = tree.getNode(m.getChildId(q.mirror(d)));
		}

		if (m.isLeaf()) {
			neighbours.add(m.nodeId);
			return neighbours;
		}

		// N3 [Finer neighbour] The region across the edge is subdivided;
		// collect the leaves along its facing side.
		collectFacing(m, node.bounds, d, neighbours);
		return neighbours;
	}

	private void collectFacing(Node<T> m, Rectangle span, Direction d, TIntArrayList neighbours) {
		if (m.isLeaf()) {
			neighbours.add(m.nodeId);
			return;
		}
		Direction facing = d.opposite();
		for (Quadrant q : QUADRANTS) {
			if (!q.exits(facing)) {
				continue;
			}
			Node<T> child = tree.getNode(m.getChildId(q));
			if (overlapsAlong(child.bounds, span, d)) {
				collectFacing(child, span, d, neighbours);
			}
		}
	}

	/**
	 * Determine whether two rectangles overlap, with a positive length, along
	 * the axis of an edge facing the passed direction.
	 */
	static boolean overlapsAlong(Rectangle a, Rectangle b, Direction d) {
		if (d.isVertical()) {
			return Math.min(a.getMaxX(), b.getMaxX()) > Math.max(a.getMinX(), b.getMinX());
		}
		return Math.min(a.getMaxY(), b.getMaxY()) > Math.max(a.getMinY(), b.getMinY());
	}
}
