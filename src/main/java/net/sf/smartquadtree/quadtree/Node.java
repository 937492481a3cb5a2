//   Node.java
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

import gnu.trove.list.array.TDoubleArrayList;

import java.util.ArrayList;

import net.sf.smartquadtree.Quadrant;
import net.sf.smartquadtree.Rectangle;

/**
 * <p>
 * Used by Quadtree. A node covers a rectangular region. While it is a leaf it
 * holds a bucket of entries in insertion order, together with the coordinates
 * read from each entry when it was stored. Once split it holds no entries and
 * instead refers to exactly four children, stored in the order NW, NE, SW,
 * SE.
 * </p>
 *
 * <p>
 * Parents and children are referred to by node id; the nodes themselves are
 * owned by the tree.
 * </p>
 */
public class Node<T> {
	static final int NO_NODE = -1;

	final int nodeId;
	final int parentId;
	final Rectangle bounds;
	final Quadrant quadrant;
	final int level;
	final long location;

	ArrayList<T> entries = new ArrayList<T>();
	TDoubleArrayList entriesX = new TDoubleArrayList();
	TDoubleArrayList entriesY = new TDoubleArrayList();

	int[] childIds = null;

	Node(int nodeId, int parentId, Rectangle bounds, Quadrant quadrant, int level, long location) {
		this.nodeId = nodeId;
		this.parentId = parentId;
		this.bounds = bounds;
		this.quadrant = quadrant;
		this.level = level;
		this.location = location;
	}

	void addEntry(T entry, double x, double y) {
		entries.add(entry);
		entriesX.add(x);
		entriesY.add(y);
	}

	// Return the index of the entry, matched by identity, or -1 if not found
	int findEntry(T entry) {
		for (int i = 0; i < entries.size(); i++) {
			if (entries.get(i) == entry) {
				return i;
			}
		}
		return -1;
	}

	// delete entry, keeping the remaining entries in insertion order
	void deleteEntry(int i) {
		entries.remove(i);
		entriesX.removeAt(i);
		entriesY.removeAt(i);
	}

	void clearEntries() {
		entries = new ArrayList<T>();
		entriesX = new TDoubleArrayList();
		entriesY = new TDoubleArrayList();
	}

	/**
	 * Select the child quadrant owning a point. Quadrant boundaries are half
	 * open: a point on the vertical centre line belongs to the east column,
	 * one on the horizontal centre line to the north row.
	 */
	Quadrant quadrantOf(double x, double y) {
		return Quadrant.of(x >= bounds.getCentreX(), y >= bounds.getCentreY());
	}

	public int getId() {
		return nodeId;
	}

	/**
	 * @return the id of the parent node, or -1 for the root
	 */
	public int getParentId() {
		return parentId;
	}

	public Rectangle getBounds() {
		return bounds;
	}

	/**
	 * @return the quadrant this node occupies in its parent, or null for the
	 *         root
	 */
	public Quadrant getQuadrant() {
		return quadrant;
	}

	/**
	 * @return the depth of this node; the root is at level 0
	 */
	public int getLevel() {
		return level;
	}

	/**
	 * @return the location code of this node: two bits per level, most
	 *         significant pair first, as defined by {@link Quadrant#code()}
	 */
	public long getLocation() {
		return location;
	}

	public boolean isLeaf() {
		return childIds == null;
	}

	/**
	 * @return the id of the child in the passed quadrant, or -1 for a leaf
	 */
	public int getChildId(Quadrant q) {
		if (childIds == null) {
			return NO_NODE;
		}
		return childIds[q.ordinal()];
	}

	public int getEntryCount() {
		return entries.size();
	}

	public T getEntry(int index) {
		return entries.get(index);
	}

	/**
	 * @return the X coordinate read from the entry when it was stored
	 */
	public double getEntryX(int index) {
		return entriesX.get(index);
	}

	/**
	 * @return the Y coordinate read from the entry when it was stored
	 */
	public double getEntryY(int index) {
		return entriesY.get(index);
	}

	@Override
	public String toString() {
		return "Node " + nodeId + " (level " + level + ", location 0x" + Long.toHexString(location) + ") "
				+ bounds;
	}
}
