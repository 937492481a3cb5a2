//   Quadtree.java
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
import gnu.trove.map.custom_hash.TObjectIntCustomHashMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import gnu.trove.stack.TIntStack;
import gnu.trove.stack.array.TIntArrayStack;
import gnu.trove.strategy.IdentityHashingStrategy;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Properties;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.sf.smartquadtree.BuildProperties;
import net.sf.smartquadtree.CoordinateAccessor;
import net.sf.smartquadtree.Direction;
import net.sf.smartquadtree.Locatable;
import net.sf.smartquadtree.OutOfBoundsException;
import net.sf.smartquadtree.Point;
import net.sf.smartquadtree.PolygonMask;
import net.sf.smartquadtree.Quadrant;
import net.sf.smartquadtree.Rectangle;
import net.sf.smartquadtree.SpatialIndex;

/**
 * <p>
 * A region quadtree over a fixed rectangle, specialised for scenes of many
 * moving points. Each leaf holds up to <i>capacity</i> entries; a leaf that
 * overflows is split into four equal quadrants and its entries are routed
 * one level down. Nodes never merge again.
 * </p>
 *
 * <p>
 * Nodes are kept in a map keyed by node id, and refer to their parent and
 * children by id. Node ids are the handles passed to
 * {@link #findNeighbours(int, Direction)}.
 * </p>
 *
 * <p>
 * Supported properties, read by {@link #Quadtree(Rectangle, Properties, CoordinateAccessor)}:
 * <ul>
 * <li>Capacity: the number of entries a leaf holds before it is split. The
 * default value of 16 is used if the property is not specified or is less
 * than 1.</li>
 * <li>MaxDepth: leaves at this level are never split and may hold more than
 * Capacity entries, which is how coincident points are stored. Defaults to
 * 24; values above 31 are reduced to 31.</li>
 * <li>MinCellSize: a leaf whose quadrants would be narrower or lower than this
 * value is never split either. Defaults to 0, i.e. no limit.</li>
 * </ul>
 * </p>
 *
 * <p>
 * This class is not thread safe.
 * </p>
 */
public class Quadtree<T> implements SpatialIndex<T> {
	private static final Logger log = LoggerFactory.getLogger(Quadtree.class);
	private static final Logger splitLog = LoggerFactory.getLogger(Quadtree.class.getName() + "-split");

	// parameters of the tree
	public final static int DEFAULT_CAPACITY = 16;
	public final static int DEFAULT_MAX_DEPTH = 24;
	public final static double DEFAULT_MIN_CELL_SIZE = 0;

	// two bits of the location code per level
	final static int MAX_SUPPORTED_DEPTH = 31;

	int capacity;
	int maxDepth;
	double minCellSize;

	// internal consistency checking - set to true if debugging tree corruption
	private final static boolean INTERNAL_CONSISTENCY_CHECKING = false;

	private final Rectangle bounds;
	private final CoordinateAccessor<? super T> accessor;
	private final NeighbourLocator<T> neighbourLocator = new NeighbourLocator<T>(this);

	// map of nodeId -> node object
	private TIntObjectHashMap<Node<T>> nodeMap = new TIntObjectHashMap<Node<T>>();

	// entry -> id of the leaf it was last stored in. Only a hint: it is
	// checked before use, as the same entry may be stored more than once.
	private TObjectIntCustomHashMap<T> entryLeaf = new TObjectIntCustomHashMap<T>(
			new IdentityHashingStrategy<T>(), 16, 0.5f, Node.NO_NODE);

	private final int rootNodeId = 0;
	private int highestUsedNodeId = rootNodeId;
	private int size = 0;

	private PolygonMask mask = null;

	/**
	 * Constructor.
	 *
	 * @param centreX
	 *            X coordinate of the centre of the covered territory
	 * @param centreY
	 *            Y coordinate of the centre of the covered territory
	 * @param halfWidth
	 *            distance from the centre to the east and west boundaries
	 * @param halfHeight
	 *            distance from the centre to the north and south boundaries
	 * @param capacity
	 *            number of entries a leaf holds before it is split
	 * @param accessor
	 *            reads the coordinates of the entries
	 */
	public Quadtree(double centreX, double centreY, double halfWidth, double halfHeight, int capacity,
			CoordinateAccessor<? super T> accessor) {
		this(Rectangle.fromCentre(centreX, centreY, halfWidth, halfHeight), properties(capacity), accessor);
	}

	/**
	 * Constructor. Use sensible defaults for every property missing from
	 * props, or for all of them if props is null.
	 */
	public Quadtree(Rectangle bounds, Properties props, CoordinateAccessor<? super T> accessor) {
		if (bounds == null) {
			throw new IllegalArgumentException("Quadtree bounds must not be null");
		}
		if (accessor == null) {
			throw new IllegalArgumentException("Quadtree coordinate accessor must not be null");
		}
		this.bounds = bounds;
		this.accessor = accessor;
		init(props);
	}

	/**
	 * Create a quadtree of entries that know their own coordinates.
	 */
	public static <T extends Locatable> Quadtree<T> create(double centreX, double centreY, double halfWidth,
			double halfHeight, int capacity) {
		return new Quadtree<T>(centreX, centreY, halfWidth, halfHeight, capacity,
				CoordinateAccessor.locatable());
	}

	private static Properties properties(int capacity) {
		Properties p = new Properties();
		p.setProperty("Capacity", Integer.toString(capacity));
		return p;
	}

	private void init(Properties props) {
		if (props == null) {
			capacity = DEFAULT_CAPACITY;
			maxDepth = DEFAULT_MAX_DEPTH;
			minCellSize = DEFAULT_MIN_CELL_SIZE;
		} else {
			capacity = Integer.parseInt(props.getProperty("Capacity", Integer.toString(DEFAULT_CAPACITY)));
			maxDepth = Integer.parseInt(props.getProperty("MaxDepth", Integer.toString(DEFAULT_MAX_DEPTH)));
			minCellSize = Double.parseDouble(props.getProperty("MinCellSize",
					Double.toString(DEFAULT_MIN_CELL_SIZE)));

			// A leaf that cannot hold a single entry would split forever.
			if (capacity < 1) {
				log.warn("Invalid Capacity = " + capacity + " Resetting to default value of " + DEFAULT_CAPACITY);
				capacity = DEFAULT_CAPACITY;
			}

			if (maxDepth < 0) {
				log.warn("Invalid MaxDepth = " + maxDepth + " Resetting to default value of " + DEFAULT_MAX_DEPTH);
				maxDepth = DEFAULT_MAX_DEPTH;
			} else if (maxDepth > MAX_SUPPORTED_DEPTH) {
				log.warn("MaxDepth must be at most " + MAX_SUPPORTED_DEPTH);
				maxDepth = MAX_SUPPORTED_DEPTH;
			}

			if (!(minCellSize >= 0) || Double.isInfinite(minCellSize)) {
				log.warn("Invalid MinCellSize = " + minCellSize + " Resetting to default value of "
						+ DEFAULT_MIN_CELL_SIZE);
				minCellSize = DEFAULT_MIN_CELL_SIZE;
			}
		}

		Node<T> root = new Node<T>(rootNodeId, Node.NO_NODE, bounds, null, 0, 0L);
		nodeMap.put(rootNodeId, root);

		log.debug("init() " + " Capacity = " + capacity + ", MaxDepth = " + maxDepth + ", MinCellSize = "
				+ minCellSize + ", bounds = " + bounds);
	}

	// -------------------------------------------------------------------------
	// public implementation of SpatialIndex interface:
	// insert(T)
	// remove(T)
	// update(T)
	// setMask(PolygonMask)
	// iterate(Consumer)
	// size()
	// -------------------------------------------------------------------------
	/**
	 * @see net.sf.smartquadtree.SpatialIndex#insert(Object)
	 */
	public void insert(T entry) {
		double x = accessor.getX(entry);
		double y = accessor.getY(entry);
		if (!bounds.contains(x, y)) {
			throw new OutOfBoundsException(x, y, bounds);
		}

		if (log.isDebugEnabled()) {
			log.debug("Adding entry " + entry + " at (" + x + ", " + y + ")");
		}

		addToLeaf(chooseLeaf(x, y), entry, x, y);
		size++;

		if (INTERNAL_CONSISTENCY_CHECKING) {
			checkConsistency();
		}
	}

	/**
	 * @see net.sf.smartquadtree.SpatialIndex#remove(Object)
	 */
	public boolean remove(T entry) {
		int leafId = findLeafOf(entry);
		if (leafId == Node.NO_NODE) {
			return false;
		}
		Node<T> leaf = getNode(leafId);
		leaf.deleteEntry(leaf.findEntry(entry));
		entryLeaf.remove(entry);
		size--;

		if (INTERNAL_CONSISTENCY_CHECKING) {
			checkConsistency();
		}
		return true;
	}

	/**
	 * @see net.sf.smartquadtree.SpatialIndex#update(Object)
	 */
	public boolean update(T entry) {
		int leafId = findLeafOf(entry);
		if (leafId == Node.NO_NODE) {
			throw new NoSuchElementException("Entry " + entry + " is not stored in this quadtree");
		}
		double x = accessor.getX(entry);
		double y = accessor.getY(entry);
		if (!bounds.contains(x, y)) {
			throw new OutOfBoundsException(x, y, bounds);
		}

		Node<T> leaf = getNode(leafId);
		int index = leaf.findEntry(entry);
		Node<T> target = chooseLeaf(x, y);
		if (target == leaf) {
			leaf.entriesX.set(index, x);
			leaf.entriesY.set(index, y);
			return false;
		}

		if (log.isDebugEnabled()) {
			log.debug("Moving entry " + entry + " from node " + leaf.nodeId + " to node " + target.nodeId);
		}
		leaf.deleteEntry(index);
		addToLeaf(target, entry, x, y);

		if (INTERNAL_CONSISTENCY_CHECKING) {
			checkConsistency();
		}
		return true;
	}

	/**
	 * Restricts iteration to the passed polygon, or removes the restriction
	 * if it is null.
	 *
	 * @see net.sf.smartquadtree.SpatialIndex#setMask(PolygonMask)
	 */
	public void setMask(PolygonMask mask) {
		if (log.isDebugEnabled()) {
			log.debug("setMask() " + mask);
		}
		this.mask = mask;
	}

	/**
	 * Restricts iteration to the polygon with the passed vertices. An empty
	 * or null vertex list removes the restriction.
	 *
	 * @throws net.sf.smartquadtree.InvalidMaskException
	 *             if one or two vertices are passed; the current mask is kept
	 */
	public void setMask(Point... vertices) {
		if (vertices == null || vertices.length == 0) {
			clearMask();
		} else {
			setMask(new PolygonMask(vertices));
		}
	}

	public void clearMask() {
		setMask((PolygonMask) null);
	}

	public PolygonMask getMask() {
		return mask;
	}

	/**
	 * @see net.sf.smartquadtree.SpatialIndex#iterate(Consumer)
	 */
	public void iterate(Consumer<? super T> visitor) {
		for (T entry : this) {
			visitor.accept(entry);
		}
	}

	/**
	 * Returns a new iterator over the entries inside the current mask. The
	 * mask in force when this method is called applies for the lifetime of
	 * the iterator.
	 */
	public Iterator<T> iterator() {
		return new QuadtreeIterator<T>(this, mask);
	}

	/**
	 * @see net.sf.smartquadtree.SpatialIndex#size()
	 */
	public int size() {
		return size;
	}

	/**
	 * @see net.sf.smartquadtree.SpatialIndex#getBounds()
	 */
	public Rectangle getBounds() {
		return bounds;
	}

	/**
	 * @see net.sf.smartquadtree.SpatialIndex#getVersion()
	 */
	public String getVersion() {
		return "Quadtree-" + BuildProperties.getVersion();
	}

	// -------------------------------------------------------------------------
	// end of SpatialIndex methods
	// -------------------------------------------------------------------------

	/**
	 * Find the leaves adjacent to a node across the edge facing the passed
	 * direction. If the region across the edge is covered by a single leaf,
	 * larger than or as large as the node, that leaf is returned; if it is
	 * subdivided further, every leaf touching the edge is returned, in NW, NE,
	 * SW, SE traversal order. The result is empty if the edge lies on the
	 * boundary of the tree, and always for the root.
	 *
	 * @param nodeId
	 *            id of a node of this tree, usually a leaf
	 */
	public TIntArrayList findNeighbours(int nodeId, Direction direction) {
		Node<T> n = getNode(nodeId);
		if (n == null) {
			throw new IllegalArgumentException("No node with id " + nodeId);
		}
		return neighbourLocator.find(n, direction);
	}

	/**
	 * Get the id of the leaf owning the passed coordinates.
	 *
	 * @throws OutOfBoundsException
	 *             if the coordinates lie outside the tree
	 */
	public int locate(double x, double y) {
		if (!bounds.contains(x, y)) {
			throw new OutOfBoundsException(x, y, bounds);
		}
		return chooseLeaf(x, y).nodeId;
	}

	/**
	 * Get the node with the passed location code at the passed level, or its
	 * deepest existing ancestor if the tree is not subdivided that far.
	 *
	 * @param location
	 *            location code, as returned by {@link Node#getLocation()}
	 * @param level
	 *            level of the requested node
	 */
	public int getQuadrant(long location, int level) {
		if (level < 0 || level > MAX_SUPPORTED_DEPTH) {
			throw new IllegalArgumentException("Invalid level " + level);
		}
		Node<T> n = getNode(rootNodeId);
		for (int i = level - 1; i >= 0 && !n.isLeaf(); i--) {
			int code = (int) ((location >>> (2 * i)) & 3);
			n = getNode(n.getChildId(Quadrant.fromCode(code)));
		}
		return n.nodeId;
	}

	/**
	 * Get a node object, given the ID of the node.
	 */
	public Node<T> getNode(int id) {
		return nodeMap.get(id);
	}

	/**
	 * Get the root node ID
	 */
	public int getRootNodeId() {
		return rootNodeId;
	}

	public int getCapacity() {
		return capacity;
	}

	public int getMaxDepth() {
		return maxDepth;
	}

	public double getMinCellSize() {
		return minCellSize;
	}

	/**
	 * @return the number of nodes, leaves and internal nodes, in the tree
	 */
	public int getNodeCount() {
		return nodeMap.size();
	}

	/**
	 * @return the level of the deepest leaf; 0 if the root was never split
	 */
	public int getDepth() {
		int depth = 0;
		for (Node<T> n : nodeMap.valueCollection()) {
			if (n.level > depth) {
				depth = n.level;
			}
		}
		return depth;
	}

	/**
	 * @return the number of entries in the fullest leaf
	 */
	public int getMaxBucketSize() {
		int max = 0;
		for (Node<T> n : nodeMap.valueCollection()) {
			if (n.entries.size() > max) {
				max = n.entries.size();
			}
		}
		return max;
	}

	public int getLeafCount() {
		return leaves().size();
	}

	/**
	 * @return the ids of all leaves, in NW, NE, SW, SE traversal order
	 */
	public TIntArrayList leaves() {
		TIntArrayList leaves = new TIntArrayList();
		TIntStack parents = new TIntArrayStack();
		parents.push(rootNodeId);
		while (parents.size() > 0) {
			Node<T> n = getNode(parents.pop());
			if (n.isLeaf()) {
				leaves.add(n.nodeId);
			} else {
				for (int q = n.childIds.length - 1; q >= 0; q--) {
					parents.push(n.childIds[q]);
				}
			}
		}
		return leaves;
	}

	private int getNextNodeId() {
		return ++highestUsedNodeId;
	}

	/**
	 * Descend from the root to the leaf owning the passed coordinates.
	 */
	private Node<T> chooseLeaf(double x, double y) {
		Node<T> n = getNode(rootNodeId);
		while (!n.isLeaf()) {
			n = getNode(n.getChildId(n.quadrantOf(x, y)));
		}
		return n;
	}

	private void addToLeaf(Node<T> leaf, T entry, double x, double y) {
		leaf.addEntry(entry, x, y);
		entryLeaf.put(entry, leaf.nodeId);
		if (leaf.getEntryCount() > capacity) {
			splitNode(leaf);
		}
	}

	/**
	 * A node may be split unless it is at the maximum depth, its quadrants
	 * would be smaller than the minimum cell size, or its centre can no longer
	 * be separated from its edges in double precision.
	 */
	boolean canSplit(Node<T> n) {
		if (n.level >= maxDepth) {
			return false;
		}
		Rectangle r = n.bounds;
		if (r.getHalfWidth() < minCellSize || r.getHalfHeight() < minCellSize) {
			return false;
		}
		double cx = r.getCentreX();
		double cy = r.getCentreY();
		return cx > r.getMinX() && cx < r.getMaxX() && cy > r.getMinY() && cy < r.getMaxY();
	}

	/**
	 * Split a leaf into four quadrants and route its entries into them.
	 * Quadrants that overflow in turn are split as well.
	 */
	private void splitNode(Node<T> n) {
		if (!canSplit(n)) {
			if (splitLog.isDebugEnabled()) {
				splitLog.debug("Node " + n.nodeId + " at level " + n.level + " cannot be split further; holding "
						+ n.getEntryCount() + " entries with capacity " + capacity);
			}
			return;
		}

		int[] childIds = new int[4];
		ArrayList<Node<T>> children = new ArrayList<Node<T>>(4);
		for (Quadrant q : Quadrant.values()) {
			Node<T> child = new Node<T>(getNextNodeId(), n.nodeId, n.bounds.quadrant(q), q, n.level + 1,
					(n.location << 2) | q.code());
			nodeMap.put(child.nodeId, child);
			childIds[q.ordinal()] = child.nodeId;
			children.add(child);
		}

		for (int i = 0; i < n.getEntryCount(); i++) {
			double x = n.entriesX.get(i);
			double y = n.entriesY.get(i);
			Node<T> child = children.get(n.quadrantOf(x, y).ordinal());
			T entry = n.entries.get(i);
			child.addEntry(entry, x, y);
			entryLeaf.put(entry, child.nodeId);
		}
		n.clearEntries();
		n.childIds = childIds;

		if (splitLog.isDebugEnabled()) {
			splitLog.debug("Node " + n.nodeId + " split into " + children.get(0).getEntryCount() + "/"
					+ children.get(1).getEntryCount() + "/" + children.get(2).getEntryCount() + "/"
					+ children.get(3).getEntryCount() + " entries (NW/NE/SW/SE)");
		}

		for (Node<T> child : children) {
			if (child.getEntryCount() > capacity) {
				splitNode(child);
			}
		}
	}

	/**
	 * Find the leaf storing the passed entry, or -1.
	 */
	private int findLeafOf(T entry) {
		int leafId = entryLeaf.get(entry);
		if (leafId != Node.NO_NODE) {
			Node<T> n = getNode(leafId);
			if (n != null && n.isLeaf() && n.findEntry(entry) != -1) {
				return leafId;
			}
		}

		// the hint is missing or stale: look in every leaf
		TIntArrayList leaves = leaves();
		for (int i = 0; i < leaves.size(); i++) {
			Node<T> n = getNode(leaves.get(i));
			if (n.findEntry(entry) != -1) {
				entryLeaf.put(entry, n.nodeId);
				return n.nodeId;
			}
		}
		entryLeaf.remove(entry);
		return Node.NO_NODE;
	}

	/**
	 * Check the consistency of the tree.
	 *
	 * @return false if an inconsistency is detected, true otherwise.
	 */
	public boolean checkConsistency() {
		int[] entryCount = new int[1];
		if (!checkConsistency(rootNodeId, Node.NO_NODE, 0, bounds, 0L, entryCount)) {
			return false;
		}
		if (entryCount[0] != size) {
			log.error("Error: tree holds " + entryCount[0] + " entries, but size is " + size);
			return false;
		}
		return true;
	}

	private boolean checkConsistency(int nodeId, int expectedParentId, int expectedLevel, Rectangle expectedBounds,
			long expectedLocation, int[] entryCount) {
		// go through the tree, and check that the internal data structures of
		// the tree are not corrupted.
		Node<T> n = getNode(nodeId);

		if (n == null) {
			log.error("Error: Could not read node " + nodeId);
			return false;
		}

		if (n.parentId != expectedParentId) {
			log.error("Error: Node " + nodeId + ", expected parent " + expectedParentId + ", actual parent "
					+ n.parentId);
			return false;
		}

		if (n.level != expectedLevel) {
			log.error("Error: Node " + nodeId + ", expected level " + expectedLevel + ", actual level " + n.level);
			return false;
		}

		if (!n.bounds.equals(expectedBounds)) {
			log.error("Error: Node " + nodeId + ", expected bounds " + expectedBounds + ", actual bounds "
					+ n.bounds);
			return false;
		}

		if (n.location != expectedLocation) {
			log.error("Error: Node " + nodeId + ", expected location 0x" + Long.toHexString(expectedLocation)
					+ ", actual location 0x" + Long.toHexString(n.location));
			return false;
		}

		if (n.entries.size() != n.entriesX.size() || n.entries.size() != n.entriesY.size()) {
			log.error("Error: Node " + nodeId + " has " + n.entries.size() + " entries but "
					+ n.entriesX.size() + "/" + n.entriesY.size() + " coordinates");
			return false;
		}

		if (!n.isLeaf()) {
			if (n.getEntryCount() != 0) {
				log.error("Error: internal node " + nodeId + " holds " + n.getEntryCount() + " entries");
				return false;
			}
			for (Quadrant q : Quadrant.values()) {
				if (!checkConsistency(n.getChildId(q), nodeId, expectedLevel + 1, n.bounds.quadrant(q),
						(expectedLocation << 2) | q.code(), entryCount)) {
					return false;
				}
			}
			return true;
		}

		if (n.getEntryCount() > capacity && canSplit(n)) {
			log.error("Error: Leaf " + nodeId + " holds " + n.getEntryCount() + " entries, more than capacity "
					+ capacity);
			return false;
		}

		for (int i = 0; i < n.getEntryCount(); i++) {
			if (n.quadrant != null && !ownsPoint(n, n.entriesX.get(i), n.entriesY.get(i))) {
				log.error("Error: Leaf " + nodeId + ", entry " + i + " at (" + n.entriesX.get(i) + ", "
						+ n.entriesY.get(i) + ") is outside the leaf");
				return false;
			}
		}
		entryCount[0] += n.getEntryCount();
		return true;
	}

	private boolean ownsPoint(Node<T> n, double x, double y) {
		return chooseLeaf(x, y) == n;
	}
}
