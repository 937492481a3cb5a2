//   PolygonMaskTest.java
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

package net.sf.smartquadtree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

public class PolygonMaskTest {

	private static final Rectangle BOX = Rectangle.fromCentre(0, 0, 10, 10);

	// a U shape, open to the north between x = 3 and x = 7
	private static final PolygonMask U = new PolygonMask(new Point(0, 0), new Point(10, 0), new Point(10, 10),
			new Point(7, 10), new Point(7, 3), new Point(3, 3), new Point(3, 10), new Point(0, 10));

	private static void assertVertices(List<Point> actual, double... xy) {
		assertEquals("vertex count of " + actual, xy.length / 2, actual.size());
		for (int i = 0; i < actual.size(); i++) {
			assertEquals("x of vertex " + i + " of " + actual, xy[2 * i], actual.get(i).getX(), 1e-9);
			assertEquals("y of vertex " + i + " of " + actual, xy[2 * i + 1], actual.get(i).getY(), 1e-9);
		}
	}

	@Test(expected = InvalidMaskException.class)
	public void testTwoVerticesRejected() {
		new PolygonMask(new Point(0, 0), new Point(1, 1));
	}

	@Test(expected = InvalidMaskException.class)
	public void testMismatchedCoordinatesRejected() {
		new PolygonMask(new double[] { 0, 1, 2 }, new double[] { 0, 1 });
	}

	@Test(expected = InvalidMaskException.class)
	public void testNonFiniteVertexRejected() {
		new PolygonMask(new double[] { 0, 1, Double.NaN }, new double[] { 0, 1, 0 });
	}

	@Test
	public void testContainsSquare() {
		PolygonMask square = new PolygonMask(new Point(-5, -5), new Point(-5, 5), new Point(5, 5), new Point(5, -5));
		assertTrue(square.contains(0, 0));
		assertTrue(square.contains(4.9, -4.9));
		assertFalse(square.contains(5.1, 0));
		assertFalse(square.contains(0, -6));
	}

	@Test
	public void testContainsConcave() {
		assertTrue(U.contains(1, 9));
		assertTrue(U.contains(8, 9));
		assertTrue(U.contains(5, 1));
		assertFalse(U.contains(5, 5));
		assertFalse(U.contains(11, 5));
	}

	@Test
	public void testOverlaps() {
		PolygonMask triangle = new PolygonMask(new Point(0, 0), new Point(10, 0), new Point(0, 10));
		// polygon inside rectangle
		assertTrue(triangle.overlaps(new Rectangle(-1, -1, 11, 11)));
		// rectangle inside polygon
		assertTrue(triangle.overlaps(new Rectangle(1, 1, 2, 2)));
		// edges crossing, no corner or vertex inside the other
		PolygonMask bar = new PolygonMask(new Point(-5, 1), new Point(5, 1), new Point(5, 2), new Point(-5, 2));
		assertTrue(bar.overlaps(new Rectangle(-1, -1, 1, 4)));
		// bounding boxes overlap, shapes do not
		assertFalse(triangle.overlaps(new Rectangle(6, 6, 9, 9)));
		// disjoint
		assertFalse(triangle.overlaps(new Rectangle(20, 20, 21, 21)));
		// the notch of the U
		assertFalse(U.overlaps(new Rectangle(4, 5, 6, 9)));
	}

	@Test
	public void testCovers() {
		assertTrue(U.covers(new Rectangle(1, 1, 8, 2)));
		assertTrue(U.covers(new Rectangle(0.5, 4, 2.5, 9)));
		// all corners inside, but the notch reaches into the rectangle
		assertFalse(U.covers(new Rectangle(1, 1, 9, 9)));
		assertFalse(U.covers(new Rectangle(4, 5, 6, 9)));
		assertFalse(U.covers(new Rectangle(-1, 1, 2, 2)));
	}

	@Test
	public void testCoversNotchWithVerticesOnRectangleEdges() {
		// square around [0,10]x[0,10] with a notch cut down to (5,0)
		PolygonMask notched = new PolygonMask(new Point(-5, -5), new Point(15, -5), new Point(15, 15),
				new Point(6, 15), new Point(6, 10), new Point(5, 0), new Point(4, 10), new Point(4, 15),
				new Point(-5, 15));
		Rectangle r = new Rectangle(0, 0, 10, 10);
		assertTrue(notched.contains(0, 0));
		assertTrue(notched.contains(10, 10));
		assertFalse(notched.contains(5, 8));

		assertTrue(notched.overlaps(r));
		assertFalse(notched.covers(r));
		// a rectangle whose edge is only touched by a polygon edge
		assertFalse(notched.covers(new Rectangle(0, 0, 4, 10)));
		assertTrue(notched.covers(new Rectangle(0, 0, 3, 10)));
	}

	@Test
	public void testClipTriangleIntersectingBox() {
		PolygonMask m = new PolygonMask(new Point(-5, -20), new Point(-15, 5), new Point(5, 5));
		assertVertices(m.clip(BOX), -1, -10, -9, -10, -10, -7.5, -10, 5, 5, 5);
	}

	@Test
	public void testClipPolygonSurroundingBox() {
		PolygonMask m = new PolygonMask(new Point(-15, -15), new Point(-15, 15), new Point(15, 15),
				new Point(15, -15));
		assertVertices(m.clip(BOX), 10, 10, 10, -10, -10, -10, -10, 10);
	}

	@Test
	public void testClipPolygonSharingEdgeWithBox() {
		PolygonMask m = new PolygonMask(new Point(-10, -5), new Point(-10, 5), new Point(15, 15),
				new Point(15, -15));
		assertVertices(m.clip(BOX), 10, 10, 10, -10, 2.5, -10, -10, -5, -10, 5, 2.5, 10);
	}

	@Test
	public void testClipDisjoint() {
		PolygonMask m = new PolygonMask(new Point(20, 20), new Point(30, 20), new Point(25, 30));
		assertTrue(m.clip(BOX).size() < 3);
	}

	@Test
	public void testEquality() {
		PolygonMask a = new PolygonMask(new double[] { 0, 1, 0 }, new double[] { 0, 0, 1 });
		PolygonMask b = new PolygonMask(new Point(0, 0), new Point(1, 0), new Point(0, 1));
		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
		assertEquals(3, a.getVertexCount());
		assertEquals(new Point(1, 0), a.getVertices().get(1));
	}
}
