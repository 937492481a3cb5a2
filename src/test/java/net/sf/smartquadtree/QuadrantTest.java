//   QuadrantTest.java
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

import org.junit.Test;

public class QuadrantTest {

	@Test
	public void testLocationCodes() {
		assertEquals(0, Quadrant.SW.code());
		assertEquals(1, Quadrant.SE.code());
		assertEquals(2, Quadrant.NW.code());
		assertEquals(3, Quadrant.NE.code());
		for (Quadrant q : Quadrant.values()) {
			assertEquals(q, Quadrant.fromCode(q.code()));
		}
	}

	@Test
	public void testExits() {
		assertTrue(Quadrant.NW.exits(Direction.NORTH));
		assertTrue(Quadrant.NW.exits(Direction.WEST));
		assertFalse(Quadrant.NW.exits(Direction.EAST));
		assertFalse(Quadrant.NW.exits(Direction.SOUTH));
		assertTrue(Quadrant.SE.exits(Direction.SOUTH));
		assertTrue(Quadrant.SE.exits(Direction.EAST));
		assertFalse(Quadrant.SE.exits(Direction.NORTH));
		assertFalse(Quadrant.SE.exits(Direction.WEST));
	}

	@Test
	public void testMirror() {
		assertEquals(Quadrant.SW, Quadrant.NW.mirror(Direction.NORTH));
		assertEquals(Quadrant.SW, Quadrant.NW.mirror(Direction.SOUTH));
		assertEquals(Quadrant.NE, Quadrant.NW.mirror(Direction.EAST));
		assertEquals(Quadrant.NE, Quadrant.NW.mirror(Direction.WEST));
		assertEquals(Quadrant.NE, Quadrant.SE.mirror(Direction.NORTH));
		assertEquals(Quadrant.SW, Quadrant.SE.mirror(Direction.WEST));
	}

	@Test
	public void testOpposite() {
		for (Direction d : Direction.values()) {
			assertEquals(d, d.opposite().opposite());
			assertEquals(d.isVertical(), d.opposite().isVertical());
		}
		assertEquals(Direction.SOUTH, Direction.NORTH.opposite());
		assertEquals(Direction.WEST, Direction.EAST.opposite());
	}
}
