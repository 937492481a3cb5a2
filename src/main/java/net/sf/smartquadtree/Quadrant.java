//   Quadrant.java
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

/**
 * The four quarters of a node, declared in the fixed order in which children
 * are stored and visited.
 * <p>
 * Each quadrant also has a two bit location code: bit 0 is set for the east
 * column and bit 1 for the north row, so SW = 0, SE = 1, NW = 2 and NE = 3.
 * </p>
 */
public enum Quadrant {
	NW(false, true), NE(true, true), SW(false, false), SE(true, false);

	private final boolean east;
	private final boolean north;

	Quadrant(boolean east, boolean north) {
		this.east = east;
		this.north = north;
	}

	public boolean isEast() {
		return east;
	}

	public boolean isNorth() {
		return north;
	}

	public int code() {
		return (north ? 2 : 0) | (east ? 1 : 0);
	}

	public static Quadrant fromCode(int code) {
		return of((code & 1) != 0, (code & 2) != 0);
	}

	public static Quadrant of(boolean east, boolean north) {
		if (north) {
			return east ? NE : NW;
		}
		return east ? SE : SW;
	}

	/**
	 * Determine whether stepping from this quadrant in the passed direction
	 * leaves the parent node. A north-west quadrant exits northwards and
	 * westwards, but stays inside its parent stepping east or south.
	 */
	public boolean exits(Direction d) {
		switch (d) {
		case NORTH:
			return north;
		case SOUTH:
			return !north;
		case EAST:
			return east;
		default:
			return !east;
		}
	}

	/**
	 * Reflect this quadrant across the axis perpendicular to the passed
	 * direction: NORTH and SOUTH flip the row, EAST and WEST flip the column.
	 */
	public Quadrant mirror(Direction d) {
		if (d.isVertical()) {
			return of(east, !north);
		}
		return of(!east, north);
	}
}
