//   OutOfBoundsException.java
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
 * Thrown when a coordinate lies outside the territory of a spatial index.
 * The index is left unchanged; the caller may grow the index or drop the
 * point.
 */
public class OutOfBoundsException extends IllegalArgumentException {
	private static final long serialVersionUID = 4139761203475982116L;

	private final double x, y;

	public OutOfBoundsException(double x, double y, Rectangle bounds) {
		super("Point (" + x + ", " + y + ") is outside " + bounds);
		this.x = x;
		this.y = y;
	}

	public double getX() {
		return x;
	}

	public double getY() {
		return y;
	}
}
