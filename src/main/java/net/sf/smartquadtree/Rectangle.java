//   Rectangle.java
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
 * Immutable axis-aligned rectangle, stored by its minimum and maximum corners.
 * Defines the territory of a quadtree node.
 */
public final class Rectangle {

	private final double minX, minY, maxX, maxY;

	/**
	 * Constructor.
	 *
	 * @param minX
	 *            minimum X coordinate of the rectangle
	 * @param minY
	 *            minimum Y coordinate of the rectangle
	 * @param maxX
	 *            maximum X coordinate of the rectangle
	 * @param maxY
	 *            maximum Y coordinate of the rectangle
	 *
	 * @throws IllegalArgumentException
	 *             if a coordinate is not finite or an extent is not strictly
	 *             positive
	 */
	public Rectangle(double minX, double minY, double maxX, double maxY) {
		if (!isFinite(minX) || !isFinite(minY) || !isFinite(maxX) || !isFinite(maxY)) {
			throw new IllegalArgumentException("Rectangle coordinates must be finite: [" + minX + ", " + minY
					+ ", " + maxX + ", " + maxY + "]");
		}
		if (!(maxX > minX) || !(maxY > minY)) {
			throw new IllegalArgumentException("Rectangle extents must be strictly positive: [" + minX + ", "
					+ minY + ", " + maxX + ", " + maxY + "]");
		}
		this.minX = minX;
		this.minY = minY;
		this.maxX = maxX;
		this.maxY = maxY;
	}

	/**
	 * Create a rectangle from its centre and half extents.
	 *
	 * @param centreX
	 *            X coordinate of the centre
	 * @param centreY
	 *            Y coordinate of the centre
	 * @param halfWidth
	 *            distance from the centre to the east and west edges
	 * @param halfHeight
	 *            distance from the centre to the north and south edges
	 */
	public static Rectangle fromCentre(double centreX, double centreY, double halfWidth, double halfHeight) {
		if (!(halfWidth > 0) || !(halfHeight > 0)) {
			throw new IllegalArgumentException("Half extents must be strictly positive: " + halfWidth + ", "
					+ halfHeight);
		}
		return new Rectangle(centreX - halfWidth, centreY - halfHeight, centreX + halfWidth, centreY + halfHeight);
	}

	private static boolean isFinite(double d) {
		return !Double.isNaN(d) && !Double.isInfinite(d);
	}

	public double getMinX() {
		return minX;
	}

	public double getMinY() {
		return minY;
	}

	public double getMaxX() {
		return maxX;
	}

	public double getMaxY() {
		return maxY;
	}

	/**
	 * X coordinate of the vertical line splitting this rectangle into its
	 * west and east quadrants.
	 */
	public double getCentreX() {
		return (minX + maxX) / 2.0;
	}

	/**
	 * Y coordinate of the horizontal line splitting this rectangle into its
	 * south and north quadrants.
	 */
	public double getCentreY() {
		return (minY + maxY) / 2.0;
	}

	public double getWidth() {
		return maxX - minX;
	}

	public double getHeight() {
		return maxY - minY;
	}

	public double getHalfWidth() {
		return getWidth() / 2.0;
	}

	public double getHalfHeight() {
		return getHeight() / 2.0;
	}

	/**
	 * Compute the area of this rectangle.
	 *
	 * @return The area of this rectangle
	 */
	public double area() {
		return getWidth() * getHeight();
	}

	public Point centre() {
		return new Point(getCentreX(), getCentreY());
	}

	/**
	 * Determine whether this rectangle contains the passed point. The
	 * rectangle is treated as closed: points on the edges are contained.
	 */
	public boolean contains(double x, double y) {
		return x >= minX && x <= maxX && y >= minY && y <= maxY;
	}

	/**
	 * Determine whether this rectangle contains the passed rectangle
	 *
	 * @param r
	 *            The rectangle that might be contained by this rectangle
	 *
	 * @return true if this rectangle contains the passed rectangle, false if it
	 *         does not
	 */
	public boolean contains(Rectangle r) {
		return r.minX >= minX && r.maxX <= maxX && r.minY >= minY && r.maxY <= maxY;
	}

	/**
	 * Determine whether this rectangle intersects the passed rectangle. Shared
	 * edges count as an intersection.
	 *
	 * @param r
	 *            The rectangle that might intersect this rectangle
	 *
	 * @return true if the rectangles intersect, false if they do not intersect
	 */
	public boolean intersects(Rectangle r) {
		return !(r.minX > maxX || r.maxX < minX || r.minY > maxY || r.maxY < minY);
	}

	/**
	 * Return the quarter of this rectangle lying in the passed quadrant. The
	 * quarters are built from the same minimum, centre and maximum values, so
	 * siblings share bit-identical edges and tile this rectangle exactly.
	 */
	public Rectangle quadrant(Quadrant q) {
		double midX = getCentreX();
		double midY = getCentreY();
		double x0 = q.isEast() ? midX : minX;
		double x1 = q.isEast() ? maxX : midX;
		double y0 = q.isNorth() ? midY : minY;
		double y1 = q.isNorth() ? maxY : midY;
		return new Rectangle(x0, y0, x1, y1);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		long bits = Double.doubleToLongBits(minX);
		result = prime * result + (int) (bits ^ (bits >>> 32));
		bits = Double.doubleToLongBits(minY);
		result = prime * result + (int) (bits ^ (bits >>> 32));
		bits = Double.doubleToLongBits(maxX);
		result = prime * result + (int) (bits ^ (bits >>> 32));
		bits = Double.doubleToLongBits(maxY);
		result = prime * result + (int) (bits ^ (bits >>> 32));
		return result;
	}

	/**
	 * Determine whether this rectangle is equal to a given object. Equality is
	 * determined by the bounds of the rectangle.
	 *
	 * @param o
	 *            The object to compare with this rectangle
	 */
	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Rectangle)) {
			return false;
		}
		Rectangle r = (Rectangle) o;
		return minX == r.minX && minY == r.minY && maxX == r.maxX && maxY == r.maxY;
	}

	@Override
	public String toString() {
		return "[(" + minX + ", " + minY + "), (" + maxX + ", " + maxY + ")]";
	}
}
