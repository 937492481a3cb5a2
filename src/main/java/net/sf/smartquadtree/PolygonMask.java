//   PolygonMask.java
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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * <p>
 * A polygon restricting which part of a spatial index takes part in
 * iteration. The vertices are ordered and the polygon is implicitly closed:
 * the last vertex connects back to the first.
 * </p>
 *
 * <p>
 * Point containment uses the even-odd rule, so a self-intersecting polygon is
 * accepted, but the rectangle tests below are only exact for simple polygons.
 * </p>
 */
public final class PolygonMask {

	private final double[] xs, ys;

	// edge constants for the crossing test, see
	// http://alienryderflex.com/polygon/
	private final double[] constant, multiple;

	private final double minX, minY, maxX, maxY;

	public PolygonMask(double[] xs, double[] ys) {
		if (xs == null || ys == null) {
			throw new InvalidMaskException("Polygon coordinates must not be null");
		}
		if (xs.length != ys.length) {
			throw new InvalidMaskException("Polygon has " + xs.length + " x coordinates but " + ys.length
					+ " y coordinates");
		}
		if (xs.length < 3) {
			throw new InvalidMaskException("Polygon needs at least 3 vertices, got " + xs.length);
		}
		double lx = Double.POSITIVE_INFINITY, ly = Double.POSITIVE_INFINITY;
		double hx = Double.NEGATIVE_INFINITY, hy = Double.NEGATIVE_INFINITY;
		for (int i = 0; i < xs.length; i++) {
			if (Double.isNaN(xs[i]) || Double.isInfinite(xs[i]) || Double.isNaN(ys[i]) || Double.isInfinite(ys[i])) {
				throw new InvalidMaskException("Vertex " + i + " is not finite: (" + xs[i] + ", " + ys[i] + ")");
			}
			lx = Math.min(lx, xs[i]);
			ly = Math.min(ly, ys[i]);
			hx = Math.max(hx, xs[i]);
			hy = Math.max(hy, ys[i]);
		}
		this.xs = xs.clone();
		this.ys = ys.clone();
		this.minX = lx;
		this.minY = ly;
		this.maxX = hx;
		this.maxY = hy;
		this.constant = new double[xs.length];
		this.multiple = new double[xs.length];
		precompute();
	}

	public PolygonMask(Point... vertices) {
		this(xsOf(vertices), ysOf(vertices));
	}

	public PolygonMask(List<Point> vertices) {
		this(vertices == null ? null : vertices.toArray(new Point[vertices.size()]));
	}

	private static double[] xsOf(Point[] vertices) {
		if (vertices == null) {
			return null;
		}
		double[] xs = new double[vertices.length];
		for (int i = 0; i < vertices.length; i++) {
			xs[i] = vertices[i].getX();
		}
		return xs;
	}

	private static double[] ysOf(Point[] vertices) {
		if (vertices == null) {
			return null;
		}
		double[] ys = new double[vertices.length];
		for (int i = 0; i < vertices.length; i++) {
			ys[i] = vertices[i].getY();
		}
		return ys;
	}

	private void precompute() {
		int j = xs.length - 1;
		for (int i = 0; i < xs.length; i++) {
			if (ys[j] == ys[i]) {
				constant[i] = xs[i];
				multiple[i] = 0;
			} else {
				constant[i] = xs[i] - (ys[i] * xs[j]) / (ys[j] - ys[i]) + (ys[i] * xs[i]) / (ys[j] - ys[i]);
				multiple[i] = (xs[j] - xs[i]) / (ys[j] - ys[i]);
			}
			j = i;
		}
	}

	public int getVertexCount() {
		return xs.length;
	}

	public List<Point> getVertices() {
		List<Point> vertices = new ArrayList<Point>(xs.length);
		for (int i = 0; i < xs.length; i++) {
			vertices.add(new Point(xs[i], ys[i]));
		}
		return Collections.unmodifiableList(vertices);
	}

	/**
	 * Determine whether a point lies inside the polygon.
	 */
	public boolean contains(double x, double y) {
		if (x < minX || x > maxX || y < minY || y > maxY) {
			return false;
		}
		boolean oddNodes = false;
		int j = xs.length - 1;
		for (int i = 0; i < xs.length; i++) {
			if ((ys[i] < y && ys[j] >= y) || (ys[j] < y && ys[i] >= y)) {
				oddNodes ^= (y * multiple[i] + constant[i] < x);
			}
			j = i;
		}
		return oddNodes;
	}

	/**
	 * Determine whether the polygon and the passed rectangle share any part of
	 * the plane: a polygon edge crosses a rectangle edge, a rectangle corner is
	 * inside the polygon, or the rectangle contains a polygon vertex. Touching
	 * boundaries count as an overlap.
	 */
	public boolean overlaps(Rectangle r) {
		if (r.getMinX() > maxX || r.getMaxX() < minX || r.getMinY() > maxY || r.getMaxY() < minY) {
			return false;
		}
		for (int i = 0; i < xs.length; i++) {
			if (r.contains(xs[i], ys[i])) {
				return true;
			}
		}
		if (contains(r.getMinX(), r.getMinY()) || contains(r.getMaxX(), r.getMinY())
				|| contains(r.getMinX(), r.getMaxY()) || contains(r.getMaxX(), r.getMaxY())) {
			return true;
		}
		int j = xs.length - 1;
		for (int i = 0; i < xs.length; i++) {
			if (crossesBoundary(r, xs[j], ys[j], xs[i], ys[i], false)) {
				return true;
			}
			j = i;
		}
		return false;
	}

	/**
	 * Determine whether the passed rectangle lies entirely inside the polygon:
	 * every corner is inside, no vertex lies in the closed rectangle and no
	 * edge touches a rectangle edge. A polygon whose boundary only touches
	 * the rectangle is reported as not covering it.
	 */
	public boolean covers(Rectangle r) {
		if (r.getMinX() < minX || r.getMaxX() > maxX || r.getMinY() < minY || r.getMaxY() > maxY) {
			return false;
		}
		if (!contains(r.getMinX(), r.getMinY()) || !contains(r.getMaxX(), r.getMinY())
				|| !contains(r.getMinX(), r.getMaxY()) || !contains(r.getMaxX(), r.getMaxY())) {
			return false;
		}
		int j = xs.length - 1;
		for (int i = 0; i < xs.length; i++) {
			if (r.contains(xs[i], ys[i])) {
				return false;
			}
			if (crossesBoundary(r, xs[j], ys[j], xs[i], ys[i], false)) {
				return false;
			}
			j = i;
		}
		return true;
	}

	private static boolean crossesBoundary(Rectangle r, double ax, double ay, double bx, double by,
			boolean properOnly) {
		double x0 = r.getMinX(), y0 = r.getMinY(), x1 = r.getMaxX(), y1 = r.getMaxY();
		return segmentsIntersect(ax, ay, bx, by, x0, y0, x1, y0, properOnly)
				|| segmentsIntersect(ax, ay, bx, by, x1, y0, x1, y1, properOnly)
				|| segmentsIntersect(ax, ay, bx, by, x1, y1, x0, y1, properOnly)
				|| segmentsIntersect(ax, ay, bx, by, x0, y1, x0, y0, properOnly);
	}

	private static double orientation(double ax, double ay, double bx, double by, double cx, double cy) {
		return (bx - ax) * (cy - ay) - (by - ay) * (cx - ax);
	}

	private static boolean onSegment(double ax, double ay, double bx, double by, double cx, double cy) {
		return Math.min(ax, bx) <= cx && cx <= Math.max(ax, bx) && Math.min(ay, by) <= cy && cy <= Math.max(ay, by);
	}

	static boolean segmentsIntersect(double ax, double ay, double bx, double by, double cx, double cy, double dx,
			double dy, boolean properOnly) {
		double d1 = orientation(cx, cy, dx, dy, ax, ay);
		double d2 = orientation(cx, cy, dx, dy, bx, by);
		double d3 = orientation(ax, ay, bx, by, cx, cy);
		double d4 = orientation(ax, ay, bx, by, dx, dy);

		if (((d1 > 0 && d2 < 0) || (d1 < 0 && d2 > 0)) && ((d3 > 0 && d4 < 0) || (d3 < 0 && d4 > 0))) {
			return true;
		}
		if (properOnly) {
			return false;
		}
		return (d1 == 0 && onSegment(cx, cy, dx, dy, ax, ay)) || (d2 == 0 && onSegment(cx, cy, dx, dy, bx, by))
				|| (d3 == 0 && onSegment(ax, ay, bx, by, cx, cy)) || (d4 == 0 && onSegment(ax, ay, bx, by, dx, dy));
	}

	/**
	 * Clip this polygon against a rectangle with the Sutherland-Hodgman
	 * algorithm. The rectangle edges are processed left, right, bottom, top.
	 *
	 * @return the vertices of the clipped polygon; fewer than three vertices
	 *         means the polygon does not overlap the rectangle with a positive
	 *         area
	 */
	public List<Point> clip(Rectangle box) {
		List<Point> output = getVertices();
		for (int edge = 0; edge < 4; edge++) {
			List<Point> input = output;
			output = new ArrayList<Point>(input.size() + 4);
			if (input.isEmpty()) {
				break;
			}
			Point from = input.get(input.size() - 1);
			for (Point to : input) {
				if (!outside(box, edge, to)) {
					if (outside(box, edge, from)) {
						Point p = intersection(box, edge, from, to);
						if (!p.equals(to)) {
							output.add(p);
						}
					}
					output.add(to);
				} else if (!outside(box, edge, from)) {
					Point p = intersection(box, edge, from, to);
					if (!p.equals(from)) {
						output.add(p);
					}
				}
				from = to;
			}
		}
		return output;
	}

	private static boolean outside(Rectangle box, int edge, Point p) {
		switch (edge) {
		case 0:
			return p.getX() < box.getMinX();
		case 1:
			return p.getX() > box.getMaxX();
		case 2:
			return p.getY() < box.getMinY();
		default:
			return p.getY() > box.getMaxY();
		}
	}

	private static Point intersection(Rectangle box, int edge, Point a, Point b) {
		double x, y;
		switch (edge) {
		case 0:
		case 1:
			x = edge == 0 ? box.getMinX() : box.getMaxX();
			y = a.getY() + (x - a.getX()) / (b.getX() - a.getX()) * (b.getY() - a.getY());
			return new Point(x, y);
		default:
			y = edge == 2 ? box.getMinY() : box.getMaxY();
			x = a.getX() + (y - a.getY()) / (b.getY() - a.getY()) * (b.getX() - a.getX());
			return new Point(x, y);
		}
	}

	@Override
	public int hashCode() {
		return 31 * Arrays.hashCode(xs) + Arrays.hashCode(ys);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof PolygonMask)) {
			return false;
		}
		PolygonMask m = (PolygonMask) o;
		return Arrays.equals(xs, m.xs) && Arrays.equals(ys, m.ys);
	}

	@Override
	public String toString() {
		return "PolygonMask" + getVertices();
	}
}
