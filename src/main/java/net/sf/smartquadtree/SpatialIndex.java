//   SpatialIndex.java
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

import java.util.function.Consumer;

/**
 * Defines the public interfaces for implementing a point spatial index. The
 * index stores payloads at the coordinates read from them on insertion, and
 * lets callers restrict iteration to the part of the plane covered by a
 * {@link PolygonMask}.
 * <p>
 * Implementations are not thread safe. Callers that share an index must
 * serialize {@link #insert}, {@link #remove}, {@link #update} and
 * {@link #setMask} against every read.
 * </p>
 *
 * @param <T>
 *            the payload type
 */
public interface SpatialIndex<T> extends Iterable<T> {

	/**
	 * Adds a payload to the index at the coordinates it currently reports.
	 *
	 * @throws OutOfBoundsException
	 *             if the coordinates lie outside {@link #getBounds()}
	 */
	void insert(T payload);

	/**
	 * Removes one stored occurrence of the payload, matched by identity.
	 *
	 * @return true if the payload was found and removed
	 */
	boolean remove(T payload);

	/**
	 * Reads the coordinates of a stored payload again and moves it if it has
	 * left the region it was stored in.
	 *
	 * @return true if the payload changed region
	 * @throws OutOfBoundsException
	 *             if the new coordinates lie outside {@link #getBounds()}; the
	 *             payload then stays where it was
	 * @throws java.util.NoSuchElementException
	 *             if the payload is not stored in the index
	 */
	boolean update(T payload);

	/**
	 * Restricts iteration to the passed polygon, or removes the restriction
	 * if it is null.
	 */
	void setMask(PolygonMask mask);

	PolygonMask getMask();

	/**
	 * Calls the visitor for every payload inside the mask, or for every
	 * payload if no mask is set. The visitor must not modify the index.
	 */
	void iterate(Consumer<? super T> visitor);

	/**
	 * Returns the number of payloads stored in the index.
	 */
	int size();

	/**
	 * Returns the territory covered by the index.
	 */
	Rectangle getBounds();

	/**
	 * Returns a string identifying the type of spatial index, and the version
	 * number, eg "SimpleIndex-0.1"
	 */
	String getVersion();
}
