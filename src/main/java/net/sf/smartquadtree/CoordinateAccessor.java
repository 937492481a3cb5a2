//   CoordinateAccessor.java
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
 * Extracts the coordinates of a payload stored in a spatial index. One
 * implementation is needed per payload type; the index reads the coordinates
 * once, when the payload is inserted or explicitly updated.
 *
 * @param <T>
 *            the payload type
 */
public interface CoordinateAccessor<T> {

	double getX(T payload);

	double getY(T payload);

	/**
	 * Accessor for payloads that know their own position. Usable for any
	 * index of a {@link Locatable} subtype.
	 */
	static CoordinateAccessor<Locatable> locatable() {
		return LocatableAccessor.INSTANCE;
	}

	final class LocatableAccessor implements CoordinateAccessor<Locatable> {
		static final LocatableAccessor INSTANCE = new LocatableAccessor();

		private LocatableAccessor() {
		}

		public double getX(Locatable payload) {
			return payload.getX();
		}

		public double getY(Locatable payload) {
			return payload.getY();
		}
	}
}
