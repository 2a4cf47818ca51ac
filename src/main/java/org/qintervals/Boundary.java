package org.qintervals;

import java.util.Comparator;
import java.util.Objects;

/**
 * A cut in an ordered set of values, immediately {@link Side#BELOW below} or immediately {@link Side#ABOVE above} a reference value. No
 * value can sit on a boundary, so a boundary carries the open/closed semantics of an interval end without being a value itself.
 *
 * @param <V> The type of values in the domain
 */
public final class Boundary<V> {
	/** Which side of its reference value a boundary is on */
	public enum Side {
		/** The cut immediately preceding the value */
		BELOW,
		/** The cut immediately following the value */
		ABOVE;
	}

	private final V theValue;
	private final Side theSide;

	private Boundary(V value, Side side) {
		theValue = Objects.requireNonNull(value, "Boundary value");
		theSide = side;
	}

	/**
	 * @param <V> The type of the value
	 * @param value The value
	 * @return The boundary immediately below the value. An interval starting here includes the value.
	 */
	public static <V> Boundary<V> below(V value) {
		return new Boundary<>(value, Side.BELOW);
	}

	/**
	 * @param <V> The type of the value
	 * @param value The value
	 * @return The boundary immediately above the value. An interval ending here includes the value.
	 */
	public static <V> Boundary<V> above(V value) {
		return new Boundary<>(value, Side.ABOVE);
	}

	/** @return The value this boundary is next to */
	public V getValue() {
		return theValue;
	}

	/** @return Which side of its {@link #getValue() value} this boundary is on */
	public Side getSide() {
		return theSide;
	}

	/** @return Whether this boundary is immediately below its value */
	public boolean isBelowValue() {
		return theSide == Side.BELOW;
	}

	/** @return Whether this boundary is immediately above its value */
	public boolean isAboveValue() {
		return theSide == Side.ABOVE;
	}

	/**
	 * Compares the positions of two cuts. In a discrete domain, <code>above(v)</code> and <code>below(next(v))</code> are the same cut and
	 * compare as equal. In a dense domain, two boundaries are only equal if both their values and their sides are.
	 *
	 * @param other The boundary to compare with
	 * @param domain The domain of the values
	 * @return
	 *         <ul>
	 *         <li><b>&lt;0</b> if this cut is before the other</li>
	 *         <li><b>0</b> if both are the same cut</li>
	 *         <li><b>&gt;0</b> if this cut is after the other</li>
	 *         </ul>
	 */
	public int compareTo(Boundary<V> other, OrderedDomain<V> domain) {
		if (theSide == other.theSide)
			return domain.compare(theValue, other.theValue);
		int comp = domain.compare(theValue, other.theValue);
		if (theSide == Side.BELOW) {
			if (comp > 0)
				return domain.isAdjacent(other.theValue, theValue) ? 0 : 1;
			return -1;
		} else {
			if (comp < 0)
				return domain.isAdjacent(theValue, other.theValue) ? 0 : -1;
			return 1;
		}
	}

	/**
	 * @param value The value to test
	 * @param compare The comparator of the domain
	 * @return Whether this cut lies before the given value
	 */
	public boolean isBelow(V value, Comparator<? super V> compare) {
		int comp = compare.compare(theValue, value);
		return theSide == Side.BELOW ? comp <= 0 : comp < 0;
	}

	/**
	 * @param value The value to test
	 * @param compare The comparator of the domain
	 * @return Whether this cut lies after the given value
	 */
	public boolean isAbove(V value, Comparator<? super V> compare) {
		int comp = compare.compare(value, theValue);
		return theSide == Side.BELOW ? comp < 0 : comp <= 0;
	}

	/**
	 * @param domain The domain of the values
	 * @return The least value above this cut
	 * @throws DomainException If this boundary is above a value with no successor in the domain
	 */
	public V valueAbove(OrderedDomain<V> domain) throws DomainException {
		return theSide == Side.BELOW ? theValue : domain.next(theValue);
	}

	/**
	 * @param domain The domain of the values
	 * @return The greatest value below this cut
	 * @throws DomainException If this boundary is below a value with no predecessor in the domain
	 */
	public V valueBelow(OrderedDomain<V> domain) throws DomainException {
		return theSide == Side.ABOVE ? theValue : domain.previous(theValue);
	}

	/**
	 * @param <V> The type of the values
	 * @param b1 One boundary
	 * @param b2 The other boundary
	 * @param domain The domain of the values
	 * @return The lesser of the two cuts
	 */
	public static <V> Boundary<V> min(Boundary<V> b1, Boundary<V> b2, OrderedDomain<V> domain) {
		return b1.compareTo(b2, domain) <= 0 ? b1 : b2;
	}

	/**
	 * @param <V> The type of the values
	 * @param b1 One boundary
	 * @param b2 The other boundary
	 * @param domain The domain of the values
	 * @return The greater of the two cuts
	 */
	public static <V> Boundary<V> max(Boundary<V> b1, Boundary<V> b2, OrderedDomain<V> domain) {
		return b1.compareTo(b2, domain) >= 0 ? b1 : b2;
	}

	@Override
	public int hashCode() {
		return Objects.hash(theValue, theSide);
	}

	/**
	 * A boundary knows no domain, so this compares values by their own {@link Object#equals(Object) equality}. Use
	 * {@link #compareTo(Boundary, OrderedDomain)} to test whether two boundaries are the same cut in a domain.
	 */
	@Override
	public boolean equals(Object obj) {
		if (obj == this)
			return true;
		else if (!(obj instanceof Boundary))
			return false;
		Boundary<?> other = (Boundary<?>) obj;
		return theSide == other.theSide && theValue.equals(other.theValue);
	}

	@Override
	public String toString() {
		return (theSide == Side.BELOW ? "below " : "above ") + theValue;
	}
}
