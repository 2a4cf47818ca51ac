package org.qintervals;

import com.google.common.collect.ImmutableSet;

/**
 * A contiguous, possibly empty, range of values in an ordered domain, delimited by a lower and an upper {@link Boundary boundary}. Every
 * combination of open and closed ends is expressed by the two boundary constructors.
 * <p>
 * Intervals are immutable. Their representation is chosen by their {@link OrderedDomain domain}: discrete domains store an inclusive pair
 * of values, dense domains store the two boundaries.
 * </p>
 *
 * @param <V> The type of values in the interval
 */
public abstract class Interval<V> implements Comparable<Interval<V>> {
	/**
	 * The result of {@link Interval#difference(Interval) subtracting} one interval from another: the fragment of the left interval below
	 * the right one and the fragment above it. Either may be empty.
	 *
	 * @param <V> The type of values in the intervals
	 */
	public static final class Difference<V> {
		private final Interval<V> theBelow;
		private final Interval<V> theAbove;

		Difference(Interval<V> below, Interval<V> above) {
			theBelow = below;
			theAbove = above;
		}

		/** @return The part of the left interval below the subtracted one */
		public Interval<V> getBelow() {
			return theBelow;
		}

		/** @return The part of the left interval above the subtracted one */
		public Interval<V> getAbove() {
			return theAbove;
		}

		/** @return Whether nothing is left, i.e. the left interval was contained in the subtracted one */
		public boolean isEmpty() {
			return theBelow.isEmpty() && theAbove.isEmpty();
		}

		@Override
		public String toString() {
			return "[" + theBelow + ", " + theAbove + "]";
		}
	}

	private final OrderedDomain<V> theDomain;

	Interval(OrderedDomain<V> domain) {
		theDomain = domain;
	}

	/**
	 * @param <V> The type of the interval
	 * @param lower The lower boundary of the interval
	 * @param upper The upper boundary of the interval
	 * @param domain The domain of the values
	 * @return The interval between the two boundaries. Empty if the upper boundary is not above the lower one.
	 */
	public static <V> Interval<V> of(Boundary<V> lower, Boundary<V> upper, OrderedDomain<V> domain) {
		return domain.interval(lower, upper);
	}

	/**
	 * @param <V> The type of the interval
	 * @param low The low end of the interval
	 * @param withLow Whether the low value should be {@link #contains(Object) contained} in the interval
	 * @param high The high end of the interval
	 * @param withHigh Whether the high value should be {@link #contains(Object) contained} in the interval
	 * @param domain The domain of the values
	 * @return An interval containing all values between the given values
	 */
	public static <V> Interval<V> between(V low, boolean withLow, V high, boolean withHigh, OrderedDomain<V> domain) {
		return domain.interval(withLow ? Boundary.below(low) : Boundary.above(low), //
			withHigh ? Boundary.above(high) : Boundary.below(high));
	}

	/**
	 * @param <V> The type of the interval
	 * @param low The least value in the interval
	 * @param high The greatest value in the interval
	 * @param domain The domain of the values
	 * @return The interval <code>low&lt;=x&lt;=high</code>
	 */
	public static <V> Interval<V> closed(V low, V high, OrderedDomain<V> domain) {
		return between(low, true, high, true, domain);
	}

	/**
	 * @param <V> The type of the interval
	 * @param low The low end of the interval
	 * @param high The high end of the interval
	 * @param domain The domain of the values
	 * @return The interval <code>low&lt;x&lt;high</code>
	 */
	public static <V> Interval<V> open(V low, V high, OrderedDomain<V> domain) {
		return between(low, false, high, false, domain);
	}

	/**
	 * @param <V> The type of the interval
	 * @param low The least value in the interval
	 * @param high The high end of the interval
	 * @param domain The domain of the values
	 * @return The interval <code>low&lt;=x&lt;high</code>
	 */
	public static <V> Interval<V> closedOpen(V low, V high, OrderedDomain<V> domain) {
		return between(low, true, high, false, domain);
	}

	/**
	 * @param <V> The type of the interval
	 * @param low The low end of the interval
	 * @param high The greatest value in the interval
	 * @param domain The domain of the values
	 * @return The interval <code>low&lt;x&lt;=high</code>
	 */
	public static <V> Interval<V> openClosed(V low, V high, OrderedDomain<V> domain) {
		return between(low, false, high, true, domain);
	}

	/**
	 * @param <V> The type of the interval
	 * @param value The value
	 * @param domain The domain of the value
	 * @return The interval containing only the given value
	 */
	public static <V> Interval<V> exactly(V value, OrderedDomain<V> domain) {
		return closed(value, value, domain);
	}

	/**
	 * @param <V> The type of the interval
	 * @param domain The domain
	 * @return The interval containing no values
	 */
	public static <V> Interval<V> empty(OrderedDomain<V> domain) {
		return domain.emptyInterval();
	}

	/** @return The domain of this interval's values */
	public OrderedDomain<V> getDomain() {
		return theDomain;
	}

	/**
	 * @return The cut below all values in this interval
	 * @throws IllegalStateException If this interval is empty
	 */
	public abstract Boundary<V> getLowerBound() throws IllegalStateException;

	/**
	 * @return The cut above all values in this interval
	 * @throws IllegalStateException If this interval is empty
	 */
	public abstract Boundary<V> getUpperBound() throws IllegalStateException;

	/** @return Whether this interval contains no values */
	public abstract boolean isEmpty();

	/**
	 * @return The least value in this interval
	 * @throws DomainException If this interval is open below in a dense domain
	 */
	public V getFirst() throws DomainException {
		return getLowerBound().valueAbove(theDomain);
	}

	/**
	 * @return The greatest value in this interval
	 * @throws DomainException If this interval is open above in a dense domain
	 */
	public V getLast() throws DomainException {
		return getUpperBound().valueBelow(theDomain);
	}

	/** @return Whether this interval excludes the value of its lower boundary */
	public boolean isOpenBelow() {
		return !isEmpty() && getLowerBound().isAboveValue();
	}

	/** @return Whether this interval excludes the value of its upper boundary */
	public boolean isOpenAbove() {
		return !isEmpty() && getUpperBound().isBelowValue();
	}

	/** @return Whether this interval excludes the values of both its boundaries */
	public boolean isOpen() {
		return isOpenBelow() && isOpenAbove();
	}

	/** @return Whether this interval includes the values of both its boundaries */
	public boolean isClosed() {
		return !isEmpty() && !isOpenBelow() && !isOpenAbove();
	}

	/** @return Whether this interval contains exactly one value */
	public boolean isSingleton() {
		return isClosed() && theDomain.compare(getLowerBound().getValue(), getUpperBound().getValue()) == 0;
	}

	/**
	 * @param value The value to compare with this interval
	 * @return
	 *         <ul>
	 *         <li><b>-1</b> if the value is below this interval's {@link #getLowerBound() lower bound}</li>
	 *         <li><b>1</b> if the value is above this interval's {@link #getUpperBound() upper bound}</li>
	 *         <li><b>0</b> if the value is between this interval's bounds</li>
	 *         </ul>
	 */
	public int locate(V value) {
		if (!getLowerBound().isBelow(value, theDomain))
			return -1;
		else if (!getUpperBound().isAbove(value, theDomain))
			return 1;
		else
			return 0;
	}

	/**
	 * @param value The value to test
	 * @return Whether the value lies in this interval
	 */
	public boolean contains(V value) {
		return !isEmpty() && locate(value) == 0;
	}

	/**
	 * @param other The interval to test
	 * @return Whether every value in the other interval is also in this one. False if either interval is empty.
	 * @throws IllegalArgumentException If the other interval belongs to a different domain
	 */
	public boolean contains(Interval<V> other) {
		checkDomain(other);
		if (isEmpty() || other.isEmpty())
			return false;
		return getLowerBound().compareTo(other.getLowerBound(), theDomain) <= 0
			&& other.getUpperBound().compareTo(getUpperBound(), theDomain) <= 0;
	}

	/**
	 * Tests whether the two intervals together form one contiguous interval. This is true if they share a value, but also if they only
	 * touch, like <code>[0,1)</code> and <code>[1,2]</code>, or like <code>0..4</code> and <code>5..6</code> in a discrete domain.
	 *
	 * @param other The interval to test
	 * @return Whether the two intervals overlap or touch, so that they would be fused into one
	 * @see #intersects(Interval)
	 */
	public boolean overlaps(Interval<V> other) {
		checkDomain(other);
		if (isEmpty() || other.isEmpty())
			return false;
		return !precedes(other) && !other.precedes(this);
	}

	/**
	 * @param other The interval to test
	 * @return Whether at least one value lies in both intervals
	 * @see #overlaps(Interval)
	 */
	public boolean intersects(Interval<V> other) {
		checkDomain(other);
		if (isEmpty() || other.isEmpty())
			return false;
		return !isBelow(other) && !other.isBelow(this);
	}

	/**
	 * @param other The non-empty interval to compare with
	 * @return Whether this non-empty interval ends before the other begins, with at least a cut's worth of gap between them, so that the
	 *         two could not be fused
	 */
	public boolean precedes(Interval<V> other) {
		checkDomain(other);
		return getUpperBound().compareTo(other.getLowerBound(), theDomain) < 0;
	}

	/**
	 * @param other The non-empty interval to compare with
	 * @return Whether every value in this non-empty interval is less than every value in the other
	 */
	public boolean isBelow(Interval<V> other) {
		checkDomain(other);
		return getUpperBound().compareTo(other.getLowerBound(), theDomain) <= 0;
	}

	/**
	 * @param other The other interval
	 * @return The interval of values contained in both intervals
	 */
	public Interval<V> intersection(Interval<V> other) {
		checkDomain(other);
		if (isEmpty())
			return this;
		else if (other.isEmpty())
			return other;
		return theDomain.interval(//
			Boundary.max(getLowerBound(), other.getLowerBound(), theDomain), //
			Boundary.min(getUpperBound(), other.getUpperBound(), theDomain));
	}

	/**
	 * @param other The other interval
	 * @return The smallest interval containing both intervals and everything between them
	 */
	public Interval<V> extent(Interval<V> other) {
		checkDomain(other);
		if (isEmpty())
			return other;
		else if (other.isEmpty())
			return this;
		return theDomain.interval(//
			Boundary.min(getLowerBound(), other.getLowerBound(), theDomain), //
			Boundary.max(getUpperBound(), other.getUpperBound(), theDomain));
	}

	/**
	 * @param other The interval to subtract
	 * @return The parts of this interval below and above the other interval
	 * @throws IllegalArgumentException If the other interval belongs to a different domain
	 */
	public Difference<V> difference(Interval<V> other) {
		checkDomain(other);
		if (isEmpty())
			return new Difference<>(this, this);
		else if (other.isEmpty())
			return new Difference<>(this, other);
		Interval<V> below = theDomain.interval(getLowerBound(), Boundary.min(getUpperBound(), other.getLowerBound(), theDomain));
		Interval<V> above = theDomain.interval(Boundary.max(other.getUpperBound(), getLowerBound(), theDomain), getUpperBound());
		return new Difference<>(below, above);
	}

	/**
	 * @return The number of values in this interval
	 * @throws DomainException If the interval is non-empty and its domain is not discrete
	 */
	public long size() throws DomainException {
		if (isEmpty())
			return 0;
		throw new DomainException("Values cannot be counted in dense domain " + theDomain);
	}

	/**
	 * @return All values in this interval, in ascending order
	 * @throws DomainException If the interval is non-empty and its domain is not discrete
	 */
	public Iterable<V> values() throws DomainException {
		if (isEmpty())
			return ImmutableSet.of();
		throw new DomainException("Values cannot be enumerated in dense domain " + theDomain);
	}

	/**
	 * Intervals are ordered by lower boundary, then by upper boundary. Empty intervals come first.
	 */
	@Override
	public int compareTo(Interval<V> other) {
		checkDomain(other);
		if (isEmpty())
			return other.isEmpty() ? 0 : -1;
		else if (other.isEmpty())
			return 1;
		int comp = getLowerBound().compareTo(other.getLowerBound(), theDomain);
		if (comp == 0)
			comp = getUpperBound().compareTo(other.getUpperBound(), theDomain);
		return comp;
	}

	/**
	 * Binary operations only make sense between intervals of the same domain
	 *
	 * @param other The other interval of an operation
	 * @throws IllegalArgumentException If the other interval belongs to a different domain
	 */
	final void checkDomain(Interval<?> other) {
		if (!theDomain.equals(other.getDomain()))
			throw new IllegalArgumentException("Interval " + other + " of domain " + other.getDomain() + " cannot be combined with " + this
				+ " of domain " + theDomain);
	}

	@Override
	public String toString() {
		return append(new StringBuilder()).toString();
	}

	/**
	 * @param str The string builder to append to
	 * @return The string builder
	 */
	public StringBuilder append(StringBuilder str) {
		if (isEmpty())
			return str.append("empty");
		str.append(getLowerBound().getValue());
		if (!isSingleton()) {
			if (isOpenBelow())
				str.append('<');
			str.append("..");
			if (isOpenAbove())
				str.append('<');
			str.append(getUpperBound().getValue());
		}
		return str;
	}
}
