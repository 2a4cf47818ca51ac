package org.qintervals;

import java.util.Comparator;

/**
 * A strategy describing a totally ordered type of values. The domain decides how {@link Interval intervals} over its values are
 * represented: a {@link DiscreteDomain} uses compact inclusive value pairs and fuses adjacent values, while a {@link DenseDomain} keeps
 * explicit {@link Boundary boundary} pairs.
 *
 * @param <V> The type of values in the domain
 */
public interface OrderedDomain<V> extends Comparator<V> {
	/**
	 * @param low The lower value
	 * @param high The higher value
	 * @return Whether <code>high</code> is the very next value after <code>low</code>, with nothing between them
	 */
	default boolean isAdjacent(V low, V high) {
		return false;
	}

	/**
	 * @param value The value
	 * @return The value immediately after the given value
	 * @throws DomainException If the domain is dense or the value is the domain's maximum
	 */
	default V next(V value) throws DomainException {
		throw new DomainException("No value is adjacent to " + value + " in dense domain " + this);
	}

	/**
	 * @param value The value
	 * @return The value immediately before the given value
	 * @throws DomainException If the domain is dense or the value is the domain's minimum
	 */
	default V previous(V value) throws DomainException {
		throw new DomainException("No value is adjacent to " + value + " in dense domain " + this);
	}

	/**
	 * @param value The value to hash
	 * @return A hash code for the value, the same for any two values this domain {@link #compare(Object, Object) compares} as equal
	 */
	default int hash(V value) {
		return value.hashCode();
	}

	/** @return Whether this domain has a {@link #getMinimum() minimum} and a {@link #getMaximum() maximum} */
	boolean isBounded();

	/**
	 * @return The least value in the domain
	 * @throws DomainException If this domain is not {@link #isBounded() bounded}
	 */
	V getMinimum() throws DomainException;

	/**
	 * @return The greatest value in the domain
	 * @throws DomainException If this domain is not {@link #isBounded() bounded}
	 */
	V getMaximum() throws DomainException;

	/**
	 * Creates an interval in this domain's representation. Intervals whose upper boundary is not above their lower boundary are
	 * {@link #emptyInterval() empty}.
	 *
	 * @param lower The lower boundary of the interval
	 * @param upper The upper boundary of the interval
	 * @return The interval
	 */
	Interval<V> interval(Boundary<V> lower, Boundary<V> upper);

	/** @return The interval containing no values in this domain */
	Interval<V> emptyInterval();

	/**
	 * @return The interval containing every value of this domain
	 * @throws DomainException If this domain is not {@link #isBounded() bounded}
	 */
	default Interval<V> universe() throws DomainException {
		return interval(Boundary.below(getMinimum()), Boundary.above(getMaximum()));
	}
}
