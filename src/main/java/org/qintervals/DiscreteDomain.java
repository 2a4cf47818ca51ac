package org.qintervals;

/**
 * An {@link OrderedDomain} with a successor/predecessor relation and a minimum and maximum. Boundaries between adjacent values coincide, so
 * <code>above(v)</code> and <code>below(next(v))</code> are the same cut and intervals separated by no missing value are fused.
 *
 * @param <V> The type of values in the domain
 */
public abstract class DiscreteDomain<V> implements OrderedDomain<V> {
	private final String theName;
	private final DiscreteInterval<V> theEmptyInterval;

	/** @param name The name of the domain, for {@link #toString()} */
	protected DiscreteDomain(String name) {
		theName = name;
		theEmptyInterval = new DiscreteInterval<>(this, null, null);
	}

	/**
	 * @param value The value, which is not the domain's maximum
	 * @return The value immediately after the given value
	 */
	protected abstract V successor(V value);

	/**
	 * @param value The value, which is not the domain's minimum
	 * @return The value immediately before the given value
	 */
	protected abstract V predecessor(V value);

	/**
	 * @param low The lower value
	 * @param high The higher value, not less than <code>low</code>
	 * @return The number of steps from <code>low</code> to <code>high</code>
	 * @throws ArithmeticException If the distance does not fit in a long
	 */
	public abstract long distance(V low, V high) throws ArithmeticException;

	@Override
	public boolean isBounded() {
		return true;
	}

	@Override
	public V next(V value) throws DomainException {
		if (compare(value, getMaximum()) >= 0)
			throw new DomainException("No value after the maximum " + value + " of " + this);
		return successor(value);
	}

	@Override
	public V previous(V value) throws DomainException {
		if (compare(value, getMinimum()) <= 0)
			throw new DomainException("No value before the minimum " + value + " of " + this);
		return predecessor(value);
	}

	@Override
	public boolean isAdjacent(V low, V high) {
		return compare(low, high) < 0 && compare(low, getMaximum()) < 0 && compare(successor(low), high) == 0;
	}

	/**
	 * @param first The first value in the interval
	 * @param last The last value in the interval
	 * @return The interval of all values from <code>first</code> to <code>last</code>, inclusive. Empty if <code>first&gt;last</code>.
	 */
	public Interval<V> closed(V first, V last) {
		if (compare(first, last) > 0)
			return emptyInterval();
		return new DiscreteInterval<>(this, first, last);
	}

	@Override
	public Interval<V> interval(Boundary<V> lower, Boundary<V> upper) {
		V first;
		if (lower.isBelowValue())
			first = lower.getValue();
		else if (compare(lower.getValue(), getMaximum()) >= 0)
			return emptyInterval();
		else
			first = successor(lower.getValue());
		V last;
		if (upper.isAboveValue())
			last = upper.getValue();
		else if (compare(upper.getValue(), getMinimum()) <= 0)
			return emptyInterval();
		else
			last = predecessor(upper.getValue());
		return closed(first, last);
	}

	@Override
	public Interval<V> emptyInterval() {
		return theEmptyInterval;
	}

	@Override
	public String toString() {
		return theName;
	}
}
