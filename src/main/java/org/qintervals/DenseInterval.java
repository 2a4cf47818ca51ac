package org.qintervals;

/**
 * An {@link Interval} stored as an explicit pair of {@link Boundary boundaries}, for {@link DenseDomain dense domains}
 *
 * @param <V> The type of values in the interval
 */
final class DenseInterval<V> extends Interval<V> {
	private final Boundary<V> theLowerBound;
	private final Boundary<V> theUpperBound;

	/** Both bounds are null for the domain's empty interval */
	DenseInterval(DenseDomain<V> domain, Boundary<V> lowerBound, Boundary<V> upperBound) {
		super(domain);
		theLowerBound = lowerBound;
		theUpperBound = upperBound;
	}

	@Override
	public Boundary<V> getLowerBound() {
		if (theLowerBound == null)
			throw new IllegalStateException("An empty interval has no bounds");
		return theLowerBound;
	}

	@Override
	public Boundary<V> getUpperBound() {
		if (theUpperBound == null)
			throw new IllegalStateException("An empty interval has no bounds");
		return theUpperBound;
	}

	@Override
	public boolean isEmpty() {
		return theLowerBound == null;
	}

	private int hash(Boundary<V> bound) {
		return getDomain().hash(bound.getValue()) * 2 + bound.getSide().ordinal();
	}

	@Override
	public int hashCode() {
		if (isEmpty())
			return 0;
		return Integer.reverse(hash(theLowerBound)) ^ hash(theUpperBound);
	}

	/** Dense intervals are equal if their boundaries are the same cuts in their domain, even if the values' representations differ */
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		else if (!(obj instanceof DenseInterval))
			return false;
		DenseInterval<?> other = (DenseInterval<?>) obj;
		if (isEmpty() || other.isEmpty())
			return isEmpty() == other.isEmpty();
		else if (!getDomain().equals(other.getDomain()))
			return false;
		DenseInterval<V> o = (DenseInterval<V>) other;
		return theLowerBound.compareTo(o.theLowerBound, getDomain()) == 0 && theUpperBound.compareTo(o.theUpperBound, getDomain()) == 0;
	}
}
