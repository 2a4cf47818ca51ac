package org.qintervals;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableSet;

/**
 * An {@link Interval} stored as an inclusive pair of values, for {@link DiscreteDomain discrete domains}. The lower boundary is always
 * <code>below(first)</code> and the upper boundary <code>above(last)</code>, so every comparison reduces to a value comparison plus an
 * adjacency check.
 *
 * @param <V> The type of values in the interval
 */
final class DiscreteInterval<V> extends Interval<V> {
	private final DiscreteDomain<V> theDomain;
	private final V theFirst;
	private final V theLast;

	/** Both values are null for the domain's empty interval */
	DiscreteInterval(DiscreteDomain<V> domain, V first, V last) {
		super(domain);
		theDomain = domain;
		theFirst = first;
		theLast = last;
	}

	@Override
	public Boundary<V> getLowerBound() {
		return Boundary.below(getFirst());
	}

	@Override
	public Boundary<V> getUpperBound() {
		return Boundary.above(getLast());
	}

	@Override
	public V getFirst() {
		if (theFirst == null)
			throw new IllegalStateException("An empty interval has no bounds");
		return theFirst;
	}

	@Override
	public V getLast() {
		if (theLast == null)
			throw new IllegalStateException("An empty interval has no bounds");
		return theLast;
	}

	@Override
	public boolean isEmpty() {
		return theFirst == null;
	}

	@Override
	public boolean isOpenBelow() {
		return false;
	}

	@Override
	public boolean isOpenAbove() {
		return false;
	}

	@Override
	public boolean isSingleton() {
		return !isEmpty() && theDomain.compare(theFirst, theLast) == 0;
	}

	@Override
	public int locate(V value) {
		if (theDomain.compare(value, theFirst) < 0)
			return -1;
		else if (theDomain.compare(value, theLast) > 0)
			return 1;
		else
			return 0;
	}

	@Override
	public boolean contains(Interval<V> other) {
		checkDomain(other);
		if (isEmpty() || other.isEmpty())
			return false;
		DiscreteInterval<V> o = (DiscreteInterval<V>) other;
		return theDomain.compare(theFirst, o.theFirst) <= 0 && theDomain.compare(o.theLast, theLast) <= 0;
	}

	@Override
	public boolean precedes(Interval<V> other) {
		checkDomain(other);
		DiscreteInterval<V> o = (DiscreteInterval<V>) other;
		return theDomain.compare(theLast, o.theFirst) < 0 && !theDomain.isAdjacent(theLast, o.theFirst);
	}

	@Override
	public boolean isBelow(Interval<V> other) {
		checkDomain(other);
		return theDomain.compare(theLast, ((DiscreteInterval<V>) other).theFirst) < 0;
	}

	@Override
	public Interval<V> intersection(Interval<V> other) {
		checkDomain(other);
		if (isEmpty())
			return this;
		else if (other.isEmpty())
			return other;
		DiscreteInterval<V> o = (DiscreteInterval<V>) other;
		return theDomain.closed(max(theFirst, o.theFirst), min(theLast, o.theLast));
	}

	@Override
	public Interval<V> extent(Interval<V> other) {
		checkDomain(other);
		if (isEmpty())
			return other;
		else if (other.isEmpty())
			return this;
		DiscreteInterval<V> o = (DiscreteInterval<V>) other;
		return theDomain.closed(min(theFirst, o.theFirst), max(theLast, o.theLast));
	}

	@Override
	public Difference<V> difference(Interval<V> other) {
		checkDomain(other);
		if (isEmpty())
			return new Difference<>(this, this);
		else if (other.isEmpty())
			return new Difference<>(this, other);
		DiscreteInterval<V> o = (DiscreteInterval<V>) other;
		Interval<V> below, above;
		// Where reached, o.theFirst>theFirst has a predecessor and o.theLast<theLast has a successor
		if (theDomain.compare(o.theFirst, theFirst) <= 0)
			below = theDomain.emptyInterval();
		else
			below = theDomain.closed(theFirst, min(theLast, theDomain.predecessor(o.theFirst)));
		if (theDomain.compare(o.theLast, theLast) >= 0)
			above = theDomain.emptyInterval();
		else
			above = theDomain.closed(max(theFirst, theDomain.successor(o.theLast)), theLast);
		return new Difference<>(below, above);
	}

	@Override
	public long size() {
		if (isEmpty())
			return 0;
		return Math.addExact(theDomain.distance(theFirst, theLast), 1);
	}

	@Override
	public Iterable<V> values() {
		if (isEmpty())
			return ImmutableSet.of();
		return () -> new ValueIterator();
	}

	@Override
	public int compareTo(Interval<V> other) {
		checkDomain(other);
		if (isEmpty())
			return other.isEmpty() ? 0 : -1;
		else if (other.isEmpty())
			return 1;
		DiscreteInterval<V> o = (DiscreteInterval<V>) other;
		int comp = theDomain.compare(theFirst, o.theFirst);
		if (comp == 0)
			comp = theDomain.compare(theLast, o.theLast);
		return comp;
	}

	private V min(V v1, V v2) {
		return theDomain.compare(v1, v2) <= 0 ? v1 : v2;
	}

	private V max(V v1, V v2) {
		return theDomain.compare(v1, v2) >= 0 ? v1 : v2;
	}

	@Override
	public int hashCode() {
		if (isEmpty())
			return 0;
		return Integer.reverse(theDomain.hash(theFirst)) ^ theDomain.hash(theLast);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		else if (!(obj instanceof DiscreteInterval))
			return false;
		DiscreteInterval<?> other = (DiscreteInterval<?>) obj;
		if (isEmpty() || other.isEmpty())
			return isEmpty() == other.isEmpty() && theDomain.equals(other.theDomain);
		else if (!theDomain.equals(other.theDomain))
			return false;
		DiscreteInterval<V> o = (DiscreteInterval<V>) other;
		return theDomain.compare(theFirst, o.theFirst) == 0 && theDomain.compare(theLast, o.theLast) == 0;
	}

	private class ValueIterator extends AbstractIterator<V> {
		private V theNext = theFirst;

		@Override
		protected V computeNext() {
			if (theNext == null)
				return endOfData();
			V value = theNext;
			theNext = theDomain.compare(value, theLast) < 0 ? theDomain.successor(value) : null;
			return value;
		}
	}
}
