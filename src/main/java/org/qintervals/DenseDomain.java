package org.qintervals;

import java.util.Comparator;
import java.util.function.ToIntFunction;

/**
 * An {@link OrderedDomain} with no notion of adjacent values, such as the real numbers. Intervals keep explicit {@link Boundary boundary}
 * pairs and two boundaries are only the same cut if both their values and sides match.
 *
 * @param <V> The type of values in the domain
 */
public class DenseDomain<V> implements OrderedDomain<V> {
	private final String theName;
	private final Comparator<? super V> theCompare;
	private final ToIntFunction<? super V> theHasher;
	private final V theMinimum;
	private final V theMaximum;
	private final DenseInterval<V> theEmptyInterval;

	/**
	 * Creates a domain whose ordering agrees with {@link Object#equals(Object)}
	 *
	 * @param name The name of the domain, for {@link #toString()}
	 * @param compare The ordering of the domain
	 * @param minimum The least value of the domain, or null if it is unbounded
	 * @param maximum The greatest value of the domain, or null if it is unbounded
	 */
	public DenseDomain(String name, Comparator<? super V> compare, V minimum, V maximum) {
		this(name, compare, minimum, maximum, Object::hashCode);
	}

	/**
	 * @param name The name of the domain, for {@link #toString()}
	 * @param compare The ordering of the domain
	 * @param minimum The least value of the domain, or null if it is unbounded
	 * @param maximum The greatest value of the domain, or null if it is unbounded
	 * @param hasher Hashes values, giving the same code to any two values the ordering considers equal
	 */
	public DenseDomain(String name, Comparator<? super V> compare, V minimum, V maximum, ToIntFunction<? super V> hasher) {
		if ((minimum == null) != (maximum == null))
			throw new IllegalArgumentException("A domain must be bounded on both ends or on neither");
		theName = name;
		theCompare = compare;
		theHasher = hasher;
		theMinimum = minimum;
		theMaximum = maximum;
		theEmptyInterval = new DenseInterval<>(this, null, null);
	}

	@Override
	public int compare(V v1, V v2) {
		return theCompare.compare(v1, v2);
	}

	@Override
	public int hash(V value) {
		return theHasher.applyAsInt(value);
	}

	@Override
	public boolean isBounded() {
		return theMinimum != null;
	}

	@Override
	public V getMinimum() throws DomainException {
		if (theMinimum == null)
			throw new DomainException(this + " has no minimum");
		return theMinimum;
	}

	@Override
	public V getMaximum() throws DomainException {
		if (theMaximum == null)
			throw new DomainException(this + " has no maximum");
		return theMaximum;
	}

	@Override
	public Interval<V> interval(Boundary<V> lower, Boundary<V> upper) {
		if (upper.compareTo(lower, this) <= 0)
			return theEmptyInterval;
		return new DenseInterval<>(this, lower, upper);
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
