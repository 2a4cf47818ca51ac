package org.qintervals.collect;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

import org.apache.log4j.Logger;
import org.qintervals.BinarySearch;
import org.qintervals.DiscreteDomain;
import org.qintervals.DomainException;
import org.qintervals.Domains;
import org.qintervals.Interval;
import org.qintervals.OrderedDomain;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.common.collect.Iterators;

/**
 * <p>
 * A set of values in an ordered domain, stored as a sorted sequence of disjoint intervals rather than as individual values. Large runs of
 * values cost no more than single values.
 * </p>
 * <p>
 * After every operation the intervals are in canonical form:
 * <ul>
 * <li>no interval is empty</li>
 * <li>no two intervals share a value</li>
 * <li>no two consecutive intervals could be fused into one (in a {@link DiscreteDomain discrete domain} this means no two intervals are
 * separated by zero missing values)</li>
 * <li>intervals are in ascending order</li>
 * </ul>
 * Each mutation finds the affected run of intervals by binary search and rewrites only that run.
 * </p>
 * <p>
 * This class is not thread-safe.
 * </p>
 *
 * @param <V> The type of values in the set
 */
public class IntervalSet<V> implements Iterable<Interval<V>> {
	private static final Logger log = Logger.getLogger(IntervalSet.class);

	private final OrderedDomain<V> theDomain;
	private final ArrayList<Interval<V>> theIntervals;

	/**
	 * Creates an empty set
	 *
	 * @param domain The domain of the set's values
	 */
	public IntervalSet(OrderedDomain<V> domain) {
		this(domain, new ArrayList<>());
	}

	private IntervalSet(OrderedDomain<V> domain, ArrayList<Interval<V>> intervals) {
		theDomain = Objects.requireNonNull(domain, "domain");
		theIntervals = intervals;
	}

	/**
	 * @param <V> The type of values in the set
	 * @param domain The domain of the set's values
	 * @return A new, empty set
	 */
	public static <V> IntervalSet<V> empty(OrderedDomain<V> domain) {
		return new IntervalSet<>(domain);
	}

	/**
	 * @param <V> The type of values in the set
	 * @param domain The domain of the set's values
	 * @return A new set containing every value in the domain
	 * @throws DomainException If the domain is not {@link OrderedDomain#isBounded() bounded}
	 */
	public static <V> IntervalSet<V> universe(OrderedDomain<V> domain) throws DomainException {
		ArrayList<Interval<V>> intervals = new ArrayList<>();
		Interval<V> universe = domain.universe();
		if (!universe.isEmpty())
			intervals.add(universe);
		return new IntervalSet<>(domain, intervals);
	}

	/**
	 * @param <V> The type of values in the set
	 * @param domain The domain of the set's values
	 * @param intervals The intervals to include
	 * @return A new set containing every value in any of the given intervals
	 */
	@SafeVarargs
	public static <V> IntervalSet<V> of(OrderedDomain<V> domain, Interval<V>... intervals) {
		return of(domain, Arrays.asList(intervals));
	}

	/**
	 * Creates a set from intervals in any order. Empty intervals are dropped, then the rest are sorted and overlapping or touching intervals
	 * are fused.
	 *
	 * @param <V> The type of values in the set
	 * @param domain The domain of the set's values
	 * @param intervals The intervals to include
	 * @return A new set containing every value in any of the given intervals
	 */
	public static <V> IntervalSet<V> of(OrderedDomain<V> domain, Collection<? extends Interval<V>> intervals) {
		ArrayList<Interval<V>> list = new ArrayList<>(intervals.size());
		for (Interval<V> interval : intervals) {
			checkDomain(domain, interval.getDomain());
			if (!interval.isEmpty())
				list.add(interval);
		}
		Collections.sort(list);
		return new IntervalSet<>(domain, coalesce(list));
	}

	/**
	 * @param <V> The type of values in the set
	 * @param domain The domain of the set's values
	 * @param values The values to include
	 * @return A new set containing the given values
	 */
	@SafeVarargs
	public static <V> IntervalSet<V> ofValues(OrderedDomain<V> domain, V... values) {
		return ofValues(domain, Arrays.asList(values));
	}

	/**
	 * @param <V> The type of values in the set
	 * @param domain The domain of the set's values
	 * @param values The values to include, in any order and possibly with duplicates
	 * @return A new set containing the given values
	 */
	public static <V> IntervalSet<V> ofValues(OrderedDomain<V> domain, Collection<? extends V> values) {
		ArrayList<Interval<V>> list = new ArrayList<>(values.size());
		for (V value : values)
			list.add(Interval.exactly(value, domain));
		Collections.sort(list);
		return new IntervalSet<>(domain, coalesce(list));
	}

	/**
	 * @param bits The bit set
	 * @return A new set of {@link Domains#integers() integers} containing the index of every set bit
	 */
	public static IntervalSet<Integer> of(BitSet bits) {
		DiscreteDomain<Integer> domain = Domains.integers();
		ArrayList<Interval<Integer>> intervals = new ArrayList<>();
		int start = bits.nextSetBit(0);
		while (start >= 0) {
			int end = bits.nextClearBit(start);
			intervals.add(domain.closed(start, end - 1));
			start = bits.nextSetBit(end);
		}
		return new IntervalSet<>(domain, intervals);
	}

	/**
	 * @param <E> The enum type
	 * @param values The enum constants to include
	 * @param type The enum type
	 * @return A new set in the {@link Domains#ofEnum(Class) enum's domain} containing the given constants
	 */
	public static <E extends Enum<E>> IntervalSet<E> of(EnumSet<E> values, Class<E> type) {
		DiscreteDomain<E> domain = Domains.ofEnum(type);
		ArrayList<Interval<E>> intervals = new ArrayList<>();
		E first = null, last = null;
		for (E value : values) { // EnumSet iterates in ordinal order
			if (first == null)
				first = value;
			else if (last.ordinal() + 1 != value.ordinal()) {
				intervals.add(domain.closed(first, last));
				first = value;
			}
			last = value;
		}
		if (first != null)
			intervals.add(domain.closed(first, last));
		return new IntervalSet<>(domain, intervals);
	}

	/** Fuses overlapping or touching neighbors of a sorted list of non-empty intervals */
	private static <V> ArrayList<Interval<V>> coalesce(ArrayList<Interval<V>> sorted) {
		int i = 0;
		for (int j = 1; j < sorted.size(); j++) {
			Interval<V> current = sorted.get(i);
			Interval<V> next = sorted.get(j);
			if (current.overlaps(next))
				sorted.set(i, current.extent(next));
			else
				sorted.set(++i, next);
		}
		if (!sorted.isEmpty())
			sorted.subList(i + 1, sorted.size()).clear();
		return sorted;
	}

	private static void checkDomain(OrderedDomain<?> domain, OrderedDomain<?> other) {
		if (!domain.equals(other))
			throw new IllegalArgumentException("Domain " + other + " cannot be combined with " + domain);
	}

	/** @return The domain of this set's values */
	public OrderedDomain<V> getDomain() {
		return theDomain;
	}

	/** @return Whether this set contains no values */
	public boolean isEmpty() {
		return theIntervals.isEmpty();
	}

	/**
	 * @return The number of values in this set
	 * @throws DomainException If this set is non-empty and its domain is not discrete
	 * @throws ArithmeticException If the count does not fit in a long
	 */
	public long size() throws DomainException, ArithmeticException {
		long size = 0;
		for (Interval<V> interval : theIntervals)
			size = Math.addExact(size, interval.size());
		return size;
	}

	/** @return The number of disjoint intervals this set is stored as */
	public int getIntervalCount() {
		return theIntervals.size();
	}

	/**
	 * @param index The index of the interval to get
	 * @return The interval at the given index
	 * @throws IndexOutOfBoundsException If <code>index&lt;0 || index&gt;={@link #getIntervalCount()}</code>
	 */
	public Interval<V> getInterval(int index) throws IndexOutOfBoundsException {
		return theIntervals.get(index);
	}

	/** @return An unmodifiable view of this set's intervals, in ascending order */
	public List<Interval<V>> getIntervals() {
		return Collections.unmodifiableList(theIntervals);
	}

	/** Iterates over this set's intervals in ascending order */
	@Override
	public Iterator<Interval<V>> iterator() {
		return Iterators.unmodifiableIterator(theIntervals.iterator());
	}

	/**
	 * @return Every value in this set, in ascending order
	 * @throws DomainException If this set is non-empty and its domain is not discrete
	 */
	public Iterable<V> values() throws DomainException {
		if (theIntervals.isEmpty())
			return ImmutableSet.of();
		else if (!(theDomain instanceof DiscreteDomain))
			throw new DomainException("Values cannot be enumerated in dense domain " + theDomain);
		return Iterables.unmodifiableIterable(Iterables.concat(Iterables.transform(theIntervals, Interval::values)));
	}

	/**
	 * @param value The value to test
	 * @return Whether the value lies in one of this set's intervals
	 */
	public boolean contains(V value) {
		return BinarySearch.find(theIntervals, interval -> -interval.locate(value)) >= 0;
	}

	/**
	 * @param interval The interval to test
	 * @return Whether the interval is enclosed by one of this set's intervals. False for an empty interval.
	 * @throws IllegalArgumentException If the argument belongs to a different domain
	 */
	public boolean contains(Interval<V> interval) {
		checkDomain(theDomain, interval.getDomain());
		if (interval.isEmpty())
			return false;
		int lo = firstIntersecting(interval);
		return lo < theIntervals.size() && lo == lastIntersecting(interval) && theIntervals.get(lo).contains(interval);
	}

	/**
	 * An empty set contains nothing, not even another empty set.
	 *
	 * @param other The set to test
	 * @return Whether every interval of the other set is contained in this set
	 * @throws IllegalArgumentException If the argument belongs to a different domain
	 */
	public boolean contains(IntervalSet<V> other) {
		checkDomain(theDomain, other.theDomain);
		if (isEmpty())
			return false;
		for (Interval<V> interval : other.theIntervals) {
			if (!contains(interval))
				return false;
		}
		return true;
	}

	/**
	 * Adds a value to this set
	 *
	 * @param value The value to include
	 * @return This set
	 */
	public IntervalSet<V> include(V value) {
		return include(Interval.exactly(value, theDomain));
	}

	/**
	 * Adds all values in an interval to this set. Overlapping or touching intervals are fused with the new one.
	 *
	 * @param interval The interval to include
	 * @return This set
	 */
	public IntervalSet<V> include(Interval<V> interval) {
		checkDomain(theDomain, interval.getDomain());
		if (interval.isEmpty())
			return this;
		int lo = firstConnected(interval);
		int hi = lastConnected(interval);
		if (log.isTraceEnabled())
			log.trace("Including " + interval + " over entries [" + lo + ", " + hi + "] of " + this);
		if (lo > hi)
			theIntervals.add(lo, interval);
		else if (lo < hi || !theIntervals.get(lo).contains(interval)) {
			Interval<V> fused = theIntervals.get(lo).extent(interval).extent(theIntervals.get(hi));
			splice(lo, hi + 1, Collections.singletonList(fused));
		}
		return this;
	}

	/**
	 * Adds all values of another set to this set
	 *
	 * @param other The set whose values to include
	 * @return This set
	 */
	public IntervalSet<V> include(IntervalSet<V> other) {
		checkDomain(theDomain, other.theDomain);
		for (Interval<V> interval : snapshot(other))
			include(interval);
		return this;
	}

	/**
	 * Removes a value from this set
	 *
	 * @param value The value to exclude
	 * @return This set
	 */
	public IntervalSet<V> exclude(V value) {
		return exclude(Interval.exactly(value, theDomain));
	}

	/**
	 * Removes all values in an interval from this set. Intervals straddling the removed interval's ends are trimmed, and an interval
	 * enclosing it is split in two.
	 *
	 * @param interval The interval to exclude
	 * @return This set
	 */
	public IntervalSet<V> exclude(Interval<V> interval) {
		checkDomain(theDomain, interval.getDomain());
		if (interval.isEmpty() || theIntervals.isEmpty())
			return this;
		int lo = firstIntersecting(interval);
		int hi = lastIntersecting(interval);
		if (log.isTraceEnabled())
			log.trace("Excluding " + interval + " over entries [" + lo + ", " + hi + "] of " + this);
		if (lo > hi)
			return this;
		List<Interval<V>> remaining = new ArrayList<>(2);
		Interval.Difference<V> firstDiff = theIntervals.get(lo).difference(interval);
		if (!firstDiff.getBelow().isEmpty())
			remaining.add(firstDiff.getBelow());
		if (lo == hi) {
			// Either trims the single entry or punches a hole in it
			if (!firstDiff.getAbove().isEmpty())
				remaining.add(firstDiff.getAbove());
		} else {
			// Entries strictly between lo and hi are consumed entirely
			Interval<V> lastAbove = theIntervals.get(hi).difference(interval).getAbove();
			if (!lastAbove.isEmpty())
				remaining.add(lastAbove);
		}
		splice(lo, hi + 1, remaining);
		return this;
	}

	/**
	 * Removes all values of another set from this set
	 *
	 * @param other The set whose values to exclude
	 * @return This set
	 */
	public IntervalSet<V> exclude(IntervalSet<V> other) {
		checkDomain(theDomain, other.theDomain);
		for (Interval<V> interval : snapshot(other))
			exclude(interval);
		return this;
	}

	/** @return A new set with the same values as this one */
	public IntervalSet<V> copy() {
		return new IntervalSet<>(theDomain, new ArrayList<>(theIntervals));
	}

	/**
	 * @return A new set containing every value of the domain that is not in this set
	 * @throws DomainException If the domain is not {@link OrderedDomain#isBounded() bounded}
	 */
	public IntervalSet<V> complement() throws DomainException {
		return universe(theDomain).exclude(this);
	}

	/**
	 * @param other The other set
	 * @return A new set containing the values in either set
	 */
	public IntervalSet<V> union(IntervalSet<V> other) {
		return copy().include(other);
	}

	/**
	 * @param other The other set
	 * @return A new set containing the values in this set that are not in the other
	 */
	public IntervalSet<V> difference(IntervalSet<V> other) {
		return copy().exclude(other);
	}

	/**
	 * @param other The other set
	 * @return A new set containing the values in both sets
	 */
	public IntervalSet<V> intersection(IntervalSet<V> other) {
		checkDomain(theDomain, other.theDomain);
		if (theDomain.isBounded())
			return copy().exclude(other.complement());
		else // No universe to complement against
			return copy().exclude(difference(other));
	}

	/**
	 * @param other The other set
	 * @return A new set containing the values in exactly one of the two sets
	 */
	public IntervalSet<V> symmetricDifference(IntervalSet<V> other) {
		return difference(other).include(other.difference(this));
	}

	private List<Interval<V>> snapshot(IntervalSet<V> other) {
		return other == this ? new ArrayList<>(theIntervals) : other.theIntervals;
	}

	/** @return The index of the first stored interval that is not separated from the given interval by a gap */
	private int firstConnected(Interval<V> interval) {
		return BinarySearch.firstMatch(theIntervals, stored -> !stored.precedes(interval));
	}

	/** @return The index of the last stored interval that is not separated from the given interval by a gap */
	private int lastConnected(Interval<V> interval) {
		return BinarySearch.lastMatch(theIntervals, stored -> !interval.precedes(stored));
	}

	/** @return The index of the first stored interval that is not entirely below the given interval */
	private int firstIntersecting(Interval<V> interval) {
		return BinarySearch.firstMatch(theIntervals, stored -> !stored.isBelow(interval));
	}

	/** @return The index of the last stored interval that is not entirely above the given interval */
	private int lastIntersecting(Interval<V> interval) {
		return BinarySearch.lastMatch(theIntervals, stored -> !interval.isBelow(stored));
	}

	/** Replaces the entries from <code>from</code> (inclusive) to <code>to</code> (exclusive) with the given intervals in one step */
	private void splice(int from, int to, List<Interval<V>> replacement) {
		List<Interval<V>> range = theIntervals.subList(from, to);
		int common = Math.min(range.size(), replacement.size());
		for (int i = 0; i < common; i++)
			range.set(i, replacement.get(i));
		if (replacement.size() > common)
			range.addAll(replacement.subList(common, replacement.size()));
		else
			range.subList(common, range.size()).clear();
	}

	@Override
	public int hashCode() {
		return theIntervals.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		else if (!(obj instanceof IntervalSet))
			return false;
		IntervalSet<?> other = (IntervalSet<?>) obj;
		return theDomain.equals(other.theDomain) && theIntervals.equals(other.theIntervals);
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder("{");
		for (int i = 0; i < theIntervals.size(); i++) {
			if (i > 0)
				str.append(", ");
			theIntervals.get(i).append(str);
		}
		return str.append('}').toString();
	}
}
