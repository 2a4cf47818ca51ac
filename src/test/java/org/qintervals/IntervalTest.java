package org.qintervals;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

/** Tests {@link Interval} in discrete and dense domains */
public class IntervalTest {
	private static final DiscreteDomain<Integer> INTS = Domains.integers();
	private static final DenseDomain<Double> DOUBLES = Domains.doubles();

	private static Interval<Integer> ints(int first, int last) {
		return Interval.closed(first, last, INTS);
	}

	/** Tests construction and the open/closed predicates */
	@SuppressWarnings("static-method")
	@Test
	public void testConstruction() {
		Interval<Double> i1 = Interval.open(1.0, 2.0, DOUBLES);
		Assert.assertTrue(i1.isOpen());
		Assert.assertEquals(Interval.of(Boundary.above(1.0), Boundary.below(2.0), DOUBLES), i1);
		Assert.assertFalse(Interval.openClosed(1.0, 2.0, DOUBLES).isOpen());
		Assert.assertTrue(Interval.openClosed(1.0, 2.0, DOUBLES).isOpenBelow());

		Interval<Integer> i2 = ints(1, 2);
		Assert.assertTrue(i2.isClosed());

		// Discrete boundaries are canonicalized to the closed form
		Assert.assertEquals(ints(4, 4), Interval.closedOpen(4, 5, INTS));
		Assert.assertEquals(ints(5, 9), Interval.open(4, 10, INTS));
		Assert.assertTrue(Interval.closedOpen(4, 5, INTS).isClosed());
		Assert.assertTrue(Interval.open(1, 2, INTS).isEmpty());
		Assert.assertTrue(Interval.openClosed(Integer.MAX_VALUE, Integer.MAX_VALUE, INTS).isEmpty());
		Assert.assertTrue(Interval.closedOpen(Integer.MIN_VALUE, Integer.MIN_VALUE, INTS).isEmpty());

		Assert.assertTrue(Interval.closed(2.0, 1.0, DOUBLES).isEmpty());
		Assert.assertTrue(Interval.closedOpen(1.0, 1.0, DOUBLES).isEmpty());
		Assert.assertFalse(Interval.closed(1.0, 1.0, DOUBLES).isEmpty());
		Assert.assertTrue(ints(3, 1).isEmpty());
		Assert.assertEquals(Interval.empty(INTS), ints(3, 1));

		Assert.assertTrue(ints(1, 1).isSingleton());
		Assert.assertFalse(ints(1, 2).isSingleton());
		Assert.assertTrue(Interval.exactly(0.5, DOUBLES).isSingleton());
		Assert.assertFalse(Interval.closedOpen(0.5, 0.6, DOUBLES).isSingleton());
	}

	/** Tests value and interval containment */
	@SuppressWarnings("static-method")
	@Test
	public void testContains() {
		Interval<Double> open = Interval.open(0.0, 1.0, DOUBLES);
		Assert.assertFalse(open.contains(0.0));
		Assert.assertFalse(open.contains(1.0));
		Assert.assertTrue(open.contains(0.1));
		Assert.assertTrue(Interval.closed(0.0, 1.0, DOUBLES).contains(open));
		Assert.assertFalse(open.contains(Interval.closed(0.0, 1.0, DOUBLES)));
		Assert.assertTrue(open.contains(open));

		Assert.assertTrue(ints(0, 10).contains(ints(3, 4)));
		Assert.assertFalse(ints(0, 10).contains(ints(3, 11)));
		Assert.assertFalse(ints(0, 10).contains(Interval.empty(INTS)));
		Assert.assertFalse(Interval.<Integer> empty(INTS).contains(5));

		Assert.assertEquals(-1, ints(2, 4).locate(1));
		Assert.assertEquals(0, ints(2, 4).locate(4));
		Assert.assertEquals(1, ints(2, 4).locate(5));
	}

	/** Tests overlap, intersection, extent and ordering */
	@SuppressWarnings("static-method")
	@Test
	public void testOverlap() {
		Interval<Integer> i2 = ints(1, 2);
		Interval<Integer> i3 = ints(2, 3);
		Assert.assertTrue(i2.compareTo(i3) < 0);
		Assert.assertTrue(i2.overlaps(i3));
		Assert.assertTrue(i2.intersects(i3));
		Assert.assertEquals(ints(2, 2), i2.intersection(i3));
		Assert.assertEquals(ints(1, 3), i2.extent(i3));

		// Adjacent discrete intervals must be fused, but share no value
		Assert.assertTrue(ints(0, 4).overlaps(ints(5, 6)));
		Assert.assertTrue(ints(5, 6).overlaps(ints(0, 4)));
		Assert.assertFalse(ints(0, 4).intersects(ints(5, 6)));
		Assert.assertFalse(ints(0, 4).overlaps(ints(6, 6)));
		Assert.assertTrue(ints(0, 4).intersection(ints(5, 6)).isEmpty());

		Assert.assertFalse(Interval.closedOpen(0.0, 1.0, DOUBLES).overlaps(Interval.openClosed(1.0, 2.0, DOUBLES)));
		Assert.assertTrue(Interval.closedOpen(0.0, 1.0, DOUBLES).overlaps(Interval.closed(1.0, 2.0, DOUBLES)));
		Assert.assertFalse(Interval.closedOpen(0.0, 1.0, DOUBLES).intersects(Interval.closed(1.0, 2.0, DOUBLES)));
		Assert.assertEquals(Interval.closed(0.0, 2.0, DOUBLES),
			Interval.closedOpen(0.0, 1.0, DOUBLES).extent(Interval.closed(1.0, 2.0, DOUBLES)));
		Assert.assertEquals(Interval.closedOpen(0.5, 1.0, DOUBLES),
			Interval.closedOpen(0.0, 1.0, DOUBLES).intersection(Interval.closed(0.5, 2.0, DOUBLES)));

		Assert.assertEquals(ints(1, 3), ints(1, 3).extent(Interval.empty(INTS)));
		Assert.assertFalse(ints(1, 3).overlaps(Interval.empty(INTS)));
	}

	/** Tests {@link Interval#difference(Interval)} */
	@SuppressWarnings("static-method")
	@Test
	public void testDifference() {
		Interval.Difference<Integer> diff = ints(0, 4).difference(ints(1, 2));
		Assert.assertEquals(ints(0, 0), diff.getBelow());
		Assert.assertEquals(ints(3, 4), diff.getAbove());

		diff = ints(Integer.MIN_VALUE, 5).difference(ints(Integer.MIN_VALUE, 2));
		Assert.assertTrue(diff.getBelow().isEmpty());
		Assert.assertEquals(ints(3, 5), diff.getAbove());

		diff = ints(0, Integer.MAX_VALUE).difference(ints(-5, Integer.MAX_VALUE));
		Assert.assertTrue(diff.isEmpty());

		diff = ints(0, 4).difference(ints(10, 12));
		Assert.assertEquals(ints(0, 4), diff.getBelow());
		Assert.assertTrue(diff.getAbove().isEmpty());

		Interval.Difference<Double> dense = Interval.closed(0.0, 1.0, DOUBLES).difference(Interval.exactly(0.5, DOUBLES));
		Assert.assertEquals(Interval.closedOpen(0.0, 0.5, DOUBLES), dense.getBelow());
		Assert.assertEquals(Interval.openClosed(0.5, 1.0, DOUBLES), dense.getAbove());

		dense = Interval.closed(0.0, 1.0, DOUBLES).difference(Interval.open(-1.0, 0.0, DOUBLES));
		Assert.assertTrue(dense.getBelow().isEmpty());
		Assert.assertEquals(Interval.closed(0.0, 1.0, DOUBLES), dense.getAbove());
	}

	/** Tests sorting of intervals, with empty intervals first */
	@SuppressWarnings("static-method")
	@Test
	public void testOrder() {
		List<Interval<Integer>> list = new ArrayList<>(Arrays.asList(ints(5, 6), ints(1, 3), Interval.empty(INTS), ints(1, 2)));
		list.sort(null);
		Assert.assertEquals(Arrays.asList(Interval.empty(INTS), ints(1, 2), ints(1, 3), ints(5, 6)), list);
		Assert.assertTrue(Interval.closedOpen(4, 5, INTS).compareTo(ints(4, 5)) < 0);
		Assert.assertTrue(Interval.closed(0.0, 1.0, DOUBLES).compareTo(Interval.openClosed(0.0, 0.5, DOUBLES)) < 0);
	}

	/** Tests counting and enumerating discrete values */
	@SuppressWarnings("static-method")
	@Test
	public void testValues() {
		Assert.assertEquals(10, ints(1, 10).size());
		Assert.assertEquals(0, Interval.empty(INTS).size());
		Assert.assertEquals(1L << 32, ints(Integer.MIN_VALUE, Integer.MAX_VALUE).size());
		List<Integer> values = new ArrayList<>();
		for (int v : ints(3, 6).values())
			values.add(v);
		Assert.assertEquals(Arrays.asList(3, 4, 5, 6), values);
		values.clear();
		for (int v : ints(Integer.MAX_VALUE - 1, Integer.MAX_VALUE).values())
			values.add(v);
		Assert.assertEquals(Arrays.asList(Integer.MAX_VALUE - 1, Integer.MAX_VALUE), values);
		Assert.assertFalse(Interval.empty(INTS).values().iterator().hasNext());
		Assert.assertEquals(Integer.valueOf(3), ints(3, 6).getFirst());
		Assert.assertEquals(Integer.valueOf(6), ints(3, 6).getLast());
	}

	/** Dense intervals cannot be counted */
	@SuppressWarnings("static-method")
	@Test(expected = DomainException.class)
	public void testDenseSize() {
		Interval.closed(0.0, 1.0, DOUBLES).size();
	}

	/** An empty dense interval has no values to enumerate */
	@SuppressWarnings("static-method")
	@Test
	public void testEmptyDenseValues() {
		Assert.assertFalse(Interval.empty(DOUBLES).values().iterator().hasNext());
		Assert.assertFalse(Interval.open(1.0, 1.0, DOUBLES).values().iterator().hasNext());
	}

	/** Intervals of different domains cannot be combined */
	@SuppressWarnings("static-method")
	@Test
	public void testDomainMismatch() {
		DenseDomain<Integer> denseInts = new DenseDomain<>("dense integers", Integer::compare, null, null);
		Interval<Integer> dense = Interval.closed(1, 2, denseInts);
		Interval<Integer> discrete = ints(0, 10);
		List<Runnable> operations = Arrays.asList(//
			() -> discrete.contains(dense), //
			() -> discrete.overlaps(dense), //
			() -> discrete.intersects(dense), //
			() -> discrete.precedes(dense), //
			() -> discrete.isBelow(dense), //
			() -> discrete.intersection(dense), //
			() -> discrete.extent(dense), //
			() -> discrete.difference(dense), //
			() -> discrete.compareTo(dense), //
			() -> dense.contains(discrete), //
			() -> dense.extent(discrete), //
			() -> dense.difference(Interval.empty(INTS)));
		for (Runnable operation : operations) {
			try {
				operation.run();
				Assert.fail("Domains should not have been combined");
			} catch (IllegalArgumentException e) {
				// Expected
			}
		}
	}

	/** Tests rendering */
	@SuppressWarnings("static-method")
	@Test
	public void testToString() {
		Assert.assertEquals("1..3", ints(1, 3).toString());
		Assert.assertEquals("5", ints(5, 5).toString());
		Assert.assertEquals("0.0..<0.5", Interval.closedOpen(0.0, 0.5, DOUBLES).toString());
		Assert.assertEquals("0.5<..1.0", Interval.openClosed(0.5, 1.0, DOUBLES).toString());
		Assert.assertEquals("0.5<..<1.0", Interval.open(0.5, 1.0, DOUBLES).toString());
		Assert.assertEquals("3.0", Interval.exactly(3.0, DOUBLES).toString());
		Assert.assertEquals("empty", Interval.empty(DOUBLES).toString());
	}
}
