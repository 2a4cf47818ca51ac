package org.qintervals;

import java.math.BigDecimal;

import org.junit.Assert;
import org.junit.Test;

/** Tests the built-in {@link Domains} */
public class DomainsTest {
	enum Color {
		RED, ORANGE, YELLOW, GREEN, BLUE
	}

	/** Tests successor, predecessor and adjacency at and away from the edges */
	@SuppressWarnings("static-method")
	@Test
	public void testDiscrete() {
		DiscreteDomain<Integer> ints = Domains.integers();
		Assert.assertEquals(Integer.valueOf(6), ints.next(5));
		Assert.assertEquals(Integer.valueOf(4), ints.previous(5));
		Assert.assertTrue(ints.isAdjacent(Integer.MAX_VALUE - 1, Integer.MAX_VALUE));
		Assert.assertFalse(ints.isAdjacent(Integer.MAX_VALUE, Integer.MIN_VALUE));
		Assert.assertFalse(ints.isAdjacent(1, 3));
		Assert.assertTrue(Domains.longs().isAdjacent(-1L, 0L));
		Assert.assertFalse(Domains.longs().isAdjacent(Long.MAX_VALUE, Long.MIN_VALUE));
		Assert.assertTrue(Domains.shorts().isAdjacent((short) 7, (short) 8));
		Assert.assertFalse(Domains.bytes().isAdjacent(Byte.MAX_VALUE, Byte.MIN_VALUE));
		Assert.assertTrue(Domains.characters().isAdjacent('a', 'b'));
		Assert.assertFalse(Domains.doubles().isAdjacent(1.0, 2.0));
		Assert.assertEquals(256, Domains.bytes().universe().size());
	}

	/** The long domain cannot be counted as a whole */
	@SuppressWarnings("static-method")
	@Test(expected = ArithmeticException.class)
	public void testLongOverflow() {
		Domains.longs().universe().size();
	}

	/** There is no successor of the domain maximum */
	@SuppressWarnings("static-method")
	@Test(expected = DomainException.class)
	public void testNextOfMaximum() {
		Domains.characters().next(Character.MAX_VALUE);
	}

	/** Tests the enum domain */
	@SuppressWarnings("static-method")
	@Test
	public void testEnum() {
		DiscreteDomain<Color> colors = Domains.ofEnum(Color.class);
		Assert.assertEquals(colors, Domains.ofEnum(Color.class));
		Assert.assertEquals(Color.RED, colors.getMinimum());
		Assert.assertEquals(Color.BLUE, colors.getMaximum());
		Assert.assertEquals(Color.GREEN, colors.next(Color.YELLOW));
		Assert.assertTrue(colors.isAdjacent(Color.RED, Color.ORANGE));
		Assert.assertEquals(3, Interval.closed(Color.ORANGE, Color.GREEN, colors).size());
		Assert.assertEquals(Interval.closed(Color.ORANGE, Color.YELLOW, colors), Interval.open(Color.RED, Color.GREEN, colors));
	}

	/** Tests dense domains, bounded and unbounded */
	@SuppressWarnings("static-method")
	@Test
	public void testDense() {
		Interval<Double> universe = Domains.doubles().universe();
		Assert.assertTrue(universe.contains(Double.NEGATIVE_INFINITY));
		Assert.assertTrue(universe.contains(Double.POSITIVE_INFINITY));
		Assert.assertFalse(universe.contains(Double.NaN));
		Assert.assertTrue(Domains.floats().universe().contains(0f));

		DenseDomain<BigDecimal> decimals = Domains.naturalOrder();
		Assert.assertFalse(decimals.isBounded());
		Assert.assertTrue(Interval.closed(BigDecimal.ONE, BigDecimal.TEN, decimals).contains(new BigDecimal("2.5")));
	}

	/** Negative zero is ordered and hashed as zero */
	@SuppressWarnings("static-method")
	@Test
	public void testSignedZero() {
		DenseDomain<Double> doubles = Domains.doubles();
		Assert.assertEquals(0, doubles.compare(-0.0, 0.0));
		Assert.assertEquals(doubles.hash(0.0), doubles.hash(-0.0));
		Assert.assertTrue(doubles.compare(-Double.MIN_VALUE, -0.0) < 0);
		Assert.assertTrue(Interval.closed(0.0, 1.0, doubles).contains(-0.0));
		Assert.assertFalse(Interval.openClosed(0.0, 1.0, doubles).contains(-0.0));

		DenseDomain<Float> floats = Domains.floats();
		Assert.assertEquals(0, floats.compare(0.0f, -0.0f));
		Assert.assertEquals(floats.hash(0.0f), floats.hash(-0.0f));
		Assert.assertTrue(Interval.closed(-1.0f, 0.0f, floats).contains(-0.0f));
	}

	/** An unbounded domain has no universe */
	@SuppressWarnings("static-method")
	@Test(expected = DomainException.class)
	public void testUnboundedUniverse() {
		Domains.<String> naturalOrder().universe();
	}
}
