package org.qintervals;

import java.util.Comparator;
import java.util.Objects;

/** Built-in {@link OrderedDomain domains} for common value types */
public class Domains {
	private static final DiscreteDomain<Integer> INTEGERS = new DiscreteDomain<Integer>("integers") {
		@Override
		public int compare(Integer v1, Integer v2) {
			return Integer.compare(v1, v2);
		}

		@Override
		public Integer getMinimum() {
			return Integer.MIN_VALUE;
		}

		@Override
		public Integer getMaximum() {
			return Integer.MAX_VALUE;
		}

		@Override
		protected Integer successor(Integer value) {
			return value + 1;
		}

		@Override
		protected Integer predecessor(Integer value) {
			return value - 1;
		}

		@Override
		public boolean isAdjacent(Integer low, Integer high) {
			return (long) high - low == 1;
		}

		@Override
		public long distance(Integer low, Integer high) {
			return (long) high - low;
		}
	};

	private static final DiscreteDomain<Long> LONGS = new DiscreteDomain<Long>("longs") {
		@Override
		public int compare(Long v1, Long v2) {
			return Long.compare(v1, v2);
		}

		@Override
		public Long getMinimum() {
			return Long.MIN_VALUE;
		}

		@Override
		public Long getMaximum() {
			return Long.MAX_VALUE;
		}

		@Override
		protected Long successor(Long value) {
			return value + 1;
		}

		@Override
		protected Long predecessor(Long value) {
			return value - 1;
		}

		@Override
		public boolean isAdjacent(Long low, Long high) {
			return low < high && high - low == 1;
		}

		@Override
		public long distance(Long low, Long high) throws ArithmeticException {
			return Math.subtractExact(high, low);
		}
	};

	private static final DiscreteDomain<Short> SHORTS = new DiscreteDomain<Short>("shorts") {
		@Override
		public int compare(Short v1, Short v2) {
			return Short.compare(v1, v2);
		}

		@Override
		public Short getMinimum() {
			return Short.MIN_VALUE;
		}

		@Override
		public Short getMaximum() {
			return Short.MAX_VALUE;
		}

		@Override
		protected Short successor(Short value) {
			return (short) (value + 1);
		}

		@Override
		protected Short predecessor(Short value) {
			return (short) (value - 1);
		}

		@Override
		public long distance(Short low, Short high) {
			return high - low;
		}
	};

	private static final DiscreteDomain<Byte> BYTES = new DiscreteDomain<Byte>("bytes") {
		@Override
		public int compare(Byte v1, Byte v2) {
			return Byte.compare(v1, v2);
		}

		@Override
		public Byte getMinimum() {
			return Byte.MIN_VALUE;
		}

		@Override
		public Byte getMaximum() {
			return Byte.MAX_VALUE;
		}

		@Override
		protected Byte successor(Byte value) {
			return (byte) (value + 1);
		}

		@Override
		protected Byte predecessor(Byte value) {
			return (byte) (value - 1);
		}

		@Override
		public long distance(Byte low, Byte high) {
			return high - low;
		}
	};

	private static final DiscreteDomain<Character> CHARACTERS = new DiscreteDomain<Character>("characters") {
		@Override
		public int compare(Character v1, Character v2) {
			return Character.compare(v1, v2);
		}

		@Override
		public Character getMinimum() {
			return Character.MIN_VALUE;
		}

		@Override
		public Character getMaximum() {
			return Character.MAX_VALUE;
		}

		@Override
		protected Character successor(Character value) {
			return (char) (value + 1);
		}

		@Override
		protected Character predecessor(Character value) {
			return (char) (value - 1);
		}

		@Override
		public long distance(Character low, Character high) {
			return high - low;
		}
	};

	// Adding positive zero turns -0.0 into 0.0 and leaves every other value alone
	private static final DenseDomain<Double> DOUBLES = new DenseDomain<>("doubles", (d1, d2) -> Double.compare(d1 + 0.0, d2 + 0.0),
		Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, d -> Double.hashCode(d + 0.0));
	private static final DenseDomain<Float> FLOATS = new DenseDomain<>("floats", (f1, f2) -> Float.compare(f1 + 0.0f, f2 + 0.0f),
		Float.NEGATIVE_INFINITY, Float.POSITIVE_INFINITY, f -> Float.hashCode(f + 0.0f));
	// Natural orderings need not agree with equals (1.0 and 1.00 as BigDecimal), so no value hash can be trusted
	private static final DenseDomain<Comparable<Object>> NATURAL = new DenseDomain<>("natural order", Comparator.naturalOrder(), null,
		null, value -> 0);

	private Domains() {}

	/** @return The domain of all 32-bit integers */
	public static DiscreteDomain<Integer> integers() {
		return INTEGERS;
	}

	/** @return The domain of all 64-bit integers */
	public static DiscreteDomain<Long> longs() {
		return LONGS;
	}

	/** @return The domain of all 16-bit integers */
	public static DiscreteDomain<Short> shorts() {
		return SHORTS;
	}

	/** @return The domain of all 8-bit integers */
	public static DiscreteDomain<Byte> bytes() {
		return BYTES;
	}

	/** @return The domain of all UTF-16 code units */
	public static DiscreteDomain<Character> characters() {
		return CHARACTERS;
	}

	/**
	 * @param <E> The enum type
	 * @param type The enum class
	 * @return The domain of the enum's constants, in ordinal order
	 */
	public static <E extends Enum<E>> DiscreteDomain<E> ofEnum(Class<E> type) {
		return new EnumDomain<>(type);
	}

	/**
	 * The doubles, from negative to positive infinity. Negative zero is the same value as zero. NaN is ordered above positive infinity as
	 * by {@link Double#compare(double, double)} and is not part of the {@link OrderedDomain#universe() universe}.
	 *
	 * @return The dense domain of doubles
	 */
	public static DenseDomain<Double> doubles() {
		return DOUBLES;
	}

	/** @return The dense domain of floats, from negative to positive infinity, with negative zero the same value as zero */
	public static DenseDomain<Float> floats() {
		return FLOATS;
	}

	/**
	 * @param <C> The comparable type
	 * @return An unbounded dense domain for any comparable type, such as {@link java.math.BigDecimal} or {@link String}. Sets in this
	 *         domain have no complement.
	 */
	public static <C extends Comparable<? super C>> DenseDomain<C> naturalOrder() {
		return (DenseDomain<C>) (DenseDomain<?>) NATURAL;
	}

	static class EnumDomain<E extends Enum<E>> extends DiscreteDomain<E> {
		private final Class<E> theType;
		private final E[] theConstants;

		EnumDomain(Class<E> type) {
			super(type.getSimpleName());
			theType = type;
			theConstants = type.getEnumConstants();
			if (theConstants.length == 0)
				throw new IllegalArgumentException("Enum " + type.getName() + " has no constants");
		}

		@Override
		public int compare(E v1, E v2) {
			return Integer.compare(v1.ordinal(), v2.ordinal());
		}

		@Override
		public E getMinimum() {
			return theConstants[0];
		}

		@Override
		public E getMaximum() {
			return theConstants[theConstants.length - 1];
		}

		@Override
		protected E successor(E value) {
			return theConstants[value.ordinal() + 1];
		}

		@Override
		protected E predecessor(E value) {
			return theConstants[value.ordinal() - 1];
		}

		@Override
		public boolean isAdjacent(E low, E high) {
			return high.ordinal() - low.ordinal() == 1;
		}

		@Override
		public long distance(E low, E high) {
			return high.ordinal() - low.ordinal();
		}

		@Override
		public int hashCode() {
			return theType.hashCode();
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof EnumDomain && Objects.equals(theType, ((EnumDomain<?>) obj).theType);
		}
	}
}
