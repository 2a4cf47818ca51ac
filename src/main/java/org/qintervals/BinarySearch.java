package org.qintervals;

import java.util.List;
import java.util.RandomAccess;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;

/**
 * Binary searches over pre-sorted {@link RandomAccess random-access} lists. This class never sorts its items; the items must be sorted so
 * that the evaluated test is monotonic over the list.
 */
public class BinarySearch {
	private BinarySearch() {}

	/**
	 * Locates an item in a list by a comparison against an implicit target
	 *
	 * @param <S> The type of the items to search
	 * @param items The items to search
	 * @param compare Compares an item to the search target: negative if the item is before the target, positive if after, zero if it
	 *        matches
	 * @return The index of the matching item, if there is one; otherwise, (-(insertion point) - 1). The insertion point is the index of the
	 *         first item after the target, or <code>items.size()</code> if all items are before it. Note that this guarantees that the
	 *         return value will be &gt;= 0 if and only if a match is found.
	 */
	public static <S> int find(List<? extends S> items, ToIntFunction<? super S> compare) {
		int min = 0, max = items.size() - 1;
		while (min <= max) {
			int mid = (min + max) >>> 1;
			int comp = compare.applyAsInt(items.get(mid));
			if (comp < 0)
				min = mid + 1;
			else if (comp > 0)
				max = mid - 1;
			else
				return mid;
		}
		return -(min + 1);
	}

	/**
	 * @param <S> The type of the items to search
	 * @param items The items to search
	 * @param test The test for each item, which must fail for a (possibly empty) prefix of the list and pass for the rest
	 * @return The index of the first item passing the test, or <code>items.size()</code> if none do
	 */
	public static <S> int firstMatch(List<? extends S> items, Predicate<? super S> test) {
		int min = 0, max = items.size();
		while (min < max) {
			int mid = (min + max) >>> 1;
			if (test.test(items.get(mid)))
				max = mid;
			else
				min = mid + 1;
		}
		return min;
	}

	/**
	 * @param <S> The type of the items to search
	 * @param items The items to search
	 * @param test The test for each item, which must pass for a (possibly empty) prefix of the list and fail for the rest
	 * @return The index of the last item passing the test, or -1 if none do
	 */
	public static <S> int lastMatch(List<? extends S> items, Predicate<? super S> test) {
		int min = -1, max = items.size() - 1;
		while (min < max) {
			int mid = (min + max + 1) >>> 1;
			if (test.test(items.get(mid)))
				min = mid;
			else
				max = mid - 1;
		}
		return min;
	}
}
