package edu.cwru.neymanpearsontesting.utilities;

import com.google.common.math.DoubleMath;

/**
 * Bit and arithmetic helpers shared by the region and likelihood-ratio code.
 * 
 * @author Ben
 *
 */
public class Utility {

	private Utility() {
	}

	/**
	 * Outcome indices held by a bitmask, ascending.
	 * 
	 * @param mask
	 * @return indices i with bit i of {@code mask} set
	 */
	public static int[] indicesOf(int mask) {
		int[] ret = new int[Integer.bitCount(mask)];
		int counter = 0;
		for (int j = 0; j < Integer.SIZE; j++) {
			/*
			 * Check if j-th bit in the mask is set. If set then j is a member.
			 */
			if ((mask & (1 << j)) != 0)
				ret[counter++] = j;
		}
		return ret;
	}

	/**
	 * Bitmask with exactly the given indices set. Indices outside [0, 31)
	 * are rejected.
	 * 
	 * @param indices
	 * @return bitmask
	 */
	public static int maskOf(int... indices) {
		int mask = 0;
		for (int i : indices) {
			if (i < 0 || i >= Integer.SIZE - 1)
				throw new IllegalArgumentException("Outcome index out of range: " + i);
			mask |= (1 << i);
		}
		return mask;
	}

	/**
	 * Mask of the full outcome space {0, ..., n - 1}.
	 * 
	 * @param n
	 * @return bitmask with the low n bits set
	 */
	public static int fullMask(int n) {
		return (1 << n) - 1;
	}

	/**
	 * Relative comparison of two likelihood ratios. Infinite ratios are equal
	 * only to each other. NaN is equal only to NaN.
	 * 
	 * @param a
	 * @param b
	 * @param relativeTolerance
	 * @return whether the two ratios belong to one tie group
	 */
	public static boolean ratiosTie(double a, double b, double relativeTolerance) {
		if (Double.isNaN(a) || Double.isNaN(b))
			return Double.isNaN(a) && Double.isNaN(b);
		if (Double.isInfinite(a) || Double.isInfinite(b))
			return a == b;
		return DoubleMath.fuzzyEquals(a, b, relativeTolerance * Math.max(Math.abs(a), Math.abs(b)));
	}
}
