/*-
 * #%L
 * This file is part of TemView.
 * %%
 * Copyright (C) 2023 - 2024 TemView developers
 * %%
 * TemView is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * TemView is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with TemView.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package temview.lib.images.arrays;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestDimensionReducer {
	
	private final DimensionReducer reducer = new DimensionReducer();
	
	private static NDArray createRange(int... shape) {
		int n = 1;
		for (int s : shape)
			n *= s;
		return new NDArray(shape, IntStream.range(0, n).asDoubleStream().toArray());
	}
	
	@Test
	public void test_squeezeSingleton() {
		var reduction = reducer.reduce(NDArray.zeros(1, 5, 5), FormatHint.NONE);
		assertTrue(reduction.isSupported());
		assertFalse(reduction.isPartial());
		assertTrue(reduction.getMessage().isEmpty());
		assertArrayEquals(new int[] {5, 5}, reduction.getArray().get().getShape());
	}
	
	@Test
	public void test_lowRankUnchanged() {
		for (int[] shape : new int[][] {{7}, {4, 6}, {3, 4, 6}}) {
			var reduction = reducer.reduce(NDArray.zeros(shape), FormatHint.TILT_SERIES);
			assertArrayEquals(shape, reduction.getArray().get().getShape());
			assertFalse(reduction.isPartial());
		}
	}
	
	@Test
	public void test_reduce4D() {
		var raw = createRange(3, 4, 5, 5);
		var reduction = reducer.reduce(raw, FormatHint.NONE);
		assertTrue(reduction.isPartial());
		assertEquals("Reducing 4-D data to 3-D", reduction.getMessage().orElse(null));
		var array = reduction.getArray().get().getArray();
		assertArrayEquals(new int[] {4, 5, 5}, array.getShape());
		assertEquals(raw.get(0, 2, 3, 4), array.get(2, 3, 4));
	}
	
	@Test
	public void test_reduce4DTiltSeries() {
		var raw = createRange(3, 4, 5, 5);
		var reduction = reducer.reduce(raw, FormatHint.TILT_SERIES);
		assertTrue(reduction.isPartial());
		assertTrue(reduction.getMessage().get().contains("tilt"));
		var array = reduction.getArray().get().getArray();
		assertArrayEquals(new int[] {3, 5, 5}, array.getShape());
		assertEquals(raw.get(2, 0, 1, 4), array.get(2, 1, 4));
	}
	
	@Test
	public void test_squeezeBeforeReduction() {
		// After squeezing this is 3-D, so nothing is discarded
		var reduction = reducer.reduce(NDArray.zeros(10, 1, 5, 5), FormatHint.NONE);
		assertFalse(reduction.isPartial());
		assertArrayEquals(new int[] {10, 5, 5}, reduction.getArray().get().getShape());
	}
	
	@Test
	public void test_unsupported() {
		var reduction = reducer.reduce(NDArray.zeros(2, 3, 4, 5, 5), FormatHint.NONE);
		assertFalse(reduction.isSupported());
		assertTrue(reduction.getArray().isEmpty());
		assertEquals("5-D data files are not supported", reduction.getMessage().orElse(null));
	}
	
	@Test
	public void test_rawArray() {
		var raw = new RawArray(NDArray.zeros(1, 8, 6), new double[] {1, 0.1, 0.2}, new String[] {"", "nm", "nm"});
		var reduction = reducer.reduce(raw, FormatHint.NONE);
		assertArrayEquals(new int[] {8, 6}, reduction.getArray().get().getShape());
		assertEquals(DisplayCalibration.PIXELS, reduction.getArray().get().getCalibration());
	}
	
	@Test
	public void test_deterministic() {
		var raw = createRange(2, 3, 4, 4);
		var first = reducer.reduce(raw, FormatHint.NONE).getArray().get().getArray();
		var second = reducer.reduce(raw, FormatHint.NONE).getArray().get().getArray();
		assertArrayEquals(first.toArray(), second.toArray());
	}

}
