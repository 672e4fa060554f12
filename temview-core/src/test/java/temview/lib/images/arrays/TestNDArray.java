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
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestNDArray {
	
	private static NDArray createRange(int... shape) {
		int n = 1;
		for (int s : shape)
			n *= s;
		return new NDArray(shape, IntStream.range(0, n).asDoubleStream().toArray());
	}
	
	@Test
	public void test_shape() {
		assertThrows(IllegalArgumentException.class, () -> new NDArray(new int[] {2, 3}, new double[5]));
		assertThrows(IllegalArgumentException.class, () -> new NDArray(new int[] {-1}, new double[0]));
		
		var array = createRange(2, 3, 4);
		assertEquals(3, array.rank());
		assertEquals(24, array.nValues());
		assertArrayEquals(new int[] {2, 3, 4}, array.getShape());
		assertEquals(1*12 + 2*4 + 3, array.get(1, 2, 3));
		assertThrows(IndexOutOfBoundsException.class, () -> array.get(2, 0, 0));
	}
	
	@Test
	public void test_squeeze() {
		var array = createRange(1, 5, 1, 5);
		var squeezed = array.squeeze();
		assertArrayEquals(new int[] {5, 5}, squeezed.getShape());
		assertArrayEquals(array.toArray(), squeezed.toArray());
		
		var noSingletons = createRange(2, 2);
		assertSame(noSingletons, noSingletons.squeeze());
	}
	
	@Test
	public void test_slice() {
		var array = createRange(3, 4, 5);
		
		var first = array.slice(0, 2);
		assertArrayEquals(new int[] {4, 5}, first.getShape());
		assertEquals(array.get(2, 3, 1), first.get(3, 1));
		
		var middle = array.slice(1, 0);
		assertArrayEquals(new int[] {3, 5}, middle.getShape());
		for (int i = 0; i < 3; i++) {
			for (int k = 0; k < 5; k++)
				assertEquals(array.get(i, 0, k), middle.get(i, k));
		}
		
		var last = array.slice(2, 4);
		assertArrayEquals(new int[] {3, 4}, last.getShape());
		assertEquals(array.get(1, 2, 4), last.get(1, 2));
		
		assertThrows(IllegalArgumentException.class, () -> array.slice(3, 0));
		assertThrows(IndexOutOfBoundsException.class, () -> array.slice(0, 3));
	}

}
