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

import java.util.Arrays;
import java.util.Objects;

/**
 * Minimal immutable N-dimensional array of numeric values, stored in row-major order 
 * (i.e. the last axis varies fastest).
 * <p>
 * The operations here are the ones needed to reduce the dimensionality of raw data for display; 
 * they never modify the array but may share its storage with the result.
 */
public final class NDArray {
	
	private final int[] shape;
	private final double[] data;
	
	/**
	 * Create a new array.
	 * The data array is used directly, and must not be modified afterwards.
	 * @param shape the size of each axis; may be empty for a single (scalar) value
	 * @param data values in row-major order
	 * @throws IllegalArgumentException if the length of the data does not match the shape
	 */
	public NDArray(int[] shape, double[] data) {
		Objects.requireNonNull(shape);
		Objects.requireNonNull(data);
		long n = 1;
		for (int s : shape) {
			if (s < 0)
				throw new IllegalArgumentException("Invalid shape " + Arrays.toString(shape));
			n *= s;
		}
		if (n != data.length)
			throw new IllegalArgumentException("Shape " + Arrays.toString(shape) + " requires " + n + " values, but " + data.length + " were provided");
		this.shape = shape.clone();
		this.data = data;
	}
	
	/**
	 * Create an array filled with zeros.
	 * @param shape
	 * @return
	 */
	public static NDArray zeros(int... shape) {
		long n = 1;
		for (int s : shape)
			n *= s;
		if (n > Integer.MAX_VALUE)
			throw new IllegalArgumentException("Array of shape " + Arrays.toString(shape) + " is too large");
		return new NDArray(shape, new double[(int)n]);
	}
	
	/**
	 * Number of dimensions.
	 * @return
	 */
	public int rank() {
		return shape.length;
	}
	
	/**
	 * Get a copy of the shape.
	 * @return
	 */
	public int[] getShape() {
		return shape.clone();
	}
	
	/**
	 * Size of the specified axis.
	 * @param axis
	 * @return
	 */
	public int size(int axis) {
		return shape[axis];
	}
	
	/**
	 * Total number of values.
	 * @return
	 */
	public int nValues() {
		return data.length;
	}
	
	/**
	 * Get a single value.
	 * @param index one index per axis
	 * @return
	 */
	public double get(int... index) {
		if (index.length != shape.length)
			throw new IllegalArgumentException("Expected " + shape.length + " indices, but got " + index.length);
		int offset = 0;
		for (int i = 0; i < shape.length; i++) {
			if (index[i] < 0 || index[i] >= shape[i])
				throw new IndexOutOfBoundsException("Index " + index[i] + " out of bounds for axis " + i + " with size " + shape[i]);
			offset = offset * shape[i] + index[i];
		}
		return data[offset];
	}
	
	/**
	 * Get a copy of all values in row-major order.
	 * @return
	 */
	public double[] toArray() {
		return data.clone();
	}
	
	/**
	 * Remove all axes of length 1.
	 * @return an array with the same values, or this array if there are no such axes
	 */
	public NDArray squeeze() {
		int[] newShape = Arrays.stream(shape).filter(s -> s != 1).toArray();
		if (newShape.length == shape.length)
			return this;
		return new NDArray(newShape, data);
	}
	
	/**
	 * Select a single index along one axis, removing that axis.
	 * @param axis the axis to remove
	 * @param index the index to keep along that axis
	 * @return an array with rank one less than this one
	 */
	public NDArray slice(int axis, int index) {
		if (axis < 0 || axis >= shape.length)
			throw new IllegalArgumentException("Axis " + axis + " is not valid for an array of rank " + shape.length);
		if (index < 0 || index >= shape[axis])
			throw new IndexOutOfBoundsException("Index " + index + " out of bounds for axis " + axis + " with size " + shape[axis]);
		int outer = 1;
		for (int i = 0; i < axis; i++)
			outer *= shape[i];
		int inner = 1;
		for (int i = axis + 1; i < shape.length; i++)
			inner *= shape[i];
		
		double[] result = new double[outer * inner];
		for (int o = 0; o < outer; o++) {
			int src = (o * shape[axis] + index) * inner;
			System.arraycopy(data, src, result, o * inner, inner);
		}
		int[] newShape = new int[shape.length - 1];
		for (int i = 0, j = 0; i < shape.length; i++) {
			if (i != axis)
				newShape[j++] = shape[i];
		}
		return new NDArray(newShape, result);
	}
	
	@Override
	public String toString() {
		return "NDArray" + Arrays.toString(shape);
	}

}
