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

package temview.lib.io.formats;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed header of an MRC file (and the related ALI and REC tomography files).
 * <p>
 * Voxel sizes are in Ångström, as stored in the file; a value that is not positive means that the axis is not calibrated.
 */
public final class MrcHeader {
	
	private int[] dimensions = new int[3];
	private int mode;
	private double voxelSizeX, voxelSizeY, voxelSizeZ;
	private int[] axisOrientations = {1, 2, 3};
	private double[] cellAngles = {90, 90, 90};
	private String extendedHeaderType = "";
	private Map<String, Object> vendorInfo;
	
	private MrcHeader() {}
	
	/**
	 * Number of columns, rows and sections (nx, ny, nz).
	 * @return
	 */
	public int[] getDimensions() {
		return dimensions.clone();
	}
	
	/**
	 * MRC data mode, e.g. 2 for 32-bit float.
	 * @return
	 */
	public int getMode() {
		return mode;
	}
	
	/**
	 * Voxel size along X, in Ångström.
	 * @return
	 */
	public double getVoxelSizeX() {
		return voxelSizeX;
	}
	
	/**
	 * Voxel size along Y, in Ångström.
	 * @return
	 */
	public double getVoxelSizeY() {
		return voxelSizeY;
	}
	
	/**
	 * Voxel size along Z, in Ångström.
	 * @return
	 */
	public double getVoxelSizeZ() {
		return voxelSizeZ;
	}
	
	/**
	 * Axes corresponding to columns, rows and sections (mapc, mapr, maps).
	 * @return
	 */
	public int[] getAxisOrientations() {
		return axisOrientations.clone();
	}
	
	/**
	 * Cell angles alpha, beta and gamma, in degrees.
	 * @return
	 */
	public double[] getCellAngles() {
		return cellAngles.clone();
	}
	
	/**
	 * Type of extended header, e.g. "FEI1", or an empty string.
	 * @return
	 */
	public String getExtendedHeaderType() {
		return extendedHeaderType;
	}
	
	/**
	 * Vendor-specific information, e.g. from an FEI extended header, if available.
	 * @return
	 */
	public Optional<Map<String, Object>> getVendorInfo() {
		return Optional.ofNullable(vendorInfo);
	}
	
	
	/**
	 * Builder for an {@link MrcHeader}.
	 */
	public static final class Builder {
		
		private MrcHeader header = new MrcHeader();
		
		/**
		 * Set the number of columns, rows and sections.
		 * @param nx
		 * @param ny
		 * @param nz
		 * @return
		 */
		public Builder dimensions(int nx, int ny, int nz) {
			header.dimensions = new int[] {nx, ny, nz};
			return this;
		}
		
		/**
		 * Set the data mode.
		 * @param mode
		 * @return
		 */
		public Builder mode(int mode) {
			header.mode = mode;
			return this;
		}
		
		/**
		 * Set the voxel sizes in Ångström.
		 * @param x
		 * @param y
		 * @param z
		 * @return
		 */
		public Builder voxelSize(double x, double y, double z) {
			header.voxelSizeX = x;
			header.voxelSizeY = y;
			header.voxelSizeZ = z;
			return this;
		}
		
		/**
		 * Set the axes corresponding to columns, rows and sections.
		 * @param mapc
		 * @param mapr
		 * @param maps
		 * @return
		 */
		public Builder axisOrientations(int mapc, int mapr, int maps) {
			header.axisOrientations = new int[] {mapc, mapr, maps};
			return this;
		}
		
		/**
		 * Set the cell angles in degrees.
		 * @param alpha
		 * @param beta
		 * @param gamma
		 * @return
		 */
		public Builder cellAngles(double alpha, double beta, double gamma) {
			header.cellAngles = new double[] {alpha, beta, gamma};
			return this;
		}
		
		/**
		 * Set the extended header type.
		 * @param type
		 * @return
		 */
		public Builder extendedHeaderType(String type) {
			header.extendedHeaderType = type == null ? "" : type;
			return this;
		}
		
		/**
		 * Set vendor-specific information.
		 * @param info
		 * @return
		 */
		public Builder vendorInfo(Map<String, ?> info) {
			header.vendorInfo = info == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(info));
			return this;
		}
		
		/**
		 * Build the header.
		 * @return
		 */
		public MrcHeader build() {
			var built = header;
			header = null;
			return built;
		}
		
	}

}
