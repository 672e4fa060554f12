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

/**
 * Hint describing how the leading axes of a raw array were acquired, used to choose which slice to display.
 */
public enum FormatHint {
	
	/**
	 * Nothing is known about the acquisition.
	 */
	NONE,
	
	/**
	 * Tilt series storing several images per tilt angle (e.g. STEMTomo7 EMD files), 
	 * with the tilt angle on the first axis.
	 */
	TILT_SERIES;

}
