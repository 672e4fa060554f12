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

package temview.lib.browser.views;

import java.util.Arrays;
import java.util.Objects;

import temview.lib.images.arrays.DisplayArray;
import temview.lib.images.calibration.AxisCalibration;

/**
 * A view that shows an image, or a stack of images, with an optional physical calibration.
 */
public class ImageView implements HandlerView {
	
	/**
	 * Height and width of the blank image shown after a failed load.
	 */
	public static final int PLACEHOLDER_SIZE = 10;
	
	private boolean visible = false;
	private DisplayArray image;
	
	/**
	 * Get the current image.
	 * @return the image, or null if no image has been set
	 */
	public DisplayArray getImage() {
		return image;
	}
	
	/**
	 * Set the current image.
	 * @param image
	 */
	public void setImage(DisplayArray image) {
		this.image = Objects.requireNonNull(image);
	}

	@Override
	public void setVisible(boolean visible) {
		this.visible = visible;
	}

	@Override
	public boolean isVisible() {
		return visible;
	}

	/**
	 * Shows a blank 10 x 10 image.
	 */
	@Override
	public void showPlaceholder() {
		image = DisplayArray.blank(PLACEHOLDER_SIZE, PLACEHOLDER_SIZE);
	}

	@Override
	public String getSummary() {
		if (image == null)
			return "No image";
		var cal = image.getCalibration();
		return "Image " + Arrays.toString(image.getShape()) + 
				", x: " + toString(cal.getX()) + 
				", y: " + toString(cal.getY());
	}
	
	private static String toString(AxisCalibration cal) {
		if (!cal.isCalibrated())
			return "pixels";
		return cal.getScale() + " " + cal.getUnit() + " per pixel (origin " + cal.getOrigin() + ")";
	}

}
