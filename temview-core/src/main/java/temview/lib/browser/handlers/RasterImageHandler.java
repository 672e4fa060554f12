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

package temview.lib.browser.handlers;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import temview.lib.browser.AbstractFileHandler;
import temview.lib.browser.StatusReporter;
import temview.lib.browser.views.ImageView;
import temview.lib.images.arrays.DisplayArray;
import temview.lib.io.formats.ImageIoFormatReader;

/**
 * Handler for common raster images, read with ImageIO.
 */
public class RasterImageHandler extends AbstractFileHandler<ImageView> {
	
	/**
	 * Name of the handler.
	 */
	public static final String NAME = "Image viewer (ImageIO)";
	
	private static final List<String> EXTENSIONS = List.of(".png", ".tif", ".tiff", ".jpg");
	
	private final ImageIoFormatReader reader = new ImageIoFormatReader();
	
	/**
	 * Create a handler.
	 * @param reporter receiver for load failures
	 */
	public RasterImageHandler(StatusReporter reporter) {
		super(NAME, EXTENSIONS, new ImageView(), reporter);
	}

	@Override
	protected void loadFile(Path path) throws IOException {
		var raw = reader.readArray(path);
		getView().setImage(new DisplayArray(raw.getArray()));
	}

}
