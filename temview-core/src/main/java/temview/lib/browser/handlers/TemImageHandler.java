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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import temview.lib.browser.AbstractFileHandler;
import temview.lib.browser.StatusReporter;
import temview.lib.browser.views.ImageView;
import temview.lib.common.GeneralTools;
import temview.lib.images.arrays.DimensionReducer;
import temview.lib.images.arrays.DisplayCalibration;
import temview.lib.images.arrays.FormatHint;
import temview.lib.images.arrays.RawArray;
import temview.lib.images.calibration.AxisCalibration;
import temview.lib.images.calibration.PhysicalUnits;
import temview.lib.io.formats.EmdFile;
import temview.lib.io.formats.EmdFormatReader;
import temview.lib.io.formats.FormatReaders;

/**
 * Handler that shows the image data of electron microscopy files.
 * <p>
 * Data with more than 3 dimensions is reduced for display; data that cannot be reduced is reported and 
 * the previous image remains visible.
 * The two trailing axes are calibrated in metres where their units are recognized.
 */
public class TemImageHandler extends AbstractFileHandler<ImageView> {
	
	private static final Logger logger = LoggerFactory.getLogger(TemImageHandler.class);
	
	/**
	 * Name of the handler.
	 */
	public static final String NAME = "TEM data viewer";
	
	/**
	 * Attribute of the EMD data group written by STEMTomo7, which stores tilt series.
	 */
	static final String STEMTOMO_ATTRIBUTE = "stemtomo version";
	
	private static final List<String> EXTENSIONS = List.of(".dm3", ".dm4", ".mrc", ".ali", ".rec", ".emd", ".ser");
	
	private final FormatReaders readers;
	private final DimensionReducer reducer = new DimensionReducer();
	private final StatusReporter reporter;
	
	/**
	 * Create a handler.
	 * @param readers readers used to decode files
	 * @param reporter receiver for load failures and unsupported data
	 */
	public TemImageHandler(FormatReaders readers, StatusReporter reporter) {
		super(NAME, EXTENSIONS, new ImageView(), reporter);
		this.readers = readers;
		this.reporter = reporter;
	}

	@Override
	protected void loadFile(Path path) throws IOException {
		var hint = getFormatHint(path);
		var raw = readers.readArray(path);
		var reduction = reducer.reduce(raw, hint);
		if (!reduction.isSupported()) {
			String message = reduction.getMessage().orElse("Unsupported data") + ": " + path;
			logger.warn(message);
			reporter.report(message);
			return;
		}
		var array = reduction.getArray().get();
		getView().setImage(array.withCalibration(getCalibration(raw)));
	}
	
	private FormatHint getFormatHint(Path path) throws IOException {
		if (!".emd".equals(GeneralTools.getExtension(path).orElse(null)))
			return FormatHint.NONE;
		try (EmdFile file = readers.getReader(EmdFormatReader.class, path).open(path)) {
			if (file.getDataAttributes().containsKey(STEMTOMO_ATTRIBUTE)) {
				logger.debug("STEMTomo7 tilt series: {}", path);
				return FormatHint.TILT_SERIES;
			}
		}
		return FormatHint.NONE;
	}
	
	/**
	 * Get the calibration of the two trailing axes of a raw array.
	 * Each axis is considered separately, and is uncalibrated if its unit is not recognized.
	 * @param raw
	 * @return
	 */
	static DisplayCalibration getCalibration(RawArray raw) {
		int n = raw.rank();
		if (n < 2)
			return DisplayCalibration.PIXELS;
		return new DisplayCalibration(
				getCalibration(raw, n-1),
				getCalibration(raw, n-2));
	}
	
	private static AxisCalibration getCalibration(RawArray raw, int dim) {
		return PhysicalUnits.calibrate(raw.getPixelSize(dim), 0, raw.getPixelUnit(dim));
	}

}
