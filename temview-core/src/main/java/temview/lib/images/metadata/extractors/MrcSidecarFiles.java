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

package temview.lib.images.metadata.extractors;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import temview.lib.common.GeneralTools;

/**
 * Readers for the text files that tomography software writes next to an MRC stack.
 */
final class MrcSidecarFiles {
	
	private static final Logger logger = LoggerFactory.getLogger(MrcSidecarFiles.class);
	
	/**
	 * Lines skipped at the start of an FEI parameter listing.
	 */
	static final int PARAMETER_HEADER_LINES = 3;
	
	/**
	 * Lines skipped at the end of an FEI parameter listing.
	 */
	static final int PARAMETER_FOOTER_LINES = 1;
	
	/**
	 * Column at which the 'name: value' text starts in an FEI parameter listing.
	 */
	static final int PARAMETER_COLUMN = 18;
	
	private MrcSidecarFiles() {
		throw new AssertionError();
	}
	
	/**
	 * Read a tilt angle list (.rawtlt), with one angle per line. Lines that are not numbers are skipped.
	 * @param file
	 * @return the angles, or empty if the file does not exist or cannot be read
	 */
	static Optional<List<Double>> readTiltAngles(Path file) {
		if (!Files.isRegularFile(file))
			return Optional.empty();
		List<String> lines;
		try {
			lines = readLines(file);
		} catch (IOException e) {
			logger.warn("Unable to read tilt angles from {}: {}", file, e.getLocalizedMessage());
			return Optional.empty();
		}
		List<Double> angles = new ArrayList<>();
		for (String line : lines) {
			if (line.isBlank())
				continue;
			try {
				angles.add(Double.parseDouble(line.strip()));
			} catch (NumberFormatException e) {
				logger.debug("Skipping tilt angle line '{}' in {}", line, file);
			}
		}
		return Optional.of(angles);
	}
	
	/**
	 * Read an FEI parameter listing (.txt). After skipping a fixed header and footer, each line is expected to contain 
	 * {@code name: value} starting from a fixed column. Lines that do not contain a numeric value are skipped.
	 * @param file
	 * @return the parameters in file order, or an empty map if the file does not exist or cannot be read
	 */
	static Map<String, Double> readParameters(Path file) {
		Map<String, Double> parameters = new LinkedHashMap<>();
		if (!Files.isRegularFile(file))
			return parameters;
		List<String> lines;
		try {
			lines = readLines(file);
		} catch (IOException e) {
			logger.warn("Unable to read parameters from {}: {}", file, e.getLocalizedMessage());
			return parameters;
		}
		for (int i = PARAMETER_HEADER_LINES; i < lines.size() - PARAMETER_FOOTER_LINES; i++) {
			String line = lines.get(i);
			String text = line.length() > PARAMETER_COLUMN ? line.substring(PARAMETER_COLUMN).strip() : "";
			String[] parts = text.split(":");
			if (parts.length < 2)
				continue;
			try {
				parameters.put(parts[0].strip(), Double.parseDouble(parts[1].strip()));
			} catch (NumberFormatException e) {
				logger.trace("Skipping non-numeric parameter '{}'", text);
			}
		}
		return parameters;
	}
	
	private static List<String> readLines(Path file) throws IOException {
		String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
		var lines = new ArrayList<>(Arrays.asList(GeneralTools.splitLines(text)));
		// A final line ending does not start another line
		if (!lines.isEmpty() && lines.get(lines.size()-1).isEmpty())
			lines.remove(lines.size()-1);
		return lines;
	}

}
