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

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import temview.lib.common.GeneralTools;
import temview.lib.images.arrays.RawArray;

/**
 * Collection of the installed {@link FormatReader FormatReaders}, responsible for finding the reader for a file.
 * <p>
 * Readers are queried in order, and the first that supports both the requested capability and the file extension is used.
 */
public class FormatReaders {
	
	private static final Logger logger = LoggerFactory.getLogger(FormatReaders.class);
	
	private final List<FormatReader> readers;
	
	// Capability and extension pairs already warned about
	private final Set<String> missingReaders = ConcurrentHashMap.newKeySet();
	
	/**
	 * Create a collection from the specified readers.
	 * @param readers
	 */
	public FormatReaders(Collection<? extends FormatReader> readers) {
		this.readers = Collections.unmodifiableList(new ArrayList<>(readers));
	}
	
	/**
	 * Create a collection of all readers that can be found by the default {@link ServiceLoader}.
	 * @return
	 */
	public static FormatReaders fromServiceLoader() {
		return fromServiceLoader(ServiceLoader.load(FormatReader.class));
	}
	
	/**
	 * Create a collection of all readers found by a specific {@link ServiceLoader}.
	 * <p>
	 * This can be handy if the readers should be loaded with an alternative ClassLoader.
	 * Readers that fail to load are logged and skipped.
	 * @param serviceLoader
	 * @return
	 */
	public static FormatReaders fromServiceLoader(ServiceLoader<FormatReader> serviceLoader) {
		List<FormatReader> list = new ArrayList<>();
		var iterator = serviceLoader.iterator();
		while (true) {
			try {
				if (!iterator.hasNext())
					break;
				var reader = iterator.next();
				logger.debug("Found format reader: {}", reader.getName());
				list.add(reader);
			} catch (ServiceConfigurationError e) {
				logger.error("Unable to load format reader: " + e.getLocalizedMessage(), e);
			}
		}
		return new FormatReaders(list);
	}
	
	/**
	 * Get all installed readers.
	 * @return
	 */
	public List<FormatReader> getInstalledReaders() {
		return readers;
	}
	
	/**
	 * Get the first reader with the specified capability that supports a file.
	 * @param <T>
	 * @param type the required capability, e.g. {@link MrcFormatReader}
	 * @param path
	 * @return
	 * @throws IOException if no suitable reader is installed
	 */
	public <T extends FormatReader> T getReader(Class<T> type, Path path) throws IOException {
		for (var reader : readers) {
			if (type.isInstance(reader) && reader.supportsFile(path))
				return type.cast(reader);
		}
		String ext = GeneralTools.getExtension(path).orElse("(no extension)");
		String message;
		if (type == FormatReader.class)
			message = "No format reader installed for " + ext + " files";
		else
			message = "No " + type.getSimpleName() + " installed for " + ext + " files";
		if (notifyMissingReader(type, ext))
			logger.warn(message);
		else
			logger.debug(message);
		throw new IOException(message);
	}
	
	/**
	 * Record that no reader with a capability is installed for an extension.
	 * A file browser requests the same missing reader for every file of that kind, so only the first request 
	 * should be reported as a warning.
	 * @param type
	 * @param ext
	 * @return true if this is the first time the capability was missing for the extension
	 */
	boolean notifyMissingReader(Class<? extends FormatReader> type, String ext) {
		return missingReaders.add(type.getName() + ":" + ext);
	}
	
	/**
	 * Read the pixels of a file using the first reader that supports it.
	 * @param path
	 * @return
	 * @throws IOException if no reader is installed, or the file cannot be read
	 */
	public RawArray readArray(Path path) throws IOException {
		return getReader(FormatReader.class, path).readArray(path);
	}

}
