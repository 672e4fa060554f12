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
import java.util.Map;

/**
 * Reader for TIA files: series (SER) files and their companion EMI files.
 */
public interface SerFormatReader extends FormatReader {
	
	/**
	 * Open a series file. The caller is responsible for closing it.
	 * @param path
	 * @return
	 * @throws IOException
	 */
	SerFile open(Path path) throws IOException;
	
	/**
	 * Read the metadata of an EMI file.
	 * @param path
	 * @return
	 * @throws IOException
	 */
	Map<String, Object> readEmi(Path path) throws IOException;

}
