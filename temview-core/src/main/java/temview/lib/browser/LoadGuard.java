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

package temview.lib.browser;

import java.nio.file.Path;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import temview.lib.browser.views.HandlerView;

/**
 * Boundary around each file load of a handler.
 * <p>
 * If a load fails, the view shows a placeholder, a single message naming the file and the cause is reported 
 * and a {@link FileLoadException} is thrown so that the caller knows the load did not succeed.
 */
public class LoadGuard {
	
	private static final Logger logger = LoggerFactory.getLogger(LoadGuard.class);
	
	/**
	 * A load that may fail with any exception.
	 */
	@FunctionalInterface
	public static interface LoadTask {
		
		/**
		 * Load the file.
		 * @throws Exception
		 */
		void run() throws Exception;
		
	}
	
	private final StatusReporter reporter;
	
	/**
	 * Create a guard that reports failures to the specified reporter.
	 * @param reporter
	 */
	public LoadGuard(StatusReporter reporter) {
		this.reporter = Objects.requireNonNull(reporter);
	}
	
	/**
	 * Run a load for the specified file.
	 * @param path the file being loaded
	 * @param view the view to reset if the load fails
	 * @param task the load
	 * @throws FileLoadException if the load failed
	 */
	public void load(Path path, HandlerView view, LoadTask task) throws FileLoadException {
		try {
			task.run();
		} catch (Exception e) {
			view.showPlaceholder();
			String message = createMessage(path, e);
			logger.error(message, e);
			reporter.report(message);
			throw new FileLoadException(path, e);
		}
	}
	
	/**
	 * Create the message shown when a file could not be loaded.
	 * @param path
	 * @param cause
	 * @return
	 */
	static String createMessage(Path path, Throwable cause) {
		String detail = cause.getLocalizedMessage();
		if (detail == null || detail.isBlank())
			detail = cause.getClass().getSimpleName();
		return "Failed to load " + path + ":\n" + detail;
	}

}
