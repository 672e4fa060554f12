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

package temview;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import temview.lib.app.LogManager;
import temview.lib.app.LogManager.LogLevel;
import temview.lib.browser.DataBrowser;
import temview.lib.browser.HandlerRegistry;
import temview.lib.browser.handlers.DefaultHandlers;
import temview.lib.common.Prefs;
import temview.lib.images.metadata.MetadataCache;
import temview.lib.io.formats.FormatReaders;

/**
 * Main TemView launcher.
 * <p>
 * Each file is selected in turn, as if clicked in a file browser, and the view of the active handler is printed.
 */
@Command(name = "temview", mixinStandardHelpOptions = true, version = "TemView 0.1.0",
		description = "Show the metadata or image data of electron microscopy files.")
public class TemView implements Callable<Integer> {
	
	private static final Logger logger = LoggerFactory.getLogger(TemView.class);
	
	@Parameters(arity = "0..*", paramLabel = "file", description = "Files to select, in order.")
	private List<Path> files = new ArrayList<>();
	
	@Option(names = {"-n", "--handler"}, description = "Name of the handler to use (default = '" + Prefs.DEFAULT_HANDLER_NAME + "').")
	private String handlerName;
	
	@Option(names = {"-a", "--auto-select"}, description = "Choose the handler for each file automatically.")
	private boolean autoSelect = Prefs.getAutoSelectHandler();
	
	@Option(names = {"-c", "--cache-size"}, description = "Number of metadata records to cache per format (default = ${DEFAULT-VALUE}).")
	private int cacheSize = Prefs.DEFAULT_METADATA_CACHE_SIZE;
	
	@Option(names = {"--list-handlers"}, description = "List the available handlers and exit.")
	private boolean listHandlers;
	
	@Option(names = {"-l", "--log"}, description = {"Log level (default = WARN).", "Options: ${COMPLETION-CANDIDATES}"})
	private LogLevel logLevel = LogLevel.WARN;
	
	private final PrintWriter out;
	private final PrintWriter err;
	
	/**
	 * Create a launcher that writes to the specified output.
	 * @param out receiver for rendered views
	 * @param err receiver for status messages
	 */
	public TemView(PrintWriter out, PrintWriter err) {
		this.out = out;
		this.err = err;
	}
	
	/**
	 * Main method to launch TemView.
	 * @param args
	 */
	public static void main(String[] args) {
		var out = new PrintWriter(System.out, true);
		var err = new PrintWriter(System.err, true);
		int exitCode = createCommandLine(new TemView(out, err)).execute(args);
		System.exit(exitCode);
	}
	
	static CommandLine createCommandLine(TemView temview) {
		var cmd = new CommandLine(temview);
		cmd.setCaseInsensitiveEnumValuesAllowed(true);
		cmd.setExpandAtFiles(false);
		return cmd;
	}

	@Override
	public Integer call() {
		if (logLevel != null)
			LogManager.setRootLogLevel(logLevel);
		
		Prefs.setAutoSelectHandler(autoSelect);
		Prefs.setMetadataCacheSize(cacheSize);
		if (handlerName != null)
			Prefs.setDefaultHandlerName(handlerName);
		
		var readers = FormatReaders.fromServiceLoader();
		logger.debug("Installed format readers: {}", readers.getInstalledReaders().size());
		var registry = DefaultHandlers.createRegistry(readers, new MetadataCache(), this::report);
		
		if (listHandlers) {
			for (var handler : registry.getHandlers())
				out.println(handler.getName());
			out.flush();
			return 0;
		}
		
		var browser = new DataBrowser(registry);
		if (handlerName != null) {
			if (registry.getHandler(handlerName).isEmpty()) {
				err.println("Unknown handler '" + handlerName + "'");
				err.flush();
				return 2;
			}
			browser.setActiveHandler(handlerName);
		}
		
		int nFailed = 0;
		for (var file : files) {
			if (!browser.selectFile(file)) {
				nFailed++;
				continue;
			}
			printView(registry, file);
		}
		out.flush();
		err.flush();
		return nFailed == 0 ? 0 : 1;
	}
	
	private void printView(HandlerRegistry registry, Path file) {
		var handler = registry.getActiveHandler().orElse(null);
		if (handler == null)
			return;
		out.println("== " + file + " [" + handler.getName() + "]");
		out.println(handler.getView().getSummary());
	}
	
	private void report(String message) {
		err.println(message);
	}

}
