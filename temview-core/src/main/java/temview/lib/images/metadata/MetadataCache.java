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

package temview.lib.images.metadata;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import temview.lib.common.Prefs;

/**
 * Cache for metadata records, so that selecting the same file again does not re-parse its header.
 * <p>
 * Each extractor has its own cache with a fixed capacity; when the capacity is exceeded, the least-recently-used 
 * record is evicted. Records are keyed by absolute path only: a file that is modified after being cached 
 * can return stale metadata until its record is evicted or invalidated.
 * Failed extractions are never cached.
 */
public class MetadataCache {
	
	private static final Logger logger = LoggerFactory.getLogger(MetadataCache.class);
	
	private final int capacity;
	
	private final Map<String, Cache<String, MetadataRecord>> caches = new HashMap<>();
	
	/**
	 * Create a cache using the capacity from {@link Prefs#getMetadataCacheSize()}.
	 */
	public MetadataCache() {
		this(Prefs.getMetadataCacheSize());
	}
	
	/**
	 * Create a cache with the specified capacity per extractor.
	 * @param capacity
	 */
	public MetadataCache(int capacity) {
		if (capacity < 1)
			throw new IllegalArgumentException("Cache capacity must be at least 1, but was " + capacity);
		this.capacity = capacity;
	}
	
	/**
	 * Get the maximum number of records retained for each extractor.
	 * @return
	 */
	public int getCapacity() {
		return capacity;
	}
	
	/**
	 * Get the cached metadata for a file, or extract and cache it if it is not available.
	 * @param extractor
	 * @param path
	 * @return
	 * @throws IOException if the extraction fails (nothing is cached in this case)
	 */
	public synchronized MetadataRecord getOrCompute(MetadataExtractor extractor, Path path) throws IOException {
		var cache = caches.computeIfAbsent(extractor.getId(), id -> createCache());
		String key = toKey(path);
		var record = cache.getIfPresent(key);
		if (record != null) {
			logger.trace("Returning cached metadata for {}", key);
			return record;
		}
		long startTime = System.currentTimeMillis();
		record = Objects.requireNonNull(extractor.extract(path), "Extractor " + extractor.getId() + " returned null");
		cache.put(key, record);
		logger.debug("Metadata extracted from {} in {} ms", key, System.currentTimeMillis() - startTime);
		return record;
	}
	
	/**
	 * Query whether a record is cached, without affecting its recency.
	 * @param extractorId
	 * @param path
	 * @return
	 */
	public synchronized boolean contains(String extractorId, Path path) {
		var cache = caches.get(extractorId);
		return cache != null && cache.asMap().containsKey(toKey(path));
	}
	
	/**
	 * Number of records currently cached for an extractor.
	 * @param extractorId
	 * @return
	 */
	public synchronized long size(String extractorId) {
		var cache = caches.get(extractorId);
		return cache == null ? 0 : cache.size();
	}
	
	/**
	 * Remove any cached records for a file, for all extractors.
	 * @param path
	 */
	public synchronized void invalidate(Path path) {
		String key = toKey(path);
		for (var cache : caches.values())
			cache.invalidate(key);
	}
	
	/**
	 * Remove all cached records.
	 */
	public synchronized void invalidateAll() {
		for (var cache : caches.values())
			cache.invalidateAll();
	}
	
	private Cache<String, MetadataRecord> createCache() {
		// A single segment gives strict least-recently-used eviction
		return CacheBuilder.newBuilder()
				.concurrencyLevel(1)
				.maximumSize(capacity)
				.build();
	}
	
	static String toKey(Path path) {
		return path.toAbsolutePath().normalize().toString();
	}

}
