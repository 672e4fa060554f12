/**
 * Metadata records, their extraction and caching.
 */
package temview.lib.images.metadata;
