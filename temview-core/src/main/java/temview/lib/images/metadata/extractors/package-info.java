/**
 * Metadata extractors for specific electron microscopy file formats.
 * <p>
 * Extractors depend only on the interfaces in {@link temview.lib.io.formats}; the decoders themselves are 
 * discovered at runtime.
 */
package temview.lib.images.metadata.extractors;
