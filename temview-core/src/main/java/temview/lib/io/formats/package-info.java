/**
 * Interfaces for decoders of image file formats, and the structures they produce.
 */
package temview.lib.io.formats;
