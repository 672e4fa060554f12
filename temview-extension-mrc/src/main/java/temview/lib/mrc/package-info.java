/**
 * Reader for MRC files, registered as a {@link temview.lib.io.formats.FormatReader}.
 */
package temview.lib.mrc;
