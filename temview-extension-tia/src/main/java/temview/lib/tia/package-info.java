/**
 * Reader for TIA series and EMI files, registered as a {@link temview.lib.io.formats.FormatReader}.
 */
package temview.lib.tia;
