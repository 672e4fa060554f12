/**
 * Physical units and axis calibrations.
 */
package temview.lib.images.calibration;
