/**
 * Supporting classes for the command line launcher.
 */
package temview.lib.app;
