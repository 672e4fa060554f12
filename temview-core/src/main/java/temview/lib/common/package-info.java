/**
 * General utilities and preferences.
 */
package temview.lib.common;
