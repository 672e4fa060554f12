/**
 * Built-in file handlers for electron microscopy data and common images.
 */
package temview.lib.browser.handlers;
