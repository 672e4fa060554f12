/**
 * Views shown by file handlers.
 */
package temview.lib.browser.views;
