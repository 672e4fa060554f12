/**
 * File handlers and the dispatching of file selections to them.
 */
package temview.lib.browser;
