/**
 * N-dimensional arrays and their reduction to a displayable rank.
 */
package temview.lib.images.arrays;
