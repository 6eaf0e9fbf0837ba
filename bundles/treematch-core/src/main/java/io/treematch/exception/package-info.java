/**
 * Exceptions thrown while loading, parsing or configuring document matching. Fingerprinting itself
 * is total and never throws.
 */
package io.treematch.exception;
