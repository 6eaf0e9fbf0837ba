/**
 * Read-only views on markup trees consumed by the fingerprinting code. Any tree provider (a DOM, a
 * StAX based builder, a database cursor) can be matched once it exposes these interfaces.
 */
package io.treematch.api;
