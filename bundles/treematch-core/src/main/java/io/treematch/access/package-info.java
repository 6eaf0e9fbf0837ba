/**
 * Entry point of document matching: {@link io.treematch.access.DocumentMatcher} and its
 * {@link io.treematch.access.MatcherConfiguration}.
 */
package io.treematch.access;
