/**
 * StAX based provider of {@link io.treematch.api.DocumentView}s.
 */
package io.treematch.service.xml;
