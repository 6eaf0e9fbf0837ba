/**
 * Fingerprint keys: the two key folds, the text hash primitives and the recursive node key.
 */
package io.treematch.key;
