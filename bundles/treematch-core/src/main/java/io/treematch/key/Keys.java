package io.treematch.key;

import com.google.common.base.Strings;

/**
 * Folds fingerprint keys into a single key.
 *
 * <p>
 * A key is a 64 bit value whose bit pattern is its only identity, the sign bit is just another bit.
 * Two folds are offered:
 * </p>
 * <ul>
 * <li>{@link #combineUniquely(long...)} mixes both the value and the position of every key, so the
 * result changes (with high probability) if two different keys swap places. It is used wherever the
 * role of a key matters, like name versus value of an attribute.</li>
 * <li>{@link #combineLoosely(long...)} is the bitwise XOR of all keys. It is invariant under
 * permutation and under insertion of {@link #IDENTITY} keys, and is used for unordered collections
 * such as attribute sets and sibling elements.</li>
 * </ul>
 * Both folds return {@link #IDENTITY} when called without keys.
 */
public final class Keys {

  /**
   * The identity key, seed of both folds.
   */
  public static final long IDENTITY = 0L;

  /**
   * Odd constant derived from the golden ratio, spreads the bits of weakly distributed keys.
   */
  static final long MAGIC = 0x9e3779b9L;

  private Keys() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Order-sensitive combination of keys.
   *
   * @param keys the keys in their significant order
   * @return the combined key
   */
  public static long combineUniquely(final long... keys) {
    long result = IDENTITY;
    for (final long key : keys) {
      result = mix(result, key);
    }
    return result;
  }

  /**
   * Order-sensitive combination of two keys.
   *
   * @param first the first key
   * @param second the second key
   * @return the combined key
   */
  public static long combineUniquely(final long first, final long second) {
    return mix(mix(IDENTITY, first), second);
  }

  /**
   * Order-sensitive combination of four keys.
   *
   * @param first the first key
   * @param second the second key
   * @param third the third key
   * @param fourth the fourth key
   * @return the combined key
   */
  public static long combineUniquely(final long first, final long second, final long third, final long fourth) {
    return mix(mix(mix(mix(IDENTITY, first), second), third), fourth);
  }

  /**
   * Order-insensitive combination of keys.
   *
   * @param keys the keys in any order
   * @return the combined key
   */
  public static long combineLoosely(final long... keys) {
    long result = IDENTITY;
    for (final long key : keys) {
      result ^= key;
    }
    return result;
  }

  /**
   * Order-insensitive combination of two keys. Used as the step function when folding an iterable.
   *
   * @param accumulator the keys folded so far
   * @param key the key to add
   * @return the combined key
   */
  public static long combineLoosely(final long accumulator, final long key) {
    return accumulator ^ key;
  }

  /**
   * One hash-combine step. Arithmetic wraps around, the right shift is unsigned.
   */
  private static long mix(final long accumulator, final long key) {
    return accumulator ^ (key + MAGIC + (accumulator << 6) + (accumulator >>> 2));
  }

  /**
   * Format a key as a zero-padded unsigned hex string, for logging.
   *
   * @param key the key
   * @return sixteen hex digits
   */
  public static String toHexString(final long key) {
    return Strings.padStart(Long.toHexString(key), 16, '0');
  }
}
