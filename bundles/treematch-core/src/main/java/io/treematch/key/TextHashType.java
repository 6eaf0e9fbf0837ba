package io.treematch.key;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import net.openhft.hashing.LongHashFunction;

import java.nio.charset.StandardCharsets;

/**
 * Text hash primitives available for fingerprinting tag names, texts and attributes.
 *
 * <p>
 * All of them are deterministic and reasonably distributed, none of them is cryptographic. Keys are
 * never persisted, so changing the primitive only requires both sides of a comparison to use the same
 * one.
 * </p>
 */
public enum TextHashType {

  /**
   * XXH3 over the UTF-16 chars, the default.
   */
  XXH3 {
    private final LongHashFunction hashFunction = LongHashFunction.xx3();

    @Override
    public long hash(final String text) {
      return hashFunction.hashChars(text);
    }
  },

  /**
   * The lower 64 bits of Murmur3 128 over the UTF-8 bytes.
   */
  MURMUR3 {
    private final HashFunction hashFunction = Hashing.murmur3_128();

    @Override
    public long hash(final String text) {
      return hashFunction.hashString(text, StandardCharsets.UTF_8).asLong();
    }
  },

  /**
   * SipHash-2-4 with the default key over the UTF-8 bytes.
   */
  SIP24 {
    private final HashFunction hashFunction = Hashing.sipHash24();

    @Override
    public long hash(final String text) {
      return hashFunction.hashString(text, StandardCharsets.UTF_8).asLong();
    }
  };

  /**
   * Hash a text value.
   *
   * @param text the text, must not be {@code null}
   * @return the 64 bit hash
   */
  public abstract long hash(String text);

  /**
   * Resolve a hash type by name, ignoring case.
   *
   * @param string the name
   * @return the matching hash type
   * @throws IllegalArgumentException if no hash type has that name
   */
  public static TextHashType fromString(final String string) {
    for (final TextHashType hashType : values()) {
      if (hashType.name().equalsIgnoreCase(string)) {
        return hashType;
      }
    }
    throw new IllegalArgumentException("No constant with name " + string + " found");
  }
}
