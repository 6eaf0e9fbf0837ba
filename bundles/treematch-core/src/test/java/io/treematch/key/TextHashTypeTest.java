package io.treematch.key;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public final class TextHashTypeTest {

  @ParameterizedTest
  @EnumSource(TextHashType.class)
  public void testDeterministic(final TextHashType hashType) {
    assertEquals(hashType.hash("config"), hashType.hash(new String("config".toCharArray())));
  }

  @ParameterizedTest
  @EnumSource(TextHashType.class)
  public void testDistinguishesTexts(final TextHashType hashType) {
    assertNotEquals(hashType.hash("hello"), hashType.hash("world"));
    assertNotEquals(hashType.hash(""), hashType.hash(" "));
    assertNotEquals(hashType.hash("ab"), hashType.hash("ba"));
  }

  @Test
  public void testFromString() {
    assertEquals(TextHashType.XXH3, TextHashType.fromString("xxh3"));
    assertEquals(TextHashType.MURMUR3, TextHashType.fromString("Murmur3"));
    assertEquals(TextHashType.SIP24, TextHashType.fromString("SIP24"));
    assertThrows(IllegalArgumentException.class, () -> TextHashType.fromString("md5"));
  }
}
