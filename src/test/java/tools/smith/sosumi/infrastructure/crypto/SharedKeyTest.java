package tools.smith.sosumi.infrastructure.crypto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SharedKeyTest {

  @Test
  void requiresExactly32Bytes() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> SharedKey.fromText("too-short"));

    assertTrue(ex.getMessage().contains("32"));
    assertThrows(IllegalArgumentException.class, () -> SharedKey.fromBytes(new byte[33]));
  }

  @Test
  void toStringNeverShowsMaterial() {
    SharedKey key = SharedKey.fromText("0123456789abcdef0123456789abcdef");

    assertFalse(key.toString().contains("0123"));
  }

  @Test
  void equalityFollowsMaterial() {
    assertEquals(SharedKey.fromBytes(new byte[32]), SharedKey.fromBytes(new byte[32]));
  }
}
