package org.moxie.sovereign.config;

import org.junit.jupiter.api.Test;
import org.moxie.sovereign.evidence.Ring;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTest {

  @Test
  void split_trimsAndDropsEmptyEntries() {
    assertEquals(List.of("Spain:*", "Portugal: *"), Config.split(" Spain:* ,, Portugal: * "));
    assertTrue(Config.split(null).isEmpty());
  }

  @Test
  void parseRings_isCaseInsensitive() {
    assertEquals(EnumSet.of(Ring.HOST, Ring.WORKLOAD), Config.parseRings("host, Workload"));
    assertTrue(Config.parseRings("").isEmpty());
  }

  @Test
  void parseRings_unknownRing_fails() {
    assertThrows(IllegalArgumentException.class, () -> Config.parseRings("host,container"));
  }
}
