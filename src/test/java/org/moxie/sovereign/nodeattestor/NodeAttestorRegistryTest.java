package org.moxie.sovereign.nodeattestor;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NodeAttestorRegistryTest {

  @Test
  void create_defaultRegistry_resolvesUnifiedIdentity() {
    NodeAttestor attestor = NodeAttestorRegistry.withDefaults().create("unified_identity", Map.of());

    assertInstanceOf(UnifiedIdentityNodeAttestor.class, attestor);
    assertEquals("unified_identity", attestor.name());
  }

  @Test
  void create_unknownName_fails() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                                              () -> NodeAttestorRegistry.withDefaults().create("tpm_devid", Map.of()));

    assertTrue(e.getMessage().contains("tpm_devid"));
  }

  @Test
  void register_duplicateName_fails() {
    NodeAttestorRegistry registry = NodeAttestorRegistry.withDefaults();

    assertThrows(IllegalStateException.class, () -> registry.register("unified_identity", UnifiedIdentityNodeAttestor::new));
  }
}
