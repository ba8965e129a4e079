package org.moxie.sovereign.nodeattestor;

import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Maps configured attestor names to implementations. Resolution happens once at startup.
 */
public class NodeAttestorRegistry {

  private final Map<String, Supplier<NodeAttestor>> attestors = new TreeMap<>();

  public static NodeAttestorRegistry withDefaults() {
    return new NodeAttestorRegistry().register(UnifiedIdentityNodeAttestor.NAME, UnifiedIdentityNodeAttestor::new);
  }

  public NodeAttestorRegistry register(String name, Supplier<NodeAttestor> factory) {
    if (attestors.putIfAbsent(name, factory) != null) {
      throw new IllegalStateException("Node attestor already registered: " + name);
    }

    return this;
  }

  public NodeAttestor create(String name, Map<String, String> settings) {
    Supplier<NodeAttestor> factory = attestors.get(name);

    if (factory == null) {
      throw new IllegalArgumentException("Unknown node attestor: " + name + " (known: " + attestors.keySet() + ")");
    }

    NodeAttestor attestor = factory.get();
    attestor.configure(settings);
    return attestor;
  }
}
