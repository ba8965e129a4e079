package org.moxie.sovereign.evidence;

/**
 * Nested trust domains, outermost first. Bundles list evidence in this order.
 */
public enum Ring {
  HOST,
  VM,
  WORKLOAD
}
