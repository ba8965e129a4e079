package org.moxie.sovereign.producers;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.moxie.sovereign.config.Config;
import org.moxie.sovereign.config.FeatureFlags;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FeatureFlagsProducerTest {

  @Mock
  private Config config;

  @Test
  void produceFeatureFlags_knownNames_loadsOnce() {
    when(config.getFeatureFlags()).thenReturn(List.of("-Unified-Identity", "i_am_a_test_flag"));

    FeatureFlagsProducer producer = new FeatureFlagsProducer();
    producer.config = config;

    FeatureFlags flags = producer.produceFeatureFlags();

    assertTrue(flags.isLoaded());
    assertFalse(flags.isEnabled(FeatureFlags.Flag.UNIFIED_IDENTITY));
    assertTrue(flags.isEnabled(FeatureFlags.Flag.TEST_FLAG));
  }

  @Test
  void produceFeatureFlags_unknownName_fails() {
    when(config.getFeatureFlags()).thenReturn(List.of("Unified-Identity", "bogus"));

    FeatureFlagsProducer producer = new FeatureFlagsProducer();
    producer.config = config;

    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, producer::produceFeatureFlags);

    assertTrue(e.getMessage().contains("bogus"), e.getMessage());
  }
}
