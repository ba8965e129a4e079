package org.moxie.sovereign.services;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.moxie.sovereign.attestation.SovereignAttestationService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PipelineStartupTest {

  @Mock
  private SovereignAttestationService attestationService;

  @Test
  void onStartup_touchesAttestationService() {
    when(attestationService.isEnabled()).thenReturn(true);

    new PipelineStartup(attestationService).onStartup(null);

    verify(attestationService).isEnabled();
  }

  @Test
  void onStartup_pipelineCannotBeBuilt_failsBoot() {
    when(attestationService.isEnabled()).thenThrow(new IllegalArgumentException("Unknown feature flags: bogus"));

    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                                              () -> new PipelineStartup(attestationService).onStartup(null));

    assertEquals("Unknown feature flags: bogus", e.getMessage());
  }
}
