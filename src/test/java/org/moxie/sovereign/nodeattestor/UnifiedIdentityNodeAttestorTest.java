package org.moxie.sovereign.nodeattestor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UnifiedIdentityNodeAttestorTest {

  @Mock
  private AttestationStream stream;

  private final UnifiedIdentityNodeAttestor attestor = new UnifiedIdentityNodeAttestor();

  @Test
  void attest_sendsMarkerAndReturnsAnswer() throws IOException {
    byte[] challenge = "{\"session_id\":\"s\"}".getBytes(StandardCharsets.UTF_8);
    when(stream.receive()).thenReturn(challenge);

    assertSame(challenge, attestor.attest(stream));
    verify(stream).send("unified_identity".getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void attest_streamFailure_propagatesUnchanged() throws IOException {
    IOException failure = new IOException("stream closed");
    doThrow(failure).when(stream).send(any());

    assertSame(failure, assertThrows(IOException.class, () -> attestor.attest(stream)));
    verify(stream, never()).receive();
  }

  @Test
  void configure_acceptsAnything() {
    assertDoesNotThrow(() -> attestor.configure(null));
    assertDoesNotThrow(() -> attestor.configure(Map.of("anything", "goes")));
  }

  @Test
  void isMarker_recognizesPayload() {
    assertTrue(UnifiedIdentityNodeAttestor.isMarker("unified_identity\n".getBytes(StandardCharsets.UTF_8)));
    assertFalse(UnifiedIdentityNodeAttestor.isMarker("join_token".getBytes(StandardCharsets.UTF_8)));
    assertFalse(UnifiedIdentityNodeAttestor.isMarker(null));
  }
}
