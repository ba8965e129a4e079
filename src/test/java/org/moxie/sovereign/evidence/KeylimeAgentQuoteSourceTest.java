package org.moxie.sovereign.evidence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.moxie.sovereign.attestation.AttestationException;
import org.moxie.sovereign.transport.RpcRequest;
import org.moxie.sovereign.transport.RpcResponse;
import org.moxie.sovereign.transport.RpcTransport;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class KeylimeAgentQuoteSourceTest {

  @Mock
  private RpcTransport transport;

  private KeylimeAgentQuoteSource source;

  @BeforeEach
  void setUp() {
    source = new KeylimeAgentQuoteSource(transport, new ObjectMapper(), Duration.ofSeconds(5));
  }

  @Test
  void quote_requestsIdentityQuoteWithHexNonce() throws Exception {
    byte[] nonce = new byte[32];
    nonce[31] = 0x2a;

    String body = "{\"code\":200,\"results\":{\"quote\":\"rAQ==\",\"hash_alg\":\"sha256\",\"pubkey\":\"ak-pem\",\"pcrs\":[\"0:aa\",\"7:bb\"]}}";
    when(transport.exchange(any(), any())).thenReturn(new RpcResponse(200, body.getBytes(StandardCharsets.UTF_8)));

    Quote quote = source.quote(Ring.HOST, nonce);

    ArgumentCaptor<RpcRequest> request = ArgumentCaptor.forClass(RpcRequest.class);
    verify(transport).exchange(request.capture(), any());

    assertEquals("GET", request.getValue().method());
    assertEquals(KeylimeAgentQuoteSource.QUOTE_PATH + "?nonce=" + HexFormat.of().formatHex(nonce), request.getValue().path());
    assertEquals("rAQ==", new String(quote.quoteBytes(), StandardCharsets.UTF_8));
    assertEquals("ak-pem", quote.signerPublicKeyId());
    assertEquals(List.of("0:aa", "7:bb"), quote.platformMeasurements());
  }

  @Test
  void quote_oversizedNonce_isRejectedBeforeCalling() {
    assertThrows(AttestationException.class, () -> source.quote(Ring.HOST, new byte[KeylimeAgentQuoteSource.MAX_NONCE_BYTES + 1]));
    verifyNoInteractions(transport);
  }

  @Test
  void quote_agentError_fails() throws Exception {
    when(transport.exchange(any(), any())).thenReturn(new RpcResponse(400, "bad nonce".getBytes(StandardCharsets.UTF_8)));

    AttestationException e = assertThrows(AttestationException.class, () -> source.quote(Ring.HOST, new byte[32]));

    assertTrue(e.getMessage().contains("400"));
  }

  @Test
  void quote_emptyQuote_fails() throws Exception {
    when(transport.exchange(any(), any())).thenReturn(new RpcResponse(200, "{\"results\":{}}".getBytes(StandardCharsets.UTF_8)));

    assertThrows(AttestationException.class, () -> source.quote(Ring.HOST, new byte[32]));
  }
}
