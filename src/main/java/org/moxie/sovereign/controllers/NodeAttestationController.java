package org.moxie.sovereign.controllers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.moxie.sovereign.attestation.AttestationException;
import org.moxie.sovereign.attestation.AttestationOutcome;
import org.moxie.sovereign.attestation.Challenge;
import org.moxie.sovereign.attestation.EvidenceSubmission;
import org.moxie.sovereign.attestation.SovereignAttestationService;
import org.moxie.sovereign.attestation.TransportException;
import org.moxie.sovereign.evidence.BundleException;
import org.moxie.sovereign.session.Session;
import org.moxie.sovereign.session.SessionException;
import org.moxie.sovereign.verifier.VerificationFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@ApplicationScoped
@Path("/v1/node")
public class NodeAttestationController {

  private static final Logger log = LoggerFactory.getLogger(NodeAttestationController.class);

  @Inject
  SovereignAttestationService attestationService;

  @Inject
  ObjectMapper mapper;

  public NodeAttestationController() {}

  NodeAttestationController(SovereignAttestationService attestationService, ObjectMapper mapper) {
    this.attestationService = attestationService;
    this.mapper             = mapper;
  }

  @POST
  @Path("/attest")
  @Consumes(MediaType.WILDCARD)
  @Produces(MediaType.APPLICATION_JSON)
  public Response attest(byte[] payload) {
    if (!attestationService.isEnabled()) {
      return error(Response.Status.NOT_FOUND, "Unified identity is disabled");
    }

    try {
      Session session = attestationService.beginAttestation(payload);
      return Response.ok(mapper.writeValueAsString(Challenge.from(session))).build();
    } catch (IllegalArgumentException e) {
      log.warn("Rejected node attestation trigger: {}", e.getMessage());
      return error(Response.Status.BAD_REQUEST, e.getMessage());
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize challenge", e);
      return error(Response.Status.INTERNAL_SERVER_ERROR, "Failed to serialize challenge");
    }
  }

  @POST
  @Path("/evidence")
  @Consumes(MediaType.APPLICATION_JSON)
  @Produces(MediaType.APPLICATION_JSON)
  public Response evidence(String body) {
    if (!attestationService.isEnabled()) {
      return error(Response.Status.NOT_FOUND, "Unified identity is disabled");
    }

    EvidenceSubmission submission;

    try {
      submission = mapper.readValue(body, EvidenceSubmission.class);
    } catch (JsonProcessingException e) {
      log.warn("Unparseable evidence submission", e);
      return error(Response.Status.BAD_REQUEST, "Invalid evidence submission");
    }

    try {
      AttestationOutcome outcome = attestationService.completeAttestation(submission);
      Response.Status    status  = outcome.isIssued() ? Response.Status.OK : Response.Status.FORBIDDEN;

      return Response.status(status).entity(mapper.writeValueAsString(outcome)).build();
    } catch (IllegalArgumentException e) {
      return error(Response.Status.BAD_REQUEST, e.getMessage());
    } catch (SessionException | BundleException e) {
      log.warn("Rejected evidence: {}", e.getMessage());
      return error(Response.Status.CONFLICT, e);
    } catch (VerificationFailedException | TransportException e) {
      log.warn("Verification failed: {}", e.getMessage());
      return error(Response.Status.BAD_GATEWAY, e);
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize outcome", e);
      return error(Response.Status.INTERNAL_SERVER_ERROR, "Failed to serialize outcome");
    } catch (AttestationException e) {
      log.error("Attestation failed", e);
      return error(Response.Status.INTERNAL_SERVER_ERROR, "Attestation failed");
    }
  }

  private Response error(Response.Status status, String message) {
    return error(status, mapper.createObjectNode().put("error", message));
  }

  private Response error(Response.Status status, AttestationException e) {
    return error(status, mapper.createObjectNode().put("error", e.getMessage()).put("retryable", e.isRetryable()));
  }

  private Response error(Response.Status status, ObjectNode node) {
    return Response.status(status).entity(node.toString()).type(MediaType.APPLICATION_JSON).build();
  }
}
