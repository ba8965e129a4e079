package org.moxie.sovereign.identity;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * What the attested node asks to be called.
 *
 * @param path      Path below the trust domain, e.g. {@code /agent/node-1}
 * @param parentId  Identity of the issuer of this node's parent ring, may be {@code null}
 * @param selectors Selectors the node requests in addition to the attested ones
 */
public record IdentityRequest(@JsonProperty("path") String path,
                              @JsonProperty("parent_id") String parentId,
                              @JsonProperty("selectors") List<String> selectors)
{

  public IdentityRequest {
    selectors = selectors == null ? List.of() : List.copyOf(selectors);
  }
}
