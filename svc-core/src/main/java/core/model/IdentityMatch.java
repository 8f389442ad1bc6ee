package core.model;

import org.bouncycastle.openpgp.PGPPublicKeyRing;

/**
 * Result of an identity lookup: the stored local part and domain plus the full certificate.
 */
public record IdentityMatch( String localPart, String domain, PGPPublicKeyRing certificate )
{
  public String email()
  {
    return localPart + "@" + domain;
  }
}
