package core.model;

import java.util.Optional;

import org.bouncycastle.openpgp.PGPPublicKeyRing;

/**
 * A source of certificates discoverable through the Web Key Directory.
 */
public interface KeyProviderIF
{
  /**
   * Returns the certificate published for the hashed local part and domain, reduced to
   * the single matching identity, or empty when nothing is published.
   */
  Optional<PGPPublicKeyRing> discover( String encodedLocal, String domain );
}
