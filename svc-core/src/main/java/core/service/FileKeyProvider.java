package core.service;

import java.util.Optional;

import org.bouncycastle.openpgp.PGPPublicKeyRing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.crypto.CertificateSanitizer;
import core.exceptions.LockException;
import core.handler.CertificateStore;
import core.model.IdentityMatch;
import core.model.KeyProviderIF;

/**
 * Key provider backed by a {@link CertificateStore} that is fed from a directory of certificate files.
 */
public class FileKeyProvider implements KeyProviderIF
{
  private static final Logger LOGGER = LoggerFactory.getLogger( FileKeyProvider.class );

  private final CertificateStore store;

  public FileKeyProvider( CertificateStore store )
  {
    this.store = store;
  }

  @Override
  public Optional<PGPPublicKeyRing> discover( String encodedLocal, String domain )
  {
    Optional<IdentityMatch> match;

    try
    {
      match = store.findByIdentity( encodedLocal, domain );
    }
    catch( LockException e )
    {
      LOGGER.error( "Lookup of {} at {} failed, answering not found: {}", encodedLocal, domain, e.getMessage() );
      return Optional.empty();
    }

    if( match.isEmpty() )
    {
      LOGGER.debug( "No certificate for {} at {}", encodedLocal, domain );
      return Optional.empty();
    }

    IdentityMatch found = match.get();
    return Optional.of( CertificateSanitizer.sanitize( found.certificate(), found.email(), store.getPolicy() ) );
  }

  public CertificateStore getStore()
  {
    return store;
  }
}
