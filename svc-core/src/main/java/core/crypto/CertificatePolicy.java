package core.crypto;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.Iterator;
import java.util.List;

import org.bouncycastle.bcpg.HashAlgorithmTags;
import org.bouncycastle.bcpg.sig.IssuerFingerprint;
import org.bouncycastle.openpgp.PGPException;
import org.bouncycastle.openpgp.PGPPublicKey;
import org.bouncycastle.openpgp.PGPPublicKeyRing;
import org.bouncycastle.openpgp.PGPSignature;
import org.bouncycastle.openpgp.PGPSignatureSubpacketVector;
import org.bouncycastle.openpgp.operator.PGPContentVerifierBuilderProvider;
import org.bouncycastle.openpgp.operator.bc.BcPGPContentVerifierBuilderProvider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.exceptions.PolicyException;
import core.model.Fingerprint;
import core.utils.UserIdParser;

/**
 * Decides which User IDs of a certificate are currently valid.
 * <p>
 * Only self-signatures count. A signature is considered when it was created in the past, has not
 * expired and uses an acceptable hash. MD5 and RIPEMD-160 are never accepted; SHA-1 is accepted only
 * for signatures created before {@link #SHA1_CUTOFF}.
 */
public class CertificatePolicy
{
  private static final Logger LOGGER = LoggerFactory.getLogger( CertificatePolicy.class );

  public static final Instant SHA1_CUTOFF = Instant.parse( "2023-02-01T00:00:00Z" );

  private static final int[] CERTIFICATION_TYPES = { PGPSignature.DEFAULT_CERTIFICATION,
                                                     PGPSignature.NO_CERTIFICATION,
                                                     PGPSignature.CASUAL_CERTIFICATION,
                                                     PGPSignature.POSITIVE_CERTIFICATION };

  private final Clock                              clock;
  private final PGPContentVerifierBuilderProvider verifierProvider;

  public CertificatePolicy()
  {
    this( Clock.systemUTC() );
  }

  public CertificatePolicy( Clock clock )
  {
    this.clock            = clock;
    this.verifierProvider = new BcPGPContentVerifierBuilderProvider();
  }

  /**
   * Returns the User IDs bound to the primary key by a valid, unrevoked self-certification.
   * An empty list is a legitimate outcome.
   *
   * @throws PolicyException when the primary key carries no valid self-signature at all, or a
   *                         signature verifier cannot be built for the key
   */
  public List<String> validUserIds( PGPPublicKeyRing cert )
   throws PolicyException
  {
    PGPPublicKey primary     = cert.getPublicKey();
    String       fingerprint = Fingerprint.of( primary ).toHex();
    Date         now         = Date.from( clock.instant() );
    boolean      selfSigned  = false;

    Iterator<PGPSignature> direct = primary.getSignaturesOfType( PGPSignature.DIRECT_KEY );
    while( direct.hasNext() )
    {
      PGPSignature sig = direct.next();
      if( isSelfSignature( sig, primary ) && isAcceptable( sig, now ) && verify( sig, primary, null, fingerprint ) )
        selfSigned = true;
    }

    List<String>     valid   = new ArrayList<String>();
    Iterator<byte[]> userIds = primary.getRawUserIDs();
    while( userIds.hasNext() )
    {
      byte[]       rawUserId     = userIds.next();
      String       userId        = UserIdParser.decode( rawUserId );
      PGPSignature newestCert    = null;
      PGPSignature newestRevoke  = null;

      if( userId == null )
      {
        LOGGER.debug( "Skipping User ID of {} that is not valid UTF-8", fingerprint );
        continue;
      }

      Iterator<PGPSignature> sigs = primary.getSignaturesForID( rawUserId );
      while( sigs != null && sigs.hasNext() )
      {
        PGPSignature sig = sigs.next();
        if( !isSelfSignature( sig, primary ) || !isAcceptable( sig, now ) )
          continue;

        int type = sig.getSignatureType();
        if( isCertificationType( type ) )
        {
          if( verify( sig, primary, rawUserId, fingerprint ) )
          {
            selfSigned = true;
            newestCert = newer( newestCert, sig );
          }
        }
        else if( type == PGPSignature.CERTIFICATION_REVOCATION )
        {
          if( verify( sig, primary, rawUserId, fingerprint ) )
            newestRevoke = newer( newestRevoke, sig );
        }
      }

      if( newestCert == null )
      {
        LOGGER.debug( "User ID '{}' of {} has no valid self-certification", userId, fingerprint );
        continue;
      }

      if( newestRevoke != null && !newestRevoke.getCreationTime().before( newestCert.getCreationTime() ) )
      {
        LOGGER.debug( "User ID '{}' of {} is revoked", userId, fingerprint );
        continue;
      }

      valid.add( userId );
    }

    if( !selfSigned )
      throw new PolicyException( fingerprint, "Primary key " + fingerprint + " has no valid self-signature" );

    return valid;
  }

  /**
   * Returns the newest binding signature of a subkey that was issued by the primary key, is
   * acceptable now and verifies, or null when there is none.
   */
  public PGPSignature latestBinding( PGPPublicKey primary, PGPPublicKey subkey )
  {
    Date         now    = Date.from( clock.instant() );
    PGPSignature latest = null;

    Iterator<PGPSignature> bindings = subkey.getSignaturesOfType( PGPSignature.SUBKEY_BINDING );
    while( bindings.hasNext() )
    {
      PGPSignature sig = bindings.next();
      if( !isSelfSignature( sig, primary ) || !isAcceptable( sig, now ) )
        continue;

      if( verifyBinding( sig, primary, subkey ) )
        latest = newer( latest, sig );
    }

    return latest;
  }

  // PGPSignature holds verifier state, and stored signatures are shared by concurrent lookups
  private boolean verify( PGPSignature sig, PGPPublicKey primary, byte[] rawUserId, String fingerprint )
   throws PolicyException
  {
    synchronized( sig )
    {
      try
      {
        sig.init( verifierProvider, primary );
      }
      catch( PGPException e )
      {
        throw new PolicyException( fingerprint, "Cannot build verifier for " + fingerprint + ": " + e.getMessage(), e );
      }

      try
      {
        if( rawUserId == null )
          return sig.verifyCertification( primary );

        return sig.verifyCertification( rawUserId, primary );
      }
      catch( PGPException | RuntimeException e )
      {
        LOGGER.debug( "Signature on {} failed to verify: {}", fingerprint, e.getMessage() );
        return false;
      }
    }
  }

  private boolean verifyBinding( PGPSignature sig, PGPPublicKey primary, PGPPublicKey subkey )
  {
    synchronized( sig )
    {
      try
      {
        sig.init( verifierProvider, primary );
        return sig.verifyCertification( primary, subkey );
      }
      catch( PGPException | RuntimeException e )
      {
        LOGGER.debug( "Binding of subkey {} failed to verify: {}", Long.toHexString( subkey.getKeyID() ), e.getMessage() );
        return false;
      }
    }
  }

  boolean isAcceptable( PGPSignature sig, Date now )
  {
    Date created = sig.getCreationTime();
    if( created.after( now ) )
      return false;

    PGPSignatureSubpacketVector hashed = sig.getHashedSubPackets();
    if( hashed != null )
    {
      long expirySeconds = hashed.getSignatureExpirationTime();
      if( expirySeconds > 0 && created.getTime() + expirySeconds * 1000L <= now.getTime() )
        return false;
    }

    switch( sig.getHashAlgorithm() )
    {
      case HashAlgorithmTags.MD5:
      case HashAlgorithmTags.RIPEMD160:
        return false;
      case HashAlgorithmTags.SHA1:
        return created.toInstant().isBefore( SHA1_CUTOFF );
      default:
        return true;
    }
  }

  private static boolean isSelfSignature( PGPSignature sig, PGPPublicKey primary )
  {
    if( sig.getKeyID() == primary.getKeyID() )
      return true;

    PGPSignatureSubpacketVector hashed = sig.getHashedSubPackets();
    if( hashed == null )
      return false;

    IssuerFingerprint issuer = hashed.getIssuerFingerprint();
    return issuer != null && Arrays.equals( issuer.getFingerprint(), primary.getFingerprint() );
  }

  private static boolean isCertificationType( int type )
  {
    for( int t : CERTIFICATION_TYPES )
    {
      if( t == type )
        return true;
    }
    return false;
  }

  private static PGPSignature newer( PGPSignature current, PGPSignature candidate )
  {
    if( current == null || candidate.getCreationTime().after( current.getCreationTime() ) )
      return candidate;

    return current;
  }
}
