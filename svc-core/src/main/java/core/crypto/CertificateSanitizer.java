package core.crypto;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.bouncycastle.bcpg.sig.KeyFlags;
import org.bouncycastle.openpgp.PGPPublicKey;
import org.bouncycastle.openpgp.PGPPublicKeyRing;
import org.bouncycastle.openpgp.PGPSignature;
import org.bouncycastle.openpgp.PGPSignatureSubpacketVector;
import org.bouncycastle.openpgp.PGPUserAttributeSubpacketVector;

import core.utils.UserIdParser;

/**
 * Reduces a certificate to what a WKD client needs for one address:
 * <ol>
 *   <li>only the User ID whose declared email equals the target,</li>
 *   <li>no user attributes (photo IDs and the like),</li>
 *   <li>only subkeys whose latest binding self-signature allows signing or transport encryption.</li>
 * </ol>
 * User IDs that are not valid UTF-8 never match. The input ring is left untouched.
 */
public class CertificateSanitizer
{
  private static final int USABLE_FLAGS = KeyFlags.ENCRYPT_COMMS | KeyFlags.SIGN_DATA;

  private static final CertificatePolicy DEFAULT_POLICY = new CertificatePolicy();

  public static PGPPublicKeyRing sanitize( PGPPublicKeyRing cert, String targetEmail )
  {
    return sanitize( cert, targetEmail, DEFAULT_POLICY );
  }

  /**
   * @param policy decides which subkey binding signatures are genuine and current
   */
  public static PGPPublicKeyRing sanitize( PGPPublicKeyRing cert, String targetEmail, CertificatePolicy policy )
  {
    PGPPublicKey master  = cert.getPublicKey();
    PGPPublicKey primary = dropUserAttributes( retainUserId( master, targetEmail ) );

    List<PGPPublicKey> keys = new ArrayList<PGPPublicKey>();
    keys.add( primary );

    Iterator<PGPPublicKey> it = cert.getPublicKeys();
    while( it.hasNext() )
    {
      PGPPublicKey key = it.next();
      if( key.isMasterKey() )
        continue;

      if( isUsableSubkey( policy, master, key ) )
        keys.add( key );
    }

    return new PGPPublicKeyRing( keys );
  }

  private static PGPPublicKey retainUserId( PGPPublicKey primary, String targetEmail )
  {
    List<byte[]>     drop = new ArrayList<byte[]>();
    Iterator<byte[]> ids  = primary.getRawUserIDs();
    while( ids.hasNext() )
    {
      byte[] id = ids.next();
      if( targetEmail == null || !targetEmail.equals( UserIdParser.email( UserIdParser.decode( id ) ) ) )
        drop.add( id );
    }

    for( byte[] id : drop )
    {
      PGPPublicKey reduced;
      while( ( reduced = PGPPublicKey.removeCertification( primary, id ) ) != null )
      {
        primary = reduced;
      }
    }

    return primary;
  }

  private static PGPPublicKey dropUserAttributes( PGPPublicKey primary )
  {
    List<PGPUserAttributeSubpacketVector> drop = new ArrayList<PGPUserAttributeSubpacketVector>();
    Iterator<PGPUserAttributeSubpacketVector> attrs = primary.getUserAttributes();
    while( attrs.hasNext() )
    {
      drop.add( attrs.next() );
    }

    for( PGPUserAttributeSubpacketVector attr : drop )
    {
      PGPPublicKey reduced;
      while( ( reduced = PGPPublicKey.removeCertification( primary, attr ) ) != null )
      {
        primary = reduced;
      }
    }

    return primary;
  }

  static boolean isUsableSubkey( CertificatePolicy policy, PGPPublicKey master, PGPPublicKey subkey )
  {
    PGPSignature latest = policy.latestBinding( master, subkey );
    if( latest == null )
      return false;

    PGPSignatureSubpacketVector hashed = latest.getHashedSubPackets();
    if( hashed == null )
      return false;

    return ( hashed.getKeyFlags() & USABLE_FLAGS ) != 0;
  }
}
