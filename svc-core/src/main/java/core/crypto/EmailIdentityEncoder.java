package core.crypto;


import java.nio.charset.StandardCharsets;

import org.bouncycastle.crypto.digests.SHA1Digest;

import core.utils.ZBase32;

/**
 * Maps an email local part to the 32 character token used in Web Key Directory paths.
 * <p>
 * The local part is hashed with SHA-1 and the 160-bit digest is encoded with
 * Z-Base-32 (RFC 6189, section 5.1.6). No case mapping is applied here; callers pass
 * the already normalized local part.
 */
public class EmailIdentityEncoder
{
  public static final int ENCODED_LENGTH = 32;

  private static final int DIGEST_BITS = 160;

  public static String encode( String localPart )
  {
    if( localPart == null )
      throw new IllegalArgumentException( "localPart cannot be null" );

    byte[]     input  = localPart.getBytes( StandardCharsets.UTF_8 );
    SHA1Digest digest = new SHA1Digest();
    digest.update( input, 0, input.length );

    byte[] hash = new byte[digest.getDigestSize()]; // 20 bytes
    digest.doFinal( hash, 0 );

    return ZBase32.encode( hash, DIGEST_BITS );
  }
}
