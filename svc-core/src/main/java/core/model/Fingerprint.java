package core.model;

import java.util.Arrays;

import org.bouncycastle.openpgp.PGPPublicKey;
import org.bouncycastle.openpgp.PGPPublicKeyRing;
import org.bouncycastle.util.encoders.Hex;

/**
 * Identifier of a certificate, derived from the fingerprint of its primary key.
 */
public final class Fingerprint
{
  private final byte[] value;
  private final String hex;

  private Fingerprint( byte[] value )
  {
    this.value = value.clone();
    this.hex   = Hex.toHexString( value ).toUpperCase();
  }

  public static Fingerprint of( PGPPublicKeyRing cert )
  {
    return of( cert.getPublicKey() );
  }

  public static Fingerprint of( PGPPublicKey key )
  {
    return new Fingerprint( key.getFingerprint() );
  }

  public static Fingerprint fromHex( String hex )
  {
    if( hex == null || hex.isEmpty() )
      throw new IllegalArgumentException( "Fingerprint hex must not be empty" );

    return new Fingerprint( Hex.decode( hex.replace( " ", "" ) ) );
  }

  public byte[] getBytes() { return value.clone(); }
  public String toHex()    { return hex;           }

  @Override
  public boolean equals( Object o )
  {
    if( this == o )
      return true;
    if( !( o instanceof Fingerprint ) )
      return false;

    return Arrays.equals( value, ((Fingerprint) o).value );
  }

  @Override
  public int hashCode()
  {
    return Arrays.hashCode( value );
  }

  @Override
  public String toString()
  {
    return hex;
  }
}
