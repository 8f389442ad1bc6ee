package core.utils;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import org.bouncycastle.bcpg.ArmoredOutputStream;
import org.bouncycastle.openpgp.PGPException;
import org.bouncycastle.openpgp.PGPKeyRing;
import org.bouncycastle.openpgp.PGPMarker;
import org.bouncycastle.openpgp.PGPObjectFactory;
import org.bouncycastle.openpgp.PGPPublicKeyRing;
import org.bouncycastle.openpgp.PGPSecretKeyRing;
import org.bouncycastle.openpgp.PGPUtil;
import org.bouncycastle.openpgp.bc.BcPGPObjectFactory;

import core.exceptions.CertificateParseException;

/**
 * Bridges raw OpenPGP bytes and Bouncy Castle key rings. Accepts binary or ASCII armored input.
 */
public class PgpCertificateCodec
{
  /**
   * Reads the first key ring found in the data. Secret key rings are returned as read; use
   * {@link #toCertificate(PGPKeyRing)} to drop their secret material.
   */
  public static PGPKeyRing read( byte[] data )
   throws CertificateParseException
  {
    if( data == null || data.length == 0 )
      throw new CertificateParseException( "No certificate data" );

    try( InputStream in = PGPUtil.getDecoderStream( new ByteArrayInputStream( data ) ) )
    {
      PGPObjectFactory factory = new BcPGPObjectFactory( in );
      Object           obj     = factory.nextObject();

      while( obj instanceof PGPMarker )
      {
        obj = factory.nextObject();
      }

      if( obj instanceof PGPPublicKeyRing || obj instanceof PGPSecretKeyRing )
        return (PGPKeyRing) obj;

      throw new CertificateParseException( "Data does not start with a key ring: " + ( obj == null ? "empty stream" : obj.getClass().getSimpleName() ) );
    }
    catch( IOException | RuntimeException e )
    {
      throw new CertificateParseException( "Malformed certificate data: " + e.getMessage(), e );
    }
  }

  public static PGPKeyRing read( Path path )
   throws CertificateParseException, IOException
  {
    return read( Files.readAllBytes( path ) );
  }

  /**
   * Returns the public part of the ring. Secret key packets never survive this call.
   */
  public static PGPPublicKeyRing toCertificate( PGPKeyRing ring )
  {
    if( ring instanceof PGPSecretKeyRing )
      return ((PGPSecretKeyRing) ring).toCertificate();

    return (PGPPublicKeyRing) ring;
  }

  public static PGPPublicKeyRing readCertificate( byte[] data )
   throws CertificateParseException
  {
    return toCertificate( read( data ) );
  }

  /**
   * Binary transferable public key, without trust packets.
   */
  public static byte[] write( PGPPublicKeyRing cert )
   throws IOException
  {
    return cert.getEncoded( true );
  }

  public static String armor( PGPKeyRing ring )
   throws IOException
  {
    ByteArrayOutputStream bOut = new ByteArrayOutputStream();
    try( ArmoredOutputStream aOut = new ArmoredOutputStream( bOut ) )
    {
      ring.encode( aOut );
    }

    return bOut.toString( StandardCharsets.US_ASCII );
  }

  public static boolean sameEncoding( PGPPublicKeyRing a, PGPPublicKeyRing b )
  {
    try
    {
      return Arrays.equals( write( a ), write( b ) );
    }
    catch( IOException e )
    {
      return false;
    }
  }

  /**
   * Merges two certificates of the same primary key. The result keeps every subkey,
   * User ID, user attribute and signature of both.
   */
  public static PGPPublicKeyRing merge( PGPPublicKeyRing existing, PGPPublicKeyRing incoming )
   throws PGPException
  {
    return PGPPublicKeyRing.join( existing, incoming );
  }
}
