package core.crypto;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.bouncycastle.bcpg.sig.KeyFlags;
import org.bouncycastle.openpgp.PGPPublicKey;
import org.bouncycastle.openpgp.PGPPublicKeyRing;
import org.bouncycastle.openpgp.PGPSignature;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;

import org.junit.jupiter.api.Test;

import core.model.Fingerprint;
import core.utils.PgpCertificateCodec;
import core.utils.TestCertificates;
import core.utils.TestCertificates.TestKey;

import static org.assertj.core.api.Assertions.assertThat;

class CertificateSanitizerTest
{
  private final CertificatePolicy policy = new CertificatePolicy();

  @Test
  void keepsOnlyTargetUserId()
  {
    TestKey key = TestCertificates.generate( "Alice <alice@example.com>" )
                                  .addUserId( "Alice <alice@work.example>" )
                                  .addUserId( "alice-nick" );

    PGPPublicKeyRing sanitized = CertificateSanitizer.sanitize( key.ring(), "alice@work.example" );

    assertThat( userIds( sanitized ) ).containsExactly( "Alice <alice@work.example>" );
    assertThat( Fingerprint.of( sanitized ) ).isEqualTo( key.fingerprint() );
  }

  @Test
  void matchesDeclaredAddressExactly()
  {
    TestKey key = TestCertificates.generate( "Alice <Alice@Example.com>" );

    assertThat( userIds( CertificateSanitizer.sanitize( key.ring(), "alice@example.com" ) ) ).isEmpty();
    assertThat( userIds( CertificateSanitizer.sanitize( key.ring(), "Alice@Example.com" ) ) ).hasSize( 1 );
  }

  @Test
  void dropsUserAttributes()
  {
    TestKey key = TestCertificates.generate( "Alice <alice@example.com>" ).addPhoto();
    assertThat( attributeCount( key.ring() ) ).isEqualTo( 1 );

    PGPPublicKeyRing sanitized = CertificateSanitizer.sanitize( key.ring(), "alice@example.com" );

    assertThat( attributeCount( sanitized ) ).isZero();
  }

  @Test
  void keepsOnlySigningAndTransportEncryptionSubkeys()
  {
    TestKey key = TestCertificates.generate( "Alice <alice@example.com>" )
                                  .addSubkey( KeyFlags.ENCRYPT_COMMS )
                                  .addSubkey( KeyFlags.SIGN_DATA )
                                  .addSubkey( KeyFlags.ENCRYPT_STORAGE )
                                  .addSubkey( KeyFlags.AUTHENTICATION )
                                  .addSubkey( 0 )
                                  .addUnboundSubkey();

    PGPPublicKeyRing sanitized = CertificateSanitizer.sanitize( key.ring(), "alice@example.com" );

    List<PGPPublicKey> subkeys = subkeys( sanitized );
    assertThat( subkeys ).hasSize( 2 );
    for( PGPPublicKey sub : subkeys )
    {
      assertThat( CertificateSanitizer.isUsableSubkey( policy, sanitized.getPublicKey(), sub ) ).isTrue();
    }
  }

  @Test
  void ignoresSubkeyBindingIssuedByAnotherKey()
  {
    TestKey key = TestCertificates.generate( "Alice <alice@example.com>" )
                                  .addSubkeyWithForeignBinding( KeyFlags.AUTHENTICATION, KeyFlags.ENCRYPT_COMMS )
                                  .addSubkeyWithForeignBinding( KeyFlags.ENCRYPT_COMMS,  KeyFlags.AUTHENTICATION );

    PGPPublicKeyRing sanitized = CertificateSanitizer.sanitize( key.ring(), "alice@example.com", policy );

    List<PGPPublicKey> subkeys = subkeys( sanitized );
    assertThat( subkeys ).hasSize( 1 );

    PGPSignature binding = policy.latestBinding( sanitized.getPublicKey(), subkeys.get( 0 ) );
    assertThat( binding.getHashedSubPackets().getKeyFlags() ).isEqualTo( KeyFlags.ENCRYPT_COMMS );
  }

  @Test
  void dropsUserIdThatIsNotUtf8()
  {
    TestKey key = TestCertificates.generate( "Alice <alice@example.com>" )
                                  .addRawUserId( TestCertificates.notUtf8UserId() );

    PGPPublicKeyRing sanitized = CertificateSanitizer.sanitize( key.ring(), "alice@example.com" );

    assertThat( rawUserIdCount( key.ring() ) ).isEqualTo( 2 );
    assertThat( rawUserIdCount( sanitized ) ).isEqualTo( 1 );
    assertThat( userIds( sanitized ) ).containsExactly( "Alice <alice@example.com>" );
  }

  @Test
  void leavesInputUntouched()
   throws Exception
  {
    TestKey key = TestCertificates.generate( "Alice <alice@example.com>" )
                                  .addUserId( "Other <other@example.com>" )
                                  .addPhoto()
                                  .addSubkey( KeyFlags.ENCRYPT_STORAGE );

    byte[] before = PgpCertificateCodec.write( key.ring() );
    CertificateSanitizer.sanitize( key.ring(), "alice@example.com" );

    assertThat( PgpCertificateCodec.write( key.ring() ) ).isEqualTo( before );
  }

  @Test
  void unknownTargetLeavesNoUserId()
  {
    TestKey key = TestCertificates.generate( "Alice <alice@example.com>" );

    assertThat( userIds( CertificateSanitizer.sanitize( key.ring(), "bob@example.com" ) ) ).isEmpty();
  }

  @Property( tries = 15 )
  void sanitizedCertificateDisclosesMinimum( @ForAll @Size( max = 4 ) List<@IntRange( min = 0, max = 63 ) Integer> subkeyFlags,
                                             @ForAll @IntRange( min = 0, max = 2 ) int target )
  {
    String[] emails = { "a@example.com", "b@example.com", "c@example.com" };

    TestKey key = TestCertificates.generate( "A <" + emails[0] + ">" )
                                  .addUserId( "B <" + emails[1] + ">" )
                                  .addUserId( "C <" + emails[2] + ">" )
                                  .addPhoto();
    for( int flags : subkeyFlags )
    {
      key.addSubkey( flags );
    }

    PGPPublicKeyRing sanitized = CertificateSanitizer.sanitize( key.ring(), emails[target] );

    assertThat( userIds( sanitized ) ).hasSize( 1 );
    assertThat( attributeCount( sanitized ) ).isZero();

    int usable = 0;
    for( int flags : subkeyFlags )
    {
      if( ( flags & ( KeyFlags.ENCRYPT_COMMS | KeyFlags.SIGN_DATA ) ) != 0 )
        usable++;
    }
    assertThat( subkeys( sanitized ) ).hasSize( usable );
  }

  private static List<String> userIds( PGPPublicKeyRing ring )
  {
    List<String>     ids = new ArrayList<String>();
    Iterator<String> it  = ring.getPublicKey().getUserIDs();
    while( it.hasNext() )
    {
      ids.add( it.next() );
    }
    return ids;
  }

  private static int rawUserIdCount( PGPPublicKeyRing ring )
  {
    int              count = 0;
    Iterator<byte[]> it    = ring.getPublicKey().getRawUserIDs();
    while( it.hasNext() )
    {
      it.next();
      count++;
    }
    return count;
  }

  private static int attributeCount( PGPPublicKeyRing ring )
  {
    int       count = 0;
    Iterator<?> it  = ring.getPublicKey().getUserAttributes();
    while( it.hasNext() )
    {
      it.next();
      count++;
    }
    return count;
  }

  private static List<PGPPublicKey> subkeys( PGPPublicKeyRing ring )
  {
    List<PGPPublicKey>     keys = new ArrayList<PGPPublicKey>();
    Iterator<PGPPublicKey> it   = ring.getPublicKeys();
    while( it.hasNext() )
    {
      PGPPublicKey key = it.next();
      if( !key.isMasterKey() )
        keys.add( key );
    }
    return keys;
  }
}
