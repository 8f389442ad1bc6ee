package core.handler;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Optional;

import org.bouncycastle.bcpg.HashAlgorithmTags;
import org.bouncycastle.bcpg.sig.KeyFlags;
import org.bouncycastle.openpgp.PGPException;
import org.bouncycastle.openpgp.PGPPublicKey;
import org.bouncycastle.openpgp.PGPPublicKeyRing;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import core.crypto.CertificatePolicy;
import core.crypto.EmailIdentityEncoder;
import core.exceptions.CertificateParseException;
import core.exceptions.NotFoundException;
import core.exceptions.PolicyException;
import core.model.EmailIdentity;
import core.model.Fingerprint;
import core.model.IdentityMatch;
import core.utils.PgpCertificateCodec;
import core.utils.TestCertificates;
import core.utils.TestCertificates.TestKey;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CertificateStoreTest
{
  @TempDir
  Path dir;

  private final CertificateStore store = new CertificateStore();

  private static String enc( String local )
  {
    return EmailIdentityEncoder.encode( local );
  }

  @Test
  void importIndexesEveryValidAddress()
   throws Exception
  {
    TestKey key = TestCertificates.generate( "Alice <Alice@Example.com>" )
                                  .addUserId( "Alice <alice@work.example>" )
                                  .addUserId( "no address" );

    store.importCertificate( key.ring() );

    assertThat( store.size() ).isEqualTo( 1 );
    assertThat( store.identityCount() ).isEqualTo( 2 );
    assertThat( store.get( key.fingerprint() ) ).isPresent();

    Optional<IdentityMatch> match = store.findByIdentity( enc( "alice" ), "example.com" );
    assertThat( match ).isPresent();
    assertThat( match.get().localPart() ).isEqualTo( "alice" );
    assertThat( match.get().domain() ).isEqualTo( "example.com" );
    assertThat( match.get().email() ).isEqualTo( "alice@example.com" );
    assertThat( Fingerprint.of( match.get().certificate() ) ).isEqualTo( key.fingerprint() );

    assertThat( store.findByIdentity( enc( "alice" ), "work.example" ) ).isPresent();
    assertThat( store.findByIdentity( enc( "alice" ), "other.example" ) ).isEmpty();
    assertThat( store.findByIdentity( enc( "bob" ),   "example.com" ) ).isEmpty();
  }

  @Test
  void importIsIdempotent()
   throws Exception
  {
    TestKey key = TestCertificates.generate( "Alice <alice@example.com>" );

    store.importCertificate( key.ring() );
    byte[] once = PgpCertificateCodec.write( store.get( key.fingerprint() ).get() );

    store.importCertificate( key.ring() );

    assertThat( store.size() ).isEqualTo( 1 );
    assertThat( store.identityCount() ).isEqualTo( 1 );
    assertThat( store.identitiesOf( key.fingerprint() ) ).containsExactly( EmailIdentity.fromEmail( "alice@example.com" ) );
    assertThat( PgpCertificateCodec.write( store.get( key.fingerprint() ).get() ) ).isEqualTo( once );
  }

  @Test
  void importMergesWithExistingCertificate()
   throws Exception
  {
    TestKey          key      = TestCertificates.generate( "Alice <alice@example.com>" ).addSubkey( KeyFlags.SIGN_DATA );
    PGPPublicKeyRing original = key.ring();
    PGPPublicKeyRing update   = key.addUserId( "Alice <alice@work.example>" ).addSubkey( KeyFlags.ENCRYPT_COMMS ).ring();

    store.importCertificate( original );
    store.importCertificate( update );

    PGPPublicKeyRing merged = store.get( key.fingerprint() ).get();
    assertThat( keyCount( merged ) ).isEqualTo( 3 );
    assertThat( store.identityCount() ).isEqualTo( 2 );

    // re-importing the older copy keeps everything gathered so far
    store.importCertificate( original );
    assertThat( keyCount( store.get( key.fingerprint() ).get() ) ).isEqualTo( 3 );
    assertThat( store.findByIdentity( enc( "alice" ), "work.example" ) ).isPresent();
  }

  @Test
  void secretMaterialIsNeverStored()
   throws Exception
  {
    TestKey key = TestCertificates.generate( "Alice <alice@example.com>" );

    store.importCertificate( key.secretRing() );

    PGPPublicKeyRing stored = store.get( key.fingerprint() ).get();
    assertThat( stored ).isInstanceOf( PGPPublicKeyRing.class );
    assertThat( PgpCertificateCodec.read( PgpCertificateCodec.write( stored ) ) ).isInstanceOf( PGPPublicKeyRing.class );
  }

  @Test
  void certificateWithoutValidAddressIsStillImported()
   throws Exception
  {
    TestKey key = TestCertificates.generate( "Just A Name" );

    store.importCertificate( key.ring() );

    assertThat( store.size() ).isEqualTo( 1 );
    assertThat( store.identityCount() ).isZero();
  }

  @Test
  void policyFailureRejectsImport()
  {
    TestKey key = TestCertificates.generate( "Alice <alice@example.com>", HashAlgorithmTags.SHA1 );

    assertThatThrownBy( () -> store.importCertificate( key.ring() ) ).isInstanceOf( PolicyException.class );
    assertThat( sizeOf( store ) ).isZero();
  }

  @Test
  void importKeepsValidIdentityBesideUserIdThatIsNotUtf8()
   throws Exception
  {
    TestKey key = TestCertificates.generate( "Alice <alice@example.com>" )
                                  .addRawUserId( TestCertificates.notUtf8UserId() );

    store.importCertificate( key.ring() );

    assertThat( store.identityCount() ).isEqualTo( 1 );
    assertThat( store.findByIdentity( enc( "alice" ), "example.com" ) ).isPresent();
  }

  @Test
  void failedMergeOnReloadLeavesPreviousCertificateInPlace()
   throws Exception
  {
    CertificateStore refusing = new CertificateStore()
    {
      @Override
      PGPPublicKeyRing mergeCertificates( PGPPublicKeyRing existing, PGPPublicKeyRing incoming )
       throws PGPException
      {
        throw new PGPException( "merge refused" );
      }
    };

    TestKey alice = TestCertificates.generate( "Alice <alice@example.com>" );
    TestKey bob   = TestCertificates.generate( "Bob <bob@example.com>" );
    Path    file  = TestCertificates.write( dir, "key.pgp", alice.ring() );

    refusing.importCertificate( bob.ring() );
    refusing.load( file );

    TestCertificates.write( dir, "key.pgp", bob.addUserId( "Bob <bob@work.example>" ).ring() );
    assertThatThrownBy( () -> refusing.load( file ) ).isInstanceOf( PolicyException.class );

    assertThat( refusing.size() ).isEqualTo( 2 );
    assertThat( refusing.fingerprintForPath( file ) ).contains( alice.fingerprint() );
    assertThat( refusing.findByIdentity( enc( "alice" ), "example.com" ) ).isPresent();
    assertThat( refusing.findByIdentity( enc( "bob" ),   "work.example" ) ).isEmpty();
  }

  @Test
  void lookupsResolveEachIdentityAmongMany()
   throws Exception
  {
    Fingerprint[] fingerprints = new Fingerprint[12];
    for( int i = 0; i < fingerprints.length; i++ )
    {
      TestKey key = TestCertificates.generate( "User " + i + " <user" + i + "@example.com>" );
      store.importCertificate( key.ring() );
      fingerprints[i] = key.fingerprint();
    }

    for( int i = 0; i < fingerprints.length; i++ )
    {
      Optional<IdentityMatch> match = store.findByIdentity( enc( "user" + i ), "example.com" );
      assertThat( match ).isPresent();
      assertThat( Fingerprint.of( match.get().certificate() ) ).isEqualTo( fingerprints[i] );
      assertThat( store.findByIdentity( enc( "user" + i ), "example.org" ) ).isEmpty();
    }

    store.delete( fingerprints[3] );
    assertThat( store.findByIdentity( enc( "user3" ), "example.com" ) ).isEmpty();
    assertThat( store.findByIdentity( enc( "user4" ), "example.com" ) ).isPresent();
  }

  @Test
  void loadThenUnloadRestoresEmptyState()
   throws Exception
  {
    TestKey key  = TestCertificates.generate( "Alice <alice@example.com>" );
    Path    file = TestCertificates.writeArmored( dir, "alice.asc", key.ring() );

    store.load( file );
    assertThat( store.size() ).isEqualTo( 1 );
    assertThat( store.paths() ).containsExactly( file.toAbsolutePath().normalize() );
    assertThat( store.fingerprintForPath( file ) ).contains( key.fingerprint() );

    PGPPublicKeyRing removed = store.unload( file );

    assertThat( Fingerprint.of( removed ) ).isEqualTo( key.fingerprint() );
    assertThat( store.size() ).isZero();
    assertThat( store.identityCount() ).isZero();
    assertThat( store.paths() ).isEmpty();
    assertThat( store.findByIdentity( enc( "alice" ), "example.com" ) ).isEmpty();
  }

  @Test
  void unloadKeepsCertificateStillProvidedByAnotherFile()
   throws Exception
  {
    TestKey key    = TestCertificates.generate( "Alice <alice@example.com>" );
    Path    first  = TestCertificates.write( dir, "alice.pgp", key.ring() );
    Path    second = TestCertificates.writeArmored( dir, "alice-copy.asc", key.ring() );

    store.load( first );
    store.load( second );
    store.unload( first );

    assertThat( store.get( key.fingerprint() ) ).isPresent();
    assertThat( store.findByIdentity( enc( "alice" ), "example.com" ) ).isPresent();

    store.unload( second );
    assertThat( store.get( key.fingerprint() ) ).isEmpty();
  }

  @Test
  void reloadOfChangedFileReleasesPreviousCertificate()
   throws Exception
  {
    TestKey alice = TestCertificates.generate( "Alice <alice@example.com>" );
    TestKey bob   = TestCertificates.generate( "Bob <bob@example.com>" );
    Path    file  = TestCertificates.write( dir, "key.pgp", alice.ring() );

    store.load( file );
    TestCertificates.write( dir, "key.pgp", bob.ring() );
    store.load( file );

    assertThat( store.size() ).isEqualTo( 1 );
    assertThat( store.get( alice.fingerprint() ) ).isEmpty();
    assertThat( store.findByIdentity( enc( "alice" ), "example.com" ) ).isEmpty();
    assertThat( store.findByIdentity( enc( "bob" ),   "example.com" ) ).isPresent();
    assertThat( store.fingerprintForPath( file ) ).contains( bob.fingerprint() );
  }

  @Test
  void loadRejectsMalformedFile()
   throws Exception
  {
    Path file = Files.write( dir.resolve( "junk.asc" ), "garbage".getBytes( StandardCharsets.UTF_8 ) );

    assertThatThrownBy( () -> store.load( file ) ).isInstanceOf( CertificateParseException.class );
    assertThatThrownBy( () -> store.load( dir.resolve( "missing.asc" ) ) ).isInstanceOf( CertificateParseException.class );
    assertThat( store.paths() ).isEmpty();
  }

  @Test
  void unknownTargetsFailWithNotFound()
  {
    TestKey key = TestCertificates.generate( "Alice <alice@example.com>" );

    assertThatThrownBy( () -> store.unload( dir.resolve( "never-loaded.asc" ) ) ).isInstanceOf( NotFoundException.class );
    assertThatThrownBy( () -> store.delete( key.fingerprint() ) ).isInstanceOf( NotFoundException.class );
  }

  @Test
  void deleteRemovesCertificateIdentitiesAndPaths()
   throws Exception
  {
    TestKey key  = TestCertificates.generate( "Alice <alice@example.com>" ).addUserId( "Alice <alice@work.example>" );
    Path    file = TestCertificates.write( dir, "alice.pgp", key.ring() );

    store.load( file );
    store.delete( key.fingerprint() );

    assertThat( store.size() ).isZero();
    assertThat( store.identityCount() ).isZero();
    assertThat( store.paths() ).isEmpty();
    assertThatThrownBy( () -> store.unload( file ) ).isInstanceOf( NotFoundException.class );
  }

  @Test
  void conflictingIdentityGoesToLatestImport()
   throws Exception
  {
    TestKey first  = TestCertificates.generate( "Alice <alice@example.com>" );
    TestKey second = TestCertificates.generate( "Alice (new key) <alice@example.com>" );

    store.importCertificate( first.ring() );
    store.importCertificate( second.ring() );

    assertThat( store.size() ).isEqualTo( 2 );
    assertThat( store.identityCount() ).isEqualTo( 1 );
    assertThat( Fingerprint.of( store.findByIdentity( enc( "alice" ), "example.com" ).get().certificate() ) )
      .isEqualTo( second.fingerprint() );

    // the older certificate is not re-indexed when the newer one goes away
    store.delete( second.fingerprint() );
    assertThat( store.findByIdentity( enc( "alice" ), "example.com" ) ).isEmpty();
    assertThat( store.get( first.fingerprint() ) ).isPresent();

    store.importCertificate( first.ring() );
    assertThat( store.findByIdentity( enc( "alice" ), "example.com" ) ).isPresent();
  }

  @Test
  void rejectsNonPositiveLockTimeout()
  {
    assertThatThrownBy( () -> new CertificateStore( new CertificatePolicy(), 0 ) )
      .isInstanceOf( IllegalArgumentException.class );
  }

  private static int sizeOf( CertificateStore store )
  {
    try
    {
      return store.size();
    }
    catch( Exception e )
    {
      throw new IllegalStateException( e );
    }
  }

  private static int keyCount( PGPPublicKeyRing ring )
  {
    int                    count = 0;
    Iterator<PGPPublicKey> it    = ring.getPublicKeys();
    while( it.hasNext() )
    {
      it.next();
      count++;
    }
    return count;
  }
}
