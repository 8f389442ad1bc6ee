package core.handler;


import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.bouncycastle.openpgp.PGPException;
import org.bouncycastle.openpgp.PGPKeyRing;
import org.bouncycastle.openpgp.PGPPublicKeyRing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.crypto.CertificatePolicy;
import core.exceptions.CertificateParseException;
import core.exceptions.LockException;
import core.exceptions.NotFoundException;
import core.exceptions.PolicyException;
import core.model.EmailIdentity;
import core.model.Fingerprint;
import core.model.IdentityMatch;
import core.utils.PgpCertificateCodec;
import core.utils.UserIdParser;

/**
 * In-memory index of imported certificates.
 * <p>
 * Three maps make up the index:
 * <ul>
 *   <li>fingerprint -> merged certificate</li>
 *   <li>email identity -> fingerprint (last import wins on conflicts), with a side index on the
 *       hashed local part and domain used by lookups</li>
 *   <li>file path -> fingerprint it contributed, so a file delete can be reversed</li>
 * </ul>
 * All three are guarded by one read/write lock. File reads, parsing and policy evaluation happen
 * before the write lock is taken; the lock only covers the map updates and the merge.
 */
public class CertificateStore
{
  private static final Logger LOGGER = LoggerFactory.getLogger( CertificateStore.class );

  public static final long DEFAULT_LOCK_TIMEOUT_MS = 30000;

  private final Map<Fingerprint,   PGPPublicKeyRing> keys  = new HashMap<>();
  private final Map<EmailIdentity, Fingerprint>      uids  = new HashMap<>();
  private final Map<Path,          Fingerprint>      files = new HashMap<>();
  private final Map<String,        EmailIdentity>    byKey = new HashMap<>();

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final CertificatePolicy      policy;
  private final long                   lockTimeoutMs;

  public CertificateStore()
  {
    this( new CertificatePolicy(), DEFAULT_LOCK_TIMEOUT_MS );
  }

  public CertificateStore( CertificatePolicy policy, long lockTimeoutMs )
  {
    if( lockTimeoutMs <= 0 )
      throw new IllegalArgumentException( "lockTimeoutMs must be positive" );

    this.policy        = policy;
    this.lockTimeoutMs = lockTimeoutMs;
  }

  /**
   * Imports a certificate. Secret key material is dropped before anything is stored. The
   * certificate's valid email identities are (re)pointed at its fingerprint and the certificate is
   * merged with any earlier material for the same fingerprint.
   */
  public void importCertificate( PGPKeyRing ring )
   throws PolicyException, LockException
  {
    PreparedImport prepared = prepare( ring );

    Lock writeLock = acquire( lock.writeLock(), "import" );
    try
    {
      commit( prepared, resolve( prepared ) );
    }
    finally
    {
      writeLock.unlock();
    }
  }

  /**
   * Reads, parses and imports the certificate held in a file and remembers which fingerprint the
   * file contributed. When the file previously held a different certificate, that association is
   * released once the new certificate is known to merge cleanly, so a failed load changes nothing.
   */
  public void load( Path path )
   throws CertificateParseException, PolicyException, LockException
  {
    Path       key = normalize( path );
    PGPKeyRing ring;

    try
    {
      ring = PgpCertificateCodec.read( key );
    }
    catch( IOException e )
    {
      throw new CertificateParseException( "Cannot read certificate file " + key + ": " + e.getMessage(), e );
    }

    PreparedImport prepared = prepare( ring );

    Lock writeLock = acquire( lock.writeLock(), "load" );
    try
    {
      PGPPublicKeyRing stored = resolve( prepared );

      Fingerprint previous = files.get( key );
      if( previous != null && !previous.equals( prepared.fingerprint ) )
      {
        LOGGER.info( "File {} now holds {} instead of {}", key, prepared.fingerprint, previous );
        releasePath( key );
      }

      commit( prepared, stored );
      files.put( key, prepared.fingerprint );
    }
    finally
    {
      writeLock.unlock();
    }

    LOGGER.info( "Loaded certificate {} from {}", prepared.fingerprint, key );
  }

  /**
   * Reverses {@link #load(Path)} for a file. The certificate and its identities are removed unless
   * another loaded file still contributes the same fingerprint.
   *
   * @return the certificate the file contributed
   */
  public PGPPublicKeyRing unload( Path path )
   throws NotFoundException, LockException
  {
    Path key = normalize( path );

    Lock writeLock = acquire( lock.writeLock(), "unload" );
    try
    {
      if( !files.containsKey( key ) )
        throw new NotFoundException( "No certificate loaded from " + key );

      PGPPublicKeyRing removed = releasePath( key );
      LOGGER.info( "Unloaded {}", key );
      return removed;
    }
    finally
    {
      writeLock.unlock();
    }
  }

  /**
   * Removes a certificate, every email identity pointing at it and every file association.
   */
  public PGPPublicKeyRing delete( Fingerprint fingerprint )
   throws NotFoundException, LockException
  {
    Lock writeLock = acquire( lock.writeLock(), "delete" );
    try
    {
      PGPPublicKeyRing removed = deleteLocked( fingerprint );
      files.values().removeIf( fingerprint::equals );
      return removed;
    }
    finally
    {
      writeLock.unlock();
    }
  }

  public Optional<PGPPublicKeyRing> get( Fingerprint fingerprint )
   throws LockException
  {
    Lock readLock = acquire( lock.readLock(), "get" );
    try
    {
      return Optional.ofNullable( keys.get( fingerprint ) );
    }
    finally
    {
      readLock.unlock();
    }
  }

  /**
   * Exact match on the hashed local part and the domain.
   */
  public Optional<IdentityMatch> findByIdentity( String encoded, String domain )
   throws LockException
  {
    if( encoded == null || domain == null )
      return Optional.empty();

    Lock readLock = acquire( lock.readLock(), "findByIdentity" );
    try
    {
      EmailIdentity identity = byKey.get( EmailIdentity.lookupKey( encoded, domain ) );
      if( identity == null )
        return Optional.empty();

      PGPPublicKeyRing cert = keys.get( uids.get( identity ) );
      if( cert == null )
        return Optional.empty();

      return Optional.of( new IdentityMatch( identity.getLocalPart(), identity.getDomain(), cert ) );
    }
    finally
    {
      readLock.unlock();
    }
  }

  public int size()
   throws LockException
  {
    Lock readLock = acquire( lock.readLock(), "size" );
    try
    {
      return keys.size();
    }
    finally
    {
      readLock.unlock();
    }
  }

  public int identityCount()
   throws LockException
  {
    Lock readLock = acquire( lock.readLock(), "identityCount" );
    try
    {
      return uids.size();
    }
    finally
    {
      readLock.unlock();
    }
  }

  public Set<EmailIdentity> identitiesOf( Fingerprint fingerprint )
   throws LockException
  {
    Lock readLock = acquire( lock.readLock(), "identitiesOf" );
    try
    {
      Set<EmailIdentity> result = new HashSet<>();
      for( Map.Entry<EmailIdentity, Fingerprint> entry : uids.entrySet() )
      {
        if( entry.getValue().equals( fingerprint ) )
          result.add( entry.getKey() );
      }
      return result;
    }
    finally
    {
      readLock.unlock();
    }
  }

  /**
   * Snapshot of the file paths currently contributing certificates.
   */
  public Set<Path> paths()
   throws LockException
  {
    Lock readLock = acquire( lock.readLock(), "paths" );
    try
    {
      return new HashSet<>( files.keySet() );
    }
    finally
    {
      readLock.unlock();
    }
  }

  public Optional<Fingerprint> fingerprintForPath( Path path )
   throws LockException
  {
    Lock readLock = acquire( lock.readLock(), "fingerprintForPath" );
    try
    {
      return Optional.ofNullable( files.get( normalize( path ) ) );
    }
    finally
    {
      readLock.unlock();
    }
  }

  /**
   * Strips secret material, evaluates the User IDs and derives the identities. Runs without the lock.
   */
  private PreparedImport prepare( PGPKeyRing ring )
   throws PolicyException
  {
    PGPPublicKeyRing cert        = PgpCertificateCodec.toCertificate( ring );
    Fingerprint      fingerprint = Fingerprint.of( cert );
    List<String>     userIds     = policy.validUserIds( cert );

    Set<EmailIdentity> identities = new LinkedHashSet<>();
    for( String userId : userIds )
    {
      String email = UserIdParser.normalizedEmail( userId );
      if( email == null )
        continue;

      EmailIdentity identity = EmailIdentity.fromEmail( email );
      if( identity != null )
        identities.add( identity );
    }

    if( identities.isEmpty() )
      LOGGER.warn( "Certificate {} has no valid email identity; it will not be discoverable", fingerprint );

    return new PreparedImport( fingerprint, cert, new ArrayList<>( identities ) );
  }

  /**
   * Combines the prepared certificate with what is already stored for its fingerprint. Changes
   * nothing. Caller holds the write lock.
   */
  private PGPPublicKeyRing resolve( PreparedImport prepared )
   throws PolicyException
  {
    Fingerprint      fingerprint = prepared.fingerprint;
    PGPPublicKeyRing existing    = keys.get( fingerprint );

    if( existing == null )
      return prepared.cert;

    if( PgpCertificateCodec.sameEncoding( existing, prepared.cert ) )
      return existing;

    try
    {
      return mergeCertificates( existing, prepared.cert );
    }
    catch( PGPException | IllegalArgumentException e )
    {
      throw new PolicyException( fingerprint.toHex(), "Cannot merge certificate " + fingerprint + ": " + e.getMessage(), e );
    }
  }

  PGPPublicKeyRing mergeCertificates( PGPPublicKeyRing existing, PGPPublicKeyRing incoming )
   throws PGPException
  {
    return PgpCertificateCodec.merge( existing, incoming );
  }

  /**
   * Caller holds the write lock.
   */
  private void commit( PreparedImport prepared, PGPPublicKeyRing stored )
  {
    Fingerprint fingerprint = prepared.fingerprint;
    boolean     merged      = keys.containsKey( fingerprint );

    for( EmailIdentity identity : prepared.identities )
    {
      byKey.put( identity.lookupKey(), identity );

      Fingerprint previous = uids.put( identity, fingerprint );
      if( previous != null && !previous.equals( fingerprint ) )
      {
        LOGGER.warn( "Identity {} moved from certificate {} to {}", identity.toEmail(), previous, fingerprint );
      }
    }

    keys.put( fingerprint, stored );
    LOGGER.debug( "Stored certificate {} ({} identities, merged = {})", fingerprint, prepared.identities.size(), merged );
  }

  /**
   * Drops the association of one path and, when no other path contributes the same fingerprint,
   * the certificate itself. Caller holds the write lock.
   */
  private PGPPublicKeyRing releasePath( Path path )
  {
    Fingerprint fingerprint = files.remove( path );
    if( fingerprint == null )
      return null;

    if( files.containsValue( fingerprint ) )
    {
      LOGGER.debug( "Certificate {} is still contributed by another file", fingerprint );
      return keys.get( fingerprint );
    }

    PGPPublicKeyRing removed = keys.remove( fingerprint );
    purgeIdentities( fingerprint );
    return removed;
  }

  private PGPPublicKeyRing deleteLocked( Fingerprint fingerprint )
   throws NotFoundException
  {
    PGPPublicKeyRing removed = keys.remove( fingerprint );
    if( removed == null )
      throw new NotFoundException( "Certificate not found: " + fingerprint );

    purgeIdentities( fingerprint );
    LOGGER.info( "Deleted certificate {}", fingerprint );
    return removed;
  }

  private void purgeIdentities( Fingerprint fingerprint )
  {
    Iterator<Map.Entry<EmailIdentity, Fingerprint>> it = uids.entrySet().iterator();
    while( it.hasNext() )
    {
      Map.Entry<EmailIdentity, Fingerprint> entry = it.next();
      if( entry.getValue().equals( fingerprint ) )
      {
        EmailIdentity identity = entry.getKey();
        byKey.remove( identity.lookupKey() );
        it.remove();
      }
    }
  }

  private Lock acquire( Lock target, String operation )
   throws LockException
  {
    try
    {
      if( !target.tryLock( lockTimeoutMs, TimeUnit.MILLISECONDS ) )
        throw new LockException( "Timed out after " + lockTimeoutMs + " ms waiting for store lock (" + operation + ")" );
    }
    catch( InterruptedException e )
    {
      Thread.currentThread().interrupt();
      throw new LockException( "Interrupted waiting for store lock (" + operation + ")", e );
    }

    return target;
  }

  public CertificatePolicy getPolicy()
  {
    return policy;
  }

  ReentrantReadWriteLock lock()
  {
    return lock;
  }

  private static Path normalize( Path path )
  {
    return path.toAbsolutePath().normalize();
  }

  private static final class PreparedImport
  {
    final Fingerprint         fingerprint;
    final PGPPublicKeyRing    cert;
    final List<EmailIdentity> identities;

    PreparedImport( Fingerprint fingerprint, PGPPublicKeyRing cert, List<EmailIdentity> identities )
    {
      this.fingerprint = fingerprint;
      this.cert        = cert;
      this.identities  = identities;
    }
  }
}
