package verticle;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.WorkerExecutor;
import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.exceptions.CertificateParseException;
import core.exceptions.LockException;
import core.exceptions.NotFoundException;
import core.exceptions.PolicyException;
import core.exceptions.WatchSubsystemException;
import core.handler.CertificateStore;
import core.model.Fingerprint;
import core.model.ServiceCoreIF;

import utils.WatchServiceFactoryIF;

/**
 * Keeps a {@link CertificateStore} in step with one directory of certificate files.
 * <p>
 * On start the directory is subscribed to and scanned. Afterwards the watch service is polled on a
 * worker thread: created or modified files are loaded, deleted files are unloaded and an overflow
 * triggers a full reconciliation. A failed subscription, or a watch service that closes underneath
 * us, is retried after a fixed backoff for as long as the verticle is deployed. Every store change is
 * published on {@link ServiceCoreIF#StoreChangedAddr}.
 */
public class DirectoryWatcherVert extends AbstractVerticle
{
  private static final Logger LOGGER = LoggerFactory.getLogger( DirectoryWatcherVert.class );

  public static final String ActionLoad   = "load";
  public static final String ActionUnload = "unload";

  private final CertificateStore      store;
  private final Path                  directory;
  private final long                  pollMs;
  private final long                  retryMs;
  private final WatchServiceFactoryIF watchFactory;

  private final AtomicInteger subscribeAttempts = new AtomicInteger( 0 );
  private final AtomicBoolean draining          = new AtomicBoolean( false );

  private WorkerExecutor        workerExecutor;
  private volatile WatchService watchService = null;
  private volatile long         pollTimerId  = -1;
  private volatile long         retryTimerId = -1;
  private volatile boolean      stopped      = false;

  public DirectoryWatcherVert( CertificateStore store, Path directory, long pollMs, long retryMs )
  {
    this( store, directory, pollMs, retryMs, WatchServiceFactoryIF.defaultFactory() );
  }

  public DirectoryWatcherVert( CertificateStore store, Path directory, long pollMs, long retryMs, WatchServiceFactoryIF watchFactory )
  {
    this.store        = store;
    this.directory    = directory.toAbsolutePath().normalize();
    this.pollMs       = pollMs;
    this.retryMs      = retryMs;
    this.watchFactory = watchFactory;
  }

  @Override
  public void start( Promise<Void> startPromise )
  {
    workerExecutor = vertx.createSharedWorkerExecutor( "wkd-directory-watcher", 1 );

    workerExecutor.executeBlocking( () ->
    {
      boolean subscribed = subscribe();

      // the scan runs after subscribing so nothing written in between is missed
      reconcile();

      if( subscribed )
        startPolling();
      else
        scheduleResubscribe();

      return ServiceCoreIF.SUCCESS;
    }).onSuccess( result ->
    {
      LOGGER.info( "DirectoryWatcherVert started on {} ({} certificates)", directory, storeSize() );
      startPromise.complete();
    }).onFailure( err ->
    {
      LOGGER.error( "Failed to start DirectoryWatcherVert: {}", err.getMessage(), err );
      startPromise.fail( err );
    });
  }

  @Override
  public void stop( Promise<Void> stopPromise )
  {
    stopped = true;
    cancelTimers();
    closeWatchService();

    if( workerExecutor != null )
      workerExecutor.close();

    LOGGER.info( "DirectoryWatcherVert stopped on {}", directory );
    stopPromise.complete();
  }

  /**
   * Runs on the worker. Returns false when the subscription could not be established.
   */
  private boolean subscribe()
  {
    int attempt = subscribeAttempts.incrementAndGet();

    try
    {
      watchService = watchFactory.subscribe( directory );
      LOGGER.info( "Watching {} (attempt {})", directory, attempt );
      return true;
    }
    catch( IOException | RuntimeException e )
    {
      LOGGER.error( "Cannot watch {} (attempt {}), retrying in {} ms: {}", directory, attempt, retryMs, e.getMessage() );
      return false;
    }
  }

  private void scheduleResubscribe()
  {
    if( stopped )
      return;

    retryTimerId = vertx.setTimer( retryMs, id ->
    {
      retryTimerId = -1;
      if( stopped )
        return;

      workerExecutor.executeBlocking( () ->
      {
        if( subscribe() )
        {
          reconcile();
          startPolling();
        }
        else
        {
          scheduleResubscribe();
        }
        return ServiceCoreIF.SUCCESS;
      }).onFailure( err -> LOGGER.error( "Resubscribe of {} failed: {}", directory, err.getMessage(), err ) );
    });
  }

  private void startPolling()
  {
    if( stopped )
    {
      closeWatchService();
      return;
    }

    pollTimerId = vertx.setPeriodic( pollMs, id -> poll() );
  }

  private void poll()
  {
    if( stopped || !draining.compareAndSet( false, true ) )
      return;

    workerExecutor.executeBlocking( () ->
    {
      try
      {
        drain();
      }
      catch( WatchSubsystemException e )
      {
        if( !stopped )
        {
          LOGGER.error( "Watch on {} degraded, reinitializing in {} ms: {}", directory, retryMs, e.getMessage() );
          cancelPolling();
          closeWatchService();
          scheduleResubscribe();
        }
      }
      finally
      {
        draining.set( false );
      }
      return ServiceCoreIF.SUCCESS;
    }).onFailure( err -> LOGGER.error( "Watch poll on {} failed: {}", directory, err.getMessage(), err ) );
  }

  /**
   * Dispatches every pending event. Each event is handled on its own; only a broken watch service
   * ends the drain.
   */
  private void drain()
   throws WatchSubsystemException
  {
    WatchService service = watchService;
    if( service == null )
      throw new WatchSubsystemException( "No watch service for " + directory );

    try
    {
      WatchKey key;
      while( ( key = service.poll() ) != null )
      {
        for( WatchEvent<?> event : key.pollEvents() )
        {
          handleEvent( event );
        }

        if( !key.reset() )
          throw new WatchSubsystemException( "Watch key for " + directory + " is no longer valid" );
      }
    }
    catch( ClosedWatchServiceException e )
    {
      throw new WatchSubsystemException( "Watch service for " + directory + " was closed", e );
    }
  }

  private void handleEvent( WatchEvent<?> event )
  {
    WatchEvent.Kind<?> kind = event.kind();

    if( kind == StandardWatchEventKinds.OVERFLOW )
    {
      LOGGER.warn( "Events lost on {}, reconciling", directory );
      reconcile();
      return;
    }

    Path name = (Path) event.context();
    if( name == null || isHidden( name ) )
      return;

    Path path = directory.resolve( name );

    if( kind == StandardWatchEventKinds.ENTRY_CREATE || kind == StandardWatchEventKinds.ENTRY_MODIFY )
    {
      if( Files.isRegularFile( path ) )
        loadFile( path );
    }
    else if( kind == StandardWatchEventKinds.ENTRY_DELETE )
    {
      unloadFile( path );
    }
  }

  /**
   * Loads every regular file present and unloads every tracked path that is gone. A directory that
   * cannot be listed leaves the store as it is.
   */
  void reconcile()
  {
    List<Path> present = new ArrayList<Path>();

    try( DirectoryStream<Path> entries = Files.newDirectoryStream( directory ) )
    {
      for( Path entry : entries )
      {
        if( !isHidden( entry.getFileName() ) && Files.isRegularFile( entry ) )
          present.add( entry.toAbsolutePath().normalize() );
      }
    }
    catch( IOException | RuntimeException e )
    {
      LOGGER.error( "Cannot list {}: {}", directory, e.getMessage() );
      return;
    }

    for( Path path : present )
    {
      loadFile( path );
    }

    Set<Path> tracked;
    try
    {
      tracked = new HashSet<Path>( store.paths() );
    }
    catch( LockException e )
    {
      LOGGER.error( "Cannot reconcile {}: {}", directory, e.getMessage() );
      return;
    }

    for( Path path : tracked )
    {
      if( directory.equals( path.getParent() ) && !present.contains( path ) )
        unloadFile( path );
    }
  }

  private void loadFile( Path path )
  {
    try
    {
      store.load( path );
      publish( ActionLoad, path, store.fingerprintForPath( path ).orElse( null ) );
    }
    catch( CertificateParseException e )
    {
      LOGGER.error( "Skipping {}: {}", path, e.getMessage() );
    }
    catch( PolicyException e )
    {
      LOGGER.error( "Rejected {} ({}): {}", path, e.getFingerprint(), e.getMessage() );
    }
    catch( LockException e )
    {
      LOGGER.error( "Cannot load {}: {}", path, e.getMessage() );
    }
    catch( RuntimeException e )
    {
      LOGGER.error( "Unexpected error loading {}: {}", path, e.getMessage(), e );
    }
  }

  private void unloadFile( Path path )
  {
    try
    {
      Fingerprint fingerprint = store.fingerprintForPath( path ).orElse( null );
      store.unload( path );
      publish( ActionUnload, path, fingerprint );
    }
    catch( NotFoundException e )
    {
      LOGGER.debug( "Ignoring delete of untracked {}", path );
    }
    catch( LockException e )
    {
      LOGGER.error( "Cannot unload {}: {}", path, e.getMessage() );
    }
    catch( RuntimeException e )
    {
      LOGGER.error( "Unexpected error unloading {}: {}", path, e.getMessage(), e );
    }
  }

  private void publish( String action, Path path, Fingerprint fingerprint )
  {
    if( stopped )
      return;

    JsonObject change = new JsonObject().put( "action", action )
                                        .put( "path",   path.toString() );
    if( fingerprint != null )
      change.put( "fingerprint", fingerprint.toHex() );

    vertx.eventBus().publish( ServiceCoreIF.StoreChangedAddr, change );
  }

  private static boolean isHidden( Path name )
  {
    return name != null && name.toString().startsWith( "." );
  }

  private int storeSize()
  {
    try
    {
      return store.size();
    }
    catch( LockException e )
    {
      return -1;
    }
  }

  private void cancelPolling()
  {
    long id = pollTimerId;
    if( id >= 0 )
    {
      vertx.cancelTimer( id );
      pollTimerId = -1;
    }
  }

  private void cancelTimers()
  {
    cancelPolling();

    long id = retryTimerId;
    if( id >= 0 )
    {
      vertx.cancelTimer( id );
      retryTimerId = -1;
    }
  }

  private void closeWatchService()
  {
    WatchService service = watchService;
    watchService = null;

    if( service == null )
      return;

    try
    {
      service.close();
    }
    catch( IOException e )
    {
      LOGGER.warn( "Error closing watch service for {}: {}", directory, e.getMessage() );
    }
  }

  public int     getSubscribeAttempts() { return subscribeAttempts.get(); }
  public boolean isSubscribed()         { return watchService != null && pollTimerId >= 0; }
  public Path    getDirectory()         { return directory; }
}
