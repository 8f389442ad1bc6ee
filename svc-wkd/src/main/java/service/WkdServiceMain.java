package service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.Verticle;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.crypto.CertificatePolicy;
import core.handler.CertificateStore;
import core.model.ChildVerticle;
import core.service.FileKeyProvider;

import utils.WkdConfig;

import verticle.DirectoryWatcherVert;
import verticle.WkdHttpVert;

/**
 * Web Key Directory service. Certificates are read from a single directory that is watched for
 * changes; lookups are served over HTTP under the well-known openpgpkey paths.
 * <p>
 * Configuration is read from the JSON file named by the {@code wkd.config} system property or the
 * {@code WKD_CONFIG} environment variable, falling back to {@code wkd-config.json} on the classpath.
 * {@code WKD_KEYS_DIR} and {@code WKD_HTTP_PORT} override the file.
 */
public class WkdServiceMain
{
  private static final Logger LOGGER = LoggerFactory.getLogger( WkdServiceMain.class );

  private final WkdConfig           config;
  private final Vertx               vertx;
  private final CertificateStore    store;
  private final FileKeyProvider     provider;
  private final List<ChildVerticle> deployedVerticles = new ArrayList<ChildVerticle>();

  private WkdHttpVert      httpVert  = null;
  private volatile boolean cleanedUp = false;

  public WkdServiceMain( WkdConfig config )
  {
    this.config = config;

    VertxOptions options = new VertxOptions()
        .setWorkerPoolSize( 8 )
        .setEventLoopPoolSize( 2 )
        .setMaxWorkerExecuteTime( 120 )
        .setMaxWorkerExecuteTimeUnit( TimeUnit.SECONDS )
        .setBlockedThreadCheckInterval( 5000 )
        .setBlockedThreadCheckIntervalUnit( TimeUnit.MILLISECONDS );

    this.vertx    = Vertx.vertx( options );
    this.store    = new CertificateStore( new CertificatePolicy(), config.getLockTimeoutMs() );
    this.provider = new FileKeyProvider( store );
  }

  /**
   * Deploys the directory watcher first so the initial scan has completed before the HTTP
   * listener accepts lookups.
   */
  public void start()
   throws Exception
  {
    LOGGER.info( "Starting WKD Service {}", config.getServiceId() );

    Path keysPath = config.getKeysPath();

    DirectoryWatcherVert watcherVert = new DirectoryWatcherVert( store, keysPath, config.getWatchPollMs(), config.getWatchRetryMs() );
    deploy( watcherVert );

    httpVert = new WkdHttpVert( provider, config.getHttpHost(), config.getHttpPort() );
    deploy( httpVert );

    LOGGER.info( "WKD Service started: {} certificates, {} identities from {}", store.size(), store.identityCount(), keysPath );
  }

  private void deploy( Verticle verticle )
   throws Exception
  {
    String id = vertx.deployVerticle( verticle, new DeploymentOptions() )
                     .toCompletionStage()
                     .toCompletableFuture()
                     .get( 60, TimeUnit.SECONDS );

    deployedVerticles.add( new ChildVerticle( verticle.getClass().getName(), id ) );
    LOGGER.info( "{} deployed successfully: {}", verticle.getClass().getSimpleName(), id );
  }

  public synchronized void cleanupResources()
  {
    if( cleanedUp )
      return;
    cleanedUp = true;

    LOGGER.info( "Starting cleanup of resources" );

    List<ChildVerticle> verticlesToUndeploy = new ArrayList<ChildVerticle>( deployedVerticles );

    for( int i = verticlesToUndeploy.size() - 1; i >= 0; i-- )
    {
      ChildVerticle child    = verticlesToUndeploy.get( i );
      String        vertInfo = child.vertName() + " with id = " + child.id();

      try
      {
        LOGGER.info( "Undeploying verticle: {}", vertInfo );
        vertx.undeploy( child.id() ).toCompletionStage()
             .toCompletableFuture()
             .get( 30, TimeUnit.SECONDS );
        LOGGER.info( "Successfully undeployed verticle: {}", vertInfo );
      }
      catch( TimeoutException e )
      {
        LOGGER.warn( "Timeout while undeploying verticle {}: {}", vertInfo, e.getMessage() );
      }
      catch( InterruptedException e )
      {
        LOGGER.warn( "Interrupted while undeploying verticle {}: {}", vertInfo, e.getMessage() );
        Thread.currentThread().interrupt();
        break;
      }
      catch( Exception e )
      {
        LOGGER.warn( "Error while undeploying verticle {}: {}", vertInfo, e.getMessage(), e );
      }
    }

    deployedVerticles.clear();

    try
    {
      vertx.close().toCompletionStage().toCompletableFuture().get( 30, TimeUnit.SECONDS );
      LOGGER.info( "Vertx instance closed" );
    }
    catch( InterruptedException e )
    {
      Thread.currentThread().interrupt();
      LOGGER.warn( "Interrupted while closing Vertx instance" );
    }
    catch( Exception e )
    {
      LOGGER.warn( "Error while closing Vertx instance: {}", e.getMessage(), e );
    }
  }

  public CertificateStore getStore()    { return store;    }
  public FileKeyProvider  getProvider() { return provider; }

  /**
   * Port the HTTP listener is bound to, or -1 before start.
   */
  public int getHttpPort()
  {
    return httpVert != null ? httpVert.getActualPort() : -1;
  }

  public static void main( String[] args )
  {
    LOGGER.info( "WkdServiceMain.main - Starting WKD Service" );

    WkdServiceMain wkdSvc = null;
    try
    {
      WkdConfig config = WkdConfig.load( System.getenv() );
      wkdSvc = new WkdServiceMain( config );

      final WkdServiceMain svc = wkdSvc;
      Runtime.getRuntime().addShutdownHook( new Thread( () ->
      {
        LOGGER.info( "Shutdown hook triggered - cleaning up resources" );
        svc.cleanupResources();
      }));

      wkdSvc.start();
    }
    catch( Exception e )
    {
      LOGGER.error( "Fatal error starting WKD Service: {}", e.getMessage(), e );
      if( wkdSvc != null )
        wkdSvc.cleanupResources();
      System.exit( 1 );
    }
  }
}
