package verticle;

import java.io.IOException;
import java.util.Locale;
import java.util.Optional;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;

import org.bouncycastle.openpgp.PGPPublicKeyRing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.model.KeyProviderIF;
import core.model.ServiceCoreIF;
import core.utils.PgpCertificateCodec;

/**
 * Serves the Web Key Directory paths for both the direct and the advanced method.
 */
public class WkdHttpVert extends AbstractVerticle
{
  private static final Logger LOGGER = LoggerFactory.getLogger( WkdHttpVert.class );

  private final KeyProviderIF provider;
  private final String        host;
  private final int           port;

  private HttpServer server = null;

  public WkdHttpVert( KeyProviderIF provider, String host, int port )
  {
    this.provider = provider;
    this.host     = host;
    this.port     = port;
  }

  @Override
  public void start( Promise<Void> startPromise )
  {
    Router router = Router.router( vertx );

    router.get( ServiceCoreIF.DirectPolicyPath   ).handler( this::handlePolicy );
    router.get( ServiceCoreIF.AdvancedPolicyPath ).handler( this::handlePolicy );
    router.get( ServiceCoreIF.DirectHashPath     ).handler( ctx -> handleLookup( ctx, requestDomain( ctx ) ) );
    router.get( ServiceCoreIF.AdvancedHashPath   ).handler( ctx -> handleLookup( ctx, ctx.pathParam( "domain" ) ) );

    vertx.createHttpServer()
         .requestHandler( router )
         .listen( port, host )
         .onSuccess( s ->
          {
            server = s;
            LOGGER.info( "WkdHttpVert listening on {}:{}", host, s.actualPort() );
            startPromise.complete();
          })
         .onFailure( err ->
          {
            LOGGER.error( "WkdHttpVert failed to listen on {}:{}: {}", host, port, err.getMessage(), err );
            startPromise.fail( err );
          });
  }

  @Override
  public void stop( Promise<Void> stopPromise )
  {
    if( server == null )
    {
      stopPromise.complete();
      return;
    }

    server.close().onComplete( ar -> stopPromise.complete() );
  }

  private void handlePolicy( RoutingContext ctx )
  {
    ctx.response().setStatusCode( 200 ).end();
  }

  private void handleLookup( RoutingContext ctx, String domain )
  {
    String local = ctx.pathParam( "local" );

    if( domain == null || domain.isEmpty() || local == null || local.isEmpty() )
    {
      notFound( ctx );
      return;
    }

    String normalizedDomain = domain.toLowerCase( Locale.ROOT );

    Optional<PGPPublicKeyRing> cert = provider.discover( local, normalizedDomain );
    if( cert.isEmpty() )
    {
      LOGGER.debug( "Not found: {} at {}", local, normalizedDomain );
      notFound( ctx );
      return;
    }

    byte[] body;
    try
    {
      body = PgpCertificateCodec.write( cert.get() );
    }
    catch( IOException e )
    {
      LOGGER.error( "Cannot encode certificate for {} at {}: {}", local, normalizedDomain, e.getMessage(), e );
      ctx.response().setStatusCode( 500 ).end();
      return;
    }

    ctx.response()
       .setStatusCode( 200 )
       .putHeader( HttpHeaders.CONTENT_TYPE, ServiceCoreIF.KeyContentType )
       .end( Buffer.buffer( body ) );
  }

  private static void notFound( RoutingContext ctx )
  {
    ctx.response().setStatusCode( 404 ).end( "Not found" );
  }

  /**
   * Host of the request without any port.
   */
  private static String requestDomain( RoutingContext ctx )
  {
    String authority = ctx.request().getHeader( HttpHeaders.HOST );
    if( authority == null )
      return null;

    if( authority.startsWith( "[" ) )
    {
      int end = authority.indexOf( ']' );
      return end > 0 ? authority.substring( 1, end ) : authority;
    }

    int colon = authority.indexOf( ':' );
    return colon >= 0 ? authority.substring( 0, colon ) : authority;
  }

  public int getActualPort()
  {
    return server != null ? server.actualPort() : -1;
  }
}
