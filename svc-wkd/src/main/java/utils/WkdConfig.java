package utils;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.model.ServiceCoreIF;
import core.model.WkdConfigIF;

public class WkdConfig
{
  private static final Logger LOGGER = LoggerFactory.getLogger( WkdConfig.class );

  public static final String DefaultResource = "wkd-config.json";

  private String serviceId     = ServiceCoreIF.WkdSvcId;
  private String environment   = null;
  private String keysDirectory = "keys";
  private String httpHost      = "0.0.0.0";
  private int    httpPort      = 8080;
  private long   watchRetryMs  = 5000;
  private long   watchPollMs   = 250;
  private long   lockTimeoutMs = 30000;

  public WkdConfig( Map<String, String> data )
  {
    if( data.get( WkdConfigIF.ServiceId     ) != null ) serviceId     = data.get( WkdConfigIF.ServiceId     );
    if( data.get( WkdConfigIF.Environment   ) != null ) environment   = data.get( WkdConfigIF.Environment   );
    if( data.get( WkdConfigIF.KeysDirectory ) != null ) keysDirectory = data.get( WkdConfigIF.KeysDirectory );
    if( data.get( WkdConfigIF.HttpHost      ) != null ) httpHost      = data.get( WkdConfigIF.HttpHost      );

    if( data.get( WkdConfigIF.HttpPort      ) != null ) httpPort      = (int) parseNumber( WkdConfigIF.HttpPort,      data.get( WkdConfigIF.HttpPort      ), 0 );
    if( data.get( WkdConfigIF.WatchRetryMs  ) != null ) watchRetryMs  = parseNumber( WkdConfigIF.WatchRetryMs,  data.get( WkdConfigIF.WatchRetryMs  ), 1 );
    if( data.get( WkdConfigIF.WatchPollMs   ) != null ) watchPollMs   = parseNumber( WkdConfigIF.WatchPollMs,   data.get( WkdConfigIF.WatchPollMs   ), 1 );
    if( data.get( WkdConfigIF.LockTimeoutMs ) != null ) lockTimeoutMs = parseNumber( WkdConfigIF.LockTimeoutMs, data.get( WkdConfigIF.LockTimeoutMs ), 1 );

    if( httpPort > 65535 )
      throw new IllegalArgumentException( WkdConfigIF.HttpPort + " out of range: " + httpPort );

    LOGGER.info( "***************** WKD Config is set for ******************" );
    LOGGER.info( WkdConfigIF.ServiceId     + "     = " + serviceId     );
    LOGGER.info( WkdConfigIF.Environment   + "   = " + environment   );
    LOGGER.info( WkdConfigIF.KeysDirectory + " = " + keysDirectory );
    LOGGER.info( WkdConfigIF.HttpHost      + "      = " + httpHost      );
    LOGGER.info( WkdConfigIF.HttpPort      + "      = " + httpPort      );
    LOGGER.info( WkdConfigIF.WatchRetryMs  + "  = " + watchRetryMs  );
    LOGGER.info( WkdConfigIF.WatchPollMs   + "   = " + watchPollMs   );
    LOGGER.info( WkdConfigIF.LockTimeoutMs + " = " + lockTimeoutMs );
    LOGGER.info( "***************** End of WKD Config ******************" );
  }

  /**
   * Locates the configuration (system property, then environment, then the classpath default), reads it
   * and applies the environment overrides.
   */
  public static WkdConfig load( Map<String, String> env )
   throws IOException
  {
    Map<String, String> data = new HashMap<String, String>();

    String location = System.getProperty( WkdConfigIF.PropConfigPath );
    if( location == null )
      location = env.get( WkdConfigIF.EnvConfigPath );

    if( location != null )
    {
      LOGGER.info( "Reading configuration from file: {}", location );
      data.putAll( readFile( new File( location ) ) );
    }
    else
    {
      try( InputStream in = WkdConfig.class.getClassLoader().getResourceAsStream( DefaultResource ) )
      {
        if( in != null )
        {
          LOGGER.info( "Reading configuration from classpath resource: {}", DefaultResource );
          data.putAll( read( in ) );
        }
        else
        {
          LOGGER.warn( "No configuration found, using defaults" );
        }
      }
    }

    if( env.get( WkdConfigIF.EnvKeysDir  ) != null ) data.put( WkdConfigIF.KeysDirectory, env.get( WkdConfigIF.EnvKeysDir  ) );
    if( env.get( WkdConfigIF.EnvHttpPort ) != null ) data.put( WkdConfigIF.HttpPort,      env.get( WkdConfigIF.EnvHttpPort ) );

    return new WkdConfig( data );
  }

  public static Map<String, String> readFile( File file )
   throws IOException
  {
    ObjectMapper mapper = new ObjectMapper();
    return stringify( mapper.readValue( file, new TypeReference<Map<String, Object>>() {} ) );
  }

  public static Map<String, String> read( InputStream in )
   throws IOException
  {
    ObjectMapper mapper = new ObjectMapper();
    return stringify( mapper.readValue( in, new TypeReference<Map<String, Object>>() {} ) );
  }

  private static Map<String, String> stringify( Map<String, Object> raw )
  {
    Map<String, String> data = new HashMap<String, String>();
    for( Map.Entry<String, Object> entry : raw.entrySet() )
    {
      if( entry.getValue() != null )
        data.put( entry.getKey(), String.valueOf( entry.getValue() ) );
    }
    return data;
  }

  private static long parseNumber( String key, String value, long min )
  {
    long parsed;
    try
    {
      parsed = Long.parseLong( value.trim() );
    }
    catch( NumberFormatException e )
    {
      throw new IllegalArgumentException( "Invalid number for " + key + ": " + value, e );
    }

    if( parsed < min )
      throw new IllegalArgumentException( key + " must be at least " + min + ": " + value );

    return parsed;
  }

  public String getServiceId()     { return serviceId;     }
  public String getEnvironment()   { return environment;   }
  public String getKeysDirectory() { return keysDirectory; }
  public String getHttpHost()      { return httpHost;      }
  public int    getHttpPort()      { return httpPort;      }
  public long   getWatchRetryMs()  { return watchRetryMs;  }
  public long   getWatchPollMs()   { return watchPollMs;   }
  public long   getLockTimeoutMs() { return lockTimeoutMs; }

  public Path getKeysPath()
  {
    return Paths.get( keysDirectory ).toAbsolutePath().normalize();
  }
}
