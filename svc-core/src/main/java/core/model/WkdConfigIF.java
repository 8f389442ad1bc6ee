package core.model;


public interface WkdConfigIF
{
  // Service conf keys
  public static final String ServiceId     = "serviceId";
  public static final String Environment   = "environment";

  // Directory watch conf keys
  public static final String KeysDirectory = "keysDirectory";
  public static final String WatchRetryMs  = "watchRetryMs";
  public static final String WatchPollMs   = "watchPollMs";
  public static final String LockTimeoutMs = "lockTimeoutMs";

  // Http conf keys
  public static final String HttpHost      = "httpHost";
  public static final String HttpPort      = "httpPort";

  // Environment overrides
  public static final String EnvConfigPath = "WKD_CONFIG";
  public static final String EnvKeysDir    = "WKD_KEYS_DIR";
  public static final String EnvHttpPort   = "WKD_HTTP_PORT";
  public static final String PropConfigPath = "wkd.config";
}
