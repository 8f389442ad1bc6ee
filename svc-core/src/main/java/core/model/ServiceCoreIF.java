package core.model;

public interface ServiceCoreIF
{
  public static final String SUCCESS = "success";

  public static final String WkdSvcId = "wkd";

  // Web Key Directory well-known paths
  public static final String WellKnownBase     = "/.well-known/openpgpkey";
  public static final String DirectHashPath    = WellKnownBase + "/hu/:local";              // host header carries the domain
  public static final String AdvancedHashPath  = WellKnownBase + "/:domain/hu/:local";      // openpgpkey.<domain> sub-domain layout
  public static final String DirectPolicyPath  = WellKnownBase + "/policy";
  public static final String AdvancedPolicyPath = WellKnownBase + "/:domain/policy";

  public static final String KeyContentType = "application/octet-stream";

  // Event bus addresses
  public static final String StoreChangedAddr = "wkd.store.changed";
}
