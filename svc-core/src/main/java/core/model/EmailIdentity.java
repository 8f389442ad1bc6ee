package core.model;

import java.util.Objects;

import core.crypto.EmailIdentityEncoder;

/**
 * One indexed email address of a certificate: the hashed local part used in WKD paths,
 * together with the plain local part and domain it was derived from.
 */
public final class EmailIdentity
{
  private final String encodedLocal;
  private final String localPart;
  private final String domain;

  public EmailIdentity( String encodedLocal, String localPart, String domain )
  {
    this.encodedLocal = Objects.requireNonNull( encodedLocal, "encodedLocal" );
    this.localPart    = Objects.requireNonNull( localPart,    "localPart"    );
    this.domain       = Objects.requireNonNull( domain,       "domain"       );
  }

  /**
   * Splits a normalized address at its '@' and hashes the local part.
   * Returns null when the address has no '@'.
   */
  public static EmailIdentity fromEmail( String email )
  {
    int at = email.indexOf( '@' );
    if( at < 0 )
      return null;

    String localPart = email.substring( 0, at );
    String domain    = email.substring( at + 1 );

    return new EmailIdentity( EmailIdentityEncoder.encode( localPart ), localPart, domain );
  }

  /**
   * Key under which an identity is found by a WKD request: the hashed local part and the domain.
   */
  public static String lookupKey( String encoded, String domain )
  {
    return encoded + "@" + domain;
  }

  public String lookupKey()
  {
    return lookupKey( encodedLocal, domain );
  }

  public String getEncodedLocal() { return encodedLocal; }
  public String getLocalPart()    { return localPart;    }
  public String getDomain()       { return domain;       }

  public String toEmail()
  {
    return localPart + "@" + domain;
  }

  @Override
  public boolean equals( Object o )
  {
    if( this == o )
      return true;
    if( !( o instanceof EmailIdentity ) )
      return false;

    EmailIdentity other = (EmailIdentity) o;
    return encodedLocal.equals( other.encodedLocal ) &&
           localPart.equals( other.localPart )       &&
           domain.equals( other.domain );
  }

  @Override
  public int hashCode()
  {
    return Objects.hash( encodedLocal, localPart, domain );
  }

  @Override
  public String toString()
  {
    return toEmail() + " (" + encodedLocal + ")";
  }
}
