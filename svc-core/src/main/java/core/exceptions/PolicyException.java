package core.exceptions;

/**
 * Thrown when a certificate cannot be evaluated under the current validity policy,
 * e.g. the primary key carries no verifiable self-signature.
 */
public class PolicyException extends Exception
{
  private static final long serialVersionUID = 6129440857720317519L;

  private final String fingerprint;

  public PolicyException( String fingerprint, String message )
  {
    super( message );
    this.fingerprint = fingerprint;
  }

  public PolicyException( String fingerprint, String message, Throwable cause )
  {
    super( message, cause );
    this.fingerprint = fingerprint;
  }

  public String getFingerprint()
  {
    return fingerprint;
  }
}
