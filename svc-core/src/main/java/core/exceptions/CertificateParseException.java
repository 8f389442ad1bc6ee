package core.exceptions;

public class CertificateParseException extends Exception
{
  private static final long serialVersionUID = 2908990171511790800L;

  public CertificateParseException( String msg ) 
  {
    super( msg );
  }

  public CertificateParseException( String msg, Throwable cause )
  {
    super( msg, cause );
  }
}
