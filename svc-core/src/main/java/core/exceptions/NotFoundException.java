package core.exceptions;

/**
 * Thrown when an unload targets a path that was never loaded or a delete targets an unknown
 * fingerprint.
 */
public class NotFoundException extends Exception
{
  private static final long serialVersionUID = 4757120132833816243L;

  public NotFoundException( String msg )
  {
    super( msg );
  }
}
