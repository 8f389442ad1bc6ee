package core.exceptions;

public class LockException extends Exception
{
  private static final long serialVersionUID = 3318402761150285571L;

  public LockException( String msg )
  {
    super( msg );
  }

  public LockException( String msg, Throwable cause )
  {
    super( msg, cause );
  }
}
