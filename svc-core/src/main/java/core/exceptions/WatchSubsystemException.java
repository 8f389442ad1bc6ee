package core.exceptions;

public class WatchSubsystemException extends Exception
{
  private static final long serialVersionUID = 4757156132833816243L;

  public WatchSubsystemException( String msg )
  {
    super( msg );
  }

  public WatchSubsystemException( String msg, Throwable cause )
  {
    super( msg, cause );
  }
}
