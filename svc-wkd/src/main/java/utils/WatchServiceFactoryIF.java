package utils;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchService;

/**
 * Creates the notification primitive the directory watcher subscribes through.
 */
@FunctionalInterface
public interface WatchServiceFactoryIF
{
  /**
   * Opens a watch service and registers the directory for create, modify and delete events.
   */
  WatchService subscribe( Path directory )
   throws IOException;

  static WatchServiceFactoryIF defaultFactory()
  {
    return directory ->
    {
      WatchService service = directory.getFileSystem().newWatchService();
      try
      {
        directory.register( service, StandardWatchEventKinds.ENTRY_CREATE,
                                     StandardWatchEventKinds.ENTRY_MODIFY,
                                     StandardWatchEventKinds.ENTRY_DELETE );
      }
      catch( IOException | RuntimeException e )
      {
        service.close();
        throw e;
      }
      return service;
    };
  }
}
