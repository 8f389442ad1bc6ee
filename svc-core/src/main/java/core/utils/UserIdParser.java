package core.utils;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Extracts email addresses from OpenPGP User ID strings such as
 * {@code "Alice Example <alice@example.com>"} or a bare {@code "alice@example.com"}.
 */
public class UserIdParser
{
  /**
   * Returns the address exactly as declared in the User ID, or null when the User ID
   * does not carry a well formed address.
   */
  public static String email( String userId )
  {
    if( userId == null )
      return null;

    String candidate;
    int    open  = userId.lastIndexOf( '<' );
    int    close = userId.lastIndexOf( '>' );

    if( open >= 0 && close > open )
      candidate = userId.substring( open + 1, close );
    else if( open < 0 && close < 0 )
      candidate = userId.trim();
    else
      return null;

    return isValidAddress( candidate ) ? candidate : null;
  }

  /**
   * Returns the declared address lower-cased, or null when the User ID carries none.
   */
  public static String normalizedEmail( String userId )
  {
    String email = email( userId );
    if( email == null )
      return null;

    return email.toLowerCase( Locale.ROOT );
  }

  /**
   * Decodes a raw User ID packet body. Returns null when the bytes are not valid UTF-8.
   */
  public static String decode( byte[] rawUserId )
  {
    if( rawUserId == null )
      return null;

    try
    {
      return StandardCharsets.UTF_8.newDecoder()
                                   .onMalformedInput( CodingErrorAction.REPORT )
                                   .onUnmappableCharacter( CodingErrorAction.REPORT )
                                   .decode( ByteBuffer.wrap( rawUserId ) )
                                   .toString();
    }
    catch( CharacterCodingException e )
    {
      return null;
    }
  }

  public static boolean isValidAddress( String address )
  {
    if( address == null || address.isEmpty() )
      return false;

    int at = address.indexOf( '@' );
    if( at <= 0 || at != address.lastIndexOf( '@' ) || at == address.length() - 1 )
      return false;

    for( int i = 0; i < address.length(); i++ )
    {
      char c = address.charAt( i );
      if( Character.isWhitespace( c ) || c == '<' || c == '>' )
        return false;
    }

    return true;
  }
}
