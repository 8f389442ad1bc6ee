package core.utils;

/**
 * Z-Base-32 encoding as described in RFC 6189, section 5.1.6. Bits are consumed
 * most significant first in groups of five.
 */
public class ZBase32
{
  private static final char[] ALPHABET = "ybndrfg8ejkmcpqxot1uwisza345h769".toCharArray();

  public static String encode( byte[] data )
  {
    if( data == null )
      throw new IllegalArgumentException( "data cannot be null" );

    return encode( data, data.length * 8 );
  }

  /**
   * Encodes the first {@code bits} bits of {@code data}. A trailing partial group is
   * padded with zero bits.
   */
  public static String encode( byte[] data, int bits )
  {
    if( data == null )
      throw new IllegalArgumentException( "data cannot be null" );
    if( bits < 0 || bits > data.length * 8 )
      throw new IllegalArgumentException( "bits out of range: " + bits );

    StringBuilder out    = new StringBuilder( ( bits + 4 ) / 5 );
    int           buffer = 0;
    int           avail  = 0;
    int           index  = 0;
    int           left   = bits;

    while( left > 0 )
    {
      if( avail < 5 )
      {
        int next = index < data.length ? data[index++] & 0xFF : 0;
        buffer   = ( buffer << 8 ) | next;
        avail   += 8;
      }

      int take  = Math.min( 5, left );
      int group = ( buffer >> ( avail - 5 ) ) & 0x1F;
      if( take < 5 )
        group &= ( 0x1F << ( 5 - take ) ) & 0x1F;

      out.append( ALPHABET[group] );
      avail -= 5;
      left  -= take;
    }

    return out.toString();
  }
}
