package de.ialistannen.ocmirror.operator;

import java.io.IOException;
import java.util.List;

/**
 * Turns the database shipped in an operator index image into channel heads.
 */
public interface IndexDatabaseDecoder {

  /**
   * @param database the raw database file
   * @return one row per package channel
   * @throws IOException if the database can not be read
   */
  List<IndexRow> decode(byte[] database) throws IOException;
}
