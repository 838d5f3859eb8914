package de.ialistannen.ocmirror.operator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the sqlite database of an operator registry index.
 */
public class SqliteIndexDatabaseDecoder implements IndexDatabaseDecoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(SqliteIndexDatabaseDecoder.class);

  private static final String CHANNEL_HEADS = "SELECT p.name AS package_name, c.name AS channel_name, "
    + "b.bundlepath AS bundle_path, c.head_operatorbundle_name AS bundle_name, p.default_channel AS default_channel "
    + "FROM package p "
    + "JOIN channel c ON c.package_name = p.name "
    + "LEFT JOIN operatorbundle b ON b.name = c.head_operatorbundle_name "
    + "ORDER BY p.name, c.name";

  @Override
  public List<IndexRow> decode(byte[] database) throws IOException {
    Path file = Files.createTempFile("oc-mirror-index", ".db");
    try {
      Files.write(file, database);
      return query(file);
    } finally {
      Files.deleteIfExists(file);
    }
  }

  private List<IndexRow> query(Path file) throws IOException {
    String url = "jdbc:sqlite:file:" + file.toAbsolutePath() + "?mode=ro";

    try (
      Connection connection = DriverManager.getConnection(url);
      PreparedStatement statement = connection.prepareStatement(CHANNEL_HEADS);
      ResultSet resultSet = statement.executeQuery()
    ) {
      List<IndexRow> rows = new ArrayList<>();
      while (resultSet.next()) {
        rows.add(new IndexRow(
          resultSet.getString("package_name"),
          resultSet.getString("channel_name"),
          resultSet.getString("bundle_path"),
          resultSet.getString("bundle_name"),
          resultSet.getString("default_channel")
        ));
      }
      LOGGER.debug("Read {} channel heads from index database", rows.size());
      return rows;
    } catch (SQLException e) {
      throw new IOException("Could not read index database", e);
    }
  }
}
