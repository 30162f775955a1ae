package db.migration;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

public class V3__business_range_constraints extends BaseJavaMigration {
  private static final String RATING_CONSTRAINT = "businesses_rating_range";
  private static final String COORDINATE_CONSTRAINT = "businesses_coordinate_range";

  @Override
  public void migrate(Context context) throws Exception {
    Connection connection = context.getConnection();
    try (Statement statement = connection.createStatement()) {
      statement.executeUpdate(
          "UPDATE businesses SET rating = NULL WHERE rating < 0 OR rating > 5");
      statement.executeUpdate(
          "UPDATE businesses SET latitude = NULL, longitude = NULL "
              + "WHERE latitude < -90 OR latitude > 90 OR longitude < -180 OR longitude > 180");
    }

    if (!constraintExists(connection, RATING_CONSTRAINT)) {
      try (Statement statement = connection.createStatement()) {
        statement.executeUpdate(
            "ALTER TABLE businesses ADD CONSTRAINT "
                + RATING_CONSTRAINT
                + " CHECK (rating IS NULL OR (rating >= 0 AND rating <= 5))");
      }
    }
    if (!constraintExists(connection, COORDINATE_CONSTRAINT)) {
      try (Statement statement = connection.createStatement()) {
        statement.executeUpdate(
            "ALTER TABLE businesses ADD CONSTRAINT "
                + COORDINATE_CONSTRAINT
                + " CHECK ((latitude IS NULL OR (latitude >= -90 AND latitude <= 90)) "
                + "AND (longitude IS NULL OR (longitude >= -180 AND longitude <= 180)))");
      }
    }
  }

  private boolean constraintExists(Connection connection, String name) throws SQLException {
    String sql =
        "SELECT 1 FROM information_schema.table_constraints "
            + "WHERE LOWER(table_name) = 'businesses' "
            + "AND LOWER(constraint_name) = ?";
    try (PreparedStatement ps = connection.prepareStatement(sql)) {
      ps.setString(1, name.toLowerCase());
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next();
      }
    }
  }
}
