package io.github.suppierk.test;

import io.github.suppierk.es.jooq.JooqEventStore;
import org.h2.jdbcx.JdbcDataSource;
import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;

/** In-memory H2 databases in PostgreSQL mode, one per test class. */
public final class TestDatabase {
  private TestDatabase() {
    // No instance
  }

  /**
   * @param name of the database, must be unique per test class
   * @return a context backed by a data source, so that every operation gets its own connection
   */
  public static DSLContext create(String name) {
    final var dataSource = new JdbcDataSource();
    dataSource.setURL(
        "jdbc:h2:mem:%s;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1"
            .formatted(name));
    return DSL.using(dataSource, SQLDialect.POSTGRES);
  }

  public static void clear(DSLContext dslContext) {
    clear(dslContext, JooqEventStore.DEFAULT_TABLE_NAME);
  }

  public static void clear(DSLContext dslContext, String tableName) {
    dslContext.deleteFrom(DSL.table(DSL.name(tableName))).execute();
  }
}
