package io.pgcom.jdbc;

/**
 * Catalog queries used by {@link Commuter}. All take their arguments as bound parameters.
 */
final class PostgresQueries {

    /** Params: table name, schema. */
    static final String TABLE_EXISTS = "SELECT table_name FROM information_schema.tables" +
            " WHERE table_name = ? AND table_schema = ?" +
            " LIMIT 1";

    /** Params: schema, table name. */
    static final String COLUMNS = "SELECT column_name, data_type FROM information_schema.columns" +
            " WHERE table_schema = ? AND table_name = ?" +
            " ORDER BY ordinal_position";

    /** Params: quoted qualified table name. */
    static final String PRIMARY_KEY = "SELECT a.attname AS column_name," +
            " format_type(a.atttypid, a.atttypmod) AS data_type" +
            " FROM pg_index i" +
            " JOIN pg_attribute a ON a.attrelid = i.indrelid AND a.attnum = ANY(i.indkey)" +
            " WHERE i.indrelid = CAST(? AS regclass) AND i.indisprimary";

    /** Params: table name, schema, parent table name, parent schema. */
    static final String FOREIGN_KEY = "SELECT child_att.attname AS child_column," +
            " parent_att.attname AS parent_column" +
            " FROM (SELECT unnest(con.conkey) AS child, unnest(con.confkey) AS parent," +
            " con.conrelid, con.confrelid" +
            " FROM pg_constraint con" +
            " JOIN pg_class cl ON con.conrelid = cl.oid" +
            " JOIN pg_namespace ns ON cl.relnamespace = ns.oid" +
            " JOIN pg_class parent_cl ON parent_cl.oid = con.confrelid" +
            " JOIN pg_namespace parent_ns ON parent_cl.relnamespace = parent_ns.oid" +
            " WHERE cl.relname = ? AND ns.nspname = ?" +
            " AND parent_cl.relname = ? AND parent_ns.nspname = ?" +
            " AND con.contype = 'f') keys" +
            " JOIN pg_attribute child_att ON child_att.attrelid = keys.conrelid AND child_att.attnum = keys.child" +
            " JOIN pg_attribute parent_att ON parent_att.attrelid = keys.confrelid AND parent_att.attnum = keys.parent";

    static final String CONNECTIONS_COUNT = "SELECT SUM(numbackends) FROM pg_stat_database";

    private PostgresQueries() {}
}
