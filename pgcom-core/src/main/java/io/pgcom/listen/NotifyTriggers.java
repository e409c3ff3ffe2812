package io.pgcom.listen;

import io.pgcom.QualifiedName;
import io.pgcom.Sql;

/**
 * SQL text for the trigger function and trigger that publish row changes with
 * {@code pg_notify}.
 */
final class NotifyTriggers {

    static String createFunction(QualifiedName function, String channel) {
        return "CREATE OR REPLACE FUNCTION " + function.toSql() + "()\n"
                + "RETURNS trigger\n"
                + "LANGUAGE plpgsql\n"
                + "AS $function$\n"
                + "BEGIN\n"
                + "    PERFORM pg_notify(" + Sql.literal(channel) + ", row_to_json(NEW)::text);\n"
                + "    RETURN NEW;\n"
                + "END;\n"
                + "$function$";
    }

    static String triggerName(QualifiedName table) {
        return table.name() + "_notify";
    }

    static String dropTrigger(QualifiedName table) {
        return "DROP TRIGGER IF EXISTS " + Sql.identifier(triggerName(table)) + " ON " + table.toSql();
    }

    static String createTrigger(QualifiedName function, QualifiedName table) {
        return "CREATE TRIGGER " + Sql.identifier(triggerName(table))
                + " AFTER INSERT OR UPDATE ON " + table.toSql()
                + " FOR EACH ROW EXECUTE FUNCTION " + function.toSql() + "()";
    }

    private NotifyTriggers() {}
}
