package io.pgcom;

import java.util.Objects;

/**
 * A schema-qualified object name such as a table or function.
 *
 * @param schema schema name
 * @param name   object name within the schema
 */
public record QualifiedName(String schema, String name) {
    public static final String PUBLIC = "public";

    public QualifiedName {
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(name, "name");
    }

    /**
     * Splits {@code qualifiedName} on its first {@code '.'}. An unqualified name is placed in
     * {@code defaultSchema}, or in {@code public} when no default is configured.
     *
     * <pre>{@code
     * resolve("model.people", null)   -> (model, people)
     * resolve("people", "model")      -> (model, people)
     * resolve("people", null)         -> (public, people)
     * }</pre>
     *
     * @param qualifiedName  {@code schema.name} or {@code name}
     * @param defaultSchema  configured default schema, may be {@code null}
     * @return the resolved name
     */
    public static QualifiedName resolve(String qualifiedName, String defaultSchema) {
        Objects.requireNonNull(qualifiedName, "qualifiedName");
        int dot = qualifiedName.indexOf('.');
        if (dot >= 0) {
            return new QualifiedName(qualifiedName.substring(0, dot), qualifiedName.substring(dot + 1));
        }
        return new QualifiedName(defaultSchema != null ? defaultSchema : PUBLIC, qualifiedName);
    }

    /** Quoted {@code "schema"."name"} form for use in SQL text. */
    public String toSql() {
        return Sql.identifier(schema) + "." + Sql.identifier(name);
    }

    @Override
    public String toString() {
        return schema + "." + name;
    }
}
