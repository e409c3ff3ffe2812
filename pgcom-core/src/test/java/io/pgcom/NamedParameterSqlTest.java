package io.pgcom;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NamedParameterSqlTest {

    @Test
    void rewritesPlaceholdersInOrder() {
        NamedParameterSql parsed = NamedParameterSql.parse("SELECT * FROM t WHERE a = :a AND b > :b_2 OR a = :a");
        assertEquals("SELECT * FROM t WHERE a = ? AND b > ? OR a = ?", parsed.sql());
        assertEquals(List.of("a", "b_2", "a"), parsed.names());
    }

    @Test
    void leavesCastsAlone() {
        NamedParameterSql parsed = NamedParameterSql.parse("SELECT :v::int, now()::date");
        assertEquals("SELECT ?::int, now()::date", parsed.sql());
        assertEquals(List.of("v"), parsed.names());
    }

    @Test
    void skipsLiteralsIdentifiersAndComments() {
        String sql = "SELECT ':x', \"col:y\", 'it'':s' -- :z\n/* :w */ FROM t WHERE c = :c";
        NamedParameterSql parsed = NamedParameterSql.parse(sql);
        assertEquals("SELECT ':x', \"col:y\", 'it'':s' -- :z\n/* :w */ FROM t WHERE c = ?", parsed.sql());
        assertEquals(List.of("c"), parsed.names());
    }

    @Test
    void skipsDollarQuotedBodies() {
        String sql = "DO $body$ BEGIN PERFORM :inside; END $body$; SELECT :outside";
        NamedParameterSql parsed = NamedParameterSql.parse(sql);
        assertEquals("DO $body$ BEGIN PERFORM :inside; END $body$; SELECT ?", parsed.sql());
        assertEquals(List.of("outside"), parsed.names());
    }

    @Test
    void textWithoutPlaceholdersIsUnchanged() {
        NamedParameterSql parsed = NamedParameterSql.parse("SELECT 1");
        assertEquals("SELECT 1", parsed.sql());
        assertTrue(parsed.names().isEmpty());
    }
}
