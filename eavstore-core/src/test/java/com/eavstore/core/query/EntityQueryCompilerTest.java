package com.eavstore.core.query;

import com.eavstore.core.schema.EavSchema;
import com.eavstore.core.sql.CompiledStatement;
import com.eavstore.core.value.AttrValue;
import com.eavstore.core.value.ValueCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the SQL shape produced by EntityQueryCompiler.
 * Behavior against a real database is covered by EntityDaoTest.
 */
class EntityQueryCompilerTest {

    private EntityQueryCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new EntityQueryCompiler(EavSchema.standard(), new ValueCodec());
    }

    @Nested
    @DisplayName("Base query")
    class BaseQueryTests {

        @Test
        @DisplayName("Projects the six row columns")
        void projectsRowColumns() {
            String sql = compiler.compile(EntityQuery.all()).sql();

            assertTrue(sql.startsWith("SELECT \"outer_attrs\".\"attr\" AS \"attr\", \"outer_attrs\".\"value\" AS \"value\","
                + " \"outer_attrs\".\"type\" AS \"type\", \"outer_ents\".\"key\" AS \"ent_key\","
                + " \"outer_ents\".\"modified\" AS \"ent_modified\", \"outer_ents\".\"created\" AS \"ent_created\""
                + " FROM \"ents\" AS \"outer_ents\""), sql);
        }

        @Test
        @DisplayName("Without attribute filters the attribute table is outer-joined")
        void outerJoinWithoutFilters() {
            CompiledStatement stmt = compiler.compile(EntityQuery.all());

            assertTrue(stmt.sql().contains("LEFT OUTER JOIN \"attrs\" AS \"outer_attrs\""), stmt.sql());
            assertFalse(stmt.sql().contains("WHERE"), stmt.sql());
            assertTrue(stmt.params().isEmpty());
        }

        @Test
        @DisplayName("Null query means all entities")
        void nullQuery() {
            assertEquals(compiler.compile(EntityQuery.all()), compiler.compile(null));
        }

        @Test
        @DisplayName("Selected attribute names restrict the join, not the entities")
        void attrsToSelectInJoin() {
            CompiledStatement stmt = compiler.compile(EntityQuery.builder().select("a", "b").build());

            assertTrue(stmt.sql().contains("LEFT OUTER JOIN \"attrs\" AS \"outer_attrs\" ON"
                + " (\"outer_attrs\".\"ent_key\" = \"outer_ents\".\"key\") AND (\"outer_attrs\".\"attr\" IN (?, ?))"),
                stmt.sql());
            assertEquals(List.of("a", "b"), stmt.params());
        }
    }

    @Nested
    @DisplayName("Attribute filters")
    class AttrFilterTests {

        @Test
        @DisplayName("Binary filter joins a distinct key subquery and forces an inner base join")
        void binaryFilter() {
            CompiledStatement stmt = compiler.compile(EntityQuery.builder().attrFilter("a", "=", 1).build());

            assertTrue(stmt.sql().contains(" JOIN \"attrs\" AS \"outer_attrs\""), stmt.sql());
            assertFalse(stmt.sql().contains("LEFT OUTER"), stmt.sql());
            assertTrue(stmt.sql().contains("JOIN (SELECT DISTINCT \"filter_attrs_1\".\"ent_key\" AS \"ent_key\""
                + " FROM \"attrs\" AS \"filter_attrs_1\" WHERE (\"filter_attrs_1\".\"attr\" = ?)"
                + " AND (\"filter_attrs_1\".\"value\" = ?)) AS \"binary_filter_1\""
                + " ON \"binary_filter_1\".\"ent_key\" = \"outer_ents\".\"key\""), stmt.sql());
            assertEquals(List.of("a", "1"), stmt.params());
        }

        @Test
        @DisplayName("Each binary filter gets its own alias")
        void distinctAliases() {
            String sql = compiler.compile(EntityQuery.builder()
                .attrFilter("a", "=", 1)
                .attrFilter("b", "! LIKE", "x%")
                .build()).sql();

            assertTrue(sql.contains("\"binary_filter_1\""), sql);
            assertTrue(sql.contains("\"binary_filter_2\""), sql);
            assertTrue(sql.contains("NOT (\"filter_attrs_2\".\"value\" LIKE ?)"), sql);
        }

        @Test
        @DisplayName("String arguments compare against the verbatim stored text")
        void stringArgument() {
            CompiledStatement stmt = compiler.compile(EntityQuery.builder().attrFilter("name", "=", "bob").build());

            assertEquals(List.of("name", "bob"), stmt.params());
        }

        @Test
        @DisplayName("Existence filters are correlated EXISTS predicates")
        void existenceFilters() {
            CompiledStatement exists = compiler.compile(EntityQuery.builder()
                .attrFilter(AttrFilter.exists("c")).build());
            CompiledStatement notExists = compiler.compile(EntityQuery.builder()
                .attrFilter(AttrFilter.notExists("c")).build());

            assertTrue(exists.sql().contains("WHERE EXISTS (SELECT \"exists_attrs_1\".\"ent_key\""), exists.sql());
            assertTrue(exists.sql().contains("(\"exists_attrs_1\".\"ent_key\" = \"outer_ents\".\"key\")"), exists.sql());
            assertTrue(notExists.sql().contains("WHERE NOT (EXISTS (SELECT"), notExists.sql());
            assertEquals(List.of("c"), notExists.params());
        }

        @Test
        @DisplayName("Existence filters keep the outer base join")
        void existenceKeepsOuterJoin() {
            EntityQuery query = EntityQuery.builder().attrFilter(AttrFilter.notExists("c")).build();
            CompiledStatement stmt = compiler.compile(query);

            assertTrue(stmt.sql().contains("LEFT OUTER JOIN \"attrs\" AS \"outer_attrs\""), stmt.sql());
            assertFalse(compiler.components(query).requiresAttrRow());
        }

        @Test
        @DisplayName("A binary filter next to an existence filter still forces the inner base join")
        void binaryWithExistence() {
            String sql = compiler.compile(EntityQuery.builder()
                .attrFilter(AttrFilter.exists("c"))
                .attrFilter("a", "=", 1)
                .build()).sql();

            assertFalse(sql.contains("LEFT OUTER"), sql);
            assertTrue(sql.contains("\"exists_attrs_1\""), sql);
            assertTrue(sql.contains("\"binary_filter_2\""), sql);
        }

        @Test
        @DisplayName("Unknown operator fails at compile time")
        void unknownOperator() {
            EntityQuery query = EntityQuery.builder().attrFilter("a", "BETWEEN", 1).build();

            UnknownFilterTypeException e = assertThrows(UnknownFilterTypeException.class,
                () -> compiler.compile(query));
            assertTrue(e.getMessage().contains("BETWEEN"));
        }

        @Test
        @DisplayName("Applying a filter leaves earlier components untouched")
        void componentsAreImmutable() {
            QueryComponents base = compiler.base();

            QueryComponents filtered = compiler.applyAttrFilter(base, AttrFilter.eq("a", 1));

            assertTrue(base.joins().isEmpty());
            assertFalse(base.requiresAttrRow());
            assertEquals(0, base.aliasCount());
            assertEquals(1, filtered.joins().size());
            assertTrue(filtered.requiresAttrRow());
        }
    }

    @Nested
    @DisplayName("Entity filters")
    class EntFilterTests {

        @Test
        @DisplayName("Compare entity columns directly")
        void entityColumn() {
            CompiledStatement stmt = compiler.compile(EntityQuery.builder()
                .entFilter("modified", ">=", 100L)
                .entFilter("key", "! =", "k")
                .build());

            assertTrue(stmt.sql().endsWith("WHERE (\"outer_ents\".\"modified\" >= ?)"
                + " AND (NOT (\"outer_ents\".\"key\" = ?))"), stmt.sql());
            assertEquals(List.of(100L, "k"), stmt.params());
        }

        @Test
        @DisplayName("Params follow join order then where order")
        void paramOrder() {
            CompiledStatement stmt = compiler.compile(EntityQuery.builder()
                .select("x")
                .attrFilter("a", "=", 1)
                .entFilter("modified", ">", 5L)
                .build());

            assertEquals(List.of("x", "a", "1", 5L), stmt.params());
        }

        @Test
        @DisplayName("Attribute value arguments are unwrapped")
        void attrValueArgument() {
            CompiledStatement stmt = compiler.compile(EntityQuery.builder()
                .entFilter("created", "<", AttrValue.of(7))
                .build());

            assertEquals(List.of(BigDecimal.valueOf(7)), stmt.params());
        }

        @Test
        @DisplayName("Unknown columns and non-binary operators are rejected")
        void rejected() {
            assertThrows(UnknownColumnException.class,
                () -> compiler.compile(EntityQuery.builder().entFilter("attr", "=", "x").build()));
            assertThrows(UnknownFilterTypeException.class,
                () -> compiler.compile(EntityQuery.builder().entFilter("key", "EXISTS", null).build()));
        }
    }
}
