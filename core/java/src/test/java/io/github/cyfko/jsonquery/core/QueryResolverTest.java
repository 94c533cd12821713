package io.github.cyfko.jsonquery.core;

import io.github.cyfko.jsonquery.core.api.ColumnSpec;
import io.github.cyfko.jsonquery.core.api.ColumnType;
import io.github.cyfko.jsonquery.core.api.LogicalRole;
import io.github.cyfko.jsonquery.core.config.OperatorAliases;
import io.github.cyfko.jsonquery.core.config.QueryLimits;
import io.github.cyfko.jsonquery.core.config.TypeConstraints;
import io.github.cyfko.jsonquery.core.exception.IllegalConstraintException;
import io.github.cyfko.jsonquery.core.spi.CustomOperatorProvider;
import io.github.cyfko.jsonquery.core.spi.CustomOperatorRegistry;
import io.github.cyfko.jsonquery.core.spi.FilterBackend;
import io.github.cyfko.jsonquery.core.support.RenderingBackend;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QueryResolver Tests")
class QueryResolverTest {

    private static final TypeConstraints TYPES = TypeConstraints.builder()
            .string("name", "email")
            .numeric("age")
            .nullable("email")
            .build();

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Mandatory arguments are checked")
        void testMandatoryArguments() {
            RenderingBackend backend = RenderingBackend.users();
            OperatorAliases aliases = OperatorAliases.defaults();

            assertThrows(IllegalConstraintException.class, () -> new QueryResolver<>(null, aliases, TYPES));
            assertThrows(IllegalConstraintException.class, () -> new QueryResolver<>(backend, null, TYPES));
            assertThrows(IllegalConstraintException.class, () -> new QueryResolver<>(backend, aliases, null));
        }

        @Test
        @DisplayName("Missing limits and operators fall back to defaults")
        void testOptionalArguments() {
            QueryResolver<String, String, String> resolver = new QueryResolver<>(
                    RenderingBackend.users(), OperatorAliases.defaults(), TYPES, null, null);

            assertEquals(QueryLimits.defaults(), resolver.limits());
            assertTrue(resolver.customOperators().isEmpty());
        }

        @Test
        @DisplayName("Declared columns must exist in the backend")
        void testUnresolvableDeclaredColumn() {
            TypeConstraints types = TypeConstraints.builder().string("name", "surname").build();

            IllegalConstraintException e = assertThrows(IllegalConstraintException.class,
                    () -> new QueryResolver<>(RenderingBackend.users(), OperatorAliases.defaults(), types));
            assertTrue(e.getMessage().contains("surname"));
        }

        @Test
        @DisplayName("Declared types must agree with the backend's column types")
        void testDeclaredTypeMismatch() {
            RenderingBackend backend = RenderingBackend.users();
            OperatorAliases aliases = OperatorAliases.defaults();

            IllegalConstraintException numericAsString = assertThrows(IllegalConstraintException.class,
                    () -> new QueryResolver<>(backend, aliases, TypeConstraints.builder().string("age").build()));
            assertEquals("Column 'age' is declared STRING but the backend reports NUMERIC", numericAsString.getMessage());

            IllegalConstraintException stringAsNumeric = assertThrows(IllegalConstraintException.class,
                    () -> new QueryResolver<>(backend, aliases, TypeConstraints.builder().numeric("name").build()));
            assertEquals("Column 'name' is declared NUMERIC but the backend reports STRING", stringAsNumeric.getMessage());
        }

        @Test
        @DisplayName("Columns the backend cannot type keep their declared type")
        void testUntypedBackendColumn() {
            QueryResolver<String, String, String> resolver = new QueryResolver<>(RenderingBackend.users(),
                    OperatorAliases.defaults(), TypeConstraints.builder().string("created").build());

            assertEquals(ColumnType.STRING, resolver.typeOf("created"));
        }

        @Test
        @DisplayName("Custom operators cannot reuse a logical alias")
        void testCustomOperatorAliasCollision() {
            OperatorAliases aliases = OperatorAliases.builder().and("and").or("or").not("not", "~").build();
            CustomOperatorRegistry<String, String> operators = CustomOperatorRegistry.<String, String>builder()
                    .register(new CustomOperatorProvider<>() {
                        @Override
                        public Set<String> supportedOperators() {
                            return Set.of("~");
                        }

                        @Override
                        public Set<ColumnType> supportedTypes() {
                            return Set.of(ColumnType.STRING);
                        }

                        @Override
                        public String toPredicate(FilterBackend<String, String, ?> backend, ColumnSpec<String> column,
                                                  String operator, Object value) {
                            return column.name() + " ~ " + value;
                        }
                    })
                    .build();

            assertThrows(IllegalConstraintException.class, () -> new QueryResolver<>(
                    RenderingBackend.users(), aliases, TYPES, QueryLimits.defaults(), operators));
        }
    }

    @Nested
    @DisplayName("Accessors")
    class AccessorTests {

        private final QueryResolver<String, String, String> resolver =
                new QueryResolver<>(RenderingBackend.users(), OperatorAliases.defaults(), TYPES, QueryLimits.strict());

        @Test
        @DisplayName("Exposes aliases, types, nullability and limits")
        void testAccessors() {
            assertEquals(Set.of("and"), resolver.aliasesFor(LogicalRole.AND));
            assertEquals(Optional.of(LogicalRole.NOT), resolver.roleOf("not"));
            assertTrue(resolver.roleOf("xor").isEmpty());
            assertEquals(ColumnType.STRING, resolver.typeOf("name"));
            assertEquals(ColumnType.NUMERIC, resolver.typeOf("age"));
            assertEquals(ColumnType.UNKNOWN, resolver.typeOf("nickname"));
            assertTrue(resolver.isNullable("email"));
            assertFalse(resolver.isNullable("age"));
            assertEquals(16, resolver.limits().maxBreadth());
            assertEquals(8, resolver.limits().maxDepth());
            assertEquals(32, resolver.limits().maxElements());
        }

        @Test
        @DisplayName("Declared columns are resolved once with their handle")
        void testColumns() {
            ColumnSpec<String> email = resolver.columns().get("email");

            assertEquals(new ColumnSpec<>("email", "email", ColumnType.STRING, true), email);
            assertEquals(3, resolver.columns().size());
            assertThrows(UnsupportedOperationException.class, () -> resolver.columns().remove("email"));
        }
    }

    @Nested
    @DisplayName("Schema fallback")
    class SchemaFallbackTests {

        @Test
        @DisplayName("Disabled: undeclared columns are unknown")
        void testDisabled() {
            QueryResolver<String, String, String> resolver =
                    new QueryResolver<>(RenderingBackend.users(), OperatorAliases.defaults(), TYPES);

            assertTrue(resolver.findColumn("nickname").isEmpty());
        }

        @Test
        @DisplayName("Enabled: undeclared columns are typed by the backend and never nullable")
        void testEnabled() {
            TypeConstraints types = TypeConstraints.builder().string("name").schemaFallback(true).build();
            QueryResolver<String, String, String> resolver =
                    new QueryResolver<>(RenderingBackend.users(), OperatorAliases.defaults(), types);

            assertEquals(new ColumnSpec<>("nickname", "nickname", ColumnType.STRING, false),
                    resolver.findColumn("nickname").orElseThrow());
            assertEquals(ColumnType.NUMERIC, resolver.typeOf("height"));
            assertTrue(resolver.findColumn("created").isEmpty());
            assertTrue(resolver.findColumn("missing").isEmpty());
        }
    }
}
