package io.github.cyfko.jsonquery.core.compiler;

import io.github.cyfko.jsonquery.core.QueryResolver;
import io.github.cyfko.jsonquery.core.api.CaseMode;
import io.github.cyfko.jsonquery.core.api.ColumnType;
import io.github.cyfko.jsonquery.core.api.NumericOperator;
import io.github.cyfko.jsonquery.core.config.OperatorAliases;
import io.github.cyfko.jsonquery.core.config.QueryLimits;
import io.github.cyfko.jsonquery.core.config.TypeConstraints;
import io.github.cyfko.jsonquery.core.exception.FilterCompilationException;
import io.github.cyfko.jsonquery.core.exception.MaximumElementsException;
import io.github.cyfko.jsonquery.core.exception.UnknownOperatorException;
import io.github.cyfko.jsonquery.core.spi.FilterBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.Optional;

import static io.github.cyfko.jsonquery.core.support.JsonFixtures.json;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Verifies which backend calls a compilation makes, and in which order.
 */
@DisplayName("FilterCompiler Backend Interaction Tests")
class FilterCompilerBackendInteractionTest {

    @Mock
    private FilterBackend<String, String, String> backend;

    private QueryResolver<String, String, String> resolver;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);

        when(backend.resolveColumn(anyString())).thenAnswer(invocation -> Optional.of(invocation.getArgument(0)));
        when(backend.columnType("name")).thenReturn(ColumnType.STRING);
        when(backend.columnType("age")).thenReturn(ColumnType.NUMERIC);
        when(backend.wildcard()).thenReturn('*');
        when(backend.compare(anyString(), any(NumericOperator.class), any(Number.class)))
                .thenAnswer(invocation -> invocation.getArgument(0) + "#" + invocation.getArgument(2));
        when(backend.stringMatch(anyString(), any(CaseMode.class), anyString()))
                .thenAnswer(invocation -> invocation.getArgument(0) + "~" + invocation.getArgument(2));
        when(backend.and(any())).thenReturn("AND");
        when(backend.or(any())).thenReturn("OR");
        when(backend.not(any())).thenReturn("NOT");
        when(backend.applyFilter(any())).thenReturn("RESULT");

        resolver = new QueryResolver<>(backend, OperatorAliases.defaults(),
                TypeConstraints.builder().string("name").numeric("age").build(), QueryLimits.defaults());
    }

    @Test
    @DisplayName("Declared columns are resolved and type-checked once, at construction")
    void testColumnsResolvedAtConstruction() {
        FilterCompiler.compile(resolver, json("{'operator': 'and', 'value': ["
                + "{'column': 'age', 'operator': '>', 'value': 1},"
                + "{'column': 'age', 'operator': '<', 'value': 9}]}"));

        verify(backend, times(1)).resolveColumn("name");
        verify(backend, times(1)).resolveColumn("age");
        verify(backend, times(1)).columnType("name");
        verify(backend, times(1)).columnType("age");
    }

    @Test
    @DisplayName("Children are built left to right and combined in one call")
    void testChildOrder() {
        String predicate = FilterCompiler.compile(resolver, json("{'operator': 'or', 'value': ["
                + "{'column': 'age', 'operator': '>', 'value': 1},"
                + "{'column': 'name', 'operator': 'match-suffix', 'value': 'son', 'case': 'strict'},"
                + "{'column': 'age', 'operator': '==', 'value': 3}]}")).predicate();

        assertEquals("OR", predicate);
        InOrder inOrder = inOrder(backend);
        inOrder.verify(backend).compare("age", NumericOperator.GT, 1);
        inOrder.verify(backend).stringMatch("name", CaseMode.STRICT, "*son");
        inOrder.verify(backend).compare("age", NumericOperator.EQ, 3);
        inOrder.verify(backend).or(List.of("age#1", "name~*son", "age#3"));
        verify(backend, never()).and(any());
    }

    @Test
    @DisplayName("apply calls applyFilter exactly once with the root predicate")
    void testApply() {
        String result = FilterCompiler.apply(resolver,
                json("{'operator': 'not', 'value': {'column': 'age', 'operator': '>=', 'value': 4}}"));

        assertEquals("RESULT", result);
        verify(backend).not("age#4");
        verify(backend, times(1)).applyFilter("NOT");
    }

    @Test
    @DisplayName("A rejected tree never reaches applyFilter")
    void testRejectedTree() {
        assertThrows(UnknownOperatorException.class, () -> FilterCompiler.apply(resolver,
                json("{'operator': 'and', 'value': [{'column': 'age', 'operator': '>', 'value': 1},"
                        + "{'column': 'age', 'operator': 'between', 'value': 2}]}")));

        verify(backend, never()).and(any());
        verify(backend, never()).applyFilter(any());
    }

    @Test
    @DisplayName("An oversized tree is rejected before any predicate is built")
    void testLimitBeforePredicates() {
        QueryResolver<String, String, String> strict = new QueryResolver<>(backend, OperatorAliases.defaults(),
                TypeConstraints.builder().numeric("age").build(), QueryLimits.builder().maxElements(2).build());

        FilterCompilationException e = assertThrows(MaximumElementsException.class, () -> FilterCompiler.apply(strict,
                json("{'operator': 'and', 'value': [{'column': 'age', 'operator': '>', 'value': 1},"
                        + "{'column': 'age', 'operator': '<', 'value': 5}]}")));

        assertEquals("Filter elements limit (2) exceeded", e.getMessage());
        verify(backend, never()).compare(anyString(), any(), any());
        verify(backend, never()).applyFilter(any());
    }

    @Test
    @DisplayName("Schema fallback asks the backend for the column type")
    void testSchemaFallbackTyping() {
        when(backend.columnType("score")).thenReturn(ColumnType.NUMERIC);
        QueryResolver<String, String, String> fallback = new QueryResolver<>(backend, OperatorAliases.defaults(),
                TypeConstraints.builder().schemaFallback(true).build());

        String predicate = FilterCompiler.compile(fallback,
                json("{'column': 'score', 'operator': '<=', 'value': 10}")).predicate();

        assertEquals("score#10", predicate);
        verify(backend).columnType("score");
    }
}
