package io.github.cyfko.jsonquery.jpa;

import io.github.cyfko.jsonquery.core.api.ColumnSpec;
import io.github.cyfko.jsonquery.core.api.ColumnType;
import io.github.cyfko.jsonquery.core.api.NumericOperator;
import io.github.cyfko.jsonquery.core.config.OperatorAliases;
import io.github.cyfko.jsonquery.core.config.QueryLimits;
import io.github.cyfko.jsonquery.core.config.TypeConstraints;
import io.github.cyfko.jsonquery.core.exception.FilterValidationException;
import io.github.cyfko.jsonquery.core.exception.UnknownOperatorException;
import io.github.cyfko.jsonquery.core.spi.CustomOperatorProvider;
import io.github.cyfko.jsonquery.core.spi.CustomOperatorRegistry;
import io.github.cyfko.jsonquery.core.spi.FilterBackend;
import io.github.cyfko.jsonquery.jpa.entities.User;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.Persistence;
import jakarta.persistence.criteria.Expression;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static io.github.cyfko.jsonquery.jpa.Filters.json;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Custom operators built from backend primitives and from native criteria expressions.
 */
@DisplayName("JPA Custom Operator Test")
class JpaCustomOperatorTest {

    private static final TypeConstraints TYPES = TypeConstraints.builder()
            .string("name", "email")
            .numeric("age", "height")
            .nullable("email")
            .build();

    private static EntityManagerFactory emf;

    private EntityManager em;
    private JsonQuery<User> users;

    /** Range of plus or minus five around the value, composed from backend comparisons. */
    private static final CustomOperatorProvider<JpaColumn, PredicateResolver<User>> AROUND =
            new CustomOperatorProvider<>() {
                @Override
                public Set<String> supportedOperators() {
                    return Set.of("~=");
                }

                @Override
                public Set<ColumnType> supportedTypes() {
                    return Set.of(ColumnType.NUMERIC);
                }

                @Override
                public PredicateResolver<User> toPredicate(FilterBackend<JpaColumn, PredicateResolver<User>, ?> backend,
                                                           ColumnSpec<JpaColumn> column, String operator, Object value) {
                    if (!(value instanceof Number number)) {
                        throw new FilterValidationException("Operator '~=' requires a number, got " + value);
                    }
                    return backend.and(List.of(
                            backend.compare(column.handle(), NumericOperator.GTE, number.intValue() - 5),
                            backend.compare(column.handle(), NumericOperator.LTE, number.intValue() + 5)));
                }
            };

    /** Divisibility check written directly against the criteria builder. */
    private static final CustomOperatorProvider<JpaColumn, PredicateResolver<User>> DIVISIBLE_BY =
            new CustomOperatorProvider<>() {
                @Override
                public Set<String> supportedOperators() {
                    return Set.of("divisible-by");
                }

                @Override
                public Set<ColumnType> supportedTypes() {
                    return Set.of(ColumnType.NUMERIC);
                }

                @Override
                public PredicateResolver<User> toPredicate(FilterBackend<JpaColumn, PredicateResolver<User>, ?> backend,
                                                           ColumnSpec<JpaColumn> column, String operator, Object value) {
                    if (!(value instanceof Integer divisor) || divisor == 0) {
                        throw new FilterValidationException("Operator 'divisible-by' requires a non-zero integer, got " + value);
                    }
                    String name = column.name();
                    return (root, query, cb) -> {
                        Expression<Integer> path = root.get(name);
                        return cb.equal(cb.mod(path, divisor), 0);
                    };
                }
            };

    /** Membership in a pipe-separated list of values. */
    private static final CustomOperatorProvider<JpaColumn, PredicateResolver<User>> ONE_OF =
            new CustomOperatorProvider<>() {
                @Override
                public Set<String> supportedOperators() {
                    return Set.of("one-of");
                }

                @Override
                public Set<ColumnType> supportedTypes() {
                    return Set.of(ColumnType.STRING);
                }

                @Override
                public PredicateResolver<User> toPredicate(FilterBackend<JpaColumn, PredicateResolver<User>, ?> backend,
                                                           ColumnSpec<JpaColumn> column, String operator, Object value) {
                    if (!(value instanceof String text)) {
                        throw new FilterValidationException("Operator 'one-of' requires a string, got " + value);
                    }
                    List<String> candidates = Arrays.asList(text.split("\\|"));
                    String name = column.name();
                    return (root, query, cb) -> root.get(name).in(candidates);
                }
            };

    /** Membership in a list of numbers. */
    private static final CustomOperatorProvider<JpaColumn, PredicateResolver<User>> IN =
            new CustomOperatorProvider<>() {
                @Override
                public Set<String> supportedOperators() {
                    return Set.of("in_");
                }

                @Override
                public Set<ColumnType> supportedTypes() {
                    return Set.of(ColumnType.NUMERIC);
                }

                @Override
                public PredicateResolver<User> toPredicate(FilterBackend<JpaColumn, PredicateResolver<User>, ?> backend,
                                                           ColumnSpec<JpaColumn> column, String operator, Object value) {
                    if (!(value instanceof List<?> candidates)) {
                        throw new FilterValidationException("Operator 'in_' requires a list, got " + value);
                    }
                    List<PredicateResolver<User>> alternatives = new ArrayList<>();
                    for (Object candidate : candidates) {
                        if (!(candidate instanceof Number number)) {
                            throw new FilterValidationException("Operator 'in_' requires numbers, got " + candidate);
                        }
                        alternatives.add(backend.compare(column.handle(), NumericOperator.EQ, number));
                    }
                    return backend.or(alternatives);
                }
            };

    @BeforeAll
    static void setup() {
        emf = Persistence.createEntityManagerFactory("testPU");
    }

    @AfterAll
    static void teardown() {
        if (emf != null) emf.close();
    }

    @BeforeEach
    void setUp() {
        em = emf.createEntityManager();
        em.getTransaction().begin();
        em.createQuery("delete from User").executeUpdate();
        em.persist(new User("alice", "alice@example.com", 20, 160));
        em.persist(new User("bob", null, 25, 175));
        em.persist(new User("carol", "carol@example.com", 30, 180));
        em.persist(new User("dave", null, 42, 190));
        em.getTransaction().commit();

        CustomOperatorRegistry<JpaColumn, PredicateResolver<User>> registry =
                CustomOperatorRegistry.<JpaColumn, PredicateResolver<User>>builder()
                        .register(AROUND)
                        .register(DIVISIBLE_BY)
                        .register(ONE_OF)
                        .register(IN)
                        .build();
        users = JsonQuery.of(em, User.class, OperatorAliases.defaults(), TYPES, QueryLimits.defaults(), registry);
    }

    @AfterEach
    void tearDown() {
        em.close();
    }

    private Set<String> names(String filter) {
        return users.query(json(filter)).getResultList().stream()
                .map(User::getName)
                .collect(Collectors.toSet());
    }

    @Test
    @DisplayName("Operators composed from backend comparisons")
    void testComposedOperator() {
        assertEquals(Set.of("alice", "bob"), names("{'column': 'age', 'operator': '~=', 'value': 22}"));
    }

    @Test
    @DisplayName("Operators written against the criteria builder")
    void testNativeOperator() {
        assertEquals(Set.of("alice", "carol", "dave"), names("{'column': 'age', 'operator': 'divisible-by', 'value': 2}"));
        assertEquals(Set.of("bob", "carol", "dave"), names("{'column': 'height', 'operator': 'divisible-by', 'value': 5}"));
    }

    @Test
    @DisplayName("String operators do not need a case mode")
    void testStringOperator() {
        assertEquals(Set.of("alice", "dave"), names("{'column': 'name', 'operator': 'one-of', 'value': 'alice|dave|erin'}"));
    }

    @Test
    @DisplayName("List values reach the operator")
    void testListOperator() {
        assertEquals(Set.of("carol", "dave"), names("{'column': 'age', 'operator': 'in_', 'value': [30, 42, 50]}"));
        assertEquals(Set.of(), names("{'column': 'age', 'operator': 'in_', 'value': []}"));
        assertThrows(FilterValidationException.class,
                () -> names("{'column': 'age', 'operator': 'in_', 'value': [30, 'forty']}"));
        assertThrows(FilterValidationException.class,
                () -> names("{'column': 'age', 'operator': '==', 'value': [30, 42]}"));
    }

    @Test
    @DisplayName("Custom and built-in comparisons combine in logical nodes")
    void testCombined() {
        String filter = "{'operator': 'and', 'value': ["
                + "{'column': 'age', 'operator': 'divisible-by', 'value': 2},"
                + "{'operator': 'not', 'value': {'column': 'email', 'operator': '==', 'value': null}},"
                + "{'column': 'name', 'operator': 'match-prefix', 'value': 'C', 'case': 'ignore'}]}";

        assertEquals(Set.of("carol"), names(filter));
    }

    @Test
    @DisplayName("Providers reject values they cannot handle")
    void testProviderValidation() {
        assertThrows(FilterValidationException.class,
                () -> names("{'column': 'age', 'operator': 'divisible-by', 'value': 0}"));
        assertThrows(FilterValidationException.class,
                () -> names("{'column': 'age', 'operator': '~=', 'value': 'twenty'}"));
    }

    @Test
    @DisplayName("Operators only apply to their supported column types")
    void testUnsupportedType() {
        assertThrows(UnknownOperatorException.class,
                () -> names("{'column': 'name', 'operator': 'divisible-by', 'value': 2}"));
        assertThrows(UnknownOperatorException.class,
                () -> names("{'column': 'age', 'operator': 'one-of', 'value': '20|25'}"));
    }
}
