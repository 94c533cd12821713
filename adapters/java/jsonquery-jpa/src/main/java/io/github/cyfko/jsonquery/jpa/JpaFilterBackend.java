package io.github.cyfko.jsonquery.jpa;

import io.github.cyfko.jsonquery.core.api.CaseMode;
import io.github.cyfko.jsonquery.core.api.ColumnType;
import io.github.cyfko.jsonquery.core.api.NumericOperator;
import io.github.cyfko.jsonquery.core.exception.FilterValidationException;
import io.github.cyfko.jsonquery.core.exception.IllegalConstraintException;
import io.github.cyfko.jsonquery.core.spi.FilterBackend;
import io.github.cyfko.jsonquery.jpa.utils.NumberConversionUtils;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.metamodel.Attribute;
import jakarta.persistence.metamodel.EntityType;
import jakarta.persistence.metamodel.SingularAttribute;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;
import java.util.logging.Logger;

/**
 * {@link FilterBackend} building Jakarta Persistence Criteria queries over one entity.
 * <p>
 * Columns are the basic, single-valued attributes of the entity as exposed by the JPA
 * metamodel. Predicates are {@link PredicateResolver deferred}: nothing touches a
 * {@link CriteriaQuery} until {@link #applyFilter(PredicateResolver)} builds
 * {@code select e from E e where <predicate>}.
 * </p>
 *
 * <h2>Type Mapping</h2>
 * <ul>
 *   <li>{@link String} attributes: {@link ColumnType#STRING}</li>
 *   <li>Numeric attributes (primitive or wrapper, {@link java.math.BigInteger}, {@link BigDecimal}): {@link ColumnType#NUMERIC}</li>
 *   <li>Anything else (dates, enums, booleans, associations, embeddables): {@link ColumnType#UNKNOWN}</li>
 * </ul>
 *
 * <h2>Numeric Comparisons</h2>
 * <p>
 * Values are converted to the attribute's Java type before binding. A fractional value compared
 * with an integral attribute is rewritten on the floor of the value ({@code age < 17.5} becomes
 * {@code age <= 17}); equality with it never matches and inequality matches every non-null
 * value. A value outside the attribute type's range is rejected with
 * {@link FilterValidationException}.
 * </p>
 *
 * <h2>String Matches</h2>
 * <p>
 * Patterns are bound to {@code LIKE} with {@value #ESCAPE} as escape character. Case-insensitive
 * matches lower-case both the attribute and the pattern.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * JpaFilterBackend<User> backend = new JpaFilterBackend<>(em, User.class);
 * QueryResolver<JpaColumn, PredicateResolver<User>, TypedQuery<User>> resolver =
 *     new QueryResolver<>(backend, OperatorAliases.defaults(), types);
 *
 * List<User> users = FilterCompiler.apply(resolver, filter).getResultList();
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Predicate factories are stateless. {@link #applyFilter(PredicateResolver)} uses the
 * {@link EntityManager} given at construction and shares its thread confinement.
 * </p>
 *
 * @param <E> the entity type
 * @since 1.0.0
 */
public class JpaFilterBackend<E> implements FilterBackend<JpaColumn, PredicateResolver<E>, TypedQuery<E>> {

    private static final Logger logger = Logger.getLogger(JpaFilterBackend.class.getName());

    /** Escape character of {@code LIKE} patterns. */
    public static final char ESCAPE = '/';

    private final EntityManager em;
    private final Class<E> entityClass;
    private final Map<String, JpaColumn> columns;

    /**
     * Creates a backend for an entity.
     *
     * @param em          the entity manager used to create queries
     * @param entityClass the entity filtered by this backend
     * @throws IllegalConstraintException if an argument is null or {@code entityClass} is not a managed entity
     */
    public JpaFilterBackend(EntityManager em, Class<E> entityClass) {
        if (em == null) {
            throw new IllegalConstraintException("EntityManager cannot be null");
        }
        if (entityClass == null) {
            throw new IllegalConstraintException("Entity class cannot be null");
        }

        EntityType<E> entityType;
        try {
            entityType = em.getMetamodel().entity(entityClass);
        } catch (IllegalArgumentException e) {
            throw new IllegalConstraintException(entityClass.getName() + " is not a managed entity", e);
        }

        Map<String, JpaColumn> basics = new LinkedHashMap<>();
        for (SingularAttribute<? super E, ?> attribute : entityType.getSingularAttributes()) {
            if (attribute.getPersistentAttributeType() == Attribute.PersistentAttributeType.BASIC) {
                basics.put(attribute.getName(),
                        new JpaColumn(attribute.getName(), NumberConversionUtils.wrap(attribute.getJavaType())));
            }
        }

        this.em = em;
        this.entityClass = entityClass;
        this.columns = Collections.unmodifiableMap(basics);

        logger.fine(() -> String.format("JPA filter backend for %s: basic attributes %s",
                entityClass.getSimpleName(), columns.keySet()));
    }

    @Override
    public Optional<JpaColumn> resolveColumn(String name) {
        return Optional.ofNullable(columns.get(name));
    }

    @Override
    public ColumnType columnType(JpaColumn column) {
        if (column.javaType() == String.class) {
            return ColumnType.STRING;
        }
        if (NumberConversionUtils.isNumeric(column.javaType())) {
            return ColumnType.NUMERIC;
        }
        return ColumnType.UNKNOWN;
    }

    @Override
    public PredicateResolver<E> compare(JpaColumn column, NumericOperator op, Number value) {
        String name = column.name();
        BigDecimal decimal;
        try {
            decimal = NumberConversionUtils.toBigDecimal(value);
        } catch (IllegalArgumentException e) {
            throw new FilterValidationException("Column '" + name + "' cannot be compared to " + value, e);
        }

        NumericOperator effective = op;
        if (NumberConversionUtils.isIntegral(column.javaType()) && decimal.stripTrailingZeros().scale() > 0) {
            switch (op) {
                case EQ -> {
                    return (root, query, cb) -> cb.disjunction();
                }
                case NE -> {
                    return (root, query, cb) -> cb.isNotNull(root.get(name));
                }
                case LT, LTE -> effective = NumericOperator.LTE;
                case GT, GTE -> effective = NumericOperator.GT;
            }
            decimal = decimal.setScale(0, RoundingMode.FLOOR);
        }

        Number bound;
        try {
            bound = NumberConversionUtils.convert(decimal, column.javaType());
        } catch (ArithmeticException e) {
            throw new FilterValidationException(String.format("Value %s is out of range for column '%s' of type %s",
                    value, name, column.javaType().getSimpleName()), e);
        }

        NumericOperator operator = effective;
        return (root, query, cb) -> {
            Path<Number> path = root.get(name);
            return switch (operator) {
                case LT -> cb.lt(path, bound);
                case LTE -> cb.le(path, bound);
                case EQ -> cb.equal(path, bound);
                case NE -> cb.notEqual(path, bound);
                case GTE -> cb.ge(path, bound);
                case GT -> cb.gt(path, bound);
            };
        };
    }

    @Override
    public PredicateResolver<E> stringMatch(JpaColumn column, CaseMode caseMode, String pattern) {
        String name = column.name();
        return switch (caseMode) {
            case STRICT -> (root, query, cb) -> cb.like(root.get(name), pattern, ESCAPE);
            case IGNORE -> {
                String lowered = pattern.toLowerCase(Locale.ROOT);
                yield (root, query, cb) -> cb.like(cb.lower(root.get(name)), lowered, ESCAPE);
            }
        };
    }

    @Override
    public PredicateResolver<E> isNull(JpaColumn column) {
        String name = column.name();
        return (root, query, cb) -> cb.isNull(root.get(name));
    }

    @Override
    public PredicateResolver<E> and(List<PredicateResolver<E>> predicates) {
        return new Junction<>(Connective.AND, List.copyOf(predicates));
    }

    @Override
    public PredicateResolver<E> or(List<PredicateResolver<E>> predicates) {
        return new Junction<>(Connective.OR, List.copyOf(predicates));
    }

    @Override
    public PredicateResolver<E> not(PredicateResolver<E> predicate) {
        return new Junction<>(Connective.NOT, List.of(predicate));
    }

    /**
     * Creates {@code select e from E e where <predicate>}.
     *
     * @param predicate the compiled filter
     * @return the query, ready for paging and execution
     */
    @Override
    public TypedQuery<E> applyFilter(PredicateResolver<E> predicate) {
        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<E> query = cb.createQuery(entityClass);
        Root<E> root = query.from(entityClass);
        query.select(root).where(predicate.resolve(root, query, cb));
        return em.createQuery(query);
    }

    public Class<E> getEntityClass() {
        return entityClass;
    }

    private enum Connective { AND, OR, NOT }

    /**
     * Logical combination of predicates. Nested junctions are resolved with an explicit stack,
     * so the nesting depth of a compiled filter is not limited by the thread stack.
     */
    private static final class Junction<E> implements PredicateResolver<E> {

        private final Connective connective;
        private final List<PredicateResolver<E>> children;

        private Junction(Connective connective, List<PredicateResolver<E>> children) {
            this.connective = connective;
            this.children = children;
        }

        @Override
        public Predicate resolve(Root<E> root, CriteriaQuery<?> query, CriteriaBuilder cb) {
            Deque<Step<E>> stack = new ArrayDeque<>();
            stack.push(new Step<>(this));

            while (true) {
                Step<E> step = stack.peek();
                if (step.next < step.junction.children.size()) {
                    PredicateResolver<E> child = step.junction.children.get(step.next);
                    if (child instanceof Junction<E> nested) {
                        stack.push(new Step<>(nested));
                    } else {
                        step.resolved[step.next++] = child.resolve(root, query, cb);
                    }
                    continue;
                }

                stack.pop();
                Predicate combined = step.junction.combine(step.resolved, cb);
                if (stack.isEmpty()) {
                    return combined;
                }
                Step<E> parent = stack.peek();
                parent.resolved[parent.next++] = combined;
            }
        }

        private Predicate combine(Predicate[] predicates, CriteriaBuilder cb) {
            return switch (connective) {
                case AND -> cb.and(predicates);
                case OR -> cb.or(predicates);
                case NOT -> cb.not(predicates[0]);
            };
        }
    }

    private static final class Step<E> {
        private final Junction<E> junction;
        private final Predicate[] resolved;
        private int next;

        private Step(Junction<E> junction) {
            this.junction = junction;
            this.resolved = new Predicate[junction.children.size()];
        }
    }
}
