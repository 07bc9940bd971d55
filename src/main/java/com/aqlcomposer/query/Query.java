package com.aqlcomposer.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of one AQL scope plus, optionally, the chain of joined scopes
 * nested inside it.
 *
 * Every builder call returns a new descriptor, so a base query can be extended in
 * several directions without the branches affecting each other:
 * <pre>
 * Query users = Query.collection("User");
 * Query adults = users.filter(Filter.of(Comparison.field("age").greaterOrEqual(18)));
 * Query friends = users.joinOutbound(1, 1, false, Query.collection("friendOf"));
 * </pre>
 */
public class Query {

    private final QuerySource source;
    private final Filter filter;
    private final Filter prune;
    private final List<SortField> sorts;
    private final Limit limit;
    private final boolean distinct;
    private final Join join;

    private Query(QuerySource source, Filter filter, Filter prune, List<SortField> sorts,
                  Limit limit, boolean distinct, Join join) {
        this.source = source;
        this.filter = filter;
        this.prune = prune;
        this.sorts = Collections.unmodifiableList(sorts);
        this.limit = limit;
        this.distinct = distinct;
        this.join = join;
    }

    private Query(QuerySource source) {
        this(Objects.requireNonNull(source, "Source cannot be null"),
                null, null, new ArrayList<>(), null, false, null);
    }

    /**
     * Scope over every document of {@code collection}
     */
    public static Query collection(String collection) {
        return new Query(new CollectionSource(collection));
    }

    /**
     * Scope over the collection a record type is stored in, named by {@link AqlCollection}
     * or, when absent, the type's simple name
     */
    public static Query forRecord(Class<?> recordType) {
        Objects.requireNonNull(recordType, "Record type cannot be null");
        AqlCollection annotation = recordType.getAnnotation(AqlCollection.class);
        return collection(annotation != null ? annotation.value() : recordType.getSimpleName());
    }

    public static Query outbound(int min, int max, String edgeCollection, String startVertex) {
        return traversal(TraversalDirection.OUTBOUND, min, max, edgeCollection, false, startVertex);
    }

    public static Query inbound(int min, int max, String edgeCollection, String startVertex) {
        return traversal(TraversalDirection.INBOUND, min, max, edgeCollection, false, startVertex);
    }

    public static Query any(int min, int max, String edgeCollection, String startVertex) {
        return traversal(TraversalDirection.ANY, min, max, edgeCollection, false, startVertex);
    }

    public static Query outboundGraph(int min, int max, String graph, String startVertex) {
        return traversal(TraversalDirection.OUTBOUND, min, max, graph, true, startVertex);
    }

    public static Query inboundGraph(int min, int max, String graph, String startVertex) {
        return traversal(TraversalDirection.INBOUND, min, max, graph, true, startVertex);
    }

    public static Query anyGraph(int min, int max, String graph, String startVertex) {
        return traversal(TraversalDirection.ANY, min, max, graph, true, startVertex);
    }

    private static Query traversal(TraversalDirection direction, int min, int max, String name,
                                   boolean namedGraph, String startVertex) {
        return new Query(new TraversalSource(direction, DepthRange.of(min, max), name, namedGraph, startVertex));
    }

    /**
     * Replace the FILTER of this scope
     *
     * @throws AqlCompilationException MALFORMED_FILTER if {@code filter} has no terms
     */
    public Query filter(FilterTerm filter) {
        return new Query(source, requireFilter(filter), prune, copySorts(), limit, distinct, join);
    }

    /**
     * Replace the PRUNE condition of this scope. Only traversal scopes may carry one;
     * a prune on a root collection scope is rejected when compiled.
     */
    public Query prune(FilterTerm prune) {
        return new Query(source, filter, requireFilter(prune), copySorts(), limit, distinct, join);
    }

    public Query sort(String field) {
        return sort(field, SortDirection.ASC);
    }

    /**
     * Append a sort key, earlier keys take precedence
     */
    public Query sort(String field, SortDirection direction) {
        List<SortField> copy = copySorts();
        copy.add(new SortField(field, direction));
        return new Query(source, filter, prune, copy, limit, distinct, join);
    }

    public Query limit(int count) {
        return limit(count, null);
    }

    /**
     * Replace the LIMIT of this scope
     *
     * @param skip documents to skip before counting, or null for none
     */
    public Query limit(int count, Integer skip) {
        return new Query(source, filter, prune, copySorts(), new Limit(count, skip), distinct, join);
    }

    public Query distinct() {
        return new Query(source, filter, prune, copySorts(), limit, true, join);
    }

    /**
     * Nest {@code query} as an outbound traversal from this scope's variable. The joined
     * query's collection names the edge collection, or the graph when {@code namedGraph}
     * is set. Replaces any previous join.
     */
    public Query joinOutbound(int min, int max, boolean namedGraph, Query query) {
        return join(TraversalDirection.OUTBOUND, min, max, namedGraph, query);
    }

    public Query joinInbound(int min, int max, boolean namedGraph, Query query) {
        return join(TraversalDirection.INBOUND, min, max, namedGraph, query);
    }

    public Query joinAny(int min, int max, boolean namedGraph, Query query) {
        return join(TraversalDirection.ANY, min, max, namedGraph, query);
    }

    private Query join(TraversalDirection direction, int min, int max, boolean namedGraph, Query query) {
        Join newJoin = new Join(direction, DepthRange.of(min, max), namedGraph, query);
        return new Query(source, filter, prune, copySorts(), limit, distinct, newJoin);
    }

    private List<SortField> copySorts() {
        return new ArrayList<>(sorts);
    }

    private static Filter requireFilter(FilterTerm term) {
        Filter f = Objects.requireNonNull(term, "Filter cannot be null").toFilter();
        if (f.isEmpty()) {
            throw new AqlCompilationException("Filter must contain at least one term",
                    CompilationErrorType.MALFORMED_FILTER);
        }
        return f;
    }

    public QuerySource getSource() {
        return source;
    }

    /**
     * FILTER of this scope, null when not set
     */
    public Filter getFilter() {
        return filter;
    }

    /**
     * PRUNE of this scope, null when not set
     */
    public Filter getPrune() {
        return prune;
    }

    public List<SortField> getSorts() {
        return sorts;
    }

    /**
     * LIMIT of this scope, null when not set
     */
    public Limit getLimit() {
        return limit;
    }

    public boolean isDistinct() {
        return distinct;
    }

    /**
     * Joined child scope, null for the deepest scope
     */
    public Join getJoin() {
        return join;
    }

    /**
     * Compile with a default {@link AqlCompiler}
     */
    public String toAql() {
        return new AqlCompiler().compile(this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Query{").append(source);
        if (filter != null) sb.append(", filter=").append(filter);
        if (prune != null) sb.append(", prune=").append(prune);
        if (!sorts.isEmpty()) sb.append(", sorts=").append(sorts);
        if (limit != null) sb.append(", ").append(limit);
        if (distinct) sb.append(", distinct");
        if (join != null) sb.append(", join=").append(join.getDirection()).append(' ').append(join.getQuery());
        return sb.append('}').toString();
    }
}
