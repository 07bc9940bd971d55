package com.aqlcomposer.query;

import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compiles query descriptors into AQL statements.
 *
 * Each scope of the join chain gets its own loop variable from {@link ScopeVariables}
 * and is rendered in a fixed clause order, independent of builder call order:
 * <pre>
 * FOR a IN ... PRUNE ... FILTER ...
 *   FOR b IN min..max DIR a edges PRUNE ... FILTER ...
 *   SORT b... LIMIT ...
 * SORT a... LIMIT ...
 * RETURN [DISTINCT] b
 * </pre>
 * All operand values are rendered by {@link AqlLiteralSerializer}; collection, graph and
 * field names are emitted as given.
 *
 * The compiler keeps no per-call state and can be shared between threads.
 */
@Component
public class AqlCompiler {

    private static final Logger logger = LoggerFactory.getLogger(AqlCompiler.class);

    @Value("${aqlcomposer.compiler.max-traversal-depth:65535}")
    int maxTraversalDepth = DepthRange.MAX_DEPTH;

    @Value("${aqlcomposer.compiler.log-queries:false}")
    boolean logQueries;

    @Autowired
    AqlLiteralSerializer serializer = new AqlLiteralSerializer();

    @Autowired(required = false)
    CompilerMetrics metrics;

    /**
     * Compile the descriptor and its join chain into a single statement
     *
     * @throws AqlCompilationException if the descriptor cannot be rendered
     */
    public String compile(Query query) {
        Objects.requireNonNull(query, "Query cannot be null");
        Timer.Sample sample = metrics != null ? metrics.startCompileTimer() : null;

        try {
            List<Query> chain = flatten(query);
            StringBuilder aql = new StringBuilder();

            for (int depth = 0; depth < chain.size(); depth++) {
                String variable = ScopeVariables.forDepth(depth);
                try {
                    Join join = depth == 0 ? null : chain.get(depth - 1).getJoin();
                    appendScopeHead(aql, chain.get(depth), join, depth, variable);
                } catch (AqlCompilationException e) {
                    throw withScope(e, variable);
                }
            }

            // Inner scopes close first
            for (int depth = chain.size() - 1; depth >= 0; depth--) {
                appendScopeTail(aql, chain.get(depth), ScopeVariables.forDepth(depth));
            }

            aql.append(" RETURN ");
            if (chain.stream().anyMatch(Query::isDistinct)) {
                aql.append("DISTINCT ");
            }
            aql.append(ScopeVariables.forDepth(chain.size() - 1));

            String result = aql.toString();
            if (logQueries) {
                logger.info("Compiled AQL ({} scopes): {}", chain.size(), result);
            } else {
                logger.debug("Compiled AQL ({} scopes): {}", chain.size(), result);
            }
            if (metrics != null) {
                metrics.recordCompiled(chain.size(), result.length());
            }
            return result;

        } catch (AqlCompilationException e) {
            logger.warn("Rejected query descriptor {}: {}", query, e.getMessage());
            if (metrics != null) {
                metrics.recordRejected();
            }
            throw e;
        } finally {
            if (sample != null) {
                metrics.recordCompileLatency(sample);
            }
        }
    }

    /**
     * Render a filter as it would appear after FILTER, qualified with {@code variable}
     *
     * @throws AqlCompilationException MALFORMED_FILTER if the filter, or a nested filter, is empty
     */
    public String compileFilter(FilterTerm filter, String variable) {
        Objects.requireNonNull(filter, "Filter cannot be null");
        Objects.requireNonNull(variable, "Variable cannot be null");
        Filter f = filter.toFilter();
        if (f.isEmpty()) {
            throw new AqlCompilationException("Filter must contain at least one term",
                    CompilationErrorType.MALFORMED_FILTER);
        }

        StringBuilder sb = new StringBuilder();
        for (Filter.Entry entry : f.getEntries()) {
            if (entry.getOperator() != null) {
                sb.append(' ').append(entry.getOperator().getAql()).append(' ');
            }
            if (entry.getTerm() instanceof Comparison) {
                sb.append(compileComparison((Comparison) entry.getTerm(), variable));
            } else {
                sb.append('(').append(compileFilter(entry.getTerm(), variable)).append(')');
            }
        }
        return sb.toString();
    }

    /**
     * Render a single comparison qualified with {@code variable}
     *
     * @throws AqlCompilationException UNSUPPORTED_OPERAND if the operand has no literal form
     */
    public String compileComparison(Comparison comparison, String variable) {
        Objects.requireNonNull(comparison, "Comparison cannot be null");
        Objects.requireNonNull(variable, "Variable cannot be null");

        StringBuilder sb = new StringBuilder();
        ComparisonSubject subject = comparison.getSubject();
        if (subject.isField()) {
            sb.append(variable).append('.');
        }
        sb.append(subject.getName());
        if (subject.getQuantifier() != null) {
            sb.append(' ').append(subject.getQuantifier());
        }

        ComparisonOperator operator = comparison.getOperator();
        sb.append(' ').append(operator.getAql()).append(' ');
        if (operator.isUnary()) {
            sb.append(operator.getFixedOperand());
        } else if (comparison.getOperand().isFieldReference()) {
            sb.append(variable).append('.').append(comparison.getOperand().getFieldReference().getField());
        } else {
            sb.append(serializer.serialize(comparison.getOperand().getValue()));
        }
        return sb.toString();
    }

    public int getMaxTraversalDepth() {
        return maxTraversalDepth;
    }

    public boolean isLogQueries() {
        return logQueries;
    }

    private List<Query> flatten(Query root) {
        List<Query> chain = new ArrayList<>();
        Query current = root;
        while (current != null) {
            chain.add(current);
            current = current.getJoin() != null ? current.getJoin().getQuery() : null;
        }
        return chain;
    }

    /**
     * FOR, PRUNE and FILTER of one scope
     */
    private void appendScopeHead(StringBuilder aql, Query scope, Join join, int depth, String variable) {
        if (depth > 0) {
            aql.append(' ');
        }
        aql.append("FOR ").append(variable).append(" IN ");

        QuerySource source = scope.getSource();
        if (join != null) {
            appendTraversal(aql, join.getDepth(), join.getDirection(), ScopeVariables.forDepth(depth - 1),
                    join.isNamedGraph(), source.getName());
        } else if (source.isTraversal()) {
            TraversalSource traversal = (TraversalSource) source;
            appendTraversal(aql, traversal.getDepth(), traversal.getDirection(),
                    serializer.serialize(traversal.getStartVertex()), traversal.isNamedGraph(), traversal.getName());
        } else {
            aql.append(source.getName());
        }

        if (scope.getPrune() != null) {
            if (join == null && !source.isTraversal()) {
                throw new AqlCompilationException("PRUNE requires a traversal, " + source + " is a collection scan",
                        CompilationErrorType.INVALID_PRUNE, variable);
            }
            aql.append(" PRUNE ").append(compileFilter(scope.getPrune(), variable));
        }
        if (scope.getFilter() != null) {
            aql.append(" FILTER ").append(compileFilter(scope.getFilter(), variable));
        }
    }

    private void appendTraversal(StringBuilder aql, DepthRange depth, TraversalDirection direction,
                                 String start, boolean namedGraph, String edgesOrGraph) {
        if (depth.getMax() > maxTraversalDepth) {
            throw new AqlCompilationException("Traversal depth " + depth + " exceeds configured maximum of "
                    + maxTraversalDepth, CompilationErrorType.INVALID_TRAVERSAL_DEPTH);
        }
        aql.append(depth.getMin()).append("..").append(depth.getMax())
                .append(' ').append(direction)
                .append(' ').append(start)
                .append(' ');
        if (namedGraph) {
            aql.append("GRAPH ");
        }
        aql.append(edgesOrGraph);
    }

    /**
     * SORT and LIMIT of one scope
     */
    private void appendScopeTail(StringBuilder aql, Query scope, String variable) {
        if (!scope.getSorts().isEmpty()) {
            aql.append(" SORT ");
            for (int i = 0; i < scope.getSorts().size(); i++) {
                if (i > 0) aql.append(", ");
                SortField sort = scope.getSorts().get(i);
                aql.append(variable).append('.').append(sort.getField()).append(' ').append(sort.getDirection());
            }
        }
        Limit limit = scope.getLimit();
        if (limit != null) {
            aql.append(" LIMIT ");
            if (limit.getSkip() != null) {
                aql.append(limit.getSkip()).append(", ");
            }
            aql.append(limit.getCount());
        }
    }

    private static AqlCompilationException withScope(AqlCompilationException e, String variable) {
        if (e.getScope() != null) {
            return e;
        }
        return new AqlCompilationException(e.getReason(), e.getErrorType(), variable, e);
    }
}
