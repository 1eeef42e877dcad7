package com.e2eq.twins.query;

import com.e2eq.twins.exceptions.TwinQueryCompileException;
import com.e2eq.twins.query.ast.Predicate;
import com.e2eq.twins.query.ast.TwinQuery;
import com.e2eq.twins.query.ast.ValueExpr;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders a {@link TwinQuery} tree as Cypher. One instance per query; it tracks the
 * aliases the source clause declares so property references can be checked and, when
 * no alias was given, rooted at the default one.
 */
class CypherQueryGenerator {
    static final String TWIN_LABEL = "Twin";
    static final String DEFAULT_TWIN_ALIAS = "T";
    static final String DEFAULT_RELATIONSHIP_ALIAS = "R";

    private final String graphNamespace;
    private final Set<String> declaredAliases = new LinkedHashSet<>();
    private final List<Predicate> edgeLabelConditions = new ArrayList<>();
    // alias property references are rooted at when the query names none
    private String defaultAlias;
    // alias IS_OF_MODEL applies to when called with the model id only
    private String primaryAlias;
    private boolean variableLength = false;

    CypherQueryGenerator(String graphNamespace) {
        this.graphNamespace = graphNamespace;
    }

    CompiledQuery generate(TwinQuery query) {
        String pattern = renderSource(query);

        StringBuilder cypher = new StringBuilder("MATCH ").append(pattern);
        String where = query.where() != null ? renderPredicate(query.where()) : null;
        if (!edgeLabelConditions.isEmpty()) {
            String labels = edgeLabelConditions.stream()
                    .map(this::renderPredicate)
                    .collect(Collectors.joining(" AND "));
            cypher.append(" WHERE ").append(labels);
            if (where != null) {
                cypher.append(" AND (").append(where).append(')');
            }
        } else if (where != null) {
            cypher.append(" WHERE ").append(where);
        }
        cypher.append(" RETURN ").append(renderProjection(query.projection()));
        if (query.top() != null) {
            cypher.append(" LIMIT ").append(query.top());
        }
        return new CompiledQuery(cypher.toString(), variableLength, query.top());
    }

    private String renderSource(TwinQuery query) {
        TwinQuery.From from = query.from();
        if (from.collection() == TwinQuery.Collection.RELATIONSHIPS) {
            if (!query.match().isEmpty() || !query.joins().isEmpty()) {
                throw new TwinQueryCompileException("MATCH and JOIN are only supported with FROM DIGITALTWINS", "FROM RELATIONSHIPS");
            }
            String alias = from.alias();
            if (alias == null) {
                alias = DEFAULT_RELATIONSHIP_ALIAS;
                defaultAlias = alias;
            }
            declaredAliases.add(alias);
            primaryAlias = alias;
            return "(:" + TWIN_LABEL + ")-[" + alias + "]->(:" + TWIN_LABEL + ")";
        }

        if (!query.match().isEmpty()) {
            if (from.alias() != null) {
                throw new TwinQueryCompileException("FROM DIGITALTWINS cannot declare an alias when MATCH is used", from.alias());
            }
            List<String> paths = new ArrayList<>();
            for (TwinQuery.PathPattern path : query.match()) {
                paths.add(renderPath(path));
            }
            return String.join(",", paths);
        }

        if (!query.joins().isEmpty()) {
            if (from.alias() == null) {
                throw new TwinQueryCompileException("JOIN requires an alias on FROM DIGITALTWINS", "FROM DIGITALTWINS");
            }
            declaredAliases.add(from.alias());
            primaryAlias = from.alias();
            List<String> clauses = new ArrayList<>();
            for (TwinQuery.Join join : query.joins()) {
                if (!declaredAliases.contains(join.sourceAlias())) {
                    throw new TwinQueryCompileException("JOIN refers to unknown alias '" + join.sourceAlias() + "'",
                            join.sourceAlias() + "." + join.relationshipName());
                }
                declaredAliases.add(join.targetAlias());
                String edgeAlias = join.edgeAlias() != null ? join.edgeAlias() : "";
                if (join.edgeAlias() != null) {
                    declaredAliases.add(join.edgeAlias());
                }
                clauses.add(node(join.sourceAlias()) + "-[" + edgeAlias + ":" + join.relationshipName() + "]->" + node(join.targetAlias()));
            }
            return String.join(",", clauses);
        }

        String alias = from.alias();
        if (alias == null) {
            alias = DEFAULT_TWIN_ALIAS;
            defaultAlias = alias;
        }
        declaredAliases.add(alias);
        primaryAlias = alias;
        return node(alias);
    }

    private String renderPath(TwinQuery.PathPattern path) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < path.nodes().size(); i++) {
            String alias = path.nodes().get(i).alias();
            if (alias != null) {
                declaredAliases.add(alias);
            }
            sb.append(node(alias));
            if (i < path.edges().size()) {
                sb.append(renderEdge(path.edges().get(i)));
            }
        }
        return sb.toString();
    }

    private String renderEdge(TwinQuery.EdgePattern edge) {
        String alias = edge.alias() != null ? edge.alias() : "";
        if (edge.alias() != null) {
            declaredAliases.add(edge.alias());
        }
        StringBuilder detail = new StringBuilder(alias);
        if (edge.isMultiLabel()) {
            // the engine has no a|b edge types, match untyped and filter on label()
            if (edge.alias() == null) {
                throw new TwinQueryCompileException("Edges with several relationship names need an alias",
                        String.join("|", edge.labels()));
            }
            if (edge.isVariableLength()) {
                throw new TwinQueryCompileException("Variable-length edges cannot have several relationship names",
                        edge.alias() + ":" + String.join("|", edge.labels()));
            }
            String disjunction = edge.labels().stream()
                    .map(label -> "label(" + edge.alias() + ") = '" + label + "'")
                    .collect(Collectors.joining(" OR "));
            edgeLabelConditions.add(new Predicate.Native("(" + disjunction + ")"));
        } else if (edge.labels().size() == 1) {
            detail.append(':').append(edge.labels().get(0));
        }
        if (edge.isVariableLength()) {
            variableLength = true;
            detail.append('*').append(edge.hops());
        }
        return switch (edge.direction()) {
            case OUTGOING -> "-[" + detail + "]->";
            case INCOMING -> "<-[" + detail + "]-";
            case UNDIRECTED -> "-[" + detail + "]-";
        };
    }

    private static String node(String alias) {
        return "(" + (alias != null ? alias : "") + ":" + TWIN_LABEL + ")";
    }

    private String renderProjection(TwinQuery.Projection projection) {
        if (projection.wildcard()) {
            return "*";
        }
        List<String> items = new ArrayList<>();
        for (TwinQuery.ProjectionItem item : projection.items()) {
            String rendered;
            if (item.value() instanceof ValueExpr.FunctionCall call) {
                if (!isCount(call)) {
                    throw new TwinQueryCompileException("Unsupported function in projection '" + call.name() + "'", call.name());
                }
                rendered = "COUNT(*)";
            } else if (item.value() instanceof ValueExpr.PropertyRef ref) {
                rendered = renderProperty(ref);
            } else {
                rendered = renderValue(item.value());
            }
            if (item.alias() != null) {
                rendered = rendered + " AS " + item.alias();
            }
            items.add(rendered);
        }
        return String.join(", ", items);
    }

    private static boolean isCount(ValueExpr.FunctionCall call) {
        if (!"COUNT".equalsIgnoreCase(call.name())) {
            return false;
        }
        return call.args().isEmpty() || (call.args().size() == 1 && call.args().get(0) instanceof ValueExpr.Star);
    }

    String renderPredicate(Predicate predicate) {
        if (predicate instanceof Predicate.And and) {
            return renderPredicate(and.left()) + " AND " + renderPredicate(and.right());
        }
        if (predicate instanceof Predicate.Or or) {
            return renderPredicate(or.left()) + " OR " + renderPredicate(or.right());
        }
        if (predicate instanceof Predicate.Not not) {
            return "NOT " + renderPredicate(not.inner());
        }
        if (predicate instanceof Predicate.Group group) {
            return "(" + renderPredicate(group.inner()) + ")";
        }
        if (predicate instanceof Predicate.Comparison comparison) {
            String left = renderValue(comparison.left());
            String right = renderValue(comparison.right());
            if ("!=".equals(comparison.operator()) || "<>".equals(comparison.operator())) {
                return "NOT (" + left + " = " + right + ")";
            }
            return left + " " + comparison.operator() + " " + right;
        }
        if (predicate instanceof Predicate.In in) {
            String list = in.values().stream().map(ValueExpr.Literal::text).collect(Collectors.joining(", "));
            String test = renderValue(in.value()) + " IN [" + list + "]";
            return in.negated() ? "NOT (" + test + ")" : test;
        }
        if (predicate instanceof Predicate.FunctionTest test) {
            return renderFunction(test.call());
        }
        if (predicate instanceof Predicate.Native nativeCondition) {
            return nativeCondition.text();
        }
        throw new IllegalStateException("Unhandled predicate " + predicate);
    }

    private String renderValue(ValueExpr value) {
        if (value instanceof ValueExpr.Literal literal) {
            return literal.text();
        }
        if (value instanceof ValueExpr.PropertyRef ref) {
            return renderProperty(ref);
        }
        if (value instanceof ValueExpr.FunctionCall call) {
            return renderFunction(call);
        }
        throw new TwinQueryCompileException("'*' is only allowed in COUNT(*)", "*");
    }

    private String renderProperty(ValueExpr.PropertyRef ref) {
        ValueExpr.PropertyRef rooted = ref;
        if (defaultAlias != null) {
            if (!defaultAlias.equals(ref.root())) {
                rooted = ref.prefixedWith(defaultAlias);
            }
        } else if (!declaredAliases.contains(ref.root())) {
            throw new TwinQueryCompileException("Unknown alias '" + ref.root() + "'", ref.root());
        }
        StringBuilder sb = new StringBuilder(rooted.root());
        for (ValueExpr.Segment segment : rooted.segments()) {
            if (segment.bracketed()) {
                sb.append("['").append(segment.name().replace("'", "\\'")).append("']");
            } else {
                sb.append('.').append(segment.name());
            }
        }
        return sb.toString();
    }

    private String renderFunction(ValueExpr.FunctionCall call) {
        String name = call.name().toUpperCase(Locale.ROOT);
        List<ValueExpr> args = call.args();
        switch (name) {
            case "IS_OF_MODEL":
                return renderIsOfModel(call);
            case "STARTSWITH":
                requireArity(call, 2);
                return renderValue(args.get(0)) + " STARTS WITH " + renderValue(args.get(1));
            case "ENDSWITH":
                requireArity(call, 2);
                return renderValue(args.get(0)) + " ENDS WITH " + renderValue(args.get(1));
            case "CONTAINS":
                requireArity(call, 2);
                return renderValue(args.get(0)) + " CONTAINS " + renderValue(args.get(1));
            case "IS_NULL":
                requireArity(call, 1);
                return renderValue(args.get(0)) + " IS NULL";
            case "IS_DEFINED":
                requireArity(call, 1);
                return renderValue(args.get(0)) + " IS NOT NULL";
            case "IS_NUMBER": {
                requireArity(call, 1);
                String v = renderValue(args.get(0));
                return "(toFloat(" + v + ") IS NOT NULL AND NOT (toString(" + v + ") = " + v + "))";
            }
            case "COUNT":
                throw new TwinQueryCompileException("COUNT() is only allowed in the projection", call.name());
            default:
                throw new TwinQueryCompileException("Unsupported function '" + call.name() + "'", call.name());
        }
    }

    /**
     * IS_OF_MODEL([alias,] 'modelId'[, exact]) becomes a call to the graph's
     * is_of_model function, which checks the model and its flattened bases.
     */
    private String renderIsOfModel(ValueExpr.FunctionCall call) {
        List<ValueExpr> args = new ArrayList<>(call.args());
        if (args.isEmpty() || args.size() > 3) {
            throw new TwinQueryCompileException("IS_OF_MODEL expects 1 to 3 arguments", call.name());
        }
        String alias;
        if (args.get(0) instanceof ValueExpr.PropertyRef ref && ref.isBareIdentifier() && isAlias(ref.root())) {
            alias = ref.root();
            args.remove(0);
        } else if (args.get(0) instanceof ValueExpr.Literal) {
            if (primaryAlias == null) {
                throw new TwinQueryCompileException("IS_OF_MODEL needs an alias argument in MATCH queries", call.name());
            }
            alias = primaryAlias;
        } else {
            throw new TwinQueryCompileException("IS_OF_MODEL expects an alias or a model id as first argument", call.name());
        }
        if (args.isEmpty() || !(args.get(0) instanceof ValueExpr.Literal modelId) || !modelId.isString()) {
            throw new TwinQueryCompileException("IS_OF_MODEL expects a quoted model id", call.name());
        }
        boolean exact = false;
        if (args.size() == 2) {
            ValueExpr flag = args.get(1);
            if (flag instanceof ValueExpr.PropertyRef ref && ref.isBareIdentifier() && "exact".equalsIgnoreCase(ref.root())) {
                exact = true;
            } else if (flag instanceof ValueExpr.Literal literal && ("true".equals(literal.text()) || "false".equals(literal.text()))) {
                exact = Boolean.parseBoolean(literal.text());
            } else {
                throw new TwinQueryCompileException("IS_OF_MODEL only accepts 'exact' as third argument", call.name());
            }
        } else if (args.size() > 2) {
            throw new TwinQueryCompileException("IS_OF_MODEL expects 1 to 3 arguments", call.name());
        }
        String model = "'" + TwinQueryAstListener.unquote(modelId.text()).replace("'", "\\'") + "'";
        return graphNamespace + ".is_of_model(" + alias + ", " + model + (exact ? ", true" : "") + ")";
    }

    private boolean isAlias(String name) {
        return declaredAliases.contains(name);
    }

    private static void requireArity(ValueExpr.FunctionCall call, int arity) {
        if (call.args().size() != arity) {
            throw new TwinQueryCompileException(call.name() + " expects " + arity + " argument(s)", call.name());
        }
    }
}
