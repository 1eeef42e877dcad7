package com.e2eq.twins.query;

import com.e2eq.twins.grammar.TwinQueryBaseListener;
import com.e2eq.twins.grammar.TwinQueryParser;
import com.e2eq.twins.query.ast.Predicate;
import com.e2eq.twins.query.ast.TwinQuery;
import com.e2eq.twins.query.ast.ValueExpr;
import org.antlr.v4.runtime.Token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Walks a parsed twin query and assembles its {@link TwinQuery} tree. Value expressions
 * and predicates are built bottom-up on two stacks; clause-level data is read directly
 * from the contexts.
 */
public class TwinQueryAstListener extends TwinQueryBaseListener {
    protected final Deque<ValueExpr> valueStack = new ArrayDeque<>();
    protected final Deque<Predicate> predicateStack = new ArrayDeque<>();

    private Integer top;
    private TwinQuery.Projection projection;
    private final List<TwinQuery.ProjectionItem> projectionItems = new ArrayList<>();
    private TwinQuery.From from;
    private final List<TwinQuery.PathPattern> match = new ArrayList<>();
    private final List<TwinQuery.Join> joins = new ArrayList<>();
    private Predicate where;
    private boolean complete = false;

    public TwinQuery getQuery() {
        if (!complete) {
            throw new IllegalStateException("Query has not been walked yet");
        }
        return new TwinQuery(top, projection, from, match, joins, where);
    }

    @Override
    public void exitTopClause(TwinQueryParser.TopClauseContext ctx) {
        top = Integer.parseInt(ctx.NUMBER().getText());
    }

    @Override
    public void exitWildcardProjection(TwinQueryParser.WildcardProjectionContext ctx) {
        projection = TwinQuery.Projection.all();
    }

    @Override
    public void exitProjectionItem(TwinQueryParser.ProjectionItemContext ctx) {
        ValueExpr value = valueStack.pop();
        String alias = ctx.IDENT() != null ? ctx.IDENT().getText() : null;
        projectionItems.add(new TwinQuery.ProjectionItem(value, alias));
    }

    @Override
    public void exitItemProjection(TwinQueryParser.ItemProjectionContext ctx) {
        projection = new TwinQuery.Projection(false, projectionItems);
    }

    @Override
    public void exitFromClause(TwinQueryParser.FromClauseContext ctx) {
        TwinQuery.Collection collection = ctx.collection.getType() == TwinQueryParser.RELATIONSHIPS
                ? TwinQuery.Collection.RELATIONSHIPS
                : TwinQuery.Collection.DIGITALTWINS;
        from = new TwinQuery.From(collection, ctx.alias != null ? ctx.alias.getText() : null);
    }

    @Override
    public void exitPathPattern(TwinQueryParser.PathPatternContext ctx) {
        List<TwinQuery.NodePattern> nodes = new ArrayList<>();
        for (TwinQueryParser.NodePatternContext node : ctx.nodePattern()) {
            nodes.add(new TwinQuery.NodePattern(node.alias != null ? node.alias.getText() : null));
        }
        List<TwinQuery.EdgePattern> edges = new ArrayList<>();
        for (TwinQueryParser.EdgePatternContext edge : ctx.edgePattern()) {
            edges.add(toEdge(edge));
        }
        match.add(new TwinQuery.PathPattern(nodes, edges));
    }

    private TwinQuery.EdgePattern toEdge(TwinQueryParser.EdgePatternContext ctx) {
        TwinQuery.Direction direction;
        if (ctx.incoming != null && ctx.outgoing == null) {
            direction = TwinQuery.Direction.INCOMING;
        } else if (ctx.outgoing != null && ctx.incoming == null) {
            direction = TwinQuery.Direction.OUTGOING;
        } else if (ctx.incoming == null) {
            direction = TwinQuery.Direction.UNDIRECTED;
        } else {
            throw new IllegalArgumentException("Edge cannot point in both directions: " + ctx.getText());
        }
        TwinQueryParser.EdgeDetailContext detail = ctx.edgeDetail();
        if (detail == null) {
            return new TwinQuery.EdgePattern(null, List.of(), direction, null);
        }
        List<String> labels = new ArrayList<>();
        for (TwinQueryParser.NameContext name : detail.name()) {
            labels.add(name.getText());
        }
        String hops = null;
        if (detail.hops() != null) {
            // text after the leading star, e.g. "1..3"
            hops = detail.hops().getText().substring(1);
        }
        return new TwinQuery.EdgePattern(detail.alias != null ? detail.alias.getText() : null, labels, direction, hops);
    }

    @Override
    public void exitJoinClause(TwinQueryParser.JoinClauseContext ctx) {
        joins.add(new TwinQuery.Join(
                ctx.target.getText(),
                ctx.source.getText(),
                ctx.name().getText(),
                ctx.edge != null ? ctx.edge.getText() : null));
    }

    @Override
    public void exitWhereClause(TwinQueryParser.WhereClauseContext ctx) {
        where = predicateStack.pop();
    }

    @Override
    public void exitQuery(TwinQueryParser.QueryContext ctx) {
        if (!valueStack.isEmpty() || !predicateStack.isEmpty()) {
            throw new IllegalStateException("Expression stacks not empty at end of query, values:"
                    + valueStack.size() + " predicates:" + predicateStack.size());
        }
        complete = true;
    }

    // predicates

    @Override
    public void exitParenPredicate(TwinQueryParser.ParenPredicateContext ctx) {
        predicateStack.push(new Predicate.Group(predicateStack.pop()));
    }

    @Override
    public void exitComparisonPredicate(TwinQueryParser.ComparisonPredicateContext ctx) {
        ValueExpr right = valueStack.pop();
        ValueExpr left = valueStack.pop();
        predicateStack.push(new Predicate.Comparison(left, ctx.compOp().getText(), right));
    }

    @Override
    public void exitInPredicate(TwinQueryParser.InPredicateContext ctx) {
        List<ValueExpr.Literal> values = new ArrayList<>();
        for (TwinQueryParser.LiteralContext literal : ctx.listLiteral().literal()) {
            values.add(toLiteral(literal));
        }
        predicateStack.push(new Predicate.In(valueStack.pop(), ctx.NOT() != null, values));
    }

    @Override
    public void exitFunctionPredicate(TwinQueryParser.FunctionPredicateContext ctx) {
        predicateStack.push(new Predicate.FunctionTest((ValueExpr.FunctionCall) valueStack.pop()));
    }

    @Override
    public void exitNotPredicate(TwinQueryParser.NotPredicateContext ctx) {
        predicateStack.push(new Predicate.Not(predicateStack.pop()));
    }

    @Override
    public void exitAndPredicate(TwinQueryParser.AndPredicateContext ctx) {
        Predicate right = predicateStack.pop();
        Predicate left = predicateStack.pop();
        predicateStack.push(new Predicate.And(left, right));
    }

    @Override
    public void exitOrPredicate(TwinQueryParser.OrPredicateContext ctx) {
        Predicate right = predicateStack.pop();
        Predicate left = predicateStack.pop();
        predicateStack.push(new Predicate.Or(left, right));
    }

    // values

    @Override
    public void exitLiteralValue(TwinQueryParser.LiteralValueContext ctx) {
        valueStack.push(toLiteral(ctx.literal()));
    }

    @Override
    public void exitPropertyValue(TwinQueryParser.PropertyValueContext ctx) {
        TwinQueryParser.PropertyRefContext ref = ctx.propertyRef();
        List<ValueExpr.Segment> segments = new ArrayList<>();
        for (TwinQueryParser.SegmentContext segment : ref.segment()) {
            if (segment instanceof TwinQueryParser.DotSegmentContext dot) {
                segments.add(new ValueExpr.Segment(dot.name().getText(), false));
            } else if (segment instanceof TwinQueryParser.DollarSegmentContext dollar) {
                segments.add(new ValueExpr.Segment(dollar.DOLLAR_IDENT().getText(), true));
            } else {
                String quoted = ((TwinQueryParser.BracketSegmentContext) segment).STRING().getText();
                segments.add(new ValueExpr.Segment(unquote(quoted), true));
            }
        }
        valueStack.push(new ValueExpr.PropertyRef(ref.root.getText(), segments));
    }

    @Override
    public void exitFunctionArg(TwinQueryParser.FunctionArgContext ctx) {
        if (ctx.STAR() != null) {
            valueStack.push(new ValueExpr.Star());
        }
    }

    @Override
    public void exitFunctionCall(TwinQueryParser.FunctionCallContext ctx) {
        int arity = ctx.functionArg().size();
        ValueExpr[] args = new ValueExpr[arity];
        for (int i = arity - 1; i >= 0; i--) {
            args[i] = valueStack.pop();
        }
        valueStack.push(new ValueExpr.FunctionCall(ctx.IDENT().getText(), List.of(args)));
    }

    private static ValueExpr.Literal toLiteral(TwinQueryParser.LiteralContext ctx) {
        Token start = ctx.getStart();
        return switch (start.getType()) {
            case TwinQueryParser.TRUE, TwinQueryParser.FALSE, TwinQueryParser.NULL ->
                    new ValueExpr.Literal(ctx.getText().toLowerCase(Locale.ROOT));
            default -> new ValueExpr.Literal(ctx.getText());
        };
    }

    static String unquote(String quoted) {
        String inner = quoted.substring(1, quoted.length() - 1);
        return inner.replace("\\'", "'").replace("\\\"", "\"");
    }
}
