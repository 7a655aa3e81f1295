package com.samplesift.query;

import com.samplesift.query.grammar.FilterQueryBaseVisitor;
import com.samplesift.query.grammar.FilterQueryParser;
import com.samplesift.record.Record;
import com.samplesift.util.DecimalParser;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns a {@code FilterQuery} parse tree into {@link QueryNode}s, recording every column the
 * expression references so the caller can validate them against the input header.
 */
final class QueryAstBuilder extends FilterQueryBaseVisitor<QueryNode> {

    private static final Pattern NUMERIC = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)");

    private final Set<String> referencedColumns = new LinkedHashSet<>();

    QueryNode build(FilterQueryParser.QueryContext context) {
        return visit(context.expression());
    }

    Set<String> getReferencedColumns() {
        return referencedColumns;
    }

    @Override
    public QueryNode visitNotExpression(FilterQueryParser.NotExpressionContext ctx) {
        QueryNode inner = visit(ctx.expression());
        return record -> !inner.test(record);
    }

    @Override
    public QueryNode visitAndExpression(FilterQueryParser.AndExpressionContext ctx) {
        QueryNode left = visit(ctx.expression(0));
        QueryNode right = visit(ctx.expression(1));
        return record -> left.test(record) && right.test(record);
    }

    @Override
    public QueryNode visitOrExpression(FilterQueryParser.OrExpressionContext ctx) {
        QueryNode left = visit(ctx.expression(0));
        QueryNode right = visit(ctx.expression(1));
        return record -> left.test(record) || right.test(record);
    }

    @Override
    public QueryNode visitParenExpression(FilterQueryParser.ParenExpressionContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public QueryNode visitBooleanExpression(FilterQueryParser.BooleanExpressionContext ctx) {
        boolean value = Boolean.parseBoolean(ctx.BOOLEAN().getText().toLowerCase(Locale.ROOT));
        return record -> value;
    }

    @Override
    public QueryNode visitComparisonExpression(FilterQueryParser.ComparisonExpressionContext ctx) {
        Operand left = operand(ctx.operand(0));
        Operand right = operand(ctx.operand(1));
        FilterQueryParser.ComparatorContext comparator = ctx.comparator();
        if (comparator.EQ() != null) {
            return record -> valuesEqual(left.valueOf(record), right.valueOf(record));
        }
        if (comparator.NE() != null) {
            return record -> !valuesEqual(left.valueOf(record), right.valueOf(record));
        }
        if (comparator.LT() != null) {
            return record -> compareOrdered(left.valueOf(record), right.valueOf(record), c -> c < 0);
        }
        if (comparator.LE() != null) {
            return record -> compareOrdered(left.valueOf(record), right.valueOf(record), c -> c <= 0);
        }
        if (comparator.GT() != null) {
            return record -> compareOrdered(left.valueOf(record), right.valueOf(record), c -> c > 0);
        }
        return record -> compareOrdered(left.valueOf(record), right.valueOf(record), c -> c >= 0);
    }

    @Override
    public QueryNode visitMembershipExpression(FilterQueryParser.MembershipExpressionContext ctx) {
        Operand column = columnOperand(ctx.column());
        List<String> candidates = new ArrayList<>();
        for (FilterQueryParser.LiteralContext literal : ctx.valueList().literal()) {
            candidates.add(literalText(literal));
        }
        boolean negated = ctx.NOT() != null;
        return record -> {
            String value = column.valueOf(record);
            boolean found = false;
            for (String candidate : candidates) {
                if (valuesEqual(value, candidate)) {
                    found = true;
                    break;
                }
            }
            return negated != found;
        };
    }

    private Operand operand(FilterQueryParser.OperandContext ctx) {
        if (ctx.column() != null) {
            return columnOperand(ctx.column());
        }
        String literal = literalText(ctx.literal());
        return record -> literal;
    }

    private Operand columnOperand(FilterQueryParser.ColumnContext ctx) {
        String name;
        if (ctx.BACKQUOTED() != null) {
            String text = ctx.BACKQUOTED().getText();
            name = text.substring(1, text.length() - 1);
        } else {
            name = ctx.IDENTIFIER().getText();
        }
        referencedColumns.add(name);
        return record -> {
            String value = record.get(name);
            return value == null ? "" : value;
        };
    }

    private static String literalText(FilterQueryParser.LiteralContext ctx) {
        if (ctx.NUMBER() != null) {
            return ctx.NUMBER().getText();
        }
        String quoted = ctx.STRING().getText();
        return unescape(quoted.substring(1, quoted.length() - 1));
    }

    private static String unescape(String body) {
        StringBuilder out = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char ch = body.charAt(i);
            if (ch == '\\' && i + 1 < body.length()) {
                i++;
                ch = body.charAt(i);
            }
            out.append(ch);
        }
        return out.toString();
    }

    static boolean valuesEqual(String left, String right) {
        BigDecimal leftNumber = numeric(left);
        BigDecimal rightNumber = numeric(right);
        if (leftNumber != null && rightNumber != null) {
            return leftNumber.compareTo(rightNumber) == 0;
        }
        return left.equals(right);
    }

    private static boolean compareOrdered(String left, String right, ComparisonTest test) {
        if (left.isEmpty() || right.isEmpty()) {
            return false;
        }
        BigDecimal leftNumber = numeric(left);
        BigDecimal rightNumber = numeric(right);
        if (leftNumber != null && rightNumber != null) {
            return test.accept(leftNumber.compareTo(rightNumber));
        }
        return test.accept(left.compareTo(right));
    }

    private static BigDecimal numeric(String text) {
        String trimmed = text.trim();
        if (!NUMERIC.matcher(trimmed).matches()) {
            return null;
        }
        return DecimalParser.tryParse(trimmed);
    }

    private interface Operand {
        String valueOf(Record record);
    }

    private interface ComparisonTest {
        boolean accept(int comparison);
    }
}
