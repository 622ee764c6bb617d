package com.pivotdeck.filter;

import com.pivotdeck.catalog.DimensionCatalog;
import com.pivotdeck.data.Record;
import com.pivotdeck.exception.ParseException;
import com.pivotdeck.exception.TypeMismatchException;
import com.pivotdeck.exception.UnknownDimensionException;

import java.util.List;
import java.util.Objects;

/**
 * A parsed and type-checked filter, ready to be evaluated.
 *
 * <p>Obtained through {@link #parse}; holding a {@code Filter} guarantees that every
 * dimension it mentions is registered and every literal fits its dimension's type.
 */
public final class Filter {

    private static final Filter ALL = new Filter("", MatchAll.INSTANCE);

    private final String text;
    private final FilterExpression expression;

    private Filter(String text, FilterExpression expression) {
        this.text = text;
        this.expression = expression;
    }

    /**
     * Parses and type checks filter text.
     *
     * @param text the filter text; null or blank yields the match-all filter
     * @param catalog the dimension catalog to check against
     * @return the filter
     * @throws ParseException if the text is malformed
     * @throws UnknownDimensionException if the text names an unregistered dimension
     * @throws TypeMismatchException if an operator or literal does not fit a dimension
     */
    public static Filter parse(String text, DimensionCatalog catalog) {
        Objects.requireNonNull(catalog, "catalog must not be null");
        FilterExpression parsed = FilterParser.parse(text);
        if (parsed instanceof MatchAll) {
            return ALL;
        }
        return new Filter(text.trim(), FilterTypeChecker.check(parsed, catalog));
    }

    /**
     * Returns the filter that matches every record.
     *
     * @return the match-all filter
     */
    public static Filter all() {
        return ALL;
    }

    public String text() {
        return text;
    }

    public FilterExpression expression() {
        return expression;
    }

    public boolean isMatchAll() {
        return expression instanceof MatchAll;
    }

    public boolean matches(Record record) {
        return FilterEvaluator.matches(expression, record);
    }

    /**
     * Returns the records this filter selects, in their original order.
     *
     * @param records the records
     * @return the matching subset
     */
    public List<Record> select(List<Record> records) {
        return FilterEvaluator.select(expression, records);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Filter)) return false;
        return expression.equals(((Filter) o).expression);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return isMatchAll() ? "Filter[all]" : "Filter[" + expression.toFilterString() + "]";
    }
}
