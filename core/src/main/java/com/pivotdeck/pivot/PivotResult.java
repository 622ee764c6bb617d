package com.pivotdeck.pivot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable output of a pivot computation.
 *
 * <p>{@link #rows()} and {@link #columns()} are in display order (bucket definition
 * order). {@link #cells()} is nested row tuple, then column tuple, then metric name;
 * a combination without records is absent unless the spec asked for empty cells.
 * Totals are computed from the records, not from the cells.
 */
public final class PivotResult {

    private final List<LabelTuple> rows;
    private final List<LabelTuple> columns;
    private final List<String> metricNames;
    private final Map<LabelTuple, Map<LabelTuple, Map<String, Number>>> cells;
    private final Map<LabelTuple, Map<String, Number>> rowTotals;
    private final Map<LabelTuple, Map<String, Number>> columnTotals;
    private final Map<String, Number> grandTotal;
    private final int filteredCount;

    PivotResult(List<LabelTuple> rows,
                List<LabelTuple> columns,
                List<String> metricNames,
                Map<LabelTuple, Map<LabelTuple, Map<String, Number>>> cells,
                Map<LabelTuple, Map<String, Number>> rowTotals,
                Map<LabelTuple, Map<String, Number>> columnTotals,
                Map<String, Number> grandTotal,
                int filteredCount) {
        this.rows = List.copyOf(rows);
        this.columns = List.copyOf(columns);
        this.metricNames = List.copyOf(metricNames);
        Map<LabelTuple, Map<LabelTuple, Map<String, Number>>> cellsCopy = new LinkedHashMap<>();
        cells.forEach((row, byColumn) -> cellsCopy.put(row, Collections.unmodifiableMap(new LinkedHashMap<>(byColumn))));
        this.cells = Collections.unmodifiableMap(cellsCopy);
        this.rowTotals = Collections.unmodifiableMap(new LinkedHashMap<>(rowTotals));
        this.columnTotals = Collections.unmodifiableMap(new LinkedHashMap<>(columnTotals));
        this.grandTotal = grandTotal;
        this.filteredCount = filteredCount;
    }

    public List<LabelTuple> rows() {
        return rows;
    }

    public List<LabelTuple> columns() {
        return columns;
    }

    public List<String> metricNames() {
        return metricNames;
    }

    public Map<LabelTuple, Map<LabelTuple, Map<String, Number>>> cells() {
        return cells;
    }

    /**
     * Returns the metrics of one cell.
     *
     * @param row the row tuple
     * @param column the column tuple
     * @return the metric values, or empty if the cell was not emitted
     */
    public Optional<Map<String, Number>> cell(LabelTuple row, LabelTuple column) {
        Map<LabelTuple, Map<String, Number>> byColumn = cells.get(row);
        return byColumn == null ? Optional.empty() : Optional.ofNullable(byColumn.get(column));
    }

    /**
     * Returns one metric of one cell.
     *
     * @return the value, or null if the cell is absent or the metric is undefined there
     */
    public Number value(LabelTuple row, LabelTuple column, String metric) {
        return cell(row, column).map(values -> values.get(metric)).orElse(null);
    }

    public Map<LabelTuple, Map<String, Number>> rowTotals() {
        return rowTotals;
    }

    public Map<LabelTuple, Map<String, Number>> columnTotals() {
        return columnTotals;
    }

    public Map<String, Number> grandTotal() {
        return grandTotal;
    }

    /**
     * Returns the number of records that passed the filter.
     *
     * @return the filtered record count
     */
    public int filteredCount() {
        return filteredCount;
    }

    public int cellCount() {
        return cells.values().stream().mapToInt(Map::size).sum();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PivotResult)) return false;
        PivotResult that = (PivotResult) o;
        return filteredCount == that.filteredCount &&
               rows.equals(that.rows) &&
               columns.equals(that.columns) &&
               metricNames.equals(that.metricNames) &&
               cells.equals(that.cells) &&
               rowTotals.equals(that.rowTotals) &&
               columnTotals.equals(that.columnTotals) &&
               grandTotal.equals(that.grandTotal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rows, columns, metricNames, cells, rowTotals, columnTotals, grandTotal, filteredCount);
    }

    @Override
    public String toString() {
        return String.format("PivotResult[rows=%d, columns=%d, cells=%d, filtered=%d]",
            rows.size(), columns.size(), cellCount(), filteredCount);
    }
}
