package com.pivotdeck.pivot;

import com.pivotdeck.bucket.BucketLabels;
import com.pivotdeck.bucket.BucketRule;
import com.pivotdeck.bucket.BucketRules;
import com.pivotdeck.data.Record;
import com.pivotdeck.types.DataType;
import com.pivotdeck.types.NumericType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Labels records along one pivot axis and orders the resulting tuples.
 *
 * <p>A dimension under a bucket rule is labelled and ordered by the rule (declaration
 * order, reserved labels last). A dimension without a rule passes its raw value
 * through as the label; raw numeric labels order numerically, other raw labels
 * lexicographically, and {@code Missing} always comes last.
 */
final class AxisLabeler {

    private final List<String> dimensions;
    private final List<BucketRule> rules;
    private final List<Comparator<String>> orders;

    AxisLabeler(List<String> dimensions, Map<String, BucketRule> rulesByDimension, Map<String, DataType> types) {
        this.dimensions = List.copyOf(dimensions);
        this.rules = new ArrayList<>(dimensions.size());
        this.orders = new ArrayList<>(dimensions.size());
        for (String dimension : dimensions) {
            BucketRule rule = rulesByDimension.get(dimension);
            rules.add(rule);
            orders.add(rule != null ? rule.labelOrder() : rawOrder(types.get(dimension)));
        }
    }

    boolean isEmpty() {
        return dimensions.isEmpty();
    }

    LabelTuple label(Record record) {
        if (dimensions.isEmpty()) {
            return LabelTuple.EMPTY;
        }
        List<String> labels = new ArrayList<>(dimensions.size());
        for (int i = 0; i < dimensions.size(); i++) {
            Object value = record.get(dimensions.get(i));
            BucketRule rule = rules.get(i);
            labels.add(rule != null ? BucketRules.apply(rule, value) : BucketLabels.rawLabel(value));
        }
        return new LabelTuple(labels);
    }

    /**
     * Orders tuples lexicographically, dimension by dimension.
     */
    Comparator<LabelTuple> tupleOrder() {
        return (a, b) -> {
            for (int i = 0; i < orders.size(); i++) {
                int cmp = orders.get(i).compare(a.get(i), b.get(i));
                if (cmp != 0) {
                    return cmp;
                }
            }
            return 0;
        };
    }

    /**
     * Returns the axis tuples in display order.
     *
     * @param observed the tuples that occur in the filtered records
     * @param includeDeclared also include every combination of declared bucket labels
     * @return the ordered tuples
     */
    List<LabelTuple> axis(Collection<LabelTuple> observed, boolean includeDeclared) {
        if (dimensions.isEmpty()) {
            return List.of(LabelTuple.EMPTY);
        }
        if (!includeDeclared) {
            TreeSet<LabelTuple> sorted = new TreeSet<>(tupleOrder());
            sorted.addAll(observed);
            return new ArrayList<>(sorted);
        }

        List<List<String>> domains = new ArrayList<>(dimensions.size());
        for (int i = 0; i < dimensions.size(); i++) {
            TreeSet<String> domain = new TreeSet<>(orders.get(i));
            if (rules.get(i) != null) {
                domain.addAll(rules.get(i).declaredLabels());
            }
            for (LabelTuple tuple : observed) {
                domain.add(tuple.get(i));
            }
            domains.add(new ArrayList<>(domain));
        }

        List<LabelTuple> product = new ArrayList<>();
        cartesian(domains, 0, new ArrayList<>(), product);
        return product;
    }

    private static void cartesian(List<List<String>> domains, int depth, List<String> prefix, List<LabelTuple> out) {
        if (depth == domains.size()) {
            out.add(new LabelTuple(prefix));
            return;
        }
        for (String label : domains.get(depth)) {
            prefix.add(label);
            cartesian(domains, depth + 1, prefix, out);
            prefix.remove(prefix.size() - 1);
        }
    }

    private static Comparator<String> rawOrder(DataType type) {
        Comparator<String> byValue = type instanceof NumericType
            ? Comparator.comparingDouble(Double::parseDouble)
            : Comparator.naturalOrder();
        return (a, b) -> {
            boolean aMissing = BucketLabels.MISSING.equals(a);
            boolean bMissing = BucketLabels.MISSING.equals(b);
            if (aMissing || bMissing) {
                return Boolean.compare(aMissing, bMissing);
            }
            return byValue.compare(a, b);
        };
    }
}
