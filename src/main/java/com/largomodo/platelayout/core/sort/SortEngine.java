package com.largomodo.platelayout.core.sort;

import com.largomodo.platelayout.core.config.SortCriterion;
import com.largomodo.platelayout.core.config.SortOrder;
import com.largomodo.platelayout.core.config.SortSpec;
import com.largomodo.platelayout.core.domain.ImageItem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.function.ToDoubleFunction;

/**
 * Orders images by a primary and an optional secondary criterion.
 * <p>
 * The result is a new list; the input is never modified. The sort is stable and, apart from
 * unseeded random keys, total: after both criteria, remaining ties fall back to the natural
 * name order. Random keys are drawn once per item before sorting, so a seeded spec always
 * produces the same permutation for the same input order.
 */
public class SortEngine {

    private final Comparator<String> naturalOrder;

    public SortEngine() {
        this(NaturalNameComparator.INSTANCE);
    }

    public SortEngine(Comparator<String> naturalOrder) {
        this.naturalOrder = naturalOrder;
    }

    public List<ImageItem> sort(List<ImageItem> images, SortSpec spec) {
        Random random = spec.seed() != null ? new Random(spec.seed()) : new Random();
        boolean primaryRandom = spec.primary().key() == SortCriterion.Key.RANDOM;
        boolean secondaryRandom = spec.secondary().key() == SortCriterion.Key.RANDOM;

        List<Entry> entries = new ArrayList<>(images.size());
        for (ImageItem item : images) {
            double p = primaryRandom ? random.nextDouble() : 0;
            double s = secondaryRandom ? random.nextDouble() : 0;
            entries.add(new Entry(item, p, s));
        }

        Comparator<Entry> order = criterion(spec.primary(), Entry::primaryKey)
                .thenComparing(criterion(spec.secondary(), Entry::secondaryKey))
                .thenComparing(e -> e.item().name(), naturalOrder);
        entries.sort(order);

        return entries.stream().map(Entry::item).toList();
    }

    /**
     * Value of the primary field an item is grouped by, {@code null} when missing. Only
     * meaningful for field criteria.
     */
    public static String groupKey(ImageItem item, SortCriterion criterion) {
        return criterion.isField() ? item.field(criterion.field()) : null;
    }

    private Comparator<Entry> criterion(SortCriterion criterion, ToDoubleFunction<Entry> randomKey) {
        boolean descending = criterion.order() == SortOrder.DESCENDING;
        Comparator<Entry> base = switch (criterion.key()) {
            case NONE -> (a, b) -> 0;
            case ALPHABETICAL -> Comparator.comparing(e -> e.item().name());
            case NATURAL_NAME -> Comparator.comparing(e -> e.item().name(), naturalOrder);
            case RANDOM -> Comparator.comparingDouble(randomKey);
            case FIELD -> fieldComparator(criterion.field(), descending);
        };
        // Field order already handles direction so missing values stay last
        if (descending && criterion.key() != SortCriterion.Key.FIELD && criterion.key() != SortCriterion.Key.NONE) {
            return base.reversed();
        }
        return base;
    }

    private Comparator<Entry> fieldComparator(String field, boolean descending) {
        return (a, b) -> {
            String va = a.item().field(field);
            String vb = b.item().field(field);
            if (va == null && vb == null) {
                return 0;
            }
            if (va == null) {
                return 1;
            }
            if (vb == null) {
                return -1;
            }
            int cmp = naturalOrder.compare(va, vb);
            return descending ? -cmp : cmp;
        };
    }

    private record Entry(ImageItem item, double primaryKey, double secondaryKey) {
    }
}
