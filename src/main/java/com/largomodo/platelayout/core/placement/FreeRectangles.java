package com.largomodo.platelayout.core.placement;

import com.largomodo.platelayout.core.domain.Rect;

import java.util.ArrayList;
import java.util.List;

/**
 * Maximal free rectangles of one bin, for best-area-fit packing without rotation.
 * <p>
 * Not thread-safe; one instance per page being packed.
 */
class FreeRectangles {

    private final List<Rect> free = new ArrayList<>();

    FreeRectangles(int width, int height) {
        free.add(new Rect(0, 0, width, height));
    }

    /**
     * Finds the free rectangle that leaves the least area after taking a {@code width x height}
     * block from its top-left corner. Ties go to the lowest y, then the lowest x.
     *
     * @return the chosen slot, or {@code null} when nothing fits
     */
    Rect find(int width, int height) {
        Rect best = null;
        long bestLeftover = Long.MAX_VALUE;
        for (Rect candidate : free) {
            if (candidate.width() < width || candidate.height() < height) {
                continue;
            }
            long leftover = candidate.area() - (long) width * height;
            if (best == null || leftover < bestLeftover
                    || (leftover == bestLeftover && (candidate.y() < best.y()
                    || (candidate.y() == best.y() && candidate.x() < best.x())))) {
                best = candidate;
                bestLeftover = leftover;
            }
        }
        return best == null ? null : new Rect(best.x(), best.y(), width, height);
    }

    /**
     * Removes {@code used} from the free space, splitting every overlapped free rectangle into
     * its maximal remainders.
     */
    void occupy(Rect used) {
        List<Rect> next = new ArrayList<>();
        for (Rect f : free) {
            if (!f.intersects(used)) {
                next.add(f);
                continue;
            }
            if (used.x() > f.x()) {
                next.add(new Rect(f.x(), f.y(), used.x() - f.x(), f.height()));
            }
            if (used.right() < f.right()) {
                next.add(new Rect(used.right(), f.y(), f.right() - used.right(), f.height()));
            }
            if (used.y() > f.y()) {
                next.add(new Rect(f.x(), f.y(), f.width(), used.y() - f.y()));
            }
            if (used.bottom() < f.bottom()) {
                next.add(new Rect(f.x(), used.bottom(), f.width(), f.bottom() - used.bottom()));
            }
        }
        free.clear();
        for (int i = 0; i < next.size(); i++) {
            Rect r = next.get(i);
            boolean redundant = false;
            for (int j = 0; j < next.size() && !redundant; j++) {
                if (i == j) {
                    continue;
                }
                Rect other = next.get(j);
                // keep the first of two identical rectangles
                redundant = other.contains(r) && (!r.equals(other) || j < i);
            }
            if (!redundant) {
                free.add(r);
            }
        }
    }

    List<Rect> snapshot() {
        return List.copyOf(free);
    }
}
