package com.largomodo.platelayout.core.pagination;

import com.largomodo.platelayout.core.domain.ImageFailure;
import com.largomodo.platelayout.core.domain.Page;

import java.util.List;

/**
 * Pages with contiguous indices, carrying divider overlays where groups meet on a page.
 */
public record Pagination(List<Page> pages, List<ImageFailure> rejected) {

    public Pagination {
        pages = List.copyOf(pages);
        rejected = List.copyOf(rejected);
    }

    public Page firstPage() {
        return pages.isEmpty() ? Page.empty(0) : pages.get(0);
    }
}
