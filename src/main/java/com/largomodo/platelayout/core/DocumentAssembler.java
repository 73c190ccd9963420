package com.largomodo.platelayout.core;

import com.largomodo.platelayout.core.config.LayoutConfig;
import com.largomodo.platelayout.core.domain.Document;
import com.largomodo.platelayout.core.domain.ImageFailure;
import com.largomodo.platelayout.core.domain.Page;
import com.largomodo.platelayout.core.scale.ScaleResolution;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects finished pages into a document with contiguous zero-based page indices.
 */
public class DocumentAssembler {

    public Document assemble(List<Page> pages, LayoutConfig config, ScaleResolution scale,
                             List<ImageFailure> failures) {
        List<Page> indexed = new ArrayList<>(pages.size());
        for (Page page : pages) {
            indexed.add(page.withIndex(indexed.size()));
        }
        return new Document(indexed, config.pageWidth(), config.pageHeight(), config.margin(), scale, failures);
    }
}
