package dao.tron.txverify.model;

import java.util.List;

public record BatchPage(List<BatchDescriptor> batches, int totalCount, int offset, int limit, boolean hasMore) {

    public BatchPage {
        batches = batches == null ? List.of() : List.copyOf(batches);
    }
}
