package dao.tron.txverify.model;

public record BatchListQuery(BatchIndexFilter filter, int limit, int offset, BatchOrder order) {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    public BatchListQuery {
        if (filter == null) filter = BatchIndexFilter.all();
        if (limit <= 0) limit = DEFAULT_LIMIT;
        if (limit > MAX_LIMIT) limit = MAX_LIMIT;
        if (offset < 0) offset = 0;
        if (order == null) order = BatchOrder.TIMESTAMP_DESC;
    }
}
