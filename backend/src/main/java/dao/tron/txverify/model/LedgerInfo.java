package dao.tron.txverify.model;

public record LedgerInfo(String network, String contractAddress, long totalBatches) {}
