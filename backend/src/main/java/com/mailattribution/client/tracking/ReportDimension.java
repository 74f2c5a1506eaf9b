package com.mailattribution.client.tracking;

/** Dimensions an entity report can be grouped by. */
public enum ReportDimension {
    DATE("date"),
    OFFER("offer"),
    SUB1("sub1"),
    SUB2("sub2");

    private final String columnType;

    ReportDimension(String columnType) {
        this.columnType = columnType;
    }

    public String getColumnType() {
        return columnType;
    }
}
