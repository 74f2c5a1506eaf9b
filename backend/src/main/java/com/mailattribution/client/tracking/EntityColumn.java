package com.mailattribution.client.tracking;

import lombok.Value;

/** One dimension value of an entity-report row; {@code columnType} is e.g. {@code offer} or {@code sub2}. */
@Value
public class EntityColumn {
    String columnType;
    String id;
    String label;
}
