package com.clickstream.analytics.validation;

import com.clickstream.analytics.domain.EventTable;
import com.clickstream.analytics.exception.MissingColumnException;
import org.springframework.stereotype.Component;

@Component
public class EventTableValidator {

    public void requireColumns(EventTable table, String... columns) {
        for (String column : columns) {
            if (!table.hasColumn(column)) {
                throw new MissingColumnException(column);
            }
        }
    }
}
