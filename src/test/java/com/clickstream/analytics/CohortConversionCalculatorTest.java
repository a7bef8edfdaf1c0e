package com.clickstream.analytics;

import com.clickstream.analytics.analytics.AnalyticsModels.ConversionRow;
import com.clickstream.analytics.analytics.AnalyticsModels.ConversionTable;
import com.clickstream.analytics.analytics.CohortConversionCalculator;
import com.clickstream.analytics.analytics.StepList;
import com.clickstream.analytics.domain.DomainModels.Event;
import com.clickstream.analytics.domain.DomainModels.FieldNames;
import com.clickstream.analytics.domain.EventTable;
import com.clickstream.analytics.exception.MissingColumnException;
import com.clickstream.analytics.validation.EventTableValidator;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CohortConversionCalculatorTest {
    private static final FieldNames FIELDS = FieldNames.defaults();
    private static final StepList STEPS = StepList.of("search", "product", "cart");
    private static final Instant DAY_1 = Instant.parse("2024-03-01T09:00:00Z");
    private static final Instant DAY_2 = Instant.parse("2024-03-02T09:00:00Z");

    private final CohortConversionCalculator calculator = new CohortConversionCalculator(new EventTableValidator());

    @Test
    void stepEventsBeforeFunnelEntryAreIgnored() {
        EventTable table = EventTable.of(FIELDS, List.of(
                Event.of("u1", "s1", DAY_1, "product"),
                Event.of("u1", "s2", DAY_2, "search"),
                Event.of("u1", "s2", DAY_2.plusSeconds(60), "product")));

        ConversionTable result = calculator.compute(table, STEPS, FIELDS);

        assertEquals(1, result.rows().size());
        ConversionRow row = result.rows().get(0);
        assertEquals(LocalDate.of(2024, 3, 2), row.cohortDate());
        assertEquals(Map.of("search", 1L, "product", 1L, "cart", 0L), row.stepUsers());
        assertEquals(1.0, row.ratios().get("cr_search_to_product"));
        assertEquals(0.0, row.ratios().get("cr_product_to_cart"));
        assertEquals(0.0, row.crFull());
    }

    @Test
    void cohortIsDateOfEarliestFirstStep() {
        EventTable table = EventTable.of(FIELDS, List.of(
                Event.of("u1", "s2", DAY_2, "search"),
                Event.of("u1", "s1", DAY_1, "search"),
                Event.of("u1", "s2", DAY_2.plusSeconds(60), "cart"),
                Event.of("u2", "s3", DAY_2, "search"),
                Event.of("u2", "s3", DAY_2.plusSeconds(30), "product")));

        List<ConversionRow> rows = calculator.compute(table, STEPS, FIELDS).rows();

        assertEquals(List.of(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 2)),
                rows.stream().map(ConversionRow::cohortDate).toList());
        assertEquals(Map.of("search", 1L, "product", 0L, "cart", 1L), rows.get(0).stepUsers());
        assertEquals(Map.of("search", 1L, "product", 1L, "cart", 0L), rows.get(1).stepUsers());
    }

    @Test
    void ratioIsNaNWhenDenominatorIsZero() {
        ConversionRow row = calculator.toRow(LocalDate.of(2024, 3, 1), Map.of(), STEPS);

        assertTrue(Double.isNaN(row.ratios().get("cr_search_to_product")));
        assertTrue(Double.isNaN(row.crFull()));
    }

    @Test
    void emptyInputKeepsColumnLayout() {
        ConversionTable result = calculator.compute(EventTable.empty(FIELDS), STEPS, FIELDS);

        assertTrue(result.rows().isEmpty());
        assertEquals(List.of("cohort_date", "search", "product", "cart",
                "cr_search_to_product", "cr_product_to_cart", "cr_full"), result.columns());
    }

    @Test
    void requiresUserColumn() {
        EventTable table = EventTable.of(List.of("sessionid", "timestamp", "action"), List.of());

        assertThrows(MissingColumnException.class, () -> calculator.compute(table, STEPS, FIELDS));
    }
}
