package com.clickstream.analytics;

import com.clickstream.analytics.analytics.AnalyticsModels.FunnelRow;
import com.clickstream.analytics.analytics.AnalyticsModels.TransitionRow;
import com.clickstream.analytics.export.ReportCsvWriter;
import com.clickstream.analytics.export.ReportTables;
import com.clickstream.analytics.export.ReportTables.CsvTable;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportCsvWriterTest {
    private final ReportCsvWriter writer = new ReportCsvWriter();

    @Test
    void writesHeaderForEmptyTable() throws Exception {
        StringWriter out = new StringWriter();

        writer.write(ReportTables.funnel(List.of()), out);

        assertEquals("step,sessions_reached,unique_users_reached", out.toString().trim());
    }

    @Test
    void writesRowsInOrder() throws Exception {
        StringWriter out = new StringWriter();

        writer.write(ReportTables.sankey(List.of(
                new TransitionRow("cart", "checkout", 3),
                new TransitionRow("search", "product", 7))), out);

        assertEquals(List.of("action,next_action,users", "cart,checkout,3", "search,product,7"),
                out.toString().lines().toList());
    }

    @Test
    void writesNaNAndNullAsEmptyCells() throws Exception {
        StringWriter out = new StringWriter();
        CsvTable table = new CsvTable("x.csv", List.of("a", "b", "c"),
                List.of(Arrays.asList("k", null, Double.NaN)));

        writer.write(table, out);

        assertEquals("k,,", out.toString().lines().toList().get(1));
    }

    @Test
    void quotesOnlyCellsThatNeedIt() throws Exception {
        StringWriter out = new StringWriter();
        CsvTable table = new CsvTable("x.csv", List.of("cr_checkout_to_confirmation", "note"),
                List.of(List.of("a_value_well_beyond_twenty_four_chars", "x,y")));

        writer.write(table, out);

        assertEquals(List.of("cr_checkout_to_confirmation,note", "a_value_well_beyond_twenty_four_chars,\"x,y\""),
                out.toString().lines().toList());
    }

    @Test
    void funnelTableKeepsStepColumns() {
        CsvTable table = ReportTables.funnel(List.of(new FunnelRow("search", 2, 1)));

        assertEquals("funnel.csv", table.fileName());
        assertEquals(List.of(List.of("search", 2L, 1L)), table.rows());
    }
}
