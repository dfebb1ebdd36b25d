package com.diskwatcher.app.report;

import com.diskwatcher.app.report.LabelRows.LabelRow;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LabelExporterTest {

    @TempDir
    Path tmp;

    @Test
    void headerStartsWithIndexAndHumanId() {
        List<String> header = LabelExporter.header();

        assertEquals("label_index", header.get(0));
        assertEquals("human_id", header.get(1));
        assertEquals(LabelRows.LABEL_EXPORT_COLUMNS.size() + 2, header.size());
    }

    @Test
    void exportWritesOneRecordPerVolume() throws Exception {
        List<LabelRow> rows = LabelRows.buildRows(List.of(
                LabelRowsTest.volume("a", 1, "1234-ABCD", null, null),
                LabelRowsTest.volume("b,with comma", 2, null, null, null)));
        Path out = tmp.resolve("exports/labels.csv");

        LabelExporter.exportCsv(rows, out);

        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build();
        try (Reader reader = Files.newBufferedReader(out); CSVParser parser = new CSVParser(reader, format)) {
            assertEquals(LabelExporter.header(), parser.getHeaderNames());
            List<CSVRecord> records = parser.getRecords();
            assertEquals(2, records.size());
            assertEquals("1", records.get(0).get("label_index"));
            assertEquals("1234-ABCD", records.get(0).get("human_id"));
            assertEquals("b,with comma", records.get(1).get("volume_id"), "Commas must be quoted");
            assertEquals("", records.get(1).get("mount_uuid"), "Nulls export as empty cells");
        }
    }
}
