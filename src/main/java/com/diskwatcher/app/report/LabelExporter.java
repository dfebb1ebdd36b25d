package com.diskwatcher.app.report;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.diskwatcher.app.report.LabelRows.LabelRow;

/** Writes label rows as CSV: label_index, human_id, then the export columns. */
public final class LabelExporter {

    private static final Logger logger = LoggerFactory.getLogger(LabelExporter.class);

    private LabelExporter() {}

    public static List<String> header() {
        List<String> h = new ArrayList<>();
        h.add("label_index");
        h.add("human_id");
        h.addAll(LabelRows.LABEL_EXPORT_COLUMNS);
        return h;
    }

    public static void exportCsv(List<LabelRow> rows, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (var writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(rows, writer);
        }
        logger.info("label export written rows={} file={}", rows.size(), file.toAbsolutePath());
    }

    public static void write(List<LabelRow> rows, Writer writer) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(header().toArray(String[]::new))
                .build();
        CSVPrinter printer = new CSVPrinter(writer, format);
        for (LabelRow row : rows) {
            List<Object> record = new ArrayList<>();
            record.add(row.labelIndex());
            record.add(row.humanId());
            for (String column : LabelRows.LABEL_EXPORT_COLUMNS) {
                record.add(row.values().get(column));
            }
            printer.printRecord(record);
        }
        printer.flush();
    }
}
