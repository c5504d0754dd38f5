package com.challenges.jeval.json;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads CSV as a header row followed by data rows, and writes rows back out
 * in CSV form.
 */
public class CsvRows {

    /** Receives each data row, both as raw cells and keyed by header. */
    @FunctionalInterface
    public interface RowHandler {
        void row(String[] cells, Map<String, String> byHeader) throws IOException;
    }

    private final CsvMapper mapper = new CsvMapper()
        .enable(CsvParser.Feature.WRAP_AS_ARRAY)
        .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING);

    /**
     * Opens {@code input} and reads its header row.
     *
     * @throws IOException if the input has no header row or is not valid CSV
     */
    public Table open(InputStream input) throws IOException {
        MappingIterator<String[]> rows = mapper.readerFor(String[].class).readValues(input);
        if (!rows.hasNextValue()) {
            rows.close();
            throw new IOException("missing CSV header row");
        }
        return new Table(rows.nextValue(), rows);
    }

    /** Writes one row, quoting cells only where CSV requires it. */
    public void write(Writer out, String[] cells) throws IOException {
        if (cells.length == 0) {
            out.write('\n');
            return;
        }
        CsvSchema.Builder columns = CsvSchema.builder();
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < cells.length; i++) {
            String column = "c" + i;
            columns.addColumn(column);
            row.put(column, cells[i]);
        }
        out.write(mapper.writer(columns.build()).writeValueAsString(row));
    }

    /** An open CSV input positioned after its header row. */
    public static final class Table implements Closeable {
        private final String[] header;
        private final MappingIterator<String[]> rows;

        private Table(String[] header, MappingIterator<String[]> rows) {
            this.header = header;
            this.rows = rows;
        }

        public String[] header() {
            return header.clone();
        }

        /**
         * Hands every remaining row to {@code handler}. A row shorter than the
         * header only maps the columns it has; extra cells are not mapped.
         */
        public void forEachRow(RowHandler handler) throws IOException {
            MutableMap<String, String> byHeader = Maps.mutable.ofInitialCapacity(header.length);
            while (rows.hasNextValue()) {
                String[] cells = rows.nextValue();
                byHeader.clear();
                for (int i = 0; i < header.length && i < cells.length; i++) {
                    byHeader.put(header[i], cells[i]);
                }
                handler.row(cells, byHeader);
            }
        }

        @Override
        public void close() throws IOException {
            rows.close();
        }
    }
}
