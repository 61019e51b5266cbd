package com.nana.educms.util;

import com.nana.educms.domain.Student;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * CsvExporter — Student CSV Encoding
 *
 * <p>RFC 4180 COMPLIANCE:
 * <ul>
 *   <li>Fields containing commas, double quotes, carriage returns or
 *       newlines are enclosed in double quotes.</li>
 *   <li>Double quotes within a quoted field are doubled
 *       ({@code He said "hi"} becomes {@code "He said ""hi"""}).</li>
 *   <li>Each record ends with CRLF.</li>
 *   <li>The first row is the header row, written exactly once.</li>
 *   <li>All rows have the same number of fields.</li>
 * </ul>
 *
 * <p>ENCODING: UTF-8 without a byte order mark and without any comment or
 * metadata line, so the first bytes of the output are the header itself.
 *
 * <p>Instances are stateless and may be shared.
 */
public class CsvExporter {

    private static final Logger log = LoggerFactory.getLogger(CsvExporter.class);

    /** RFC 4180 record separator, independent of the host OS. */
    private static final String CRLF = "\r\n";

    private final List<CsvColumn> columns;

    public CsvExporter() {
        this.columns = Arrays.asList(CsvColumn.exportColumns());
    }

    /**
     * Encodes {@code students}, in the given order, as a UTF-8 CSV document.
     *
     * @param students rows to write; must not be null
     * @return the encoded document
     */
    public byte[] export(List<Student> students) {
        if (students == null) {
            throw new IllegalArgumentException("Student list must not be null.");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8)) {
            write(students, writer);
        } catch (IOException ex) {
            // not expected from an in-memory stream
            throw new UncheckedIOException("CSV encoding failed.", ex);
        }
        byte[] bytes = out.toByteArray();
        log.debug("CSV encoded: {} rows, {} bytes.", students.size(), bytes.length);
        return bytes;
    }

    /**
     * Writes the header row and one row per student to {@code writer}.
     *
     * @throws IOException if the writer fails
     */
    public void write(List<Student> students, Writer writer) throws IOException {
        writeHeaderRow(writer);
        for (Student student : students) {
            writeDataRow(writer, student);
        }
        writer.flush();
    }

    private void writeHeaderRow(Writer writer) throws IOException {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(escapeCsvField(columns.get(i).getHeaderName()));
        }
        writer.write(sb.toString());
        writer.write(CRLF);
    }

    private void writeDataRow(Writer writer, Student student) throws IOException {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(escapeCsvField(columns.get(i).extract(student)));
        }
        writer.write(sb.toString());
        writer.write(CRLF);
    }

    /**
     * Applies RFC 4180 escaping to one field.
     *
     * <pre>
     *   escapeCsvField("John")           → John
     *   escapeCsvField("O'Brien, Jr.")   → "O'Brien, Jr."
     *   escapeCsvField("He said \"hi\"") → "He said ""hi"""
     *   escapeCsvField(null)             → (empty string)
     * </pre>
     *
     * @param value raw value; null is written as an empty field
     * @return the field as it appears in the file
     */
    public static String escapeCsvField(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }

        boolean needsQuoting = value.indexOf(',') >= 0
                || value.indexOf('"') >= 0
                || value.indexOf('\r') >= 0
                || value.indexOf('\n') >= 0;

        if (!needsQuoting) {
            return value;
        }
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }
}
