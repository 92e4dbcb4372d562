package io.github.hotbrkm.mailgoat.dispatcher.send.entry;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * CSV recipients. The first record is the header; each following record is parsed only when iterated.
 */
class CsvRecipientRows implements RecipientRows {

    private final CsvMapper csvMapper;
    private final RecipientSourceReader.InputSupplier supplier;
    private final String description;

    CsvRecipientRows(CsvMapper csvMapper, RecipientSourceReader.InputSupplier supplier, String description) {
        this.csvMapper = csvMapper;
        this.supplier = supplier;
        this.description = description;
    }

    @Override
    public String describe() {
        return description;
    }

    @Override
    public Iterator<RecipientRow> iterator() {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        InputStream in = null;
        try {
            in = supplier.open();
            MappingIterator<Map<String, String>> records = csvMapper.readerFor(Map.class).with(schema).readValues(in);
            return new CsvIterator(records);
        } catch (IOException e) {
            closeQuietly(in);
            throw new RecipientValidationException("failed to read CSV input: " + description, e);
        }
    }

    private void closeQuietly(InputStream in) {
        if (in == null) {
            return;
        }
        try {
            in.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private final class CsvIterator implements Iterator<RecipientRow>, Closeable {
        private final MappingIterator<Map<String, String>> records;
        private int nextIndex;
        private boolean closed;

        private CsvIterator(MappingIterator<Map<String, String>> records) {
            this.records = records;
        }

        @Override
        public boolean hasNext() {
            if (closed) {
                return false;
            }
            try {
                if (records.hasNextValue()) {
                    return true;
                }
            } catch (IOException | RuntimeJsonMappingException e) {
                close();
                throw new RecipientValidationException("malformed CSV input near row " + nextIndex + ": " + description, e);
            }
            close();
            return false;
        }

        @Override
        public RecipientRow next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            try {
                Map<String, String> record = records.nextValue();
                return RecipientRowMapper.fromCsv(nextIndex++, record);
            } catch (IOException | RuntimeJsonMappingException e) {
                close();
                throw new RecipientValidationException("malformed CSV input near row " + nextIndex + ": " + description, e);
            }
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            try {
                records.close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
