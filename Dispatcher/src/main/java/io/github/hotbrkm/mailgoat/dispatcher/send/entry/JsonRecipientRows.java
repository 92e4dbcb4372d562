package io.github.hotbrkm.mailgoat.dispatcher.send.entry;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * JSON array recipients, streamed one element at a time.
 */
class JsonRecipientRows implements RecipientRows {

    private final ObjectMapper objectMapper;
    private final RecipientSourceReader.InputSupplier supplier;
    private final String description;

    JsonRecipientRows(ObjectMapper objectMapper, RecipientSourceReader.InputSupplier supplier, String description) {
        this.objectMapper = objectMapper;
        this.supplier = supplier;
        this.description = description;
    }

    @Override
    public String describe() {
        return description;
    }

    @Override
    public Iterator<RecipientRow> iterator() {
        JsonParser parser = null;
        try {
            parser = objectMapper.createParser(supplier.open());
            if (parser.nextToken() != JsonToken.START_ARRAY) {
                closeParser(parser);
                throw new RecipientValidationException("JSON input must be an array of recipient objects: " + description);
            }
            return new JsonIterator(parser);
        } catch (IOException e) {
            closeParser(parser);
            throw new RecipientValidationException("invalid JSON input: " + description, e);
        }
    }

    private static void closeParser(JsonParser parser) {
        if (parser == null) {
            return;
        }
        try {
            parser.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private final class JsonIterator implements Iterator<RecipientRow>, Closeable {
        private final JsonParser parser;
        private JsonNode pending;
        private boolean hasPending;
        private int nextIndex;
        private boolean finished;

        private JsonIterator(JsonParser parser) {
            this.parser = parser;
        }

        @Override
        public boolean hasNext() {
            if (hasPending) {
                return true;
            }
            if (finished) {
                return false;
            }
            try {
                JsonToken token = parser.nextToken();
                if (token == null || token == JsonToken.END_ARRAY) {
                    finish();
                    return false;
                }
                pending = objectMapper.readTree(parser);
                hasPending = true;
                return true;
            } catch (IOException e) {
                finish();
                throw new RecipientValidationException("invalid JSON input near element " + nextIndex + ": " + description, e);
            }
        }

        @Override
        public RecipientRow next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            JsonNode node = pending;
            pending = null;
            hasPending = false;
            return RecipientRowMapper.fromJson(nextIndex++, node);
        }

        @Override
        public void close() {
            pending = null;
            hasPending = false;
            if (!finished) {
                finish();
            }
        }

        private void finish() {
            finished = true;
            closeParser(parser);
        }
    }
}
