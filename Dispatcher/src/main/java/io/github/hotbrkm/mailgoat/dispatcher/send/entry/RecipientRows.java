package io.github.hotbrkm.mailgoat.dispatcher.send.entry;

import java.util.Iterator;

/**
 * Ordered, lazy sequence of recipients.
 * <p>
 * Every call to {@link #iterator()} starts again from the first row, so the sequence can be counted
 * up front and then iterated for sending. Iterators over file input are {@link java.io.Closeable} and release
 * the file when closed or exhausted.
 */
public interface RecipientRows extends Iterable<RecipientRow> {

    /**
     * Human readable description of the source, used in logs.
     */
    String describe();

    /**
     * Counts the rows with a full pass over the source.
     */
    default int count() {
        int count = 0;
        Iterator<RecipientRow> it = iterator();
        while (it.hasNext()) {
            it.next();
            count++;
        }
        return count;
    }
}
