package io.github.hotbrkm.mailgoat.dispatcher.send.result;

/**
 * Write-once storage of sealed batch records keyed by batch id.
 * <p>
 * Implementations must allow concurrent {@link #save} calls for distinct batch ids.
 */
public interface BatchStore {

    /**
     * @throws BatchStorageException if the store is unavailable or the id was already saved
     */
    void save(BatchRecord record);

    /**
     * @throws BatchNotFoundException if no record has that id
     * @throws BatchStorageException  if the store is unavailable
     */
    BatchRecord load(String batchId);
}
