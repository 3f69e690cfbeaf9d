package com.ebayseller.scraper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for the persisted listing store.
 */
public interface CsvServiceInterface {
    /**
     * Merges listings into the store at {@code file}, keyed by item id, and rewrites it.
     * Existing rows absent from {@code listings} are kept; rows with the same key are replaced.
     * @param listings freshly scraped listings
     * @param file store location; created with its parent directories if missing
     * @return number of rows in the rewritten store
     * @throws StoreFormatException if the existing store cannot be parsed; the file is left untouched
     * @throws IOException if reading or writing fails
     */
    int mergeListings(List<Listing> listings, Path file) throws IOException;

    /**
     * Reads every row of the store.
     * @param file store location
     * @return listings in file order, empty if the file does not exist
     * @throws StoreFormatException if the store cannot be parsed
     * @throws IOException if reading fails
     */
    List<Listing> readListings(Path file) throws IOException;
}
