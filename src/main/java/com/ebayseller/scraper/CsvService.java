package com.ebayseller.scraper;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Service for the accumulating listing store, a CSV file written with OpenCSV.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Loads the existing store strictly: wrong header, wrong column count or a malformed
 *       boolean/count cell raises {@link StoreFormatException} and nothing is written.</li>
 *   <li>Overlays the new listings on a map keyed by item id (title and price when a listing has
 *       no id). Existing rows keep their position, new keys are appended in scrape order.</li>
 *   <li>Writes the whole map to a sibling temporary file and moves it over the store.</li>
 * </ul>
 * List columns ({@code notes}, {@code item_specifics}) are joined with {@value #LIST_SEPARATOR};
 * booleans are {@code true}/{@code false}; absent values are empty cells.
 *
 * @author eBay Seller Dashboard Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    static final String LIST_SEPARATOR = ";";

    // Column order of the store
    private static final List<MetadataField> CSV_FIELDS = List.of(
        new MetadataField("title", List.of()),
        new MetadataField("price", List.of()),
        new MetadataField("shipping", List.of()),
        new MetadataField("condition", List.of()),
        new MetadataField("watchers", List.of()),
        new MetadataField("seller", List.of()),
        new MetadataField("seller_feedback", List.of()),
        new MetadataField("buy_it_now", List.of()),
        new MetadataField("accepts_offers", List.of()),
        new MetadataField("location", List.of()),
        new MetadataField("quantity_available", List.of()),
        new MetadataField("is_new_listing", List.of()),
        new MetadataField("item_id", List.of()),
        new MetadataField("url", List.of()),
        new MetadataField("notes", List.of()),
        new MetadataField("item_specifics", List.of()),
        new MetadataField("description", List.of())
    );

    static final String[] HEADER = CSV_FIELDS.stream().map(f -> f.fieldName).toArray(String[]::new);

    @Override
    public int mergeListings(List<Listing> listings, Path file) throws IOException {
        if (listings == null) {
            logger.warn("Attempted to merge a null listing list into {}", file);
            throw new IllegalArgumentException("Listing list cannot be null");
        }
        if (file == null) {
            throw new IllegalArgumentException("Store path cannot be null");
        }
        Map<String, Listing> merged = new LinkedHashMap<>();
        List<Listing> existing = readListings(file);
        for (Listing l : existing) merged.put(key(l), l);
        int updated = 0;
        for (Listing l : listings) {
            if (merged.put(key(l), l) != null) updated++;
        }
        write(new ArrayList<>(merged.values()), file);
        logger.info("Merged {} listings into {} ({} existing, {} replaced, {} rows now)",
            listings.size(), file, existing.size(), updated, merged.size());
        return merged.size();
    }

    @Override
    public List<Listing> readListings(Path file) throws IOException {
        List<Listing> listings = new ArrayList<>();
        if (file == null || !Files.exists(file)) return listings;
        if (Files.size(file) == 0) {
            logger.info("Store {} is empty", file);
            return listings;
        }
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReaderBuilder(in)
                 .withCSVParser(new RFC4180ParserBuilder().build())
                 .build()) {
            String[] header = reader.readNext();
            if (header == null) return listings;
            if (header.length > 0) header[0] = stripBom(header[0]);
            if (!Arrays.equals(header, HEADER)) {
                throw new StoreFormatException("Unexpected header in " + file + ": " + Arrays.toString(header));
            }
            String[] row;
            while ((row = reader.readNext()) != null) {
                long line = reader.getLinesRead();
                if (row.length == 1 && row[0].isEmpty()) continue;
                if (row.length != HEADER.length) {
                    throw new StoreFormatException("Row ending at line " + line + " of " + file + " has "
                        + row.length + " columns, expected " + HEADER.length);
                }
                listings.add(fromRow(row, line));
            }
        } catch (CsvValidationException e) {
            throw new StoreFormatException("Cannot parse " + file + ": " + e.getMessage(), e);
        }
        logger.debug("Read {} rows from {}", listings.size(), file);
        return listings;
    }

    private void write(List<Listing> listings, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tmp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
        try {
            try (Writer out = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8);
                 CSVWriter writer = new CSVWriter(out)) {
                writer.writeNext(HEADER);
                for (Listing l : listings) writer.writeNext(toRow(l));
            }
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move unsupported for {}, replacing instead", file);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    static String key(Listing l) {
        if (l.hasItemId()) return l.getItemId();
        return "title:" + l.getTitle() + "|price:" + l.getPrice();
    }

    static String[] toRow(Listing l) {
        return new String[]{
            l.getTitle(),
            l.getPrice(),
            l.getShipping(),
            l.getCondition(),
            l.getWatchers() == null ? "" : l.getWatchers().toString(),
            l.getSeller(),
            l.getSellerFeedback(),
            Boolean.toString(l.isBuyItNow()),
            Boolean.toString(l.isAcceptsOffers()),
            l.getLocation(),
            l.getQuantityAvailable() == null ? "" : l.getQuantityAvailable().toString(),
            Boolean.toString(l.isNewListing()),
            l.getItemId(),
            l.getUrl(),
            String.join(LIST_SEPARATOR, l.getNotes()),
            String.join(LIST_SEPARATOR, l.getItemSpecifics()),
            l.getDescription() == null ? "" : l.getDescription()
        };
    }

    static Listing fromRow(String[] row, long line) throws StoreFormatException {
        Listing l = new Listing();
        l.setTitle(row[0]);
        l.setPrice(row[1]);
        l.setShipping(row[2]);
        l.setCondition(row[3]);
        l.setWatchers(count(row[4], HEADER[4], line));
        l.setSeller(row[5]);
        l.setSellerFeedback(row[6]);
        l.setBuyItNow(bool(row[7], HEADER[7], line));
        l.setAcceptsOffers(bool(row[8], HEADER[8], line));
        l.setLocation(row[9]);
        l.setQuantityAvailable(count(row[10], HEADER[10], line));
        l.setNewListing(bool(row[11], HEADER[11], line));
        l.setItemId(row[12]);
        l.setUrl(row[13]);
        l.getNotes().addAll(split(row[14]));
        l.getItemSpecifics().addAll(split(row[15]));
        l.setDescription(row[16].isEmpty() ? null : row[16]);
        return l;
    }

    private static Integer count(String cell, String column, long line) throws StoreFormatException {
        if (cell.isBlank()) return null;
        try {
            return Integer.valueOf(cell.trim());
        } catch (NumberFormatException e) {
            throw new StoreFormatException("Non-numeric " + column + " '" + cell + "' near line " + line, e);
        }
    }

    private static boolean bool(String cell, String column, long line) throws StoreFormatException {
        String v = cell.trim().toLowerCase(Locale.ROOT);
        if (v.equals("true")) return true;
        if (v.equals("false")) return false;
        throw new StoreFormatException("Non-boolean " + column + " '" + cell + "' near line " + line);
    }

    private static List<String> split(String cell) {
        List<String> out = new ArrayList<>();
        if (cell.isEmpty()) return out;
        for (String part : cell.split(LIST_SEPARATOR)) {
            if (!part.isBlank()) out.add(part.trim());
        }
        return out;
    }

    private static String stripBom(String s) {
        return s.startsWith("\uFEFF") ? s.substring(1) : s;
    }
}
