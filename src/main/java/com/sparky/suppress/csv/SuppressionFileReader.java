package com.sparky.suppress.csv;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Streams the rows of an input file. The character encoding is picked by trying each configured
 * candidate in order until one decodes the whole file.
 */
public class SuppressionFileReader implements Closeable, Iterable<CsvRow> {
    private static final Logger LOGGER = LoggerFactory.getLogger(SuppressionFileReader.class);

    private final Charset charset;
    private final CSVParser parser;

    private SuppressionFileReader(Charset charset, CSVParser parser) {
        this.charset = charset;
        this.parser = parser;
    }

    public static SuppressionFileReader open(Path file, List<String> candidateEncodings) throws IOException, InvalidSuppressionFileException {
        Charset charset = detectEncoding(file, candidateEncodings);
        Reader reader = Files.newBufferedReader(file, charset);
        // blank lines come through as rows so line numbers stay true to the file
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setIgnoreEmptyLines(false)
            .build();
        return new SuppressionFileReader(charset, format.parse(reader));
    }

    /**
     * @return the first candidate encoding that reads every line of the file without a decoding error
     * @throws InvalidSuppressionFileException when no candidate works
     */
    public static Charset detectEncoding(Path file, List<String> candidateEncodings) throws IOException, InvalidSuppressionFileException {
        for (String name : candidateEncodings) {
            Charset charset;
            try {
                charset = Charset.forName(name.trim());
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                LOGGER.warn("Skipping unknown character encoding: {}", name);
                continue;
            }

            LOGGER.info("Trying file {} with encoding: {}", file, charset.name());
            long lines = 0;
            CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(file), decoder))) {
                while (reader.readLine() != null) {
                    lines++;
                }
                LOGGER.info("File reads OK. Lines in file: {}", lines);
                return charset;
            } catch (CharacterCodingException e) {
                // most likely the wrong encoding, report where it broke and try the next one
                LOGGER.warn("Near line {}: {}", lines + 1, e.toString());
            }
        }
        throw new InvalidSuppressionFileException("Unable to read " + file + " with any of the configured encodings: " + candidateEncodings);
    }

    public Charset charset() {
        return charset;
    }

    @Override
    public Iterator<CsvRow> iterator() {
        Iterator<CSVRecord> records = parser.iterator();
        return new Iterator<>() {
            // line breaks consumed up to the end of the previous record
            private long previousEnd = 0;

            @Override
            public boolean hasNext() {
                return records.hasNext();
            }

            @Override
            public CsvRow next() {
                CSVRecord record = records.next();
                List<String> cells = new ArrayList<>(record.size());
                record.forEach(cells::add);
                long line = previousEnd + 1;
                previousEnd = parser.getCurrentLineNumber();
                return new CsvRow(line, cells);
            }
        };
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }
}
