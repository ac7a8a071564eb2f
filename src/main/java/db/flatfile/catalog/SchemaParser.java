package db.flatfile.catalog;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.flatfile.DatabaseNotFoundException;
import db.flatfile.ErrorCode;

/**
 * Parser for schema definition (.dbd) files:
 *   TAB <name>   starts naming the current table
 *   KEY <name>   appends the primary key column
 *   COL <name>   appends a column
 *   **           closes the current table and opens a new, empty one
 * Every other line is ignored. Tag = first 4 chars trimmed, value = text after
 * the 3-char tag trimmed.
 */
public class SchemaParser {
    private static final Logger logger = LoggerFactory.getLogger(SchemaParser.class);

    private static final String TABLE_SEPARATOR = "**";

    public Schema parse(Path schemaFile) {
        if (!Files.isRegularFile(schemaFile) || !Files.isReadable(schemaFile)) {
            throw new DatabaseNotFoundException(ErrorCode.DBD_FILE_MISSING, schemaFile.toString());
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(schemaFile);
        } catch (IOException e) {
            throw new DatabaseNotFoundException(ErrorCode.DBD_FILE_MISSING, schemaFile + " (" + e.getMessage() + ")");
        }
        List<String> lines = decode(bytes, schemaFile).lines().toList();
        if (lines.isEmpty()) {
            throw new DatabaseNotFoundException(ErrorCode.DBD_FILE_EMPTY, schemaFile.toString());
        }
        Schema schema = parseLines(lines);
        logger.debug("Parsed {} table definition(s) from {}", schema.tables().size(), schemaFile);
        return schema;
    }

    // UTF-8 when valid, otherwise byte-per-char ISO-8859-1 so legacy files still open
    private static String decode(byte[] bytes, Path schemaFile) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        } catch (CharacterCodingException e) {
            logger.debug("Schema file {} is not UTF-8, reading it as ISO-8859-1", schemaFile);
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }

    public Schema parseLines(List<String> lines) {
        List<TableSchema> tables = new ArrayList<>();
        TableBuilder current = new TableBuilder();
        for (String line : lines) {
            if (line.startsWith(TABLE_SEPARATOR)) {
                tables.add(current.build());
                current = new TableBuilder();
                continue;
            }
            String tag = line.substring(0, Math.min(4, line.length())).trim();
            String value = line.length() > 3 ? line.substring(3).trim() : "";
            switch (tag) {
                case "TAB" -> current.name = value;
                case "KEY" -> {
                    current.key = value;
                    current.columns.add(value);
                }
                case "COL" -> current.columns.add(value);
                default -> { }
            }
        }
        tables.add(current.build());
        return new Schema(tables);
    }

    // Mutable definition while lines are being consumed
    private static final class TableBuilder {
        String name = "";
        String key;
        final List<String> columns = new ArrayList<>();

        TableSchema build() {
            String pk = key;
            if (pk == null) {
                // No KEY line: fall back to the first declared column
                pk = columns.isEmpty() ? "" : columns.get(0);
                if (!columns.isEmpty()) logger.debug("Table '{}' declares no KEY, using '{}'", name, pk);
            }
            return new TableSchema(name, columns, pk);
        }
    }
}
