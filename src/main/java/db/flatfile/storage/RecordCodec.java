package db.flatfile.storage;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts a table's record set to and from its data file bytes.
 *
 * Layout: fields joined by the column delimiter byte, each row terminated by
 * the row delimiter byte plus '\n'. No escaping: values must not contain the
 * delimiter bytes. Splitting happens on raw bytes before charset decoding;
 * with the legacy 200/201 delimiters, values should stay single-byte.
 *
 * A field that is not valid in the charset reads as ISO-8859-1 text and keeps
 * its file bytes, which are written back verbatim unless the field is set.
 */
public class RecordCodec {
    private static final byte LINE_FEED = '\n';

    private final Delimiters delimiters;
    private final Charset charset;

    public RecordCodec(Delimiters delimiters) {
        this(delimiters, StandardCharsets.UTF_8);
    }

    public RecordCodec(Delimiters delimiters, Charset charset) {
        this.delimiters = delimiters;
        this.charset = charset;
    }

    public Delimiters delimiters() {
        return delimiters;
    }

    public List<Record> decode(byte[] data) {
        List<Record> out = new ArrayList<>();
        if (data == null || data.length == 0) return out;
        byte rowDelim = delimiters.row();
        int rowStart = 0;
        for (int i = 0; i < data.length; i++) {
            if (data[i] == rowDelim) {
                out.add(decodeRow(data, rowStart, i));
                rowStart = i + 1;
            }
        }
        // Bytes after the last row delimiter (normally just '\n') are dropped
        return out;
    }

    private Record decodeRow(byte[] data, int start, int end) {
        int from = start;
        while (from < end && isLeadingWhitespace(data[from])) from++;
        byte colDelim = delimiters.column();
        List<int[]> spans = new ArrayList<>();
        int fieldStart = from;
        for (int i = from; i < end; i++) {
            if (data[i] == colDelim) {
                spans.add(new int[] {fieldStart, i});
                fieldStart = i + 1;
            }
        }
        spans.add(new int[] {fieldStart, end});

        List<String> values = new ArrayList<>(spans.size());
        List<Integer> undecodable = new ArrayList<>();
        for (int[] span : spans) {
            String text = decodeStrict(data, span[0], span[1] - span[0]);
            if (text == null) {
                undecodable.add(values.size());
                text = new String(data, span[0], span[1] - span[0], StandardCharsets.ISO_8859_1);
            }
            values.add(text);
        }
        Record record = new Record(values);
        for (int idx : undecodable) {
            int[] span = spans.get(idx);
            byte[] raw = new byte[span[1] - span[0]];
            System.arraycopy(data, span[0], raw, 0, raw.length);
            record.keepRawField(idx, raw);
        }
        return record;
    }

    private String decodeStrict(byte[] data, int offset, int length) {
        CharsetDecoder decoder = charset.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(data, offset, length)).toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    // space, tab, LF, CR, NUL, vertical tab
    private static boolean isLeadingWhitespace(byte b) {
        return b == ' ' || b == '\t' || b == '\n' || b == '\r' || b == 0 || b == 0x0B;
    }

    public byte[] encode(List<Record> records) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Record record : records) {
            List<String> values = record.getValues();
            for (int i = 0; i < values.size(); i++) {
                if (i > 0) out.write(delimiters.column());
                byte[] bytes = record.rawField(i);
                if (bytes == null) bytes = stripDelimiterEscapes(values.get(i)).getBytes(charset);
                out.write(bytes, 0, bytes.length);
            }
            out.write(delimiters.row());
            out.write(LINE_FEED);
        }
        return out.toByteArray();
    }

    /**
     * Drops a backslash that escapes a delimiter character inside a value;
     * every other backslash is kept.
     */
    String stripDelimiterEscapes(String value) {
        if (value == null) return "";
        if (value.indexOf('\\') < 0) return value;
        char col = delimiters.columnChar();
        char row = delimiters.rowChar();
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length()) {
                char next = value.charAt(i + 1);
                if (next == col || next == row) continue;
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
