/*
 * The MIT License
 *
 * Copyright (c) 2016 The Dupliganger Authors
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package dupliganger.sam;

import htsjdk.samtools.SAMRecord;
import htsjdk.samtools.SAMRecordIterator;
import htsjdk.samtools.SAMTextHeaderCodec;
import htsjdk.samtools.SamReader;
import htsjdk.samtools.SamReaderFactory;
import htsjdk.samtools.ValidationStringency;
import htsjdk.samtools.util.CloserUtil;
import htsjdk.samtools.util.FileExtensions;
import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.PeekableIterator;
import htsjdk.samtools.util.RuntimeIOException;
import org.apache.commons.lang3.StringUtils;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * An alignment file presented as SAM text: the header lines, followed by an iterator over the alignment lines.
 * SAM files (optionally gzipped) are read line by line; BAM files are decoded with htsjdk and rendered as SAM text.
 * Lines are returned without their line terminator.
 */
public class SamTextSource implements Closeable, Iterable<String> {
    public static final char HEADER_PREFIX = '@';

    private final List<String> headerLines = new ArrayList<>();
    private final PeekableIterator<String> lines;
    private final Closeable underlying;
    private boolean iteratorReturned = false;

    private SamTextSource(final Iterator<String> rawLines, final Closeable underlying) {
        this.lines = new PeekableIterator<>(rawLines);
        this.underlying = underlying;
        while (lines.hasNext() && isHeader(lines.peek())) {
            headerLines.add(lines.next());
        }
    }

    /**
     * Opens a SAM, gzipped SAM or BAM file.
     */
    public static SamTextSource open(final File input) {
        IOUtil.assertFileIsReadable(input);
        if (input.getName().endsWith(FileExtensions.BAM)) {
            final SamReader reader = SamReaderFactory.makeDefault()
                    .validationStringency(ValidationStringency.SILENT)
                    .open(input);
            final StringWriter headerText = new StringWriter();
            new SAMTextHeaderCodec().encode(headerText, reader.getFileHeader());
            final List<String> header = headerText.getBuffer().length() == 0 ?
                    Collections.emptyList() :
                    Arrays.asList(StringUtils.split(headerText.toString(), '\n'));
            return new SamTextSource(new BamTextIterator(header, reader.iterator()), reader);
        } else {
            final BufferedReader reader = IOUtil.openFileForBufferedReading(input);
            return new SamTextSource(new LineIterator(reader), reader);
        }
    }

    public static boolean isHeader(final String line) {
        return !line.isEmpty() && line.charAt(0) == HEADER_PREFIX;
    }

    /** @return the header lines at the top of the file */
    public List<String> getHeaderLines() {
        return Collections.unmodifiableList(headerLines);
    }

    /**
     * @return the alignment lines following the header.  Blank lines and stray header lines are skipped.
     * May only be called once.
     */
    @Override
    public Iterator<String> iterator() {
        if (iteratorReturned) {
            throw new IllegalStateException("The alignment lines of a SamTextSource may only be iterated once.");
        }
        iteratorReturned = true;
        return new Iterator<String>() {
            @Override
            public boolean hasNext() {
                while (lines.hasNext() && (lines.peek().isEmpty() || isHeader(lines.peek()))) {
                    lines.next();
                }
                return lines.hasNext();
            }

            @Override
            public String next() {
                if (!hasNext()) throw new NoSuchElementException();
                return lines.next();
            }
        };
    }

    @Override
    public void close() {
        CloserUtil.close(underlying);
    }

    /** Reads the lines of a text file, stripping line terminators. */
    private static class LineIterator implements Iterator<String> {
        private final BufferedReader reader;
        private String next;

        LineIterator(final BufferedReader reader) {
            this.reader = reader;
            advance();
        }

        private void advance() {
            try {
                next = reader.readLine();
            } catch (final IOException e) {
                throw new RuntimeIOException("Error reading alignment file", e);
            }
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public String next() {
            if (next == null) throw new NoSuchElementException();
            final String line = next;
            advance();
            return line;
        }
    }

    /** Renders a BAM file's header and records as SAM text lines. */
    private static class BamTextIterator implements Iterator<String> {
        private final Iterator<String> header;
        private final SAMRecordIterator records;

        BamTextIterator(final List<String> header, final SAMRecordIterator records) {
            this.header = header.iterator();
            this.records = records;
        }

        @Override
        public boolean hasNext() {
            return header.hasNext() || records.hasNext();
        }

        @Override
        public String next() {
            if (header.hasNext()) return header.next();
            final SAMRecord record = records.next();
            return StringUtils.stripEnd(record.getSAMString(), "\r\n");
        }
    }
}
