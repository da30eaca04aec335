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

package dupliganger.dedup;

import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.RuntimeIOException;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Writers for the output files of a run.  Each enabled output is written to a temporary file next to its final
 * location and moved into place by {@link #commit()}; outputs that are not enabled get a writer that discards
 * everything.  Closing without committing deletes the temporary files.
 */
public class DedupOutputs implements Closeable {
    private static final Log log = Log.getInstance(DedupOutputs.class);

    static final String TMP_SUFFIX = ".tmp";

    private final Map<DedupOutput, File> files = new EnumMap<>(DedupOutput.class);
    private final Map<DedupOutput, BufferedWriter> writers = new EnumMap<>(DedupOutput.class);
    private boolean closed = false;

    public DedupOutputs(final File outputDir, final String prefix, final Set<DedupOutput> enabled) {
        IOUtil.assertDirectoryIsWritable(outputDir);
        for (final DedupOutput output : DedupOutput.values()) {
            if (enabled.contains(output)) {
                final File file = new File(outputDir, output.getFileName(prefix));
                files.put(output, file);
                writers.put(output, IOUtil.openFileForBufferedWriting(tmpFile(file)));
            } else {
                writers.put(output, new BufferedWriter(Writer.nullWriter()));
            }
        }
    }

    private static File tmpFile(final File file) {
        return new File(file.getParentFile(), file.getName() + TMP_SUFFIX);
    }

    public BufferedWriter get(final DedupOutput output) {
        return writers.get(output);
    }

    /** Closes every writer and moves each temporary file to its final location. */
    public void commit() {
        closeWriters();
        for (final Map.Entry<DedupOutput, File> entry : files.entrySet()) {
            final File file = entry.getValue();
            try {
                Files.move(tmpFile(file).toPath(), file.toPath(), StandardCopyOption.REPLACE_EXISTING);
            } catch (final IOException e) {
                throw new RuntimeIOException("Could not move " + tmpFile(file) + " to " + file, e);
            }
            log.info("Wrote " + file.getAbsolutePath());
        }
        files.clear();
    }

    private void closeWriters() {
        if (closed) return;
        closed = true;
        for (final Map.Entry<DedupOutput, BufferedWriter> entry : writers.entrySet()) {
            try {
                entry.getValue().close();
            } catch (final IOException e) {
                throw new RuntimeIOException("Error closing " + entry.getKey() + " output", e);
            }
        }
    }

    /** Closes the writers and deletes the temporary files of any output that was not committed. */
    @Override
    public void close() {
        try {
            closeWriters();
        } finally {
            for (final File file : files.values()) {
                final File tmp = tmpFile(file);
                if (tmp.exists() && !tmp.delete()) {
                    log.warn("Could not delete temporary file " + tmp.getAbsolutePath());
                }
            }
        }
    }
}
