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

package dupliganger.db;

import dupliganger.DupligangerException;
import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.RuntimeIOException;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Shared plumbing of the stores: transaction checks and debug dumps over a string-to-string map.
 */
abstract class AbstractStore {
    protected final String name;
    protected final Map<String, String> map;

    AbstractStore(final String name, final Map<String, String> map) {
        this.name = name;
        this.map = map;
    }

    public String getName() {
        return name;
    }

    protected void checkRead(final Transaction txn) {
        txn.assertOpen();
    }

    protected void checkWrite(final Transaction txn) {
        txn.assertOpen();
        if (!txn.isWrite()) {
            throw new DupligangerException("Attempted to write to store '" + name + "' in a read-only transaction.");
        }
    }

    /** @return the number of keys in the store */
    public int size(final Transaction txn) {
        checkRead(txn);
        return map.size();
    }

    /**
     * @return one {@code key: value} line per entry, sorted
     */
    public List<String> dump(final Transaction txn) {
        checkRead(txn);
        final List<String> lines = new ArrayList<>(map.size());
        for (final Map.Entry<String, String> entry : map.entrySet()) {
            lines.add(entry.getKey() + ": " + entry.getValue());
        }
        Collections.sort(lines);
        return lines;
    }

    /** Writes {@link #dump(Transaction)} to a file. */
    public void dump(final Transaction txn, final File file) {
        try (BufferedWriter out = IOUtil.openFileForBufferedWriting(file)) {
            for (final String line : dump(txn)) {
                out.write(line);
                out.newLine();
            }
        } catch (final IOException e) {
            throw new RuntimeIOException("Error writing dump of store '" + name + "' to " + file.getAbsolutePath(), e);
        }
    }
}
