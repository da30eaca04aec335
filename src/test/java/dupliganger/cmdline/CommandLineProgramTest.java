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

package dupliganger.cmdline;

import dupliganger.DupligangerException;
import org.apache.commons.io.FileUtils;
import org.testng.annotations.AfterClass;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Utility class for CommandLine Program testing.
 */
public abstract class CommandLineProgramTest {

    public static final File TEST_DATA_DIR = new File("testdata/dupliganger");

    // A per-test-class directory that will be deleted after the tests are complete.
    private File tempOutputDir;

    /**
     * returns a directory designated for output which will be deleted after the test class is tested
     */
    public File getTempOutputDir() {
        if (tempOutputDir == null) {
            try {
                tempOutputDir = Files.createTempDirectory(this.getClass().getName()).toFile();
            } catch (IOException e) {
                throw new DupligangerException("Couldn't create temp directory", e);
            }
        }
        return tempOutputDir;
    }

    /**
     * returns a fresh, empty directory inside {@link #getTempOutputDir()}
     */
    public File newTempOutputDir(final String name) throws IOException {
        return Files.createTempDirectory(getTempOutputDir().toPath(), name).toFile();
    }

    @AfterClass
    final void cleanup_temp_dir() throws IOException {
        if (tempOutputDir != null) {
            FileUtils.deleteDirectory(tempOutputDir);
        }
    }

    public abstract String getCommandLineProgramName();

    /**
     * Given the arguments of a program, builds the arguments appropriate for calling it through DupligangerCommandLine
     */
    public String[] makeDupligangerCommandLineArgs(final String programName, final List<String> args) {
        final String[] commandLineArgs = new String[args.size() + 1];
        commandLineArgs[0] = programName;
        int i = 1;
        for (final String arg : args) {
            commandLineArgs[i++] = arg;
        }
        return commandLineArgs;
    }

    public String[] makeDupligangerCommandLineArgs(final List<String> args) {
        return makeDupligangerCommandLineArgs(getCommandLineProgramName(), args);
    }

    public String[] makeDupligangerCommandLineArgs(final Map<String, String> kwargs) {
        final List<String> args = new ArrayList<>();
        for (final Map.Entry<String, String> entry : kwargs.entrySet()) {
            args.add("--" + entry.getKey());
            args.add(entry.getValue());
        }
        return makeDupligangerCommandLineArgs(args);
    }

    public int runDupligangerCommandLine(final List<String> args) {
        return new DupligangerCommandLine().instanceMain(makeDupligangerCommandLineArgs(args));
    }

    public int runDupligangerCommandLine(final String[] args) {
        return runDupligangerCommandLine(Arrays.asList(args));
    }

    public int runDupligangerCommandLine(final Map<String, String> kwargs) {
        return new DupligangerCommandLine().instanceMain(makeDupligangerCommandLineArgs(kwargs));
    }
}
