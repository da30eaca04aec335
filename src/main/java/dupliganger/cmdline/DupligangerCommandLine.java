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

import dupliganger.dedup.BuildReadAndLocationDbs;
import dupliganger.dedup.Dedup;
import htsjdk.samtools.util.Log;
import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * The unified command line for Dupligänger: the first argument names the program to run, and the remaining
 * arguments are passed to that program.
 */
public class DupligangerCommandLine {
    private static final Log log = Log.getInstance(DupligangerCommandLine.class);

    /** The name of this unified command line program **/
    private final static String COMMAND_LINE_NAME = DupligangerCommandLine.class.getSimpleName();

    /** The programs available from the command line, in registration order. **/
    protected static Map<String, Supplier<CommandLineProgram>> getPrograms() {
        final Map<String, Supplier<CommandLineProgram>> programs = new LinkedHashMap<>();
        programs.put(Dedup.class.getSimpleName(), Dedup::new);
        programs.put(BuildReadAndLocationDbs.class.getSimpleName(), BuildReadAndLocationDbs::new);
        return programs;
    }

    /**
     * The main method.
     */
    protected int instanceMain(final String[] args, final Map<String, Supplier<CommandLineProgram>> programs, final String commandLineName) {
        final CommandLineProgram program = extractCommandLineProgram(args, programs, commandLineName);
        if (null == program) return 1; // no program found!
        final String[] mainArgs = Arrays.copyOfRange(args, 1, args.length);
        return program.instanceMain(mainArgs);
    }

    /** For testing **/
    public int instanceMain(final String[] args) {
        return instanceMain(args, getPrograms(), COMMAND_LINE_NAME);
    }

    public static void main(final String[] args) {
        System.exit(new DupligangerCommandLine().instanceMain(args, getPrograms(), COMMAND_LINE_NAME));
    }

    /** Returns the command line program specified, or prints the usage and returns null **/
    private static CommandLineProgram extractCommandLineProgram(final String[] args,
                                                                final Map<String, Supplier<CommandLineProgram>> programs,
                                                                final String commandLineName) {
        if (args.length < 1 || args[0].equals("-h")) {
            printUsage(programs, commandLineName, false);
        } else if (args[0].equals("--list-commands")) {
            printUsage(programs, commandLineName, true);
        } else if (programs.containsKey(args[0])) {
            return programs.get(args[0]).get();
        } else {
            printUsage(programs, commandLineName, false);
            log.error("'" + args[0] + "' is not a valid command. See " + commandLineName + " -h for the list of commands.");
        }
        return null;
    }

    private static void printUsage(final Map<String, Supplier<CommandLineProgram>> programs, final String commandLineName,
                                   final boolean commandListOnly) {
        final StringBuilder builder = new StringBuilder();
        if (!commandListOnly) {
            builder.append("USAGE: ").append(commandLineName).append(" <program name> [-h]\n\n");
            builder.append("Available Programs:\n");
        }

        /** Group CommandLinePrograms by CommandLineProgramGroup **/
        final Map<String, List<Class<?>>> programsByGroup = new TreeMap<>();
        final Map<String, CommandLineProgramGroup> groupsByName = new TreeMap<>();
        for (final Supplier<CommandLineProgram> supplier : programs.values()) {
            final Class<?> clazz = supplier.get().getClass();
            final CommandLineProgramProperties property = clazz.getAnnotation(CommandLineProgramProperties.class);
            if (null == property) {
                throw new RuntimeException(String.format("The class '%s' is missing the required CommandLineProgramProperties annotation.", clazz.getSimpleName()));
            }
            final CommandLineProgramGroup programGroup;
            try {
                programGroup = property.programGroup().getDeclaredConstructor().newInstance();
            } catch (final ReflectiveOperationException e) {
                throw new RuntimeException(e);
            }
            groupsByName.put(programGroup.getName(), programGroup);
            programsByGroup.computeIfAbsent(programGroup.getName(), k -> new ArrayList<>()).add(clazz);
        }

        for (final Map.Entry<String, List<Class<?>>> entry : programsByGroup.entrySet()) {
            final CommandLineProgramGroup programGroup = groupsByName.get(entry.getKey());
            if (!commandListOnly) {
                builder.append("--------------------------------------------------------------------------------------\n");
                builder.append(String.format("%-48s %-45s\n", programGroup.getName() + ":", programGroup.getDescription()));
            }
            final List<Class<?>> sortedClasses = new ArrayList<>(entry.getValue());
            Collections.sort(sortedClasses, Comparator.comparing(Class::getSimpleName));
            for (final Class<?> clazz : sortedClasses) {
                if (commandListOnly) {
                    builder.append(clazz.getSimpleName()).append("\n");
                } else {
                    final CommandLineProgramProperties property = clazz.getAnnotation(CommandLineProgramProperties.class);
                    builder.append(String.format("    %-45s%s\n", clazz.getSimpleName(), property.oneLineSummary()));
                }
            }
            if (!commandListOnly) builder.append("\n");
        }
        if (commandListOnly) {
            System.out.print(builder);
        } else {
            builder.append("--------------------------------------------------------------------------------------\n\n");
            System.err.print(builder);
        }
    }
}
