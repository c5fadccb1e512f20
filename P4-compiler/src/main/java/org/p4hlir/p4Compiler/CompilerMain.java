/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.p4hlir.p4Compiler;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import org.p4hlir.p4Compiler.compiler.CompilerOptions;
import org.p4hlir.p4Compiler.compiler.P4Compiler;
import org.p4hlir.p4Compiler.compiler.errors.CompilerMessages;

/** Main entry point of the P4 dependency analyzer. */
public class CompilerMain {
    final CompilerOptions options;

    CompilerMain() {
        this.options = new CompilerOptions();
    }

    void usage(JCommander commander) {
        // JCommander mistakenly prints this as default value
        // if it manages to parse it partially.
        this.options.ioOptions.loggingLevel.clear();
        commander.usage();
    }

    int parseOptions(String[] argv) {
        JCommander commander = JCommander.newBuilder()
                .addObject(this.options)
                .build();
        commander.setProgramName("p4-graphs");
        try {
            commander.parse(argv);
        } catch (ParameterException ex) {
            if (this.options.help) {
                this.usage(commander);
                return 1;
            }
            System.err.println(ex.getMessage());
            return 1;
        }
        if (this.options.help) {
            this.usage(commander);
            return 1;
        }
        return 0;
    }

    /** Run the analyzer, return the messages produced. */
    CompilerMessages run() {
        P4Compiler compiler = new P4Compiler(this.options);
        return compiler.compile();
    }

    public static CompilerMessages execute(String... argv) {
        CompilerMain main = new CompilerMain();
        int exitCode = main.parseOptions(argv);
        if (exitCode != 0) {
            // return empty messages
            CompilerMessages result = new CompilerMessages();
            result.setExitCode(exitCode);
            return result;
        }
        return main.run();
    }

    public static void main(String[] argv) {
        CompilerMessages messages = execute(argv);
        messages.show(System.err);
        System.exit(messages.exitCode);
    }
}
