/*
 * Copyright by the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.descriptorj.tools;

import com.google.common.base.Joiner;
import org.descriptorj.core.Address;
import org.descriptorj.core.AddressFormatException;
import org.descriptorj.core.NetworkParameters;
import org.descriptorj.crypto.ChildNumber;
import org.descriptorj.crypto.DeterministicKey;
import org.descriptorj.crypto.HDDerivationException;
import org.descriptorj.crypto.HDUtils;
import org.descriptorj.descriptor.DescriptorChecksum;
import org.descriptorj.descriptor.DescriptorDerivationException;
import org.descriptorj.descriptor.DescriptorDocument;
import org.descriptorj.descriptor.DescriptorException;
import org.descriptorj.descriptor.DescriptorParser;
import org.descriptorj.descriptor.DescriptorScriptBuilder;
import org.descriptorj.descriptor.DescriptorSemanticException;
import org.descriptorj.params.MainNetParams;
import org.descriptorj.params.TestNet3Params;
import org.descriptorj.script.Script;
import org.descriptorj.utils.BriefLogFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A command line tool for working with output script descriptors and extended keys.
 *
 * <p>Run with {@code --help} for the list of sub-commands. Exit codes: 0 on success, 1 for usage errors and input
 * that cannot be parsed or decoded, 2 for input that parses but is invalid or cannot be derived.</p>
 */
public class DescriptorTool {
    private static final Logger log = LoggerFactory.getLogger(DescriptorTool.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_INVALID_INPUT = 1;
    public static final int EXIT_INVALID_DESCRIPTOR = 2;

    static final String HELP_TEXT = Joiner.on('\n').join(
            "descriptor-tool: output script descriptors (BIP 380 to 389) and BIP 32 keys",
            "",
            "Usage:",
            "    derive-key {xpub|xprv} [--path PATH] [-]",
            "        Decodes an extended key, optionally derives the key at PATH below it, and prints",
            "        XPUB:XPRV. The XPRV part is empty for an extended public key. PATH is a sequence",
            "        of NUM or NUMh steps separated by '/', NUM in [0, 2^31-1]; 'H' and ''' may be",
            "        used instead of 'h' and a leading 'm/' or '/' is allowed.",
            "",
            "    key-expression {expr} [-]",
            "        Parses a key expression (optional [fingerprint/path] origin, a hex public key,",
            "        a WIF private key or an extended key with optional derivation path) and echoes it.",
            "",
            "    script-expression {expr} [--verify-checksum | --compute-checksum] [-]",
            "        Parses and validates a descriptor and prints it in canonical form with checksum.",
            "        --verify-checksum   requires a checksum, verifies it and prints OK.",
            "        --compute-checksum  ignores any checksum given and prints SCRIPT#CHECKSUM, with",
            "                            SCRIPT exactly as given.",
            "        The two options cannot be combined.",
            "",
            "    derive-script {expr} [--index N] [-]",
            "        Prints the output scripts of a descriptor as hex, each followed by its address",
            "        when it has one. Ranged descriptors are evaluated at index N (default 0); each",
            "        multipath alternative is printed in turn.",
            "",
            "Options:",
            "    -            read the inputs line by line from standard input instead of the",
            "                 arguments.",
            "    --testnet    use testnet keys and addresses (tpub, tprv, tb1...).",
            "    --verbose    log debugging output to standard error.",
            "    --help       print this text; takes precedence over everything else.",
            "",
            "Exit codes: 0 success, 1 usage, syntax, checksum or key encoding error,",
            "2 semantic or derivation error.");

    private enum Command {
        DERIVE_KEY("derive-key"),
        KEY_EXPRESSION("key-expression"),
        SCRIPT_EXPRESSION("script-expression"),
        DERIVE_SCRIPT("derive-script");

        private final String name;

        Command(String name) {
            this.name = name;
        }

        @Nullable
        static Command fromName(String name) {
            for (Command command : values()) {
                if (command.name.equals(name))
                    return command;
            }
            return null;
        }
    }

    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    public DescriptorTool(InputStream in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        if (Arrays.asList(args).contains("--verbose"))
            BriefLogFormatter.initVerbose();
        else
            BriefLogFormatter.initWithSilentLogging();
        int exitCode = new DescriptorTool(System.in, System.out, System.err).run(args);
        System.exit(exitCode);
    }

    /**
     * Runs the tool with the given arguments and returns its exit code.
     */
    public int run(String[] args) {
        for (String arg : args) {
            if (arg.equals("--help")) {
                out.println(HELP_TEXT);
                return EXIT_OK;
            }
        }

        Command command = null;
        List<String> inputs = new ArrayList<>();
        boolean readStdin = false;
        boolean testnet = false;
        boolean verifyChecksum = false;
        boolean computeChecksum = false;
        String path = null;
        String index = null;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-":
                    readStdin = true;
                    break;
                case "--testnet":
                    testnet = true;
                    break;
                case "--verbose":
                    break;
                case "--verify-checksum":
                    verifyChecksum = true;
                    break;
                case "--compute-checksum":
                    computeChecksum = true;
                    break;
                case "--path":
                case "--index":
                    if (i + 1 >= args.length)
                        return usage("Missing value after flag '" + arg + "'");
                    if ((arg.equals("--path") ? path : index) != null)
                        return usage("Flag '" + arg + "' can only be given once");
                    if (arg.equals("--path"))
                        path = args[++i];
                    else
                        index = args[++i];
                    break;
                default:
                    if (arg.startsWith("--"))
                        return usage("Unknown flag '" + arg + "'");
                    if (command == null) {
                        command = Command.fromName(arg);
                        if (command == null)
                            return usage("Unknown sub-command '" + arg + "'");
                    } else {
                        inputs.add(arg);
                    }
            }
        }
        if (command == null)
            return usage("No sub-command given");
        if (path != null && command != Command.DERIVE_KEY)
            return usage("--path only applies to derive-key");
        if (index != null && command != Command.DERIVE_SCRIPT)
            return usage("--index only applies to derive-script");
        if ((verifyChecksum || computeChecksum) && command != Command.SCRIPT_EXPRESSION)
            return usage("--verify-checksum and --compute-checksum only apply to script-expression");
        if (verifyChecksum && computeChecksum)
            return usage("--verify-checksum and --compute-checksum cannot be combined");

        if (readStdin) {
            try {
                inputs = readLines();
            } catch (IOException x) {
                err.println("Cannot read standard input: " + x.getMessage());
                return EXIT_INVALID_INPUT;
            }
        }
        if (inputs.isEmpty())
            return usage("No input given. Provide an argument, or '-' to read from standard input");

        NetworkParameters params = testnet ? TestNet3Params.get() : MainNetParams.get();
        for (String input : inputs) {
            int result;
            switch (command) {
                case DERIVE_KEY:
                    result = deriveKey(params, input, path);
                    break;
                case KEY_EXPRESSION:
                    result = keyExpression(params, input);
                    break;
                case SCRIPT_EXPRESSION:
                    result = scriptExpression(params, input, verifyChecksum, computeChecksum);
                    break;
                case DERIVE_SCRIPT:
                    result = deriveScript(params, input, index);
                    break;
                default:
                    throw new IllegalStateException("Unknown command " + command);
            }
            if (result != EXIT_OK)
                return result;
        }
        return EXIT_OK;
    }

    private List<String> readLines() throws IOException {
        List<String> lines = new ArrayList<>();
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line;
        while ((line = reader.readLine()) != null) {
            if (!line.isEmpty())
                lines.add(line);
        }
        return lines;
    }

    private int usage(String message) {
        err.println(message);
        err.println("Run with --help for usage.");
        return EXIT_INVALID_INPUT;
    }

    private int deriveKey(NetworkParameters params, String input, @Nullable String path) {
        DeterministicKey key;
        try {
            key = DeterministicKey.deserializeB58(input.trim(), params);
        } catch (AddressFormatException x) {
            err.println("Invalid extended key: " + x.getMessage());
            return EXIT_INVALID_INPUT;
        }
        List<ChildNumber> childNumbers;
        try {
            childNumbers = path == null ? new ArrayList<ChildNumber>() : HDUtils.parsePath(path);
        } catch (HDDerivationException x) {
            err.println("Invalid path: " + x.getMessage());
            return EXIT_INVALID_INPUT;
        }
        try {
            key = key.derive(childNumbers);
        } catch (HDDerivationException x) {
            err.println("Cannot derive " + HDUtils.formatPath(childNumbers) + ": " + x.getMessage());
            return EXIT_INVALID_DESCRIPTOR;
        }
        String xprv = key.hasPrivKey() ? key.serializePrivB58(params) : "";
        out.println(key.serializePubB58(params) + ":" + xprv);
        return EXIT_OK;
    }

    private int keyExpression(NetworkParameters params, String input) {
        try {
            new DescriptorParser(params).parseKeyExpression(input);
        } catch (DescriptorException x) {
            return report(x);
        }
        out.println(input);
        return EXIT_OK;
    }

    private int scriptExpression(NetworkParameters params, String input, boolean verifyChecksum,
                                 boolean computeChecksum) {
        DescriptorParser parser = new DescriptorParser(params);
        try {
            if (computeChecksum) {
                int hash = input.indexOf('#');
                String script = hash < 0 ? input : input.substring(0, hash);
                parser.parse(script);
                out.println(DescriptorChecksum.addChecksum(script));
            } else if (verifyChecksum) {
                parser.parse(input, true);
                out.println("OK");
            } else {
                out.println(parser.parse(input));
            }
        } catch (DescriptorException x) {
            return report(x);
        }
        return EXIT_OK;
    }

    private int deriveScript(NetworkParameters params, String input, @Nullable String indexText) {
        int index = 0;
        if (indexText != null) {
            try {
                index = Integer.parseInt(indexText);
            } catch (NumberFormatException x) {
                return usage("Invalid index '" + indexText + "'");
            }
            if (index < 0)
                return usage("Index must not be negative: " + index);
        }
        try {
            DescriptorDocument document = new DescriptorParser(params).parse(input);
            List<List<Script>> branches = new DescriptorScriptBuilder(params).build(document, index);
            for (List<Script> scripts : branches) {
                for (Script script : scripts) {
                    Address address = script.getToAddress(params);
                    out.println(address != null ? script + " " + address : script.toString());
                }
            }
        } catch (DescriptorException x) {
            return report(x);
        }
        return EXIT_OK;
    }

    private int report(DescriptorException x) {
        log.debug("Rejected input", x);
        err.println(x.getMessage());
        if (x instanceof DescriptorSemanticException || x instanceof DescriptorDerivationException)
            return EXIT_INVALID_DESCRIPTOR;
        return EXIT_INVALID_INPUT;
    }
}
