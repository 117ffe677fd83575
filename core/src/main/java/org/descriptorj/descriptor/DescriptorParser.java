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


package org.descriptorj.descriptor;

import com.google.common.base.Splitter;
import org.descriptorj.core.Address;
import org.descriptorj.core.AddressFormatException;
import org.descriptorj.core.Base58;
import org.descriptorj.core.DumpedPrivateKey;
import org.descriptorj.core.ECKey;
import org.descriptorj.core.NetworkParameters;
import org.descriptorj.core.Utils;
import org.descriptorj.crypto.ChildNumber;
import org.descriptorj.crypto.DeterministicKey;
import org.descriptorj.descriptor.DescriptorSyntaxException.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>Parses output script descriptors into {@link DescriptorDocument}s. The grammar is</p>
 *
 * <pre>
 * DESCRIPTOR := SCRIPT ('#' CHECKSUM)?
 * SCRIPT     := NAME '(' ARGS ')'
 * KEY        := ('[' FINGERPRINT ('/' STEP)* ']')? KEYBODY ('/' PATHSTEP)*
 * PATHSTEP   := NUM HARDENER? | '*' HARDENER? | '&lt;' NUM HARDENER? (';' NUM HARDENER?)+ '&gt;' HARDENER?
 * HARDENER   := 'h' | '\''
 * </pre>
 *
 * <p>Spaces around arguments are skipped. Script functions nest at most {@value #MAX_NESTING_DEPTH} levels deep,
 * which is what {@code sh(wsh(multi(...)))} needs, and the parser refuses to descend further. Keys are decoded for
 * the network given to the constructor.</p>
 *
 * <p>Errors report the character offset they were found at. Instances are immutable and can be shared between
 * threads.</p>
 */
public class DescriptorParser {
    private static final Logger log = LoggerFactory.getLogger(DescriptorParser.class);

    /** Deepest nesting of script functions the parser accepts. */
    public static final int MAX_NESTING_DEPTH = 3;

    private static final Splitter PATH_SPLITTER = Splitter.on('/');
    private static final Splitter MULTIPATH_SPLITTER = Splitter.on(';');

    private final NetworkParameters params;

    public DescriptorParser(NetworkParameters params) {
        this.params = checkNotNull(params);
    }

    public NetworkParameters getParams() {
        return params;
    }

    /**
     * Parses and validates a descriptor. A checksum is verified when present but not required.
     *
     * @throws DescriptorSyntaxException if the text does not follow the grammar
     * @throws DescriptorChecksumException if the checksum is malformed or does not match
     * @throws KeyEncodingException if a key, fingerprint, address or hex string cannot be decoded
     * @throws DescriptorSemanticException if the tree breaks one of the rules of {@link DescriptorValidator}
     */
    public DescriptorDocument parse(String text) throws DescriptorException {
        return parse(text, false);
    }

    /**
     * Parses and validates a descriptor.
     *
     * @param requireChecksum if true, a descriptor without checksum is rejected
     */
    public DescriptorDocument parse(String text, boolean requireChecksum) throws DescriptorException {
        DescriptorDocument document = parseWithoutValidation(text, requireChecksum);
        DescriptorValidator.validate(document.getRoot());
        log.debug("Parsed descriptor {}", document);
        return document;
    }

    /**
     * Parses a descriptor without applying the rules of {@link DescriptorValidator}.
     */
    DescriptorDocument parseWithoutValidation(String text, boolean requireChecksum) throws DescriptorException {
        checkCharacters(text);
        int hash = text.indexOf('#');
        String body = hash < 0 ? text : text.substring(0, hash);
        String checksum = null;
        if (hash >= 0) {
            checksum = text.substring(hash + 1);
            checkChecksum(body, checksum, hash + 1);
        } else if (requireChecksum) {
            throw new DescriptorChecksumException("Missing checksum", text.length());
        }
        Reader reader = new Reader(body);
        ScriptExpression root = parseScript(reader, 1);
        reader.skipSpaces();
        if (!reader.atEnd()) {
            if (reader.peek() == ')')
                throw new DescriptorSyntaxException(Kind.UNBALANCED_PARENTHESES, "Unmatched ')'", reader.pos);
            throw new DescriptorSyntaxException(Kind.UNEXPECTED_TOKEN, "Unexpected text after the descriptor",
                    reader.pos, "end of descriptor");
        }
        return new DescriptorDocument(root, checksum);
    }

    /**
     * Parses a lone key expression such as {@code [d34db33f/44h/0h/0h]xpub.../1/*}.
     *
     * @throws DescriptorSyntaxException if the origin or the path is malformed
     * @throws KeyEncodingException if the key or the fingerprint cannot be decoded
     */
    public KeyExpression parseKeyExpression(String text) throws DescriptorException {
        checkCharacters(text);
        if (text.indexOf('#') >= 0)
            throw new DescriptorSyntaxException(Kind.UNEXPECTED_TOKEN, "Key expressions have no checksum",
                    text.indexOf('#'), "key");
        KeyExpression key = parseKey(text, 0);
        log.debug("Parsed key expression {}", key);
        return key;
    }

    private static void checkCharacters(String text) throws DescriptorSyntaxException {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (DescriptorChecksum.INPUT_CHARSET.indexOf(c) < 0)
                throw new DescriptorSyntaxException(Kind.INVALID_CHARACTER,
                        String.format(Locale.US, "Invalid character U+%04X", (int) c), i);
        }
    }

    private static void checkChecksum(String body, String checksum, int offset) throws DescriptorChecksumException {
        if (checksum.length() != DescriptorChecksum.LENGTH)
            throw new DescriptorChecksumException("Checksum must be " + DescriptorChecksum.LENGTH
                    + " characters long, got " + checksum.length(), offset);
        for (int i = 0; i < checksum.length(); i++) {
            if (DescriptorChecksum.CHECKSUM_CHARSET.indexOf(checksum.charAt(i)) < 0)
                throw new DescriptorChecksumException("Invalid checksum character '" + checksum.charAt(i) + "'",
                        offset + i);
        }
        if (!DescriptorChecksum.verify(body, checksum))
            throw new DescriptorChecksumException("Checksum mismatch, expected "
                    + DescriptorChecksum.create(body) + " but found " + checksum, offset);
    }

    private ScriptExpression parseScript(Reader reader, int depth) throws DescriptorException {
        reader.skipSpaces();
        int start = reader.pos;
        while (!reader.atEnd() && isNameChar(reader.peek()))
            reader.pos++;
        String name = reader.text.substring(start, reader.pos);
        if (name.isEmpty())
            throw new DescriptorSyntaxException(Kind.UNEXPECTED_TOKEN, "Expected a script expression", start,
                    "function name");
        if (reader.atEnd() || reader.peek() != '(')
            throw new DescriptorSyntaxException(Kind.UNEXPECTED_TOKEN, "Expected '(' after " + name, reader.pos,
                    "'('");
        ScriptExpression.Type type = ScriptExpression.Type.fromFunctionName(name);
        if (type == null)
            throw new DescriptorSyntaxException(Kind.UNKNOWN_FUNCTION, "Unknown function " + name + "()", start);
        reader.pos++;

        ScriptExpression expression;
        switch (type) {
            case PK:
            case PKH:
            case WPKH:
            case COMBO: {
                Argument argument = readArgument(reader, "key");
                expression = new KeyScriptExpression(type, parseKey(argument.text, argument.offset));
                break;
            }
            case SH:
            case WSH: {
                reader.skipSpaces();
                if (depth >= MAX_NESTING_DEPTH)
                    throw new DescriptorSyntaxException(Kind.NESTING_TOO_DEEP, "Script expressions nest deeper than "
                            + MAX_NESTING_DEPTH + " levels", reader.pos);
                expression = new WrapperScriptExpression(type, parseScript(reader, depth + 1));
                break;
            }
            case MULTI:
            case SORTED_MULTI: {
                Argument argument = readArgument(reader, "threshold");
                int threshold = parseThreshold(argument);
                List<KeyExpression> keys = new ArrayList<>();
                reader.skipSpaces();
                while (!reader.atEnd() && reader.peek() == ',') {
                    reader.pos++;
                    Argument key = readArgument(reader, "key");
                    keys.add(parseKey(key.text, key.offset));
                    reader.skipSpaces();
                }
                expression = new MultisigScriptExpression(type, threshold, keys);
                break;
            }
            case ADDR: {
                Argument argument = readArgument(reader, "address");
                try {
                    expression = new AddrScriptExpression(Address.fromString(params, argument.text));
                } catch (AddressFormatException x) {
                    throw new KeyEncodingException("Invalid address " + argument.text + ": " + x.getMessage(),
                            argument.offset, x);
                }
                break;
            }
            case RAW: {
                Argument argument = readArgument(reader, "hex script");
                String hex = argument.text.replace(" ", "");
                if (!Utils.isHexString(hex))
                    throw new KeyEncodingException("Invalid hex script " + argument.text, argument.offset);
                expression = new RawScriptExpression(Utils.HEX.decode(hex.toLowerCase(Locale.ROOT)));
                break;
            }
            default:
                throw new IllegalStateException("Unknown expression type " + type);
        }
        closeParenthesis(reader);
        return expression;
    }

    private static boolean isNameChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static void closeParenthesis(Reader reader) throws DescriptorSyntaxException {
        reader.skipSpaces();
        if (reader.atEnd())
            throw new DescriptorSyntaxException(Kind.UNBALANCED_PARENTHESES, "Missing ')'", reader.pos, "')'");
        if (reader.peek() != ')')
            throw new DescriptorSyntaxException(Kind.UNEXPECTED_TOKEN, "Unexpected '" + reader.peek() + "'",
                    reader.pos, "')'");
        reader.pos++;
    }

    /**
     * Reads the text up to the next {@code ,} or {@code )}, without the spaces around it.
     */
    private static Argument readArgument(Reader reader, String expected) throws DescriptorSyntaxException {
        int start = reader.pos;
        while (!reader.atEnd() && reader.peek() != ',' && reader.peek() != ')' && reader.peek() != '(')
            reader.pos++;
        if (reader.atEnd())
            throw new DescriptorSyntaxException(Kind.UNBALANCED_PARENTHESES, "Missing ')'", reader.pos, "')'");
        if (reader.peek() == '(')
            throw new DescriptorSyntaxException(Kind.UNEXPECTED_TOKEN, "Unexpected '('", reader.pos, expected);
        int end = reader.pos;
        while (start < end && reader.text.charAt(start) == ' ')
            start++;
        while (end > start && reader.text.charAt(end - 1) == ' ')
            end--;
        if (start == end)
            throw new DescriptorSyntaxException(Kind.UNEXPECTED_TOKEN, "Missing " + expected, start, expected);
        return new Argument(reader.text.substring(start, end), start);
    }

    private static int parseThreshold(Argument argument) throws DescriptorSyntaxException {
        String text = argument.text;
        if (text.length() > 10 || !isDigits(text))
            throw new DescriptorSyntaxException(Kind.UNEXPECTED_TOKEN, "Invalid threshold " + text,
                    argument.offset, "threshold");
        long value = Long.parseLong(text);
        if (value > Integer.MAX_VALUE)
            throw new DescriptorSyntaxException(Kind.UNEXPECTED_TOKEN, "Threshold out of range: " + text,
                    argument.offset, "threshold");
        return (int) value;
    }

    private KeyExpression parseKey(String text, int offset) throws DescriptorException {
        KeyOrigin origin = null;
        int bodyStart = 0;
        if (text.startsWith("[")) {
            int close = text.indexOf(']');
            if (close < 0)
                throw new DescriptorSyntaxException(Kind.UNEXPECTED_TOKEN, "Key origin is missing ']'",
                        offset + text.length(), "']'");
            origin = parseOrigin(text.substring(1, close), offset + 1);
            bodyStart = close + 1;
        }
        String body = text.substring(bodyStart);
        int bodyOffset = offset + bodyStart;
        int bracket = firstIndexOf(body, '[', ']');
        if (bracket >= 0)
            throw new DescriptorSyntaxException(Kind.UNEXPECTED_TOKEN, "Key origin must come first and only once",
                    bodyOffset + bracket, "key");
        int slash = body.indexOf('/');
        String keyText = slash < 0 ? body : body.substring(0, slash);
        if (keyText.isEmpty())
            throw new KeyEncodingException("Missing key", bodyOffset);

        if (Utils.isHexString(keyText)) {
            rejectPath(slash, bodyOffset);
            return new RawPublicKeyExpression(origin, decodePublicKey(keyText, bodyOffset));
        }
        byte[] decoded;
        try {
            decoded = Base58.decodeChecked(keyText);
        } catch (AddressFormatException x) {
            throw new KeyEncodingException("Invalid key " + keyText + ": " + x.getMessage(), bodyOffset, x);
        }
        if (decoded.length == DeterministicKey.SERIALIZED_LENGTH) {
            DeterministicKey key;
            try {
                key = DeterministicKey.deserialize(params, decoded);
            } catch (AddressFormatException x) {
                throw new KeyEncodingException("Invalid extended key " + keyText + ": " + x.getMessage(),
                        bodyOffset, x);
            }
            List<DerivationStep> path = slash < 0 ? new ArrayList<DerivationStep>()
                    : parsePath(body.substring(slash + 1), bodyOffset + slash + 1);
            return new ExtendedKeyExpression(origin, key, keyText, path);
        }
        rejectPath(slash, bodyOffset);
        try {
            return new RawPrivateKeyExpression(origin, DumpedPrivateKey.fromBase58(params, keyText));
        } catch (AddressFormatException x) {
            throw new KeyEncodingException("Invalid WIF private key " + keyText + ": " + x.getMessage(),
                    bodyOffset, x);
        }
    }

    private static int firstIndexOf(String text, char a, char b) {
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == a || text.charAt(i) == b)
                return i;
        }
        return -1;
    }

    private static void rejectPath(int slash, int bodyOffset) throws DescriptorSyntaxException {
        if (slash >= 0)
            throw new DescriptorSyntaxException(Kind.UNEXPECTED_TOKEN,
                    "Only extended keys can be followed by a derivation path", bodyOffset + slash, "end of key");
    }

    private static ECKey decodePublicKey(String hex, int offset) throws KeyEncodingException {
        if (hex.length() != 66 && hex.length() != 130)
            throw new KeyEncodingException("Public key must be 33 or 65 bytes, got " + hex.length() / 2, offset);
        try {
            return ECKey.fromPublicOnly(Utils.HEX.decode(hex.toLowerCase(Locale.ROOT)));
        } catch (IllegalArgumentException x) {
            throw new KeyEncodingException("Invalid public key " + hex + ": " + x.getMessage(), offset, x);
        }
    }

    private static KeyOrigin parseOrigin(String content, int offset) throws DescriptorException {
        List<String> parts = PATH_SPLITTER.splitToList(content);
        String fingerprint = parts.get(0);
        if (fingerprint.length() != 8 || !Utils.isHexString(fingerprint))
            throw new KeyEncodingException("Fingerprint must be 8 hex characters, got " + fingerprint, offset);
        List<ChildNumber> path = new ArrayList<>();
        int partOffset = offset + fingerprint.length() + 1;
        for (String part : parts.subList(1, parts.size())) {
            if (part.startsWith("*") || part.startsWith("<"))
                throw new DescriptorSyntaxException(Kind.INVALID_PATH_STEP,
                        "Key origin paths can only contain fixed steps", partOffset);
            path.add(parseChildNumber(part, partOffset));
            partOffset += part.length() + 1;
        }
        return new KeyOrigin((int) Long.parseLong(fingerprint, 16), path);
    }

    private static List<DerivationStep> parsePath(String pathText, int offset) throws DescriptorSyntaxException {
        List<DerivationStep> steps = new ArrayList<>();
        boolean seenMultipath = false;
        int partOffset = offset;
        for (String part : PATH_SPLITTER.split(pathText)) {
            if (!steps.isEmpty() && steps.get(steps.size() - 1).getType() == DerivationStep.Type.WILDCARD)
                throw new DescriptorSyntaxException(Kind.INVALID_PATH_STEP, "A wildcard can only be the last step",
                        partOffset - 1);
            if (part.startsWith("*")) {
                String hardener = part.substring(1);
                if (hardener.isEmpty())
                    steps.add(DerivationStep.wildcard(false));
                else if (isHardener(hardener))
                    steps.add(DerivationStep.wildcard(true));
                else
                    throw new DescriptorSyntaxException(Kind.INVALID_PATH_STEP, "Invalid wildcard " + part,
                            partOffset);
            } else if (part.startsWith("<")) {
                if (seenMultipath)
                    throw new DescriptorSyntaxException(Kind.INVALID_PATH_STEP,
                            "A key can only have one multipath step", partOffset);
                steps.add(parseMultipath(part, partOffset));
                seenMultipath = true;
            } else {
                steps.add(DerivationStep.fixed(parseChildNumber(part, partOffset)));
            }
            partOffset += part.length() + 1;
        }
        return steps;
    }

    private static DerivationStep parseMultipath(String part, int offset) throws DescriptorSyntaxException {
        int close = part.indexOf('>');
        if (close < 0)
            throw new DescriptorSyntaxException(Kind.INVALID_PATH_STEP, "Multipath step is missing '>'", offset, "'>'");
        String suffix = part.substring(close + 1);
        if (!suffix.isEmpty() && !isHardener(suffix))
            throw new DescriptorSyntaxException(Kind.INVALID_PATH_STEP, "Invalid text after multipath step: " + suffix,
                    offset + close + 1);
        boolean hardenAll = !suffix.isEmpty();
        List<ChildNumber> alternatives = new ArrayList<>();
        Set<ChildNumber> seen = new HashSet<>();
        int alternativeOffset = offset + 1;
        for (String alternative : MULTIPATH_SPLITTER.split(part.substring(1, close))) {
            ChildNumber childNumber = parseChildNumber(alternative, alternativeOffset);
            if (hardenAll)
                childNumber = new ChildNumber(childNumber.num(), true);
            if (!seen.add(childNumber))
                throw new DescriptorSyntaxException(Kind.INVALID_PATH_STEP,
                        "Duplicate multipath alternative " + childNumber, alternativeOffset);
            alternatives.add(childNumber);
            alternativeOffset += alternative.length() + 1;
        }
        if (alternatives.size() < 2)
            throw new DescriptorSyntaxException(Kind.INVALID_PATH_STEP,
                    "A multipath step needs at least two alternatives", offset);
        return DerivationStep.multipath(alternatives);
    }

    private static ChildNumber parseChildNumber(String step, int offset) throws DescriptorSyntaxException {
        if (step.isEmpty())
            throw new DescriptorSyntaxException(Kind.INVALID_PATH_STEP, "Empty path step", offset, "number");
        char last = step.charAt(step.length() - 1);
        if (last == 'H')
            throw new DescriptorSyntaxException(Kind.INVALID_PATH_STEP,
                    "Hardened steps are marked with h or ', not H", offset + step.length() - 1);
        boolean hardened = isHardener(String.valueOf(last));
        String digits = hardened ? step.substring(0, step.length() - 1) : step;
        if (digits.isEmpty() || digits.length() > 10 || !isDigits(digits))
            throw new DescriptorSyntaxException(Kind.INVALID_PATH_STEP, "Invalid path step " + step, offset,
                    "number");
        long value = Long.parseLong(digits);
        if (value > Integer.MAX_VALUE)
            throw new DescriptorSyntaxException(Kind.INVALID_PATH_STEP, "Path step out of range: " + step, offset);
        return new ChildNumber((int) value, hardened);
    }

    private static boolean isHardener(String s) {
        return s.equals("h") || s.equals("'");
    }

    private static boolean isDigits(String s) {
        if (s.isEmpty())
            return false;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) < '0' || s.charAt(i) > '9')
                return false;
        }
        return true;
    }

    /** Position in the text being parsed. */
    private static final class Reader {
        final String text;
        int pos;

        Reader(String text) {
            this.text = text;
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        char peek() {
            return text.charAt(pos);
        }

        void skipSpaces() {
            while (!atEnd() && peek() == ' ')
                pos++;
        }
    }

    /** An argument with its offset in the descriptor. */
    private static final class Argument {
        final String text;
        final int offset;

        Argument(String text, int offset) {
            this.text = text;
            this.offset = offset;
        }
    }
}
