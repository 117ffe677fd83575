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

import org.descriptorj.core.Utils;

/**
 * Writes descriptor syntax trees back to text in canonical form. Hex is written in lowercase, hardened steps use
 * {@code h}, a hardener written after a multipath group is written on each of its alternatives, spaces the parser
 * skipped are dropped and bech32 addresses are lowercase. Parsing the canonical text yields an equal tree.
 */
public final class DescriptorSerializer {

    private DescriptorSerializer() { }

    /** Returns the canonical text of the given expression, without checksum. */
    public static String serialize(ScriptExpression expression) {
        StringBuilder sb = new StringBuilder();
        append(sb, expression);
        return sb.toString();
    }

    /** Returns the canonical text of the given expression followed by {@code #} and its checksum. */
    public static String serializeWithChecksum(ScriptExpression expression) {
        return DescriptorChecksum.addChecksum(serialize(expression));
    }

    /** Returns the canonical text of the given key expression. */
    public static String serialize(KeyExpression key) {
        StringBuilder sb = new StringBuilder();
        append(sb, key);
        return sb.toString();
    }

    private static void append(StringBuilder sb, ScriptExpression expression) {
        sb.append(expression.getType().functionName()).append('(');
        switch (expression.getType()) {
            case PK:
            case PKH:
            case WPKH:
            case COMBO:
                append(sb, ((KeyScriptExpression) expression).getKey());
                break;
            case SH:
            case WSH:
                append(sb, ((WrapperScriptExpression) expression).getInner());
                break;
            case MULTI:
            case SORTED_MULTI:
                MultisigScriptExpression multi = (MultisigScriptExpression) expression;
                sb.append(multi.getThreshold());
                for (KeyExpression key : multi.getKeys()) {
                    sb.append(',');
                    append(sb, key);
                }
                break;
            case ADDR:
                sb.append(((AddrScriptExpression) expression).getAddress());
                break;
            case RAW:
                sb.append(Utils.HEX.encode(((RawScriptExpression) expression).getProgram()));
                break;
            default:
                throw new IllegalStateException("Unknown expression type " + expression.getType());
        }
        sb.append(')');
    }

    private static void append(StringBuilder sb, KeyExpression key) {
        if (key.getOrigin() != null)
            sb.append(key.getOrigin());
        switch (key.getType()) {
            case RAW_PUBLIC_KEY:
                sb.append(((RawPublicKeyExpression) key).getKey().getPublicKeyAsHex());
                break;
            case RAW_PRIVATE_KEY:
                sb.append(((RawPrivateKeyExpression) key).getPrivateKey().toBase58());
                break;
            case EXTENDED_KEY:
                ExtendedKeyExpression extended = (ExtendedKeyExpression) key;
                sb.append(extended.getEncoded());
                for (DerivationStep step : extended.getPath())
                    sb.append('/').append(step);
                break;
            default:
                throw new IllegalStateException("Unknown key type " + key.getType());
        }
    }
}
