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

import org.descriptorj.script.Script;

/**
 * Checks the rules a well-formed descriptor tree must satisfy beyond its grammar:
 *
 * <ul>
 * <li>{@code sh} only at the top level; {@code wsh} at the top level or inside {@code sh}; {@code wpkh} at the top
 * level or inside {@code sh}; {@code combo}, {@code addr} and {@code raw} only at the top level.</li>
 * <li>{@code 1 <= k <= n <= 20} for {@code multi} and {@code sortedmulti}.</li>
 * <li>Keys under {@code wpkh} and {@code wsh} are compressed.</li>
 * <li>All multipath steps of a descriptor have the same number of alternatives.</li>
 * </ul>
 */
public final class DescriptorValidator {

    /** Where an expression sits, which decides what it may be. */
    private enum Context {
        TOP,
        P2SH,
        P2WSH
    }

    private DescriptorValidator() { }

    /**
     * @throws DescriptorSemanticException describing the first rule the tree breaks
     */
    public static void validate(ScriptExpression root) throws DescriptorSemanticException {
        validate(root, Context.TOP);
        int multipathCount = 1;
        for (KeyExpression key : root.getKeys()) {
            int count = key.getMultipathCount();
            if (count == 1)
                continue;
            if (multipathCount != 1 && count != multipathCount)
                throw new DescriptorSemanticException("Multipath steps have " + multipathCount + " and " + count
                        + " alternatives, all multipath steps must have the same number");
            multipathCount = count;
        }
    }

    private static void validate(ScriptExpression expression, Context context) throws DescriptorSemanticException {
        String name = expression.getType().functionName();
        switch (expression.getType()) {
            case PK:
            case PKH:
                if (context == Context.P2WSH)
                    requireCompressed(((KeyScriptExpression) expression).getKey(), name);
                break;
            case WPKH:
                if (context == Context.P2WSH)
                    throw new DescriptorSemanticException("wpkh() is not allowed inside wsh()");
                requireCompressed(((KeyScriptExpression) expression).getKey(), name);
                break;
            case COMBO:
            case ADDR:
            case RAW:
                if (context != Context.TOP)
                    throw new DescriptorSemanticException(name + "() can only be used at the top level");
                break;
            case SH:
                if (context != Context.TOP)
                    throw new DescriptorSemanticException("sh() can only be used at the top level");
                validate(((WrapperScriptExpression) expression).getInner(), Context.P2SH);
                break;
            case WSH:
                if (context == Context.P2WSH)
                    throw new DescriptorSemanticException("wsh() can only be used at the top level or inside sh()");
                validate(((WrapperScriptExpression) expression).getInner(), Context.P2WSH);
                break;
            case MULTI:
            case SORTED_MULTI:
                MultisigScriptExpression multi = (MultisigScriptExpression) expression;
                int n = multi.getKeys().size();
                int k = multi.getThreshold();
                if (n < 1 || n > Script.MAX_PUBKEYS_PER_MULTISIG)
                    throw new DescriptorSemanticException(name + "() takes between 1 and "
                            + Script.MAX_PUBKEYS_PER_MULTISIG + " keys, got " + n);
                if (k < 1 || k > n)
                    throw new DescriptorSemanticException(name + "() threshold " + k
                            + " is not between 1 and the number of keys " + n);
                if (context == Context.P2WSH) {
                    for (KeyExpression key : multi.getKeys())
                        requireCompressed(key, name);
                }
                break;
            default:
                throw new IllegalStateException("Unknown expression type " + expression.getType());
        }
    }

    private static void requireCompressed(KeyExpression key, String name) throws DescriptorSemanticException {
        if (!key.isCompressed())
            throw new DescriptorSemanticException("Uncompressed key " + key + " is not allowed in segwit " + name
                    + "()");
    }
}
