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


package org.descriptorj.script;

import com.google.common.collect.ImmutableMap;

import java.util.Locale;
import java.util.Map;

/**
 * Various constants that define the assembly-like scripting language that forms part of the Bitcoin protocol.
 * Only the operations that output script templates use are listed. Also provides a method to convert them to a
 * string.
 */
public class ScriptOpCodes {
    // push value
    public static final int OP_0 = 0x00; // push empty vector
    public static final int OP_FALSE = OP_0;
    public static final int OP_PUSHDATA1 = 0x4c;
    public static final int OP_PUSHDATA2 = 0x4d;
    public static final int OP_PUSHDATA4 = 0x4e;
    public static final int OP_1NEGATE = 0x4f;
    public static final int OP_1 = 0x51;
    public static final int OP_TRUE = OP_1;
    public static final int OP_16 = 0x60;

    // stack ops
    public static final int OP_DUP = 0x76;

    // bit logic
    public static final int OP_EQUAL = 0x87;
    public static final int OP_EQUALVERIFY = 0x88;

    // crypto
    public static final int OP_HASH160 = 0xa9;
    public static final int OP_CHECKSIG = 0xac;
    public static final int OP_CHECKMULTISIG = 0xae;

    private static final Map<Integer, String> opCodeNameMap = ImmutableMap.<Integer, String>builder()
        .put(OP_0, "0")
        .put(OP_PUSHDATA1, "PUSHDATA1")
        .put(OP_PUSHDATA2, "PUSHDATA2")
        .put(OP_PUSHDATA4, "PUSHDATA4")
        .put(OP_1NEGATE, "1NEGATE")
        .put(OP_DUP, "DUP")
        .put(OP_EQUAL, "EQUAL")
        .put(OP_EQUALVERIFY, "EQUALVERIFY")
        .put(OP_HASH160, "HASH160")
        .put(OP_CHECKSIG, "CHECKSIG")
        .put(OP_CHECKMULTISIG, "CHECKMULTISIG")
        .build();

    private ScriptOpCodes() { }

    /**
     * Converts the given OpCode into a string (eg "0", "PUSHDATA", or "NON_OP(10)")
     */
    public static String getOpCodeName(int opcode) {
        if (opcode >= OP_1 && opcode <= OP_16)
            return Integer.toString(opcode - OP_1 + 1);
        if (opCodeNameMap.containsKey(opcode))
            return opCodeNameMap.get(opcode);
        return String.format(Locale.US, "NON_OP(%d)", opcode);
    }

    /** Returns the small number an {@code OP_0} .. {@code OP_16} opcode pushes. */
    public static int decodeFromOpN(int opcode) {
        if (opcode == OP_0)
            return 0;
        if (opcode < OP_1 || opcode > OP_16)
            throw new IllegalArgumentException("decodeFromOpN called on non OP_N opcode: " + opcode);
        return opcode + 1 - OP_1;
    }

    /** Returns the {@code OP_0} .. {@code OP_16} opcode that pushes the given small number. */
    public static int encodeToOpN(int value) {
        if (value < 0 || value > 16)
            throw new IllegalArgumentException("encodeToOpN called for " + value + " which we cannot encode in an opcode.");
        if (value == 0)
            return OP_0;
        return value - 1 + OP_1;
    }
}
