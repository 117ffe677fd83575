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

import org.descriptorj.core.LegacyAddress;
import org.descriptorj.core.SegwitAddress;

import static org.descriptorj.script.ScriptOpCodes.*;

/**
 * This is a Script pattern matcher with some typical script patterns
 */
public class ScriptPattern {

    private ScriptPattern() { }

    /**
     * Returns true if this script is of the form {@code DUP HASH160 <pubkey hash> EQUALVERIFY CHECKSIG}, ie, payment to an
     * address like {@code 1VayNert3x1KzbpzMGt2qdqrAThiRovi8}. This form was originally intended for the case where you wish
     * to send somebody money with a written code because their node is offline, but over time has become the standard
     * way to make payments due to the short and recognizable base58 form addresses come in.
     */
    public static boolean isP2PKH(Script script) {
        return script.length() == 25
                && script.byteAt(0) == OP_DUP
                && script.byteAt(1) == OP_HASH160
                && script.byteAt(2) == LegacyAddress.LENGTH
                && script.byteAt(23) == OP_EQUALVERIFY
                && script.byteAt(24) == OP_CHECKSIG;
    }

    /**
     * Extract the pubkey hash from a P2PKH scriptPubKey. It's important that the script is in the correct form, so you
     * will want to guard calls to this method with {@link #isP2PKH(Script)}.
     */
    public static byte[] extractHashFromP2PKH(Script script) {
        return script.copyOfRange(3, 23);
    }

    /**
     * <p>
     * Whether or not this is a scriptPubKey representing a P2SH output. In such outputs, the logic that controls
     * reclamation is not actually in the output at all. Instead there's just a hash, and it's up to the spending input
     * to provide a program matching that hash.
     * </p>
     */
    public static boolean isP2SH(Script script) {
        return script.length() == 23
                && script.byteAt(0) == OP_HASH160
                && script.byteAt(1) == LegacyAddress.LENGTH
                && script.byteAt(22) == OP_EQUAL;
    }

    /**
     * Extract the script hash from a P2SH scriptPubKey. It's important that the script is in the correct form, so you
     * will want to guard calls to this method with {@link #isP2SH(Script)}.
     */
    public static byte[] extractHashFromP2SH(Script script) {
        return script.copyOfRange(2, 22);
    }

    /**
     * Returns true if this script is of the form {@code <pubkey> OP_CHECKSIG}. This form was originally intended for
     * transactions where the peers talked to each other directly via TCP/IP, but has fallen out of favor with time due
     * to that mode of operation being susceptible to man-in-the-middle attacks.
     */
    public static boolean isP2PK(Script script) {
        int length = script.length();
        if (length == 35)
            return script.byteAt(0) == 33 && script.byteAt(34) == OP_CHECKSIG;
        if (length == 67)
            return script.byteAt(0) == 65 && script.byteAt(66) == OP_CHECKSIG;
        return false;
    }

    /**
     * Returns true if this script is a witness program: a version opcode ({@code OP_0} .. {@code OP_16}) followed by
     * a single push of 2 to 40 bytes.
     */
    public static boolean isWitnessProgram(Script script) {
        int length = script.length();
        if (length < 4 || length > 42)
            return false;
        int version = script.byteAt(0);
        if (version != OP_0 && (version < OP_1 || version > OP_16))
            return false;
        int pushLength = script.byteAt(1);
        return pushLength + 2 == length && pushLength >= SegwitAddress.WITNESS_PROGRAM_MIN_LENGTH
                && pushLength <= SegwitAddress.WITNESS_PROGRAM_MAX_LENGTH;
    }

    /** Extract the witness version of a witness program. Guard calls with {@link #isWitnessProgram(Script)}. */
    public static int extractWitnessVersion(Script script) {
        return decodeFromOpN(script.byteAt(0));
    }

    /** Extract the program of a witness program. Guard calls with {@link #isWitnessProgram(Script)}. */
    public static byte[] extractWitnessProgram(Script script) {
        return script.copyOfRange(2, script.length());
    }

    /**
     * Returns true if this script is of the form {@code OP_0 <hash>} and hash is 20 bytes long. This can only be a
     * P2WPKH scriptPubKey. This script type was introduced with segwit.
     */
    public static boolean isP2WPKH(Script script) {
        return isWitnessProgram(script) && script.byteAt(0) == OP_0
                && script.length() == 2 + SegwitAddress.WITNESS_PROGRAM_LENGTH_PKH;
    }

    /**
     * Returns true if this script is of the form {@code OP_0 <hash>} and hash is 32 bytes long. This can only be a
     * P2WSH scriptPubKey. This script type was introduced with segwit.
     */
    public static boolean isP2WSH(Script script) {
        return isWitnessProgram(script) && script.byteAt(0) == OP_0
                && script.length() == 2 + SegwitAddress.WITNESS_PROGRAM_LENGTH_SH;
    }

    /**
     * Returns true if this script is of the form {@code OP_1 <pubkey>} and the key is 32 bytes long.
     */
    public static boolean isP2TR(Script script) {
        return isWitnessProgram(script) && script.byteAt(0) == OP_1
                && script.length() == 2 + SegwitAddress.WITNESS_PROGRAM_LENGTH_TR;
    }
}
