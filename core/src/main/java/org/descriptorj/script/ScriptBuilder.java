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

import org.descriptorj.core.Address;
import org.descriptorj.core.ECKey;
import org.descriptorj.core.LegacyAddress;
import org.descriptorj.core.SegwitAddress;
import org.descriptorj.core.Sha256Hash;
import org.descriptorj.core.Utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static org.descriptorj.script.ScriptOpCodes.*;

/**
 * <p>Tools for the construction of commonly used script types. You don't normally need this as it's hidden behind
 * convenience methods on {@link Script}, but they are useful when making complex contracts.</p>
 */
public class ScriptBuilder {
    private final List<ScriptChunk> chunks;

    /** Creates a fresh ScriptBuilder with an empty program. */
    public ScriptBuilder() {
        chunks = new ArrayList<>();
    }

    /** Adds the given chunk to the end of the program */
    public ScriptBuilder addChunk(ScriptChunk chunk) {
        chunks.add(chunk);
        return this;
    }

    /** Adds the given opcode to the end of the program. */
    public ScriptBuilder op(int opcode) {
        checkArgument(opcode > OP_PUSHDATA4);
        return addChunk(new ScriptChunk(opcode, null));
    }

    /** Adds a copy of the given byte array as a data element (i.e. PUSHDATA) at the end of the program. */
    public ScriptBuilder data(byte[] data) {
        if (data.length == 0)
            return smallNum(0);
        // implements BIP62
        byte[] copy = Arrays.copyOf(data, data.length);
        int opcode;
        if (data.length == 1) {
            byte b = data[0];
            if (b >= 1 && b <= 16)
                return smallNum(b);
            opcode = 1;
        } else if (data.length < OP_PUSHDATA1) {
            opcode = data.length;
        } else if (data.length < 256) {
            opcode = OP_PUSHDATA1;
        } else if (data.length < 65536) {
            opcode = OP_PUSHDATA2;
        } else {
            throw new IllegalArgumentException("Unimplemented");
        }
        return addChunk(new ScriptChunk(opcode, copy));
    }

    /**
     * Adds the given number to the end of the program. Automatically uses
     * shortest encoding possible.
     */
    public ScriptBuilder number(long num) {
        if (num >= 0 && num <= 16)
            return smallNum((int) num);
        return bigNum(num);
    }

    /**
     * Adds the given number as a OP_N opcode to the end of the program.
     * Only handles values 0-16 inclusive.
     */
    public ScriptBuilder smallNum(int num) {
        checkArgument(num >= 0, "Cannot encode negative numbers with smallNum");
        checkArgument(num <= 16, "Cannot encode numbers larger than 16 with smallNum");
        if (num == 0)
            return addChunk(new ScriptChunk(OP_0, new byte[0]));
        return addChunk(new ScriptChunk(encodeToOpN(num), null));
    }

    /**
     * Adds the given number as a push data chunk, in the minimal little endian sign-magnitude encoding that script
     * numbers use.
     */
    protected ScriptBuilder bigNum(long num) {
        checkArgument(num != 0, "zero is pushed with smallNum");
        List<Byte> result = new ArrayList<>();
        boolean neg = num < 0;
        long absvalue = Math.abs(num);
        while (absvalue != 0) {
            result.add((byte) (absvalue & 0xff));
            absvalue >>= 8;
        }
        if ((result.get(result.size() - 1) & 0x80) != 0) {
            // The most significant byte is used for the sign, so an extra byte is needed.
            result.add((byte) (neg ? 0x80 : 0));
        } else if (neg) {
            int last = result.size() - 1;
            result.set(last, (byte) (result.get(last) | 0x80));
        }
        byte[] data = new byte[result.size()];
        for (int i = 0; i < data.length; i++)
            data[i] = result.get(i);
        checkState(data.length < OP_PUSHDATA1);
        return addChunk(new ScriptChunk(data.length, data));
    }

    /** Creates a new immutable Script based on the state of the builder. */
    public Script build() {
        return new Script(chunks);
    }

    /** Creates a scriptPubKey that encodes payment to the given address. */
    public static Script createOutputScript(Address to) {
        if (to instanceof LegacyAddress) {
            LegacyAddress legacy = (LegacyAddress) to;
            return legacy.p2sh ? createP2SHOutputScript(legacy.getHash()) : createP2PKHOutputScript(legacy.getHash());
        } else if (to instanceof SegwitAddress) {
            SegwitAddress segwit = (SegwitAddress) to;
            return new ScriptBuilder().smallNum(segwit.getWitnessVersion()).data(segwit.getWitnessProgram()).build();
        } else {
            throw new IllegalStateException("Cannot handle " + to);
        }
    }

    /** Creates a scriptPubKey that encodes payment to the given raw public key. */
    public static Script createP2PKOutputScript(byte[] pubKey) {
        return new ScriptBuilder().data(pubKey).op(OP_CHECKSIG).build();
    }

    /** Creates a scriptPubKey that encodes payment to the given raw public key. */
    public static Script createP2PKOutputScript(ECKey pubKey) {
        return createP2PKOutputScript(pubKey.getPubKey());
    }

    /**
     * Creates a scriptPubKey that sends to the given public key hash.
     */
    public static Script createP2PKHOutputScript(byte[] hash) {
        checkArgument(hash.length == LegacyAddress.LENGTH);
        ScriptBuilder builder = new ScriptBuilder();
        builder.op(OP_DUP);
        builder.op(OP_HASH160);
        builder.data(hash);
        builder.op(OP_EQUALVERIFY);
        builder.op(OP_CHECKSIG);
        return builder.build();
    }

    /**
     * Creates a scriptPubKey that sends to the given public key.
     */
    public static Script createP2PKHOutputScript(ECKey key) {
        return createP2PKHOutputScript(key.getPubKeyHash());
    }

    /**
     * Creates a segwit scriptPubKey that sends to the given public key hash.
     */
    public static Script createP2WPKHOutputScript(byte[] hash) {
        checkArgument(hash.length == SegwitAddress.WITNESS_PROGRAM_LENGTH_PKH);
        return new ScriptBuilder().smallNum(0).data(hash).build();
    }

    /**
     * Creates a segwit scriptPubKey that sends to the given public key.
     */
    public static Script createP2WPKHOutputScript(ECKey key) {
        checkArgument(key.isCompressed());
        return createP2WPKHOutputScript(key.getPubKeyHash());
    }

    /**
     * Creates a scriptPubKey that sends to the given script hash. Read
     * <a href="https://github.com/bitcoin/bips/blob/master/bip-0016.mediawiki">BIP 16</a> to learn more about this
     * kind of script.
     */
    public static Script createP2SHOutputScript(byte[] hash) {
        checkArgument(hash.length == 20);
        return new ScriptBuilder().op(OP_HASH160).data(hash).op(OP_EQUAL).build();
    }

    /**
     * Creates a scriptPubKey for a given redeem script.
     */
    public static Script createP2SHOutputScript(Script redeemScript) {
        byte[] hash = Utils.sha256hash160(redeemScript.getProgram());
        return createP2SHOutputScript(hash);
    }

    /**
     * Creates a segwit scriptPubKey that sends to the given script hash.
     */
    public static Script createP2WSHOutputScript(byte[] hash) {
        checkArgument(hash.length == SegwitAddress.WITNESS_PROGRAM_LENGTH_SH);
        return new ScriptBuilder().smallNum(0).data(hash).build();
    }

    /**
     * Creates a segwit scriptPubKey for the given witness script.
     */
    public static Script createP2WSHOutputScript(Script witnessScript) {
        byte[] hash = Sha256Hash.hash(witnessScript.getProgram());
        return createP2WSHOutputScript(hash);
    }

    /**
     * Creates a program that requires at least N of the given keys to sign, using OP_CHECKMULTISIG. The keys are
     * pushed in the order given.
     */
    public static Script createMultiSigOutputScript(int threshold, List<ECKey> pubkeys) {
        checkArgument(threshold > 0);
        checkArgument(threshold <= pubkeys.size());
        checkArgument(pubkeys.size() <= Script.MAX_PUBKEYS_PER_MULTISIG);
        ScriptBuilder builder = new ScriptBuilder();
        builder.number(threshold);
        for (ECKey key : pubkeys) {
            builder.data(key.getPubKey());
        }
        builder.number(pubkeys.size());
        builder.op(OP_CHECKMULTISIG);
        return builder.build();
    }
}
