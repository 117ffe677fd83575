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
import org.descriptorj.core.LegacyAddress;
import org.descriptorj.core.NetworkParameters;
import org.descriptorj.core.SegwitAddress;
import org.descriptorj.core.Utils;

import javax.annotation.Nullable;
import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>An output script: the program that locks coins sent to it. Instances are created by {@link ScriptBuilder} from
 * templates, or wrap bytes taken verbatim from a {@code raw()} descriptor, which need not be parseable.</p>
 *
 * <p>Scripts are immutable and compare equal when their programs are byte-identical.</p>
 */
public class Script {

    /** Enumeration of standard output script types. */
    public enum ScriptType {
        P2PK("pk"), // pay to pubkey
        P2PKH("pkh"), // pay to pubkey hash (aka pay to address)
        P2SH("sh"), // pay to script hash
        P2WPKH("wpkh"), // pay to witness pubkey hash
        P2WSH("wsh"), // pay to witness script hash
        P2TR("tr"), // pay to taproot
        WITNESS_UNKNOWN("witness_unknown"); // witness program of a version or length without a known meaning

        private final String id;

        ScriptType(String id) {
            this.id = id;
        }

        public String id() {
            return id;
        }
    }

    /** Max number of public keys allowed in a bare multisig output. */
    public static final int MAX_PUBKEYS_PER_MULTISIG = 20;

    private final byte[] program;

    /**
     * Construct a script that wraps the given program bytes. Nothing is parsed; non-standard and even malformed
     * programs are carried as they are.
     */
    public Script(byte[] programBytes) {
        this.program = Arrays.copyOf(checkNotNull(programBytes), programBytes.length);
    }

    Script(List<ScriptChunk> chunks) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        for (ScriptChunk chunk : chunks)
            chunk.write(bos);
        this.program = bos.toByteArray();
    }

    /** Returns the serialized program as a newly created byte array. */
    public byte[] getProgram() {
        return Arrays.copyOf(program, program.length);
    }

    /**
     * Get the {@link ScriptType}.
     * @return The script type, or null if the script is of unknown type
     */
    @Nullable
    public ScriptType getScriptType() {
        if (ScriptPattern.isP2PKH(this))
            return ScriptType.P2PKH;
        if (ScriptPattern.isP2PK(this))
            return ScriptType.P2PK;
        if (ScriptPattern.isP2SH(this))
            return ScriptType.P2SH;
        if (ScriptPattern.isP2WPKH(this))
            return ScriptType.P2WPKH;
        if (ScriptPattern.isP2WSH(this))
            return ScriptType.P2WSH;
        if (ScriptPattern.isP2TR(this))
            return ScriptType.P2TR;
        if (ScriptPattern.isWitnessProgram(this))
            return ScriptType.WITNESS_UNKNOWN;
        return null;
    }

    /**
     * Gets the destination address from this script, if it's in the required form. Pay-to-pubkey, bare multisig
     * and non-standard scripts have no address.
     *
     * @return the address, or null if this script has no address form
     */
    @Nullable
    public Address getToAddress(NetworkParameters params) {
        if (ScriptPattern.isP2PKH(this))
            return LegacyAddress.fromPubKeyHash(params, ScriptPattern.extractHashFromP2PKH(this));
        if (ScriptPattern.isP2SH(this))
            return LegacyAddress.fromScriptHash(params, ScriptPattern.extractHashFromP2SH(this));
        if (ScriptPattern.isP2WPKH(this) || ScriptPattern.isP2WSH(this))
            return SegwitAddress.fromProgram(params, 0, ScriptPattern.extractWitnessProgram(this));
        // version 0 programs of any other length are unspendable and have no address
        if (ScriptPattern.isWitnessProgram(this) && byteAt(0) != ScriptOpCodes.OP_0)
            return SegwitAddress.fromProgram(params, ScriptPattern.extractWitnessVersion(this),
                    ScriptPattern.extractWitnessProgram(this));
        return null;
    }

    int length() {
        return program.length;
    }

    int byteAt(int index) {
        return program[index] & 0xFF;
    }

    byte[] copyOfRange(int from, int to) {
        return Arrays.copyOfRange(program, from, to);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(program, ((Script) o).program);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(program);
    }

    /** Returns the program as lowercase hex. */
    @Override
    public String toString() {
        return Utils.HEX.encode(program);
    }
}
