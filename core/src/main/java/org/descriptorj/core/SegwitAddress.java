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

package org.descriptorj.core;

import org.descriptorj.script.Script.ScriptType;

import java.util.Arrays;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * <p>Implementation of native segwit addresses. They are composed of two parts:</p>
 *
 * <ul>
 * <li>A human-readable part (HRP) which is a string the specifies the network. See
 * {@link NetworkParameters#getSegwitAddressHrp()}.</li>
 * <li>A data part, containing the witness version (encoded as an OP_N operator) and program (encoded by re-arranging
 * bits into groups of 5).</li>
 * </ul>
 *
 * <p>See <a href="https://github.com/bitcoin/bips/blob/master/bip-0173.mediawiki">BIP173</a> for details. Witness
 * version 1 and above use the bech32m checksum of
 * <a href="https://github.com/bitcoin/bips/blob/master/bip-0350.mediawiki">BIP350</a>.</p>
 */
public class SegwitAddress extends Address {
    public static final int WITNESS_PROGRAM_LENGTH_PKH = 20;
    public static final int WITNESS_PROGRAM_LENGTH_SH = 32;
    public static final int WITNESS_PROGRAM_LENGTH_TR = 32;
    public static final int WITNESS_PROGRAM_MIN_LENGTH = 2;
    public static final int WITNESS_PROGRAM_MAX_LENGTH = 40;

    private final int witnessVersion;

    private SegwitAddress(NetworkParameters params, int witnessVersion, byte[] witnessProgram)
            throws AddressFormatException {
        super(params, witnessProgram);
        if (witnessVersion < 0 || witnessVersion > 16)
            throw new AddressFormatException("Invalid script version: " + witnessVersion);
        if (witnessProgram.length < WITNESS_PROGRAM_MIN_LENGTH || witnessProgram.length > WITNESS_PROGRAM_MAX_LENGTH)
            throw new AddressFormatException.InvalidDataLength("Invalid length: " + witnessProgram.length);
        // Check script length for version 0
        if (witnessVersion == 0 && witnessProgram.length != WITNESS_PROGRAM_LENGTH_PKH
                && witnessProgram.length != WITNESS_PROGRAM_LENGTH_SH)
            throw new AddressFormatException.InvalidDataLength(
                    "Invalid length for address version 0: " + witnessProgram.length);
        this.witnessVersion = witnessVersion;
    }

    /**
     * Construct a {@link SegwitAddress} that represents the given witness program.
     */
    public static SegwitAddress fromProgram(NetworkParameters params, int witnessVersion, byte[] program)
            throws AddressFormatException {
        return new SegwitAddress(params, witnessVersion, program);
    }

    /**
     * Construct a {@link SegwitAddress} from its textual form.
     *
     * @throws AddressFormatException
     *             if something about the given bech32 address isn't right
     * @throws AddressFormatException.WrongNetwork
     *             if the human readable part doesn't belong to the given network
     */
    public static SegwitAddress fromBech32(NetworkParameters params, String bech32) throws AddressFormatException {
        Bech32.Bech32Data bechData = Bech32.decode(bech32);
        if (!bechData.hrp.equals(params.getSegwitAddressHrp()))
            throw new AddressFormatException.WrongNetwork(bechData.hrp);
        if (bechData.data.length < 1)
            throw new AddressFormatException.InvalidDataLength("Missing witness version");
        int witnessVersion = bechData.data[0];
        if (witnessVersion == 0 && bechData.encoding != Bech32.Encoding.BECH32)
            throw new AddressFormatException.InvalidChecksum("Witness version 0 requires bech32 encoding");
        if (witnessVersion != 0 && bechData.encoding != Bech32.Encoding.BECH32M)
            throw new AddressFormatException.InvalidChecksum("Witness version 1+ requires bech32m encoding");
        byte[] program = Bech32.convertBits(bechData.data, 1, bechData.data.length - 1, 5, 8, false);
        return new SegwitAddress(params, witnessVersion, program);
    }

    /**
     * Returns the witness version in decoded form. Only versions 0 and 1 are in use right now.
     */
    public int getWitnessVersion() {
        return witnessVersion;
    }

    /**
     * Returns the witness program in decoded form.
     */
    public byte[] getWitnessProgram() {
        return bytes;
    }

    @Override
    public byte[] getHash() {
        return getWitnessProgram();
    }

    /**
     * Get the type of output script that will be used for sending to the address. This is either
     * {@link ScriptType#P2WPKH}, {@link ScriptType#P2WSH} or {@link ScriptType#P2TR}. Programs of other
     * witness versions or lengths are future soft forks and have no known script type.
     */
    @Override
    public ScriptType getOutputScriptType() {
        int version = getWitnessVersion();
        if (version == 0) {
            int programLength = bytes.length;
            if (programLength == WITNESS_PROGRAM_LENGTH_PKH)
                return ScriptType.P2WPKH;
            checkArgument(programLength == WITNESS_PROGRAM_LENGTH_SH, programLength);
            return ScriptType.P2WSH;
        }
        if (version == 1 && bytes.length == WITNESS_PROGRAM_LENGTH_TR)
            return ScriptType.P2TR;
        return ScriptType.WITNESS_UNKNOWN;
    }

    public String toBech32() {
        byte[] programBytes = Bech32.convertBits(bytes, 0, bytes.length, 8, 5, true);
        byte[] data = new byte[programBytes.length + 1];
        data[0] = (byte) (witnessVersion & 0xff);
        System.arraycopy(programBytes, 0, data, 1, programBytes.length);
        Bech32.Encoding encoding = witnessVersion == 0 ? Bech32.Encoding.BECH32 : Bech32.Encoding.BECH32M;
        return Bech32.encode(encoding, params.getSegwitAddressHrp(), data);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SegwitAddress other = (SegwitAddress) o;
        return params.equals(other.params) && witnessVersion == other.witnessVersion
                && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(params, witnessVersion, Arrays.hashCode(bytes));
    }

    @Override
    public String toString() {
        return toBech32();
    }
}
