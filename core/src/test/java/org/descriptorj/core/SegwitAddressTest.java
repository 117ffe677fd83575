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

import nl.jqno.equalsverifier.EqualsVerifier;
import nl.jqno.equalsverifier.Warning;
import org.descriptorj.params.MainNetParams;
import org.descriptorj.params.TestNet3Params;
import org.descriptorj.script.Script.ScriptType;
import org.junit.Test;

import static org.descriptorj.core.Utils.HEX;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class SegwitAddressTest {
    private static final MainNetParams MAINNET = MainNetParams.get();
    private static final TestNet3Params TESTNET = TestNet3Params.get();

    @Test
    public void equalsContract() {
        EqualsVerifier.forClass(SegwitAddress.class)
                .withPrefabValues(NetworkParameters.class, MAINNET, TESTNET)
                .suppress(Warning.NULL_FIELDS)
                .usingGetClass()
                .verify();
    }

    @Test
    public void example_p2wpkh_mainnet() {
        String bech32 = "bc1qw508d6qejxtdg4y5r3zarvary0c5xw7kv8f3t4";

        SegwitAddress address = SegwitAddress.fromBech32(MAINNET, bech32);

        assertEquals(MAINNET, address.getParameters());
        assertEquals(0, address.getWitnessVersion());
        assertEquals("751e76e8199196d454941c45d1b3a323f1433bd6", HEX.encode(address.getWitnessProgram()));
        assertEquals(ScriptType.P2WPKH, address.getOutputScriptType());
        assertEquals(bech32, address.toBech32());
    }

    @Test
    public void example_p2wsh_mainnet() {
        String bech32 = "bc1qrp33g0q5c5txsp9arysrx4k6zdkfs4nce4xj0gdcccefvpysxf3qccfmv3";

        SegwitAddress address = SegwitAddress.fromBech32(MAINNET, bech32);

        assertEquals("1863143c14c5166804bd19203356da136c985678cd4d27a1b8c6329604903262",
                HEX.encode(address.getWitnessProgram()));
        assertEquals(ScriptType.P2WSH, address.getOutputScriptType());
        assertEquals(bech32, address.toString());
    }

    @Test
    public void example_p2wpkh_testnet() {
        String bech32 = "tb1qw508d6qejxtdg4y5r3zarvary0c5xw7kxpjzsx";

        SegwitAddress address = SegwitAddress.fromBech32(TESTNET, bech32);

        assertEquals(TESTNET, address.getParameters());
        assertEquals("751e76e8199196d454941c45d1b3a323f1433bd6", HEX.encode(address.getWitnessProgram()));
        assertEquals(bech32, address.toBech32());
    }

    @Test
    public void example_p2tr_mainnet() {
        String bech32m = "bc1p0xlxvlhemja6c4dqv22uapctqupfhlxm9h8z3k2e72q4k9hcz7vqzk5jj0";

        SegwitAddress address = SegwitAddress.fromBech32(MAINNET, bech32m);

        assertEquals(1, address.getWitnessVersion());
        assertEquals("79be667ef9dcbbac55a06295ce870b07029bfcdb2dce28d959f2815b16f81798",
                HEX.encode(address.getWitnessProgram()));
        assertEquals(ScriptType.P2TR, address.getOutputScriptType());
        assertEquals(bech32m, address.toBech32());
    }

    @Test
    public void upperCaseIsAcceptedAndPrintedLowerCase() {
        SegwitAddress address = SegwitAddress.fromBech32(MAINNET, "BC1QW508D6QEJXTDG4Y5R3ZARVARY0C5XW7KV8F3T4");
        assertEquals("bc1qw508d6qejxtdg4y5r3zarvary0c5xw7kv8f3t4", address.toString());
        assertEquals(address, Address.fromString(MAINNET, "BC1QW508D6QEJXTDG4Y5R3ZARVARY0C5XW7KV8F3T4"));
    }

    @Test(expected = AddressFormatException.WrongNetwork.class)
    public void fromBech32_wrongNetwork() {
        SegwitAddress.fromBech32(MAINNET, "tb1qw508d6qejxtdg4y5r3zarvary0c5xw7kxpjzsx");
    }

    @Test(expected = AddressFormatException.InvalidChecksum.class)
    public void fromBech32_version0WithBech32m() {
        byte[] program = HEX.decode("751e76e8199196d454941c45d1b3a323f1433bd6");
        byte[] converted = Bech32.convertBits(program, 0, program.length, 8, 5, true);
        byte[] data = new byte[converted.length + 1];
        System.arraycopy(converted, 0, data, 1, converted.length);
        SegwitAddress.fromBech32(MAINNET, Bech32.encode(Bech32.Encoding.BECH32M, "bc", data));
    }

    @Test(expected = AddressFormatException.InvalidChecksum.class)
    public void fromBech32_badChecksum() {
        SegwitAddress.fromBech32(MAINNET, "bc1qw508d6qejxtdg4y5r3zarvary0c5xw7kv8f3t5");
    }

    @Test
    public void fromProgram_invalidLength() {
        try {
            SegwitAddress.fromProgram(MAINNET, 0, new byte[21]);
            fail();
        } catch (AddressFormatException.InvalidDataLength x) {
            // expected: version 0 programs are 20 or 32 bytes
        }
        try {
            SegwitAddress.fromProgram(MAINNET, 1, new byte[41]);
            fail();
        } catch (AddressFormatException.InvalidDataLength x) {
            // expected
        }
    }

    @Test
    public void unknownWitnessVersion() {
        SegwitAddress address = SegwitAddress.fromProgram(MAINNET, 2, new byte[16]);
        assertEquals(ScriptType.WITNESS_UNKNOWN, address.getOutputScriptType());
        assertEquals(address, SegwitAddress.fromBech32(MAINNET, address.toBech32()));
    }
}
