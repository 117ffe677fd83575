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
import static org.junit.Assert.*;

public class LegacyAddressTest {
    private static final NetworkParameters TESTNET = TestNet3Params.get();
    private static final NetworkParameters MAINNET = MainNetParams.get();

    @Test
    public void equalsContract() {
        EqualsVerifier.forClass(LegacyAddress.class)
                .withPrefabValues(NetworkParameters.class, MAINNET, TESTNET)
                .suppress(Warning.NULL_FIELDS)
                .usingGetClass()
                .verify();
    }

    @Test
    public void stringification() {
        LegacyAddress a = LegacyAddress.fromPubKeyHash(MAINNET, HEX.decode("751e76e8199196d454941c45d1b3a323f1433bd6"));
        assertEquals("1BgGZ9tcN4rm9KBzDn7KprQz87SZ26SAMH", a.toString());
        assertEquals(ScriptType.P2PKH, a.getOutputScriptType());
        assertEquals(0, a.getVersion());

        LegacyAddress b = LegacyAddress.fromPubKeyHash(TESTNET, HEX.decode("751e76e8199196d454941c45d1b3a323f1433bd6"));
        assertEquals("mrCDrCybB6J1vRfbwM5hemdJz73FwDBC8r", b.toString());

        LegacyAddress c = LegacyAddress.fromScriptHash(MAINNET, HEX.decode("84ab21b1b2fd065d4504ff693d832434b6108d7b"));
        assertEquals("3DnW8JGpPViEZdpqat8qky1zc26EKbXnmM", c.toString());
        assertEquals(ScriptType.P2SH, c.getOutputScriptType());
        assertEquals(5, c.getVersion());
    }

    @Test
    public void decoding() {
        LegacyAddress a = LegacyAddress.fromBase58(MAINNET, "1BgGZ9tcN4rm9KBzDn7KprQz87SZ26SAMH");
        assertEquals("751e76e8199196d454941c45d1b3a323f1433bd6", HEX.encode(a.getHash()));
        assertFalse(a.p2sh);

        LegacyAddress b = LegacyAddress.fromBase58(MAINNET, "3DnW8JGpPViEZdpqat8qky1zc26EKbXnmM");
        assertEquals("84ab21b1b2fd065d4504ff693d832434b6108d7b", HEX.encode(b.getHash()));
        assertTrue(b.p2sh);

        assertEquals(a, Address.fromString(MAINNET, "1BgGZ9tcN4rm9KBzDn7KprQz87SZ26SAMH"));
    }

    @Test
    public void errorPaths() {
        // Check what happens if we try and decode garbage.
        try {
            LegacyAddress.fromBase58(MAINNET, "this is not a valid address!");
            fail();
        } catch (AddressFormatException.WrongNetwork e) {
            fail();
        } catch (AddressFormatException e) {
            // Success.
        }

        // Check the empty case.
        try {
            LegacyAddress.fromBase58(MAINNET, "");
            fail();
        } catch (AddressFormatException.WrongNetwork e) {
            fail();
        } catch (AddressFormatException e) {
            // Success.
        }

        // Check the case of a mismatched network.
        try {
            LegacyAddress.fromBase58(TESTNET, "1BgGZ9tcN4rm9KBzDn7KprQz87SZ26SAMH");
            fail();
        } catch (AddressFormatException.WrongNetwork e) {
            // Success.
        }
    }

    @Test(expected = AddressFormatException.InvalidDataLength.class)
    public void wrongHashLength() {
        LegacyAddress.fromPubKeyHash(MAINNET, new byte[19]);
    }
}
