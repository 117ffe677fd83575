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

import org.junit.Test;

import java.math.BigInteger;
import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class Base58Test {
    @Test
    public void testEncode() {
        byte[] testbytes = "Hello World".getBytes();
        assertEquals("JxF12TrwUP45BMd", Base58.encode(testbytes));

        BigInteger bi = BigInteger.valueOf(3471844090L);
        assertEquals("16Ho7Hs", Base58.encode(bi.toByteArray()));

        byte[] zeroBytes1 = new byte[1];
        assertEquals("1", Base58.encode(zeroBytes1));

        byte[] zeroBytes7 = new byte[7];
        assertEquals("1111111", Base58.encode(zeroBytes7));

        // test empty encode
        assertEquals("", Base58.encode(new byte[0]));
    }

    @Test
    public void testEncodeChecked_address() {
        String encoded = Base58.encodeChecked(0, Utils.HEX.decode("751e76e8199196d454941c45d1b3a323f1433bd6"));
        assertEquals("1BgGZ9tcN4rm9KBzDn7KprQz87SZ26SAMH", encoded);
    }

    @Test
    public void testDecode() {
        byte[] testbytes = "Hello World".getBytes();
        byte[] actualbytes = Base58.decode("JxF12TrwUP45BMd");
        assertTrue(new String(actualbytes), Arrays.equals(testbytes, actualbytes));

        assertArrayEquals(new byte[1], Base58.decode("1"));
        assertArrayEquals(new byte[4], Base58.decode("1111"));

        // Now check we can correctly decode a case where the high bit of the first byte is not zero, so BigInteger
        // sign extension would otherwise add a byte.
        Base58.decode("93VYUMzRG9DdbRP72uQXjaWibbQwygnvaCu9DumcqDjGybD864T");

        assertEquals(0, Base58.decode("").length);
    }

    @Test(expected = AddressFormatException.InvalidCharacter.class)
    public void testDecode_invalidCharacter() {
        Base58.decode("This isn't valid base58");
    }

    @Test
    public void testDecodeChecked() {
        Base58.decodeChecked("4stwEBjT6FYyVV");

        // Now check we can correctly decode a case where the high bit of the first byte is not zero, so BigInteger
        // sign extension would otherwise add a byte.
        Base58.decodeChecked("93VYUMzRG9DdbRP72uQXjaWibbQwygnvaCu9DumcqDjGybD864T");
    }

    @Test(expected = AddressFormatException.InvalidChecksum.class)
    public void testDecodeChecked_invalidChecksum() {
        Base58.decodeChecked("4stwEBjT6FYyVW");
    }

    @Test(expected = AddressFormatException.InvalidDataLength.class)
    public void testDecodeChecked_shortInput() {
        Base58.decodeChecked("4s");
    }

    @Test
    public void testEncodeCheckedRoundTrip() {
        byte[] payload = Utils.HEX.decode("0488b21e00000000000000000000");
        assertArrayEquals(payload, Base58.decodeChecked(Base58.encodeChecked(payload)));
        try {
            Base58.encodeChecked(256, payload);
            fail();
        } catch (IllegalArgumentException x) {
            // expected
        }
    }
}
