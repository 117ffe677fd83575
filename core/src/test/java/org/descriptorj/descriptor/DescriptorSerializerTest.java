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

import org.descriptorj.params.MainNetParams;
import org.junit.Test;

import static org.junit.Assert.*;

public class DescriptorSerializerTest {
    private static final String XPUB_1 =
            "xpub661MyMwAqRbcFtXgS5sYJABqqG9YLmC4Q1Rdap9gSE8NqtwybGhePY2gZ29ESFjqJoCu1Rupje8YtGqsefD265TMg7usUDFdp6W1EGMcet8";
    private static final String XPUB_2 =
            "xpub661MyMwAqRbcFW31YEwpkMuc5THy2PSt5bDMsktWQcFF8syAmRUapSCGu8ED9W6oDMSgv6Zz8idoc4a6mr8BDzTJY47LJhkJ8UB7WEGuduB";

    private final DescriptorParser parser = new DescriptorParser(MainNetParams.get());

    @Test
    public void canonicalForms() throws Exception {
        assertCanonical("pkh(" + XPUB_1 + ")#vm4xc4ed", "pkh(   " + XPUB_1 + ")");
        assertCanonical("multi(2," + XPUB_1 + "," + XPUB_2 + ")#f43yex6t",
                "multi(2, " + XPUB_1 + ", " + XPUB_2 + ")#5jlj4shz");
        assertCanonical("pkh([deadbeef/0h/1h]" + XPUB_1 + "/2h/*h)#6uzjm0qu",
                "pkh([deadbeef/0'/1']" + XPUB_1 + "/2'/*')");
        assertCanonical("wpkh(" + XPUB_1 + "/<0h;1h>/*)#m2rse6m6", "wpkh(" + XPUB_1 + "/<0;1>h/*)");
        assertCanonical("wpkh(" + XPUB_1 + "/<0;1>/*)#3zpr76xn", "wpkh(" + XPUB_1 + "/<0;1>/*)");
        assertCanonical("raw(deadbeef)#89f8spxm", "raw(DEA D BEEF)");
        assertCanonical("addr(bc1qw508d6qejxtdg4y5r3zarvary0c5xw7kv8f3t4)#uyjndxcw",
                "addr(BC1QW508D6QEJXTDG4Y5R3ZARVARY0C5XW7KV8F3T4)");
        assertCanonical("sh(wpkh(L4rK1yDtCWekvXuE6oXD9jCYfFNV2cWRpVuPLBcCU2z8TrisoyY1))#0qtndeve",
                "sh( wpkh( L4rK1yDtCWekvXuE6oXD9jCYfFNV2cWRpVuPLBcCU2z8TrisoyY1 ) )");
        assertCanonical("pk(0279be667ef9dcbbac55a06295ce870b07029bfcdb2dce28d959f2815b16f81798)#gn28ywm7",
                "pk(0279BE667EF9DCBBAC55A06295CE870B07029BFCDB2DCE28D959F2815B16F81798)");
    }

    @Test
    public void canonicalFormIsStable() throws Exception {
        String[] descriptors = {
                "pkh([deadbeef/0'/1']" + XPUB_1 + "/2'/*')",
                "sh(wsh(sortedmulti(1, " + XPUB_1 + "/<0;1>/*, " + XPUB_2 + "/<1;0>/*)))",
                "combo(5KYZdUEo39z3FPrtuX2QbbwGnNP5zTd7yyr2SC1j299sBCnWjss)",
                "raw(DEADBEEF)",
        };
        for (String descriptor : descriptors) {
            DescriptorDocument document = parser.parse(descriptor);
            DescriptorDocument reparsed = parser.parse(document.toString(), true);
            assertEquals(descriptor, document, reparsed);
            assertEquals(descriptor, document.toString(), reparsed.toString());
        }
    }

    @Test
    public void keyExpressions() throws Exception {
        KeyExpression key = parser.parseKeyExpression("[DEADBEEF/0'/1h]" + XPUB_1 + "/0/*'");
        assertEquals("[deadbeef/0h/1h]" + XPUB_1 + "/0/*h", DescriptorSerializer.serialize(key));
        assertEquals("[deadbeef/0h/1h]", key.getOrigin().toString());
        assertEquals(DescriptorSerializer.serialize(key), key.toString());
    }

    @Test
    public void withoutChecksum() throws Exception {
        DescriptorDocument document = parser.parse("raw(deadbeef)#89f8spxm");
        assertEquals("raw(deadbeef)", document.toStringWithoutChecksum());
        assertEquals("raw(deadbeef)", document.getRoot().toString());
        assertEquals("raw(deadbeef)#89f8spxm", DescriptorSerializer.serializeWithChecksum(document.getRoot()));
    }

    private void assertCanonical(String expected, String input) throws DescriptorException {
        assertEquals(input, expected, parser.parse(input).toString());
    }
}
