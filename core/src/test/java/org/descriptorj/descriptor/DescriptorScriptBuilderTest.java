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

import org.descriptorj.core.NetworkParameters;
import org.descriptorj.crypto.HDDerivationException;
import org.descriptorj.params.MainNetParams;
import org.descriptorj.params.TestNet3Params;
import org.descriptorj.script.Script;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class DescriptorScriptBuilderTest {
    private static final NetworkParameters MAINNET = MainNetParams.get();

    private static final String XPUB_1 =
            "xpub661MyMwAqRbcFtXgS5sYJABqqG9YLmC4Q1Rdap9gSE8NqtwybGhePY2gZ29ESFjqJoCu1Rupje8YtGqsefD265TMg7usUDFdp6W1EGMcet8";
    private static final String XPRV_1 =
            "xprv9s21ZrQH143K3QTDL4LXw2F7HEK3wJUD2nW2nRk4stbPy6cq3jPPqjiChkVvvNKmPGJxWUtg6LnF5kejMRNNU3TGtRBeJgk33yuGBxrMPHi";
    private static final String XPUB_2 =
            "xpub661MyMwAqRbcFW31YEwpkMuc5THy2PSt5bDMsktWQcFF8syAmRUapSCGu8ED9W6oDMSgv6Zz8idoc4a6mr8BDzTJY47LJhkJ8UB7WEGuduB";
    private static final String XPUB_2_0 =
            "xpub69H7F5d8KSRgmmdJg2KhpAK8SR3DjMwAdkxj3ZuxV27CprR9LgpeyGmXUbC6wb7ERfvrnKZjXoUmmDznezpbZb7ap6r1D3tgFxHmwMkQTPH";
    private static final String WIF_COMPRESSED = "L4rK1yDtCWekvXuE6oXD9jCYfFNV2cWRpVuPLBcCU2z8TrisoyY1";
    private static final String WIF_UNCOMPRESSED = "5KYZdUEo39z3FPrtuX2QbbwGnNP5zTd7yyr2SC1j299sBCnWjss";

    private final DescriptorParser parser = new DescriptorParser(MAINNET);
    private final DescriptorScriptBuilder builder = new DescriptorScriptBuilder(MAINNET);

    @Test
    public void singleKeyScripts() throws Exception {
        assertEquals("76a91406afd46bcdfd22ef94ac122aa11f241244a37ecc88ac",
                buildOne("pkh(02c6047f9441ed7d6d3045406e95c07cd85c778e4b8cef3ca7abac09b95c709ee5)"));
        assertEquals("2103a34b99f22c790c4e36b2b3c2c35a36db06226e41c692fc82b8b56ac1c540c5bdac",
                buildOne("pk(" + WIF_COMPRESSED + ")"));
        assertEquals("00149a1c78a507689f6f54b847ad1cef1e614ee23f1e", buildOne("wpkh(" + WIF_COMPRESSED + ")"));
        assertEquals("a91484ab21b1b2fd065d4504ff693d832434b6108d7b87",
                buildOne("sh(wpkh(" + WIF_COMPRESSED + "))"));
        assertEquals("00201863143c14c5166804bd19203356da136c985678cd4d27a1b8c6329604903262",
                buildOne("wsh(pk(0279be667ef9dcbbac55a06295ce870b07029bfcdb2dce28d959f2815b16f81798))"));
    }

    @Test
    public void comboCompressed() throws Exception {
        List<Script> scripts = builder.build(parser.parse("combo(" + WIF_COMPRESSED + ")"));
        assertEquals(4, scripts.size());
        assertEquals("2103a34b99f22c790c4e36b2b3c2c35a36db06226e41c692fc82b8b56ac1c540c5bdac",
                scripts.get(0).toString());
        assertEquals("76a9149a1c78a507689f6f54b847ad1cef1e614ee23f1e88ac", scripts.get(1).toString());
        assertEquals("00149a1c78a507689f6f54b847ad1cef1e614ee23f1e", scripts.get(2).toString());
        assertEquals("a91484ab21b1b2fd065d4504ff693d832434b6108d7b87", scripts.get(3).toString());
        assertEquals("3DnW8JGpPViEZdpqat8qky1zc26EKbXnmM", scripts.get(3).getToAddress(MAINNET).toString());
        assertNull(scripts.get(0).getToAddress(MAINNET));
    }

    @Test
    public void comboUncompressed() throws Exception {
        List<Script> scripts = builder.build(parser.parse("combo(" + WIF_UNCOMPRESSED + ")"));
        assertEquals(2, scripts.size());
        assertEquals("4104a34b99f22c790c4e36b2b3c2c35a36db06226e41c692fc82b8b56ac1c540c5bd"
                + "5b8dec5235a0fa8722476c7709c02559e3aa73aa03918ba2d492eea75abea235ac", scripts.get(0).toString());
        assertEquals("76a914b5bd079c4d57cc7fc28ecf8213a6b791625b818388ac", scripts.get(1).toString());
    }

    @Test
    public void rangedMultisig() throws Exception {
        DescriptorDocument document = parser.parse(
                "wsh(multi(1," + XPUB_2 + "/1/0/*," + XPUB_2_0 + "/0/0/*))#t2zpj2eu", true);
        String[][] expected = {
                {"002064969d8cdca2aa0bb72cfe88427612878db98a5f07f9a7ec6ec87b85e9f9208b",
                 "bc1qvjtfmrxu524qhdevl6yyyasjs7xmnzjlqlu60mrwepact60eyz9s9xjw0c"},
                {"00200e869c7fb066dc4879de9560c4615b1f2402efd1852170bab9f14b7759b807f1",
                 "bc1qp6rfclasvmwys7w7j4svgc2mrujq9m73s5shpw4e799hwkdcqlcsj464fw"},
                {"0020827e61124a4ab2c85e01f96749fab483b0c852de0d167035cea72660c9cd63a8",
                 "bc1qsflxzyj2f2evshspl9n5n745swcvs5k7p5t8qdww5unxpjwdvw5qx53ms4"},
        };
        for (int i = 0; i < expected.length; i++) {
            List<List<Script>> scripts = builder.build(document, i);
            assertEquals(1, scripts.size());
            Script script = scripts.get(0).get(0);
            assertEquals(expected[i][0], script.toString());
            assertEquals(expected[i][1], script.getToAddress(MAINNET).toString());
        }
    }

    @Test
    public void multipath() throws Exception {
        DescriptorDocument document = parser.parse("wpkh(" + XPUB_1 + "/<0;1>/*)");
        List<List<Script>> atZero = builder.build(document, 0);
        assertEquals(2, atZero.size());
        assertEquals("00140d1c9c02a7be9ba8b8842804feb961481ce6561b", atZero.get(0).get(0).toString());
        assertEquals("0014f09cb16010dc6d58dfafee3d3f9f027dc03be2c4", atZero.get(1).get(0).toString());

        List<List<Script>> atFive = builder.build(document, 5);
        assertEquals("bc1qc6xkeyekth5xe7lsey3qgxm55nypxe7dfpfawu",
                atFive.get(0).get(0).getToAddress(MAINNET).toString());
        assertEquals("bc1q6cqdvcx40upr5nzkm9kvn60dlu7l2jml6fa5k0",
                atFive.get(1).get(0).getToAddress(MAINNET).toString());
    }

    @Test
    public void sortedMulti() throws Exception {
        String sorted = "51210339a36013301597daef41fbe593a02cc513d0b55527ec2df1050e2e8ff49c85c2"
                + "2103cbcaa9c98c877a26977d00825c956a238e8dddfbd322cce4f74b0b5bd6ace4a752ae";
        String reversed = "512103cbcaa9c98c877a26977d00825c956a238e8dddfbd322cce4f74b0b5bd6ace4a7"
                + "210339a36013301597daef41fbe593a02cc513d0b55527ec2df1050e2e8ff49c85c252ae";
        assertEquals(sorted, buildOne("sortedmulti(1," + XPUB_2 + "," + XPUB_1 + ")"));
        assertEquals(sorted, buildOne("sortedmulti(1," + XPUB_1 + "," + XPUB_2 + ")"));
        assertEquals(reversed, buildOne("multi(1," + XPUB_2 + "," + XPUB_1 + ")"));
        assertEquals("a9143de1c2066215ce6bd4488311b7c7bacbe41ea16387",
                buildOne("sh(multi(1," + XPUB_1 + "," + XPUB_2 + "))"));
    }

    @Test
    public void privateAndPublicDerivationAgree() throws Exception {
        String expected = "76a914bef5a2f9a56a94aab12459f72ad9cf8cf19c7bbe88ac";
        assertEquals(expected, buildOne("pkh(" + XPRV_1 + "/0h/1)"));
        assertEquals(expected, buildOne("pkh(xpub6ASuArnXKPbfEwhqN6e3mwBcDTgzisQN1wXN9BJcM47sSikHjJf3UFHKkNAWbWMiGj7Wf5uMash7SyYq527Hqck2AxYysAA7xmALppuCkwQ)"));
    }

    @Test
    public void addrAndRaw() throws Exception {
        assertEquals("0014751e76e8199196d454941c45d1b3a323f1433bd6",
                buildOne("addr(bc1qw508d6qejxtdg4y5r3zarvary0c5xw7kv8f3t4)"));
        assertEquals("76a914751e76e8199196d454941c45d1b3a323f1433bd688ac",
                buildOne("addr(1BgGZ9tcN4rm9KBzDn7KprQz87SZ26SAMH)"));
        assertEquals("deadbeef", buildOne("raw(deadbeef)"));
    }

    @Test
    public void testnetAddresses() throws Exception {
        NetworkParameters testnet = TestNet3Params.get();
        DescriptorDocument document = new DescriptorParser(testnet).parse(
                "pkh(tpubD6NzVbkrYhZ4XgiXtGrdW5XDAPFCL9h7we1vwNCpn8tGbBcgfVYjXyhWo4E1xkh56hjod1RhGjxbaTLV3X4FyWuejifB9jusQ46QzG87VKp)");
        Script script = new DescriptorScriptBuilder(testnet).build(document).get(0);
        assertEquals("76a9143442193e1bb70916e914552172cd4e2dbc9df81188ac", script.toString());
        assertEquals("mkHGce7dctSxHgaWSSbmmrRWsZfzz7MxMk", script.getToAddress(testnet).toString());
    }

    @Test
    public void unresolvedDescriptors() throws Exception {
        try {
            builder.build(parser.parse("pkh(" + XPUB_1 + "/0/*)"));
            fail();
        } catch (DescriptorDerivationException x) {
            assertNull(x.getReason());
        }
        try {
            builder.build(parser.parse("pkh(" + XPUB_1 + "/<0;1>)"));
            fail();
        } catch (DescriptorDerivationException x) {
            assertNull(x.getReason());
        }
    }

    @Test
    public void hardenedStepFromPublicKey() throws Exception {
        try {
            builder.build(parser.parse("pkh(" + XPUB_1 + "/0h)"));
            fail();
        } catch (DescriptorDerivationException x) {
            assertEquals(HDDerivationException.Reason.HARDENED_FROM_PUBLIC, x.getReason());
        }
        try {
            builder.build(parser.parse("pkh(" + XPUB_1 + "/*h)"), 0);
            fail();
        } catch (DescriptorDerivationException x) {
            assertEquals(HDDerivationException.Reason.HARDENED_FROM_PUBLIC, x.getReason());
        }
    }

    private String buildOne(String descriptor) throws DescriptorException {
        List<Script> scripts = builder.build(parser.parse(descriptor));
        assertEquals(1, scripts.size());
        return scripts.get(0).toString();
    }
}
