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


package org.descriptorj.tools;

import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.*;

public class DescriptorToolTest {
    private static final String XPUB_1 =
            "xpub661MyMwAqRbcFtXgS5sYJABqqG9YLmC4Q1Rdap9gSE8NqtwybGhePY2gZ29ESFjqJoCu1Rupje8YtGqsefD265TMg7usUDFdp6W1EGMcet8";
    private static final String XPUB_2 =
            "xpub661MyMwAqRbcFW31YEwpkMuc5THy2PSt5bDMsktWQcFF8syAmRUapSCGu8ED9W6oDMSgv6Zz8idoc4a6mr8BDzTJY47LJhkJ8UB7WEGuduB";
    private static final String XPUB_2_0 =
            "xpub69H7F5d8KSRgmmdJg2KhpAK8SR3DjMwAdkxj3ZuxV27CprR9LgpeyGmXUbC6wb7ERfvrnKZjXoUmmDznezpbZb7ap6r1D3tgFxHmwMkQTPH";
    private static final String XPUB_0H_1_2H =
            "xpub6D4BDPcP2GT577Vvch3R8wDkScZWzQzMMUm3PWbmWvVJrZwQY4VUNgqFJPMM3No2dFDFGTsxxpG5uJh7n7epu4trkrX7x7DogT5Uv6fcLW5";
    private static final String XPRV_0H_1_2H =
            "xprv9z4pot5VBttmtdRTWfWQmoH1taj2axGVzFqSb8C9xaxKymcFzXBDptWmT7FwuEzG3ryjH4ktypQSAewRiNMjANTtpgP4mLTj34bhnZX7UiM";
    private static final String XPUB_0H_1_2H_2_1000000000 =
            "xpub6H1LXWLaKsWFhvm6RVpEL9P4KfRZSW7abD2ttkWP3SSQvnyA8FSVqNTEcYFgJS2UaFcxupHiYkro49S8yGasTvXEYBVPamhGW6cFJodrTHy";
    private static final String XPRV_0H_1_2H_2_1000000000 =
            "xprvA41z7zogVVwxVSgdKUHDy1SKmdb533PjDz7J6N6mV6uS3ze1ai8FHa8kmHScGpWmj4WggLyQjgPie1rFSruoUihUZREPSL39UNdE3BBDu76";

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    private int runWithStdin(String stdin, String... args) {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        DescriptorTool tool = new DescriptorTool(new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true), new PrintStream(err, true));
        return tool.run(args);
    }

    private int run(String... args) {
        return runWithStdin("", args);
    }

    private String out() {
        return new String(out.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private String err() {
        return new String(err.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void help() {
        assertEquals(DescriptorTool.EXIT_OK, run("--help"));
        assertTrue(out().startsWith("descriptor-tool"));
        assertEquals(DescriptorTool.EXIT_OK, run("derive-key", "garbage", "--help"));
        assertEquals(DescriptorTool.EXIT_OK, run("bogus", "--help"));
    }

    @Test
    public void usageErrors() {
        assertEquals(DescriptorTool.EXIT_INVALID_INPUT, run());
        assertEquals(DescriptorTool.EXIT_INVALID_INPUT, run("bogus", "x"));
        assertTrue(err().contains("bogus"));
        assertEquals(DescriptorTool.EXIT_INVALID_INPUT, run("derive-key"));
        assertEquals(DescriptorTool.EXIT_INVALID_INPUT, run("derive-key", XPUB_1, "--path"));
        assertEquals(DescriptorTool.EXIT_INVALID_INPUT, run("derive-key", XPUB_1, "--frobnicate"));
        assertEquals(DescriptorTool.EXIT_INVALID_INPUT, run("derive-key", XPUB_1, "--index", "1"));
        assertEquals(DescriptorTool.EXIT_INVALID_INPUT,
                run("script-expression", "raw(00)", "--verify-checksum", "--compute-checksum"));
        assertEquals(DescriptorTool.EXIT_INVALID_INPUT, run("derive-script", "raw(00)", "--index", "-1"));
        assertEquals(DescriptorTool.EXIT_INVALID_INPUT, run("derive-script", "raw(00)", "--index", "one"));
    }

    @Test
    public void deriveKey() {
        assertEquals(DescriptorTool.EXIT_OK, run("derive-key", XPUB_0H_1_2H, "--path", "2/1000000000"));
        assertEquals(XPUB_0H_1_2H_2_1000000000 + ":\n", out());

        assertEquals(DescriptorTool.EXIT_OK, run("derive-key", XPRV_0H_1_2H, "--path", "m/2/1000000000"));
        assertEquals(XPUB_0H_1_2H_2_1000000000 + ":" + XPRV_0H_1_2H_2_1000000000 + "\n", out());

        assertEquals(DescriptorTool.EXIT_OK, run("derive-key", XPRV_0H_1_2H));
        assertEquals(XPUB_0H_1_2H + ":" + XPRV_0H_1_2H + "\n", out());
    }

    @Test
    public void deriveKeyErrors() {
        assertEquals(DescriptorTool.EXIT_INVALID_DESCRIPTOR, run("derive-key", XPUB_2_0, "--path", "0h"));
        assertEquals("", out());
        assertEquals(DescriptorTool.EXIT_INVALID_INPUT, run("derive-key", XPUB_1, "--path", "0//1"));
        assertEquals(DescriptorTool.EXIT_INVALID_INPUT, run("derive-key", "xpub123"));
        assertEquals(DescriptorTool.EXIT_INVALID_INPUT, run("derive-key", XPUB_1, "--testnet"));
    }

    @Test
    public void keyExpression() {
        String expression = "[deadbeef/0h/1h]" + XPUB_1 + "/2/*";
        assertEquals(DescriptorTool.EXIT_OK, run("key-expression", expression));
        assertEquals(expression + "\n", out());
        assertEquals(DescriptorTool.EXIT_INVALID_INPUT, run("key-expression", "[deadbee/0h]" + XPUB_1));
        assertFalse(err().isEmpty());
    }

    @Test
    public void scriptExpression() {
        assertEquals(DescriptorTool.EXIT_OK, run("script-expression", "pkh(" + XPUB_1 + ")"));
        assertEquals("pkh(" + XPUB_1 + ")#vm4xc4ed\n", out());

        assertEquals(DescriptorTool.EXIT_OK, run("script-expression", "raw(deadbeef)#aaaaaaaa", "--compute-checksum"));
        assertEquals("raw(deadbeef)#89f8spxm\n", out());

        assertEquals(DescriptorTool.EXIT_OK, run("script-expression", "raw(deadbeef)#89f8spxm", "--verify-checksum"));
        assertEquals("OK\n", out());
        assertEquals(DescriptorTool.EXIT_INVALID_INPUT, run("script-expression", "raw(deadbeef)", "--verify-checksum"));
        assertEquals(DescriptorTool.EXIT_INVALID_INPUT, run("script-expression", "raw(deadbeef)#89f8spxn"));
    }

    @Test
    public void scriptExpressionErrors() {
        assertEquals(DescriptorTool.EXIT_INVALID_INPUT, run("script-expression", "pkh(" + XPUB_1));
        assertEquals(DescriptorTool.EXIT_INVALID_INPUT, run("script-expression", "foo(" + XPUB_1 + ")"));
        assertEquals(DescriptorTool.EXIT_INVALID_DESCRIPTOR, run("script-expression", "wpkh(0479be667ef9dcbbac55a06295ce870b07029bfcdb2dce28d959f2815b16f81798483ada7726a3c4655da4fbfc0e1108a8fd17b448a68554199c47d08ffb10d4b8)"));
        assertEquals(DescriptorTool.EXIT_INVALID_DESCRIPTOR, run("script-expression", "wsh(sh(pkh(" + XPUB_1 + ")))"));
    }

    @Test
    public void deriveScript() {
        assertEquals(DescriptorTool.EXIT_OK,
                run("derive-script", "sh(wpkh(L4rK1yDtCWekvXuE6oXD9jCYfFNV2cWRpVuPLBcCU2z8TrisoyY1))"));
        assertEquals("a91484ab21b1b2fd065d4504ff693d832434b6108d7b87 3DnW8JGpPViEZdpqat8qky1zc26EKbXnmM\n", out());

        assertEquals(DescriptorTool.EXIT_OK, run("derive-script", "raw(deadbeef)"));
        assertEquals("deadbeef\n", out());

        assertEquals(DescriptorTool.EXIT_OK, run("derive-script",
                "wsh(multi(1," + XPUB_2 + "/1/0/*," + XPUB_2_0 + "/0/0/*))", "--index", "1"));
        assertEquals("00200e869c7fb066dc4879de9560c4615b1f2402efd1852170bab9f14b7759b807f1 "
                + "bc1qp6rfclasvmwys7w7j4svgc2mrujq9m73s5shpw4e799hwkdcqlcsj464fw\n", out());

        assertEquals(DescriptorTool.EXIT_OK, run("derive-script", "wpkh(" + XPUB_1 + "/<0;1>/*)"));
        assertEquals("00140d1c9c02a7be9ba8b8842804feb961481ce6561b bc1qp5wfcq48h6d63wyy9qz0awtpfqwwv4sma86mhz\n"
                + "0014f09cb16010dc6d58dfafee3d3f9f027dc03be2c4 bc1q7zwtzcqsm3k43ha0ac7nl8cz0hqrhckywf6sew\n", out());

        assertEquals(DescriptorTool.EXIT_INVALID_DESCRIPTOR, run("derive-script", "pkh(" + XPUB_1 + "/0h)"));
    }

    @Test
    public void testnet() {
        String tpub = "tpubD6NzVbkrYhZ4XgiXtGrdW5XDAPFCL9h7we1vwNCpn8tGbBcgfVYjXyhWo4E1xkh56hjod1RhGjxbaTLV3X4FyWuejifB9jusQ46QzG87VKp";
        assertEquals(DescriptorTool.EXIT_OK, run("derive-script", "--testnet", "pkh(" + tpub + ")"));
        assertEquals("76a9143442193e1bb70916e914552172cd4e2dbc9df81188ac mkHGce7dctSxHgaWSSbmmrRWsZfzz7MxMk\n", out());
        assertEquals(DescriptorTool.EXIT_OK, run("derive-key", "--testnet", tpub));
        assertEquals(tpub + ":\n", out());
    }

    @Test
    public void standardInput() {
        String stdin = "raw(00)\n\nraw(deadbeef)\n";
        assertEquals(DescriptorTool.EXIT_OK, runWithStdin(stdin, "script-expression", "-"));
        assertEquals("raw(00)#qwfjgwf6\nraw(deadbeef)#89f8spxm\n", out());

        assertEquals(DescriptorTool.EXIT_INVALID_INPUT, runWithStdin("raw(00\nraw(deadbeef)\n", "derive-script", "-"));
        assertEquals("", out());
    }
}
