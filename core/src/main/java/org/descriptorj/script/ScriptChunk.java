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

import org.descriptorj.core.Utils;

import javax.annotation.Nullable;
import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Objects;

import static org.descriptorj.script.ScriptOpCodes.OP_16;
import static org.descriptorj.script.ScriptOpCodes.OP_PUSHDATA1;
import static org.descriptorj.script.ScriptOpCodes.OP_PUSHDATA2;
import static org.descriptorj.script.ScriptOpCodes.OP_PUSHDATA4;

/**
 * A script element that is either a data push (signature, pubkey, etc) or a non-push (logic, numeric, etc) operation.
 */
public class ScriptChunk {
    /** Operation to be executed. Opcodes are defined in {@link ScriptOpCodes}. */
    public final int opcode;

    /**
     * For push operations, this is the vector to be pushed on the stack. For {@link ScriptOpCodes#OP_0}, the vector is
     * empty. Null for non-push operations.
     */
    @Nullable
    public final byte[] data;

    public ScriptChunk(int opcode, @Nullable byte[] data) {
        this.opcode = opcode;
        this.data = data;
    }

    public boolean equalsOpCode(int opcode) {
        return opcode == this.opcode;
    }

    /**
     * If this chunk is a single byte of non-pushdata content (could be OP_RESERVED or some invalid Opcode)
     */
    public boolean isOpCode() {
        return opcode > OP_PUSHDATA4;
    }

    /**
     * Returns true if this chunk is pushdata content, including the single-byte pushdatas.
     */
    public boolean isPushData() {
        return opcode <= OP_16;
    }

    void write(ByteArrayOutputStream stream) {
        if (isOpCode()) {
            if (data != null)
                throw new IllegalStateException("Data must be null for opcode chunk");
            stream.write(opcode);
        } else if (data != null) {
            if (opcode < OP_PUSHDATA1) {
                if (data.length != opcode)
                    throw new IllegalStateException("Data length must equal opcode value");
                stream.write(opcode);
            } else if (opcode == OP_PUSHDATA1) {
                if (data.length > 0xFF)
                    throw new IllegalStateException("Data length must be less than or equal to 256");
                stream.write(OP_PUSHDATA1);
                stream.write(data.length);
            } else if (opcode == OP_PUSHDATA2) {
                if (data.length > 0xFFFF)
                    throw new IllegalStateException("Data length must be less than or equal to 65536");
                stream.write(OP_PUSHDATA2);
                stream.write(data.length & 0xFF);
                stream.write((data.length >> 8) & 0xFF);
            } else {
                throw new IllegalStateException("Unsupported push opcode " + opcode);
            }
            stream.write(data, 0, data.length);
        } else {
            stream.write(opcode); // smallNum
        }
    }

    @Override
    public String toString() {
        if (data == null || data.length == 0)
            return ScriptOpCodes.getOpCodeName(opcode);
        return "PUSHDATA(" + data.length + ")[" + Utils.HEX.encode(data) + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScriptChunk other = (ScriptChunk) o;
        return opcode == other.opcode && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(opcode, Arrays.hashCode(data));
    }
}
