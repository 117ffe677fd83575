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

import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.function.Function;

/** {@code raw(HEX)}: a script given by its bytes. */
public class RawScriptExpression extends ScriptExpression {
    private final byte[] program;

    public RawScriptExpression(byte[] program) {
        super(Type.RAW);
        this.program = Arrays.copyOf(program, program.length);
    }

    public byte[] getProgram() {
        return Arrays.copyOf(program, program.length);
    }

    @Override
    public ImmutableList<KeyExpression> getKeys() {
        return ImmutableList.of();
    }

    @Override
    public RawScriptExpression transformKeys(Function<KeyExpression, KeyExpression> transformation) {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(program, ((RawScriptExpression) o).program);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(program);
    }
}
