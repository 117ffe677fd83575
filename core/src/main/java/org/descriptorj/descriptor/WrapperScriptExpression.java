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

import java.util.Objects;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/** {@code sh(SCRIPT)} or {@code wsh(SCRIPT)}: pays to the hash of the inner script. */
public class WrapperScriptExpression extends ScriptExpression {
    private final ScriptExpression inner;

    public WrapperScriptExpression(Type type, ScriptExpression inner) {
        super(type);
        checkArgument(type == Type.SH || type == Type.WSH, "%s does not wrap a script", type);
        this.inner = checkNotNull(inner);
    }

    public ScriptExpression getInner() {
        return inner;
    }

    @Override
    public ImmutableList<KeyExpression> getKeys() {
        return inner.getKeys();
    }

    @Override
    public WrapperScriptExpression transformKeys(Function<KeyExpression, KeyExpression> transformation) {
        return new WrapperScriptExpression(type, inner.transformKeys(transformation));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WrapperScriptExpression other = (WrapperScriptExpression) o;
        return type == other.type && inner.equals(other.inner);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, inner);
    }
}
