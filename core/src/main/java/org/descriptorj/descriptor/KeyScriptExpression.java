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

import java.util.EnumSet;
import java.util.Objects;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/** {@code pk(KEY)}, {@code pkh(KEY)}, {@code wpkh(KEY)} or {@code combo(KEY)}. */
public class KeyScriptExpression extends ScriptExpression {
    private static final EnumSet<Type> KEY_TYPES = EnumSet.of(Type.PK, Type.PKH, Type.WPKH, Type.COMBO);

    private final KeyExpression key;

    public KeyScriptExpression(Type type, KeyExpression key) {
        super(type);
        checkArgument(KEY_TYPES.contains(type), "%s does not take a single key", type);
        this.key = checkNotNull(key);
    }

    public KeyExpression getKey() {
        return key;
    }

    @Override
    public ImmutableList<KeyExpression> getKeys() {
        return ImmutableList.of(key);
    }

    @Override
    public KeyScriptExpression transformKeys(Function<KeyExpression, KeyExpression> transformation) {
        return new KeyScriptExpression(type, transformation.apply(key));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        KeyScriptExpression other = (KeyScriptExpression) o;
        return type == other.type && key.equals(other.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, key);
    }
}
