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

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * {@code multi(k,KEY_1,...,KEY_n)} or {@code sortedmulti(k,KEY_1,...,KEY_n)}. The bounds on k and n are checked by
 * {@link DescriptorValidator}, so an instance may hold any threshold.
 */
public class MultisigScriptExpression extends ScriptExpression {
    private final int threshold;
    private final ImmutableList<KeyExpression> keys;

    public MultisigScriptExpression(Type type, int threshold, List<KeyExpression> keys) {
        super(type);
        checkArgument(type == Type.MULTI || type == Type.SORTED_MULTI, "%s is not a multisig function", type);
        this.threshold = threshold;
        this.keys = ImmutableList.copyOf(keys);
    }

    public int getThreshold() {
        return threshold;
    }

    /** True for {@code sortedmulti}, whose keys are put in lexicographic order of their serialization. */
    public boolean isSorted() {
        return type == Type.SORTED_MULTI;
    }

    @Override
    public ImmutableList<KeyExpression> getKeys() {
        return keys;
    }

    @Override
    public MultisigScriptExpression transformKeys(Function<KeyExpression, KeyExpression> transformation) {
        ImmutableList.Builder<KeyExpression> transformed = ImmutableList.builder();
        for (KeyExpression key : keys)
            transformed.add(transformation.apply(key));
        return new MultisigScriptExpression(type, threshold, transformed.build());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MultisigScriptExpression other = (MultisigScriptExpression) o;
        return type == other.type && threshold == other.threshold && keys.equals(other.keys);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, threshold, keys);
    }
}
