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

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A parsed and validated output script descriptor: the root {@link ScriptExpression} and the checksum it was
 * written with, if any. Documents are immutable; {@link #atIndex(int)} and {@link #expandMultipath()} return new
 * documents.
 *
 * <p>Two documents are equal when their trees are equal. The checksum only records how the input was written.</p>
 */
public final class DescriptorDocument {
    private final ScriptExpression root;
    @Nullable private final String checksum;

    DescriptorDocument(ScriptExpression root, @Nullable String checksum) {
        this.root = checkNotNull(root);
        this.checksum = checksum;
    }

    public ScriptExpression getRoot() {
        return root;
    }

    /** Returns the checksum given in the input, or null if the input had none. */
    @Nullable
    public String getChecksum() {
        return checksum;
    }

    /** True if any key ends in a wildcard, so that the descriptor stands for a range of scripts. */
    public boolean isRange() {
        for (KeyExpression key : root.getKeys()) {
            if (key.isRange())
                return true;
        }
        return false;
    }

    /** Returns the number of alternatives of the multipath steps, 1 if there are none. */
    public int getMultipathCount() {
        int count = 1;
        for (KeyExpression key : root.getKeys())
            count = Math.max(count, key.getMultipathCount());
        return count;
    }

    /**
     * Returns the document that results from replacing every wildcard by the given index. Documents that are not
     * ranged are returned unchanged.
     *
     * @throws IllegalArgumentException if the index is negative
     */
    public DescriptorDocument atIndex(int index) {
        checkArgument(index >= 0, "Index must not be negative: %s", index);
        if (!isRange())
            return this;
        return new DescriptorDocument(root.transformKeys(key -> key.atIndex(index)), null);
    }

    /**
     * Returns one document per multipath alternative, the i-th of which takes the i-th alternative of every
     * multipath step. A document without multipath steps expands to a list holding only itself.
     */
    public ImmutableList<DescriptorDocument> expandMultipath() {
        int count = getMultipathCount();
        if (count == 1)
            return ImmutableList.of(this);
        ImmutableList.Builder<DescriptorDocument> expanded = ImmutableList.builder();
        for (int i = 0; i < count; i++) {
            final int position = i;
            expanded.add(new DescriptorDocument(root.transformKeys(key -> key.selectMultipath(position)), null));
        }
        return expanded.build();
    }

    /** Returns the canonical text of the descriptor without checksum. */
    public String toStringWithoutChecksum() {
        return DescriptorSerializer.serialize(root);
    }

    /** Returns the canonical text of the descriptor followed by {@code #} and its checksum. */
    @Override
    public String toString() {
        return DescriptorSerializer.serializeWithChecksum(root);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return root.equals(((DescriptorDocument) o).root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }
}
