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

import javax.annotation.Nullable;

/**
 * Thrown when the text of a descriptor does not follow the grammar.
 */
public class DescriptorSyntaxException extends DescriptorException {

    public enum Kind {
        UNEXPECTED_TOKEN,
        UNBALANCED_PARENTHESES,
        UNKNOWN_FUNCTION,
        NESTING_TOO_DEEP,
        INVALID_CHARACTER,
        INVALID_PATH_STEP
    }

    private final Kind kind;
    @Nullable private final String expected;

    public DescriptorSyntaxException(Kind kind, String message, int offset) {
        this(kind, message, offset, null);
    }

    public DescriptorSyntaxException(Kind kind, String message, int offset, @Nullable String expected) {
        super(message, offset);
        this.kind = kind;
        this.expected = expected;
    }

    public Kind getKind() {
        return kind;
    }

    /** Describes what the parser was looking for at the offset, or null if nothing in particular. */
    @Nullable
    public String getExpected() {
        return expected;
    }
}
